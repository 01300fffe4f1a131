package org.springaicommunity.content.checker;

import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.Optional;

/**
 * Result of a finished check as returned by the platform.
 *
 * @param id platform check id
 * @param qualityScore overall quality score
 * @param qualityStatus quality status (e.g. "red", "yellow", "green")
 * @param reports report name to report link
 */
public record CheckResult(String id, double qualityScore, @Nullable String qualityStatus, Map<String, String> reports) {

	public static final String SCORECARD = "scorecard";

	public static final String CONTENT_ANALYSIS_DASHBOARD = "contentAnalysisDashboard";

	public CheckResult {
		reports = Map.copyOf(reports);
	}

	/**
	 * Looks up a report link by name.
	 * @param reportName report name
	 * @return the link, or empty if the report is absent or blank
	 */
	public Optional<String> reportLink(String reportName) {
		return Optional.ofNullable(reports.get(reportName)).filter(link -> !link.isBlank());
	}

}
