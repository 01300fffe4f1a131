package org.springaicommunity.content.checker;

import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * Tally of a finished batch run.
 *
 * @param batchId the batch id
 * @param successCount outcomes that produced a link
 * @param failureCount outcomes that did not
 * @param representativeLink first non-blank link in input order, or null
 */
public record BatchSummary(String batchId, int successCount, int failureCount, @Nullable String representativeLink) {

	public int totalCount() {
		return successCount + failureCount;
	}

	public boolean hasFailures() {
		return failureCount > 0;
	}

	public Optional<String> representativeLinkOptional() {
		return Optional.ofNullable(representativeLink);
	}

}
