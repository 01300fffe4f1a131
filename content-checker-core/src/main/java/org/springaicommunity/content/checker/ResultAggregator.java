package org.springaicommunity.content.checker;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Reduces the outcomes of a batch to a {@link BatchSummary}.
 */
public final class ResultAggregator {

	private ResultAggregator() {
	}

	/**
	 * Count successes and failures and pick the representative link, which is the first
	 * non-blank link of a successful outcome in input order.
	 * @param batchId batch id of the run
	 * @param outcomes outcomes in input order
	 * @return summary
	 */
	public static BatchSummary summarize(String batchId, List<CheckOutcome> outcomes) {
		int successCount = 0;
		int failureCount = 0;
		@Nullable
		String representativeLink = null;

		for (CheckOutcome outcome : outcomes) {
			if (outcome.succeeded()) {
				successCount++;
				String link = outcome.resultLink();
				if (representativeLink == null && link != null && !link.isBlank()) {
					representativeLink = link;
				}
			}
			else {
				failureCount++;
			}
		}

		return new BatchSummary(batchId, successCount, failureCount, representativeLink);
	}

}
