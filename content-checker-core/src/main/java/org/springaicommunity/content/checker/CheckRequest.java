package org.springaicommunity.content.checker;

import org.jspecify.annotations.Nullable;

/**
 * A single check submission, built per file at invocation time.
 *
 * @param filePath path of the checked file, used as the document reference
 * @param batchId batch the check belongs to; only sent for {@link CheckMode#BATCH}
 * @param checkMode batch or automated check
 * @param content full file content
 */
public record CheckRequest(String filePath, @Nullable String batchId, CheckMode checkMode, String content) {

	/**
	 * Returns the batch id to send to the platform, which is {@code null} unless this is
	 * a batch check.
	 * @return effective batch id, or null
	 */
	public @Nullable String effectiveBatchId() {
		return checkMode == CheckMode.BATCH ? batchId : null;
	}

}
