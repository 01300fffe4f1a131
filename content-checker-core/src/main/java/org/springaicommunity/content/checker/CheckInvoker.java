package org.springaicommunity.content.checker;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Checks a single file against the platform.
 *
 * <p>
 * Implementations never throw for item-level problems: a missing file, a rejected
 * request or exhausted retries all produce an empty result. Only cancellation
 * propagates, as {@link CheckCancelledException}.
 */
@FunctionalInterface
public interface CheckInvoker {

	/**
	 * Check one file.
	 * @param filePath file to check
	 * @param batchId batch id, used only in {@link CheckMode#BATCH}
	 * @param checkMode batch or automated
	 * @param signal shared cancellation signal
	 * @return report link, or empty if the check produced none
	 */
	Optional<String> check(Path filePath, @Nullable String batchId, CheckMode checkMode, CancellationSignal signal);

}
