package org.springaicommunity.content.checker;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * {@link CheckInvoker} that reads the file, signs in and submits the check through the
 * {@link PlatformClient}, retrying transient failures with the {@link RetryExecutor}.
 * Submission and result polling are retried separately, so a failed poll never submits
 * the document a second time.
 *
 * <p>
 * Holds only read-only collaborators, so one instance serves all concurrent checks.
 */
public class PlatformCheckInvoker implements CheckInvoker {

	private static final Logger logger = LoggerFactory.getLogger(PlatformCheckInvoker.class);

	private final PlatformClient platformClient;

	private final RetryExecutor retryExecutor;

	private final String apiToken;

	private final String username;

	private final RetryPolicy remotePolicy;

	private final RetryPolicy filePolicy;

	private final long maxFileSizeBytes;

	public PlatformCheckInvoker(PlatformClient platformClient, RetryExecutor retryExecutor, String apiToken,
			String username, RetryPolicy remotePolicy, RetryPolicy filePolicy, long maxFileSizeBytes) {
		this.platformClient = platformClient;
		this.retryExecutor = retryExecutor;
		this.apiToken = apiToken;
		this.username = username;
		this.remotePolicy = remotePolicy;
		this.filePolicy = filePolicy;
		this.maxFileSizeBytes = maxFileSizeBytes;
	}

	@Override
	public Optional<String> check(Path filePath, @Nullable String batchId, CheckMode checkMode,
			CancellationSignal signal) {
		String path = filePath.toString();

		if (!Files.isRegularFile(filePath) || !Files.isReadable(filePath)) {
			logger.warn("File not found or not readable: {}", path);
			return Optional.empty();
		}

		try {
			String content = retryExecutor.execute(() -> readContent(filePath), "readFile", path, filePolicy, signal);
			logger.debug("Read {} ({} characters)", path, content.length());

			String accessToken = retryExecutor.execute(() -> platformClient.signIn(apiToken, username), "signIn",
					path, remotePolicy, signal);

			CheckRequest request = new CheckRequest(path, batchId, checkMode, content);
			logger.info("Sending check request for {} (batch id: {}, mode: {})", path, request.effectiveBatchId(),
					checkMode);
			String resultLink = retryExecutor.execute(() -> platformClient.submitCheck(accessToken, request),
					"submitCheck", path, remotePolicy, signal);
			CheckResult result = retryExecutor.execute(
					() -> platformClient.pollResult(accessToken, resultLink, signal), "pollResult", path, remotePolicy,
					signal);

			logger.info("Check {} completed for {}: score {} ({})", result.id(), path, result.qualityScore(),
					result.qualityStatus());
			Optional<String> link = selectLink(result, checkMode);
			if (link.isEmpty()) {
				logger.warn("Check {} for {} returned no usable report link", result.id(), path);
			}
			return link;
		}
		catch (CheckCancelledException e) {
			throw e;
		}
		catch (ContentCheckException e) {
			logger.warn("Check failed for {} ({}): {}", path, e.getErrorKind(), e.getMessage());
			return Optional.empty();
		}
		catch (RuntimeException e) {
			logger.error("Unexpected error while checking {}", path, e);
			return Optional.empty();
		}
	}

	/**
	 * Picks the link to surface for a finished check: the content analysis dashboard for
	 * batch checks when present, otherwise the scorecard.
	 * @param result finished check
	 * @param checkMode mode the check ran in
	 * @return selected link, or empty
	 */
	public static Optional<String> selectLink(CheckResult result, CheckMode checkMode) {
		if (checkMode == CheckMode.BATCH) {
			Optional<String> dashboard = result.reportLink(CheckResult.CONTENT_ANALYSIS_DASHBOARD);
			if (dashboard.isPresent()) {
				return dashboard;
			}
		}
		return result.reportLink(CheckResult.SCORECARD);
	}

	private String readContent(Path filePath) {
		String path = filePath.toString();
		try {
			long size = Files.size(filePath);
			if (size > maxFileSizeBytes) {
				throw new ContentCheckException(ErrorKind.FILE_TOO_LARGE,
						"File is " + size + " bytes, limit is " + maxFileSizeBytes, path);
			}
			return new String(Files.readAllBytes(filePath), StandardCharsets.UTF_8);
		}
		catch (NoSuchFileException | AccessDeniedException e) {
			throw new ContentCheckException(ErrorKind.FILE_NOT_READABLE, "Cannot read file: " + e.getMessage(), path,
					e);
		}
		catch (IOException e) {
			throw new ContentCheckException(ErrorKind.FILE_BUSY, "Reading file failed: " + e.getMessage(), path, e);
		}
	}

}
