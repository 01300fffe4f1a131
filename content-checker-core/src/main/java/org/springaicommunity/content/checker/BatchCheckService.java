package org.springaicommunity.content.checker;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs one batch check over the configured content directory.
 *
 * <p>
 * Validates the configuration, resolves the batch id, discovers the supported files,
 * dispatches them through the {@link ThrottledBatchDispatcher}, logs a line per file and
 * the summary, and opens the representative link.
 */
public class BatchCheckService {

	private static final Logger logger = LoggerFactory.getLogger(BatchCheckService.class);

	private final ThrottledBatchDispatcher dispatcher;

	private final ContentFileScanner fileScanner;

	private final BatchIdGenerator batchIdGenerator;

	private final BrowserLauncher browserLauncher;

	private final CheckerProperties properties;

	public BatchCheckService(ThrottledBatchDispatcher dispatcher, ContentFileScanner fileScanner,
			BatchIdGenerator batchIdGenerator, BrowserLauncher browserLauncher, CheckerProperties properties) {
		this.dispatcher = dispatcher;
		this.fileScanner = fileScanner;
		this.batchIdGenerator = batchIdGenerator;
		this.browserLauncher = browserLauncher;
		this.properties = properties;
	}

	/**
	 * Check every supported file of the content directory as one batch.
	 * @param configuration loaded configuration, must be valid
	 * @param requestedBatchId batch id to use, or null to generate one
	 * @param signal shared cancellation signal
	 * @return summary of the run
	 * @throws ConfigurationException if the configuration is invalid
	 */
	public BatchSummary runBatch(CheckerConfiguration configuration, @Nullable String requestedBatchId,
			CancellationSignal signal) {
		configuration.validateOrThrow();
		Path contentDirectory = configuration.contentDirectory();
		if (contentDirectory == null) {
			throw new ConfigurationException(List.of("Content directory not configured"));
		}

		String batchId = resolveBatchId(requestedBatchId);

		List<Path> files = fileScanner.scan(contentDirectory, properties.isRecursive());
		logger.info("Found {} supported files in {}", files.size(), contentDirectory);
		if (files.isEmpty()) {
			logger.warn("No supported files found in {}", contentDirectory);
			return ResultAggregator.summarize(batchId, List.of());
		}
		for (Path file : files) {
			logger.debug("Adding file to batch check: {}", file);
		}

		List<CheckOutcome> outcomes = dispatcher.dispatchBatch(files, batchId, CheckMode.BATCH, signal);
		BatchSummary summary = ResultAggregator.summarize(batchId, outcomes);
		report(outcomes, summary);

		if (properties.isOpenBrowser()) {
			summary.representativeLinkOptional().ifPresent(browserLauncher::open);
		}
		return summary;
	}

	/**
	 * Returns the requested batch id, or a generated one when none was given.
	 * @param requestedBatchId batch id from the user, may be null or blank
	 * @return batch id to use
	 */
	public String resolveBatchId(@Nullable String requestedBatchId) {
		if (requestedBatchId == null || requestedBatchId.isBlank()) {
			String generated = batchIdGenerator.generate();
			logger.info("Using default Batch ID: {}", generated);
			return generated;
		}
		logger.info("Using provided Batch ID: {}", requestedBatchId.trim());
		return requestedBatchId.trim();
	}

	private void report(List<CheckOutcome> outcomes, BatchSummary summary) {
		logger.info("Check Results Summary:");
		for (CheckOutcome outcome : outcomes) {
			if (outcome.succeeded()) {
				logger.info("SUCCESS: {} - {}", outcome.filePath(), outcome.resultLink());
			}
			else {
				logger.warn("FAILED: {}", outcome.filePath());
			}
		}

		logger.info("Batch processing completed: {} successful, {} failed", summary.successCount(),
				summary.failureCount());
		logger.info("Batch Check Summary - Batch ID: {}", summary.batchId());
		if (summary.representativeLink() != null) {
			logger.info("Content Analysis Dashboard (Batch Report): {}", summary.representativeLink());
		}
		else {
			logger.warn("No Content Analysis Dashboard report was generated");
		}
	}

}
