package org.springaicommunity.content.checker.cli;

import ch.qos.logback.classic.Level;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.content.checker.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Content Checker CLI Application
 *
 * Plain Java command-line application that checks content files against the Acrolinx
 * platform, either as one batch over the content directory or continuously as files
 * change. Services are wired with ContentCheckerBuilder.
 *
 * Usage: java -jar content-checker-cli.jar [OPTIONS]
 *
 * Environment Variables: ACROLINX_URL, ACROLINX_SSO_TOKEN, ACROLINX_USERNAME,
 * ACROLINX_CLIENT_SIGNATURE, ACROLINX_CONTENT_DIR
 *
 * Examples: java -jar content-checker-cli.jar --batch-id release-42 java -jar
 * content-checker-cli.jar --mode watch --no-browser java -jar content-checker-cli.jar
 * --dir docs --concurrency 3 --verbose
 */
public class ContentCheckerCli {

	private static final Logger logger = LoggerFactory.getLogger(ContentCheckerCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_CONFIGURATION_ERROR = 1;

	static final int EXIT_BATCH_FAILURES = 2;

	static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

	public static void main(String[] args) {
		CancellationSignal signal = CancellationSignal.create();
		CountDownLatch finished = new CountDownLatch(1);
		Runtime.getRuntime().addShutdownHook(shutdownHook(signal, finished, SHUTDOWN_GRACE));

		int exitCode;
		try {
			exitCode = run(args, new ConfigurationLoader(), signal);
		}
		catch (Exception e) {
			logger.error("Content check failed: {}", e.getMessage());
			exitCode = EXIT_CONFIGURATION_ERROR;
		}
		finally {
			finished.countDown();
		}
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}

	/**
	 * Creates the shutdown hook that cancels running checks and then waits up to the
	 * grace period for the main run to log its results.
	 * @param signal signal shared with the run
	 * @param finished counted down when the main run returns
	 * @param grace longest time the JVM shutdown is held back
	 * @return unstarted hook thread
	 */
	static Thread shutdownHook(CancellationSignal signal, CountDownLatch finished, Duration grace) {
		return new Thread(() -> {
			if (finished.getCount() == 0) {
				return;
			}
			if (!signal.isCancelled()) {
				logger.info("Shutdown requested, cancelling running checks");
				signal.cancel();
			}
			try {
				if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
					logger.warn("Checks did not stop within {} seconds", grace.toSeconds());
				}
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}, "content-checker-shutdown");
	}

	static int run(String[] args, ConfigurationLoader configurationLoader, CancellationSignal signal) {
		CheckerProperties properties = new CheckerProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		try {
			ParsedConfiguration config = argumentParser.parseAndValidate(args);
			if (config.verbose) {
				enableVerboseLogging();
			}
			config.applyTo(properties);

			Path directoryOverride = config.contentDirectory != null ? Path.of(config.contentDirectory) : null;
			CheckerConfiguration configuration = configurationLoader.load(directoryOverride).validateOrThrow();

			logConfiguration(config, configuration);

			ContentCheckerBuilder builder = ContentCheckerBuilder.create()
				.configuration(configuration)
				.properties(properties);

			if (config.isWatchMode()) {
				return runWatch(builder, configuration, signal);
			}
			return runBatch(builder, configuration, config.batchId, signal);
		}
		catch (IllegalArgumentException e) {
			logger.error(e.getMessage());
			logger.error("Use --help for usage information");
			return EXIT_CONFIGURATION_ERROR;
		}
		catch (ConfigurationException e) {
			logger.error("Invalid configuration. Please check environment variables");
			for (String error : e.getValidationErrors()) {
				logger.error("  - {}", error);
			}
			return EXIT_CONFIGURATION_ERROR;
		}
	}

	private static int runBatch(ContentCheckerBuilder builder, CheckerConfiguration configuration,
			@Nullable String batchId, CancellationSignal signal) {
		BatchSummary summary = builder.buildBatchService().runBatch(configuration, batchId, signal);
		logResults(summary);

		if (signal.isCancelled()) {
			logger.warn("Batch {} was cancelled before all files were checked", summary.batchId());
			return EXIT_BATCH_FAILURES;
		}
		return summary.hasFailures() ? EXIT_BATCH_FAILURES : EXIT_OK;
	}

	private static int runWatch(ContentCheckerBuilder builder, CheckerConfiguration configuration,
			CancellationSignal signal) {
		Path directory = configuration.contentDirectory();
		if (directory == null) {
			throw new ConfigurationException(List.of("Content directory not configured"));
		}
		logger.info("Watching '{}' for file changes. Press Ctrl+C to quit.", directory);
		builder.buildWatchService().watch(directory, signal);
		return EXIT_OK;
	}

	private static void enableVerboseLogging() {
		Logger packageLogger = LoggerFactory.getLogger("org.springaicommunity.content.checker");
		if (packageLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config, CheckerConfiguration configuration) {
		logger.info("Configuration:");
		logger.info("  Mode: {}", config.mode);
		logger.info("  Platform URL: {}", configuration.remoteUrl());
		logger.info("  Username: {}", configuration.username());
		logger.info("  Content directory: {}", configuration.contentDirectory());
		logger.info("  Batch id: {}", config.batchId != null ? config.batchId : "(generated)");
		logger.info("  Max concurrency: {}", config.maxConcurrency);
		logger.info("  Pacing delay: {}ms", config.pacingDelayMillis);
		logger.info("  Recursive: {}", config.recursive);
		logger.info("  Open browser: {}", config.openBrowser);
	}

	private static void logResults(BatchSummary summary) {
		logger.info("Batch {} completed", summary.batchId());
		logger.info("Total files: {}", summary.totalCount());
		logger.info("Successful: {}", summary.successCount());
		logger.info("Failed: {}", summary.failureCount());
		logger.info("Report: {}", summary.representativeLinkOptional().orElse("(none)"));
	}

}
