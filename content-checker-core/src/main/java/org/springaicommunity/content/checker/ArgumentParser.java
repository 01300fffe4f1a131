package org.springaicommunity.content.checker;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the content checker. Pure Java with no framework
 * dependencies.
 */
public class ArgumentParser {

	private static final int MAX_CONCURRENCY_LIMIT = 16;

	private final CheckerProperties defaultProperties;

	public ArgumentParser(CheckerProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-m", "--mode":
					String mode = getRequiredValue(args, i, "mode").toLowerCase();
					if (!List.of("batch", "watch").contains(mode)) {
						throw new IllegalArgumentException("Invalid mode '" + mode + "': must be 'batch' or 'watch'");
					}
					config.mode = mode;
					i++;
					break;

				case "-b", "--batch-id":
					config.batchId = getRequiredValue(args, i, "batch-id");
					i++;
					break;

				case "-d", "--dir":
					config.contentDirectory = getRequiredValue(args, i, "dir");
					i++;
					break;

				case "-c", "--concurrency":
					String concurrencyStr = getRequiredValue(args, i, "concurrency");
					try {
						config.maxConcurrency = Integer.parseInt(concurrencyStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid concurrency '" + concurrencyStr + "': must be a positive integer");
					}
					i++;
					break;

				case "--pacing-ms":
					String pacingStr = getRequiredValue(args, i, "pacing-ms");
					try {
						config.pacingDelayMillis = Long.parseLong(pacingStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid pacing delay '" + pacingStr + "': must be a non-negative integer");
					}
					i++;
					break;

				case "--no-recursive":
					config.recursive = false;
					break;

				case "--no-browser":
					config.openBrowser = false;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: content-checker [OPTIONS]\n");
		help.append("\n");
		help.append("Check content files against the Acrolinx platform, as one batch or on every change.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -m, --mode MODE         Run mode: batch, watch (default: batch)\n");
		help.append("    -b, --batch-id ID       Batch id for batch mode (default: batch-yyyyMMdd-HHmmss, UTC)\n");
		help.append("    -d, --dir DIR           Content directory (default: $ACROLINX_CONTENT_DIR)\n");
		help.append("    -c, --concurrency N     Maximum concurrent checks (default: ")
			.append(defaultProperties.getMaxConcurrency())
			.append(")\n");
		help.append("    --pacing-ms MS          Delay after each check before the next starts (default: ")
			.append(defaultProperties.getPacingDelayMillis())
			.append(")\n");
		help.append("    --no-recursive          Only check files directly inside the content directory\n");
		help.append("    --no-browser            Do not open report links in the browser\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    ACROLINX_URL               Platform URL, e.g. https://yourcompany.acrolinx.cloud\n");
		help.append("    ACROLINX_SSO_TOKEN         Single sign-on token\n");
		help.append("    ACROLINX_USERNAME          Platform user name\n");
		help.append("    ACROLINX_CLIENT_SIGNATURE  Client signature\n");
		help.append("    ACROLINX_CONTENT_DIR       Directory with the content files\n");
		help.append("    Values are also read from a .env file in the working or home directory.\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0  all files checked successfully\n");
		help.append("    1  configuration or argument error\n");
		help.append("    2  batch finished with failed files\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    # Check the configured directory as one batch\n");
		help.append("    content-checker --batch-id release-42\n");
		help.append("\n");
		help.append("    # Check files as they change, without opening a browser\n");
		help.append("    content-checker --mode watch --no-browser\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.maxConcurrency <= 0) {
			errors.add("Concurrency must be positive (got: " + config.maxConcurrency + ")");
		}
		else if (config.maxConcurrency > MAX_CONCURRENCY_LIMIT) {
			errors.add("Concurrency too large (got: " + config.maxConcurrency + ", max: " + MAX_CONCURRENCY_LIMIT
					+ ")");
		}

		if (config.pacingDelayMillis < 0) {
			errors.add("Pacing delay must not be negative (got: " + config.pacingDelayMillis + ")");
		}

		if (config.batchId != null) {
			if (config.batchId.isBlank()) {
				errors.add("Batch id cannot be empty");
			}
			else if (config.isWatchMode()) {
				errors.add("Batch id is only used in batch mode");
			}
		}

		if (config.contentDirectory != null && config.contentDirectory.isBlank()) {
			errors.add("Content directory cannot be empty");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
