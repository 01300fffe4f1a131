package org.springaicommunity.content.checker;

import org.jspecify.annotations.Nullable;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Run mode: "batch" or "watch"
	public String mode = "batch";

	// null = generate one
	public @Nullable String batchId = null;

	// null = ACROLINX_CONTENT_DIR
	public @Nullable String contentDirectory = null;

	// Throttling
	public int maxConcurrency;

	public long pacingDelayMillis;

	// Flags
	public boolean recursive;

	public boolean openBrowser;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(CheckerProperties defaultProperties) {
		this.maxConcurrency = defaultProperties.getMaxConcurrency();
		this.pacingDelayMillis = defaultProperties.getPacingDelayMillis();
		this.recursive = defaultProperties.isRecursive();
		this.openBrowser = defaultProperties.isOpenBrowser();
	}

	public boolean isWatchMode() {
		return "watch".equals(mode);
	}

	/**
	 * Copy the command-line overrides onto a properties instance.
	 * @param properties properties to update
	 * @return the same properties instance
	 */
	public CheckerProperties applyTo(CheckerProperties properties) {
		properties.setMaxConcurrency(maxConcurrency);
		properties.setPacingDelayMillis(pacingDelayMillis);
		properties.setRecursive(recursive);
		properties.setOpenBrowser(openBrowser);
		return properties;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "mode='" + mode + '\'' + ", batchId='" + batchId + '\''
				+ ", contentDirectory='" + contentDirectory + '\'' + ", maxConcurrency=" + maxConcurrency
				+ ", pacingDelayMillis=" + pacingDelayMillis + ", recursive=" + recursive + ", openBrowser="
				+ openBrowser + ", verbose=" + verbose + ", helpRequested=" + helpRequested + '}';
	}

}
