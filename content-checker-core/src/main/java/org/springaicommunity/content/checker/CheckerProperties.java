package org.springaicommunity.content.checker;

import java.time.Duration;

/**
 * Tunable settings for checking runs.
 *
 * <p>
 * All properties have defaults suitable for a shared platform instance. Properties can
 * be set directly via setters or overridden from the command line, then passed to
 * {@link ContentCheckerBuilder}.
 */
public class CheckerProperties {

	/**
	 * Maximum number of checks in flight at once.
	 */
	private int maxConcurrency = 2;

	/**
	 * Delay in milliseconds after each check before its slot is released.
	 */
	private long pacingDelayMillis = 500;

	/**
	 * Files larger than this are not submitted (default: 10MB).
	 */
	private long maxFileSizeBytes = 10L * 1024 * 1024;

	/**
	 * Maximum number of retries for failed platform calls.
	 */
	private int maxRetries = 3;

	/**
	 * Initial backoff delay in milliseconds for platform calls.
	 */
	private long retryBaseDelayMillis = 1000;

	/**
	 * Upper bound in milliseconds for a single backoff delay.
	 */
	private long retryMaxDelayMillis = 30000;

	/**
	 * Growth factor of the backoff delay per attempt.
	 */
	private double retryBackoffMultiplier = 2.0;

	/**
	 * Include files in sub-directories of the content directory.
	 */
	private boolean recursive = true;

	/**
	 * Open the resulting report link in the default browser.
	 */
	private boolean openBrowser = true;

	/**
	 * Returns the maximum number of concurrent checks.
	 * @return the concurrency limit
	 */
	public int getMaxConcurrency() {
		return maxConcurrency;
	}

	/**
	 * Sets the maximum number of concurrent checks.
	 * @param maxConcurrency the concurrency limit
	 */
	public void setMaxConcurrency(int maxConcurrency) {
		this.maxConcurrency = maxConcurrency;
	}

	public long getPacingDelayMillis() {
		return pacingDelayMillis;
	}

	public void setPacingDelayMillis(long pacingDelayMillis) {
		this.pacingDelayMillis = pacingDelayMillis;
	}

	/**
	 * Returns the largest file size that is still submitted.
	 * @return the size limit in bytes
	 */
	public long getMaxFileSizeBytes() {
		return maxFileSizeBytes;
	}

	/**
	 * Sets the largest file size that is still submitted.
	 * @param maxFileSizeBytes the size limit in bytes
	 */
	public void setMaxFileSizeBytes(long maxFileSizeBytes) {
		this.maxFileSizeBytes = maxFileSizeBytes;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public long getRetryBaseDelayMillis() {
		return retryBaseDelayMillis;
	}

	public void setRetryBaseDelayMillis(long retryBaseDelayMillis) {
		this.retryBaseDelayMillis = retryBaseDelayMillis;
	}

	public long getRetryMaxDelayMillis() {
		return retryMaxDelayMillis;
	}

	public void setRetryMaxDelayMillis(long retryMaxDelayMillis) {
		this.retryMaxDelayMillis = retryMaxDelayMillis;
	}

	public double getRetryBackoffMultiplier() {
		return retryBackoffMultiplier;
	}

	public void setRetryBackoffMultiplier(double retryBackoffMultiplier) {
		this.retryBackoffMultiplier = retryBackoffMultiplier;
	}

	/**
	 * Returns whether sub-directories are scanned.
	 * @return true for a recursive scan
	 */
	public boolean isRecursive() {
		return recursive;
	}

	/**
	 * Sets whether sub-directories are scanned.
	 * @param recursive true for a recursive scan
	 */
	public void setRecursive(boolean recursive) {
		this.recursive = recursive;
	}

	public boolean isOpenBrowser() {
		return openBrowser;
	}

	public void setOpenBrowser(boolean openBrowser) {
		this.openBrowser = openBrowser;
	}

	/**
	 * Builds the retry policy for platform calls from the retry settings.
	 * @return remote call policy
	 */
	public RetryPolicy remoteRetryPolicy() {
		return new RetryPolicy(maxRetries, Duration.ofMillis(retryBaseDelayMillis),
				Duration.ofMillis(retryMaxDelayMillis), retryBackoffMultiplier);
	}

}
