package org.springaicommunity.content.checker;

import java.time.Duration;

/**
 * Retry limits and backoff parameters for {@link RetryExecutor}.
 *
 * @param maxRetries retries after the first attempt (total attempts = maxRetries + 1)
 * @param baseDelay delay before the first retry
 * @param maxDelay upper bound for any single delay, jitter included
 * @param backoffMultiplier growth factor per attempt
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, double backoffMultiplier) {

	/** Upper bound of the random jitter as a fraction of the computed delay. */
	public static final double JITTER_FRACTION = 0.1;

	public RetryPolicy {
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries must be non-negative");
		}
		if (baseDelay.isNegative() || baseDelay.isZero()) {
			throw new IllegalArgumentException("baseDelay must be positive");
		}
		if (maxDelay.compareTo(baseDelay) < 0) {
			throw new IllegalArgumentException("maxDelay must not be smaller than baseDelay");
		}
		if (backoffMultiplier < 1.0) {
			throw new IllegalArgumentException("backoffMultiplier must be at least 1.0");
		}
	}

	/**
	 * Policy for calls to the remote platform: 3 retries, 1s base, 30s cap, x2.
	 * @return remote call policy
	 */
	public static RetryPolicy remoteCall() {
		return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0);
	}

	/**
	 * Policy for local file operations: 2 retries, 500ms base, 5s cap, x1.5.
	 * @return file operation policy
	 */
	public static RetryPolicy fileOperation() {
		return new RetryPolicy(2, Duration.ofMillis(500), Duration.ofSeconds(5), 1.5);
	}

	/**
	 * Exponential delay for the given attempt, capped at {@link #maxDelay()}, without
	 * jitter.
	 * @param attempt 0-based attempt number that just failed
	 * @return capped delay in milliseconds
	 */
	public long cappedDelayMillis(int attempt) {
		double raw = baseDelay.toMillis() * Math.pow(backoffMultiplier, attempt);
		return (long) Math.min(maxDelay.toMillis(), raw);
	}

	/**
	 * Delay before retrying after the given attempt. Jitter is added to the capped delay
	 * and the sum is capped again, so {@link #maxDelay()} is never exceeded.
	 * @param attempt 0-based attempt number that just failed
	 * @param jitterSample random sample in [0, 1)
	 * @return delay before the next attempt
	 */
	public Duration delayFor(int attempt, double jitterSample) {
		long capped = cappedDelayMillis(attempt);
		long jitter = (long) (capped * JITTER_FRACTION * jitterSample);
		return Duration.ofMillis(Math.min(maxDelay.toMillis(), capped + jitter));
	}

}
