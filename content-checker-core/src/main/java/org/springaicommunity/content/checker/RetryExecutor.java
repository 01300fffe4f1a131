package org.springaicommunity.content.checker;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;
import java.util.function.DoubleSupplier;

/**
 * Runs an operation with bounded retries and exponential backoff plus jitter.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Retries only failures whose {@link ErrorKind} is transient (timeouts, connection
 * failures, 429, 5xx)</li>
 * <li>Non-transient failures are rethrown after the first attempt</li>
 * <li>Backoff waits go through the shared {@link CancellationSignal} and end early when
 * it fires</li>
 * <li>Each scheduled retry is published as a {@link RetryAttempt} to an optional
 * listener</li>
 * </ul>
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * RetryExecutor executor = RetryExecutor.builder().build();
 * String token = executor.execute(() -> client.signIn(apiToken, username), "signIn", filePath,
 *     RetryPolicy.remoteCall(), signal);
 * }
 * </pre>
 */
public final class RetryExecutor {

	private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

	private final DoubleSupplier jitterSource;

	private final Consumer<RetryAttempt> retryListener;

	private RetryExecutor(Builder builder) {
		this.jitterSource = builder.jitterSource;
		this.retryListener = builder.retryListener;
	}

	/**
	 * Create a new builder for RetryExecutor.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Execute an operation, retrying transient failures according to the policy.
	 * @param operation the operation to run
	 * @param operationName name used in log messages
	 * @param context additional context for log messages, typically the file path
	 * @param policy retry limits and backoff
	 * @param signal shared cancellation signal
	 * @param <T> result type
	 * @return the operation's result
	 * @throws ContentCheckException the last failure when it is non-transient or retries
	 * are exhausted, or {@link CheckCancelledException} when the signal fires
	 */
	public <T> T execute(RetryableOperation<T> operation, String operationName, @Nullable String context,
			RetryPolicy policy, CancellationSignal signal) {
		int maxRetries = policy.maxRetries();

		for (int attempt = 0;; attempt++) {
			signal.throwIfCancelled(operationName);
			try {
				if (attempt > 0) {
					logger.info("Retrying {} (attempt {}/{}). Context: {}", operationName, attempt, maxRetries,
							context);
				}
				else {
					logger.debug("Running {}. Context: {}", operationName, context);
				}
				T result = operation.run();
				if (attempt > 0) {
					logger.info("Successfully completed {} after {} retries. Context: {}", operationName, attempt,
							context);
				}
				else {
					logger.debug("Completed {} on the first attempt. Context: {}", operationName, context);
				}
				return result;
			}
			catch (CheckCancelledException e) {
				throw e;
			}
			catch (RuntimeException e) {
				ErrorKind kind = classify(e);

				if (!kind.isTransient()) {
					logger.error("Non-transient error ({}) in {}. Context: {}: {}", kind, operationName, context,
							e.getMessage());
					throw e;
				}
				if (attempt >= maxRetries) {
					logger.error("Maximum retries ({}) exceeded for {}. Context: {}: {}", maxRetries, operationName,
							context, e.getMessage());
					throw e;
				}

				Duration delay = policy.delayFor(attempt, jitterSource.getAsDouble());
				logger.warn("Transient error ({}) in {} (attempt {}/{}). Retrying in {}ms. Context: {}: {}", kind,
						operationName, attempt, maxRetries, delay.toMillis(), context, e.getMessage());
				retryListener.accept(new RetryAttempt(attempt, kind, delay));
				signal.await(delay);
			}
		}
	}

	/**
	 * Returns the error kind of a failure. Exceptions that do not carry a kind are
	 * treated as {@link ErrorKind#UNKNOWN} and therefore not retried.
	 * @param failure the failure
	 * @return error kind
	 */
	public static ErrorKind classify(RuntimeException failure) {
		if (failure instanceof ContentCheckException checkException) {
			return checkException.getErrorKind();
		}
		return ErrorKind.UNKNOWN;
	}

	/**
	 * An operation that can be retried.
	 *
	 * @param <T> result type
	 */
	@FunctionalInterface
	public interface RetryableOperation<T> {

		T run();

	}

	/**
	 * Builder for {@link RetryExecutor}.
	 *
	 * <p>
	 * Defaults: jitter drawn from {@link ThreadLocalRandom}, no retry listener.
	 */
	public static class Builder {

		private DoubleSupplier jitterSource = () -> ThreadLocalRandom.current().nextDouble();

		private Consumer<RetryAttempt> retryListener = attempt -> {
		};

		private Builder() {
		}

		/**
		 * Set the source of jitter samples in [0, 1).
		 * @param jitterSource jitter source
		 * @return this builder
		 */
		public Builder jitterSource(DoubleSupplier jitterSource) {
			this.jitterSource = jitterSource;
			return this;
		}

		/**
		 * Set a listener notified before each backoff wait.
		 * @param retryListener listener
		 * @return this builder
		 */
		public Builder retryListener(Consumer<RetryAttempt> retryListener) {
			this.retryListener = retryListener;
			return this;
		}

		public RetryExecutor build() {
			return new RetryExecutor(this);
		}

	}

}
