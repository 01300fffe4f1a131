package org.springaicommunity.content.checker;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link RetryExecutor}.
 *
 * Tests retry logic, backoff bookkeeping, error classification and cancellation.
 */
@DisplayName("RetryExecutor Tests")
class RetryExecutorTest {

	private static final RetryPolicy FAST_POLICY = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(10),
			2.0);

	private final List<RetryAttempt> attempts = new ArrayList<>();

	private RetryExecutor executor;

	private CancellationSignal signal;

	@BeforeEach
	void setUp() {
		attempts.clear();
		executor = RetryExecutor.builder().jitterSource(() -> 0.0).retryListener(attempts::add).build();
		signal = CancellationSignal.create();
	}

	private static ContentCheckException failure(ErrorKind kind) {
		return new ContentCheckException(kind, kind + " failure");
	}

	@Nested
	@DisplayName("Retry Behavior Tests")
	class RetryBehaviorTest {

		@Test
		@DisplayName("Should return result without retrying on success")
		void shouldReturnOnFirstSuccess() {
			AtomicInteger calls = new AtomicInteger();

			String result = executor.execute(() -> {
				calls.incrementAndGet();
				return "ok";
			}, "signIn", "a.md", FAST_POLICY, signal);

			assertThat(result).isEqualTo("ok");
			assertThat(calls).hasValue(1);
			assertThat(attempts).isEmpty();
		}

		@Test
		@DisplayName("Should retry transient failures until success")
		void shouldRetryTransientFailures() {
			AtomicInteger calls = new AtomicInteger();

			String result = executor.execute(() -> {
				if (calls.incrementAndGet() < 3) {
					throw failure(ErrorKind.SERVER_ERROR);
				}
				return "ok";
			}, "submitCheck", "a.md", FAST_POLICY, signal);

			assertThat(result).isEqualTo("ok");
			assertThat(calls).hasValue(3);
			assertThat(attempts).extracting(RetryAttempt::attemptNumber).containsExactly(0, 1);
			assertThat(attempts).extracting(RetryAttempt::lastError)
				.containsOnly(ErrorKind.SERVER_ERROR);
		}

		@Test
		@DisplayName("Should make maxRetries + 1 attempts and rethrow the last failure")
		void shouldStopAfterMaxRetries() {
			AtomicInteger calls = new AtomicInteger();
			ContentCheckException timeout = failure(ErrorKind.TIMEOUT);

			assertThatThrownBy(() -> executor.execute(() -> {
				calls.incrementAndGet();
				throw timeout;
			}, "submitCheck", "a.md", FAST_POLICY, signal)).isSameAs(timeout);

			assertThat(calls).hasValue(4);
			assertThat(attempts).hasSize(3);
		}

		@Test
		@DisplayName("Should make exactly one attempt when maxRetries is 0")
		void shouldNotRetryWithZeroRetries() {
			AtomicInteger calls = new AtomicInteger();
			RetryPolicy noRetries = new RetryPolicy(0, Duration.ofMillis(1), Duration.ofMillis(1), 1.0);

			assertThatThrownBy(() -> executor.execute(() -> {
				calls.incrementAndGet();
				throw failure(ErrorKind.RATE_LIMITED);
			}, "signIn", null, noRetries, signal)).isInstanceOf(ContentCheckException.class);

			assertThat(calls).hasValue(1);
		}

		@ParameterizedTest
		@EnumSource(value = ErrorKind.class, names = { "AUTHENTICATION", "CLIENT_ERROR", "INVALID_RESPONSE",
				"FILE_NOT_READABLE", "FILE_TOO_LARGE", "CHECK_EXPIRED", "UNKNOWN" })
		@DisplayName("Should NOT retry non-transient failures")
		void shouldNotRetryNonTransient(ErrorKind kind) {
			AtomicInteger calls = new AtomicInteger();

			assertThatThrownBy(() -> executor.execute(() -> {
				calls.incrementAndGet();
				throw failure(kind);
			}, "submitCheck", "a.md", FAST_POLICY, signal)).isInstanceOf(ContentCheckException.class);

			assertThat(calls).hasValue(1);
			assertThat(attempts).isEmpty();
		}

		@Test
		@DisplayName("Should treat exceptions without an error kind as non-transient")
		void shouldNotRetryUnclassifiedExceptions() {
			AtomicInteger calls = new AtomicInteger();

			assertThatThrownBy(() -> executor.execute(() -> {
				calls.incrementAndGet();
				throw new IllegalStateException("bug");
			}, "submitCheck", "a.md", FAST_POLICY, signal)).isInstanceOf(IllegalStateException.class);

			assertThat(calls).hasValue(1);
		}

		@Test
		@DisplayName("Should report exponential delays to the listener")
		void shouldReportBackoffDelays() {
			RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(2), Duration.ofMillis(5), 2.0);

			assertThatThrownBy(() -> executor.execute(() -> {
				throw failure(ErrorKind.CONNECTION);
			}, "signIn", null, policy, signal)).isInstanceOf(ContentCheckException.class);

			assertThat(attempts).extracting(RetryAttempt::nextDelay)
				.containsExactly(Duration.ofMillis(2), Duration.ofMillis(4), Duration.ofMillis(5));
		}

	}

	@Nested
	@DisplayName("Classification Tests")
	class ClassificationTest {

		@Test
		@DisplayName("Should read the kind carried by ContentCheckException")
		void shouldUseCarriedKind() {
			assertThat(RetryExecutor.classify(failure(ErrorKind.RATE_LIMITED))).isEqualTo(ErrorKind.RATE_LIMITED);
		}

		@Test
		@DisplayName("Should classify other exceptions as UNKNOWN")
		void shouldClassifyOthersAsUnknown() {
			assertThat(RetryExecutor.classify(new RuntimeException("x"))).isEqualTo(ErrorKind.UNKNOWN);
		}

	}

	@Nested
	@DisplayName("Cancellation Tests")
	class CancellationTest {

		@Test
		@DisplayName("Should not run the operation when already cancelled")
		void shouldNotRunWhenCancelled() {
			AtomicInteger calls = new AtomicInteger();
			signal.cancel();

			assertThatThrownBy(() -> executor.execute(() -> calls.incrementAndGet(), "signIn", null, FAST_POLICY,
					signal))
				.isInstanceOf(CheckCancelledException.class);

			assertThat(calls).hasValue(0);
		}

		@Test
		@DisplayName("Should end a long backoff wait promptly when cancelled")
		void shouldInterruptBackoffOnCancel() {
			RetryPolicy slowPolicy = new RetryPolicy(3, Duration.ofSeconds(30), Duration.ofSeconds(30), 2.0);
			RetryExecutor cancellingExecutor = RetryExecutor.builder()
				.jitterSource(() -> 0.0)
				.retryListener(attempt -> signal.cancel())
				.build();

			long start = System.nanoTime();
			assertThatThrownBy(() -> cancellingExecutor.execute(() -> {
				throw failure(ErrorKind.SERVER_ERROR);
			}, "submitCheck", "a.md", slowPolicy, signal)).isInstanceOf(CheckCancelledException.class);

			assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
		}

		@Test
		@DisplayName("Should propagate cancellation raised by the operation without retrying")
		void shouldPropagateCancellationFromOperation() {
			AtomicInteger calls = new AtomicInteger();

			assertThatThrownBy(() -> executor.execute(() -> {
				calls.incrementAndGet();
				throw new CheckCancelledException("stop");
			}, "submitCheck", "a.md", FAST_POLICY, signal)).isInstanceOf(CheckCancelledException.class);

			assertThat(calls).hasValue(1);
		}

	}

	@Nested
	@DisplayName("Logging Tests")
	class LoggingTest {

		private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

		private final Logger retryLogger = (Logger) LoggerFactory.getLogger(RetryExecutor.class);

		@BeforeEach
		void attachAppender() {
			appender.start();
			retryLogger.addAppender(appender);
		}

		@AfterEach
		void detachAppender() {
			retryLogger.detachAppender(appender);
			appender.stop();
		}

		@Test
		@DisplayName("Should log the first attempt and its success")
		void shouldLogFirstAttempt() {
			executor.execute(() -> "ok", "signIn", "a.md", FAST_POLICY, signal);

			assertThat(appender.list).extracting(ILoggingEvent::getLevel).containsExactly(Level.DEBUG, Level.DEBUG);
			assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage)
				.containsExactly("Running signIn. Context: a.md",
						"Completed signIn on the first attempt. Context: a.md");
		}

		@Test
		@DisplayName("Should log every retry and the final success")
		void shouldLogEveryAttempt() {
			AtomicInteger calls = new AtomicInteger();

			executor.execute(() -> {
				if (calls.incrementAndGet() < 2) {
					throw failure(ErrorKind.TIMEOUT);
				}
				return "ok";
			}, "submitCheck", "a.md", FAST_POLICY, signal);

			assertThat(appender.list).extracting(ILoggingEvent::getLevel)
				.containsExactly(Level.DEBUG, Level.WARN, Level.INFO, Level.INFO);
		}

	}

}
