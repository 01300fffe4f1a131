package org.springaicommunity.content.checker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the record types, the error classification and the cancellation signal.
 */
@DisplayName("DataModels Tests")
class DataModelsTest {

	@Nested
	@DisplayName("Check Request and Result")
	class RequestResultTest {

		@Test
		@DisplayName("Should only expose the batch id for batch checks")
		void shouldOnlySendBatchIdInBatchMode() {
			CheckRequest batch = new CheckRequest("a.md", "batch-1", CheckMode.BATCH, "text");
			CheckRequest automated = new CheckRequest("a.md", "batch-1", CheckMode.AUTOMATED, "text");

			assertThat(batch.effectiveBatchId()).isEqualTo("batch-1");
			assertThat(automated.effectiveBatchId()).isNull();
		}

		@Test
		@DisplayName("Should carry the platform wire values for check modes")
		void shouldExposeWireValues() {
			assertThat(CheckMode.BATCH.wireValue()).isEqualTo("batch");
			assertThat(CheckMode.AUTOMATED.wireValue()).isEqualTo("automated");
		}

		@Test
		@DisplayName("Should copy reports defensively and ignore blank links")
		void shouldCopyReports() {
			Map<String, String> reports = new HashMap<>();
			reports.put(CheckResult.SCORECARD, "https://host/scorecard");
			reports.put(CheckResult.CONTENT_ANALYSIS_DASHBOARD, " ");

			CheckResult result = new CheckResult("check-1", 87.5, "green", reports);
			reports.clear();

			assertThat(result.reportLink(CheckResult.SCORECARD)).contains("https://host/scorecard");
			assertThat(result.reportLink(CheckResult.CONTENT_ANALYSIS_DASHBOARD)).isEmpty();
			assertThat(result.reportLink("missing")).isEmpty();
		}

	}

	@Nested
	@DisplayName("Check Outcome")
	class OutcomeTest {

		@Test
		@DisplayName("Should derive success from the presence of a link")
		void shouldDeriveSuccessFromLink() {
			CheckOutcome success = CheckOutcome.of("a.md", Optional.of("https://host/a"));
			CheckOutcome failure = CheckOutcome.of("b.md", Optional.empty());

			assertThat(success.succeeded()).isTrue();
			assertThat(success.link()).contains("https://host/a");
			assertThat(failure.succeeded()).isFalse();
			assertThat(failure.link()).isEmpty();
		}

		@Test
		@DisplayName("Should reject a success without a link")
		void shouldRejectSuccessWithoutLink() {
			assertThatThrownBy(() -> new CheckOutcome("a.md", null, true))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("needs a result link");
			assertThatThrownBy(() -> CheckOutcome.success("a.md", " "))
				.isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> new CheckOutcome("a.md", "https://host/a", false))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("cannot carry a result link");
		}

	}

	@Nested
	@DisplayName("Error Kind")
	class ErrorKindTest {

		@ParameterizedTest
		@CsvSource({ "429, RATE_LIMITED", "500, SERVER_ERROR", "503, SERVER_ERROR", "401, AUTHENTICATION",
				"403, AUTHENTICATION", "400, CLIENT_ERROR", "404, CLIENT_ERROR", "302, UNKNOWN" })
		@DisplayName("Should map HTTP status codes to error kinds")
		void shouldMapStatusCodes(int statusCode, ErrorKind expected) {
			assertThat(ErrorKind.fromStatusCode(statusCode)).isEqualTo(expected);
		}

		@Test
		@DisplayName("Should mark only timeouts, connection, 429, 5xx and busy files as transient")
		void shouldFlagTransientKinds() {
			assertThat(ErrorKind.values()).filteredOn(ErrorKind::isTransient)
				.containsExactlyInAnyOrder(ErrorKind.TIMEOUT, ErrorKind.CONNECTION, ErrorKind.RATE_LIMITED,
						ErrorKind.SERVER_ERROR, ErrorKind.FILE_BUSY);
		}

		@Test
		@DisplayName("Should carry kind and file path on exceptions")
		void shouldCarryKindOnException() {
			ContentCheckException exception = new ContentCheckException(ErrorKind.FILE_TOO_LARGE, "too big", "a.md");

			assertThat(exception.getErrorKind()).isEqualTo(ErrorKind.FILE_TOO_LARGE);
			assertThat(exception.getFilePath()).isEqualTo("a.md");
			assertThat(exception.isTransient()).isFalse();
			assertThat(new CheckCancelledException("stop").getErrorKind()).isEqualTo(ErrorKind.CANCELLED);
		}

	}

	@Nested
	@DisplayName("Cancellation Signal")
	class CancellationSignalTest {

		@Test
		@DisplayName("Should wait the full duration when not cancelled")
		void shouldWaitWhenNotCancelled() {
			CancellationSignal signal = CancellationSignal.create();

			long start = System.nanoTime();
			signal.await(Duration.ofMillis(50));

			assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(45));
			assertThat(signal.isCancelled()).isFalse();
		}

		@Test
		@DisplayName("Should end a wait early when cancelled from another thread")
		void shouldEndWaitOnCancel() {
			CancellationSignal signal = CancellationSignal.create();
			Thread canceller = new Thread(() -> {
				try {
					Thread.sleep(50);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				signal.cancel();
			});
			canceller.start();

			long start = System.nanoTime();
			assertThatThrownBy(() -> signal.await(Duration.ofSeconds(30))).isInstanceOf(CheckCancelledException.class);
			assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
		}

		@Test
		@DisplayName("Should throw immediately once cancelled")
		void shouldThrowWhenCancelled() {
			CancellationSignal signal = CancellationSignal.create();
			signal.cancel();
			signal.cancel();

			assertThat(signal.isCancelled()).isTrue();
			assertThatThrownBy(() -> signal.throwIfCancelled("signIn")).isInstanceOf(CheckCancelledException.class)
				.hasMessageContaining("signIn");
			assertThatThrownBy(() -> signal.await(Duration.ZERO)).isInstanceOf(CheckCancelledException.class);
		}

	}

}
