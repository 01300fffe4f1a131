package org.springaicommunity.content.checker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ResultAggregator Tests")
class ResultAggregatorTest {

	@Test
	@DisplayName("Should count successes and failures")
	void shouldCountOutcomes() {
		List<CheckOutcome> outcomes = List.of(CheckOutcome.success("a.md", "https://host/a"),
				CheckOutcome.failure("b.md"), CheckOutcome.success("c.md", "https://host/c"),
				CheckOutcome.failure("d.md"), CheckOutcome.failure("e.md"));

		BatchSummary summary = ResultAggregator.summarize("batch-1", outcomes);

		assertThat(summary.batchId()).isEqualTo("batch-1");
		assertThat(summary.successCount()).isEqualTo(2);
		assertThat(summary.failureCount()).isEqualTo(3);
		assertThat(summary.totalCount()).isEqualTo(outcomes.size());
		assertThat(summary.hasFailures()).isTrue();
	}

	@Test
	@DisplayName("Should pick the first link in input order")
	void shouldPickFirstLinkInInputOrder() {
		List<CheckOutcome> outcomes = List.of(CheckOutcome.failure("a.md"),
				CheckOutcome.success("b.md", "https://host/dashboard-b"),
				CheckOutcome.success("c.md", "https://host/dashboard-c"));

		BatchSummary summary = ResultAggregator.summarize("batch-1", outcomes);

		assertThat(summary.representativeLink()).isEqualTo("https://host/dashboard-b");
	}

	@Test
	@DisplayName("Should count a blank link as a failure")
	void shouldCountBlankLinkAsFailure() {
		List<CheckOutcome> outcomes = List.of(CheckOutcome.of("a.md", Optional.of("  ")),
				CheckOutcome.success("b.md", "https://host/b"));

		BatchSummary summary = ResultAggregator.summarize("batch-1", outcomes);

		assertThat(summary.representativeLink()).isEqualTo("https://host/b");
		assertThat(summary.successCount()).isEqualTo(1);
		assertThat(summary.failureCount()).isEqualTo(1);
	}

	@Test
	@DisplayName("Should have no link when every file failed")
	void shouldHaveNoLinkWhenAllFailed() {
		BatchSummary summary = ResultAggregator.summarize("batch-1",
				List.of(CheckOutcome.failure("a.md"), CheckOutcome.failure("b.md")));

		assertThat(summary.successCount()).isZero();
		assertThat(summary.failureCount()).isEqualTo(2);
		assertThat(summary.representativeLinkOptional()).isEmpty();
	}

	@Test
	@DisplayName("Should summarize an empty batch")
	void shouldSummarizeEmptyBatch() {
		BatchSummary summary = ResultAggregator.summarize("batch-1", List.of());

		assertThat(summary.totalCount()).isZero();
		assertThat(summary.hasFailures()).isFalse();
		assertThat(summary.representativeLink()).isNull();
	}

}
