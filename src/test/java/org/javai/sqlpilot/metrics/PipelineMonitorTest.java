package org.javai.sqlpilot.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import java.util.List;
import org.javai.sqlpilot.route.ComplexityTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PipelineMonitor")
class PipelineMonitorTest {

	private static RequestRecord record(ComplexityTier tier, long duration, boolean cacheHit, boolean succeeded) {
		return new RequestRecord("what is total revenue", tier, 1, duration, cacheHit, succeeded,
				succeeded ? List.of() : List.of("ATTEMPTS_EXHAUSTED"));
	}

	@Test
	@DisplayName("reports zeros before any request")
	void emptySnapshot() {
		MonitorSnapshot snapshot = new PipelineMonitor().snapshot();

		assertThat(snapshot.totalRequests()).isZero();
		assertThat(snapshot.successRate()).isZero();
		assertThat(snapshot.requestsByTier()).isEmpty();
	}

	@Test
	@DisplayName("aggregates recorded requests")
	void aggregates() {
		PipelineMonitor monitor = new PipelineMonitor();
		monitor.record(record(ComplexityTier.SIMPLE, 100, true, true));
		monitor.record(record(ComplexityTier.SIMPLE, 200, false, true));
		monitor.record(record(ComplexityTier.COMPLEX, 300, false, false));
		monitor.record(record(ComplexityTier.MODERATE, 400, false, true));

		MonitorSnapshot snapshot = monitor.snapshot();

		assertThat(snapshot.totalRequests()).isEqualTo(4);
		assertThat(snapshot.successRate()).isEqualTo(0.75);
		assertThat(snapshot.averageDurationMillis()).isEqualTo(250.0);
		assertThat(snapshot.cacheHitRate()).isEqualTo(0.25);
		assertThat(snapshot.requestsByTier()).containsOnly(
				entry(ComplexityTier.SIMPLE, 2L), entry(ComplexityTier.MODERATE, 1L), entry(ComplexityTier.COMPLEX, 1L));
	}

	@Test
	@DisplayName("keeps a bounded history, dropping the oldest record")
	void boundedHistory() {
		PipelineMonitor monitor = new PipelineMonitor(2);
		monitor.record(record(ComplexityTier.SIMPLE, 1, false, true));
		monitor.record(record(ComplexityTier.MODERATE, 2, false, true));
		monitor.record(record(ComplexityTier.COMPLEX, 3, false, false));

		assertThat(monitor.history()).extracting(RequestRecord::durationMillis).containsExactly(2L, 3L);
	}

	@Test
	@DisplayName("truncates long questions")
	void truncatesQuestion() {
		RequestRecord record = new RequestRecord("x".repeat(250), ComplexityTier.SIMPLE, 1, 5, false, true, null);

		assertThat(record.questionPrefix()).hasSize(RequestRecord.QUESTION_PREFIX_LENGTH);
		assertThat(record.errorKinds()).isEmpty();
	}

	@Test
	@DisplayName("clears its history")
	void clears() {
		PipelineMonitor monitor = new PipelineMonitor();
		monitor.record(record(ComplexityTier.SIMPLE, 1, false, true));

		monitor.clear();

		assertThat(monitor.snapshot().totalRequests()).isZero();
	}

	@Test
	@DisplayName("rejects a non-positive history size")
	void rejectsZeroSize() {
		assertThatThrownBy(() -> new PipelineMonitor(0)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("pipeline metrics expose the final round")
	void finalRound() {
		RoundRecord first = new RoundRecord(1, "GENERATE", ComplexityTier.SIMPLE, "mini", RoundOutcome.LOW_CONFIDENCE,
				12, "confidence 0.20 is below the success threshold 0.50");
		RoundRecord second = new RoundRecord(2, "FIX", ComplexityTier.SIMPLE, "mini", RoundOutcome.SUCCESS, 8, null);

		PipelineMetrics metrics = new PipelineMetrics(ComplexityTier.SIMPLE, 2, false, 20, List.of(first, second));

		assertThat(metrics.finalRound()).isEqualTo(second);
		assertThat(metrics.succeeded()).isTrue();
		assertThat(PipelineMetrics.empty().finalRound()).isNull();
	}
}
