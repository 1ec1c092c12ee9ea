package org.javai.sqlpilot.metrics;

import org.javai.sqlpilot.route.ComplexityTier;

/**
 * Record of one pipeline round for observability.
 *
 * @param attempt 1-based attempt number the round consumed
 * @param stage {@code GENERATE} or {@code FIX}
 * @param tier tier the round was routed to
 * @param modelId model that served the round's generation call, null if unknown or not called
 * @param outcome result of the round after execution and analysis
 * @param durationMillis wall time of the round including execution
 * @param detail first error of the round, null on success
 */
public record RoundRecord(
		int attempt,
		String stage,
		ComplexityTier tier,
		String modelId,
		RoundOutcome outcome,
		long durationMillis,
		String detail
) {

	public RoundRecord {
		if (attempt < 1) {
			throw new IllegalArgumentException("attempt must be >= 1");
		}
		if (stage == null || stage.isBlank()) {
			throw new IllegalArgumentException("stage must not be blank");
		}
		if (outcome == null) {
			throw new IllegalArgumentException("outcome must not be null");
		}
		if (durationMillis < 0) {
			throw new IllegalArgumentException("durationMillis must be >= 0");
		}
	}

	public boolean isSuccess() {
		return outcome == RoundOutcome.SUCCESS;
	}
}
