package org.javai.sqlpilot.metrics;

import java.util.List;
import org.javai.sqlpilot.route.ComplexityTier;

/**
 * Per-request telemetry attached to every pipeline response.
 *
 * @param tier tier the question was routed to, null if the request ended before routing
 * @param totalAttempts attempts consumed
 * @param cacheHit whether any round was served from the result cache
 * @param durationMillis wall time of the whole request
 * @param rounds one record per generate or fix round, in order
 */
public record PipelineMetrics(
		ComplexityTier tier,
		int totalAttempts,
		boolean cacheHit,
		long durationMillis,
		List<RoundRecord> rounds
) {

	public PipelineMetrics {
		rounds = rounds != null ? List.copyOf(rounds) : List.of();
		if (totalAttempts < 0) {
			throw new IllegalArgumentException("totalAttempts must be >= 0");
		}
		if (durationMillis < 0) {
			throw new IllegalArgumentException("durationMillis must be >= 0");
		}
	}

	public static PipelineMetrics empty() {
		return new PipelineMetrics(null, 0, false, 0, List.of());
	}

	public boolean succeeded() {
		return rounds.stream().anyMatch(RoundRecord::isSuccess);
	}

	/**
	 * @return the round that determined the outcome, or null if no round ran
	 */
	public RoundRecord finalRound() {
		return rounds.isEmpty() ? null : rounds.get(rounds.size() - 1);
	}
}
