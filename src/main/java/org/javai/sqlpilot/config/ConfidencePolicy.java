package org.javai.sqlpilot.config;

/**
 * Numeric policy constants used to score candidate queries.
 *
 * <p>The values are calibration knobs, not contracts. The one relationship enforced here is that an ungrounded
 * candidate can never reach the success threshold, even after the aggregate boost.</p>
 *
 * @param successThreshold minimum confidence for a request to succeed
 * @param groundedBase initial confidence of a parseable query that only uses known names
 * @param ungroundedCap confidence forced onto a query that uses unknown names
 * @param aggregateBoost additive boost for single-row aggregate results
 * @param aggregateFloor minimum confidence after boosting a candidate that already met the threshold
 * @param emptyResultCap cap applied when a query returns no rows
 * @param correctionConfidence fixed confidence of a deterministic pattern correction
 */
public record ConfidencePolicy(
		double successThreshold,
		double groundedBase,
		double ungroundedCap,
		double aggregateBoost,
		double aggregateFloor,
		double emptyResultCap,
		double correctionConfidence
) {

	/** Penalty applied when a candidate cannot be parsed locally and only its table names could be checked. */
	public static final double UNPARSED_PENALTY = 0.1;

	public ConfidencePolicy {
		requireUnit("successThreshold", successThreshold);
		requireUnit("groundedBase", groundedBase);
		requireUnit("ungroundedCap", ungroundedCap);
		requireUnit("aggregateBoost", aggregateBoost);
		requireUnit("aggregateFloor", aggregateFloor);
		requireUnit("emptyResultCap", emptyResultCap);
		requireUnit("correctionConfidence", correctionConfidence);
		if (ungroundedCap + aggregateBoost >= successThreshold) {
			throw new IllegalArgumentException(
					"ungroundedCap + aggregateBoost must stay below successThreshold");
		}
	}

	public static ConfidencePolicy defaults() {
		return new ConfidencePolicy(0.5, 0.7, 0.2, 0.15, 0.8, 0.3, 0.6);
	}

	public ConfidencePolicy withSuccessThreshold(double threshold) {
		return new ConfidencePolicy(threshold, groundedBase, ungroundedCap, aggregateBoost, aggregateFloor,
				emptyResultCap, correctionConfidence);
	}

	private static void requireUnit(String name, double value) {
		if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
			throw new IllegalArgumentException(name + " must be within [0, 1]");
		}
	}
}
