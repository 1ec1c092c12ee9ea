package org.javai.sqlpilot.metrics;

/**
 * Outcome of a single generate or fix round.
 */
public enum RoundOutcome {
	/**
	 * The candidate executed and met the success threshold.
	 */
	SUCCESS,

	/**
	 * The candidate executed but its confidence stayed below the threshold, or the analyzer reported errors.
	 */
	LOW_CONFIDENCE,

	/**
	 * The data source timed out or reported an error.
	 */
	EXECUTION_FAILED,

	/**
	 * The generation service errored or returned no usable query.
	 */
	GENERATION_FAILED,

	/**
	 * The candidate was rejected as a non-read query.
	 */
	FORBIDDEN
}
