package org.javai.sqlpilot.route;

/**
 * Cost/quality class of generation resource chosen for a question.
 */
public enum ComplexityTier {
	/** Single-table lookups and filters. */
	SIMPLE,
	/** Aggregations, grouping and joins along known relationships. */
	MODERATE,
	/** Nested aggregation, several time windows, rankings and wide joins. */
	COMPLEX
}
