package org.javai.sqlpilot.correct;

import java.util.List;

/**
 * Output of the {@link QueryCorrector}.
 *
 * @param query the repaired query, or the original query when no repair was possible
 * @param confidence structural confidence of the returned query
 * @param method how the query was obtained
 * @param errors problems with the returned query or with the repair attempt
 * @param generationFailed true if the model fallback was tried and the service errored or returned nothing usable
 * @param modelId model used by the fallback, if any
 */
public record Correction(
		String query,
		double confidence,
		Method method,
		List<String> errors,
		boolean generationFailed,
		String modelId
) {

	public enum Method {
		/** A deterministic pattern rewrote the query. */
		PATTERN,
		/** The generation service produced a new candidate. */
		MODEL,
		/** Nothing worked; the original query is returned. */
		NONE
	}

	public Correction {
		query = query != null ? query : "";
		errors = errors != null ? List.copyOf(errors) : List.of();
		if (method == null) {
			throw new IllegalArgumentException("method must not be null");
		}
		if (confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("confidence must be within [0, 1]");
		}
	}

	public boolean fixed() {
		return method != Method.NONE;
	}
}
