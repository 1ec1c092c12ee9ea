package org.javai.sqlpilot.synth;

import java.util.List;

/**
 * Candidate produced by the {@link QuerySynthesizer}.
 *
 * @param query the candidate query, empty when generation failed
 * @param confidence structural confidence in [0, 1]
 * @param errors problems found while producing the candidate
 * @param generationFailed true if the service errored or returned no extractable query
 * @param modelId model that served the call, if known
 */
public record SynthesisResult(
		String query,
		double confidence,
		List<String> errors,
		boolean generationFailed,
		String modelId
) {

	public SynthesisResult {
		query = query != null ? query : "";
		errors = errors != null ? List.copyOf(errors) : List.of();
		if (confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("confidence must be within [0, 1]");
		}
	}

	static SynthesisResult failure(String error, String modelId) {
		return new SynthesisResult("", 0.0, List.of(error), true, modelId);
	}
}
