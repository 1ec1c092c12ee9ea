package org.javai.sqlpilot.generation;

import org.javai.sqlpilot.route.ComplexityTier;

/**
 * Boundary to the language model. A prompt goes in, raw text comes out; callers must expect empty, malformed or
 * refusal-shaped text.
 */
public interface GenerationService {

	/**
	 * @return the raw response text, never null
	 * @throws GenerationException if no response arrived within the request's time budget
	 */
	String generate(GenerationRequest request);

	/**
	 * Identifier of the model serving a tier, for metrics. Null if unknown.
	 */
	default String modelIdFor(ComplexityTier tier) {
		return null;
	}
}
