package org.javai.sqlpilot.generation;

import java.time.Duration;
import org.javai.sqlpilot.route.ComplexityTier;

/**
 * One prompt for the generation service.
 *
 * @param systemPrompt instructions (may be blank)
 * @param userPrompt the request text
 * @param tier model-tier hint
 * @param timeBudget time the caller is prepared to wait
 */
public record GenerationRequest(String systemPrompt, String userPrompt, ComplexityTier tier, Duration timeBudget) {

	public GenerationRequest {
		if (userPrompt == null || userPrompt.isBlank()) {
			throw new IllegalArgumentException("userPrompt must not be blank");
		}
		if (tier == null) {
			throw new IllegalArgumentException("tier must not be null");
		}
		if (timeBudget == null || timeBudget.isNegative() || timeBudget.isZero()) {
			throw new IllegalArgumentException("timeBudget must be positive");
		}
	}
}
