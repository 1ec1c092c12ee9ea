package org.javai.sqlpilot.analyze;

import java.util.List;

/**
 * Annotations the {@link ResultAnalyzer} attaches to an executed result.
 *
 * @param confidence adjusted confidence in [0, 1]
 * @param suggestions hints for a repair attempt
 * @param errors problems detected in the result itself
 */
public record Analysis(double confidence, List<String> suggestions, List<String> errors) {

	public Analysis {
		if (confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("confidence must be within [0, 1]");
		}
		suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
		errors = errors != null ? List.copyOf(errors) : List.of();
	}

	public static Analysis none() {
		return new Analysis(0.0, List.of(), List.of());
	}
}
