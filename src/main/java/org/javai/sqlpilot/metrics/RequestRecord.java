package org.javai.sqlpilot.metrics;

import java.util.List;
import org.javai.sqlpilot.route.ComplexityTier;

/**
 * One completed request as kept in the {@link PipelineMonitor} history.
 *
 * @param questionPrefix the first {@value #QUESTION_PREFIX_LENGTH} characters of the question
 * @param errorKinds names of the error kinds the request reported, empty on success
 */
public record RequestRecord(
		String questionPrefix,
		ComplexityTier tier,
		int attempts,
		long durationMillis,
		boolean cacheHit,
		boolean succeeded,
		List<String> errorKinds
) {

	public static final int QUESTION_PREFIX_LENGTH = 100;

	public RequestRecord {
		questionPrefix = questionPrefix == null ? ""
				: questionPrefix.length() > QUESTION_PREFIX_LENGTH
						? questionPrefix.substring(0, QUESTION_PREFIX_LENGTH) : questionPrefix;
		errorKinds = errorKinds != null ? List.copyOf(errorKinds) : List.of();
	}
}
