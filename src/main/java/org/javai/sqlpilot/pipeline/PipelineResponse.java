package org.javai.sqlpilot.pipeline;

import java.util.List;
import org.javai.sqlpilot.exec.QueryRows;
import org.javai.sqlpilot.metrics.PipelineMetrics;

/**
 * What a caller gets back for one question.
 */
public sealed interface PipelineResponse {

	enum Status {
		SUCCEEDED,
		FAILED
	}

	Status status();

	int attempts();

	PipelineMetrics metrics();

	/**
	 * @param query the query that produced the results
	 * @param results the rows returned by the data source or the cache
	 * @param narrative a short interpretation of the results
	 * @param confidence final confidence, at or above the success threshold
	 * @param suggestions analyzer hints attached to the final result
	 */
	record Succeeded(
			String query,
			QueryRows results,
			String narrative,
			double confidence,
			int attempts,
			List<String> suggestions,
			PipelineMetrics metrics
	) implements PipelineResponse {

		public Succeeded {
			if (query == null || query.isBlank()) {
				throw new IllegalArgumentException("query must not be blank");
			}
			if (results == null) {
				throw new IllegalArgumentException("results must not be null");
			}
			narrative = narrative != null ? narrative : "";
			suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
			metrics = metrics != null ? metrics : PipelineMetrics.empty();
		}

		@Override
		public Status status() {
			return Status.SUCCEEDED;
		}
	}

	/**
	 * @param lastQuery the last candidate query, empty if none was ever produced
	 * @param errors every error recorded while processing, in order
	 */
	record Failed(
			String lastQuery,
			List<PipelineError> errors,
			int attempts,
			PipelineMetrics metrics
	) implements PipelineResponse {

		public Failed {
			lastQuery = lastQuery != null ? lastQuery : "";
			errors = errors != null ? List.copyOf(errors) : List.of();
			metrics = metrics != null ? metrics : PipelineMetrics.empty();
		}

		@Override
		public Status status() {
			return Status.FAILED;
		}

		public boolean hasError(ErrorKind kind) {
			return errors.stream().anyMatch(error -> error.kind() == kind);
		}
	}
}
