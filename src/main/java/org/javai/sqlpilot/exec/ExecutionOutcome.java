package org.javai.sqlpilot.exec;

/**
 * Result of asking the {@link QueryExecutor} to run a candidate query.
 */
public sealed interface ExecutionOutcome {

	/**
	 * @param rows the result, possibly served from the cache
	 * @param cacheHit true if no execution took place
	 * @param executedQuery the text sent to the data source (after row limiting); the candidate text on a hit
	 */
	record Success(QueryRows rows, boolean cacheHit, String executedQuery) implements ExecutionOutcome {
		public Success {
			if (rows == null) {
				throw new IllegalArgumentException("rows must not be null");
			}
		}
	}

	/**
	 * No slot freed up, or the query ran past its time budget.
	 */
	record TimedOut(String message) implements ExecutionOutcome {
	}

	/**
	 * The engine reported a fault. The message is passed through untouched.
	 */
	record EngineError(String message) implements ExecutionOutcome {
	}

	/**
	 * The query is not a pure read and was never sent to the data source.
	 */
	record Forbidden(String reason) implements ExecutionOutcome {
	}

	default boolean succeeded() {
		return this instanceof Success;
	}
}
