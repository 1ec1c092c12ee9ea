package org.javai.sqlpilot.pipeline;

/**
 * Typed failure categories reported by the pipeline.
 */
public enum ErrorKind {
	/** The catalog is missing or has no tables. Fatal, consumes no attempt. */
	SCHEMA_UNAVAILABLE(false),
	/** The generation service errored or its response held no query. */
	GENERATION_FAILURE(true),
	/** The candidate names a table or column absent from the reduced context. */
	UNKNOWN_IDENTIFIER(true),
	EXECUTION_TIMEOUT(true),
	/** The engine reported a fault; the message is the engine's own text. */
	EXECUTION_ERROR(true),
	/** The candidate is not a pure read. Fatal. */
	FORBIDDEN_OPERATION(false),
	/** The candidate executed but its confidence stayed below the success threshold. */
	LOW_CONFIDENCE(true),
	/** The result analyzer found the result implausible. */
	SUSPECT_RESULT(true),
	/** The corrector returned the query unchanged. */
	CORRECTION_FAILED(true),
	/** The attempt budget ran out. Terminal. */
	ATTEMPTS_EXHAUSTED(false),
	/** The caller abandoned the request. */
	REQUEST_ABANDONED(false),
	/** An unexpected fault inside the pipeline. */
	INTERNAL_ERROR(false);

	private final boolean recoverable;

	ErrorKind(boolean recoverable) {
		this.recoverable = recoverable;
	}

	/**
	 * Whether a fix round may address this kind of error.
	 */
	public boolean isRecoverable() {
		return recoverable;
	}
}
