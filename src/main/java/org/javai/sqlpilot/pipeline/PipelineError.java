package org.javai.sqlpilot.pipeline;

/**
 * One error recorded while processing a request.
 *
 * @param kind category of the error
 * @param message human-readable detail; engine messages are kept verbatim
 * @param attempt the attempt during which the error arose, 0 if before the first attempt
 */
public record PipelineError(ErrorKind kind, String message, int attempt) {

	public PipelineError {
		if (kind == null) {
			throw new IllegalArgumentException("kind must not be null");
		}
		if (message == null) {
			message = "";
		}
		if (attempt < 0) {
			throw new IllegalArgumentException("attempt must be >= 0");
		}
	}

	@Override
	public String toString() {
		return kind + ": " + message;
	}
}
