package org.javai.sqlpilot.generation;

/**
 * The generation service could not produce a response: transport error, refusal to accept the call, or the time
 * budget ran out.
 */
public class GenerationException extends RuntimeException {

	public GenerationException(String message) {
		super(message);
	}

	public GenerationException(String message, Throwable cause) {
		super(message, cause);
	}
}
