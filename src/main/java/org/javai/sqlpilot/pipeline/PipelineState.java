package org.javai.sqlpilot.pipeline;

/**
 * States of the {@link Supervisor}.
 */
public enum PipelineState {
	GENERATE,
	EXECUTE_ANALYZE,
	FIX,
	SUCCEEDED,
	FAILED;

	public boolean isTerminal() {
		return this == SUCCEEDED || this == FAILED;
	}
}
