package org.javai.sqlpilot.exec;

/**
 * A fault reported by the data source. The message is the engine's own diagnostic text.
 */
public class DataSourceException extends RuntimeException {

	public DataSourceException(String message) {
		super(message);
	}

	public DataSourceException(String message, Throwable cause) {
		super(message, cause);
	}
}
