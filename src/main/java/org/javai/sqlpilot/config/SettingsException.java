package org.javai.sqlpilot.config;

/**
 * Raised when pipeline settings cannot be read or hold an invalid value.
 */
public class SettingsException extends RuntimeException {

	public SettingsException(String message) {
		super(message);
	}

	public SettingsException(String message, Throwable cause) {
		super(message, cause);
	}
}
