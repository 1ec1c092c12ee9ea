package org.javai.sqlpilot.exec;

/**
 * The data source stopped a query because it ran past its time budget.
 */
public class DataSourceTimeoutException extends DataSourceException {

	public DataSourceTimeoutException(String message) {
		super(message);
	}

	public DataSourceTimeoutException(String message, Throwable cause) {
		super(message, cause);
	}
}
