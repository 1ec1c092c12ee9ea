package org.javai.sqlpilot.exec;

import java.time.Duration;

/**
 * Read-only boundary to the data warehouse.
 */
public interface QueryDataSource {

	/**
	 * Runs a read-only query.
	 *
	 * @param sql the query text, already row-limited
	 * @param rowLimit maximum rows to return
	 * @param timeBudget time the engine may spend on the query
	 * @return the records in engine order
	 * @throws DataSourceTimeoutException if the engine gave up because of the time budget
	 * @throws DataSourceException with the raw engine message for any other failure
	 */
	QueryRows execute(String sql, int rowLimit, Duration timeBudget);
}
