package org.javai.sqlpilot.exec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.sql.DataSource;

/**
 * {@link QueryDataSource} over a JDBC {@link DataSource}. Connections are marked read-only and statements carry
 * the row limit and a query timeout rounded up to whole seconds.
 */
public final class JdbcQueryDataSource implements QueryDataSource {

	private final DataSource dataSource;

	public JdbcQueryDataSource(DataSource dataSource) {
		this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
	}

	@Override
	public QueryRows execute(String sql, int rowLimit, Duration timeBudget) {
		try (Connection connection = dataSource.getConnection()) {
			connection.setReadOnly(true);
			try (Statement statement = connection.createStatement()) {
				statement.setMaxRows(rowLimit);
				statement.setQueryTimeout(timeoutSeconds(timeBudget));
				try (ResultSet resultSet = statement.executeQuery(sql)) {
					return read(resultSet);
				}
			}
		} catch (SQLTimeoutException e) {
			throw new DataSourceTimeoutException(e.getMessage(), e);
		} catch (SQLException e) {
			throw new DataSourceException(e.getMessage(), e);
		}
	}

	private static QueryRows read(ResultSet resultSet) throws SQLException {
		ResultSetMetaData metaData = resultSet.getMetaData();
		int count = metaData.getColumnCount();
		List<String> columns = new ArrayList<>(count);
		for (int i = 1; i <= count; i++) {
			columns.add(metaData.getColumnLabel(i));
		}
		List<Map<String, Object>> rows = new ArrayList<>();
		while (resultSet.next()) {
			Map<String, Object> row = new LinkedHashMap<>();
			for (int i = 1; i <= count; i++) {
				row.put(columns.get(i - 1), resultSet.getObject(i));
			}
			rows.add(row);
		}
		return new QueryRows(columns, rows);
	}

	private static int timeoutSeconds(Duration timeBudget) {
		long millis = timeBudget.toMillis();
		return (int) Math.max(1, Math.min(Integer.MAX_VALUE, (millis + 999) / 1000));
	}
}
