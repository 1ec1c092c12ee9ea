package org.javai.sqlpilot.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An ordered sequence of records returned by the data source. Each record maps column name to a scalar value
 * (null allowed) and preserves the column order of the result.
 *
 * @param columns column names in result order
 * @param rows the records
 */
public record QueryRows(List<String> columns, List<Map<String, Object>> rows) {

	public QueryRows {
		columns = columns != null ? List.copyOf(columns) : List.of();
		List<Map<String, Object>> copied = new ArrayList<>();
		if (rows != null) {
			for (Map<String, Object> row : rows) {
				copied.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
			}
		}
		rows = Collections.unmodifiableList(copied);
	}

	public static QueryRows empty(List<String> columns) {
		return new QueryRows(columns, List.of());
	}

	/**
	 * Builds a result from records, taking the column order from the first record.
	 */
	public static QueryRows of(List<Map<String, Object>> rows) {
		List<String> columns = rows == null || rows.isEmpty() ? List.of() : List.copyOf(rows.get(0).keySet());
		return new QueryRows(columns, rows);
	}

	public int size() {
		return rows.size();
	}

	public boolean isEmpty() {
		return rows.isEmpty();
	}
}
