package org.javai.sqlpilot.catalog;

import java.util.List;
import java.util.StringJoiner;

/**
 * A join path between two catalog tables.
 *
 * @param sourceTable table holding the referencing keys
 * @param targetTable referenced table
 * @param joinKeys ordered column pairs, at least one
 * @param cardinality cardinality read from source to target
 */
public record Relationship(
		String sourceTable,
		String targetTable,
		List<JoinKey> joinKeys,
		Cardinality cardinality
) {

	/**
	 * One column pair of a join condition.
	 */
	public record JoinKey(String sourceColumn, String targetColumn) {
		public JoinKey {
			if (sourceColumn == null || sourceColumn.isBlank() || targetColumn == null || targetColumn.isBlank()) {
				throw new IllegalArgumentException("join key columns must not be blank");
			}
		}
	}

	public Relationship {
		if (sourceTable == null || sourceTable.isBlank()) {
			throw new IllegalArgumentException("sourceTable must not be blank");
		}
		if (targetTable == null || targetTable.isBlank()) {
			throw new IllegalArgumentException("targetTable must not be blank");
		}
		joinKeys = joinKeys != null ? List.copyOf(joinKeys) : List.of();
		if (joinKeys.isEmpty()) {
			throw new IllegalArgumentException("relationship %s -> %s needs at least one join key"
					.formatted(sourceTable, targetTable));
		}
		cardinality = cardinality != null ? cardinality : Cardinality.MANY_TO_ONE;
	}

	public static Relationship of(String sourceTable, String sourceColumn, String targetTable, String targetColumn,
			Cardinality cardinality) {
		return new Relationship(sourceTable, targetTable, List.of(new JoinKey(sourceColumn, targetColumn)),
				cardinality);
	}

	public boolean connects(String tableName) {
		return sourceTable.equalsIgnoreCase(tableName) || targetTable.equalsIgnoreCase(tableName);
	}

	/**
	 * Creates a join clause suggestion for SQL.
	 *
	 * @return a string like "JOIN customers ON orders.customer_id = customers.id"
	 */
	public String joinHint() {
		StringJoiner condition = new StringJoiner(" AND ");
		for (JoinKey key : joinKeys) {
			condition.add("%s.%s = %s.%s".formatted(sourceTable, key.sourceColumn(), targetTable, key.targetColumn()));
		}
		return "JOIN %s ON %s".formatted(targetTable, condition);
	}
}
