package org.javai.sqlpilot.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable, ordered set of tables plus the relationships between them.
 *
 * <p>A catalog is built once per data-source connection and is read-only during query processing. Refreshing a
 * catalog produces a new instance; work that started against the previous instance keeps using it. Equality is
 * identity: two catalogs with the same content built at different times are different snapshots.</p>
 *
 * <pre>{@code
 * SchemaCatalog catalog = SchemaCatalog.builder()
 *     .addTable("orders", "Orders")
 *     .addColumn("orders", CatalogColumn.primaryKey("order_id", "INTEGER"))
 *     .addColumn("orders", CatalogColumn.of("amount", "DECIMAL", ColumnRole.AMOUNT))
 *     .build();
 * }</pre>
 */
public final class SchemaCatalog {

	private static final SchemaCatalog EMPTY = new SchemaCatalog(List.of(), List.of());

	private final List<CatalogTable> tables;
	private final List<Relationship> relationships;
	private final Map<String, CatalogTable> tablesByName;

	private SchemaCatalog(List<CatalogTable> tables, List<Relationship> relationships) {
		this.tables = List.copyOf(tables);
		this.relationships = List.copyOf(relationships);
		Map<String, CatalogTable> byName = new LinkedHashMap<>();
		for (CatalogTable table : this.tables) {
			if (byName.put(key(table.name()), table) != null) {
				throw new IllegalArgumentException("duplicate table name: " + table.name());
			}
		}
		for (Relationship relationship : this.relationships) {
			if (!byName.containsKey(key(relationship.sourceTable()))
					|| !byName.containsKey(key(relationship.targetTable()))) {
				throw new IllegalArgumentException("relationship %s -> %s references a table outside the catalog"
						.formatted(relationship.sourceTable(), relationship.targetTable()));
			}
		}
		this.tablesByName = byName;
	}

	public static SchemaCatalog of(List<CatalogTable> tables, List<Relationship> relationships) {
		return new SchemaCatalog(
				tables != null ? tables : List.of(),
				relationships != null ? relationships : List.of());
	}

	public static SchemaCatalog empty() {
		return EMPTY;
	}

	public static Builder builder() {
		return new Builder();
	}

	public List<CatalogTable> tables() {
		return tables;
	}

	public List<Relationship> relationships() {
		return relationships;
	}

	public boolean isEmpty() {
		return tables.isEmpty();
	}

	public int size() {
		return tables.size();
	}

	/**
	 * Finds a table by name or business alias, ignoring case and quoting.
	 */
	public Optional<CatalogTable> findTable(String name) {
		if (name == null || name.isBlank()) {
			return Optional.empty();
		}
		CatalogTable exact = tablesByName.get(key(Identifiers.lastSegment(name)));
		if (exact != null) {
			return Optional.of(exact);
		}
		return tables.stream().filter(t -> t.matchesName(name)).findFirst();
	}

	/**
	 * Returns a catalog holding only the given tables, in this catalog's declaration order, together with the
	 * relationships whose endpoints are both retained.
	 */
	public SchemaCatalog restrictTo(Collection<CatalogTable> retained) {
		Set<String> keep = retained.stream()
				.map(t -> key(t.name()))
				.collect(Collectors.toSet());
		List<CatalogTable> keptTables = tables.stream()
				.filter(t -> keep.contains(key(t.name())))
				.toList();
		List<Relationship> keptRelationships = relationships.stream()
				.filter(r -> keep.contains(key(r.sourceTable())) && keep.contains(key(r.targetTable())))
				.toList();
		return new SchemaCatalog(keptTables, keptRelationships);
	}

	/**
	 * All table names, aliases and column names, in declaration order. Used to ground and repair identifiers.
	 */
	public List<String> knownNames() {
		List<String> names = new ArrayList<>();
		for (CatalogTable table : tables) {
			names.add(table.name());
		}
		for (CatalogTable table : tables) {
			for (CatalogColumn column : table.columns()) {
				if (!names.contains(column.name())) {
					names.add(column.name());
				}
			}
		}
		return names;
	}

	@Override
	public String toString() {
		return "SchemaCatalog" + tables.stream().map(CatalogTable::name).toList();
	}

	private static String key(String name) {
		return name.toLowerCase(Locale.ROOT);
	}

	/**
	 * Fluent builder preserving declaration order.
	 */
	public static final class Builder {

		private final Map<String, TableDraft> tables = new LinkedHashMap<>();
		private final List<Relationship> relationships = new ArrayList<>();

		private Builder() {
		}

		public Builder addTable(String name, String alias) {
			return addTable(name, alias, null);
		}

		public Builder addTable(String name, String alias, String description) {
			tables.put(name, new TableDraft(name, alias, description));
			return this;
		}

		public Builder addTable(CatalogTable table) {
			TableDraft draft = new TableDraft(table.name(), table.alias(), table.description());
			draft.columns.addAll(table.columns());
			tables.put(table.name(), draft);
			return this;
		}

		public Builder addColumn(String tableName, CatalogColumn column) {
			TableDraft draft = tables.get(tableName);
			if (draft == null) {
				throw new IllegalArgumentException("Table not found: " + tableName);
			}
			draft.columns.add(column);
			return this;
		}

		public Builder addColumn(String tableName, String columnName, String type, ColumnRole role) {
			return addColumn(tableName, CatalogColumn.of(columnName, type, role));
		}

		public Builder addRelationship(Relationship relationship) {
			relationships.add(relationship);
			return this;
		}

		public Builder addRelationship(String sourceTable, String sourceColumn, String targetTable,
				String targetColumn, Cardinality cardinality) {
			return addRelationship(Relationship.of(sourceTable, sourceColumn, targetTable, targetColumn, cardinality));
		}

		public SchemaCatalog build() {
			List<CatalogTable> built = tables.values().stream()
					.map(d -> new CatalogTable(d.name, d.alias, d.description, d.columns))
					.toList();
			return new SchemaCatalog(built, relationships);
		}

		private static final class TableDraft {
			private final String name;
			private final String alias;
			private final String description;
			private final List<CatalogColumn> columns = new ArrayList<>();

			private TableDraft(String name, String alias, String description) {
				this.name = name;
				this.alias = alias;
				this.description = description;
			}
		}
	}
}
