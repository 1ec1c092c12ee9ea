package org.javai.sqlpilot.catalog;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * A table of the schema catalog with its business alias and ordered columns.
 *
 * @param name physical table name, unique within a catalog
 * @param alias business-friendly name (may be null)
 * @param description business description (may be null)
 * @param columns ordered columns
 */
public record CatalogTable(
		String name,
		String alias,
		String description,
		List<CatalogColumn> columns
) {

	public CatalogTable {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("table name must not be blank");
		}
		columns = columns != null ? List.copyOf(columns) : List.of();
		Set<String> seen = new HashSet<>();
		for (CatalogColumn column : columns) {
			if (!seen.add(column.name().toLowerCase(Locale.ROOT))) {
				throw new IllegalArgumentException(
						"duplicate column '%s' in table '%s'".formatted(column.name(), name));
			}
		}
	}

	public CatalogTable(String name, String alias, List<CatalogColumn> columns) {
		this(name, alias, null, columns);
	}

	/**
	 * Returns true if the candidate matches the table name or its alias, ignoring case and quotes. A
	 * schema-qualified candidate ({@code sales.orders}) is matched on its last segment.
	 */
	public boolean matchesName(String candidate) {
		if (candidate == null) {
			return false;
		}
		String bare = Identifiers.lastSegment(candidate);
		return name.equalsIgnoreCase(bare) || (alias != null && alias.equalsIgnoreCase(bare));
	}

	public Optional<CatalogColumn> findColumn(String columnName) {
		if (columnName == null || columnName.isBlank()) {
			return Optional.empty();
		}
		return columns.stream()
				.filter(c -> c.matchesName(columnName))
				.findFirst();
	}

	public boolean hasPrimaryKey() {
		return columns.stream().anyMatch(CatalogColumn::primaryKey);
	}

	public List<String> columnNames() {
		return columns.stream().map(CatalogColumn::name).toList();
	}
}
