package org.javai.sqlpilot.catalog;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a catalog beyond its construction invariants.
 *
 * <p>Relationships whose join keys name columns that do not exist are errors and raise
 * {@link CatalogException}. Tables without columns, tables without a primary key and tables that take part in
 * no relationship (in a catalog with more than one table) are reported as warnings.</p>
 */
public final class CatalogValidator {

	/**
	 * @return warnings, possibly empty
	 * @throws CatalogException if a relationship refers to a missing column
	 */
	public List<String> validate(SchemaCatalog catalog) {
		List<String> errors = new ArrayList<>();
		for (Relationship relationship : catalog.relationships()) {
			CatalogTable source = catalog.findTable(relationship.sourceTable()).orElseThrow();
			CatalogTable target = catalog.findTable(relationship.targetTable()).orElseThrow();
			for (Relationship.JoinKey key : relationship.joinKeys()) {
				if (source.findColumn(key.sourceColumn()).isEmpty()) {
					errors.add("relationship %s -> %s: unknown column %s.%s".formatted(
							source.name(), target.name(), source.name(), key.sourceColumn()));
				}
				if (target.findColumn(key.targetColumn()).isEmpty()) {
					errors.add("relationship %s -> %s: unknown column %s.%s".formatted(
							source.name(), target.name(), target.name(), key.targetColumn()));
				}
			}
		}
		if (!errors.isEmpty()) {
			throw new CatalogException("Invalid catalog: " + String.join("; ", errors));
		}

		List<String> warnings = new ArrayList<>();
		for (CatalogTable table : catalog.tables()) {
			if (table.columns().isEmpty()) {
				warnings.add("table %s has no columns".formatted(table.name()));
			} else if (!table.hasPrimaryKey()) {
				warnings.add("table %s has no primary key".formatted(table.name()));
			}
			if (catalog.size() > 1 && catalog.relationships().stream().noneMatch(r -> r.connects(table.name()))) {
				warnings.add("table %s takes part in no relationship".formatted(table.name()));
			}
		}
		return warnings;
	}
}
