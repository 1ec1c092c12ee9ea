package org.javai.sqlpilot.catalog;

/**
 * A column of a catalog table.
 *
 * @param name physical column name
 * @param type declared type as reported by the data source (may be null)
 * @param role semantic role tag
 * @param description business-friendly description (may be null)
 * @param primaryKey whether the column is (part of) the primary key
 * @param references foreign key target in {@code table.column} form, or null
 */
public record CatalogColumn(
		String name,
		String type,
		ColumnRole role,
		String description,
		boolean primaryKey,
		String references
) {

	public CatalogColumn {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("column name must not be blank");
		}
		role = role != null ? role : ColumnRole.OTHER;
	}

	public static CatalogColumn of(String name, String type, ColumnRole role) {
		return new CatalogColumn(name, type, role, null, false, null);
	}

	public static CatalogColumn primaryKey(String name, String type) {
		return new CatalogColumn(name, type, ColumnRole.IDENTIFIER, null, true, null);
	}

	/**
	 * Case-insensitive name match that ignores surrounding identifier quotes.
	 */
	public boolean matchesName(String candidate) {
		return candidate != null && name.equalsIgnoreCase(Identifiers.unquote(candidate));
	}

	public boolean foreignKey() {
		return references != null && !references.isBlank();
	}
}
