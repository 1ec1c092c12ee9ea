package org.javai.sqlpilot.catalog;

import java.util.Locale;

/**
 * Semantic role of a column. Role-tagged columns are treated as essential when a table is rendered into a
 * generation prompt.
 */
public enum ColumnRole {
	IDENTIFIER,
	NAME,
	DATE,
	AMOUNT,
	CATEGORY,
	OTHER;

	/**
	 * Parses a role tag such as {@code "amount"} or {@code "Identifier"}. Blank or unrecognised tags map to
	 * {@link #OTHER}.
	 */
	public static ColumnRole fromTag(String tag) {
		if (tag == null || tag.isBlank()) {
			return OTHER;
		}
		try {
			return valueOf(tag.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			return OTHER;
		}
	}

	public boolean isEssential() {
		return this != OTHER;
	}
}
