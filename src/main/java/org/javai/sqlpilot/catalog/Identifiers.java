package org.javai.sqlpilot.catalog;

/**
 * Helpers for comparing SQL identifiers against catalog names.
 */
public final class Identifiers {

	private Identifiers() {
		// Utility class
	}

	/**
	 * Removes one level of identifier quoting: {@code "name"}, {@code `name`} or {@code [name]}.
	 */
	public static String unquote(String identifier) {
		if (identifier == null) {
			return null;
		}
		String trimmed = identifier.trim();
		if (trimmed.length() >= 2) {
			char first = trimmed.charAt(0);
			char last = trimmed.charAt(trimmed.length() - 1);
			if ((first == '"' && last == '"') || (first == '`' && last == '`') || (first == '[' && last == ']')) {
				return trimmed.substring(1, trimmed.length() - 1);
			}
		}
		return trimmed;
	}

	/**
	 * Returns the unquoted last segment of a dotted name, e.g. {@code orders} for {@code "sales"."orders"}.
	 */
	public static String lastSegment(String qualifiedName) {
		if (qualifiedName == null) {
			return null;
		}
		String trimmed = qualifiedName.trim();
		int dot = lastUnquotedDot(trimmed);
		return unquote(dot < 0 ? trimmed : trimmed.substring(dot + 1));
	}

	private static int lastUnquotedDot(String name) {
		boolean quoted = false;
		int last = -1;
		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			if (c == '"' || c == '`') {
				quoted = !quoted;
			} else if (c == '.' && !quoted) {
				last = i;
			}
		}
		return last;
	}
}
