package org.javai.sqlpilot.correct;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.sqlpilot.catalog.CatalogTable;
import org.javai.sqlpilot.catalog.SchemaCatalog;
import org.javai.sqlpilot.sql.QueryReferences;
import org.javai.sqlpilot.sql.SqlText;

/**
 * Repairs ambiguous column references by qualifying them with the first table in the query that has the
 * column, using that table's alias when the query gives one.
 */
final class TableQualification implements CorrectionPattern {

	private static final Pattern AMBIGUOUS_NAME = Pattern.compile(
			"(?i)(?:ambiguous\\s+(?:column\\s+)?(?:name|reference|identifier)?\\s*:?\\s*[\"'`]?([A-Za-z_][\\w$]*)[\"'`]?"
					+ "|column\\s+(?:reference\\s+)?[\"'`]?([A-Za-z_][\\w$]*)[\"'`]?\\s+is\\s+ambiguous"
					+ "|[\"'`]([A-Za-z_][\\w$]*)[\"'`][^\"'`]*\\bambiguous)");

	@Override
	public boolean matches(String lowerCaseErrors) {
		return lowerCaseErrors.contains("ambiguous");
	}

	@Override
	public Optional<String> apply(String query, String errors, SchemaCatalog context) {
		Optional<String> column = ambiguousColumn(errors);
		Optional<QueryReferences> references = QueryReferences.of(query);
		if (column.isEmpty() || references.isEmpty()) {
			return Optional.empty();
		}
		Map<String, String> qualifiers = qualifiersByTable(references.get());
		for (String table : references.get().tables()) {
			Optional<CatalogTable> known = context.findTable(table);
			if (known.isPresent() && known.get().findColumn(column.get()).isPresent()) {
				String qualifier = qualifiers.getOrDefault(table.toLowerCase(Locale.ROOT), table);
				String repaired = SqlText.qualifyColumn(query, column.get(), qualifier);
				return repaired.equals(query) ? Optional.empty() : Optional.of(repaired);
			}
		}
		return Optional.empty();
	}

	@Override
	public String name() {
		return "table-qualification";
	}

	static Optional<String> ambiguousColumn(String errors) {
		Matcher matcher = AMBIGUOUS_NAME.matcher(errors);
		while (matcher.find()) {
			String name = matcher.group(1) != null ? matcher.group(1)
					: matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
			if (name != null && !name.equalsIgnoreCase("column") && !name.equalsIgnoreCase("reference")) {
				return Optional.of(name);
			}
		}
		return Optional.empty();
	}

	private static Map<String, String> qualifiersByTable(QueryReferences references) {
		Map<String, String> qualifiers = new LinkedHashMap<>();
		references.tableAliases().forEach((alias, table) ->
				qualifiers.putIfAbsent(table.toLowerCase(Locale.ROOT), alias));
		return qualifiers;
	}
}
