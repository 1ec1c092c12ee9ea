package org.javai.sqlpilot.generation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.StringJoiner;
import org.javai.sqlpilot.catalog.CatalogColumn;
import org.javai.sqlpilot.catalog.CatalogTable;
import org.javai.sqlpilot.catalog.Relationship;
import org.javai.sqlpilot.catalog.SchemaCatalog;
import org.javai.sqlpilot.reduce.QuestionTerms;

/**
 * Renders a reduced catalog as prompt text.
 *
 * <p>Tables with more columns than the per-table cap are compressed to their essential columns: key columns,
 * role-tagged columns and columns sharing a term with the question, in declaration order. Relationships render
 * as join hints.</p>
 */
public final class SchemaPromptRenderer {

	private static final String SQL_CATALOG_FOOTER = """

			🔴 CRITICAL: SQL table/column names MUST be taken from this catalog exactly as shown.
			- Use the table NAME shown before the colon, NOT the user's informal terms
			- Use the column NAME shown after the bullet, NOT invented names
			- For JOINs, use the RELATIONSHIPS listed above
			- If a name doesn't appear in this catalog, DON'T use it in SQL
			""";

	private final int maxColumnsPerTable;

	public SchemaPromptRenderer(int maxColumnsPerTable) {
		if (maxColumnsPerTable < 1) {
			throw new IllegalArgumentException("maxColumnsPerTable must be >= 1");
		}
		this.maxColumnsPerTable = maxColumnsPerTable;
	}

	public String render(SchemaCatalog catalog, String question) {
		Set<String> terms = QuestionTerms.ofQuestion(question);
		StringBuilder sb = new StringBuilder("SQL CATALOG:\n");
		for (CatalogTable table : catalog.tables()) {
			sb.append("- ").append(table.name());
			if (table.alias() != null && !table.alias().isBlank() && !table.alias().equalsIgnoreCase(table.name())) {
				sb.append(" (aka: ").append(table.alias()).append(")");
			}
			if (table.description() != null && !table.description().isBlank()) {
				sb.append(": ").append(table.description());
			}
			sb.append("\n");
			List<CatalogColumn> shown = essentialColumns(table, terms);
			for (CatalogColumn column : shown) {
				sb.append("  • ").append(column.name());
				StringJoiner details = new StringJoiner("; ");
				if (column.type() != null && !column.type().isBlank()) {
					details.add("type=" + column.type());
				}
				if (column.role().isEssential()) {
					details.add("role=" + column.role().name().toLowerCase(Locale.ROOT));
				}
				if (column.primaryKey()) {
					details.add("pk");
				}
				if (column.foreignKey()) {
					details.add("fk:" + column.references());
				}
				if (column.description() != null && !column.description().isBlank()) {
					details.add(column.description());
				}
				if (details.length() > 0) {
					sb.append(" (").append(details).append(")");
				}
				sb.append("\n");
			}
			int omitted = table.columns().size() - shown.size();
			if (omitted > 0) {
				sb.append("  • (").append(omitted).append(" more columns not relevant to this question)\n");
			}
		}
		if (!catalog.relationships().isEmpty()) {
			sb.append("RELATIONSHIPS:\n");
			for (Relationship relationship : catalog.relationships()) {
				sb.append("- ").append(relationship.joinHint())
						.append(" (").append(relationship.cardinality()).append(")\n");
			}
		}
		sb.append(SQL_CATALOG_FOOTER);
		return sb.toString().trim();
	}

	List<CatalogColumn> essentialColumns(CatalogTable table, Set<String> terms) {
		List<CatalogColumn> columns = table.columns();
		if (columns.size() <= maxColumnsPerTable) {
			return columns;
		}
		List<CatalogColumn> essential = new ArrayList<>();
		for (CatalogColumn column : columns) {
			if (essential.size() >= maxColumnsPerTable) {
				break;
			}
			boolean mentioned = QuestionTerms.ofName(column.name()).stream().anyMatch(terms::contains);
			if (mentioned || column.primaryKey() || column.foreignKey() || column.role().isEssential()) {
				essential.add(column);
			}
		}
		if (essential.isEmpty()) {
			return columns.subList(0, maxColumnsPerTable);
		}
		return essential;
	}
}
