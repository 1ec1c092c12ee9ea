package org.javai.sqlpilot.synth;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.javai.sqlpilot.catalog.CatalogTable;
import org.javai.sqlpilot.catalog.SchemaCatalog;
import org.javai.sqlpilot.sql.QueryReferences;
import org.javai.sqlpilot.sql.TableMentions;

/**
 * Checks that a query only names tables and columns present in a reduced context.
 *
 * <p>Qualified columns are checked against the table their qualifier resolves to; qualifiers that resolve to
 * nothing in the catalog (subquery or CTE aliases) are not checked. Unqualified columns must exist in one of the
 * query's catalog tables unless they name a value the query derives itself.</p>
 *
 * <p>Text JSqlParser cannot parse is checked lexically by the tables it reads from. If no table can be found the
 * query is reported as unverified, which keeps it below any success threshold.</p>
 */
public final class IdentifierGrounding {

	public GroundingReport check(String query, SchemaCatalog context) {
		Optional<QueryReferences> parsed = QueryReferences.of(query);
		if (parsed.isEmpty()) {
			return checkTablesOnly(query, context);
		}
		QueryReferences references = parsed.get();

		List<String> unknownTables = new ArrayList<>();
		List<CatalogTable> queryTables = new ArrayList<>();
		for (String table : references.tables()) {
			Optional<CatalogTable> known = context.findTable(table);
			if (known.isPresent()) {
				queryTables.add(known.get());
			} else {
				unknownTables.add(table);
			}
		}

		List<String> unknownColumns = new ArrayList<>();
		for (QueryReferences.ColumnReference column : references.columns()) {
			if (column.qualified()) {
				Optional<CatalogTable> owner = references.resolveQualifier(column.qualifier())
						.flatMap(context::findTable);
				if (owner.isPresent() && owner.get().findColumn(column.name()).isEmpty()
						&& !unknownColumns.contains(column.name())) {
					unknownColumns.add(column.name());
				}
			} else if (!references.isDerived(column.name())
					&& !queryTables.isEmpty()
					&& queryTables.stream().noneMatch(t -> t.findColumn(column.name()).isPresent())
					&& !unknownColumns.contains(column.name())) {
				unknownColumns.add(column.name());
			}
		}
		return GroundingReport.parsed(unknownTables, unknownColumns);
	}

	private static GroundingReport checkTablesOnly(String query, SchemaCatalog context) {
		List<String> tables = TableMentions.of(query);
		if (tables.isEmpty()) {
			return GroundingReport.unverified();
		}
		List<String> unknownTables = tables.stream().filter(table -> context.findTable(table).isEmpty()).toList();
		return GroundingReport.tablesOnly(unknownTables);
	}
}
