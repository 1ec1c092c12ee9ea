package org.javai.sqlpilot.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.javai.sqlpilot.catalog.Identifiers;

/**
 * The tables, table aliases, columns and derived names a SELECT statement refers to.
 *
 * <p>Table names are reported without schema qualification. Columns keep their qualifier (table name or alias)
 * when the query gives one. Derived names are aliases introduced with {@code AS} anywhere in the query; an
 * unqualified column matching one of them refers to the derived value, not to the catalog.</p>
 *
 * @param tables referenced table names (CTE names excluded)
 * @param tableAliases alias to table name, lower-cased keys
 * @param columns referenced columns in order of appearance
 * @param derivedNames lower-cased aliases introduced by the query
 */
public record QueryReferences(
		Set<String> tables,
		Map<String, String> tableAliases,
		List<ColumnReference> columns,
		Set<String> derivedNames
) {

	private static final Pattern AS_ALIAS = Pattern.compile("(?i)\\bAS\\s+([\"`]?)([A-Za-z_][\\w$]*)\\1");

	/** Names JSqlParser may surface as columns that are really literals or niladic functions. */
	private static final Set<String> PSEUDO_COLUMNS = Set.of(
			"true", "false", "null", "current_date", "current_time", "current_timestamp", "localtime",
			"localtimestamp", "sysdate", "current_user", "session_user");

	/**
	 * A column as written in the query.
	 *
	 * @param qualifier table name or alias, or null if unqualified
	 * @param name unquoted column name
	 */
	public record ColumnReference(String qualifier, String name) {
		public boolean qualified() {
			return qualifier != null;
		}
	}

	public QueryReferences {
		tables = Collections.unmodifiableSet(new LinkedHashSet<>(tables));
		tableAliases = Collections.unmodifiableMap(new LinkedHashMap<>(tableAliases));
		columns = List.copyOf(columns);
		derivedNames = Set.copyOf(derivedNames);
	}

	/**
	 * Parses a SELECT statement.
	 *
	 * @return the references, or empty if the text is not a SELECT JSqlParser can parse
	 */
	public static Optional<QueryReferences> of(String sql) {
		if (sql == null || sql.isBlank()) {
			return Optional.empty();
		}
		Statement statement;
		try {
			statement = CCJSqlParserUtil.parse(sql);
		} catch (JSQLParserException e) {
			return Optional.empty();
		}
		if (!(statement instanceof Select)) {
			return Optional.empty();
		}
		ReferenceCollector collector = new ReferenceCollector();
		Set<String> rawTables;
		try {
			rawTables = collector.getTables(statement);
		} catch (UnsupportedOperationException e) {
			// the finder rejects some vendor constructs; treat like an unparseable query
			return Optional.empty();
		}
		Set<String> tables = new LinkedHashSet<>();
		for (String table : rawTables) {
			tables.add(Identifiers.lastSegment(table));
		}
		return Optional.of(new QueryReferences(tables, collector.aliases, collector.columns, derivedNames(sql)));
	}

	/**
	 * Resolves a qualifier to a table name using the query's aliases.
	 */
	public Optional<String> resolveQualifier(String qualifier) {
		if (qualifier == null) {
			return Optional.empty();
		}
		String bare = Identifiers.lastSegment(qualifier);
		String aliased = tableAliases.get(bare.toLowerCase(Locale.ROOT));
		if (aliased != null) {
			return Optional.of(aliased);
		}
		return tables.stream().filter(t -> t.equalsIgnoreCase(bare)).findFirst();
	}

	public boolean isDerived(String name) {
		return name != null && derivedNames.contains(name.toLowerCase(Locale.ROOT));
	}

	private static Set<String> derivedNames(String sql) {
		Set<String> names = new LinkedHashSet<>();
		Matcher matcher = AS_ALIAS.matcher(SqlText.codeOnly(sql.replace('"', ' ').replace('`', ' ')));
		while (matcher.find()) {
			names.add(matcher.group(2).toLowerCase(Locale.ROOT));
		}
		return names;
	}

	/**
	 * Collects table aliases and column references while {@link TablesNamesFinder} walks the statement.
	 */
	private static final class ReferenceCollector extends TablesNamesFinder {

		private final Map<String, String> aliases = new LinkedHashMap<>();
		private final List<ColumnReference> columns = new ArrayList<>();

		@Override
		public void visit(Table table) {
			if (table.getAlias() != null && table.getName() != null) {
				aliases.put(Identifiers.unquote(table.getAlias().getName()).toLowerCase(Locale.ROOT),
						Identifiers.lastSegment(table.getName()));
			}
			super.visit(table);
		}

		@Override
		public void visit(Column column) {
			String name = Identifiers.unquote(column.getColumnName());
			if (name == null || PSEUDO_COLUMNS.contains(name.toLowerCase(Locale.ROOT))) {
				return;
			}
			Table table = column.getTable();
			String qualifier = table != null && table.getName() != null
					? Identifiers.unquote(table.getName())
					: null;
			columns.add(new ColumnReference(qualifier, name));
		}
	}
}
