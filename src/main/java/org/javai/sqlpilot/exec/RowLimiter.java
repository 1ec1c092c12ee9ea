package org.javai.sqlpilot.exec;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Limit;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;

/**
 * Adds a {@code LIMIT} to read queries that have no row limit of their own.
 *
 * <p>A plain SELECT gets the limit attached to its AST. Other SELECT shapes (set operations, parenthesised
 * queries) are wrapped in an outer {@code SELECT * ... LIMIT n}. Queries that already carry a {@code LIMIT},
 * {@code FETCH} or {@code TOP}, and text JSqlParser cannot parse, are returned unchanged.</p>
 */
public final class RowLimiter {

	public String apply(String query, int rowCap) {
		Statement statement;
		try {
			statement = CCJSqlParserUtil.parse(query);
		} catch (JSQLParserException e) {
			return query;
		}
		if (!(statement instanceof Select select)) {
			return query;
		}
		if (hasRowLimit(select)) {
			return query;
		}
		if (select instanceof PlainSelect plain) {
			plain.setLimit(new Limit().withRowCount(new LongValue(rowCap)));
			return plain.toString();
		}
		return "SELECT * FROM (" + stripTrailingSemicolon(query) + ") limited_rows LIMIT " + rowCap;
	}

	private static boolean hasRowLimit(Select select) {
		if (select.getLimit() != null || select.getFetch() != null) {
			return true;
		}
		if (select instanceof PlainSelect plain) {
			return plain.getTop() != null;
		}
		if (select instanceof ParenthesedSelect parenthesed) {
			return parenthesed.getSelect() != null && hasRowLimit(parenthesed.getSelect());
		}
		return false;
	}

	private static String stripTrailingSemicolon(String query) {
		String trimmed = query.trim();
		while (trimmed.endsWith(";")) {
			trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
		}
		return trimmed;
	}
}
