package org.javai.sqlpilot.exec;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import org.javai.sqlpilot.sql.SqlText;

/**
 * Rejects anything that is not a single read-only query.
 *
 * <p>The lexical checks (write and DDL verbs, statement separators) run twice: once reading quotes the standard
 * way and once treating a backslash inside a literal as an escape, since engines differ on this. Text on which the
 * two readings disagree is refused outright. The text must then parse as exactly one SELECT without an
 * {@code INTO} target. Text JSqlParser cannot parse is passed through only when it lexically starts as a query,
 * so the engine can report its own syntax error.</p>
 */
public final class ReadOnlyGuard {

	private static final Pattern FORBIDDEN_VERB = Pattern.compile(
			"(?i)(?<![\\w$])(INSERT|UPDATE|DELETE|DROP|CREATE|ALTER|TRUNCATE|MERGE|GRANT|REVOKE|UPSERT|EXEC|EXECUTE"
					+ "|CALL|COPY|RENAME|REPLACE\\s+INTO|ATTACH|DETACH|VACUUM)(?![\\w$])");

	private static final Pattern STATEMENT_SEPARATOR = Pattern.compile(";\\s*\\S");

	private static final Pattern QUERY_START = Pattern.compile("(?i)^[\\s(]*(SELECT|WITH)(?![\\w$])");

	/**
	 * @return a description of the violation, or empty if the query is a pure read
	 */
	public Optional<String> violation(String query) {
		if (query == null || query.isBlank()) {
			return Optional.empty();
		}
		String standard = SqlText.codeOnly(query, false);
		String escaped = SqlText.codeOnly(query, true);
		for (String code : new String[] { standard, escaped }) {
			Optional<String> lexical = lexicalViolation(code);
			if (lexical.isPresent()) {
				return lexical;
			}
		}
		if (!standard.equals(escaped)) {
			return Optional.of("forbidden operation: ambiguous string literal escaping");
		}
		Statements statements;
		try {
			statements = CCJSqlParserUtil.parseStatements(query);
		} catch (JSQLParserException e) {
			if (QUERY_START.matcher(standard).find()) {
				return Optional.empty();
			}
			return Optional.of("forbidden operation: statement is not recognisable as a query");
		}
		if (statements == null || statements.size() != 1) {
			return Optional.of("forbidden operation: multiple statements");
		}
		Statement statement = statements.get(0);
		if (!(statement instanceof Select select)) {
			return Optional.of("forbidden operation: only SELECT statements are allowed, got "
					+ statement.getClass().getSimpleName());
		}
		if (select instanceof PlainSelect plain && plain.getIntoTables() != null && !plain.getIntoTables().isEmpty()) {
			return Optional.of("forbidden operation: SELECT INTO");
		}
		return Optional.empty();
	}

	private static Optional<String> lexicalViolation(String code) {
		Matcher verb = FORBIDDEN_VERB.matcher(code);
		if (verb.find()) {
			return Optional.of("forbidden operation: " + verb.group(1).toUpperCase(Locale.ROOT).replaceAll("\\s+", " "));
		}
		if (STATEMENT_SEPARATOR.matcher(code.trim()).find()) {
			return Optional.of("forbidden operation: multiple statements");
		}
		return Optional.empty();
	}
}
