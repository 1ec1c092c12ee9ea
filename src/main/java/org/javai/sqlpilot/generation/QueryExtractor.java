package org.javai.sqlpilot.generation;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a single SQL statement out of a model response.
 *
 * <p>A fenced code block wins if there is one. Otherwise the statement starts at the first line that opens with a
 * statement keyword and runs to the next blank line. A trailing semicolon is dropped; text after an inner semicolon
 * is kept so that the executor sees, and refuses, a second statement. Responses without a statement line
 * (refusals, explanations) yield nothing. Write statements are extracted like any other so that the executor can
 * refuse them.</p>
 */
public final class QueryExtractor {

	private static final Pattern FENCED_BLOCK = Pattern.compile("```[a-zA-Z]*\\s*\\n?(.*?)```", Pattern.DOTALL);

	private static final Pattern STATEMENT_START = Pattern.compile(
			"(?im)^\\s*(?:(?:sql|query)\\s*:\\s*)?((?:SELECT|WITH|INSERT|UPDATE|DELETE|DROP|CREATE|ALTER|TRUNCATE"
					+ "|MERGE|GRANT|REVOKE|UPSERT|EXEC|EXECUTE|CALL|REPLACE)\\b.*)$");

	private static final Pattern BLANK_LINE = Pattern.compile("\\n\\s*\\n");

	public Optional<String> extract(String response) {
		if (response == null || response.isBlank()) {
			return Optional.empty();
		}
		String trimmed = response.trim();

		Matcher fenced = FENCED_BLOCK.matcher(trimmed);
		if (fenced.find()) {
			return clean(fenced.group(1));
		}

		Matcher start = STATEMENT_START.matcher(trimmed);
		if (!start.find()) {
			return Optional.empty();
		}
		String rest = trimmed.substring(start.start(1));
		Matcher blank = BLANK_LINE.matcher(rest);
		if (blank.find()) {
			rest = rest.substring(0, blank.start());
		}
		return clean(rest);
	}

	private static Optional<String> clean(String candidate) {
		String statement = candidate.trim();
		int semicolon = statement.indexOf(';');
		if (semicolon >= 0 && statement.substring(semicolon + 1).isBlank()) {
			statement = statement.substring(0, semicolon).trim();
		}
		return statement.isEmpty() ? Optional.empty() : Optional.of(statement);
	}
}
