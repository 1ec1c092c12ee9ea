package org.javai.sqlpilot.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical helpers over raw SQL text that respect string literals, quoted identifiers and comments.
 *
 * <p>Used where a full parse is either unavailable (dialect-specific SQL that JSqlParser rejects) or unnecessary:
 * keyword scanning, fingerprint normalisation and identifier substitution.</p>
 */
public final class SqlText {

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");
	private static final Pattern TRAILING_AS = Pattern.compile("(?i)\\bAS\\s*$");

	private SqlText() {
		// Utility class
	}

	public enum Kind {
		CODE,
		STRING_LITERAL,
		QUOTED_IDENTIFIER,
		COMMENT
	}

	public record Segment(Kind kind, String text) {
	}

	/**
	 * Splits SQL into code, literal, quoted-identifier and comment segments. Doubled quote characters inside a
	 * literal or quoted identifier are treated as escapes. An unterminated literal runs to the end of the text.
	 */
	public static List<Segment> segments(String sql) {
		return segments(sql, false);
	}

	/**
	 * Splits SQL as {@link #segments(String)} does. With {@code backslashEscapes} a backslash inside a string
	 * literal or double-quoted text also escapes the next character, as PostgreSQL {@code E''} strings and MySQL
	 * string literals read it.
	 */
	public static List<Segment> segments(String sql, boolean backslashEscapes) {
		List<Segment> segments = new ArrayList<>();
		if (sql == null || sql.isEmpty()) {
			return segments;
		}
		StringBuilder code = new StringBuilder();
		int i = 0;
		int length = sql.length();
		while (i < length) {
			char c = sql.charAt(i);
			if (c == '\'' || c == '"' || c == '`') {
				int end = closingQuote(sql, i, c, backslashEscapes && c != '`');
				flush(segments, code);
				segments.add(new Segment(c == '\'' ? Kind.STRING_LITERAL : Kind.QUOTED_IDENTIFIER,
						sql.substring(i, end)));
				i = end;
			} else if (c == '-' && i + 1 < length && sql.charAt(i + 1) == '-') {
				int end = sql.indexOf('\n', i);
				end = end < 0 ? length : end;
				flush(segments, code);
				segments.add(new Segment(Kind.COMMENT, sql.substring(i, end)));
				i = end;
			} else if (c == '/' && i + 1 < length && sql.charAt(i + 1) == '*') {
				int end = sql.indexOf("*/", i + 2);
				end = end < 0 ? length : end + 2;
				flush(segments, code);
				segments.add(new Segment(Kind.COMMENT, sql.substring(i, end)));
				i = end;
			} else {
				code.append(c);
				i++;
			}
		}
		flush(segments, code);
		return segments;
	}

	/**
	 * Returns the code with literals, quoted identifiers and comments blanked out, for keyword scanning.
	 */
	public static String codeOnly(String sql) {
		return codeOnly(sql, false);
	}

	/**
	 * Returns the code-only text under the given escape reading.
	 */
	public static String codeOnly(String sql, boolean backslashEscapes) {
		StringBuilder sb = new StringBuilder();
		for (Segment segment : segments(sql, backslashEscapes)) {
			sb.append(segment.kind() == Kind.CODE ? segment.text() : " ");
		}
		return sb.toString();
	}

	/**
	 * Normalises cosmetic differences: comments are dropped and, outside literals and quoted identifiers,
	 * whitespace runs collapse to one space and letters are lower-cased. Trailing semicolons are removed.
	 */
	public static String normalize(String sql) {
		StringBuilder sb = new StringBuilder();
		for (Segment segment : segments(sql)) {
			switch (segment.kind()) {
				case CODE -> sb.append(WHITESPACE.matcher(segment.text()).replaceAll(" ").toLowerCase(Locale.ROOT));
				case COMMENT -> sb.append(' ');
				default -> sb.append(segment.text());
			}
		}
		String normalized = WHITESPACE.matcher(sb).replaceAll(" ").trim();
		while (normalized.endsWith(";")) {
			normalized = normalized.substring(0, normalized.length() - 1).trim();
		}
		return normalized;
	}

	/**
	 * Replaces whole-word occurrences of an identifier outside string literals. A quoted identifier whose
	 * content matches (ignoring case) is replaced as a whole, quotes included.
	 */
	public static String replaceIdentifier(String sql, String identifier, String replacement) {
		Pattern word = Pattern.compile("(?i)(?<![\\w$])" + Pattern.quote(identifier) + "(?![\\w$])");
		StringBuilder sb = new StringBuilder();
		for (Segment segment : segments(sql)) {
			switch (segment.kind()) {
				case CODE -> sb.append(word.matcher(segment.text()).replaceAll(Matcher.quoteReplacement(replacement)));
				case QUOTED_IDENTIFIER -> {
					String inner = segment.text().substring(1, Math.max(1, segment.text().length() - 1));
					sb.append(inner.equalsIgnoreCase(identifier) ? replacement : segment.text());
				}
				default -> sb.append(segment.text());
			}
		}
		return sb.toString();
	}

	/**
	 * Prefixes unqualified occurrences of a column with {@code qualifier.}. Occurrences that are already
	 * qualified, are followed by a dot or a parenthesis, or name an alias after {@code AS} are left alone.
	 */
	public static String qualifyColumn(String sql, String column, String qualifier) {
		Pattern word = Pattern.compile("(?i)(?<![\\w$.])" + Pattern.quote(column) + "(?![\\w$.(])");
		StringBuilder sb = new StringBuilder();
		for (Segment segment : segments(sql)) {
			if (segment.kind() != Kind.CODE) {
				sb.append(segment.text());
				continue;
			}
			String text = segment.text();
			Matcher matcher = word.matcher(text);
			int last = 0;
			while (matcher.find()) {
				String before = text.substring(0, matcher.start());
				sb.append(text, last, matcher.start());
				if (TRAILING_AS.matcher(before).find()) {
					sb.append(matcher.group());
				} else {
					sb.append(qualifier).append('.').append(matcher.group());
				}
				last = matcher.end();
			}
			sb.append(text.substring(last));
		}
		return sb.toString();
	}

	private static int closingQuote(String sql, int start, char quote, boolean backslashEscapes) {
		int i = start + 1;
		while (i < sql.length()) {
			if (backslashEscapes && sql.charAt(i) == '\\') {
				i += 2;
				continue;
			}
			if (sql.charAt(i) == quote) {
				if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
					i += 2;
					continue;
				}
				return i + 1;
			}
			i++;
		}
		return Math.min(i, sql.length());
	}

	private static void flush(List<Segment> segments, StringBuilder code) {
		if (code.length() > 0) {
			segments.add(new Segment(Kind.CODE, code.toString()));
			code.setLength(0);
		}
	}
}
