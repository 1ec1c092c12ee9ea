package org.javai.sqlpilot.sql;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the table names a query reads from without parsing it, for SQL in dialects JSqlParser rejects.
 *
 * <p>A name counts when it follows {@code JOIN}, or follows {@code FROM} at a parenthesis level that has already
 * seen a {@code SELECT} (so {@code EXTRACT(YEAR FROM d)} is ignored). Comma-separated {@code FROM} lists are
 * followed. Names followed by a parenthesis are table functions and are skipped, as are CTE names.</p>
 */
public final class TableMentions {

	private static final Pattern TOKEN = Pattern.compile("[A-Za-z_][\\w$]*(?:\\.[A-Za-z_][\\w$]*)*|[(),]|\\S");
	private static final Pattern NON_WORD = Pattern.compile("[^\\w$.]");

	private static final Set<String> CLAUSE_WORDS = Set.of(
			"where", "group", "order", "having", "limit", "offset", "fetch", "join", "inner", "left", "right",
			"full", "outer", "cross", "natural", "on", "using", "union", "intersect", "except", "minus", "qualify",
			"window", "lateral", "tablesample", "pivot", "unpivot", "for", "as", "select", "from", "with");

	private TableMentions() {
		// Utility class
	}

	/**
	 * @return the referenced table names in order of first appearance, without duplicates
	 */
	public static List<String> of(String sql) {
		List<String> tokens = tokens(sql);
		Set<String> cteNames = cteNames(tokens);
		Set<String> tables = new LinkedHashSet<>();
		Deque<Boolean> selectSeen = new ArrayDeque<>();
		selectSeen.push(Boolean.FALSE);
		for (int i = 0; i < tokens.size(); i++) {
			String token = tokens.get(i);
			String lower = token.toLowerCase(Locale.ROOT);
			if (token.equals("(")) {
				selectSeen.push(Boolean.FALSE);
			} else if (token.equals(")")) {
				if (selectSeen.size() > 1) {
					selectSeen.pop();
				}
			} else if (lower.equals("select")) {
				selectSeen.pop();
				selectSeen.push(Boolean.TRUE);
			} else if (lower.equals("join")) {
				i = readTables(tokens, i + 1, false, tables);
			} else if (lower.equals("from") && selectSeen.peek() && !previousIs(tokens, i, "distinct")) {
				i = readTables(tokens, i + 1, true, tables);
			}
		}
		List<String> result = new ArrayList<>();
		for (String table : tables) {
			if (!cteNames.contains(table.toLowerCase(Locale.ROOT))) {
				result.add(table);
			}
		}
		return result;
	}

	private static int readTables(List<String> tokens, int start, boolean list, Set<String> tables) {
		int i = start;
		while (i < tokens.size()) {
			if (isKeyword(tokens.get(i), "only") || isKeyword(tokens.get(i), "lateral")) {
				i++;
				continue;
			}
			String name = tokens.get(i);
			if (!isWord(name) || CLAUSE_WORDS.contains(name.toLowerCase(Locale.ROOT))) {
				return i - 1;
			}
			i++;
			if (i < tokens.size() && tokens.get(i).equals("(")) {
				return i - 1;
			}
			tables.add(name);
			if (i < tokens.size() && isKeyword(tokens.get(i), "as")) {
				i += 2;
			} else if (i < tokens.size() && isWord(tokens.get(i))
					&& !CLAUSE_WORDS.contains(tokens.get(i).toLowerCase(Locale.ROOT))) {
				i++;
			}
			if (!list || i >= tokens.size() || !tokens.get(i).equals(",")) {
				return i - 1;
			}
			i++;
		}
		return i - 1;
	}

	private static Set<String> cteNames(List<String> tokens) {
		Set<String> names = new LinkedHashSet<>();
		for (int i = 1; i + 1 < tokens.size(); i++) {
			if (!isKeyword(tokens.get(i), "as") || !tokens.get(i + 1).equals("(")) {
				continue;
			}
			int before = i - 1;
			if (tokens.get(before).equals(")")) {
				int depth = 0;
				while (before >= 0) {
					String token = tokens.get(before);
					if (token.equals(")")) {
						depth++;
					} else if (token.equals("(") && --depth == 0) {
						break;
					}
					before--;
				}
				before--;
			}
			if (before >= 0 && isWord(tokens.get(before))) {
				names.add(tokens.get(before).toLowerCase(Locale.ROOT));
			}
		}
		return names;
	}

	private static List<String> tokens(String sql) {
		StringBuilder text = new StringBuilder();
		for (SqlText.Segment segment : SqlText.segments(sql)) {
			switch (segment.kind()) {
				case CODE -> text.append(segment.text());
				case QUOTED_IDENTIFIER -> {
					String inner = segment.text().substring(1, Math.max(1, segment.text().length() - 1));
					text.append(' ').append(NON_WORD.matcher(inner).replaceAll("_")).append(' ');
				}
				case STRING_LITERAL -> text.append(" ? ");
				default -> text.append(' ');
			}
		}
		List<String> tokens = new ArrayList<>();
		Matcher matcher = TOKEN.matcher(text);
		while (matcher.find()) {
			tokens.add(matcher.group());
		}
		return tokens;
	}

	private static boolean previousIs(List<String> tokens, int index, String keyword) {
		return index > 0 && isKeyword(tokens.get(index - 1), keyword);
	}

	private static boolean isKeyword(String token, String keyword) {
		return token.equalsIgnoreCase(keyword);
	}

	private static boolean isWord(String token) {
		char first = token.charAt(0);
		return Character.isLetter(first) || first == '_';
	}
}
