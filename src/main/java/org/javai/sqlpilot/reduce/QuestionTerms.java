package org.javai.sqlpilot.reduce;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits questions and schema names into comparable lower-case terms.
 *
 * <p>Schema names split on underscores, digits and camel-case boundaries ({@code orderDate}, {@code order_date}
 * both give {@code order}, {@code date}). Plurals are reduced with a naive suffix rule so that "customers"
 * matches {@code customer}.</p>
 */
public final class QuestionTerms {

	private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9]+");
	private static final Pattern CAMEL = Pattern.compile("(?<=[a-z])(?=[A-Z])");

	private static final Set<String> STOPWORDS = Set.of(
			"a", "an", "the", "of", "in", "on", "for", "to", "from", "by", "with", "and", "or", "is", "are", "was",
			"were", "be", "what", "which", "who", "whom", "how", "many", "much", "show", "me", "list", "give", "get",
			"find", "all", "each", "per", "that", "this", "these", "those", "do", "does", "did", "have", "has", "my",
			"our", "their", "there", "it", "its", "at", "as", "than", "then", "between", "into", "over", "top",
			"please", "tell", "i", "we", "you");

	private QuestionTerms() {
		// Utility class
	}

	public static Set<String> ofQuestion(String question) {
		Set<String> terms = new LinkedHashSet<>();
		if (question == null) {
			return terms;
		}
		for (String token : NON_WORD.split(question.toLowerCase(Locale.ROOT))) {
			if (token.length() > 1 && !STOPWORDS.contains(token)) {
				terms.add(stem(token));
			}
		}
		return terms;
	}

	public static Set<String> ofName(String name) {
		Set<String> terms = new LinkedHashSet<>();
		if (name == null) {
			return terms;
		}
		String spaced = CAMEL.matcher(name).replaceAll(" ");
		for (String token : NON_WORD.split(spaced.toLowerCase(Locale.ROOT))) {
			if (token.length() > 1 && !token.chars().allMatch(Character::isDigit)) {
				terms.add(stem(token));
			}
		}
		return terms;
	}

	/**
	 * Lower-cases and whitespace-collapses a question for use as a cache key.
	 */
	public static String fingerprint(String question) {
		return question == null ? "" : question.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
	}

	static String stem(String token) {
		if (token.length() > 4 && token.endsWith("ies")) {
			return token.substring(0, token.length() - 3) + "y";
		}
		if (token.length() > 4 && (token.endsWith("ses") || token.endsWith("xes"))) {
			return token.substring(0, token.length() - 2);
		}
		if (token.length() > 3 && token.endsWith("s") && !token.endsWith("ss")) {
			return token.substring(0, token.length() - 1);
		}
		return token;
	}
}
