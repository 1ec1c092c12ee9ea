package org.javai.sqlpilot.correct;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.javai.sqlpilot.catalog.Identifiers;
import org.javai.sqlpilot.catalog.SchemaCatalog;
import org.javai.sqlpilot.sql.SqlText;

/**
 * Repairs references to names the engine does not know.
 *
 * <p>Each name quoted in, or following "identifier"/"column"/"table"/"relation" in, the error text is replaced by
 * the known catalog name it most likely meant: first a match that differs only in case or quoting, then the
 * closest name by edit distance, accepted when the distance is at most a third of the name's length (minimum
 * one, maximum {@value #MAX_DISTANCE}). Ties go to the name declared first.</p>
 */
final class IdentifierNormalization implements CorrectionPattern {

	static final int MAX_DISTANCE = 2;

	private static final List<String> TRIGGERS = List.of(
			"unknown identifier", "invalid identifier", "does not exist", "no such column", "no such table",
			"unknown column", "invalid column name", "invalid object name", "not found");

	private static final Pattern AFTER_KEYWORD = Pattern.compile(
			"(?i)\\b(?:identifier|column|table|relation)\\b[:\\s]+[\"'`]?([A-Za-z_][\\w$.]*)[\"'`]?");

	private static final Pattern QUOTED = Pattern.compile("[\"'`]([A-Za-z_][\\w$.]*)[\"'`]");

	@Override
	public boolean matches(String lowerCaseErrors) {
		return TRIGGERS.stream().anyMatch(lowerCaseErrors::contains);
	}

	@Override
	public Optional<String> apply(String query, String errors, SchemaCatalog context) {
		List<String> known = context.knownNames();
		String repaired = query;
		for (String offending : offendingNames(errors)) {
			if (known.contains(offending)) {
				continue;
			}
			Optional<String> replacement = closest(offending, known);
			if (replacement.isPresent()) {
				repaired = SqlText.replaceIdentifier(repaired, offending, replacement.get());
			}
		}
		return repaired.equals(query) ? Optional.empty() : Optional.of(repaired);
	}

	@Override
	public String name() {
		return "identifier-normalization";
	}

	static Set<String> offendingNames(String errors) {
		Set<String> names = new LinkedHashSet<>();
		collect(AFTER_KEYWORD.matcher(errors), names);
		collect(QUOTED.matcher(errors), names);
		return names;
	}

	private static void collect(Matcher matcher, Set<String> names) {
		while (matcher.find()) {
			String name = Identifiers.lastSegment(matcher.group(1));
			if (name != null && !name.isBlank() && !isNoise(name)) {
				names.add(name);
			}
		}
	}

	private static boolean isNoise(String word) {
		String lower = word.toLowerCase(Locale.ROOT);
		return lower.equals("reference") || lower.equals("name") || lower.equals("does") || lower.equals("is")
				|| lower.equals("not") || lower.equals("the") || lower.equals("in");
	}

	static Optional<String> closest(String offending, List<String> known) {
		for (String name : known) {
			if (name.equalsIgnoreCase(offending)) {
				return Optional.of(name);
			}
		}
		int threshold = Math.min(MAX_DISTANCE, Math.max(1, offending.length() / 3));
		String best = null;
		int bestDistance = Integer.MAX_VALUE;
		for (String name : known) {
			int distance = StringUtils.getLevenshteinDistance(offending.toLowerCase(Locale.ROOT),
					name.toLowerCase(Locale.ROOT), threshold);
			if (distance >= 0 && distance < bestDistance) {
				best = name;
				bestDistance = distance;
			}
		}
		return Optional.ofNullable(best);
	}
}
