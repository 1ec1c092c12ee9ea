package org.javai.sqlpilot.route;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies a question into a {@link ComplexityTier} with a fixed rule set.
 *
 * <ul>
 *   <li>{@code COMPLEX}: more than three relevant tables, nested aggregation, ranking/trend/comparison language,
 *   or two or more time-window conditions.</li>
 *   <li>{@code MODERATE}: two or more relevant tables, join or grouping language, or aggregation keywords.</li>
 *   <li>{@code SIMPLE}: everything else.</li>
 * </ul>
 *
 * <p>The tier only selects the generation profile; it never changes what counts as a correct answer.</p>
 */
public final class ComplexityRouter {

	private static final Logger logger = LoggerFactory.getLogger(ComplexityRouter.class);

	private static final List<Pattern> NESTED_AGGREGATION = List.of(
			Pattern.compile("\\b(average|avg|mean|median|max(imum)?|min(imum)?)\\s+(of\\s+)?(the\\s+)?"
					+ "(total|sum|count|number|average)s?\\b"),
			Pattern.compile("\\b(total|sum|count|number)\\s+of\\s+(the\\s+)?(average|max(imum)?|min(imum)?)\\b"),
			Pattern.compile("\\bper\\b.*\\bper\\b"),
			Pattern.compile("\\btop\\s+\\d+\\b.*\\b(per|for each|in each|by each)\\b"));

	private static final Pattern COMPLEX_KEYWORDS = Pattern.compile(
			"\\b(trend|trends|growth|year over year|yoy|month over month|mom|cohort|retention|percentile|median"
					+ "|rank|ranking|ranked|moving average|rolling|cumulative|running total|correlat\\w*|compare"
					+ "|comparison|versus|vs|share of|percentage of|ratio)\\b");

	private static final Pattern TIME_WINDOW = Pattern.compile(
			"\\b((last|past|previous|this|next)\\s+(\\d+\\s+)?(day|week|month|quarter|year)s?|between\\s+\\S+\\s+and"
					+ "|since|before|after|during|yesterday|today|ytd|mtd|qtd|q[1-4]|(in|of)\\s+(19|20)\\d{2})\\b");

	private static final Pattern JOIN_LANGUAGE = Pattern.compile(
			"\\b(by|per|for each|each|with their|along with|together with|across|join|joined|grouped|group"
					+ "|breakdown|broken down|split by|and their|including)\\b");

	private static final Pattern AGGREGATION = Pattern.compile(
			"\\b(total|sum|count|average|avg|mean|max|maximum|min|minimum|how many|number of|highest|lowest"
					+ "|most|least|top)\\b");

	public ComplexityTier route(String question) {
		return route(question, 1);
	}

	/**
	 * @param question the user's question
	 * @param relevantTables number of tables the question appears to touch
	 */
	public ComplexityTier route(String question, int relevantTables) {
		String text = question == null ? "" : question.toLowerCase(Locale.ROOT);
		ComplexityTier tier = classify(text, relevantTables);
		logger.debug("Routed question to {} ({} relevant tables)", tier, relevantTables);
		return tier;
	}

	private ComplexityTier classify(String text, int relevantTables) {
		if (relevantTables > 3
				|| NESTED_AGGREGATION.stream().anyMatch(p -> p.matcher(text).find())
				|| COMPLEX_KEYWORDS.matcher(text).find()
				|| count(TIME_WINDOW, text) >= 2) {
			return ComplexityTier.COMPLEX;
		}
		if (relevantTables >= 2 || JOIN_LANGUAGE.matcher(text).find() || AGGREGATION.matcher(text).find()) {
			return ComplexityTier.MODERATE;
		}
		return ComplexityTier.SIMPLE;
	}

	private static int count(Pattern pattern, String text) {
		Matcher matcher = pattern.matcher(text);
		int count = 0;
		while (matcher.find()) {
			count++;
		}
		return count;
	}
}
