package org.javai.sqlpilot.analyze;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.lang3.math.NumberUtils;
import org.javai.sqlpilot.config.ConfidencePolicy;
import org.javai.sqlpilot.exec.QueryRows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads correctness signals from an executed result and adjusts the candidate's confidence.
 *
 * <ul>
 *   <li>No rows, or a single row of nothing but nulls: confidence is capped at the empty-result cap and a
 *   "check filter conditions" suggestion is emitted.</li>
 *   <li>One row of at most {@value #MAX_AGGREGATE_COLUMNS} columns, all numeric: the aggregate boost is added; a
 *   candidate that already met the success threshold is lifted to at least the aggregate floor.</li>
 *   <li>As many rows as the row cap: confidence is left alone and a truncation suggestion is emitted.</li>
 *   <li>A negative value in a column named like a count is reported as an error.</li>
 * </ul>
 *
 * <p>The analyzer only annotates; it never touches the query or the data source.</p>
 */
public final class ResultAnalyzer {

	private static final Logger logger = LoggerFactory.getLogger(ResultAnalyzer.class);

	static final int MAX_AGGREGATE_COLUMNS = 3;

	public static final String CHECK_FILTERS = "check filter conditions";

	private final ConfidencePolicy policy;
	private final int rowCap;

	public ResultAnalyzer(ConfidencePolicy policy, int rowCap) {
		this.policy = Objects.requireNonNull(policy, "policy must not be null");
		this.rowCap = rowCap;
	}

	/**
	 * @param confidence the candidate's confidence before analysis
	 */
	public Analysis analyze(String question, String query, QueryRows rows, double confidence) {
		List<String> suggestions = new ArrayList<>();
		List<String> errors = new ArrayList<>();
		double adjusted = confidence;

		if (rows.isEmpty() || allNull(rows)) {
			adjusted = Math.min(adjusted, policy.emptyResultCap());
			suggestions.add(CHECK_FILTERS);
			if (!rows.isEmpty()) {
				suggestions.add("aggregate over no matching rows returned null");
			}
		} else if (isAggregateShaped(rows)) {
			double boosted = Math.min(1.0, adjusted + policy.aggregateBoost());
			if (confidence >= policy.successThreshold()) {
				boosted = Math.max(boosted, policy.aggregateFloor());
			}
			adjusted = boosted;
		} else if (rows.size() >= rowCap) {
			suggestions.add("result truncated at the row cap of %d rows; consider aggregating or filtering"
					.formatted(rowCap));
		}

		errors.addAll(sanityErrors(rows));
		logger.debug("Analyzed {} rows for '{}': confidence {} -> {}", rows.size(), question, confidence, adjusted);
		return new Analysis(adjusted, suggestions, errors);
	}

	static boolean isAggregateShaped(QueryRows rows) {
		if (rows.size() != 1) {
			return false;
		}
		Map<String, Object> row = rows.rows().get(0);
		if (row.isEmpty() || row.size() > MAX_AGGREGATE_COLUMNS) {
			return false;
		}
		return row.values().stream().allMatch(ResultAnalyzer::isNumeric);
	}

	private static boolean isNumeric(Object value) {
		if (value instanceof Number) {
			return true;
		}
		return value instanceof String text && NumberUtils.isCreatable(text.trim());
	}

	private static boolean allNull(QueryRows rows) {
		return rows.size() == 1 && rows.rows().get(0).values().stream().allMatch(Objects::isNull);
	}

	private static List<String> sanityErrors(QueryRows rows) {
		List<String> errors = new ArrayList<>();
		for (String column : rows.columns()) {
			if (!column.toLowerCase(Locale.ROOT).contains("count")) {
				continue;
			}
			boolean negative = rows.rows().stream()
					.map(row -> row.get(column))
					.anyMatch(value -> value instanceof Number number && number.doubleValue() < 0);
			if (negative) {
				errors.add("column %s holds a negative count".formatted(column));
			}
		}
		return errors;
	}
}
