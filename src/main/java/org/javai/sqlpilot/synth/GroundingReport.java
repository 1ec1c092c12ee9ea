package org.javai.sqlpilot.synth;

import java.util.ArrayList;
import java.util.List;
import org.javai.sqlpilot.config.ConfidencePolicy;

/**
 * Outcome of checking a query's identifiers against a reduced context.
 *
 * @param parsed whether the query could be parsed locally; for unparsed queries only table names are checked
 * @param verified whether any check could run at all; an unparsed query naming no recognisable table is not
 * @param unknownTables referenced tables absent from the context
 * @param unknownColumns referenced columns absent from the context
 */
public record GroundingReport(boolean parsed, boolean verified, List<String> unknownTables,
		List<String> unknownColumns) {

	static final String UNVERIFIED = "query could not be checked against the schema";

	public GroundingReport {
		unknownTables = unknownTables != null ? List.copyOf(unknownTables) : List.of();
		unknownColumns = unknownColumns != null ? List.copyOf(unknownColumns) : List.of();
	}

	public static GroundingReport parsed(List<String> unknownTables, List<String> unknownColumns) {
		return new GroundingReport(true, true, unknownTables, unknownColumns);
	}

	/**
	 * Report for text that could not be parsed, checked by table names alone.
	 */
	public static GroundingReport tablesOnly(List<String> unknownTables) {
		return new GroundingReport(false, true, unknownTables, List.of());
	}

	public static GroundingReport unverified() {
		return new GroundingReport(false, false, List.of(), List.of());
	}

	public boolean grounded() {
		return verified && unknownTables.isEmpty() && unknownColumns.isEmpty();
	}

	/**
	 * One "uses unknown identifier" message per unknown name, or a single message when nothing could be checked.
	 */
	public List<String> errors() {
		List<String> errors = new ArrayList<>();
		if (!verified) {
			errors.add(UNVERIFIED);
		}
		unknownTables.forEach(t -> errors.add("uses unknown identifier " + t + " (table)"));
		unknownColumns.forEach(c -> errors.add("uses unknown identifier " + c));
		return errors;
	}

	/**
	 * Structural confidence of a candidate: forced low when ungrounded or unverified, slightly reduced when only
	 * the table names could be checked.
	 */
	public double confidence(ConfidencePolicy policy) {
		if (!grounded()) {
			return policy.ungroundedCap();
		}
		if (!parsed) {
			return Math.max(0.0, policy.groundedBase() - ConfidencePolicy.UNPARSED_PENALTY);
		}
		return policy.groundedBase();
	}
}
