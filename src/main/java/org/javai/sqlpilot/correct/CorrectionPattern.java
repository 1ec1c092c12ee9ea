package org.javai.sqlpilot.correct;

import java.util.Optional;
import org.javai.sqlpilot.catalog.SchemaCatalog;

/**
 * A deterministic repair keyed by substrings of an error message.
 */
public interface CorrectionPattern {

	/**
	 * @param lowerCaseErrors all error text of the failed round, lower-cased
	 */
	boolean matches(String lowerCaseErrors);

	/**
	 * @param query the failing query
	 * @param errors all error text of the failed round, original case
	 * @param context the reduced catalog the query must conform to
	 * @return the repaired query, or empty if this pattern cannot repair it
	 */
	Optional<String> apply(String query, String errors, SchemaCatalog context);

	String name();
}
