package org.javai.sqlpilot.generation;

import org.javai.sqlpilot.route.ComplexityTier;

/**
 * Prompt text sent to the generation service.
 */
public final class PromptTemplates {

	private PromptTemplates() {
		// Utility class
	}

	public static final String SQL_SYSTEM_PROMPT = """
			You are an expert SQL analyst. You translate business questions into a single SQL query.

			RULES:
			- Produce exactly one read-only SELECT statement (a WITH clause is allowed). Never modify data or schema.
			- Use only the tables, columns and joins listed in the SQL CATALOG. Do not invent names.
			- Qualify columns with their table name or alias whenever more than one table is involved.
			- Quote identifiers with double quotes only when they contain spaces or clash with keywords.
			- Use single quotes for string literals.
			- Give aggregate columns a descriptive alias.
			- Return the query inside a ```sql fenced block and nothing else.
			""";

	private static final String SIMPLE_GUIDANCE = """
			This is a simple question: read from a single table and avoid joins unless the question needs them.
			""";

	private static final String MODERATE_GUIDANCE = """
			This question needs aggregation or joins: join only along the listed relationships and group by every
			non-aggregated column.
			""";

	private static final String COMPLEX_GUIDANCE = """
			This is a complex question: break it into common table expressions where that helps readability. Window
			functions are allowed. Keep time-window conditions explicit.
			""";

	public static final String REPAIR_TEMPLATE = """
			The previous query for this question failed.

			QUESTION:
			%s

			PREVIOUS FAILED QUERY:
			%s

			ERROR MESSAGE:
			%s

			%s
			Write a corrected query that answers the question and avoids the error.
			""";

	public static final String REGENERATE_TEMPLATE = """
			A previous attempt to answer this question produced no usable query.

			QUESTION:
			%s

			ERRORS:
			%s

			Write a query that answers the question.
			""";

	public static final String NARRATIVE_SYSTEM_PROMPT = """
			You are a data analyst explaining query results to a business user. Answer in two or three plain
			sentences. Mention the key figures. Do not describe the SQL.
			""";

	public static final String NARRATIVE_TEMPLATE = """
			QUESTION:
			%s

			QUERY:
			%s

			RESULT (%d rows, first %d shown):
			%s
			""";

	public static String systemPrompt(ComplexityTier tier) {
		return SQL_SYSTEM_PROMPT + "\n" + guidance(tier);
	}

	public static String guidance(ComplexityTier tier) {
		return switch (tier) {
			case SIMPLE -> SIMPLE_GUIDANCE;
			case MODERATE -> MODERATE_GUIDANCE;
			case COMPLEX -> COMPLEX_GUIDANCE;
		};
	}
}
