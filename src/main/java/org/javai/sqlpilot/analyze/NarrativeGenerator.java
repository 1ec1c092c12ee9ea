package org.javai.sqlpilot.analyze;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.javai.sqlpilot.exec.QueryRows;
import org.javai.sqlpilot.generation.GenerationException;
import org.javai.sqlpilot.generation.GenerationRequest;
import org.javai.sqlpilot.generation.GenerationService;
import org.javai.sqlpilot.generation.PromptTemplates;
import org.javai.sqlpilot.route.ComplexityTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a short plain-language interpretation of a successful result.
 *
 * <p>The model sees the question, the query and the first {@value #SAMPLE_ROWS} rows as JSON. When the model
 * call fails or answers with nothing, a deterministic summary is returned instead, so a narrative is always
 * available.</p>
 */
public final class NarrativeGenerator {

	private static final Logger logger = LoggerFactory.getLogger(NarrativeGenerator.class);

	static final int SAMPLE_ROWS = 10;

	private final GenerationService generation;
	private final ObjectMapper objectMapper;
	private final Duration timeBudget;

	public NarrativeGenerator(GenerationService generation, ObjectMapper objectMapper, Duration timeBudget) {
		this.generation = Objects.requireNonNull(generation, "generation must not be null");
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
		this.timeBudget = Objects.requireNonNull(timeBudget, "timeBudget must not be null");
	}

	public String narrate(String question, String query, QueryRows rows) {
		List<Map<String, Object>> sample = rows.rows().subList(0, Math.min(SAMPLE_ROWS, rows.size()));
		String userPrompt;
		try {
			userPrompt = PromptTemplates.NARRATIVE_TEMPLATE.formatted(question, query, rows.size(), sample.size(),
					objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(sample));
		} catch (JsonProcessingException e) {
			logger.warn("Could not render rows for the narrative prompt: {}", e.getOriginalMessage());
			return summarize(rows);
		}
		try {
			String narrative = generation.generate(new GenerationRequest(PromptTemplates.NARRATIVE_SYSTEM_PROMPT,
					userPrompt, ComplexityTier.SIMPLE, timeBudget));
			if (narrative.isBlank()) {
				return summarize(rows);
			}
			return narrative.trim();
		} catch (GenerationException e) {
			logger.warn("Narrative generation failed, using summary: {}", e.getMessage());
			return summarize(rows);
		}
	}

	/**
	 * Deterministic description of a result.
	 */
	public static String summarize(QueryRows rows) {
		if (rows.isEmpty()) {
			return "The query returned no rows.";
		}
		if (rows.size() == 1) {
			String values = rows.rows().get(0).entrySet().stream()
					.map(e -> e.getKey() + " = " + e.getValue())
					.collect(Collectors.joining(", "));
			return "The query returned 1 row: " + values + ".";
		}
		return "The query returned %d rows with columns %s.".formatted(rows.size(), String.join(", ", rows.columns()));
	}
}
