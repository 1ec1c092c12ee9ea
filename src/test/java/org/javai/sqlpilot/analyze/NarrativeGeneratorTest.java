package org.javai.sqlpilot.analyze;

import static org.assertj.core.api.Assertions.assertThat;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.javai.sqlpilot.exec.QueryRows;
import org.javai.sqlpilot.generation.GenerationRequest;
import org.javai.sqlpilot.generation.PromptTemplates;
import org.javai.sqlpilot.testsupport.PipelineLogCaptor;
import org.javai.sqlpilot.testsupport.RecordingDataSource;
import org.javai.sqlpilot.testsupport.ScriptedGenerationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NarrativeGenerator")
class NarrativeGeneratorTest {

	private static final String QUERY = "SELECT SUM(amount) AS total FROM orders";

	private final ScriptedGenerationService generation = ScriptedGenerationService.responding();

	private NarrativeGenerator narrator() {
		return new NarrativeGenerator(generation, new ObjectMapper(), Duration.ofSeconds(5));
	}

	@Test
	@DisplayName("returns the model's interpretation")
	void modelNarrative() {
		String narrative = narrator().narrate("what is total revenue", QUERY,
				RecordingDataSource.row("total", 1234.5));

		assertThat(narrative).isEqualTo(ScriptedGenerationService.NARRATIVE);
		GenerationRequest request = generation.narrativeRequests().get(0);
		assertThat(request.systemPrompt()).isEqualTo(PromptTemplates.NARRATIVE_SYSTEM_PROMPT);
		assertThat(request.userPrompt())
				.contains("what is total revenue")
				.contains(QUERY)
				.contains("RESULT (1 rows, first 1 shown)")
				.contains("\"total\" : 1234.5");
	}

	@Test
	@DisplayName("samples at most ten rows")
	void samplesRows() {
		List<Map<String, Object>> rows = new ArrayList<>();
		for (int i = 0; i < 25; i++) {
			rows.add(Map.of("order_id", i));
		}

		narrator().narrate("list orders", "SELECT order_id FROM orders", QueryRows.of(rows));

		assertThat(generation.narrativeRequests().get(0).userPrompt())
				.contains("RESULT (25 rows, first 10 shown)")
				.contains("\"order_id\" : 9")
				.doesNotContain("\"order_id\" : 10");
	}

	@Test
	@DisplayName("falls back to a summary when the model fails")
	void fallsBackOnFailure() {
		generation.narrative(null);

		try (PipelineLogCaptor log = PipelineLogCaptor.capture(NarrativeGenerator.class)) {
			String narrative = narrator().narrate("what is total revenue", QUERY, RecordingDataSource.row("total", 42));

			assertThat(narrative).isEqualTo("The query returned 1 row: total = 42.");
			assertThat(log.warningsStartingWith("Narrative generation failed"))
					.containsExactly("Narrative generation failed, using summary: narrative unavailable");
		}
	}

	@Test
	@DisplayName("falls back to a summary when the model answers with nothing")
	void fallsBackOnBlank() {
		generation.narrative("  ");

		String narrative = narrator().narrate("list orders", "SELECT order_id FROM orders",
				QueryRows.empty(List.of("order_id")));

		assertThat(narrative).isEqualTo("The query returned no rows.");
	}

	@Test
	@DisplayName("summarizes multi-row results by shape")
	void summarizesRows() {
		QueryRows rows = QueryRows.of(List.of(Map.of("region", "north"), Map.of("region", "south")));

		assertThat(NarrativeGenerator.summarize(rows)).isEqualTo("The query returned 2 rows with columns region.");
	}
}
