package org.javai.sqlpilot.generation;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("QueryExtractor")
class QueryExtractorTest {

	private final QueryExtractor extractor = new QueryExtractor();

	@Test
	@DisplayName("prefers a fenced code block")
	void fencedBlock() {
		String response = """
				Here is the query:
				```sql
				SELECT SUM(amount) FROM orders;
				```
				It sums every order.""";

		assertThat(extractor.extract(response)).contains("SELECT SUM(amount) FROM orders");
	}

	@Test
	@DisplayName("reads a bare statement up to the next blank line")
	void bareStatement() {
		String response = "Sure.\nSELECT amount\nFROM orders\n\nThis lists every amount.";

		assertThat(extractor.extract(response)).contains("SELECT amount\nFROM orders");
	}

	@Test
	@DisplayName("strips a leading label")
	void labelledStatement() {
		assertThat(extractor.extract("SQL: SELECT * FROM orders")).contains("SELECT * FROM orders");
	}

	@Test
	@DisplayName("keeps a second statement so that it can be refused")
	void keepsSecondStatement() {
		assertThat(extractor.extract("SELECT 1; DROP TABLE orders;"))
				.hasValueSatisfying(query -> assertThat(query).contains("DROP TABLE orders"));
	}

	@Test
	@DisplayName("extracts write statements")
	void writeStatement() {
		assertThat(extractor.extract("DELETE FROM orders")).contains("DELETE FROM orders");
	}

	@Test
	@DisplayName("yields nothing for refusals")
	void refusal() {
		assertThat(extractor.extract("I'm sorry, I cannot answer that question.")).isEmpty();
	}

	@Test
	@DisplayName("yields nothing for empty responses")
	void emptyResponse() {
		assertThat(extractor.extract(null)).isEmpty();
		assertThat(extractor.extract("   ")).isEmpty();
		assertThat(extractor.extract("```sql\n```")).isEmpty();
	}
}
