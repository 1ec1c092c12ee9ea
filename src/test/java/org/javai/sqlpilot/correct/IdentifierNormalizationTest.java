package org.javai.sqlpilot.correct;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import org.javai.sqlpilot.testsupport.Catalogs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("IdentifierNormalization")
class IdentifierNormalizationTest {

	private final IdentifierNormalization pattern = new IdentifierNormalization();

	@Test
	@DisplayName("triggers on unknown-name errors only")
	void matches() {
		assertThat(pattern.matches("unknown identifier revenu")).isTrue();
		assertThat(pattern.matches("no such column: revenu")).isTrue();
		assertThat(pattern.matches("relation \"ordrs\" does not exist")).isTrue();
		assertThat(pattern.matches("syntax error at or near \"form\"")).isFalse();
	}

	@Test
	@DisplayName("replaces a misspelt column with the closest catalog name")
	void misspeltColumn() {
		assertThat(pattern.apply("SELECT SUM(revenu) FROM orders", "unknown identifier revenu",
				Catalogs.ordersWithRevenue()))
				.contains("SELECT SUM(revenue) FROM orders");
	}

	@Test
	@DisplayName("replaces a misspelt table")
	void misspeltTable() {
		assertThat(pattern.apply("SELECT SUM(amount) FROM ordrs", "relation \"ordrs\" does not exist",
				Catalogs.orders()))
				.contains("SELECT SUM(amount) FROM orders");
	}

	@Test
	@DisplayName("fixes case and quoting before edit distance")
	void caseMismatch() {
		assertThat(pattern.apply("SELECT SUM(\"AMOUNT\") FROM orders", "column \"AMOUNT\" does not exist",
				Catalogs.orders()))
				.contains("SELECT SUM(amount) FROM orders");
	}

	@Test
	@DisplayName("gives up when no catalog name is close enough")
	void noCloseName() {
		assertThat(pattern.apply("SELECT SUM(profit_margin) FROM orders", "unknown identifier profit_margin",
				Catalogs.orders()))
				.isEmpty();
	}

	@Test
	@DisplayName("reads offending names after keywords and inside quotes")
	void offendingNames() {
		assertThat(IdentifierNormalization.offendingNames("Unknown column 'o.revenu' in 'field list'"))
				.contains("revenu");
	}

	@Test
	@DisplayName("prefers the first declared name on equal distance")
	void tieGoesToFirst() {
		assertThat(IdentifierNormalization.closest("cat", List.of("car", "cab"))).contains("car");
	}
}
