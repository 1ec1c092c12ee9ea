package org.javai.sqlpilot.exec;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RowLimiter")
class RowLimiterTest {

	private final RowLimiter limiter = new RowLimiter();

	@Test
	@DisplayName("adds a limit to a plain select")
	void addsLimit() {
		assertThat(limiter.apply("SELECT amount FROM orders", 1000)).isEqualTo("SELECT amount FROM orders LIMIT 1000");
	}

	@Test
	@DisplayName("keeps an existing limit")
	void keepsLimit() {
		String query = "SELECT amount FROM orders LIMIT 5";

		assertThat(limiter.apply(query, 1000)).isSameAs(query);
	}

	@Test
	@DisplayName("wraps set operations")
	void wrapsUnion() {
		assertThat(limiter.apply("SELECT a FROM x UNION SELECT a FROM y;", 10))
				.isEqualTo("SELECT * FROM (SELECT a FROM x UNION SELECT a FROM y) limited_rows LIMIT 10");
	}

	@Test
	@DisplayName("keeps the limit or fetch clause of a set operation")
	void keepsSetOperationLimit() {
		String limited = "SELECT a FROM x UNION SELECT a FROM y LIMIT 5";
		String fetched = "SELECT a FROM x UNION ALL SELECT a FROM y FETCH FIRST 5 ROWS ONLY";

		assertThat(limiter.apply(limited, 10)).isSameAs(limited);
		assertThat(limiter.apply(fetched, 10)).isSameAs(fetched);
	}

	@Test
	@DisplayName("keeps the limit of a parenthesised select")
	void keepsParenthesisedLimit() {
		String query = "(SELECT amount FROM orders LIMIT 5)";

		assertThat(limiter.apply(query, 10)).isSameAs(query);
	}

	@Test
	@DisplayName("returns unparseable text unchanged")
	void unparseable() {
		String query = "SELEKT amount FROM orders";

		assertThat(limiter.apply(query, 10)).isSameAs(query);
	}
}
