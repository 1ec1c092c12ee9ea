package org.javai.sqlpilot.exec;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ReadOnlyGuard")
class ReadOnlyGuardTest {

	private final ReadOnlyGuard guard = new ReadOnlyGuard();

	@Nested
	@DisplayName("Refuses")
	class Refuses {

		@Test
		@DisplayName("write verbs in any case")
		void writeVerbs() {
			assertThat(guard.violation("delete from orders")).contains("forbidden operation: DELETE");
			assertThat(guard.violation("UPDATE orders SET amount = 0")).contains("forbidden operation: UPDATE");
			assertThat(guard.violation("insert into orders values (1)")).contains("forbidden operation: INSERT");
		}

		@Test
		@DisplayName("DDL verbs")
		void ddl() {
			assertThat(guard.violation("DROP TABLE orders")).contains("forbidden operation: DROP");
			assertThat(guard.violation("truncate orders")).contains("forbidden operation: TRUNCATE");
			assertThat(guard.violation("REPLACE   INTO orders VALUES (1)"))
					.contains("forbidden operation: REPLACE INTO");
		}

		@Test
		@DisplayName("a write hidden behind a read")
		void stackedStatements() {
			assertThat(guard.violation("SELECT 1; DROP TABLE orders")).isPresent();
			assertThat(guard.violation("SELECT 1; SELECT 2")).contains("forbidden operation: multiple statements");
		}

		@Test
		@DisplayName("a write smuggled past a backslash-escaped quote")
		void backslashEscapedQuote() {
			assertThat(guard.violation("SELECT E'\\''; DELETE FROM orders; --'"))
					.contains("forbidden operation: DELETE");
			assertThat(guard.violation("SELECT 'x\\'; SELECT 1 --'"))
					.contains("forbidden operation: multiple statements");
		}

		@Test
		@DisplayName("literals whose extent depends on the escape convention")
		void ambiguousEscaping() {
			assertThat(guard.violation("SELECT 'C:\\' AS path, 'x' AS tag FROM files"))
					.contains("forbidden operation: ambiguous string literal escaping");
		}

		@Test
		@DisplayName("unparseable text that does not start as a query")
		void unrecognisable() {
			assertThat(guard.violation("SHOW GRANTS ???")).isPresent();
			assertThat(guard.violation("PRAGMA ??? orders"))
					.contains("forbidden operation: statement is not recognisable as a query");
		}

		@Test
		@DisplayName("SELECT INTO")
		void selectInto() {
			assertThat(guard.violation("SELECT * INTO backup FROM orders")).contains("forbidden operation: SELECT INTO");
		}
	}

	@Nested
	@DisplayName("Allows")
	class Allows {

		@Test
		@DisplayName("plain reads and a trailing semicolon")
		void reads() {
			assertThat(guard.violation("SELECT SUM(amount) FROM orders;")).isEmpty();
			assertThat(guard.violation("WITH t AS (SELECT 1 AS x) SELECT x FROM t")).isEmpty();
			assertThat(guard.violation("SELECT name FROM customers WHERE name = 'O''Brien'")).isEmpty();
		}

		@Test
		@DisplayName("verbs inside literals, quoted names and comments")
		void verbsOutsideCode() {
			assertThat(guard.violation("SELECT * FROM audit WHERE action = 'DELETE'")).isEmpty();
			assertThat(guard.violation("SELECT \"update\" FROM audit -- drop later")).isEmpty();
		}

		@Test
		@DisplayName("verbs embedded in longer names")
		void embedded() {
			assertThat(guard.violation("SELECT last_update, created_at FROM audit")).isEmpty();
		}

		@Test
		@DisplayName("query-shaped text the parser cannot read, leaving diagnosis to the engine")
		void unparseable() {
			assertThat(guard.violation("SELECT amount FROM orders QUALIFY ROW_NUMBER() OVER () = 1 ???")).isEmpty();
		}
	}
}
