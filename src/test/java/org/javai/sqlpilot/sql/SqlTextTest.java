package org.javai.sqlpilot.sql;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SqlText")
class SqlTextTest {

	@Nested
	@DisplayName("Segmentation")
	class Segmentation {

		@Test
		@DisplayName("separates code, literals, quoted identifiers and comments")
		void segments() {
			assertThat(SqlText.segments("SELECT \"Order Date\", 'it''s' -- note\nFROM t /* c */"))
					.extracting(SqlText.Segment::kind)
					.containsExactly(
							SqlText.Kind.CODE,
							SqlText.Kind.QUOTED_IDENTIFIER,
							SqlText.Kind.CODE,
							SqlText.Kind.STRING_LITERAL,
							SqlText.Kind.CODE,
							SqlText.Kind.COMMENT,
							SqlText.Kind.CODE,
							SqlText.Kind.COMMENT);
		}

		@Test
		@DisplayName("code-only text hides keywords inside literals")
		void codeOnly() {
			String code = SqlText.codeOnly("SELECT 'drop table x' FROM notes");

			assertThat(code).contains("SELECT").contains("FROM notes").doesNotContain("drop");
		}

		@Test
		@DisplayName("an unterminated literal runs to the end")
		void unterminated() {
			assertThat(SqlText.segments("SELECT 'open"))
					.extracting(SqlText.Segment::text)
					.containsExactly("SELECT ", "'open");
		}
	}

	@Nested
	@DisplayName("Normalisation")
	class Normalisation {

		@Test
		@DisplayName("collapses whitespace and case outside literals")
		void cosmetic() {
			assertThat(SqlText.normalize("SELECT  Amount\n\tFROM Orders WHERE name = 'Bob  X'; "))
					.isEqualTo("select amount from orders where name = 'Bob  X'");
		}

		@Test
		@DisplayName("drops comments and keeps quoted identifiers verbatim")
		void commentsAndQuotes() {
			assertThat(SqlText.normalize("SELECT \"Order Date\" -- the date\nFROM t;;"))
					.isEqualTo("select \"Order Date\" from t");
		}

		@Test
		@DisplayName("literals differing in case stay distinct")
		void literalCase() {
			assertThat(SqlText.normalize("select * from t where a = 'X'"))
					.isNotEqualTo(SqlText.normalize("select * from t where a = 'x'"));
		}
	}

	@Nested
	@DisplayName("Identifier rewriting")
	class Rewriting {

		@Test
		@DisplayName("replaces whole words in code only")
		void replacesWholeWords() {
			String sql = "SELECT SUM(revenu), revenues FROM orders WHERE note = 'revenu'";

			assertThat(SqlText.replaceIdentifier(sql, "revenu", "revenue"))
					.isEqualTo("SELECT SUM(revenue), revenues FROM orders WHERE note = 'revenu'");
		}

		@Test
		@DisplayName("replaces a matching quoted identifier including its quotes")
		void replacesQuoted() {
			assertThat(SqlText.replaceIdentifier("SELECT \"Revenu\" FROM t", "revenu", "revenue"))
					.isEqualTo("SELECT revenue FROM t");
		}

		@Test
		@DisplayName("qualifies bare occurrences of a column")
		void qualifies() {
			String sql = "SELECT id, name FROM a JOIN b ON a.id = b.a_id WHERE id > 3";

			assertThat(SqlText.qualifyColumn(sql, "id", "a"))
					.isEqualTo("SELECT a.id, name FROM a JOIN b ON a.id = b.a_id WHERE a.id > 3");
		}

		@Test
		@DisplayName("leaves aliases and function names alone")
		void leavesAliases() {
			assertThat(SqlText.qualifyColumn("SELECT count(*) AS count FROM a", "count", "a"))
					.isEqualTo("SELECT count(*) AS count FROM a");
		}
	}
}
