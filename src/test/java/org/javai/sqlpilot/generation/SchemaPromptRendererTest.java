package org.javai.sqlpilot.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.javai.sqlpilot.catalog.CatalogColumn;
import org.javai.sqlpilot.catalog.ColumnRole;
import org.javai.sqlpilot.catalog.SchemaCatalog;
import org.javai.sqlpilot.testsupport.Catalogs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SchemaPromptRenderer")
class SchemaPromptRendererTest {

	@Test
	@DisplayName("renders tables with column details")
	void rendersColumns() {
		String rendered = new SchemaPromptRenderer(10).render(Catalogs.orders(), "total revenue");

		assertThat(rendered)
				.startsWith("SQL CATALOG:")
				.contains("- orders: Customer orders")
				.contains("  • order_id (type=INTEGER; role=identifier; pk)")
				.contains("  • amount (type=DECIMAL; role=amount)")
				.doesNotContain("aka:");
	}

	@Test
	@DisplayName("renders relationships as join hints")
	void rendersRelationships() {
		String rendered = new SchemaPromptRenderer(10).render(Catalogs.retail(), "orders per customer");

		assertThat(rendered)
				.contains("RELATIONSHIPS:")
				.contains("orders.customer_id = customers.customer_id")
				.contains("- employees (aka: Staff): Employees");
	}

	@Test
	@DisplayName("compresses wide tables to their essential columns")
	void compressesWideTables() {
		SchemaCatalog.Builder builder = SchemaCatalog.builder()
				.addTable("sales", "Sales")
				.addColumn("sales", CatalogColumn.primaryKey("sale_id", "INTEGER"));
		for (int i = 1; i <= 9; i++) {
			builder.addColumn("sales", "attribute_" + i, "VARCHAR", ColumnRole.OTHER);
		}
		builder.addColumn("sales", "discount", "DECIMAL", ColumnRole.OTHER);

		String rendered = new SchemaPromptRenderer(3).render(builder.build(), "average discount");

		assertThat(rendered)
				.contains("  • sale_id")
				.contains("  • discount")
				.doesNotContain("attribute_1")
				.contains("(9 more columns not relevant to this question)");
	}

	@Test
	@DisplayName("rejects a non-positive column cap")
	void rejectsZeroCap() {
		assertThatThrownBy(() -> new SchemaPromptRenderer(0)).isInstanceOf(IllegalArgumentException.class);
	}
}
