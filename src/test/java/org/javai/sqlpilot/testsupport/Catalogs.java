package org.javai.sqlpilot.testsupport;

import org.javai.sqlpilot.catalog.Cardinality;
import org.javai.sqlpilot.catalog.CatalogColumn;
import org.javai.sqlpilot.catalog.ColumnRole;
import org.javai.sqlpilot.catalog.SchemaCatalog;

/**
 * Catalog fixtures shared by tests.
 */
public final class Catalogs {

	private Catalogs() {
	}

	/**
	 * {@code orders(order_id, amount, date)}.
	 */
	public static SchemaCatalog orders() {
		return SchemaCatalog.builder()
				.addTable("orders", "Orders", "Customer orders")
				.addColumn("orders", CatalogColumn.primaryKey("order_id", "INTEGER"))
				.addColumn("orders", "amount", "DECIMAL", ColumnRole.AMOUNT)
				.addColumn("orders", "date", "DATE", ColumnRole.DATE)
				.build();
	}

	/**
	 * {@code orders(order_id, revenue, order_date)}.
	 */
	public static SchemaCatalog ordersWithRevenue() {
		return SchemaCatalog.builder()
				.addTable("orders", "Orders", "Customer orders")
				.addColumn("orders", CatalogColumn.primaryKey("order_id", "INTEGER"))
				.addColumn("orders", "revenue", "DECIMAL", ColumnRole.AMOUNT)
				.addColumn("orders", "order_date", "DATE", ColumnRole.DATE)
				.build();
	}

	/**
	 * Seven tables of a small retail warehouse, joined through orders.
	 */
	public static SchemaCatalog retail() {
		return SchemaCatalog.builder()
				.addTable("customers", "Customers", "People who place orders")
				.addColumn("customers", CatalogColumn.primaryKey("customer_id", "INTEGER"))
				.addColumn("customers", "customer_name", "VARCHAR", ColumnRole.NAME)
				.addColumn("customers", "region_id", "INTEGER", ColumnRole.IDENTIFIER)
				.addTable("orders", "Orders", "Customer orders")
				.addColumn("orders", CatalogColumn.primaryKey("order_id", "INTEGER"))
				.addColumn("orders", "customer_id", "INTEGER", ColumnRole.IDENTIFIER)
				.addColumn("orders", "amount", "DECIMAL", ColumnRole.AMOUNT)
				.addColumn("orders", "order_date", "DATE", ColumnRole.DATE)
				.addTable("products", "Products", "Things we sell")
				.addColumn("products", CatalogColumn.primaryKey("product_id", "INTEGER"))
				.addColumn("products", "product_name", "VARCHAR", ColumnRole.NAME)
				.addColumn("products", "category", "VARCHAR", ColumnRole.CATEGORY)
				.addTable("order_items", "Order lines", null)
				.addColumn("order_items", "order_id", "INTEGER", ColumnRole.IDENTIFIER)
				.addColumn("order_items", "product_id", "INTEGER", ColumnRole.IDENTIFIER)
				.addColumn("order_items", "quantity", "INTEGER", ColumnRole.AMOUNT)
				.addTable("regions", "Regions", "Sales regions")
				.addColumn("regions", CatalogColumn.primaryKey("region_id", "INTEGER"))
				.addColumn("regions", "region_name", "VARCHAR", ColumnRole.NAME)
				.addTable("suppliers", "Suppliers", "Vendors")
				.addColumn("suppliers", CatalogColumn.primaryKey("supplier_id", "INTEGER"))
				.addColumn("suppliers", "supplier_name", "VARCHAR", ColumnRole.NAME)
				.addTable("employees", "Staff", "Employees")
				.addColumn("employees", CatalogColumn.primaryKey("employee_id", "INTEGER"))
				.addColumn("employees", "employee_name", "VARCHAR", ColumnRole.NAME)
				.addRelationship("orders", "customer_id", "customers", "customer_id", Cardinality.MANY_TO_ONE)
				.addRelationship("order_items", "order_id", "orders", "order_id", Cardinality.MANY_TO_ONE)
				.addRelationship("order_items", "product_id", "products", "product_id", Cardinality.MANY_TO_ONE)
				.addRelationship("customers", "region_id", "regions", "region_id", Cardinality.MANY_TO_ONE)
				.build();
	}
}
