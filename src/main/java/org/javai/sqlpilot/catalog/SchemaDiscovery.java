package org.javai.sqlpilot.catalog;

/**
 * Builds a catalog by inspecting a data source. Implementations talk to the warehouse driver and are supplied by
 * the host application.
 */
@FunctionalInterface
public interface SchemaDiscovery {

	/**
	 * @param catalogId identifier of the catalog (typically one per data-source connection)
	 * @return the freshly discovered catalog
	 * @throws CatalogException if discovery fails
	 */
	SchemaCatalog discover(String catalogId);
}
