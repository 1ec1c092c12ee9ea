package org.javai.sqlpilot.catalog;

import java.util.Optional;

/**
 * Read/write persistence for long-lived catalogs.
 */
public interface SchemaCatalogStore {

	Optional<SchemaCatalog> load(String catalogId);

	void save(String catalogId, SchemaCatalog catalog);
}
