package org.javai.sqlpilot.catalog;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the active catalog for each catalog id.
 *
 * <p>Replacing a catalog is a single atomic swap of the reference. Requests take a snapshot with
 * {@link #snapshot(String)} when they start and keep it until they finish.</p>
 */
public final class CatalogRegistry {

	private static final Logger logger = LoggerFactory.getLogger(CatalogRegistry.class);

	private final ConcurrentMap<String, SchemaCatalog> catalogs = new ConcurrentHashMap<>();

	public void register(String catalogId, SchemaCatalog catalog) {
		if (catalogId == null || catalogId.isBlank()) {
			throw new IllegalArgumentException("catalogId must not be blank");
		}
		if (catalog == null) {
			throw new IllegalArgumentException("catalog must not be null");
		}
		SchemaCatalog previous = catalogs.put(catalogId, catalog);
		logger.info("Catalog '{}' {} with {} tables", catalogId, previous == null ? "registered" : "replaced",
				catalog.size());
	}

	public Optional<SchemaCatalog> snapshot(String catalogId) {
		return catalogId == null ? Optional.empty() : Optional.ofNullable(catalogs.get(catalogId));
	}

	/**
	 * Rebuilds a catalog through the discovery collaborator and swaps it in after validation. The previous
	 * catalog stays active if discovery or validation fails.
	 *
	 * @return the newly active catalog
	 * @throws CatalogException if discovery fails or the discovered catalog is structurally invalid
	 */
	public SchemaCatalog refresh(String catalogId, SchemaDiscovery discovery, CatalogValidator validator) {
		SchemaCatalog discovered;
		try {
			discovered = discovery.discover(catalogId);
		} catch (CatalogException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new CatalogException("Schema discovery failed for '%s': %s".formatted(catalogId, e.getMessage()), e);
		}
		if (discovered == null) {
			throw new CatalogException("Schema discovery returned no catalog for '%s'".formatted(catalogId));
		}
		validator.validate(discovered)
				.forEach(warning -> logger.warn("Catalog '{}': {}", catalogId, warning));
		register(catalogId, discovered);
		return discovered;
	}

	public boolean remove(String catalogId) {
		return catalogs.remove(catalogId) != null;
	}

	public Set<String> catalogIds() {
		return Collections.unmodifiableSet(new TreeSet<>(catalogs.keySet()));
	}
}
