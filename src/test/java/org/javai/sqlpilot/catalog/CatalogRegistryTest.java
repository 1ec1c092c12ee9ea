package org.javai.sqlpilot.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.javai.sqlpilot.testsupport.Catalogs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CatalogRegistry")
class CatalogRegistryTest {

	private final CatalogRegistry registry = new CatalogRegistry();
	private final CatalogValidator validator = new CatalogValidator();

	@Test
	@DisplayName("refresh swaps the catalog while earlier snapshots stay intact")
	void refreshSwapsAtomically() {
		SchemaCatalog before = Catalogs.orders();
		registry.register("sales", before);
		SchemaCatalog snapshot = registry.snapshot("sales").orElseThrow();

		SchemaCatalog after = registry.refresh("sales", id -> Catalogs.retail(), validator);

		assertThat(snapshot).isSameAs(before);
		assertThat(snapshot.size()).isEqualTo(1);
		assertThat(registry.snapshot("sales")).containsSame(after);
		assertThat(after.size()).isEqualTo(7);
	}

	@Test
	@DisplayName("a failing discovery keeps the previous catalog")
	void failedDiscovery() {
		SchemaCatalog before = Catalogs.orders();
		registry.register("sales", before);

		assertThatThrownBy(() -> registry.refresh("sales", id -> {
			throw new IllegalStateException("connection refused");
		}, validator))
				.isInstanceOf(CatalogException.class)
				.hasMessageContaining("connection refused");
		assertThat(registry.snapshot("sales")).containsSame(before);
	}

	@Test
	@DisplayName("discovery returning nothing is an error")
	void nullDiscovery() {
		assertThatThrownBy(() -> registry.refresh("sales", id -> null, validator))
				.isInstanceOf(CatalogException.class);
		assertThat(registry.snapshot("sales")).isEmpty();
	}

	@Test
	@DisplayName("lists and removes catalog ids")
	void idsAndRemoval() {
		registry.register("b", Catalogs.orders());
		registry.register("a", Catalogs.retail());

		assertThat(registry.catalogIds()).containsExactly("a", "b");
		assertThat(registry.remove("a")).isTrue();
		assertThat(registry.remove("a")).isFalse();
		assertThat(registry.snapshot(null)).isEmpty();
	}

	@Test
	@DisplayName("blank ids are rejected")
	void blankId() {
		assertThatThrownBy(() -> registry.register(" ", Catalogs.orders()))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
