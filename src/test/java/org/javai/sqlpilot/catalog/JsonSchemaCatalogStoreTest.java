package org.javai.sqlpilot.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.nio.file.Files;
import java.nio.file.Path;
import org.javai.sqlpilot.testsupport.Catalogs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("JsonSchemaCatalogStore")
class JsonSchemaCatalogStoreTest {

	@TempDir
	Path directory;

	@Test
	@DisplayName("a saved catalog loads back with tables, keys and relationships")
	void savesAndLoads() {
		JsonSchemaCatalogStore store = new JsonSchemaCatalogStore(directory);
		SchemaCatalog original = Catalogs.retail();

		store.save("retail", original);
		SchemaCatalog loaded = store.load("retail").orElseThrow();

		assertThat(Files.exists(directory.resolve("retail.json"))).isTrue();
		assertThat(loaded).isNotSameAs(original);
		assertThat(loaded.tables()).isEqualTo(original.tables());
		assertThat(loaded.relationships()).isEqualTo(original.relationships());
	}

	@Test
	@DisplayName("an unknown id loads nothing")
	void missing() {
		assertThat(new JsonSchemaCatalogStore(directory).load("absent")).isEmpty();
	}

	@Test
	@DisplayName("ids that could escape the directory are refused")
	void unsafeId() {
		JsonSchemaCatalogStore store = new JsonSchemaCatalogStore(directory);

		assertThatThrownBy(() -> store.save("../evil", Catalogs.orders()))
				.isInstanceOf(CatalogException.class)
				.hasMessageContaining("Invalid catalog id");
	}

	@Test
	@DisplayName("a corrupt file is reported as a catalog error")
	void corruptFile() throws Exception {
		Files.writeString(directory.resolve("broken.json"), "{ not json");

		assertThatThrownBy(() -> new JsonSchemaCatalogStore(directory).load("broken"))
				.isInstanceOf(CatalogException.class)
				.hasMessageContaining("Failed to read catalog 'broken'");
	}
}
