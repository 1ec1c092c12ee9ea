package org.javai.sqlpilot.catalog;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores each catalog as {@code <catalogId>.json} in a directory.
 */
public final class JsonSchemaCatalogStore implements SchemaCatalogStore {

	private static final Logger logger = LoggerFactory.getLogger(JsonSchemaCatalogStore.class);

	private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_.-]+");

	private final Path directory;
	private final ObjectMapper objectMapper;

	public JsonSchemaCatalogStore(Path directory) {
		this(directory, new ObjectMapper());
	}

	public JsonSchemaCatalogStore(Path directory, ObjectMapper objectMapper) {
		this.directory = Objects.requireNonNull(directory, "directory must not be null");
		this.objectMapper = objectMapper.copy()
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.enable(SerializationFeature.INDENT_OUTPUT);
	}

	@Override
	public Optional<SchemaCatalog> load(String catalogId) {
		Path file = fileFor(catalogId);
		if (!Files.exists(file)) {
			return Optional.empty();
		}
		try {
			CatalogDocument document = objectMapper.readValue(file.toFile(), CatalogDocument.class);
			return Optional.of(SchemaCatalog.of(document.tables(), document.relationships()));
		} catch (IOException | IllegalArgumentException e) {
			throw new CatalogException("Failed to read catalog '%s' from %s".formatted(catalogId, file), e);
		}
	}

	@Override
	public void save(String catalogId, SchemaCatalog catalog) {
		Path file = fileFor(catalogId);
		try {
			Files.createDirectories(directory);
			objectMapper.writeValue(file.toFile(), new CatalogDocument(catalog.tables(), catalog.relationships()));
			logger.info("Saved catalog '{}' ({} tables) to {}", catalogId, catalog.size(), file);
		} catch (IOException e) {
			throw new CatalogException("Failed to write catalog '%s' to %s".formatted(catalogId, file), e);
		}
	}

	private Path fileFor(String catalogId) {
		if (catalogId == null || !SAFE_ID.matcher(catalogId).matches()) {
			throw new CatalogException("Invalid catalog id: " + catalogId);
		}
		return directory.resolve(catalogId + ".json");
	}

	record CatalogDocument(List<CatalogTable> tables, List<Relationship> relationships) {
	}
}
