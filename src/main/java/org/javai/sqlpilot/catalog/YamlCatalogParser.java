package org.javai.sqlpilot.catalog;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/**
 * Parses a catalog definition written in YAML.
 *
 * <pre>
 * tables:
 *   - name: orders
 *     alias: Orders
 *     columns:
 *       - { name: order_id, type: INTEGER, role: identifier, primary-key: true }
 *       - { name: customer_id, type: INTEGER, references: customers.customer_id }
 *       - { name: amount, type: DECIMAL, role: amount }
 * relationships:
 *   - source: orders
 *     target: customers
 *     cardinality: many_to_one
 *     keys:
 *       - { source: customer_id, target: customer_id }
 * </pre>
 */
public class YamlCatalogParser {

	private final Yaml yaml = new Yaml();

	public SchemaCatalog parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			Map<String, Object> data = yaml.load(reader);
			return build(data);
		} catch (CatalogException e) {
			throw e;
		} catch (Exception e) {
			throw new CatalogException("Failed to parse catalog from path: " + path, e);
		}
	}

	public SchemaCatalog parse(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return build(data);
		} catch (CatalogException e) {
			throw e;
		} catch (Exception e) {
			throw new CatalogException("Failed to parse catalog from input stream", e);
		}
	}

	public SchemaCatalog parseString(String content) {
		try {
			Map<String, Object> data = yaml.load(content);
			return build(data);
		} catch (CatalogException e) {
			throw e;
		} catch (Exception e) {
			throw new CatalogException("Failed to parse catalog from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private SchemaCatalog build(Map<String, Object> data) {
		if (data == null) {
			return SchemaCatalog.empty();
		}
		List<CatalogTable> tables = new ArrayList<>();
		List<Map<String, Object>> tableList = (List<Map<String, Object>>) data.get("tables");
		if (tableList != null) {
			for (Map<String, Object> tableMap : tableList) {
				tables.add(buildTable(tableMap));
			}
		}
		List<Relationship> relationships = new ArrayList<>();
		List<Map<String, Object>> relationshipList = (List<Map<String, Object>>) data.get("relationships");
		if (relationshipList != null) {
			for (Map<String, Object> relationshipMap : relationshipList) {
				relationships.add(buildRelationship(relationshipMap));
			}
		}
		return SchemaCatalog.of(tables, relationships);
	}

	@SuppressWarnings("unchecked")
	private CatalogTable buildTable(Map<String, Object> tableMap) {
		String name = required(tableMap, "name", "table");
		List<CatalogColumn> columns = new ArrayList<>();
		List<Map<String, Object>> columnList = (List<Map<String, Object>>) tableMap.get("columns");
		if (columnList != null) {
			for (Map<String, Object> columnMap : columnList) {
				columns.add(new CatalogColumn(
						required(columnMap, "name", "column of " + name),
						toString(columnMap.get("type")),
						ColumnRole.fromTag(toString(columnMap.get("role"))),
						toString(columnMap.get("description")),
						Boolean.TRUE.equals(columnMap.get("primary-key")),
						toString(columnMap.get("references"))));
			}
		}
		return new CatalogTable(name, toString(tableMap.get("alias")), toString(tableMap.get("description")),
				columns);
	}

	@SuppressWarnings("unchecked")
	private Relationship buildRelationship(Map<String, Object> map) {
		String source = required(map, "source", "relationship");
		String target = required(map, "target", "relationship");
		List<Relationship.JoinKey> keys = new ArrayList<>();
		List<Map<String, Object>> keyList = (List<Map<String, Object>>) map.get("keys");
		if (keyList != null) {
			for (Map<String, Object> key : keyList) {
				keys.add(new Relationship.JoinKey(toString(key.get("source")), toString(key.get("target"))));
			}
		} else if (map.containsKey("source-column")) {
			keys.add(new Relationship.JoinKey(toString(map.get("source-column")), toString(map.get("target-column"))));
		}
		String cardinality = toString(map.get("cardinality"));
		return new Relationship(source, target, keys,
				cardinality == null ? null : Cardinality.valueOf(cardinality.trim().toUpperCase(Locale.ROOT)));
	}

	private static String required(Map<String, Object> map, String key, String context) {
		String value = toString(map.get(key));
		if (value == null || value.isBlank()) {
			throw new CatalogException("Missing required '%s' in %s".formatted(key, context));
		}
		return value;
	}

	private static String toString(Object obj) {
		return obj == null ? null : obj instanceof String s ? s : String.valueOf(obj);
	}
}
