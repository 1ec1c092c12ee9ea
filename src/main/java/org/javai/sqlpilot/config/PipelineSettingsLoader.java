package org.javai.sqlpilot.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@link PipelineSettings} from YAML. Missing keys keep their defaults; unknown keys are ignored.
 *
 * <pre>
 * supervisor:
 *   attempt-budget: 3
 * confidence:
 *   success-threshold: 0.5
 * executor:
 *   row-cap: 1000
 *   time-budget: 30s
 * cache:
 *   ttl: PT1H
 * </pre>
 *
 * <p>Durations accept ISO-8601 ({@code PT30S}) or a number with a {@code ms}, {@code s}, {@code m} or {@code h}
 * suffix.</p>
 */
public final class PipelineSettingsLoader {

	private static final Logger logger = LoggerFactory.getLogger(PipelineSettingsLoader.class);

	/** Classpath resource consulted by {@link #loadDefault()}. */
	public static final String DEFAULT_RESOURCE = "sqlpilot.yml";

	private static final Pattern SHORT_DURATION = Pattern.compile("(\\d+)\\s*(ms|s|m|h)");

	private final Yaml yaml = new Yaml();

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath, or returns the defaults if there is none.
	 */
	public PipelineSettings loadDefault() {
		InputStream in = PipelineSettingsLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
		if (in == null) {
			logger.info("No {} on the classpath, using default settings", DEFAULT_RESOURCE);
			return PipelineSettings.defaults();
		}
		try (in) {
			return load(in);
		} catch (IOException e) {
			throw new SettingsException("Failed to read " + DEFAULT_RESOURCE, e);
		}
	}

	public PipelineSettings load(Path path) {
		try (InputStream in = Files.newInputStream(path)) {
			return load(in);
		} catch (IOException e) {
			throw new SettingsException("Failed to read settings from " + path, e);
		}
	}

	public PipelineSettings load(InputStream in) {
		Map<String, Object> data;
		try {
			data = yaml.load(in);
		} catch (YAMLException e) {
			throw new SettingsException("Malformed settings YAML: " + e.getMessage(), e);
		}
		return fromMap(data);
	}

	public PipelineSettings parseString(String content) {
		Map<String, Object> data;
		try {
			data = yaml.load(content);
		} catch (YAMLException e) {
			throw new SettingsException("Malformed settings YAML: " + e.getMessage(), e);
		}
		return fromMap(data);
	}

	private PipelineSettings fromMap(Map<String, Object> data) {
		PipelineSettings.Builder builder = PipelineSettings.builder();
		if (data == null) {
			return builder.build();
		}
		Map<String, Object> reducer = section(data, "reducer");
		ifPresent(reducer, "max-tables", v -> builder.maxTables(toInt("reducer.max-tables", v)));
		ifPresent(reducer, "max-columns-per-table",
				v -> builder.maxColumnsPerTable(toInt("reducer.max-columns-per-table", v)));

		Map<String, Object> supervisor = section(data, "supervisor");
		ifPresent(supervisor, "attempt-budget", v -> builder.attemptBudget(toInt("supervisor.attempt-budget", v)));

		Map<String, Object> executor = section(data, "executor");
		ifPresent(executor, "row-cap", v -> builder.rowCap(toInt("executor.row-cap", v)));
		ifPresent(executor, "time-budget",
				v -> builder.executionTimeBudget(toDuration("executor.time-budget", v)));
		ifPresent(executor, "pool-size", v -> builder.executionPoolSize(toInt("executor.pool-size", v)));

		Map<String, Object> generation = section(data, "generation");
		ifPresent(generation, "time-budget",
				v -> builder.generationTimeBudget(toDuration("generation.time-budget", v)));
		ifPresent(generation, "max-concurrent",
				v -> builder.generationMaxConcurrent(toInt("generation.max-concurrent", v)));

		Map<String, Object> cache = section(data, "cache");
		ifPresent(cache, "capacity", v -> builder.cacheCapacity(toInt("cache.capacity", v)));
		ifPresent(cache, "ttl", v -> builder.cacheTtl(toDuration("cache.ttl", v)));

		Map<String, Object> monitor = section(data, "monitor");
		ifPresent(monitor, "history-size", v -> builder.monitorHistorySize(toInt("monitor.history-size", v)));

		Map<String, Object> confidence = section(data, "confidence");
		if (!confidence.isEmpty()) {
			builder.confidence(confidencePolicy(confidence));
		}

		try {
			return builder.build();
		} catch (IllegalArgumentException e) {
			throw new SettingsException("Invalid settings: " + e.getMessage(), e);
		}
	}

	private ConfidencePolicy confidencePolicy(Map<String, Object> section) {
		ConfidencePolicy d = ConfidencePolicy.defaults();
		try {
			return new ConfidencePolicy(
					toDouble(section, "success-threshold", d.successThreshold()),
					toDouble(section, "grounded-base", d.groundedBase()),
					toDouble(section, "ungrounded-cap", d.ungroundedCap()),
					toDouble(section, "aggregate-boost", d.aggregateBoost()),
					toDouble(section, "aggregate-floor", d.aggregateFloor()),
					toDouble(section, "empty-result-cap", d.emptyResultCap()),
					toDouble(section, "correction", d.correctionConfidence()));
		} catch (IllegalArgumentException e) {
			throw new SettingsException("Invalid confidence policy: " + e.getMessage(), e);
		}
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> section(Map<String, Object> data, String name) {
		Object value = data.get(name);
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map)) {
			throw new SettingsException("Section '" + name + "' must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private static void ifPresent(Map<String, Object> section, String key, Consumer<Object> apply) {
		Object value = section.get(key);
		if (value != null) {
			apply.accept(value);
		}
	}

	private static int toInt(String key, Object value) {
		if (value instanceof Number number) {
			return number.intValue();
		}
		try {
			return Integer.parseInt(value.toString().trim());
		} catch (NumberFormatException e) {
			throw new SettingsException("'%s' is not an integer: %s".formatted(key, value), e);
		}
	}

	private static double toDouble(Map<String, Object> section, String key, double fallback) {
		Object value = section.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Number number) {
			return number.doubleValue();
		}
		try {
			return Double.parseDouble(value.toString().trim());
		} catch (NumberFormatException e) {
			throw new SettingsException("'confidence.%s' is not a number: %s".formatted(key, value), e);
		}
	}

	static Duration toDuration(String key, Object value) {
		if (value instanceof Number number) {
			return Duration.ofSeconds(number.longValue());
		}
		String text = value.toString().trim().toLowerCase(Locale.ROOT);
		Matcher matcher = SHORT_DURATION.matcher(text);
		if (matcher.matches()) {
			long amount = Long.parseLong(matcher.group(1));
			return switch (matcher.group(2)) {
				case "ms" -> Duration.ofMillis(amount);
				case "s" -> Duration.ofSeconds(amount);
				case "m" -> Duration.ofMinutes(amount);
				default -> Duration.ofHours(amount);
			};
		}
		try {
			return Duration.parse(text.toUpperCase(Locale.ROOT));
		} catch (DateTimeParseException e) {
			throw new SettingsException("'%s' is not a duration: %s".formatted(key, value), e);
		}
	}
}
