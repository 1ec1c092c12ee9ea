package org.javai.sqlpilot.config;

import java.time.Duration;

/**
 * Tunable limits and policy constants of the query pipeline.
 *
 * <pre>{@code
 * PipelineSettings settings = PipelineSettings.builder()
 *     .attemptBudget(5)
 *     .executionTimeBudget(Duration.ofSeconds(10))
 *     .build();
 * }</pre>
 *
 * @param maxTables maximum number of tables kept in a reduced context
 * @param maxColumnsPerTable cap on the columns rendered per table in a generation prompt
 * @param attemptBudget maximum number of generate-or-fix rounds per request
 * @param confidence confidence scoring policy
 * @param rowCap row limit applied to executed queries
 * @param executionTimeBudget time allowed for acquiring an execution slot and running a query
 * @param executionPoolSize number of queries that may run against the data source at once
 * @param generationTimeBudget time allowed for a single generation call
 * @param generationMaxConcurrent per-tier ceiling on concurrent generation calls
 * @param cacheCapacity maximum number of cached results
 * @param cacheTtl lifetime of a cached result
 * @param monitorHistorySize number of request records kept for monitoring
 */
public record PipelineSettings(
		int maxTables,
		int maxColumnsPerTable,
		int attemptBudget,
		ConfidencePolicy confidence,
		int rowCap,
		Duration executionTimeBudget,
		int executionPoolSize,
		Duration generationTimeBudget,
		int generationMaxConcurrent,
		int cacheCapacity,
		Duration cacheTtl,
		int monitorHistorySize
) {

	public PipelineSettings {
		requirePositive("maxTables", maxTables);
		requirePositive("maxColumnsPerTable", maxColumnsPerTable);
		requirePositive("attemptBudget", attemptBudget);
		requirePositive("rowCap", rowCap);
		requirePositive("executionPoolSize", executionPoolSize);
		requirePositive("generationMaxConcurrent", generationMaxConcurrent);
		requirePositive("cacheCapacity", cacheCapacity);
		requirePositive("monitorHistorySize", monitorHistorySize);
		if (confidence == null) {
			throw new IllegalArgumentException("confidence must not be null");
		}
		requirePositive("executionTimeBudget", executionTimeBudget);
		requirePositive("generationTimeBudget", generationTimeBudget);
		requirePositive("cacheTtl", cacheTtl);
	}

	public static PipelineSettings defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		return new Builder()
				.maxTables(maxTables)
				.maxColumnsPerTable(maxColumnsPerTable)
				.attemptBudget(attemptBudget)
				.confidence(confidence)
				.rowCap(rowCap)
				.executionTimeBudget(executionTimeBudget)
				.executionPoolSize(executionPoolSize)
				.generationTimeBudget(generationTimeBudget)
				.generationMaxConcurrent(generationMaxConcurrent)
				.cacheCapacity(cacheCapacity)
				.cacheTtl(cacheTtl)
				.monitorHistorySize(monitorHistorySize);
	}

	private static void requirePositive(String name, int value) {
		if (value < 1) {
			throw new IllegalArgumentException(name + " must be >= 1");
		}
	}

	private static void requirePositive(String name, Duration value) {
		if (value == null || value.isZero() || value.isNegative()) {
			throw new IllegalArgumentException(name + " must be a positive duration");
		}
	}

	public static final class Builder {

		private int maxTables = 5;
		private int maxColumnsPerTable = 8;
		private int attemptBudget = 3;
		private ConfidencePolicy confidence = ConfidencePolicy.defaults();
		private int rowCap = 1000;
		private Duration executionTimeBudget = Duration.ofSeconds(30);
		private int executionPoolSize = 20;
		private Duration generationTimeBudget = Duration.ofSeconds(60);
		private int generationMaxConcurrent = 8;
		private int cacheCapacity = 1000;
		private Duration cacheTtl = Duration.ofHours(1);
		private int monitorHistorySize = 1000;

		private Builder() {
		}

		public Builder maxTables(int maxTables) {
			this.maxTables = maxTables;
			return this;
		}

		public Builder maxColumnsPerTable(int maxColumnsPerTable) {
			this.maxColumnsPerTable = maxColumnsPerTable;
			return this;
		}

		public Builder attemptBudget(int attemptBudget) {
			this.attemptBudget = attemptBudget;
			return this;
		}

		public Builder confidence(ConfidencePolicy confidence) {
			this.confidence = confidence;
			return this;
		}

		public Builder rowCap(int rowCap) {
			this.rowCap = rowCap;
			return this;
		}

		public Builder executionTimeBudget(Duration executionTimeBudget) {
			this.executionTimeBudget = executionTimeBudget;
			return this;
		}

		public Builder executionPoolSize(int executionPoolSize) {
			this.executionPoolSize = executionPoolSize;
			return this;
		}

		public Builder generationTimeBudget(Duration generationTimeBudget) {
			this.generationTimeBudget = generationTimeBudget;
			return this;
		}

		public Builder generationMaxConcurrent(int generationMaxConcurrent) {
			this.generationMaxConcurrent = generationMaxConcurrent;
			return this;
		}

		public Builder cacheCapacity(int cacheCapacity) {
			this.cacheCapacity = cacheCapacity;
			return this;
		}

		public Builder cacheTtl(Duration cacheTtl) {
			this.cacheTtl = cacheTtl;
			return this;
		}

		public Builder monitorHistorySize(int monitorHistorySize) {
			this.monitorHistorySize = monitorHistorySize;
			return this;
		}

		public PipelineSettings build() {
			return new PipelineSettings(maxTables, maxColumnsPerTable, attemptBudget, confidence, rowCap,
					executionTimeBudget, executionPoolSize, generationTimeBudget, generationMaxConcurrent,
					cacheCapacity, cacheTtl, monitorHistorySize);
		}
	}
}
