package org.javai.sqlpilot.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.lang3.StringUtils;
import org.javai.sqlpilot.analyze.NarrativeGenerator;
import org.javai.sqlpilot.analyze.ResultAnalyzer;
import org.javai.sqlpilot.catalog.CatalogRegistry;
import org.javai.sqlpilot.catalog.CatalogValidator;
import org.javai.sqlpilot.catalog.SchemaCatalog;
import org.javai.sqlpilot.catalog.SchemaCatalogStore;
import org.javai.sqlpilot.catalog.SchemaDiscovery;
import org.javai.sqlpilot.config.PipelineSettings;
import org.javai.sqlpilot.correct.QueryCorrector;
import org.javai.sqlpilot.exec.CacheStats;
import org.javai.sqlpilot.exec.ExecutionPool;
import org.javai.sqlpilot.exec.QueryDataSource;
import org.javai.sqlpilot.exec.QueryExecutor;
import org.javai.sqlpilot.exec.QueryResultCache;
import org.javai.sqlpilot.generation.ChatClientGenerationService;
import org.javai.sqlpilot.generation.GenerationService;
import org.javai.sqlpilot.generation.SchemaPromptRenderer;
import org.javai.sqlpilot.metrics.MonitorSnapshot;
import org.javai.sqlpilot.metrics.PipelineMetrics;
import org.javai.sqlpilot.metrics.PipelineMonitor;
import org.javai.sqlpilot.metrics.RequestRecord;
import org.javai.sqlpilot.reduce.SchemaContextReducer;
import org.javai.sqlpilot.route.ComplexityRouter;
import org.javai.sqlpilot.synth.QuerySynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Entry point of the question-to-query pipeline.
 *
 * <p>Owns the process-wide pieces: the catalog registry, the result cache, the execution pool and the monitor.
 * Each request takes a catalog snapshot and runs through a {@link Supervisor}; the outcome always comes back as a
 * {@link PipelineResponse}, never as an exception.</p>
 *
 * <pre>
 * QueryPipelineService service = QueryPipelineService.builder()
 *         .chatClient(chatClient, "gpt-4o-mini")
 *         .dataSource(new JdbcQueryDataSource(dataSource))
 *         .settings(PipelineSettingsLoader.loadDefault())
 *         .build();
 * service.registerCatalog("sales", catalog);
 * PipelineResponse response = service.process("what is total revenue", "sales");
 * </pre>
 */
public final class QueryPipelineService implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(QueryPipelineService.class);

	private final PipelineSettings settings;
	private final CatalogRegistry registry = new CatalogRegistry();
	private final CatalogValidator validator = new CatalogValidator();
	private final SchemaCatalogStore catalogStore;
	private final SchemaContextReducer reducer;
	private final QueryResultCache cache;
	private final ExecutionPool pool;
	private final QueryExecutor executor;
	private final Supervisor supervisor;
	private final NarrativeGenerator narrativeGenerator;
	private final PipelineMonitor monitor;
	private final ExecutorService requestWorkers;
	private final AutoCloseable ownedGeneration;

	private QueryPipelineService(Builder builder) {
		this.settings = builder.settings;
		this.catalogStore = builder.catalogStore;
		this.ownedGeneration = builder.ownedGeneration;
		GenerationService generation = builder.generation;
		SchemaPromptRenderer renderer = new SchemaPromptRenderer(settings.maxColumnsPerTable());

		this.reducer = new SchemaContextReducer(settings.maxTables(), settings.cacheCapacity());
		this.cache = new QueryResultCache(settings.cacheCapacity(), settings.cacheTtl());
		this.pool = new ExecutionPool(settings.executionPoolSize());
		this.executor = new QueryExecutor(builder.dataSource, cache, pool);
		this.monitor = new PipelineMonitor(settings.monitorHistorySize());
		this.narrativeGenerator = new NarrativeGenerator(generation, builder.objectMapper,
				settings.generationTimeBudget());
		this.supervisor = new Supervisor(
				reducer,
				new ComplexityRouter(),
				new QuerySynthesizer(generation, renderer, settings.confidence(), settings.generationTimeBudget()),
				executor,
				new ResultAnalyzer(settings.confidence(), settings.rowCap()),
				new QueryCorrector(generation, renderer, settings.confidence(), settings.generationTimeBudget()),
				settings.attemptBudget(),
				settings.confidence().successThreshold(),
				settings.rowCap(),
				settings.executionTimeBudget());
		this.requestWorkers = Executors.newCachedThreadPool(requestThreads());
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Processes one question against the catalog registered under {@code catalogId}.
	 *
	 * @throws IllegalArgumentException if the question is null
	 */
	public PipelineResponse process(String question, String catalogId) {
		if (question == null) {
			throw new IllegalArgumentException("question must not be null");
		}
		long start = System.nanoTime();
		WorkflowState state;
		try {
			state = supervisor.run(question, registry.snapshot(catalogId).orElse(null));
		} catch (RuntimeException e) {
			logger.error("Pipeline fault for question '{}'", StringUtils.abbreviate(question, 100), e);
			long millis = (System.nanoTime() - start) / 1_000_000;
			PipelineResponse failed = new PipelineResponse.Failed("",
					List.of(new PipelineError(ErrorKind.INTERNAL_ERROR, String.valueOf(e.getMessage()), 0)), 0,
					new PipelineMetrics(null, 0, false, millis, List.of()));
			record(question, failed, List.of(ErrorKind.INTERNAL_ERROR.name()));
			return failed;
		}
		return respond(state);
	}

	/**
	 * Processes a question on a background thread. Cancelling the returned future abandons the request: in-flight
	 * generation or execution results are discarded and no response is delivered.
	 */
	public CompletableFuture<PipelineResponse> processAsync(String question, String catalogId) {
		if (question == null) {
			throw new IllegalArgumentException("question must not be null");
		}
		CompletableFuture<PipelineResponse> response = new CompletableFuture<>();
		Future<?> task;
		try {
			task = requestWorkers.submit(() -> {
				try {
					response.complete(process(question, catalogId));
				} catch (RuntimeException e) {
					response.completeExceptionally(e);
				}
			});
		} catch (RejectedExecutionException e) {
			response.completeExceptionally(e);
			return response;
		}
		response.whenComplete((result, error) -> {
			if (response.isCancelled()) {
				task.cancel(true);
				logger.info("Request abandoned by caller");
			}
		});
		return response;
	}

	/**
	 * Validates and registers a catalog. Warnings are logged, structural errors raise
	 * {@link org.javai.sqlpilot.catalog.CatalogException}.
	 */
	public void registerCatalog(String catalogId, SchemaCatalog catalog) {
		validator.validate(catalog).forEach(warning -> logger.warn("Catalog '{}': {}", catalogId, warning));
		registry.register(catalogId, catalog);
	}

	/**
	 * Loads a catalog from the configured store and registers it.
	 *
	 * @return true if the store held a catalog under that id
	 */
	public boolean restoreCatalog(String catalogId) {
		if (catalogStore == null) {
			return false;
		}
		Optional<SchemaCatalog> stored = catalogStore.load(catalogId);
		stored.ifPresent(catalog -> registerCatalog(catalogId, catalog));
		return stored.isPresent();
	}

	/**
	 * Rebuilds a catalog through discovery and swaps it in. Requests already running keep their snapshot. The
	 * result cache and the reducer cache are flushed, and the new catalog is saved if a store is configured.
	 *
	 * @throws org.javai.sqlpilot.catalog.CatalogException if discovery, validation or saving fails; on a
	 * discovery or validation failure the previous catalog stays active
	 */
	public SchemaCatalog refreshSchema(String catalogId, SchemaDiscovery discovery) {
		SchemaCatalog refreshed = registry.refresh(catalogId, discovery, validator);
		cache.flush();
		reducer.invalidateAll();
		if (catalogStore != null) {
			catalogStore.save(catalogId, refreshed);
		}
		return refreshed;
	}

	public CacheStats cacheStats() {
		return cache.stats();
	}

	public void flushCache() {
		cache.flush();
		logger.info("Result cache flushed");
	}

	public MonitorSnapshot monitorSnapshot() {
		return monitor.snapshot();
	}

	public SystemStatus status() {
		return new SystemStatus(registry.catalogIds(), cache.stats(), monitor.snapshot(), pool.available());
	}

	public PipelineSettings settings() {
		return settings;
	}

	@Override
	public void close() {
		requestWorkers.shutdownNow();
		executor.close();
		if (ownedGeneration != null) {
			try {
				ownedGeneration.close();
			} catch (Exception e) {
				logger.warn("Failed to close generation service", e);
			}
		}
	}

	private PipelineResponse respond(WorkflowState state) {
		PipelineMetrics metrics = new PipelineMetrics(state.tier(), state.attempts(), state.cacheHit(),
				state.elapsedMillis(), state.rounds());
		PipelineResponse response;
		if (state.state() == PipelineState.SUCCEEDED) {
			String narrative = narrativeGenerator.narrate(state.question(), state.candidateQuery(), state.results());
			response = new PipelineResponse.Succeeded(state.candidateQuery(), state.results(), narrative,
					state.confidence(), state.attempts(), state.analysis().suggestions(), metrics);
		} else {
			response = new PipelineResponse.Failed(state.candidateQuery(), state.errors(), state.attempts(), metrics);
		}
		List<String> errorKinds = state.state() == PipelineState.SUCCEEDED ? List.of()
				: state.errors().stream().map(error -> error.kind().name()).distinct().toList();
		record(state.question(), response, errorKinds);
		return response;
	}

	private void record(String question, PipelineResponse response, List<String> errorKinds) {
		PipelineMetrics metrics = response.metrics();
		monitor.record(new RequestRecord(question, metrics.tier(), response.attempts(), metrics.durationMillis(),
				metrics.cacheHit(), response.status() == PipelineResponse.Status.SUCCEEDED, errorKinds));
	}

	private static ThreadFactory requestThreads() {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, "sqlpilot-request-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

	public static final class Builder {
		private GenerationService generation;
		private AutoCloseable ownedGeneration;
		private QueryDataSource dataSource;
		private PipelineSettings settings = PipelineSettings.defaults();
		private SchemaCatalogStore catalogStore;
		private ObjectMapper objectMapper;

		private Builder() {
		}

		public Builder generationService(GenerationService generation) {
			this.generation = generation;
			this.ownedGeneration = null;
			return this;
		}

		/**
		 * Serves every tier from one chat client.
		 */
		public Builder chatClient(ChatClient chatClient, String modelId) {
			Objects.requireNonNull(chatClient, "chatClient must not be null");
			ChatClientGenerationService service = ChatClientGenerationService.builder()
					.defaultTier(chatClient, modelId, settings.generationMaxConcurrent())
					.build();
			this.generation = service;
			this.ownedGeneration = service;
			return this;
		}

		public Builder dataSource(QueryDataSource dataSource) {
			this.dataSource = dataSource;
			return this;
		}

		/**
		 * Set before {@link #chatClient(ChatClient, String)} for its concurrency ceiling to apply.
		 */
		public Builder settings(PipelineSettings settings) {
			if (settings != null) {
				this.settings = settings;
			}
			return this;
		}

		public Builder catalogStore(SchemaCatalogStore catalogStore) {
			this.catalogStore = catalogStore;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
			return this;
		}

		public QueryPipelineService build() {
			if (generation == null) {
				throw new IllegalStateException("A generation service or chat client is required");
			}
			if (dataSource == null) {
				throw new IllegalStateException("A data source is required");
			}
			if (objectMapper == null) {
				objectMapper = new ObjectMapper();
			}
			return new QueryPipelineService(this);
		}
	}
}
