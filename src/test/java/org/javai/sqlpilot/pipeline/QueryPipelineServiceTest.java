package org.javai.sqlpilot.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.javai.sqlpilot.catalog.CatalogException;
import org.javai.sqlpilot.catalog.JsonSchemaCatalogStore;
import org.javai.sqlpilot.config.PipelineSettings;
import org.javai.sqlpilot.generation.GenerationException;
import org.javai.sqlpilot.generation.GenerationService;
import org.javai.sqlpilot.metrics.MonitorSnapshot;
import org.javai.sqlpilot.testsupport.Catalogs;
import org.javai.sqlpilot.testsupport.RecordingDataSource;
import org.javai.sqlpilot.testsupport.ScriptedGenerationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("QueryPipelineService")
class QueryPipelineServiceTest {

	private static final String TOTAL_REVENUE = "what is total revenue";
	private static final String SUM_QUERY = "SELECT SUM(amount) AS total_revenue FROM orders";

	private final RecordingDataSource dataSource = new RecordingDataSource()
			.when("sum(amount)", RecordingDataSource.row("total_revenue", 1234.5));
	private QueryPipelineService service;

	@AfterEach
	void tearDown() {
		if (service != null) {
			service.close();
		}
	}

	private QueryPipelineService service(GenerationService generation) {
		service = QueryPipelineService.builder()
				.generationService(generation)
				.dataSource(dataSource)
				.settings(PipelineSettings.builder().attemptBudget(3).executionPoolSize(4).build())
				.build();
		service.registerCatalog("sales", Catalogs.orders());
		return service;
	}

	@Nested
	@DisplayName("processing")
	class Processing {

		@Test
		@DisplayName("answers with rows, a narrative and metrics")
		void succeeds() {
			PipelineResponse response = service(ScriptedGenerationService.responding(SUM_QUERY))
					.process(TOTAL_REVENUE, "sales");

			assertThat(response).isInstanceOf(PipelineResponse.Succeeded.class);
			PipelineResponse.Succeeded succeeded = (PipelineResponse.Succeeded) response;
			assertThat(succeeded.query()).isEqualTo(SUM_QUERY);
			assertThat(succeeded.results().rows()).singleElement()
					.satisfies(row -> assertThat(row).containsEntry("total_revenue", 1234.5));
			assertThat(succeeded.narrative()).isEqualTo(ScriptedGenerationService.NARRATIVE);
			assertThat(succeeded.confidence()).isGreaterThanOrEqualTo(0.8);
			assertThat(succeeded.attempts()).isEqualTo(1);
			assertThat(succeeded.metrics().totalAttempts()).isEqualTo(1);
			assertThat(succeeded.metrics().cacheHit()).isFalse();
		}

		@Test
		@DisplayName("serves a repeated question from the result cache")
		void cachesResults() {
			QueryPipelineService pipeline = service(ScriptedGenerationService.responding(SUM_QUERY, SUM_QUERY));

			pipeline.process(TOTAL_REVENUE, "sales");
			PipelineResponse second = pipeline.process(TOTAL_REVENUE, "sales");

			assertThat(second.status()).isEqualTo(PipelineResponse.Status.SUCCEEDED);
			assertThat(second.metrics().cacheHit()).isTrue();
			assertThat(dataSource.callCount()).isEqualTo(1);
			assertThat(pipeline.cacheStats().hitCount()).isEqualTo(1);
		}

		@Test
		@DisplayName("fails with a schema error for an unknown catalog")
		void unknownCatalog() {
			ScriptedGenerationService generation = ScriptedGenerationService.responding(SUM_QUERY);

			PipelineResponse response = service(generation).process(TOTAL_REVENUE, "inventory");

			assertThat(response).isInstanceOf(PipelineResponse.Failed.class);
			assertThat(((PipelineResponse.Failed) response).hasError(ErrorKind.SCHEMA_UNAVAILABLE)).isTrue();
			assertThat(response.attempts()).isZero();
			assertThat(generation.callCount()).isZero();
		}

		@Test
		@DisplayName("reports exhausted attempts as a failure")
		void exhausted() {
			PipelineResponse response = service(ScriptedGenerationService.alwaysFailing())
					.process(TOTAL_REVENUE, "sales");

			assertThat(response.status()).isEqualTo(PipelineResponse.Status.FAILED);
			assertThat(response.attempts()).isEqualTo(3);
			assertThat(((PipelineResponse.Failed) response).hasError(ErrorKind.ATTEMPTS_EXHAUSTED)).isTrue();
		}

		@Test
		@DisplayName("rejects a missing question")
		void nullQuestion() {
			QueryPipelineService pipeline = service(ScriptedGenerationService.responding(SUM_QUERY));

			assertThatThrownBy(() -> pipeline.process(null, "sales"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessage("question must not be null");
		}

		@Test
		@DisplayName("records every request in the monitor")
		void monitors() {
			QueryPipelineService pipeline = service(ScriptedGenerationService.responding(SUM_QUERY));

			pipeline.process(TOTAL_REVENUE, "sales");
			pipeline.process(TOTAL_REVENUE, "inventory");

			MonitorSnapshot snapshot = pipeline.monitorSnapshot();
			assertThat(snapshot.totalRequests()).isEqualTo(2);
			assertThat(snapshot.successRate()).isEqualTo(0.5);
		}
	}

	@Nested
	@DisplayName("asynchronous processing")
	class AsyncProcessing {

		@Test
		@DisplayName("completes with the response")
		void completes() throws Exception {
			PipelineResponse response = service(ScriptedGenerationService.responding(SUM_QUERY))
					.processAsync(TOTAL_REVENUE, "sales")
					.get(10, TimeUnit.SECONDS);

			assertThat(response.status()).isEqualTo(PipelineResponse.Status.SUCCEEDED);
		}

		@Test
		@DisplayName("abandons the request when the caller cancels")
		void cancels() throws Exception {
			CountDownLatch started = new CountDownLatch(1);
			CountDownLatch release = new CountDownLatch(1);
			GenerationService blocking = request -> {
				started.countDown();
				try {
					release.await(10, TimeUnit.SECONDS);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new GenerationException("generation abandoned", e);
				}
				return SUM_QUERY;
			};
			QueryPipelineService pipeline = service(blocking);

			CompletableFuture<PipelineResponse> future = pipeline.processAsync(TOTAL_REVENUE, "sales");
			assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();
			future.cancel(true);

			assertThat(future.isCancelled()).isTrue();
			assertThatThrownBy(future::join).isInstanceOf(CancellationException.class);
			long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
			while (pipeline.monitorSnapshot().totalRequests() == 0 && System.nanoTime() < deadline) {
				Thread.sleep(10);
			}
			assertThat(pipeline.monitorSnapshot().totalRequests()).isEqualTo(1);
			assertThat(pipeline.monitorSnapshot().successRate()).isZero();
			assertThat(dataSource.callCount()).isZero();
		}
	}

	@Nested
	@DisplayName("catalog management")
	class CatalogManagement {

		@Test
		@DisplayName("refreshing a schema flushes cached results")
		void refreshFlushesCache() {
			QueryPipelineService pipeline = service(ScriptedGenerationService.responding(SUM_QUERY, SUM_QUERY));
			pipeline.process(TOTAL_REVENUE, "sales");

			pipeline.refreshSchema("sales", catalogId -> Catalogs.orders());
			PipelineResponse second = pipeline.process(TOTAL_REVENUE, "sales");

			assertThat(second.metrics().cacheHit()).isFalse();
			assertThat(dataSource.callCount()).isEqualTo(2);
		}

		@Test
		@DisplayName("a failed refresh keeps the previous catalog")
		void failedRefresh() {
			QueryPipelineService pipeline = service(ScriptedGenerationService.responding(SUM_QUERY));

			assertThatThrownBy(() -> pipeline.refreshSchema("sales", catalogId -> {
				throw new CatalogException("warehouse unreachable");
			})).isInstanceOf(CatalogException.class);

			assertThat(pipeline.process(TOTAL_REVENUE, "sales").status()).isEqualTo(PipelineResponse.Status.SUCCEEDED);
		}

		@Test
		@DisplayName("restores a catalog from the store")
		void restores(@TempDir Path directory) {
			new JsonSchemaCatalogStore(directory).save("archive", Catalogs.orders());
			service = QueryPipelineService.builder()
					.generationService(ScriptedGenerationService.responding(SUM_QUERY))
					.dataSource(dataSource)
					.catalogStore(new JsonSchemaCatalogStore(directory))
					.build();

			assertThat(service.restoreCatalog("archive")).isTrue();
			assertThat(service.restoreCatalog("missing")).isFalse();
			assertThat(service.process(TOTAL_REVENUE, "archive").status())
					.isEqualTo(PipelineResponse.Status.SUCCEEDED);
		}

		@Test
		@DisplayName("reports its status")
		void status() {
			QueryPipelineService pipeline = service(ScriptedGenerationService.responding(SUM_QUERY));

			SystemStatus status = pipeline.status();

			assertThat(status.catalogIds()).containsExactly("sales");
			assertThat(status.availableExecutionSlots()).isEqualTo(4);
			assertThat(status.monitor().totalRequests()).isZero();
		}
	}

	@Test
	@DisplayName("requires a generation service and a data source")
	void builderValidation() {
		assertThatThrownBy(() -> QueryPipelineService.builder().dataSource(dataSource).build())
				.isInstanceOf(IllegalStateException.class)
				.hasMessage("A generation service or chat client is required");
		assertThatThrownBy(() -> QueryPipelineService.builder()
				.generationService(ScriptedGenerationService.responding()).build())
				.isInstanceOf(IllegalStateException.class)
				.hasMessage("A data source is required");
	}
}
