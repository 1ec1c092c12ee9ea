package org.javai.sqlpilot.exec;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs candidate queries against the data source under a row cap and a time budget.
 *
 * <h2>Order of operations</h2>
 * <ol>
 *   <li>Queries that are not pure reads are refused with {@link ExecutionOutcome.Forbidden}; the data source is
 *   never called.</li>
 *   <li>The result cache is consulted by {@link QueryFingerprint}; a hit returns the stored rows.</li>
 *   <li>The query gets a row limit if it has none, waits for an execution slot and runs on a worker thread.</li>
 *   <li>A result is stored in the cache; faults come back as typed outcomes carrying the engine's message.</li>
 * </ol>
 *
 * <p>The slot wait and the query share one time budget. When the budget runs out the call is abandoned, not
 * cancelled: its slot is released when the data source eventually returns, and its result is discarded.</p>
 */
public final class QueryExecutor implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

	private final QueryDataSource dataSource;
	private final QueryResultCache cache;
	private final ExecutionPool pool;
	private final ExecutorService workers;
	private final boolean ownsWorkers;
	private final ReadOnlyGuard guard = new ReadOnlyGuard();
	private final RowLimiter rowLimiter = new RowLimiter();

	public QueryExecutor(QueryDataSource dataSource, QueryResultCache cache, ExecutionPool pool) {
		this(dataSource, cache, pool, Executors.newCachedThreadPool(daemonThreads()), true);
	}

	public QueryExecutor(QueryDataSource dataSource, QueryResultCache cache, ExecutionPool pool,
			ExecutorService workers) {
		this(dataSource, cache, pool, workers, false);
	}

	private QueryExecutor(QueryDataSource dataSource, QueryResultCache cache, ExecutionPool pool,
			ExecutorService workers, boolean ownsWorkers) {
		this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
		this.cache = Objects.requireNonNull(cache, "cache must not be null");
		this.pool = Objects.requireNonNull(pool, "pool must not be null");
		this.workers = Objects.requireNonNull(workers, "workers must not be null");
		this.ownsWorkers = ownsWorkers;
	}

	public ExecutionOutcome execute(String query, int rowCap, Duration timeBudget) {
		if (query == null || query.isBlank()) {
			return new ExecutionOutcome.EngineError("no query to execute");
		}
		Optional<String> violation = guard.violation(query);
		if (violation.isPresent()) {
			logger.warn("Refused query: {} [{}]", violation.get(), query);
			return new ExecutionOutcome.Forbidden(violation.get());
		}

		String fingerprint = QueryFingerprint.of(query, rowCap);
		Optional<QueryRows> cached = cache.lookup(fingerprint);
		if (cached.isPresent()) {
			logger.debug("Cache hit for {}", fingerprint);
			return new ExecutionOutcome.Success(cached.get(), true, query);
		}

		String limited = rowLimiter.apply(query, rowCap);
		long deadline = System.nanoTime() + timeBudget.toNanos();
		ExecutionPool.Slot slot;
		try {
			Optional<ExecutionPool.Slot> acquired = pool.tryAcquire(timeBudget);
			if (acquired.isEmpty()) {
				logger.warn("No execution slot within {} ({} slots busy)", timeBudget, pool.capacity());
				return new ExecutionOutcome.TimedOut("no execution slot became free within " + timeBudget);
			}
			slot = acquired.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return new ExecutionOutcome.TimedOut("execution abandoned while waiting for a slot");
		}

		Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
		Future<QueryRows> call;
		try {
			call = workers.submit(() -> {
				try (slot) {
					return dataSource.execute(limited, rowCap, remaining);
				}
			});
		} catch (RejectedExecutionException e) {
			slot.close();
			return new ExecutionOutcome.EngineError("executor is shut down");
		}

		try {
			QueryRows rows = call.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
			QueryRows stored = cache.store(fingerprint, rows);
			logger.info("Executed query, {} rows", stored.size());
			return new ExecutionOutcome.Success(stored, false, limited);
		} catch (TimeoutException e) {
			logger.warn("Query exceeded time budget of {}, abandoning it", timeBudget);
			return new ExecutionOutcome.TimedOut("query exceeded the time budget of " + timeBudget);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return new ExecutionOutcome.TimedOut("execution abandoned");
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof DataSourceTimeoutException timeout) {
				return new ExecutionOutcome.TimedOut(String.valueOf(timeout.getMessage()));
			}
			logger.info("Query failed: {}", cause.getMessage());
			return new ExecutionOutcome.EngineError(String.valueOf(cause.getMessage()));
		}
	}

	@Override
	public void close() {
		if (ownsWorkers) {
			workers.shutdownNow();
		}
	}

	private static ThreadFactory daemonThreads() {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, "sqlpilot-exec-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}
}
