package org.javai.sqlpilot.exec;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared store of query results keyed by {@link QueryFingerprint}.
 *
 * <p>Entries expire a fixed time after they were written and the store is bounded in size. Concurrent writers
 * for one fingerprint are resolved first-writer-wins: {@link #store} returns whichever result is cached after
 * the call, so every caller sees the same rows.</p>
 */
public final class QueryResultCache {

	private static final Logger logger = LoggerFactory.getLogger(QueryResultCache.class);

	private final Cache<String, QueryRows> cache;

	public QueryResultCache(int capacity, Duration ttl) {
		this(capacity, ttl, Ticker.systemTicker());
	}

	/**
	 * @param ticker time source for expiry, replaceable in tests
	 */
	public QueryResultCache(int capacity, Duration ttl, Ticker ticker) {
		this.cache = Caffeine.newBuilder()
				.recordStats()
				.maximumSize(capacity)
				.expireAfterWrite(ttl)
				.ticker(ticker)
				.executor(Runnable::run)
				.build();
	}

	public Optional<QueryRows> lookup(String fingerprint) {
		return Optional.ofNullable(cache.getIfPresent(fingerprint));
	}

	/**
	 * Stores a result unless another writer got there first.
	 *
	 * @return the cached result for the fingerprint
	 */
	public QueryRows store(String fingerprint, QueryRows rows) {
		QueryRows existing = cache.asMap().putIfAbsent(fingerprint, rows);
		return existing != null ? existing : rows;
	}

	public CacheStats stats() {
		cache.cleanUp();
		com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
		return new CacheStats(cache.estimatedSize(), stats.hitCount(), stats.missCount(), stats.hitRate());
	}

	public void flush() {
		long size = cache.estimatedSize();
		cache.invalidateAll();
		cache.cleanUp();
		logger.info("Flushed result cache ({} entries)", size);
	}
}
