package org.javai.sqlpilot.exec;

import static org.assertj.core.api.Assertions.assertThat;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("QueryResultCache")
class QueryResultCacheTest {

	private final AtomicLong nanos = new AtomicLong();
	private final QueryResultCache cache = new QueryResultCache(100, Duration.ofMinutes(10), nanos::get);

	@Test
	@DisplayName("fingerprints ignore cosmetic differences but not literals or row caps")
	void fingerprints() {
		String fingerprint = QueryFingerprint.of("SELECT SUM(amount) FROM orders", 1000);

		assertThat(QueryFingerprint.of("select  sum(amount)\nfrom ORDERS;", 1000)).isEqualTo(fingerprint);
		assertThat(QueryFingerprint.of("SELECT SUM(amount) FROM orders", 10)).isNotEqualTo(fingerprint);
		assertThat(QueryFingerprint.of("SELECT * FROM t WHERE a = 'X'", 10))
				.isNotEqualTo(QueryFingerprint.of("SELECT * FROM t WHERE a = 'x'", 10));
		assertThat(fingerprint).hasSize(64);
	}

	@Test
	@DisplayName("first writer wins")
	void firstWriterWins() {
		QueryRows first = rows(1);
		QueryRows second = rows(2);

		assertThat(cache.store("k", first)).isSameAs(first);
		assertThat(cache.store("k", second)).isSameAs(first);
		assertThat(cache.lookup("k")).containsSame(first);
	}

	@Test
	@DisplayName("entries expire after the TTL")
	void expires() {
		cache.store("k", rows(1));
		nanos.addAndGet(TimeUnit.MINUTES.toNanos(9));
		assertThat(cache.lookup("k")).isPresent();

		nanos.addAndGet(TimeUnit.MINUTES.toNanos(2));
		assertThat(cache.lookup("k")).isEmpty();
	}

	@Test
	@DisplayName("size stays within capacity")
	void bounded() {
		QueryResultCache small = new QueryResultCache(3, Duration.ofMinutes(10), nanos::get);
		for (int i = 0; i < 20; i++) {
			small.store("k" + i, rows(i));
		}

		assertThat(small.stats().size()).isLessThanOrEqualTo(3);
	}

	@Test
	@DisplayName("reports hits and misses and can be flushed")
	void statsAndFlush() {
		cache.store("k", rows(1));
		cache.lookup("k");
		cache.lookup("missing");

		CacheStats stats = cache.stats();
		assertThat(stats.size()).isEqualTo(1);
		assertThat(stats.hitCount()).isEqualTo(1);
		assertThat(stats.missCount()).isEqualTo(1);
		assertThat(stats.hitRate()).isEqualTo(0.5);

		cache.flush();
		assertThat(cache.stats().size()).isZero();
		assertThat(cache.lookup("k")).isEmpty();
	}

	private static QueryRows rows(int value) {
		return QueryRows.of(List.of(Map.of("value", value)));
	}
}
