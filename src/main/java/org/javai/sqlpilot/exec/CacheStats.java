package org.javai.sqlpilot.exec;

/**
 * Operational view of the result cache.
 *
 * @param size approximate number of entries
 * @param hitCount lookups answered from the cache
 * @param missCount lookups that fell through to execution
 * @param hitRate hits divided by lookups, 1.0 when nothing has been looked up
 */
public record CacheStats(long size, long hitCount, long missCount, double hitRate) {
}
