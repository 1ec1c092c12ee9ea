package org.javai.sqlpilot.metrics;

import java.util.Map;
import org.javai.sqlpilot.route.ComplexityTier;

/**
 * Aggregate view over the monitor's retained history.
 *
 * @param totalRequests requests currently retained
 * @param successRate fraction of retained requests that succeeded, 0 when empty
 * @param averageDurationMillis mean request duration, 0 when empty
 * @param cacheHitRate fraction of retained requests with at least one cache hit, 0 when empty
 * @param requestsByTier request count per routed tier
 */
public record MonitorSnapshot(
		int totalRequests,
		double successRate,
		double averageDurationMillis,
		double cacheHitRate,
		Map<ComplexityTier, Long> requestsByTier
) {

	public MonitorSnapshot {
		requestsByTier = requestsByTier != null ? Map.copyOf(requestsByTier) : Map.of();
	}
}
