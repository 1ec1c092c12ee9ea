package org.javai.sqlpilot.pipeline;

import java.util.Set;
import org.javai.sqlpilot.exec.CacheStats;
import org.javai.sqlpilot.metrics.MonitorSnapshot;

/**
 * Operational view of a running {@link QueryPipelineService}.
 *
 * @param catalogIds ids of the registered catalogs
 * @param cache result cache statistics
 * @param monitor aggregate of recent requests
 * @param availableExecutionSlots execution slots free at the time of the call
 */
public record SystemStatus(Set<String> catalogIds, CacheStats cache, MonitorSnapshot monitor,
		int availableExecutionSlots) {

	public SystemStatus {
		catalogIds = catalogIds != null ? Set.copyOf(catalogIds) : Set.of();
	}
}
