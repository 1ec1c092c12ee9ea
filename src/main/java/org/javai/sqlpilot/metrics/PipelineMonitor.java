package org.javai.sqlpilot.metrics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.sqlpilot.route.ComplexityTier;

/**
 * Bounded in-memory history of completed requests. Oldest records are dropped once the history is full.
 */
public final class PipelineMonitor {

	public static final int DEFAULT_HISTORY_SIZE = 1000;

	private final int historySize;
	private final Deque<RequestRecord> history;

	public PipelineMonitor() {
		this(DEFAULT_HISTORY_SIZE);
	}

	public PipelineMonitor(int historySize) {
		if (historySize < 1) {
			throw new IllegalArgumentException("historySize must be >= 1");
		}
		this.historySize = historySize;
		this.history = new ArrayDeque<>(Math.min(historySize, 1024));
	}

	public synchronized void record(RequestRecord record) {
		Objects.requireNonNull(record, "record must not be null");
		if (history.size() == historySize) {
			history.removeFirst();
		}
		history.addLast(record);
	}

	public synchronized List<RequestRecord> history() {
		return List.copyOf(history);
	}

	public synchronized MonitorSnapshot snapshot() {
		int total = history.size();
		if (total == 0) {
			return new MonitorSnapshot(0, 0.0, 0.0, 0.0, Map.of());
		}
		long succeeded = 0;
		long cacheHits = 0;
		long duration = 0;
		Map<ComplexityTier, Long> byTier = new EnumMap<>(ComplexityTier.class);
		for (RequestRecord record : history) {
			if (record.succeeded()) {
				succeeded++;
			}
			if (record.cacheHit()) {
				cacheHits++;
			}
			duration += record.durationMillis();
			if (record.tier() != null) {
				byTier.merge(record.tier(), 1L, Long::sum);
			}
		}
		return new MonitorSnapshot(total, (double) succeeded / total, (double) duration / total,
				(double) cacheHits / total, byTier);
	}

	public synchronized void clear() {
		history.clear();
	}
}
