package org.javai.sqlpilot.exec;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed number of slots for concurrent data-source queries. Waiting for a slot is bounded; callers that cannot
 * get one in time fail instead of queueing.
 */
public final class ExecutionPool {

	private final int capacity;
	private final Semaphore slots;

	public ExecutionPool(int capacity) {
		if (capacity < 1) {
			throw new IllegalArgumentException("capacity must be >= 1");
		}
		this.capacity = capacity;
		this.slots = new Semaphore(capacity, true);
	}

	/**
	 * @return a held slot, or empty if none freed up within the timeout
	 * @throws InterruptedException if the caller was interrupted while waiting
	 */
	public Optional<Slot> tryAcquire(Duration timeout) throws InterruptedException {
		if (slots.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
			return Optional.of(new Slot());
		}
		return Optional.empty();
	}

	public int capacity() {
		return capacity;
	}

	public int available() {
		return slots.availablePermits();
	}

	/**
	 * A held slot. Closing it more than once releases it once.
	 */
	public final class Slot implements AutoCloseable {

		private final AtomicBoolean released = new AtomicBoolean();

		private Slot() {
		}

		@Override
		public void close() {
			if (released.compareAndSet(false, true)) {
				slots.release();
			}
		}
	}
}
