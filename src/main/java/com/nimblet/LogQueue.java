/*
 * Copyright 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.nimblet;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Collection;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.atomic.LongAdder;

import static java.util.Objects.requireNonNull;

/**
 * Bounded FIFO between request-processing threads and the log consumer.
 * <p>
 * {@link #enqueue(LogEntry)} never blocks: when the queue is full the entry is discarded and the drop counter
 * is incremented. Entries that are accepted are drained in the order they were accepted.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class LogQueue {
	@NonNull
	private final Integer capacity;
	@NonNull
	private final ArrayBlockingQueue<LogEntry> entries;
	@NonNull
	private final LongAdder droppedCount;

	public LogQueue(@NonNull Integer capacity) {
		requireNonNull(capacity);

		if (capacity < 1)
			throw new IllegalArgumentException("Log queue capacity must be > 0");

		this.capacity = capacity;
		this.entries = new ArrayBlockingQueue<>(capacity);
		this.droppedCount = new LongAdder();
	}

	/**
	 * Offers an entry to the queue.
	 *
	 * @param logEntry the entry to enqueue
	 * @return {@code true} if accepted, {@code false} if the queue was full and the entry was dropped
	 */
	@NonNull
	public Boolean enqueue(@NonNull LogEntry logEntry) {
		requireNonNull(logEntry);

		if (getEntries().offer(logEntry))
			return true;

		getDroppedCount().increment();
		return false;
	}

	/**
	 * Moves every currently queued entry into the given collection, oldest first.
	 *
	 * @param destination where drained entries go
	 * @return how many entries were drained
	 */
	@NonNull
	public Integer drainTo(@NonNull Collection<? super LogEntry> destination) {
		requireNonNull(destination);
		return getEntries().drainTo(destination);
	}

	/**
	 * Total entries dropped since this queue was created.
	 *
	 * @return the drop count
	 */
	@NonNull
	public Long getDropCount() {
		return getDroppedCount().sum();
	}

	@NonNull
	public Integer size() {
		return getEntries().size();
	}

	@NonNull
	public Integer getCapacity() {
		return this.capacity;
	}

	@NonNull
	private ArrayBlockingQueue<LogEntry> getEntries() {
		return this.entries;
	}

	@NonNull
	private LongAdder getDroppedCount() {
		return this.droppedCount;
	}
}
