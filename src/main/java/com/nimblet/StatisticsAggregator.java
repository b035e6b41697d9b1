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

import com.nimblet.StatsCounters.Counts;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Aggregates request and connection counts and periodically emits a {@link StatsSnapshot}.
 * <p>
 * Recording methods may be called from any thread. Every {@code frequency}, the window counters are
 * read-and-reset and a snapshot carrying both the cumulative and windowed values is handed to the sink
 * (normally {@link LoggingSystem#log(LogEntry)}).
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class StatisticsAggregator {
	@NonNull
	private static final Logger logger;

	static {
		logger = LoggerFactory.getLogger(StatisticsAggregator.class);
	}

	@NonNull
	private final Duration frequency;
	@NonNull
	private final Consumer<StatsSnapshot> snapshotConsumer;
	@NonNull
	private final StatsCounters cumulative;
	@NonNull
	private final StatsCounters windowed;
	@NonNull
	private final ReentrantLock lock;
	private volatile long startedAtNanos;
	private volatile long windowStartedAtNanos;
	@Nullable
	private volatile ScheduledExecutorService timerExecutorService;

	public StatisticsAggregator(@NonNull Duration frequency,
															@NonNull Consumer<StatsSnapshot> snapshotConsumer) {
		requireNonNull(frequency);
		requireNonNull(snapshotConsumer);

		if (frequency.toMillis() < 1)
			throw new IllegalArgumentException("Statistics frequency must be at least 1 millisecond");

		this.frequency = frequency;
		this.snapshotConsumer = snapshotConsumer;
		this.cumulative = new StatsCounters();
		this.windowed = new StatsCounters();
		this.lock = new ReentrantLock();
		this.startedAtNanos = System.nanoTime();
		this.windowStartedAtNanos = this.startedAtNanos;
	}

	public void start() {
		getLock().lock();

		try {
			if (this.timerExecutorService != null)
				return;

			this.startedAtNanos = System.nanoTime();
			this.windowStartedAtNanos = this.startedAtNanos;

			ScheduledExecutorService timerExecutorService = Executors.newSingleThreadScheduledExecutor(
					new DefaultServer.NonvirtualThreadFactory("nimblet-stats"));
			long frequencyMillis = getFrequency().toMillis();
			timerExecutorService.scheduleAtFixedRate(this::flushSafely, frequencyMillis, frequencyMillis, TimeUnit.MILLISECONDS);

			this.timerExecutorService = timerExecutorService;
		} finally {
			getLock().unlock();
		}
	}

	public void stop() {
		getLock().lock();

		try {
			ScheduledExecutorService timerExecutorService = this.timerExecutorService;
			this.timerExecutorService = null;

			if (timerExecutorService != null)
				timerExecutorService.shutdownNow();
		} finally {
			getLock().unlock();
		}
	}

	public void recordRequest(@NonNull Duration latency) {
		requireNonNull(latency);
		getCumulative().recordRequest(latency);
		getWindowed().recordRequest(latency);
	}

	public void recordConnectionOpened() {
		getCumulative().recordConnectionOpened();
		getWindowed().recordConnectionOpened();
	}

	public void recordConnectionClosed() {
		getCumulative().recordConnectionClosed();
		getWindowed().recordConnectionClosed();
	}

	public void recordIdleDisconnect() {
		getCumulative().recordIdleDisconnect();
		getWindowed().recordIdleDisconnect();
	}

	public void recordRequestTimeout() {
		getCumulative().recordRequestTimeout();
		getWindowed().recordRequestTimeout();
	}

	/**
	 * Closes the current window: reads and resets the window counters and emits a snapshot.
	 *
	 * @return the emitted snapshot
	 */
	@NonNull
	public StatsSnapshot flush() {
		getLock().lock();

		try {
			long now = System.nanoTime();
			Counts windowCounts = getWindowed().readAndReset();
			Counts cumulativeCounts = getCumulative().read();
			Duration window = Duration.ofNanos(now - this.windowStartedAtNanos);
			Duration uptime = Duration.ofNanos(now - this.startedAtNanos);

			this.windowStartedAtNanos = now;

			StatsSnapshot statsSnapshot = new StatsSnapshot(Instant.now(), uptime, window, cumulativeCounts, windowCounts);
			getSnapshotConsumer().accept(statsSnapshot);
			return statsSnapshot;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Current counts without closing the window.
	 *
	 * @return cumulative counts since start
	 */
	@NonNull
	public Counts getCumulativeCounts() {
		return getCumulative().read();
	}

	@NonNull
	public Counts getWindowCounts() {
		return getWindowed().read();
	}

	private void flushSafely() {
		try {
			flush();
		} catch (RuntimeException e) {
			logger.error("Unable to emit statistics snapshot", e);
		}
	}

	@NonNull
	public Duration getFrequency() {
		return this.frequency;
	}

	@NonNull
	private Consumer<StatsSnapshot> getSnapshotConsumer() {
		return this.snapshotConsumer;
	}

	@NonNull
	private StatsCounters getCumulative() {
		return this.cumulative;
	}

	@NonNull
	private StatsCounters getWindowed() {
		return this.windowed;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	protected Optional<ScheduledExecutorService> getTimerExecutorService() {
		return Optional.ofNullable(this.timerExecutorService);
	}
}
