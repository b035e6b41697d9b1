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
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static java.util.Objects.requireNonNull;

/**
 * Lock-free counters updated by any engine thread.
 * <p>
 * Two instances exist per aggregator: one cumulative since start, one for the current reporting window.
 * Only the statistics timer reads and resets the window instance.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class StatsCounters {
	@NonNull
	private final AtomicLong requests;
	@NonNull
	private final AtomicLong connections;
	@NonNull
	private final AtomicLong connects;
	@NonNull
	private final AtomicLong idleDisconnects;
	@NonNull
	private final AtomicLong requestTimeouts;
	@NonNull
	private final AtomicLong latencyCount;
	@NonNull
	private final AtomicLong latencySumNanos;
	@NonNull
	private final AtomicLong latencyMaxNanos;

	public StatsCounters() {
		this.requests = new AtomicLong();
		this.connections = new AtomicLong();
		this.connects = new AtomicLong();
		this.idleDisconnects = new AtomicLong();
		this.requestTimeouts = new AtomicLong();
		this.latencyCount = new AtomicLong();
		this.latencySumNanos = new AtomicLong();
		this.latencyMaxNanos = new AtomicLong();
	}

	public void recordRequest(@NonNull Duration latency) {
		requireNonNull(latency);

		long nanos = Math.max(0L, latency.toNanos());

		this.requests.incrementAndGet();
		this.latencyCount.incrementAndGet();
		this.latencySumNanos.addAndGet(nanos);
		this.latencyMaxNanos.accumulateAndGet(nanos, Math::max);
	}

	public void recordConnectionOpened() {
		this.connects.incrementAndGet();
		this.connections.incrementAndGet();
	}

	public void recordConnectionClosed() {
		this.connections.decrementAndGet();
	}

	public void recordIdleDisconnect() {
		this.idleDisconnects.incrementAndGet();
	}

	public void recordRequestTimeout() {
		this.requestTimeouts.incrementAndGet();
	}

	/**
	 * Reads the current values without modifying them.
	 *
	 * @return a point-in-time copy
	 */
	@NonNull
	public Counts read() {
		return new Counts(requests.get(), connections.get(), connects.get(), idleDisconnects.get(),
				requestTimeouts.get(), latencyCount.get(), latencySumNanos.get(), latencyMaxNanos.get());
	}

	/**
	 * Reads the current values and zeroes every counter except the live connection gauge.
	 *
	 * @return the values accumulated since the previous reset
	 */
	@NonNull
	public Counts readAndReset() {
		return new Counts(requests.getAndSet(0), connections.get(), connects.getAndSet(0), idleDisconnects.getAndSet(0),
				requestTimeouts.getAndSet(0), latencyCount.getAndSet(0), latencySumNanos.getAndSet(0), latencyMaxNanos.getAndSet(0));
	}

	/**
	 * Immutable copy of a {@link StatsCounters} instance.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@ThreadSafe
	public record Counts(long requests,
											 long connections,
											 long connects,
											 long idleDisconnects,
											 long requestTimeouts,
											 long latencyCount,
											 long latencySumNanos,
											 long latencyMaxNanos) {
		@NonNull
		public Duration averageLatency() {
			return latencyCount == 0 ? Duration.ZERO : Duration.ofNanos(latencySumNanos / latencyCount);
		}

		@NonNull
		public Duration maximumLatency() {
			return Duration.ofNanos(latencyMaxNanos);
		}

		public double requestsPerSecond(@NonNull Duration interval) {
			requireNonNull(interval);
			long millis = interval.toMillis();
			return millis <= 0 ? 0D : requests * 1000D / millis;
		}
	}
}
