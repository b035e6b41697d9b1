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

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.time.Instant;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Periodic statistics block for the statistics log: cumulative counts since start plus counts for the window
 * that just closed.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class StatsSnapshot implements LogEntry {
	@NonNull
	private final Instant timestamp;
	@NonNull
	private final Duration uptime;
	@NonNull
	private final Duration window;
	@NonNull
	private final Counts cumulative;
	@NonNull
	private final Counts windowed;

	public StatsSnapshot(@NonNull Instant timestamp,
											 @NonNull Duration uptime,
											 @NonNull Duration window,
											 @NonNull Counts cumulative,
											 @NonNull Counts windowed) {
		this.timestamp = requireNonNull(timestamp);
		this.uptime = requireNonNull(uptime);
		this.window = requireNonNull(window);
		this.cumulative = requireNonNull(cumulative);
		this.windowed = requireNonNull(windowed);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{uptime=%s, window=%s, cumulative=%s, windowed=%s}", getClass().getSimpleName(),
				getUptime(), getWindow(), getCumulative(), getWindowed());
	}

	@Override
	@NonNull
	public Instant getTimestamp() {
		return this.timestamp;
	}

	@NonNull
	public Duration getUptime() {
		return this.uptime;
	}

	/**
	 * Length of the window covered by {@link #getWindowed()}.
	 *
	 * @return the window length
	 */
	@NonNull
	public Duration getWindow() {
		return this.window;
	}

	@NonNull
	public Counts getCumulative() {
		return this.cumulative;
	}

	@NonNull
	public Counts getWindowed() {
		return this.windowed;
	}
}
