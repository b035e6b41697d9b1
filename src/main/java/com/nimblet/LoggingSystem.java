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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Owns the three log sinks (main, request, statistics), the {@link LogQueue} that feeds them and the single
 * consumer thread that drains it.
 * <p>
 * Producers call {@link #log(LogEntry)}, which never blocks. The consumer wakes every flush interval, drains the
 * queue in FIFO order and writes each entry to its sink. If entries were dropped since the previous drain, a
 * warning line is written straight to the main sink, bypassing the queue.
 * <p>
 * Construct explicitly, {@link #start()} once, and {@link #shutdown()} once; shutdown performs a final drain.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class LoggingSystem implements AutoCloseable {
	@NonNull
	private static final Logger logger;
	@NonNull
	private static final DateTimeFormatter TIMESTAMP_FORMATTER;
	@NonNull
	private static final Duration DEFAULT_FLUSH_INTERVAL;
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_QUEUE_SIZE;

	static {
		logger = LoggerFactory.getLogger(LoggingSystem.class);
		TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS", Locale.US).withZone(ZoneId.systemDefault());
		DEFAULT_FLUSH_INTERVAL = Duration.ofMillis(100);
		DEFAULT_MAXIMUM_QUEUE_SIZE = 100_000;
	}

	@NonNull
	private final RotatingLogSink mainLogSink;
	@NonNull
	private final RotatingLogSink requestLogSink;
	@NonNull
	private final RotatingLogSink statsLogSink;
	@NonNull
	private final LogQueue logQueue;
	@NonNull
	private final Duration flushInterval;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final ReentrantLock drainLock;
	@Nullable
	private volatile ScheduledExecutorService consumerExecutorService;
	private long reportedDropCount;
	private boolean shutDown;

	@NonNull
	public static Builder withSinks(@NonNull RotatingLogSink mainLogSink,
																	@NonNull RotatingLogSink requestLogSink,
																	@NonNull RotatingLogSink statsLogSink) {
		requireNonNull(mainLogSink);
		requireNonNull(requestLogSink);
		requireNonNull(statsLogSink);

		return new Builder(mainLogSink, requestLogSink, statsLogSink);
	}

	protected LoggingSystem(@NonNull Builder builder) {
		requireNonNull(builder);

		this.mainLogSink = builder.mainLogSink;
		this.requestLogSink = builder.requestLogSink;
		this.statsLogSink = builder.statsLogSink;
		this.logQueue = builder.logQueue != null ? builder.logQueue : new LogQueue(DEFAULT_MAXIMUM_QUEUE_SIZE);
		this.flushInterval = builder.flushInterval != null ? builder.flushInterval : DEFAULT_FLUSH_INTERVAL;
		this.lock = new ReentrantLock();
		this.drainLock = new ReentrantLock();

		if (this.flushInterval.isNegative() || this.flushInterval.isZero())
			throw new IllegalArgumentException("Log flush interval must be > 0");
	}

	/**
	 * Starts the consumer thread. Calling more than once has no effect.
	 */
	public void start() {
		getLock().lock();

		try {
			if (this.shutDown)
				throw new IllegalStateException("Logging system has already been shut down");

			if (this.consumerExecutorService != null)
				return;

			ScheduledExecutorService consumerExecutorService = Executors.newSingleThreadScheduledExecutor(
					new DefaultServer.NonvirtualThreadFactory("nimblet-log-consumer"));

			long intervalMillis = Math.max(1L, getFlushInterval().toMillis());
			consumerExecutorService.scheduleWithFixedDelay(this::drainSafely, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);

			this.consumerExecutorService = consumerExecutorService;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Signals that startup has finished, so the main log stops mirroring to the console.
	 */
	public void markStarted() {
		getMainLogSink().stopMirroringToConsole();
	}

	/**
	 * Enqueues an entry for asynchronous writing. Never blocks.
	 *
	 * @param logEntry the entry to log
	 * @return {@code true} if enqueued, {@code false} if it was dropped because the queue is full
	 */
	@NonNull
	public Boolean log(@NonNull LogEntry logEntry) {
		requireNonNull(logEntry);
		return getLogQueue().enqueue(logEntry);
	}

	/**
	 * Writes a main log line synchronously, bypassing the queue. Used for startup configuration echo.
	 *
	 * @param logEvent the event to write
	 */
	public void logImmediately(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getMainLogSink().write(formatLogEvent(logEvent));
		} catch (IOException e) {
			logger.warn("Unable to write to {}", getMainLogSink().getName(), e);
		}
	}

	/**
	 * Drains and writes everything currently queued. Normally invoked by the consumer thread.
	 *
	 * @return how many entries were written
	 */
	@NonNull
	public Integer drain() {
		getDrainLock().lock();

		try {
			List<LogEntry> logEntries = new ArrayList<>();
			getLogQueue().drainTo(logEntries);

			int written = 0;

			for (LogEntry logEntry : logEntries) {
				RotatingLogSink sink = sinkFor(logEntry);

				try {
					sink.write(formatLogEntry(logEntry));
					++written;
				} catch (IOException e) {
					logger.warn("Unable to write to {}", sink.getName(), e);
				}
			}

			long dropCount = getLogQueue().getDropCount();

			if (dropCount > this.reportedDropCount) {
				long newlyDropped = dropCount - this.reportedDropCount;
				this.reportedDropCount = dropCount;

				logImmediately(LogEvent.with(LogEventType.LOG_QUEUE_OVERFLOW,
						format("Log queue full (capacity %d): dropped %d entries, %d total", getLogQueue().getCapacity(), newlyDropped, dropCount)).build());
			}

			return written;
		} finally {
			getDrainLock().unlock();
		}
	}

	/**
	 * Stops the consumer, performs a final drain and closes all sinks.
	 */
	public void shutdown() {
		getLock().lock();

		try {
			if (this.shutDown)
				return;

			this.shutDown = true;

			ScheduledExecutorService consumerExecutorService = this.consumerExecutorService;
			this.consumerExecutorService = null;

			if (consumerExecutorService != null) {
				consumerExecutorService.shutdown();

				try {
					if (!consumerExecutorService.awaitTermination(5, TimeUnit.SECONDS))
						consumerExecutorService.shutdownNow();
				} catch (InterruptedException e) {
					consumerExecutorService.shutdownNow();
					Thread.currentThread().interrupt();
				}
			}

			drain();

			for (RotatingLogSink sink : List.of(getMainLogSink(), getRequestLogSink(), getStatsLogSink())) {
				try {
					sink.close();
				} catch (IOException e) {
					logger.warn("Unable to close {}", sink.getName(), e);
				}
			}
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public void close() {
		shutdown();
	}

	@NonNull
	public Boolean isStarted() {
		return this.consumerExecutorService != null;
	}

	private void drainSafely() {
		try {
			drain();
		} catch (RuntimeException e) {
			// An exception escaping here would cancel the fixed-delay schedule
			logger.error("Unexpected failure while draining log queue", e);
		}
	}

	@NonNull
	private RotatingLogSink sinkFor(@NonNull LogEntry logEntry) {
		requireNonNull(logEntry);

		if (logEntry instanceof RequestEvent)
			return getRequestLogSink();

		if (logEntry instanceof StatsSnapshot)
			return getStatsLogSink();

		return getMainLogSink();
	}

	@NonNull
	static String formatLogEntry(@NonNull LogEntry logEntry) {
		requireNonNull(logEntry);

		if (logEntry instanceof RequestEvent requestEvent)
			return formatRequestEvent(requestEvent);

		if (logEntry instanceof StatsSnapshot statsSnapshot)
			return formatStatsSnapshot(statsSnapshot);

		if (logEntry instanceof LogEvent logEvent)
			return formatLogEvent(logEvent);

		throw new IllegalArgumentException(format("Unsupported log entry type %s", logEntry.getClass().getName()));
	}

	@NonNull
	static String formatLogEvent(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		StringBuilder line = new StringBuilder();
		line.append('[').append(TIMESTAMP_FORMATTER.format(logEvent.getTimestamp())).append("]: (")
				.append(logEvent.getLogLevel().name()).append(") [")
				.append(logEvent.getLogEventType().name()).append("] ")
				.append(logEvent.getMessage());

		logEvent.getUri().ifPresent(uri -> line.append(" (uri=").append(uri).append(')'));

		Throwable throwable = logEvent.getThrowable().orElse(null);

		if (throwable != null) {
			StringWriter stackTrace = new StringWriter();
			throwable.printStackTrace(new PrintWriter(stackTrace));
			line.append('\n').append(stackTrace.toString().stripTrailing());
		}

		return line.toString();
	}

	@NonNull
	static String formatRequestEvent(@NonNull RequestEvent requestEvent) {
		requireNonNull(requestEvent);

		double processingMillis = requestEvent.getProcessingTime().toNanos() / 1_000_000D;

		return format("[%s]|%s|%s|%s|%s|%s|%s",
				TIMESTAMP_FORMATTER.format(requestEvent.getTimestamp()),
				requestEvent.getMethod(),
				requestEvent.getUri(),
				requestEvent.getQuery().orElse(""),
				requestEvent.getUserAgent().orElse(""),
				requestEvent.getReferer().orElse(""),
				String.format(Locale.US, "%.3f", processingMillis));
	}

	@NonNull
	static String formatStatsSnapshot(@NonNull StatsSnapshot statsSnapshot) {
		requireNonNull(statsSnapshot);

		String header = format("%-10s|%10s|%10s|%10s|%10s|%10s|%10s|%10s|%10s",
				"SCOPE", "REQUESTS", "CONNS", "CONNECTS", "QPS", "IDLE_DISC", "RTIMEOUT", "AVG_LAT", "MAX_LAT");
		String separator = "-".repeat(header.length());

		return String.join("\n",
				format("Statistics: [%s] uptime=%ds window=%dms",
						TIMESTAMP_FORMATTER.format(statsSnapshot.getTimestamp()),
						statsSnapshot.getUptime().toSeconds(),
						statsSnapshot.getWindow().toMillis()),
				separator,
				header,
				separator,
				formatCounts("ALL_TIME", statsSnapshot.getCumulative(), statsSnapshot.getUptime()),
				formatCounts("WINDOW", statsSnapshot.getWindowed(), statsSnapshot.getWindow()),
				separator);
	}

	@NonNull
	private static String formatCounts(@NonNull String scope,
																		 @NonNull Counts counts,
																		 @NonNull Duration interval) {
		requireNonNull(scope);
		requireNonNull(counts);
		requireNonNull(interval);

		return String.format(Locale.US, "%-10s|%10d|%10d|%10d|%10.2f|%10d|%10d|%10.3f|%10.3f",
				scope,
				counts.requests(),
				counts.connections(),
				counts.connects(),
				counts.requestsPerSecond(interval),
				counts.idleDisconnects(),
				counts.requestTimeouts(),
				counts.averageLatency().toNanos() / 1_000_000D,
				counts.maximumLatency().toNanos() / 1_000_000D);
	}

	@NonNull
	public RotatingLogSink getMainLogSink() {
		return this.mainLogSink;
	}

	@NonNull
	public RotatingLogSink getRequestLogSink() {
		return this.requestLogSink;
	}

	@NonNull
	public RotatingLogSink getStatsLogSink() {
		return this.statsLogSink;
	}

	@NonNull
	public LogQueue getLogQueue() {
		return this.logQueue;
	}

	@NonNull
	public Duration getFlushInterval() {
		return this.flushInterval;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	private ReentrantLock getDrainLock() {
		return this.drainLock;
	}

	@NonNull
	protected Optional<ScheduledExecutorService> getConsumerExecutorService() {
		return Optional.ofNullable(this.consumerExecutorService);
	}

	/**
	 * Builder used to construct instances of {@link LoggingSystem} via {@link LoggingSystem#withSinks(RotatingLogSink, RotatingLogSink, RotatingLogSink)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final RotatingLogSink mainLogSink;
		@NonNull
		private final RotatingLogSink requestLogSink;
		@NonNull
		private final RotatingLogSink statsLogSink;
		@Nullable
		private LogQueue logQueue;
		@Nullable
		private Duration flushInterval;

		protected Builder(@NonNull RotatingLogSink mainLogSink,
											@NonNull RotatingLogSink requestLogSink,
											@NonNull RotatingLogSink statsLogSink) {
			this.mainLogSink = requireNonNull(mainLogSink);
			this.requestLogSink = requireNonNull(requestLogSink);
			this.statsLogSink = requireNonNull(statsLogSink);
		}

		@NonNull
		public Builder logQueue(@Nullable LogQueue logQueue) {
			this.logQueue = logQueue;
			return this;
		}

		@NonNull
		public Builder flushInterval(@Nullable Duration flushInterval) {
			this.flushInterval = flushInterval;
			return this;
		}

		@NonNull
		public LoggingSystem build() {
			return new LoggingSystem(this);
		}
	}
}
