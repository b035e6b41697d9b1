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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A main log event that occurs during Nimblet's internal processing - for example, a handler fault or a log rotation.
 * <p>
 * These events are written to the main log and are also exposed via {@link LifecycleObserver#didReceiveLogEvent(LogEvent)}.
 * <p>
 * Instances can be acquired via the {@link #with(LogEventType, String)} builder factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class LogEvent implements LogEntry {
	@NonNull
	private final LogEventType logEventType;
	@NonNull
	private final LogLevel logLevel;
	@NonNull
	private final String message;
	@NonNull
	private final Instant timestamp;
	@Nullable
	private final Throwable throwable;
	@Nullable
	private final String uri;

	/**
	 * Acquires a builder for {@link LogEvent} instances.
	 *
	 * @param logEventType what kind of log event this is
	 * @param message      the message for this log event
	 * @return the builder
	 */
	@NonNull
	public static Builder with(@NonNull LogEventType logEventType,
														 @NonNull String message) {
		requireNonNull(logEventType);
		requireNonNull(message);

		return new Builder(logEventType, message);
	}

	/**
	 * Vends a mutable copier seeded with this instance's data, suitable for building new instances.
	 *
	 * @return a copier for this instance
	 */
	@NonNull
	public Copier copy() {
		return new Copier(this);
	}

	protected LogEvent(@NonNull Builder builder) {
		requireNonNull(builder);

		this.logEventType = builder.logEventType;
		this.logLevel = builder.logLevel != null ? builder.logLevel : builder.logEventType.getDefaultLogLevel();
		this.message = builder.message;
		this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
		this.throwable = builder.throwable;
		this.uri = builder.uri;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{logEventType=%s, logLevel=%s, message=%s, throwable=%s}", getClass().getSimpleName(),
				getLogEventType(), getLogLevel(), getMessage(), getThrowable().orElse(null));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof LogEvent logEvent))
			return false;

		return Objects.equals(getLogEventType(), logEvent.getLogEventType())
				&& Objects.equals(getLogLevel(), logEvent.getLogLevel())
				&& Objects.equals(getMessage(), logEvent.getMessage())
				&& Objects.equals(getTimestamp(), logEvent.getTimestamp())
				&& Objects.equals(getThrowable(), logEvent.getThrowable())
				&& Objects.equals(getUri(), logEvent.getUri());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getLogEventType(), getLogLevel(), getMessage(), getTimestamp(), getThrowable(), getUri());
	}

	/**
	 * The type of log event this is.
	 *
	 * @return the log event type
	 */
	@NonNull
	public LogEventType getLogEventType() {
		return this.logEventType;
	}

	@NonNull
	public LogLevel getLogLevel() {
		return this.logLevel;
	}

	/**
	 * The message for this log event.
	 *
	 * @return the message
	 */
	@NonNull
	public String getMessage() {
		return this.message;
	}

	@Override
	@NonNull
	public Instant getTimestamp() {
		return this.timestamp;
	}

	/**
	 * The throwable for this log event, if available.
	 *
	 * @return the throwable, or {@link Optional#empty()} if not available
	 */
	@NonNull
	public Optional<Throwable> getThrowable() {
		return Optional.ofNullable(this.throwable);
	}

	/**
	 * The URI of the request being processed when this event occurred, if any.
	 *
	 * @return the request URI, or {@link Optional#empty()} if not associated with a request
	 */
	@NonNull
	public Optional<String> getUri() {
		return Optional.ofNullable(this.uri);
	}

	/**
	 * Builder used to construct instances of {@link LogEvent} via {@link LogEvent#with(LogEventType, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private LogEventType logEventType;
		@NonNull
		private String message;
		@Nullable
		private LogLevel logLevel;
		@Nullable
		private Instant timestamp;
		@Nullable
		private Throwable throwable;
		@Nullable
		private String uri;

		protected Builder(@NonNull LogEventType logEventType,
											@NonNull String message) {
			requireNonNull(logEventType);
			requireNonNull(message);

			this.logEventType = logEventType;
			this.message = message;
		}

		@NonNull
		public Builder logEventType(@NonNull LogEventType logEventType) {
			requireNonNull(logEventType);
			this.logEventType = logEventType;
			return this;
		}

		@NonNull
		public Builder message(@NonNull String message) {
			requireNonNull(message);
			this.message = message;
			return this;
		}

		@NonNull
		public Builder logLevel(@Nullable LogLevel logLevel) {
			this.logLevel = logLevel;
			return this;
		}

		@NonNull
		public Builder timestamp(@Nullable Instant timestamp) {
			this.timestamp = timestamp;
			return this;
		}

		@NonNull
		public Builder throwable(@Nullable Throwable throwable) {
			this.throwable = throwable;
			return this;
		}

		@NonNull
		public Builder uri(@Nullable String uri) {
			this.uri = uri;
			return this;
		}

		@NonNull
		public LogEvent build() {
			return new LogEvent(this);
		}
	}

	/**
	 * Builder used to copy instances of {@link LogEvent} via {@link LogEvent#copy()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Copier {
		@NonNull
		private final Builder builder;

		Copier(@NonNull LogEvent logEvent) {
			requireNonNull(logEvent);

			this.builder = new Builder(logEvent.getLogEventType(), logEvent.getMessage())
					.logLevel(logEvent.getLogLevel())
					.timestamp(logEvent.getTimestamp())
					.throwable(logEvent.getThrowable().orElse(null))
					.uri(logEvent.getUri().orElse(null));
		}

		@NonNull
		public Copier logLevel(@NonNull LogLevel logLevel) {
			requireNonNull(logLevel);
			this.builder.logLevel(logLevel);
			return this;
		}

		@NonNull
		public Copier message(@NonNull String message) {
			requireNonNull(message);
			this.builder.message(message);
			return this;
		}

		@NonNull
		public Copier throwable(@Nullable Throwable throwable) {
			this.builder.throwable(throwable);
			return this;
		}

		@NonNull
		public LogEvent finish() {
			return this.builder.build();
		}
	}
}
