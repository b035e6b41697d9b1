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
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Resolved configuration for a {@link Nimblet} instance.
 * <p>
 * Instances are created via {@link #withHandlerRegistry(HandlerRegistry)} or loaded from a {@code .properties}
 * file via {@link #fromProperties(Path, HandlerRegistry)}. Relative paths are resolved against {@link #getRootDirectory()}.
 * <p>
 * Durations in properties files are either ISO-8601 ({@code PT30S}) or a plain number of milliseconds.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class NimbletConfig {
	@NonNull
	private final HandlerRegistry handlerRegistry;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final Path rootDirectory;
	@NonNull
	private final Path webroot;
	@NonNull
	private final String host;
	@NonNull
	private final Integer port;
	@NonNull
	private final Integer threadPoolSize;
	@NonNull
	private final Integer eventLoopCount;
	@NonNull
	private final LogSinkConfig mainLog;
	@NonNull
	private final LogSinkConfig requestLog;
	@NonNull
	private final LogSinkConfig statsLog;
	@NonNull
	private final Duration statsFrequency;
	@NonNull
	private final Integer maximumLogQueueSize;
	@NonNull
	private final Duration logFlushInterval;
	@NonNull
	private final Duration sessionTimeout;
	@NonNull
	private final Duration sessionSweepInterval;
	@NonNull
	private final Duration idleTimeout;
	@NonNull
	private final Duration requestTimeout;
	@NonNull
	private final Duration asyncTimeout;
	@NonNull
	private final Integer maximumRequestSizeInBytes;
	@NonNull
	private final Integer maximumConnections;
	@NonNull
	private final Duration shutdownTimeout;
	@NonNull
	private final String serverName;
	@NonNull
	private final String rspExtension;
	@NonNull
	private final Boolean rspCacheEnabled;
	@Nullable
	private final Path tlsCertificate;
	@Nullable
	private final Path tlsPrivateKey;

	@NonNull
	public static Builder withHandlerRegistry(@NonNull HandlerRegistry handlerRegistry) {
		requireNonNull(handlerRegistry);
		return new Builder(handlerRegistry);
	}

	/**
	 * Loads a {@code .properties} file into a builder, so callers can still adjust values (e.g. the lifecycle observer).
	 * <p>
	 * A missing {@code root_dir} defaults to the directory containing the file.
	 *
	 * @param propertiesFile  the file to load
	 * @param handlerRegistry the application's handlers
	 * @return a builder populated from the file
	 * @throws IOException              if the file cannot be read
	 * @throws IllegalArgumentException if any value is invalid
	 */
	@NonNull
	public static Builder fromProperties(@NonNull Path propertiesFile,
																			 @NonNull HandlerRegistry handlerRegistry) throws IOException {
		requireNonNull(propertiesFile);
		requireNonNull(handlerRegistry);

		Properties properties = new Properties();

		try (Reader reader = Files.newBufferedReader(propertiesFile, StandardCharsets.UTF_8)) {
			properties.load(reader);
		}

		Path parent = propertiesFile.toAbsolutePath().getParent();
		return fromProperties(properties, parent == null ? Path.of("") : parent, handlerRegistry);
	}

	/**
	 * Populates a builder from already-loaded properties.
	 *
	 * @param properties           the properties
	 * @param defaultRootDirectory used when {@code root_dir} is absent
	 * @param handlerRegistry      the application's handlers
	 * @return a builder populated from the properties
	 * @throws IllegalArgumentException if any value is invalid
	 */
	@NonNull
	public static Builder fromProperties(@NonNull Properties properties,
																			 @NonNull Path defaultRootDirectory,
																			 @NonNull HandlerRegistry handlerRegistry) {
		requireNonNull(properties);
		requireNonNull(defaultRootDirectory);
		requireNonNull(handlerRegistry);

		PropertyReader reader = new PropertyReader(properties);
		Builder builder = withHandlerRegistry(handlerRegistry);

		builder.rootDirectory(reader.path("root_dir").orElse(defaultRootDirectory));
		reader.path("webroot").ifPresent(builder::webroot);
		reader.string("bind_address").ifPresent(builder::bindAddress);
		reader.integer("thread_pool_size").ifPresent(builder::threadPoolSize);
		reader.integer("event_loop_count").ifPresent(builder::eventLoopCount);
		builder.mainLog(reader.logSinkConfig("mainlog"));
		builder.requestLog(reader.logSinkConfig("requestlog"));
		builder.statsLog(reader.logSinkConfig("statslog"));
		reader.duration("stats_frequency").ifPresent(builder::statsFrequency);
		reader.integer("max_log_queue").ifPresent(builder::maximumLogQueueSize);
		reader.duration("log_flush_interval").ifPresent(builder::logFlushInterval);
		reader.duration("session_timeout").ifPresent(builder::sessionTimeout);
		reader.duration("session_sweep_interval").ifPresent(builder::sessionSweepInterval);
		reader.duration("idle_timeout").ifPresent(builder::idleTimeout);
		reader.duration("request_timeout").ifPresent(builder::requestTimeout);
		reader.duration("async_timeout").ifPresent(builder::asyncTimeout);
		reader.integer("maximum_request_size").ifPresent(builder::maximumRequestSizeInBytes);
		reader.integer("maximum_connections").ifPresent(builder::maximumConnections);
		reader.duration("shutdown_timeout").ifPresent(builder::shutdownTimeout);
		reader.string("server_name").ifPresent(builder::serverName);
		reader.string("rsp_extension").ifPresent(builder::rspExtension);
		reader.bool("rsp_cache_enabled").ifPresent(builder::rspCacheEnabled);
		reader.path("tls_certificate").ifPresent(builder::tlsCertificate);
		reader.path("tls_private_key").ifPresent(builder::tlsPrivateKey);

		return builder;
	}

	protected NimbletConfig(@NonNull Builder builder) {
		requireNonNull(builder);

		this.handlerRegistry = builder.handlerRegistry;
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : new LifecycleObserver() {};
		this.rootDirectory = (builder.rootDirectory != null ? builder.rootDirectory : Path.of("")).toAbsolutePath().normalize();
		this.webroot = resolve(builder.webroot != null ? builder.webroot : Path.of("www"));
		this.host = builder.host != null ? builder.host : "0.0.0.0";
		this.port = builder.port != null ? builder.port : 8080;
		this.threadPoolSize = builder.threadPoolSize != null ? builder.threadPoolSize : Runtime.getRuntime().availableProcessors();
		this.eventLoopCount = builder.eventLoopCount != null ? builder.eventLoopCount : 1;
		this.mainLog = resolve(builder.mainLog != null ? builder.mainLog : LogSinkConfig.withLocation(Path.of("logs", "mainlog.log")));
		this.requestLog = resolve(builder.requestLog != null ? builder.requestLog : LogSinkConfig.withLocation(Path.of("logs", "requestlog.log")));
		this.statsLog = resolve(builder.statsLog != null ? builder.statsLog : LogSinkConfig.withLocation(Path.of("logs", "statslog.log")));
		this.statsFrequency = builder.statsFrequency != null ? builder.statsFrequency : Duration.ofSeconds(10);
		this.maximumLogQueueSize = builder.maximumLogQueueSize != null ? builder.maximumLogQueueSize : 10_000;
		this.logFlushInterval = builder.logFlushInterval != null ? builder.logFlushInterval : Duration.ofMillis(100);
		this.sessionTimeout = builder.sessionTimeout != null ? builder.sessionTimeout : Duration.ofMinutes(30);
		this.sessionSweepInterval = builder.sessionSweepInterval != null ? builder.sessionSweepInterval : Duration.ofSeconds(1);
		this.idleTimeout = builder.idleTimeout != null ? builder.idleTimeout : Duration.ofMinutes(2);
		this.requestTimeout = builder.requestTimeout != null ? builder.requestTimeout : Duration.ofSeconds(30);
		this.asyncTimeout = builder.asyncTimeout != null ? builder.asyncTimeout : Duration.ofSeconds(60);
		this.maximumRequestSizeInBytes = builder.maximumRequestSizeInBytes != null ? builder.maximumRequestSizeInBytes : 1_024 * 1_024 * 10;
		this.maximumConnections = builder.maximumConnections != null ? builder.maximumConnections : 0;
		this.shutdownTimeout = builder.shutdownTimeout != null ? builder.shutdownTimeout : Duration.ofSeconds(5);
		this.serverName = builder.serverName != null ? builder.serverName : format("Nimblet/%s", Nimblet.VERSION);
		this.rspExtension = builder.rspExtension != null ? builder.rspExtension : Dispatcher.DEFAULT_RSP_EXTENSION;
		this.rspCacheEnabled = builder.rspCacheEnabled != null ? builder.rspCacheEnabled : false;
		this.tlsCertificate = builder.tlsCertificate == null ? null : resolve(builder.tlsCertificate);
		this.tlsPrivateKey = builder.tlsPrivateKey == null ? null : resolve(builder.tlsPrivateKey);

		if (this.port < 0 || this.port > 65_535)
			throw new IllegalArgumentException(format("Illegal port %d", this.port));

		requirePositive("thread_pool_size", this.threadPoolSize);
		requirePositive("event_loop_count", this.eventLoopCount);
		requirePositive("max_log_queue", this.maximumLogQueueSize);
		requirePositive("maximum_request_size", this.maximumRequestSizeInBytes);
		requirePositive("stats_frequency", this.statsFrequency);

		if (this.statsFrequency.toMillis() < 1)
			throw new IllegalArgumentException(format("stats_frequency must be at least 1ms, but was %s", this.statsFrequency));

		requirePositive("log_flush_interval", this.logFlushInterval);
		requirePositive("session_timeout", this.sessionTimeout);
		requirePositive("session_sweep_interval", this.sessionSweepInterval);
		requirePositive("idle_timeout", this.idleTimeout);
		requirePositive("request_timeout", this.requestTimeout);
		requirePositive("async_timeout", this.asyncTimeout);

		if (this.maximumConnections < 0)
			throw new IllegalArgumentException("maximum_connections must be >= 0");

		if (this.shutdownTimeout.isNegative())
			throw new IllegalArgumentException("shutdown_timeout must be >= 0");
	}

	/**
	 * Every resolved setting as {@code key=value} pairs, in a stable order, for echoing at startup.
	 */
	@NonNull
	public Map<@NonNull String, @NonNull String> describe() {
		Map<String, String> description = new LinkedHashMap<>();
		description.put("root_dir", getRootDirectory().toString());
		description.put("webroot", getWebroot().toString());
		description.put("bind_address", format("%s:%d", getHost(), getPort()));
		description.put("thread_pool_size", String.valueOf(getThreadPoolSize()));
		description.put("event_loop_count", String.valueOf(getEventLoopCount()));
		getMainLog().describeInto("mainlog", description);
		getRequestLog().describeInto("requestlog", description);
		getStatsLog().describeInto("statslog", description);
		description.put("stats_frequency", String.valueOf(getStatsFrequency()));
		description.put("max_log_queue", String.valueOf(getMaximumLogQueueSize()));
		description.put("log_flush_interval", String.valueOf(getLogFlushInterval()));
		description.put("session_timeout", String.valueOf(getSessionTimeout()));
		description.put("session_sweep_interval", String.valueOf(getSessionSweepInterval()));
		description.put("idle_timeout", String.valueOf(getIdleTimeout()));
		description.put("request_timeout", String.valueOf(getRequestTimeout()));
		description.put("async_timeout", String.valueOf(getAsyncTimeout()));
		description.put("maximum_request_size", String.valueOf(getMaximumRequestSizeInBytes()));
		description.put("maximum_connections", String.valueOf(getMaximumConnections()));
		description.put("shutdown_timeout", String.valueOf(getShutdownTimeout()));
		description.put("server_name", getServerName());
		description.put("rsp_extension", getRspExtension());
		description.put("rsp_cache_enabled", String.valueOf(getRspCacheEnabled()));
		description.put("tls_certificate", getTlsCertificate().map(Path::toString).orElse("(none)"));
		description.put("tls_private_key", getTlsPrivateKey().map(Path::toString).orElse("(none)"));

		return description;
	}

	@NonNull
	private Path resolve(@NonNull Path path) {
		requireNonNull(path);
		return this.rootDirectory.resolve(path).normalize();
	}

	@NonNull
	private LogSinkConfig resolve(@NonNull LogSinkConfig logSinkConfig) {
		requireNonNull(logSinkConfig);

		Path location = logSinkConfig.getLocation().orElse(null);

		if (location == null)
			return logSinkConfig;

		return new LogSinkConfig(resolve(location), logSinkConfig.getMaximumSizeInBytes(),
				logSinkConfig.getMaximumAge(), logSinkConfig.getDeleteOnRotation());
	}

	private static void requirePositive(@NonNull String name,
																			@NonNull Integer value) {
		if (value < 1)
			throw new IllegalArgumentException(format("%s must be > 0, but was %d", name, value));
	}

	private static void requirePositive(@NonNull String name,
																			@NonNull Duration value) {
		if (value.isNegative() || value.isZero())
			throw new IllegalArgumentException(format("%s must be > 0, but was %s", name, value));
	}

	@NonNull
	public HandlerRegistry getHandlerRegistry() {
		return this.handlerRegistry;
	}

	@NonNull
	public LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	public Path getRootDirectory() {
		return this.rootDirectory;
	}

	@NonNull
	public Path getWebroot() {
		return this.webroot;
	}

	@NonNull
	public String getHost() {
		return this.host;
	}

	@NonNull
	public Integer getPort() {
		return this.port;
	}

	@NonNull
	public Integer getThreadPoolSize() {
		return this.threadPoolSize;
	}

	@NonNull
	public Integer getEventLoopCount() {
		return this.eventLoopCount;
	}

	@NonNull
	public LogSinkConfig getMainLog() {
		return this.mainLog;
	}

	@NonNull
	public LogSinkConfig getRequestLog() {
		return this.requestLog;
	}

	@NonNull
	public LogSinkConfig getStatsLog() {
		return this.statsLog;
	}

	@NonNull
	public Duration getStatsFrequency() {
		return this.statsFrequency;
	}

	@NonNull
	public Integer getMaximumLogQueueSize() {
		return this.maximumLogQueueSize;
	}

	@NonNull
	public Duration getLogFlushInterval() {
		return this.logFlushInterval;
	}

	@NonNull
	public Duration getSessionTimeout() {
		return this.sessionTimeout;
	}

	@NonNull
	public Duration getSessionSweepInterval() {
		return this.sessionSweepInterval;
	}

	@NonNull
	public Duration getIdleTimeout() {
		return this.idleTimeout;
	}

	@NonNull
	public Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	@NonNull
	public Duration getAsyncTimeout() {
		return this.asyncTimeout;
	}

	@NonNull
	public Integer getMaximumRequestSizeInBytes() {
		return this.maximumRequestSizeInBytes;
	}

	@NonNull
	public Integer getMaximumConnections() {
		return this.maximumConnections;
	}

	@NonNull
	public Duration getShutdownTimeout() {
		return this.shutdownTimeout;
	}

	@NonNull
	public String getServerName() {
		return this.serverName;
	}

	@NonNull
	public String getRspExtension() {
		return this.rspExtension;
	}

	@NonNull
	public Boolean getRspCacheEnabled() {
		return this.rspCacheEnabled;
	}

	@NonNull
	public Optional<Path> getTlsCertificate() {
		return Optional.ofNullable(this.tlsCertificate);
	}

	@NonNull
	public Optional<Path> getTlsPrivateKey() {
		return Optional.ofNullable(this.tlsPrivateKey);
	}

	/**
	 * Settings for one rotating log stream.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@ThreadSafe
	public static final class LogSinkConfig {
		@Nullable
		private final Path location;
		@NonNull
		private final Long maximumSizeInBytes;
		@NonNull
		private final Duration maximumAge;
		@NonNull
		private final Boolean deleteOnRotation;

		/**
		 * @param location           the active file, or {@code null} to write nowhere
		 * @param maximumSizeInBytes rotate at this size, {@code 0} for never
		 * @param maximumAge         rotate at this age, {@link Duration#ZERO} for never
		 * @param deleteOnRotation   discard rotated files instead of archiving them
		 */
		public LogSinkConfig(@Nullable Path location,
												 @NonNull Long maximumSizeInBytes,
												 @NonNull Duration maximumAge,
												 @NonNull Boolean deleteOnRotation) {
			requireNonNull(maximumSizeInBytes);
			requireNonNull(maximumAge);
			requireNonNull(deleteOnRotation);

			if (maximumSizeInBytes < 0)
				throw new IllegalArgumentException("Maximum log size must be >= 0");

			if (maximumAge.isNegative())
				throw new IllegalArgumentException("Maximum log age must be >= 0");

			this.location = location;
			this.maximumSizeInBytes = maximumSizeInBytes;
			this.maximumAge = maximumAge;
			this.deleteOnRotation = deleteOnRotation;
		}

		/**
		 * A stream that rotates at 10 MiB or one day, whichever comes first.
		 */
		@NonNull
		public static LogSinkConfig withLocation(@Nullable Path location) {
			return new LogSinkConfig(location, 10L * 1_024L * 1_024L, Duration.ofDays(1), false);
		}

		@NonNull
		public Optional<Path> getLocation() {
			return Optional.ofNullable(this.location);
		}

		@NonNull
		public Long getMaximumSizeInBytes() {
			return this.maximumSizeInBytes;
		}

		@NonNull
		public Duration getMaximumAge() {
			return this.maximumAge;
		}

		@NonNull
		public Boolean getDeleteOnRotation() {
			return this.deleteOnRotation;
		}

		void describeInto(@NonNull String prefix,
											@NonNull Map<String, String> description) {
			description.put(prefix + ".location", getLocation().map(Path::toString).orElse("(none)"));
			description.put(prefix + ".max_size", String.valueOf(getMaximumSizeInBytes()));
			description.put(prefix + ".max_age", String.valueOf(getMaximumAge()));
			description.put(prefix + ".delete_rotation", String.valueOf(getDeleteOnRotation()));
		}
	}

	/**
	 * Typed, validating access to raw properties.
	 */
	private record PropertyReader(@NonNull Properties properties) {
		@NonNull
		Optional<String> string(@NonNull String key) {
			return Optional.ofNullable(Utilities.trimAggressivelyToNull(properties().getProperty(key)));
		}

		@NonNull
		Optional<Path> path(@NonNull String key) {
			return string(key).map(Path::of);
		}

		@NonNull
		Optional<Integer> integer(@NonNull String key) {
			return string(key).map(value -> {
				try {
					return Integer.valueOf(value);
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException(format("%s must be an integer, but was '%s'", key, value), e);
				}
			});
		}

		@NonNull
		Optional<Long> longValue(@NonNull String key) {
			return string(key).map(value -> {
				try {
					return Long.valueOf(value);
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException(format("%s must be an integer, but was '%s'", key, value), e);
				}
			});
		}

		@NonNull
		Optional<Boolean> bool(@NonNull String key) {
			return string(key).map(value -> {
				String normalizedValue = value.toLowerCase(Locale.ROOT);

				if (normalizedValue.equals("true"))
					return true;

				if (normalizedValue.equals("false"))
					return false;

				throw new IllegalArgumentException(format("%s must be 'true' or 'false', but was '%s'", key, value));
			});
		}

		@NonNull
		Optional<Duration> duration(@NonNull String key) {
			return string(key).map(value -> {
				try {
					if (value.chars().allMatch(Character::isDigit))
						return Duration.ofMillis(Long.parseLong(value));

					return Duration.parse(value);
				} catch (NumberFormatException | DateTimeParseException e) {
					throw new IllegalArgumentException(format("%s must be an ISO-8601 duration or milliseconds, but was '%s'", key, value), e);
				}
			});
		}

		@NonNull
		LogSinkConfig logSinkConfig(@NonNull String prefix) {
			LogSinkConfig defaults = LogSinkConfig.withLocation(Path.of("logs", prefix + ".log"));

			return new LogSinkConfig(
					path(prefix + ".location").orElse(defaults.getLocation().orElse(null)),
					longValue(prefix + ".max_size").orElse(defaults.getMaximumSizeInBytes()),
					duration(prefix + ".max_age").orElse(defaults.getMaximumAge()),
					bool(prefix + ".delete_rotation").orElse(defaults.getDeleteOnRotation()));
		}
	}

	/**
	 * Builder used to construct instances of {@link NimbletConfig} via {@link NimbletConfig#withHandlerRegistry(HandlerRegistry)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final HandlerRegistry handlerRegistry;
		@Nullable
		private LifecycleObserver lifecycleObserver;
		@Nullable
		private Path rootDirectory;
		@Nullable
		private Path webroot;
		@Nullable
		private String host;
		@Nullable
		private Integer port;
		@Nullable
		private Integer threadPoolSize;
		@Nullable
		private Integer eventLoopCount;
		@Nullable
		private LogSinkConfig mainLog;
		@Nullable
		private LogSinkConfig requestLog;
		@Nullable
		private LogSinkConfig statsLog;
		@Nullable
		private Duration statsFrequency;
		@Nullable
		private Integer maximumLogQueueSize;
		@Nullable
		private Duration logFlushInterval;
		@Nullable
		private Duration sessionTimeout;
		@Nullable
		private Duration sessionSweepInterval;
		@Nullable
		private Duration idleTimeout;
		@Nullable
		private Duration requestTimeout;
		@Nullable
		private Duration asyncTimeout;
		@Nullable
		private Integer maximumRequestSizeInBytes;
		@Nullable
		private Integer maximumConnections;
		@Nullable
		private Duration shutdownTimeout;
		@Nullable
		private String serverName;
		@Nullable
		private String rspExtension;
		@Nullable
		private Boolean rspCacheEnabled;
		@Nullable
		private Path tlsCertificate;
		@Nullable
		private Path tlsPrivateKey;

		protected Builder(@NonNull HandlerRegistry handlerRegistry) {
			requireNonNull(handlerRegistry);
			this.handlerRegistry = handlerRegistry;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public Builder rootDirectory(@Nullable Path rootDirectory) {
			this.rootDirectory = rootDirectory;
			return this;
		}

		@NonNull
		public Builder webroot(@Nullable Path webroot) {
			this.webroot = webroot;
			return this;
		}

		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		@NonNull
		public Builder port(@Nullable Integer port) {
			this.port = port;
			return this;
		}

		/**
		 * Sets host and port from a {@code host:port} string, e.g. {@code 0.0.0.0:8080}.
		 *
		 * @throws IllegalArgumentException if the value is not {@code host:port}
		 */
		@NonNull
		public Builder bindAddress(@NonNull String bindAddress) {
			requireNonNull(bindAddress);

			int colon = bindAddress.lastIndexOf(':');

			if (colon <= 0 || colon == bindAddress.length() - 1)
				throw new IllegalArgumentException(format("bind_address must be host:port, but was '%s'", bindAddress));

			try {
				this.port = Integer.valueOf(bindAddress.substring(colon + 1));
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException(format("bind_address has an illegal port: '%s'", bindAddress), e);
			}

			this.host = bindAddress.substring(0, colon);
			return this;
		}

		@NonNull
		public Builder threadPoolSize(@Nullable Integer threadPoolSize) {
			this.threadPoolSize = threadPoolSize;
			return this;
		}

		@NonNull
		public Builder eventLoopCount(@Nullable Integer eventLoopCount) {
			this.eventLoopCount = eventLoopCount;
			return this;
		}

		@NonNull
		public Builder mainLog(@Nullable LogSinkConfig mainLog) {
			this.mainLog = mainLog;
			return this;
		}

		@NonNull
		public Builder requestLog(@Nullable LogSinkConfig requestLog) {
			this.requestLog = requestLog;
			return this;
		}

		@NonNull
		public Builder statsLog(@Nullable LogSinkConfig statsLog) {
			this.statsLog = statsLog;
			return this;
		}

		@NonNull
		public Builder statsFrequency(@Nullable Duration statsFrequency) {
			this.statsFrequency = statsFrequency;
			return this;
		}

		@NonNull
		public Builder maximumLogQueueSize(@Nullable Integer maximumLogQueueSize) {
			this.maximumLogQueueSize = maximumLogQueueSize;
			return this;
		}

		@NonNull
		public Builder logFlushInterval(@Nullable Duration logFlushInterval) {
			this.logFlushInterval = logFlushInterval;
			return this;
		}

		@NonNull
		public Builder sessionTimeout(@Nullable Duration sessionTimeout) {
			this.sessionTimeout = sessionTimeout;
			return this;
		}

		@NonNull
		public Builder sessionSweepInterval(@Nullable Duration sessionSweepInterval) {
			this.sessionSweepInterval = sessionSweepInterval;
			return this;
		}

		@NonNull
		public Builder idleTimeout(@Nullable Duration idleTimeout) {
			this.idleTimeout = idleTimeout;
			return this;
		}

		@NonNull
		public Builder requestTimeout(@Nullable Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		@NonNull
		public Builder asyncTimeout(@Nullable Duration asyncTimeout) {
			this.asyncTimeout = asyncTimeout;
			return this;
		}

		@NonNull
		public Builder maximumRequestSizeInBytes(@Nullable Integer maximumRequestSizeInBytes) {
			this.maximumRequestSizeInBytes = maximumRequestSizeInBytes;
			return this;
		}

		@NonNull
		public Builder maximumConnections(@Nullable Integer maximumConnections) {
			this.maximumConnections = maximumConnections;
			return this;
		}

		@NonNull
		public Builder shutdownTimeout(@Nullable Duration shutdownTimeout) {
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		@NonNull
		public Builder serverName(@Nullable String serverName) {
			this.serverName = serverName;
			return this;
		}

		@NonNull
		public Builder rspExtension(@Nullable String rspExtension) {
			this.rspExtension = rspExtension;
			return this;
		}

		@NonNull
		public Builder rspCacheEnabled(@Nullable Boolean rspCacheEnabled) {
			this.rspCacheEnabled = rspCacheEnabled;
			return this;
		}

		/**
		 * Recorded and echoed at startup; TLS termination is not performed.
		 */
		@NonNull
		public Builder tlsCertificate(@Nullable Path tlsCertificate) {
			this.tlsCertificate = tlsCertificate;
			return this;
		}

		@NonNull
		public Builder tlsPrivateKey(@Nullable Path tlsPrivateKey) {
			this.tlsPrivateKey = tlsPrivateKey;
			return this;
		}

		@NonNull
		public NimbletConfig build() {
			return new NimbletConfig(this);
		}
	}
}
