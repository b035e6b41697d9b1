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

import javax.annotation.concurrent.ThreadSafe;
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Nimblet's main class: owns the server, the logging pipeline, statistics and sessions for one configuration.
 * <p>
 * <pre>{@code HandlerRegistry handlerRegistry = HandlerRegistry.builder()
 *   .route("/echo", (requestContext) -> requestContext.write(requestContext.getQuery().orElse("")))
 *   .build();
 *
 * NimbletConfig config = NimbletConfig.withHandlerRegistry(handlerRegistry)
 *   .bindAddress("0.0.0.0:8080")
 *   .build();
 *
 * try (Nimblet nimblet = Nimblet.withConfig(config)) {
 *   nimblet.start();
 *   nimblet.awaitShutdown();
 * }}</pre>
 * <p>
 * A stopped instance cannot be restarted: its log sinks have been closed.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Nimblet implements AutoCloseable {
	@NonNull
	public static final String VERSION;

	static {
		VERSION = "1.0.0";
	}

	@NonNull
	private final NimbletConfig config;
	@NonNull
	private final LoggingSystem loggingSystem;
	@NonNull
	private final StatisticsAggregator statisticsAggregator;
	@NonNull
	private final SessionStore sessionStore;
	@NonNull
	private final Dispatcher dispatcher;
	@NonNull
	private final Server server;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final AtomicReference<CountDownLatch> awaitShutdownLatchReference;
	private volatile boolean started;
	private volatile boolean stopped;

	/**
	 * Creates an instance with the given configuration. Nothing runs until {@link #start()}.
	 */
	@NonNull
	public static Nimblet withConfig(@NonNull NimbletConfig config) {
		requireNonNull(config);
		return new Nimblet(config);
	}

	private Nimblet(@NonNull NimbletConfig config) {
		requireNonNull(config);

		this.config = config;
		this.lock = new ReentrantLock();
		this.awaitShutdownLatchReference = new AtomicReference<>(new CountDownLatch(1));

		this.loggingSystem = LoggingSystem.withSinks(
						createSink("mainlog", config.getMainLog(), true),
						createSink("requestlog", config.getRequestLog(), false),
						createSink("statslog", config.getStatsLog(), false))
				.logQueue(new LogQueue(config.getMaximumLogQueueSize()))
				.flushInterval(config.getLogFlushInterval())
				.build();

		this.statisticsAggregator = new StatisticsAggregator(config.getStatsFrequency(), this.loggingSystem::log);

		this.sessionStore = SessionStore.builder()
				.timeout(config.getSessionTimeout())
				.sweepInterval(config.getSessionSweepInterval())
				.build();

		RspInterpreter rspInterpreter = RspInterpreter.withWebroot(config.getWebroot(), config.getHandlerRegistry())
				.cacheEnabled(config.getRspCacheEnabled())
				.build();

		InternalLifecycleObserver lifecycleObserver = new InternalLifecycleObserver(config.getLifecycleObserver());

		this.dispatcher = new Dispatcher(config.getHandlerRegistry(), rspInterpreter, config.getRspExtension(), lifecycleObserver::didReceiveLogEvent);

		this.server = Server.withPort(config.getPort())
				.host(config.getHost())
				.threadPoolSize(config.getThreadPoolSize())
				.eventLoopCount(config.getEventLoopCount())
				.requestTimeout(config.getRequestTimeout())
				.idleTimeout(config.getIdleTimeout())
				.asyncTimeout(config.getAsyncTimeout())
				.shutdownTimeout(config.getShutdownTimeout())
				.maximumRequestSizeInBytes(config.getMaximumRequestSizeInBytes())
				.maximumConnections(config.getMaximumConnections())
				.serverName(config.getServerName())
				.build();

		this.server.initialize(this.dispatcher, lifecycleObserver, this.sessionStore);
	}

	/**
	 * Starts logging, statistics, the session sweep and the server, then echoes the configuration to the main log.
	 * <p>
	 * If already started, this is a no-op.
	 *
	 * @throws IllegalStateException if this instance was previously stopped
	 */
	public void start() {
		getLock().lock();

		try {
			if (this.stopped)
				throw new IllegalStateException(format("This %s instance has been stopped and cannot be restarted", getClass().getSimpleName()));

			if (this.started)
				return;

			getAwaitShutdownLatchReference().set(new CountDownLatch(1));

			LifecycleObserver lifecycleObserver = getConfig().getLifecycleObserver();
			lifecycleObserver.willStartNimblet(this);

			try {
				getLoggingSystem().start();
				echoConfiguration();
				getSessionStore().start();
				getStatisticsAggregator().start();
				getServer().start();

				this.started = true;

				getLoggingSystem().logImmediately(LogEvent.with(LogEventType.LIFECYCLE,
						format("Nimblet %s started on %s:%d", VERSION, getConfig().getHost(), getPort().orElse(getConfig().getPort()))).build());
				getLoggingSystem().markStarted();

				lifecycleObserver.didStartNimblet(this);
			} catch (Throwable t) {
				getLoggingSystem().logImmediately(LogEvent.with(LogEventType.LIFECYCLE, "Nimblet failed to start")
						.throwable(t)
						.build());

				shutDownComponents();
				lifecycleObserver.didFailToStartNimblet(this, t);

				if (t instanceof RuntimeException)
					throw (RuntimeException) t;

				throw new RuntimeException(t);
			}
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Stops the server, letting in-flight requests finish within the shutdown timeout, then flushes and closes the logs.
	 * <p>
	 * If not started, this is a no-op.
	 */
	public void stop() {
		getLock().lock();

		try {
			if (this.started && !this.stopped) {
				LifecycleObserver lifecycleObserver = getConfig().getLifecycleObserver();
				lifecycleObserver.willStopNimblet(this);

				getLoggingSystem().log(LogEvent.with(LogEventType.LIFECYCLE, "Nimblet is stopping").build());
				shutDownComponents();

				lifecycleObserver.didStopNimblet(this);
			}
		} finally {
			try {
				getAwaitShutdownLatchReference().get().countDown();
			} finally {
				getLock().unlock();
			}
		}
	}

	/**
	 * Blocks the current thread until {@link #stop()} is called or the JVM begins shutting down, then stops this instance.
	 *
	 * @throws InterruptedException if interrupted while waiting
	 */
	public void awaitShutdown() throws InterruptedException {
		Thread shutdownHook = new Thread(this::stop, "nimblet-shutdown-hook");
		Runtime.getRuntime().addShutdownHook(shutdownHook);

		try {
			getAwaitShutdownLatchReference().get().await();
		} finally {
			try {
				Runtime.getRuntime().removeShutdownHook(shutdownHook);
			} catch (IllegalStateException e) {
				// JVM is already shutting down and the hook is running
			}
		}
	}

	@Override
	public void close() {
		stop();
	}

	@NonNull
	public Boolean isStarted() {
		return this.started && !this.stopped;
	}

	/**
	 * The port the server actually bound, which is useful when configured with port {@code 0}.
	 */
	@NonNull
	public Optional<Integer> getPort() {
		return getServer().getBoundPort();
	}

	private void shutDownComponents() {
		this.stopped = true;

		getServer().stop();
		getStatisticsAggregator().stop();
		getLoggingSystem().log(getStatisticsAggregator().flush());
		getSessionStore().stop();
		getLoggingSystem().shutdown();
	}

	private void echoConfiguration() {
		for (Map.Entry<String, String> entry : getConfig().describe().entrySet())
			getLoggingSystem().logImmediately(LogEvent.with(LogEventType.CONFIGURATION,
					format("%s=%s", entry.getKey(), entry.getValue())).build());

		if (getConfig().getTlsCertificate().isPresent() || getConfig().getTlsPrivateKey().isPresent())
			getLoggingSystem().logImmediately(LogEvent.with(LogEventType.CONFIGURATION_UNSUPPORTED,
					"TLS certificate/key were configured, but TLS termination is not supported; serving plain HTTP").build());
	}

	@NonNull
	private RotatingLogSink createSink(@NonNull String name,
																		 NimbletConfig.@NonNull LogSinkConfig logSinkConfig,
																		 @NonNull Boolean mirrorToConsole) {
		requireNonNull(name);
		requireNonNull(logSinkConfig);
		requireNonNull(mirrorToConsole);

		return RotatingLogSink.withName(name)
				.location(logSinkConfig.getLocation().orElse(null))
				.maximumSizeInBytes(logSinkConfig.getMaximumSizeInBytes())
				.maximumAge(logSinkConfig.getMaximumAge())
				.deleteOnRotation(logSinkConfig.getDeleteOnRotation())
				.console(mirrorToConsole ? System.out : null)
				.rotationListener((logEvent) -> getLoggingSystem().log(logEvent))
				.build();
	}

	@NonNull
	public NimbletConfig getConfig() {
		return this.config;
	}

	@NonNull
	public LoggingSystem getLoggingSystem() {
		return this.loggingSystem;
	}

	@NonNull
	public StatisticsAggregator getStatisticsAggregator() {
		return this.statisticsAggregator;
	}

	@NonNull
	public SessionStore getSessionStore() {
		return this.sessionStore;
	}

	@NonNull
	Dispatcher getDispatcher() {
		return this.dispatcher;
	}

	@NonNull
	Server getServer() {
		return this.server;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	private AtomicReference<CountDownLatch> getAwaitShutdownLatchReference() {
		return this.awaitShutdownLatchReference;
	}

	/**
	 * Feeds engine events into statistics and the logs, then forwards them to the application's observer.
	 */
	@ThreadSafe
	private final class InternalLifecycleObserver implements LifecycleObserver {
		@NonNull
		private final LifecycleObserver delegate;

		private InternalLifecycleObserver(@NonNull LifecycleObserver delegate) {
			requireNonNull(delegate);
			this.delegate = delegate;
		}

		@Override
		public void didAcceptConnection(@Nullable InetSocketAddress remoteAddress) {
			getStatisticsAggregator().recordConnectionOpened();
			forward(() -> this.delegate.didAcceptConnection(remoteAddress));
		}

		@Override
		public void didFailToAcceptConnection(@Nullable InetSocketAddress remoteAddress) {
			getLoggingSystem().log(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR,
							format("Refused connection from %s: maximum of %d connections reached", remoteAddress, getConfig().getMaximumConnections()))
					.logLevel(LogLevel.WARNING)
					.build());
			forward(() -> this.delegate.didFailToAcceptConnection(remoteAddress));
		}

		@Override
		public void didCloseConnection(@Nullable InetSocketAddress remoteAddress) {
			getStatisticsAggregator().recordConnectionClosed();
			forward(() -> this.delegate.didCloseConnection(remoteAddress));
		}

		@Override
		public void didDisconnectIdleConnection(@Nullable InetSocketAddress remoteAddress) {
			getStatisticsAggregator().recordIdleDisconnect();
			forward(() -> this.delegate.didDisconnectIdleConnection(remoteAddress));
		}

		@Override
		public void didTimeOutRequest(@Nullable InetSocketAddress remoteAddress) {
			getStatisticsAggregator().recordRequestTimeout();
			forward(() -> this.delegate.didTimeOutRequest(remoteAddress));
		}

		@Override
		public void didCompleteRequest(@NonNull RequestEvent requestEvent) {
			getStatisticsAggregator().recordRequest(requestEvent.getProcessingTime());
			getLoggingSystem().log(requestEvent);
			forward(() -> this.delegate.didCompleteRequest(requestEvent));
		}

		@Override
		public void didReceiveLogEvent(@NonNull LogEvent logEvent) {
			getLoggingSystem().log(logEvent);
			forward(() -> this.delegate.didReceiveLogEvent(logEvent));
		}

		private void forward(@NonNull Runnable notification) {
			try {
				notification.run();
			} catch (Throwable t) {
				getLoggingSystem().log(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED,
								format("%s threw an exception", LifecycleObserver.class.getSimpleName()))
						.throwable(t)
						.build());
			}
		}
	}
}
