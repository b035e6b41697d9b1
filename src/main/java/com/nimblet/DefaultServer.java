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

import com.nimblet.exception.BadRequestException;
import com.nimblet.internal.microhttp.ConnectionListener;
import com.nimblet.internal.microhttp.EventLoop;
import com.nimblet.internal.microhttp.Header;
import com.nimblet.internal.microhttp.MicrohttpHandler;
import com.nimblet.internal.microhttp.MicrohttpRequest;
import com.nimblet.internal.microhttp.MicrohttpResponse;
import com.nimblet.internal.microhttp.Options;
import com.nimblet.internal.microhttp.ResponseCallback;
import com.nimblet.internal.microhttp.Slf4jLogger;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Standard {@link Server}: a non-blocking accept/read/write core feeding a fixed pool of worker threads.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultServer implements Server {
	@NonNull
	private static final Logger logger = LoggerFactory.getLogger(DefaultServer.class);

	@NonNull
	private static final String DEFAULT_HOST;
	@NonNull
	private static final Integer DEFAULT_THREAD_POOL_SIZE;
	@NonNull
	private static final Integer DEFAULT_EVENT_LOOP_COUNT;
	@NonNull
	private static final Duration DEFAULT_REQUEST_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_IDLE_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_ASYNC_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_SOCKET_SELECT_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_SWEEP_INTERVAL;
	@NonNull
	private static final Duration MINIMUM_SWEEP_INTERVAL;
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
	@NonNull
	private static final Integer DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
	@NonNull
	private static final Integer DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT;
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_CONNECTIONS;
	@NonNull
	private static final Duration DEFAULT_SHUTDOWN_TIMEOUT;
	@NonNull
	private static final String DEFAULT_SERVER_NAME;

	static {
		DEFAULT_HOST = "0.0.0.0";
		DEFAULT_THREAD_POOL_SIZE = Runtime.getRuntime().availableProcessors();
		DEFAULT_EVENT_LOOP_COUNT = 1;
		DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
		DEFAULT_IDLE_TIMEOUT = Duration.ofMinutes(2);
		DEFAULT_ASYNC_TIMEOUT = Duration.ofSeconds(60);
		DEFAULT_SOCKET_SELECT_TIMEOUT = Duration.ofMillis(100);
		DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(1);
		MINIMUM_SWEEP_INTERVAL = Duration.ofMillis(10);
		DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES = 1_024 * 1_024 * 10;
		DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES = 1_024 * 64;
		DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT = 0;
		DEFAULT_MAXIMUM_CONNECTIONS = 0;
		DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
		DEFAULT_SERVER_NAME = "Nimblet";
	}

	@NonNull
	private final Integer port;
	@NonNull
	private final String host;
	@NonNull
	private final Integer threadPoolSize;
	@NonNull
	private final Integer eventLoopCount;
	@NonNull
	private final Duration requestTimeout;
	@NonNull
	private final Duration idleTimeout;
	@NonNull
	private final Duration asyncTimeout;
	@NonNull
	private final Duration socketSelectTimeout;
	@NonNull
	private final Duration shutdownTimeout;
	@NonNull
	private final Integer maximumRequestSizeInBytes;
	@NonNull
	private final Integer requestReadBufferSizeInBytes;
	@NonNull
	private final Integer socketPendingConnectionLimit;
	@NonNull
	private final Integer maximumConnections;
	@NonNull
	private final String serverName;
	@NonNull
	private final ReentrantLock lock;
	@Nullable
	private volatile ExecutorService workerExecutorService;
	@Nullable
	private volatile ScheduledExecutorService asyncTimeoutExecutorService;
	@Nullable
	private volatile RequestHandler requestHandler;
	@Nullable
	private volatile LifecycleObserver lifecycleObserver;
	@Nullable
	private volatile SessionStore sessionStore;
	@Nullable
	private volatile EventLoop eventLoop;
	@Nullable
	private volatile Integer boundPort;

	protected DefaultServer(@NonNull Builder builder) {
		requireNonNull(builder);

		this.lock = new ReentrantLock();

		this.port = builder.port;
		this.host = builder.host != null ? builder.host : DEFAULT_HOST;
		this.threadPoolSize = builder.threadPoolSize != null ? builder.threadPoolSize : DEFAULT_THREAD_POOL_SIZE;
		this.eventLoopCount = builder.eventLoopCount != null ? builder.eventLoopCount : DEFAULT_EVENT_LOOP_COUNT;
		this.requestTimeout = builder.requestTimeout != null ? builder.requestTimeout : DEFAULT_REQUEST_TIMEOUT;
		this.idleTimeout = builder.idleTimeout != null ? builder.idleTimeout : DEFAULT_IDLE_TIMEOUT;
		this.asyncTimeout = builder.asyncTimeout != null ? builder.asyncTimeout : DEFAULT_ASYNC_TIMEOUT;
		this.socketSelectTimeout = builder.socketSelectTimeout != null ? builder.socketSelectTimeout : DEFAULT_SOCKET_SELECT_TIMEOUT;
		this.shutdownTimeout = builder.shutdownTimeout != null ? builder.shutdownTimeout : DEFAULT_SHUTDOWN_TIMEOUT;
		this.maximumRequestSizeInBytes = builder.maximumRequestSizeInBytes != null ? builder.maximumRequestSizeInBytes : DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
		this.requestReadBufferSizeInBytes = builder.requestReadBufferSizeInBytes != null ? builder.requestReadBufferSizeInBytes : DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
		this.socketPendingConnectionLimit = builder.socketPendingConnectionLimit != null ? builder.socketPendingConnectionLimit : DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT;
		this.maximumConnections = builder.maximumConnections != null ? builder.maximumConnections : DEFAULT_MAXIMUM_CONNECTIONS;
		this.serverName = builder.serverName != null ? builder.serverName : DEFAULT_SERVER_NAME;

		if (this.port < 0 || this.port > 65_535)
			throw new IllegalArgumentException(format("Illegal port %d", this.port));

		if (this.threadPoolSize < 1)
			throw new IllegalArgumentException("Thread pool size must be > 0");

		if (this.eventLoopCount < 1)
			throw new IllegalArgumentException("Event loop count must be > 0");

		for (Duration timeout : List.of(this.requestTimeout, this.idleTimeout, this.asyncTimeout, this.socketSelectTimeout))
			if (timeout.isNegative() || timeout.isZero())
				throw new IllegalArgumentException(format("Timeouts must be > 0, but %s was specified", timeout));

		if (this.maximumRequestSizeInBytes < 1)
			throw new IllegalArgumentException("Maximum request size must be > 0");

		if (this.maximumConnections < 0)
			throw new IllegalArgumentException("Maximum connections must be >= 0");
	}

	@Override
	public void start() {
		getLock().lock();

		try {
			if (isStarted())
				return;

			if (getRequestHandler().isEmpty())
				throw new IllegalStateException(format("No %s was registered for %s", RequestHandler.class.getSimpleName(), getClass().getSimpleName()));

			if (getLifecycleObserver().isEmpty())
				throw new IllegalStateException(format("No %s was registered for %s", LifecycleObserver.class.getSimpleName(), getClass().getSimpleName()));

			Options options = Options.builder()
					.host(getHost())
					.port(getPort())
					.concurrency(getEventLoopCount())
					.requestTimeout(getRequestTimeout())
					.idleTimeout(getIdleTimeout())
					.sweepInterval(determineSweepInterval())
					.resolution(getSocketSelectTimeout())
					.readBufferSize(getRequestReadBufferSizeInBytes())
					.maxRequestSize(getMaximumRequestSizeInBytes())
					.acceptLength(getSocketPendingConnectionLimit())
					.maxConnections(getMaximumConnections())
					.build();

			MicrohttpHandler handler = (microhttpRequest, responseCallback) -> {
				ExecutorService workerExecutorServiceReference = this.workerExecutorService;

				if (workerExecutorServiceReference == null) {
					safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Worker executor service is unavailable").build());
					respondSafely(responseCallback, provideFailsafeResponse(503).withConnectionClose());
					return;
				}

				try {
					workerExecutorServiceReference.submit(() -> handleRequest(microhttpRequest, responseCallback));
				} catch (RejectedExecutionException e) {
					safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Worker executor rejected task")
							.throwable(e)
							.uri(microhttpRequest.uri())
							.build());
					respondSafely(responseCallback, provideFailsafeResponse(503).withConnectionClose());
				}
			};

			this.workerExecutorService = Executors.newFixedThreadPool(getThreadPoolSize(), new NonvirtualThreadFactory("nimblet-worker"));
			this.asyncTimeoutExecutorService = Executors.newSingleThreadScheduledExecutor(new NonvirtualThreadFactory("nimblet-async-timeout"));
			EventLoop eventLoop = null;

			try {
				eventLoop = new EventLoop(options, new Slf4jLogger(LoggerFactory.getLogger(EventLoop.class)), handler, new LifecycleConnectionListener());
				eventLoop.start();
				this.eventLoop = eventLoop;
				this.boundPort = eventLoop.getPort();
			} catch (BindException e) {
				cleanupFailedStart(eventLoop);
				throw new UncheckedIOException(format("Nimblet was unable to start the HTTP server - port %d is already in use.", options.port()), e);
			} catch (IOException e) {
				cleanupFailedStart(eventLoop);
				throw new UncheckedIOException(e);
			} catch (RuntimeException e) {
				cleanupFailedStart(eventLoop);
				throw e;
			}
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public void stop() {
		getLock().lock();

		try {
			if (!isStarted())
				return;

			EventLoop eventLoop = getEventLoop().get();

			try {
				eventLoop.stop();
			} catch (Exception e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to shut down server event loop")
						.throwable(e)
						.build());
			}

			boolean interrupted = false;

			try {
				ExecutorService workerExecutorService = getWorkerExecutorService().orElse(null);

				// Single wall-clock budget for the whole server shutdown
				final long deadlineNanos = System.nanoTime() + getShutdownTimeout().toNanos();

				if (workerExecutorService != null) {
					workerExecutorService.shutdown();

					long remainingMillis = Math.max(0L, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
					boolean done = remainingMillis == 0L || workerExecutorService.awaitTermination(remainingMillis, TimeUnit.MILLISECONDS);

					if (!done) {
						workerExecutorService.shutdownNow();
						remainingMillis = Math.max(100L, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
						workerExecutorService.awaitTermination(remainingMillis, TimeUnit.MILLISECONDS);
					}
				}

				ScheduledExecutorService asyncTimeoutExecutorService = getAsyncTimeoutExecutorService().orElse(null);

				if (asyncTimeoutExecutorService != null)
					asyncTimeoutExecutorService.shutdownNow();

				long remainingMillis = Math.max(100L, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
				eventLoop.join(remainingMillis);
			} catch (InterruptedException e) {
				interrupted = true;
			} catch (Exception e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to shut down server worker executor service")
						.throwable(e)
						.build());
			} finally {
				if (interrupted)
					Thread.currentThread().interrupt();
			}
		} finally {
			this.eventLoop = null;
			this.boundPort = null;
			this.workerExecutorService = null;
			this.asyncTimeoutExecutorService = null;

			getLock().unlock();
		}
	}

	protected void handleRequest(@NonNull MicrohttpRequest microhttpRequest,
															 @NonNull ResponseCallback responseCallback) {
		requireNonNull(microhttpRequest);
		requireNonNull(responseCallback);

		RequestHandler requestHandler = getRequestHandler().orElse(null);

		if (requestHandler == null)
			return;

		Instant startedAt = Instant.now();
		long startedAtNanos = System.nanoTime();
		AtomicReference<ScheduledFuture<?>> asyncTimeoutFutureRef = new AtomicReference<>();
		RequestContext requestContext;

		try {
			HttpMethod httpMethod = HttpMethod.fromRequestLine(microhttpRequest.method());
			List<HttpHeader> headers = new ArrayList<>(microhttpRequest.headers().size());

			for (Header header : microhttpRequest.headers())
				headers.add(new HttpHeader(header.name(), header.value() == null ? "" : header.value()));

			requestContext = RequestContext.withRequest(httpMethod, microhttpRequest.uri())
					.headers(headers)
					.body(microhttpRequest.body())
					.remoteAddress(microhttpRequest.remoteAddress())
					.startedAt(startedAt)
					.sessionStore(getSessionStore().orElse(null))
					.logEventHandler(this::safelyLog)
					.completionHandler((completedRequestContext) -> {
						cancelTimeout(asyncTimeoutFutureRef.getAndSet(null));
						respondSafely(responseCallback, toMicrohttpResponse(completedRequestContext));
						didCompleteRequest(microhttpRequest, completedRequestContext.getStatusCode(), startedAt, startedAtNanos);
					})
					.build();
		} catch (BadRequestException e) {
			safelyLog(LogEvent.with(LogEventType.BAD_REQUEST, e.getMessage())
					.throwable(e)
					.uri(microhttpRequest.uri())
					.build());
			respondSafely(responseCallback, provideFailsafeResponse(400).withConnectionClose());
			didCompleteRequest(microhttpRequest, 400, startedAt, startedAtNanos);
			return;
		}

		try {
			requestHandler.handleRequest(requestContext);
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "An unexpected error occurred during request handling")
					.throwable(t)
					.uri(microhttpRequest.uri())
					.build());

			if (requestContext.abandon()) {
				respondSafely(responseCallback, provideFailsafeResponse(500).withConnectionClose());
				didCompleteRequest(microhttpRequest, 500, startedAt, startedAtNanos);
			}

			return;
		}

		if (!requestContext.isCompleted())
			scheduleAsyncTimeout(requestContext, responseCallback, microhttpRequest.remoteAddress(), asyncTimeoutFutureRef);
	}

	private void scheduleAsyncTimeout(@NonNull RequestContext requestContext,
																		@NonNull ResponseCallback responseCallback,
																		@Nullable InetSocketAddress remoteAddress,
																		@NonNull AtomicReference<ScheduledFuture<?>> asyncTimeoutFutureRef) {
		requireNonNull(requestContext);
		requireNonNull(responseCallback);
		requireNonNull(asyncTimeoutFutureRef);

		ScheduledExecutorService asyncTimeoutExecutorService = this.asyncTimeoutExecutorService;

		if (asyncTimeoutExecutorService == null || asyncTimeoutExecutorService.isShutdown())
			return;

		try {
			asyncTimeoutFutureRef.set(asyncTimeoutExecutorService.schedule(() -> {
				if (!requestContext.abandon())
					return;

				requestContext.reportProtocolMisuse(format("Async response was not completed within %d ms; closing connection",
						getAsyncTimeout().toMillis()));
				safelyNotify(() -> getLifecycleObserver().ifPresent(lifecycleObserver -> lifecycleObserver.didTimeOutRequest(remoteAddress)));
				responseCallback.abort();
			}, Math.max(1L, getAsyncTimeout().toMillis()), TimeUnit.MILLISECONDS));
		} catch (RejectedExecutionException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to schedule async timeout")
					.throwable(e)
					.uri(requestContext.getUri())
					.build());
		}

		// The async side may have finished while we were scheduling
		if (requestContext.isCompleted())
			cancelTimeout(asyncTimeoutFutureRef.getAndSet(null));
	}

	private void didCompleteRequest(@NonNull MicrohttpRequest microhttpRequest,
																	@NonNull Integer statusCode,
																	@NonNull Instant startedAt,
																	long startedAtNanos) {
		requireNonNull(microhttpRequest);
		requireNonNull(statusCode);
		requireNonNull(startedAt);

		String[] pathAndQuery = Utilities.splitRequestTarget(microhttpRequest.uri());
		RequestEvent requestEvent = new RequestEvent(startedAt,
				microhttpRequest.method(),
				pathAndQuery[0],
				pathAndQuery[1],
				microhttpRequest.header("User-Agent"),
				microhttpRequest.header("Referer"),
				statusCode,
				Duration.ofNanos(System.nanoTime() - startedAtNanos));

		safelyNotify(() -> getLifecycleObserver().ifPresent(lifecycleObserver -> lifecycleObserver.didCompleteRequest(requestEvent)));
	}

	@NonNull
	protected MicrohttpResponse toMicrohttpResponse(@NonNull RequestContext requestContext) {
		requireNonNull(requestContext);

		List<Header> headers = new ArrayList<>(requestContext.getResponseHeaders().size() + 1);

		if (requestContext.getResponseHeader("Server").isEmpty())
			headers.add(new Header("Server", getServerName()));

		for (HttpHeader httpHeader : requestContext.getResponseHeaders())
			headers.add(new Header(httpHeader.name(), httpHeader.value()));

		byte[] body = requestContext.getResponseBody();

		// HEAD reports the length the GET body would have had
		if (requestContext.getHttpMethod() == HttpMethod.HEAD) {
			if (requestContext.getResponseHeader("Content-Length").isEmpty())
				headers.add(new Header("Content-Length", String.valueOf(body.length)));

			body = Utilities.emptyByteArray();
		}

		Integer statusCode = requestContext.getStatusCode();
		return new MicrohttpResponse(statusCode, StatusCode.reasonPhraseFor(statusCode), headers, body);
	}

	@NonNull
	protected MicrohttpResponse provideFailsafeResponse(@NonNull Integer statusCode) {
		requireNonNull(statusCode);

		String reasonPhrase = StatusCode.reasonPhraseFor(statusCode);
		return MicrohttpResponse.plainText(statusCode, reasonPhrase, List.of(new Header("Server", getServerName())),
				format("HTTP %d: %s", statusCode, reasonPhrase));
	}

	private void respondSafely(@NonNull ResponseCallback responseCallback,
														 @NonNull MicrohttpResponse microhttpResponse) {
		requireNonNull(responseCallback);
		requireNonNull(microhttpResponse);

		try {
			responseCallback.respond(microhttpResponse);
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to write response")
					.throwable(t)
					.build());
		}
	}

	private void cancelTimeout(@Nullable ScheduledFuture<?> timeoutFuture) {
		if (timeoutFuture != null)
			timeoutFuture.cancel(false);
	}

	@NonNull
	private Duration determineSweepInterval() {
		Duration shortestTimeout = getIdleTimeout().compareTo(getRequestTimeout()) < 0 ? getIdleTimeout() : getRequestTimeout();
		Duration sweepInterval = shortestTimeout.dividedBy(2);

		if (sweepInterval.compareTo(DEFAULT_SWEEP_INTERVAL) > 0)
			return DEFAULT_SWEEP_INTERVAL;

		return sweepInterval.compareTo(MINIMUM_SWEEP_INTERVAL) < 0 ? MINIMUM_SWEEP_INTERVAL : sweepInterval;
	}

	@NonNull
	@Override
	public Boolean isStarted() {
		getLock().lock();

		try {
			return getEventLoop().isPresent();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	@Override
	public Optional<Integer> getBoundPort() {
		return Optional.ofNullable(this.boundPort);
	}

	@Override
	public void initialize(@NonNull RequestHandler requestHandler,
												 @NonNull LifecycleObserver lifecycleObserver,
												 @Nullable SessionStore sessionStore) {
		requireNonNull(requestHandler);
		requireNonNull(lifecycleObserver);

		this.requestHandler = requestHandler;
		this.lifecycleObserver = lifecycleObserver;
		this.sessionStore = sessionStore;
	}

	protected void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);
		safelyNotify(() -> getLifecycleObserver().ifPresent(lifecycleObserver -> lifecycleObserver.didReceiveLogEvent(logEvent)));
	}

	protected void safelyNotify(@NonNull Runnable notification) {
		requireNonNull(notification);

		try {
			notification.run();
		} catch (Throwable throwable) {
			// The observer failed and there is nowhere else to report it, so fall back to SLF4J
			logger.error("{} threw while being notified", LifecycleObserver.class.getSimpleName(), throwable);
		}
	}

	@NonNull
	protected Integer getPort() {
		return this.port;
	}

	@NonNull
	protected String getHost() {
		return this.host;
	}

	@NonNull
	protected Integer getThreadPoolSize() {
		return this.threadPoolSize;
	}

	@NonNull
	protected Integer getEventLoopCount() {
		return this.eventLoopCount;
	}

	@NonNull
	protected Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	@NonNull
	protected Duration getIdleTimeout() {
		return this.idleTimeout;
	}

	@NonNull
	protected Duration getAsyncTimeout() {
		return this.asyncTimeout;
	}

	@NonNull
	protected Duration getSocketSelectTimeout() {
		return this.socketSelectTimeout;
	}

	@NonNull
	protected Duration getShutdownTimeout() {
		return this.shutdownTimeout;
	}

	@NonNull
	protected Integer getMaximumRequestSizeInBytes() {
		return this.maximumRequestSizeInBytes;
	}

	@NonNull
	protected Integer getRequestReadBufferSizeInBytes() {
		return this.requestReadBufferSizeInBytes;
	}

	@NonNull
	protected Integer getSocketPendingConnectionLimit() {
		return this.socketPendingConnectionLimit;
	}

	@NonNull
	protected Integer getMaximumConnections() {
		return this.maximumConnections;
	}

	@NonNull
	protected String getServerName() {
		return this.serverName;
	}

	@NonNull
	protected ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	protected Optional<ExecutorService> getWorkerExecutorService() {
		return Optional.ofNullable(this.workerExecutorService);
	}

	@NonNull
	protected Optional<ScheduledExecutorService> getAsyncTimeoutExecutorService() {
		return Optional.ofNullable(this.asyncTimeoutExecutorService);
	}

	@NonNull
	protected Optional<RequestHandler> getRequestHandler() {
		return Optional.ofNullable(this.requestHandler);
	}

	@NonNull
	protected Optional<LifecycleObserver> getLifecycleObserver() {
		return Optional.ofNullable(this.lifecycleObserver);
	}

	@NonNull
	protected Optional<SessionStore> getSessionStore() {
		return Optional.ofNullable(this.sessionStore);
	}

	@NonNull
	protected Optional<EventLoop> getEventLoop() {
		return Optional.ofNullable(this.eventLoop);
	}

	private void cleanupFailedStart(@Nullable EventLoop eventLoop) {
		if (eventLoop != null) {
			try {
				eventLoop.stop();
			} catch (Exception e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to shut down server event loop after failed start")
						.throwable(e)
						.build());
			}
		}

		ExecutorService workerExecutorService = this.workerExecutorService;

		if (workerExecutorService != null)
			workerExecutorService.shutdownNow();

		ScheduledExecutorService asyncTimeoutExecutorService = this.asyncTimeoutExecutorService;

		if (asyncTimeoutExecutorService != null)
			asyncTimeoutExecutorService.shutdownNow();

		this.eventLoop = null;
		this.boundPort = null;
		this.workerExecutorService = null;
		this.asyncTimeoutExecutorService = null;
	}

	/**
	 * Forwards engine connection events to the {@link LifecycleObserver}.
	 */
	@ThreadSafe
	private final class LifecycleConnectionListener implements ConnectionListener {
		@Override
		public void didAcceptConnection(@Nullable InetSocketAddress remoteAddress) {
			safelyNotify(() -> getLifecycleObserver().ifPresent(lifecycleObserver -> lifecycleObserver.didAcceptConnection(remoteAddress)));
		}

		@Override
		public void didFailToAcceptConnection(@Nullable InetSocketAddress remoteAddress) {
			safelyNotify(() -> getLifecycleObserver().ifPresent(lifecycleObserver -> lifecycleObserver.didFailToAcceptConnection(remoteAddress)));
		}

		@Override
		public void didCloseConnection(@Nullable InetSocketAddress remoteAddress) {
			safelyNotify(() -> getLifecycleObserver().ifPresent(lifecycleObserver -> lifecycleObserver.didCloseConnection(remoteAddress)));
		}

		@Override
		public void didDisconnectIdleConnection(@Nullable InetSocketAddress remoteAddress) {
			safelyNotify(() -> getLifecycleObserver().ifPresent(lifecycleObserver -> lifecycleObserver.didDisconnectIdleConnection(remoteAddress)));
		}

		@Override
		public void didTimeOutRequest(@Nullable InetSocketAddress remoteAddress) {
			safelyNotify(() -> getLifecycleObserver().ifPresent(lifecycleObserver -> lifecycleObserver.didTimeOutRequest(remoteAddress)));
		}
	}

	@ThreadSafe
	protected static class NonvirtualThreadFactory implements ThreadFactory {
		@NonNull
		private final String namePrefix;
		@NonNull
		private final AtomicInteger idGenerator;

		public NonvirtualThreadFactory(@NonNull String namePrefix) {
			requireNonNull(namePrefix);

			this.namePrefix = namePrefix;
			this.idGenerator = new AtomicInteger(0);
		}

		@Override
		@NonNull
		public Thread newThread(@NonNull Runnable runnable) {
			String name = format("%s-%s", getNamePrefix(), getIdGenerator().incrementAndGet());
			Thread thread = new Thread(runnable, name);
			thread.setDaemon(true);
			return thread;
		}

		@NonNull
		protected String getNamePrefix() {
			return this.namePrefix;
		}

		@NonNull
		protected AtomicInteger getIdGenerator() {
			return this.idGenerator;
		}
	}
}
