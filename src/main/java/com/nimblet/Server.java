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
import java.time.Duration;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The HTTP engine: accepts connections, parses requests, hands them to a {@link RequestHandler} on a worker
 * thread and writes responses back.
 * <p>
 * <strong>Most applications use the standard implementation acquired via {@link #withPort(Integer)}
 * and never implement this interface directly.</strong>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Server extends AutoCloseable {
	/**
	 * Binds the listening socket and starts the event loops and worker pool. Calling more than once has no effect.
	 *
	 * @throws java.io.UncheckedIOException if the socket cannot be bound
	 */
	void start();

	/**
	 * Stops accepting, lets in-flight work drain up to the shutdown timeout, then closes everything.
	 * Calling on a stopped server has no effect.
	 */
	void stop();

	@NonNull
	Boolean isStarted();

	/**
	 * The port actually bound, which differs from the configured one when that was {@code 0}.
	 *
	 * @return the bound port, or {@link Optional#empty()} if not started
	 */
	@NonNull
	Optional<Integer> getBoundPort();

	/**
	 * Wires the server to request processing and event reporting. Must be called before {@link #start()}.
	 *
	 * @param requestHandler    receives every parsed request on a worker thread
	 * @param lifecycleObserver receives connection, request and diagnostic events
	 * @param sessionStore      backs {@link RequestContext#getSession()}, or {@code null} for none
	 */
	void initialize(@NonNull RequestHandler requestHandler,
									@NonNull LifecycleObserver lifecycleObserver,
									@Nullable SessionStore sessionStore);

	/**
	 * {@link AutoCloseable}-enabled synonym for {@link #stop()}.
	 */
	@Override
	default void close() {
		stop();
	}

	/**
	 * Request processing contract between a {@link Server} and whatever routes requests.
	 * <p>
	 * Implementations must flush the {@link RequestContext} before returning, unless async processing was started.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@FunctionalInterface
	interface RequestHandler {
		void handleRequest(@NonNull RequestContext requestContext);
	}

	@NonNull
	static Builder withPort(@NonNull Integer port) {
		requireNonNull(port);
		return new Builder(port);
	}

	/**
	 * Builder used to construct a standard implementation of {@link Server}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	final class Builder {
		@NonNull
		Integer port;
		@Nullable
		String host;
		@Nullable
		Integer threadPoolSize;
		@Nullable
		Integer eventLoopCount;
		@Nullable
		Duration requestTimeout;
		@Nullable
		Duration idleTimeout;
		@Nullable
		Duration asyncTimeout;
		@Nullable
		Duration socketSelectTimeout;
		@Nullable
		Duration shutdownTimeout;
		@Nullable
		Integer maximumRequestSizeInBytes;
		@Nullable
		Integer requestReadBufferSizeInBytes;
		@Nullable
		Integer socketPendingConnectionLimit;
		@Nullable
		Integer maximumConnections;
		@Nullable
		String serverName;

		private Builder(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
		}

		@NonNull
		public Builder port(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
			return this;
		}

		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		/**
		 * Number of worker threads that run handlers.
		 */
		@NonNull
		public Builder threadPoolSize(@Nullable Integer threadPoolSize) {
			this.threadPoolSize = threadPoolSize;
			return this;
		}

		/**
		 * Number of connection event loops (selector threads).
		 */
		@NonNull
		public Builder eventLoopCount(@Nullable Integer eventLoopCount) {
			this.eventLoopCount = eventLoopCount;
			return this;
		}

		@NonNull
		public Builder requestTimeout(@Nullable Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		@NonNull
		public Builder idleTimeout(@Nullable Duration idleTimeout) {
			this.idleTimeout = idleTimeout;
			return this;
		}

		@NonNull
		public Builder asyncTimeout(@Nullable Duration asyncTimeout) {
			this.asyncTimeout = asyncTimeout;
			return this;
		}

		@NonNull
		public Builder socketSelectTimeout(@Nullable Duration socketSelectTimeout) {
			this.socketSelectTimeout = socketSelectTimeout;
			return this;
		}

		@NonNull
		public Builder shutdownTimeout(@Nullable Duration shutdownTimeout) {
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		@NonNull
		public Builder maximumRequestSizeInBytes(@Nullable Integer maximumRequestSizeInBytes) {
			this.maximumRequestSizeInBytes = maximumRequestSizeInBytes;
			return this;
		}

		@NonNull
		public Builder requestReadBufferSizeInBytes(@Nullable Integer requestReadBufferSizeInBytes) {
			this.requestReadBufferSizeInBytes = requestReadBufferSizeInBytes;
			return this;
		}

		@NonNull
		public Builder socketPendingConnectionLimit(@Nullable Integer socketPendingConnectionLimit) {
			this.socketPendingConnectionLimit = socketPendingConnectionLimit;
			return this;
		}

		@NonNull
		public Builder maximumConnections(@Nullable Integer maximumConnections) {
			this.maximumConnections = maximumConnections;
			return this;
		}

		/**
		 * Value of the {@code Server} response header.
		 */
		@NonNull
		public Builder serverName(@Nullable String serverName) {
			this.serverName = serverName;
			return this;
		}

		@NonNull
		public Server build() {
			return new DefaultServer(this);
		}
	}
}
