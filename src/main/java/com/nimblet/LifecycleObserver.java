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

import java.net.InetSocketAddress;

/**
 * Read-only hook methods for observing system and request lifecycle events.
 * <p>
 * Methods are invoked on engine threads (event loops, workers, timers) and must return quickly.
 * Exceptions thrown from them are caught and reported as {@link LogEventType#LIFECYCLE_OBSERVER_FAILED}.
 * <p>
 * {@link Nimblet} routes these events into its logging and statistics subsystems; applications may supply their
 * own observer to see the same events.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface LifecycleObserver {
	/**
	 * Called before a {@link Nimblet} instance starts.
	 */
	default void willStartNimblet(@NonNull Nimblet nimblet) {
		// No-op by default
	}

	/**
	 * Called after a {@link Nimblet} instance starts.
	 */
	default void didStartNimblet(@NonNull Nimblet nimblet) {
		// No-op by default
	}

	/**
	 * Called after a {@link Nimblet} instance was asked to start, but failed due to an exception.
	 */
	default void didFailToStartNimblet(@NonNull Nimblet nimblet,
																		 @NonNull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called before a {@link Nimblet} instance stops.
	 */
	default void willStopNimblet(@NonNull Nimblet nimblet) {
		// No-op by default
	}

	/**
	 * Called after a {@link Nimblet} instance stops.
	 */
	default void didStopNimblet(@NonNull Nimblet nimblet) {
		// No-op by default
	}

	/**
	 * Called when a connection is accepted.
	 */
	default void didAcceptConnection(@Nullable InetSocketAddress remoteAddress) {
		// No-op by default
	}

	/**
	 * Called when a connection is refused because the connection limit was reached.
	 */
	default void didFailToAcceptConnection(@Nullable InetSocketAddress remoteAddress) {
		// No-op by default
	}

	/**
	 * Called exactly once per accepted connection when it closes.
	 */
	default void didCloseConnection(@Nullable InetSocketAddress remoteAddress) {
		// No-op by default
	}

	/**
	 * Called when a connection is closed for idling between requests.
	 */
	default void didDisconnectIdleConnection(@Nullable InetSocketAddress remoteAddress) {
		// No-op by default
	}

	/**
	 * Called when a connection is closed because a request was not received, or an async response not
	 * completed, in time.
	 */
	default void didTimeOutRequest(@Nullable InetSocketAddress remoteAddress) {
		// No-op by default
	}

	/**
	 * Called once per request whose response was handed to the connection for writing.
	 */
	default void didCompleteRequest(@NonNull RequestEvent requestEvent) {
		// No-op by default
	}

	/**
	 * Called when Nimblet emits a diagnostic event.
	 */
	default void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		// No-op by default
	}
}
