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

import static java.util.Objects.requireNonNull;

/**
 * Kinds of {@link LogEvent} instances that Nimblet can produce.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum LogEventType {
	/**
	 * Startup echo of a resolved configuration value.
	 */
	CONFIGURATION(LogLevel.INFO),
	/**
	 * Indicates that a configuration option was supplied but isn't supported; it is ignored.
	 */
	CONFIGURATION_UNSUPPORTED(LogLevel.WARNING),
	/**
	 * Container start and stop milestones.
	 */
	LIFECYCLE(LogLevel.INFO),
	/**
	 * Indicates handler code threw an exception or error; the client received an HTTP 500.
	 */
	HANDLER_FAULT(LogLevel.ERROR),
	/**
	 * Indicates the async handoff contract was broken, e.g. a second {@link AsyncContext#complete()} or a never-completed context.
	 */
	PROTOCOL_MISUSE(LogLevel.ERROR),
	/**
	 * Indicates an RSP page document could not be parsed.
	 */
	MALFORMED_DOCUMENT(LogLevel.WARNING),
	/**
	 * Indicates a handler name was referenced but never registered.
	 */
	UNKNOWN_HANDLER(LogLevel.ERROR),
	/**
	 * Indicates a request whose method, URI or query could not be interpreted.
	 */
	BAD_REQUEST(LogLevel.WARNING),
	/**
	 * Indicates a log file was rotated.
	 */
	LOG_ROTATION(LogLevel.INFO),
	/**
	 * Indicates log entries were dropped because the {@link LogQueue} was full.
	 */
	LOG_QUEUE_OVERFLOW(LogLevel.WARNING),
	/**
	 * Indicates {@link LifecycleObserver} code threw an exception.
	 */
	LIFECYCLE_OBSERVER_FAILED(LogLevel.ERROR),
	/**
	 * Indicates an internal {@link Server} error occurred.
	 */
	SERVER_INTERNAL_ERROR(LogLevel.ERROR);

	@NonNull
	private final LogLevel defaultLogLevel;

	LogEventType(@NonNull LogLevel defaultLogLevel) {
		this.defaultLogLevel = requireNonNull(defaultLogLevel);
	}

	/**
	 * The level used for events of this type unless the builder overrides it.
	 *
	 * @return the default level
	 */
	@NonNull
	public LogLevel getDefaultLogLevel() {
		return this.defaultLogLevel;
	}
}
