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
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One line of the request log, produced exactly once per completed request.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class RequestEvent implements LogEntry {
	@NonNull
	private final Instant timestamp;
	@NonNull
	private final String method;
	@NonNull
	private final String uri;
	@Nullable
	private final String query;
	@Nullable
	private final String userAgent;
	@Nullable
	private final String referer;
	@NonNull
	private final Integer statusCode;
	@NonNull
	private final Duration processingTime;

	public RequestEvent(@NonNull Instant timestamp,
											@NonNull String method,
											@NonNull String uri,
											@Nullable String query,
											@Nullable String userAgent,
											@Nullable String referer,
											@NonNull Integer statusCode,
											@NonNull Duration processingTime) {
		this.timestamp = requireNonNull(timestamp);
		this.method = requireNonNull(method);
		this.uri = requireNonNull(uri);
		this.query = query;
		this.userAgent = userAgent;
		this.referer = referer;
		this.statusCode = requireNonNull(statusCode);
		this.processingTime = requireNonNull(processingTime);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{method=%s, uri=%s, query=%s, statusCode=%s, processingTime=%s}", getClass().getSimpleName(),
				getMethod(), getUri(), getQuery().orElse(null), getStatusCode(), getProcessingTime());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RequestEvent requestEvent))
			return false;

		return Objects.equals(getTimestamp(), requestEvent.getTimestamp())
				&& Objects.equals(getMethod(), requestEvent.getMethod())
				&& Objects.equals(getUri(), requestEvent.getUri())
				&& Objects.equals(getQuery(), requestEvent.getQuery())
				&& Objects.equals(getUserAgent(), requestEvent.getUserAgent())
				&& Objects.equals(getReferer(), requestEvent.getReferer())
				&& Objects.equals(getStatusCode(), requestEvent.getStatusCode())
				&& Objects.equals(getProcessingTime(), requestEvent.getProcessingTime());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getTimestamp(), getMethod(), getUri(), getQuery(), getUserAgent(), getReferer(),
				getStatusCode(), getProcessingTime());
	}

	@Override
	@NonNull
	public Instant getTimestamp() {
		return this.timestamp;
	}

	@NonNull
	public String getMethod() {
		return this.method;
	}

	/**
	 * The request path, without query string.
	 *
	 * @return the path
	 */
	@NonNull
	public String getUri() {
		return this.uri;
	}

	/**
	 * The raw query string, without the leading {@code ?}.
	 *
	 * @return the query, or {@link Optional#empty()} if the request had none
	 */
	@NonNull
	public Optional<String> getQuery() {
		return Optional.ofNullable(this.query);
	}

	@NonNull
	public Optional<String> getUserAgent() {
		return Optional.ofNullable(this.userAgent);
	}

	@NonNull
	public Optional<String> getReferer() {
		return Optional.ofNullable(this.referer);
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	/**
	 * Wall-clock time from request parse to response flush.
	 *
	 * @return the processing time
	 */
	@NonNull
	public Duration getProcessingTime() {
		return this.processingTime;
	}
}
