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

import com.nimblet.exception.ProtocolMisuseException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.ByteArrayOutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Per-request state shared by every handler that participates in producing one response.
 * <p>
 * The request side is fixed at construction. The response side (status, headers, body buffer) is written by
 * handlers and flushed exactly once: when the handler returns, or via {@link AsyncContext#complete()} after
 * {@link #startAsync()}.
 * <p>
 * Instances are confined to one thread at a time. Async handoff transfers that confinement to whichever thread
 * holds the {@link AsyncContext}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public final class RequestContext {
	@NonNull
	private static final Integer DEFAULT_STATUS_CODE;

	static {
		DEFAULT_STATUS_CODE = 200;
	}

	@NonNull
	private final HttpMethod httpMethod;
	@NonNull
	private final String uri;
	@NonNull
	private final String path;
	@Nullable
	private final String query;
	@NonNull
	private final Map<@NonNull String, @NonNull List<@NonNull String>> queryParameters;
	@NonNull
	private final List<@NonNull HttpHeader> headers;
	@NonNull
	private final byte[] body;
	@NonNull
	private final Map<@NonNull String, @NonNull String> cookies;
	@Nullable
	private final InetSocketAddress remoteAddress;
	@NonNull
	private final Instant startedAt;
	@NonNull
	private final Long startedAtNanos;
	@Nullable
	private final SessionStore sessionStore;
	@NonNull
	private final Consumer<RequestContext> completionHandler;
	@NonNull
	private final Consumer<LogEvent> logEventHandler;
	@NonNull
	private final AtomicBoolean completed;
	@NonNull
	private final List<@NonNull HttpHeader> responseHeaders;
	@NonNull
	private final ByteArrayOutputStream responseBody;
	@NonNull
	private Integer statusCode;
	@Nullable
	private String redirectUrl;
	@Nullable
	private Session session;
	@Nullable
	private AsyncContext asyncContext;
	@NonNull
	private Integer pageDepth;

	/**
	 * Acquires a builder for a request with the given method and raw request-target.
	 *
	 * @param httpMethod the request method
	 * @param uri        the raw request-target, e.g. {@code /echo?a=1}
	 * @return the builder
	 */
	@NonNull
	public static Builder withRequest(@NonNull HttpMethod httpMethod,
																		@NonNull String uri) {
		requireNonNull(httpMethod);
		requireNonNull(uri);

		return new Builder(httpMethod, uri);
	}

	protected RequestContext(@NonNull Builder builder) {
		requireNonNull(builder);

		String[] pathAndQuery = Utilities.splitRequestTarget(builder.uri);

		this.httpMethod = builder.httpMethod;
		this.uri = builder.uri;
		this.path = Utilities.normalizePath(pathAndQuery[0]);
		this.query = pathAndQuery[1];
		this.queryParameters = Utilities.extractQueryParameters(this.query);
		this.headers = builder.headers == null ? List.of() : List.copyOf(builder.headers);
		this.body = builder.body == null ? Utilities.emptyByteArray() : builder.body;
		this.cookies = Utilities.extractCookies(this.headers);
		this.remoteAddress = builder.remoteAddress;
		this.startedAt = builder.startedAt == null ? Instant.now() : builder.startedAt;
		this.startedAtNanos = System.nanoTime();
		this.sessionStore = builder.sessionStore;
		this.completionHandler = builder.completionHandler == null ? (requestContext) -> {} : builder.completionHandler;
		this.logEventHandler = builder.logEventHandler == null ? (logEvent) -> {} : builder.logEventHandler;
		this.completed = new AtomicBoolean(false);
		this.responseHeaders = new ArrayList<>();
		this.responseBody = new ByteArrayOutputStream();
		this.statusCode = DEFAULT_STATUS_CODE;
		this.pageDepth = 0;
	}

	// Request side

	@NonNull
	public HttpMethod getHttpMethod() {
		return this.httpMethod;
	}

	/**
	 * The raw request-target as sent by the client, query included.
	 */
	@NonNull
	public String getUri() {
		return this.uri;
	}

	/**
	 * The percent-decoded, dot-segment-free path used for routing.
	 */
	@NonNull
	public String getPath() {
		return this.path;
	}

	/**
	 * The raw (still percent-encoded) query string, without the leading {@code ?}.
	 */
	@NonNull
	public Optional<String> getQuery() {
		return Optional.ofNullable(this.query);
	}

	@NonNull
	public Map<@NonNull String, @NonNull List<@NonNull String>> getQueryParameters() {
		return this.queryParameters;
	}

	@NonNull
	public Optional<String> getQueryParameter(@NonNull String name) {
		requireNonNull(name);

		List<String> values = getQueryParameters().get(name);
		return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
	}

	@NonNull
	public List<@NonNull String> getQueryParameterValues(@NonNull String name) {
		requireNonNull(name);

		List<String> values = getQueryParameters().get(name);
		return values == null ? List.of() : values;
	}

	@NonNull
	public List<@NonNull HttpHeader> getHeaders() {
		return this.headers;
	}

	/**
	 * The first request header with the given case-insensitive name.
	 */
	@NonNull
	public Optional<String> getHeader(@NonNull String name) {
		requireNonNull(name);

		for (HttpHeader header : getHeaders())
			if (header.hasName(name))
				return Optional.of(header.value());

		return Optional.empty();
	}

	@NonNull
	public List<@NonNull String> getHeaderValues(@NonNull String name) {
		requireNonNull(name);

		List<String> values = new ArrayList<>();

		for (HttpHeader header : getHeaders())
			if (header.hasName(name))
				values.add(header.value());

		return Collections.unmodifiableList(values);
	}

	@NonNull
	public byte[] getBody() {
		return this.body;
	}

	/**
	 * The request body decoded as UTF-8.
	 */
	@NonNull
	public String getBodyAsString() {
		return new String(getBody(), StandardCharsets.UTF_8);
	}

	@NonNull
	public Map<@NonNull String, @NonNull String> getCookies() {
		return this.cookies;
	}

	@NonNull
	public Optional<String> getCookie(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(getCookies().get(name));
	}

	@NonNull
	public Optional<InetSocketAddress> getRemoteAddress() {
		return Optional.ofNullable(this.remoteAddress);
	}

	@NonNull
	public Instant getStartedAt() {
		return this.startedAt;
	}

	/**
	 * {@link System#nanoTime()} at construction, for computing processing time.
	 */
	@NonNull
	public Long getStartedAtNanos() {
		return this.startedAtNanos;
	}

	// Response side

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	public void setStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);

		if (statusCode < 100 || statusCode > 999)
			throw new IllegalArgumentException(format("Illegal status code %d", statusCode));

		this.statusCode = statusCode;
	}

	/**
	 * Response headers in the order they were added. Duplicates are permitted.
	 */
	@NonNull
	public List<@NonNull HttpHeader> getResponseHeaders() {
		return Collections.unmodifiableList(this.responseHeaders);
	}

	@NonNull
	public Optional<String> getResponseHeader(@NonNull String name) {
		requireNonNull(name);

		for (HttpHeader header : this.responseHeaders)
			if (header.hasName(name))
				return Optional.of(header.value());

		return Optional.empty();
	}

	public void addHeader(@NonNull String name,
												@NonNull String value) {
		requireNonNull(name);
		requireNonNull(value);

		this.responseHeaders.add(new HttpHeader(name, value));
	}

	/**
	 * Replaces every response header with the given name by a single header.
	 */
	public void setHeader(@NonNull String name,
												@NonNull String value) {
		requireNonNull(name);
		requireNonNull(value);

		removeHeader(name);
		addHeader(name, value);
	}

	public void removeHeader(@NonNull String name) {
		requireNonNull(name);
		this.responseHeaders.removeIf((header) -> header.hasName(name));
	}

	public void setContentType(@NonNull String contentType) {
		requireNonNull(contentType);
		setHeader("Content-Type", contentType);
	}

	@NonNull
	public Optional<String> getContentType() {
		return getResponseHeader("Content-Type");
	}

	/**
	 * Adds a {@code Set-Cookie} response header.
	 *
	 * @param name       cookie name
	 * @param value      cookie value
	 * @param attributes attribute text appended after {@code ; }, e.g. {@code Path=/; HttpOnly}, or {@code null} for none
	 */
	public void addCookie(@NonNull String name,
												@NonNull String value,
												@Nullable String attributes) {
		requireNonNull(name);
		requireNonNull(value);

		String trimmedAttributes = Utilities.trimAggressivelyToNull(attributes);
		addHeader("Set-Cookie", trimmedAttributes == null
				? format("%s=%s", name, value)
				: format("%s=%s; %s", name, value, trimmedAttributes));
	}

	/**
	 * Responds with {@code 302 Found} and a {@code Location} header.
	 */
	public void setRedirect(@NonNull String redirectUrl) {
		requireNonNull(redirectUrl);

		this.redirectUrl = redirectUrl;
		setStatusCode(302);
		setHeader("Location", redirectUrl);
	}

	@NonNull
	public Optional<String> getRedirectUrl() {
		return Optional.ofNullable(this.redirectUrl);
	}

	public void write(@NonNull String string) {
		requireNonNull(string);
		write(string.getBytes(StandardCharsets.UTF_8));
	}

	public void write(@NonNull byte[] bytes) {
		requireNonNull(bytes);
		this.responseBody.writeBytes(bytes);
	}

	/**
	 * A copy of the response body buffered so far.
	 */
	@NonNull
	public byte[] getResponseBody() {
		return this.responseBody.toByteArray();
	}

	// Sessions

	/**
	 * The session bound to this request, created (with a {@code Set-Cookie} header) when the client presents
	 * no live session cookie or the current session has been invalidated.
	 *
	 * @return the session
	 * @throws IllegalStateException if no session store is configured
	 */
	@NonNull
	public Session getSession() {
		if (this.session != null && !this.session.isInvalidated())
			return this.session;

		if (this.sessionStore == null)
			throw new IllegalStateException("No session store is configured");

		if (this.session == null) {
			Session existingSession = this.sessionStore.findSession(getCookie(this.sessionStore.getCookieName()).orElse(null)).orElse(null);

			if (existingSession != null) {
				this.session = existingSession;
				return existingSession;
			}
		}

		Session newSession = this.sessionStore.createSession();
		this.session = newSession;
		addCookie(this.sessionStore.getCookieName(), newSession.getId(), "Path=/; HttpOnly");

		return newSession;
	}

	/**
	 * The session this request already holds, without creating one.
	 */
	@NonNull
	public Optional<Session> getExistingSession() {
		if (this.session != null && !this.session.isInvalidated())
			return Optional.of(this.session);

		if (this.sessionStore == null)
			return Optional.empty();

		Optional<Session> existingSession = this.sessionStore.findSession(getCookie(this.sessionStore.getCookieName()).orElse(null));
		existingSession.ifPresent((session) -> this.session = session);

		return existingSession;
	}

	// Async

	/**
	 * Detaches the response from the current worker thread.
	 * <p>
	 * The handler returns without the response being flushed; whoever holds the returned {@link AsyncContext}
	 * must call {@link AsyncContext#complete()} exactly once.
	 *
	 * @return the async context
	 * @throws ProtocolMisuseException if called twice, after completion, or from a handler invoked by an RSP page
	 */
	@NonNull
	public AsyncContext startAsync() {
		if (this.pageDepth > 0)
			throw reportProtocolMisuse("startAsync() is not permitted from a handler invoked by an RSP page");

		if (this.asyncContext != null)
			throw reportProtocolMisuse("startAsync() was already called for this request");

		if (isCompleted())
			throw reportProtocolMisuse("startAsync() was called after the response was flushed");

		this.asyncContext = new AsyncContext(this);
		return this.asyncContext;
	}

	@NonNull
	public Boolean isAsyncStarted() {
		return this.asyncContext != null;
	}

	@NonNull
	public Optional<AsyncContext> getAsyncContext() {
		return Optional.ofNullable(this.asyncContext);
	}

	@NonNull
	public Boolean isCompleted() {
		return this.completed.get();
	}

	// Engine-facing

	/**
	 * Flushes the response if nobody has yet.
	 *
	 * @return {@code true} if this call performed the flush
	 */
	@NonNull
	Boolean complete() {
		if (!this.completed.compareAndSet(false, true))
			return false;

		this.completionHandler.accept(this);
		return true;
	}

	/**
	 * Marks the response finalized without flushing it, e.g. when the async timeout gives up on it.
	 *
	 * @return {@code true} if this call finalized the response
	 */
	@NonNull
	Boolean abandon() {
		return this.completed.compareAndSet(false, true);
	}

	/**
	 * Discards any buffered response so an error response can be written instead.
	 */
	void resetResponse() {
		this.statusCode = DEFAULT_STATUS_CODE;
		this.redirectUrl = null;
		this.responseHeaders.clear();
		this.responseBody.reset();
	}

	void enterPage() {
		this.pageDepth = this.pageDepth + 1;
	}

	void exitPage() {
		this.pageDepth = this.pageDepth - 1;
	}

	@NonNull
	Boolean isRenderingPage() {
		return this.pageDepth > 0;
	}

	@NonNull
	ProtocolMisuseException reportProtocolMisuse(@NonNull String message) {
		requireNonNull(message);

		ProtocolMisuseException protocolMisuseException = new ProtocolMisuseException(message);
		this.logEventHandler.accept(LogEvent.with(LogEventType.PROTOCOL_MISUSE, message)
				.throwable(protocolMisuseException)
				.uri(getUri())
				.build());

		return protocolMisuseException;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{httpMethod=%s, uri=%s, statusCode=%d}", getClass().getSimpleName(),
				getHttpMethod().name(), getUri(), getStatusCode());
	}

	/**
	 * Builder used to construct instances of {@link RequestContext} via {@link RequestContext#withRequest(HttpMethod, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final HttpMethod httpMethod;
		@NonNull
		private final String uri;
		@Nullable
		private List<@NonNull HttpHeader> headers;
		@Nullable
		private byte[] body;
		@Nullable
		private InetSocketAddress remoteAddress;
		@Nullable
		private Instant startedAt;
		@Nullable
		private SessionStore sessionStore;
		@Nullable
		private Consumer<RequestContext> completionHandler;
		@Nullable
		private Consumer<LogEvent> logEventHandler;

		protected Builder(@NonNull HttpMethod httpMethod,
											@NonNull String uri) {
			this.httpMethod = httpMethod;
			this.uri = uri;
		}

		@NonNull
		public Builder headers(@Nullable List<@NonNull HttpHeader> headers) {
			this.headers = headers;
			return this;
		}

		@NonNull
		public Builder body(@Nullable byte[] body) {
			this.body = body;
			return this;
		}

		@NonNull
		public Builder remoteAddress(@Nullable InetSocketAddress remoteAddress) {
			this.remoteAddress = remoteAddress;
			return this;
		}

		@NonNull
		public Builder startedAt(@Nullable Instant startedAt) {
			this.startedAt = startedAt;
			return this;
		}

		@NonNull
		public Builder sessionStore(@Nullable SessionStore sessionStore) {
			this.sessionStore = sessionStore;
			return this;
		}

		/**
		 * Invoked exactly once, on whichever thread finalizes the response.
		 */
		@NonNull
		public Builder completionHandler(@Nullable Consumer<RequestContext> completionHandler) {
			this.completionHandler = completionHandler;
			return this;
		}

		@NonNull
		public Builder logEventHandler(@Nullable Consumer<LogEvent> logEventHandler) {
			this.logEventHandler = logEventHandler;
			return this;
		}

		/**
		 * @throws com.nimblet.exception.BadRequestException if the request-target cannot be decoded
		 */
		@NonNull
		public RequestContext build() {
			return new RequestContext(this);
		}
	}
}
