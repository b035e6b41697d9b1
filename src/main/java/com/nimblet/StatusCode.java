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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * HTTP status codes Nimblet writes itself, plus the common ones handlers are likely to set.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum StatusCode {
	HTTP_200(200, "OK"),
	HTTP_201(201, "Created"),
	HTTP_202(202, "Accepted"),
	HTTP_204(204, "No Content"),
	HTTP_301(301, "Moved Permanently"),
	HTTP_302(302, "Found"),
	HTTP_303(303, "See Other"),
	HTTP_304(304, "Not Modified"),
	HTTP_307(307, "Temporary Redirect"),
	HTTP_308(308, "Permanent Redirect"),
	HTTP_400(400, "Bad Request"),
	HTTP_401(401, "Unauthorized"),
	HTTP_403(403, "Forbidden"),
	HTTP_404(404, "Not Found"),
	HTTP_405(405, "Method Not Allowed"),
	HTTP_408(408, "Request Timeout"),
	HTTP_409(409, "Conflict"),
	HTTP_413(413, "Content Too Large"),
	HTTP_415(415, "Unsupported Media Type"),
	HTTP_429(429, "Too Many Requests"),
	/**
	 * Written for handler faults and failures in Nimblet's own request processing.
	 */
	HTTP_500(500, "Internal Server Error"),
	HTTP_501(501, "Not Implemented"),
	HTTP_502(502, "Bad Gateway"),
	/**
	 * Written when the worker pool rejects a request, e.g. during shutdown.
	 */
	HTTP_503(503, "Service Unavailable"),
	HTTP_504(504, "Gateway Timeout");

	@NonNull
	private static final Map<Integer, StatusCode> STATUS_CODES_BY_NUMBER;

	static {
		Map<Integer, StatusCode> statusCodesByNumber = new HashMap<>();

		for (StatusCode statusCode : StatusCode.values())
			statusCodesByNumber.put(statusCode.getStatusCode(), statusCode);

		STATUS_CODES_BY_NUMBER = Collections.unmodifiableMap(statusCodesByNumber);
	}

	@NonNull
	private final Integer statusCode;
	@NonNull
	private final String reasonPhrase;

	StatusCode(@NonNull Integer statusCode,
						 @NonNull String reasonPhrase) {
		requireNonNull(statusCode);
		requireNonNull(reasonPhrase);

		this.statusCode = statusCode;
		this.reasonPhrase = reasonPhrase;
	}

	@NonNull
	public static Optional<StatusCode> fromStatusCode(@NonNull Integer statusCode) {
		return Optional.ofNullable(STATUS_CODES_BY_NUMBER.get(statusCode));
	}

	/**
	 * Reason phrase for any numeric status, falling back to {@code Unknown}.
	 *
	 * @param statusCode the numeric status
	 * @return a reason phrase suitable for a status line
	 */
	@NonNull
	public static String reasonPhraseFor(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return fromStatusCode(statusCode).map(StatusCode::getReasonPhrase).orElse("Unknown");
	}

	@Override
	public String toString() {
		return format("%s.%s{statusCode=%s, reasonPhrase=%s}", getClass().getSimpleName(), name(), getStatusCode(), getReasonPhrase());
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@NonNull
	public String getReasonPhrase() {
		return this.reasonPhrase;
	}
}
