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
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.Locale;

import static java.lang.String.format;

/**
 * HTTP request methods Nimblet will dispatch.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum HttpMethod {
	GET,
	POST,
	PUT,
	PATCH,
	OPTIONS,
	HEAD,
	DELETE;

	/**
	 * Parses a request-line method token.
	 *
	 * @param method the raw method token
	 * @return the corresponding enum value
	 * @throws BadRequestException if the token is not a supported method
	 */
	@NonNull
	public static HttpMethod fromRequestLine(@Nullable String method) {
		String normalized = Utilities.trimAggressivelyToEmpty(method).toUpperCase(Locale.ENGLISH);

		if (normalized.equals("PRI"))
			throw new BadRequestException("HTTP/2.0 connection preface received, but only HTTP/1.x is supported");

		try {
			return HttpMethod.valueOf(normalized);
		} catch (IllegalArgumentException e) {
			throw new BadRequestException(format("Unsupported HTTP method specified: '%s'", method), e);
		}
	}
}
