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

import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * A non-instantiable collection of utility methods for URI, query-string and cookie handling.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Utilities {
	@NonNull
	private static final byte[] EMPTY_BYTE_ARRAY;
	@NonNull
	private static final Pattern HEAD_WHITESPACE_PATTERN;
	@NonNull
	private static final Pattern TAIL_WHITESPACE_PATTERN;

	static {
		EMPTY_BYTE_ARRAY = new byte[0];
		// Unicode whitespace plus the format characters that commonly sneak in via copy-paste
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^[\\p{Z}\\s\\u200B\\u200C\\u200D\\u2060\\uFEFF]+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("[\\p{Z}\\s\\u200B\\u200C\\u200D\\u2060\\uFEFF]+$");
	}

	private Utilities() {
		// Non-instantiable
	}

	@NonNull
	static byte[] emptyByteArray() {
		return EMPTY_BYTE_ARRAY;
	}

	/**
	 * Splits a request-target such as {@code /echo?a=1} into its raw path and raw query parts.
	 *
	 * @param requestTarget the request-target from the request line
	 * @return a two-element array: raw path (never {@code null}) and raw query ({@code null} if absent or empty)
	 */
	@NonNull
	static String[] splitRequestTarget(@NonNull String requestTarget) {
		requireNonNull(requestTarget);

		String target = requestTarget;
		int fragment = target.indexOf('#');

		if (fragment >= 0)
			target = target.substring(0, fragment);

		// Absolute-form targets, e.g. "http://host/path?x"
		int scheme = target.indexOf("://");

		if (scheme > 0 && !target.startsWith("/")) {
			int pathStart = target.indexOf('/', scheme + 3);
			int queryStart = target.indexOf('?', scheme + 3);

			if (pathStart < 0 || (queryStart >= 0 && queryStart < pathStart))
				target = "/" + (queryStart >= 0 ? target.substring(queryStart) : "");
			else
				target = target.substring(pathStart);
		}

		int q = target.indexOf('?');

		if (q < 0)
			return new String[]{target, null};

		String query = target.substring(q + 1);
		return new String[]{target.substring(0, q), query.isEmpty() ? null : query};
	}

	/**
	 * Percent-decodes a raw request path and normalizes it: dot segments are resolved, duplicate slashes collapse,
	 * a leading slash is ensured and trailing slashes are removed (except for the root path).
	 *
	 * @param rawPath the undecoded path
	 * @return the normalized path, {@code "/"} for empty input
	 * @throws BadRequestException if the path contains malformed percent-encoding
	 */
	@NonNull
	public static String normalizePath(@NonNull String rawPath) {
		requireNonNull(rawPath);

		String path = trimAggressivelyToEmpty(rawPath);

		if (path.isEmpty())
			return "/";

		return removeDotSegments(percentDecode(path));
	}

	/**
	 * Parses a raw query string such as {@code a=1&b=2&a=3} into an ordered multimap.
	 * <p>
	 * {@code +} decodes to a space. Pairs without a name are ignored; a name without {@code =} has an empty value.
	 * Repeated names keep every value in order of appearance.
	 *
	 * @param rawQuery the raw query string, without leading {@code ?}
	 * @return an unmodifiable map of parameter names to values; empty if none
	 * @throws BadRequestException if the query contains malformed percent-encoding
	 */
	@NonNull
	public static Map<@NonNull String, @NonNull List<@NonNull String>> extractQueryParameters(@Nullable String rawQuery) {
		String query = trimAggressivelyToNull(rawQuery);

		if (query == null)
			return Map.of();

		Map<String, List<String>> queryParameters = new LinkedHashMap<>();

		for (String pair : query.split("&")) {
			if (pair.isEmpty())
				continue;

			int equals = pair.indexOf('=');
			String rawName = equals < 0 ? pair : pair.substring(0, equals);
			String rawValue = equals < 0 ? "" : pair.substring(equals + 1);

			String name = percentDecode(rawName.replace('+', ' '));

			if (name.isEmpty())
				continue;

			String value = percentDecode(rawValue.replace('+', ' '));
			queryParameters.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
		}

		Map<String, List<String>> unmodifiable = new LinkedHashMap<>(queryParameters.size());
		queryParameters.forEach((name, values) -> unmodifiable.put(name, List.copyOf(values)));
		return Collections.unmodifiableMap(unmodifiable);
	}

	/**
	 * Parses every {@code Cookie} header into a map of cookie name to value.
	 * <p>
	 * Cookie names are case-sensitive. Surrounding double quotes on a value are removed.
	 * If a name appears more than once, the first occurrence wins, matching browser precedence for more specific paths.
	 *
	 * @param headers the request headers
	 * @return an unmodifiable map of cookie names to values; empty if none
	 */
	@NonNull
	public static Map<@NonNull String, @NonNull String> extractCookies(@NonNull List<@NonNull HttpHeader> headers) {
		requireNonNull(headers);

		Map<String, String> cookies = new LinkedHashMap<>();

		for (HttpHeader header : headers) {
			if (!header.hasName("Cookie"))
				continue;

			for (String component : header.value().split(";")) {
				int equals = component.indexOf('=');

				if (equals <= 0)
					continue;

				String name = trimAggressivelyToNull(component.substring(0, equals));

				if (name == null)
					continue;

				String value = trimAggressivelyToEmpty(component.substring(equals + 1));

				if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\""))
					value = value.substring(1, value.length() - 1);

				cookies.putIfAbsent(name, value);
			}
		}

		return Collections.unmodifiableMap(cookies);
	}

	/**
	 * Percent-decodes a string as UTF-8. Runs of consecutive escapes are decoded together so multi-byte sequences survive.
	 *
	 * @param string the string to decode
	 * @return the decoded string
	 * @throws BadRequestException on a truncated or non-hex escape
	 */
	@NonNull
	static String percentDecode(@NonNull String string) {
		requireNonNull(string);

		if (string.indexOf('%') < 0)
			return string;

		StringBuilder sb = new StringBuilder(string.length());
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();

		for (int i = 0; i < string.length(); ) {
			char c = string.charAt(i);

			if (c != '%') {
				sb.append(c);
				i++;
				continue;
			}

			bytes.reset();

			while (i < string.length() && string.charAt(i) == '%') {
				if (i + 2 >= string.length())
					throw new BadRequestException("Invalid percent-encoding in URI component");

				int hi = hex(string.charAt(i + 1));
				int lo = hex(string.charAt(i + 2));

				if (hi < 0 || lo < 0)
					throw new BadRequestException("Invalid percent-encoding in URI component");

				bytes.write((hi << 4) | lo);
				i += 3;
			}

			sb.append(bytes.toString(StandardCharsets.UTF_8));
		}

		return sb.toString();
	}

	private static int hex(char c) {
		if (c >= '0' && c <= '9') return c - '0';
		if (c >= 'A' && c <= 'F') return c - 'A' + 10;
		if (c >= 'a' && c <= 'f') return c - 'a' + 10;
		return -1;
	}

	@NonNull
	private static String removeDotSegments(@NonNull String path) {
		requireNonNull(path);

		Deque<String> stack = new ArrayDeque<>();

		for (String segment : path.split("/")) {
			if (segment.isEmpty() || ".".equals(segment))
				continue;

			if ("..".equals(segment)) {
				if (!stack.isEmpty())
					stack.removeLast();
			} else {
				stack.addLast(segment);
			}
		}

		return "/" + String.join("/", stack);
	}

	@Nullable
	public static String trimAggressively(@Nullable String string) {
		if (string == null)
			return null;

		string = HEAD_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		if (string.isEmpty())
			return string;

		return TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("");
	}

	@Nullable
	public static String trimAggressivelyToNull(@Nullable String string) {
		if (string == null)
			return null;

		string = trimAggressively(string);
		return string.isEmpty() ? null : string;
	}

	@NonNull
	public static String trimAggressivelyToEmpty(@Nullable String string) {
		if (string == null)
			return "";

		return trimAggressively(string);
	}
}
