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
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A URI mapping: either an exact path ({@code /echo}) or a prefix ending in {@code *} ({@code /static/*}).
 * <p>
 * Exact patterns are normalized the same way request paths are. A prefix pattern's literal is everything before
 * the {@code *}; a request path matches if it starts with the literal. For a literal ending in {@code /},
 * the bare directory path (e.g. {@code /static}) matches too.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class UriPattern {
	@NonNull
	private final String pattern;
	@NonNull
	private final String literal;
	@NonNull
	private final Boolean prefix;

	/**
	 * Parses a pattern string.
	 *
	 * @param pattern e.g. {@code /echo} or {@code /static/*}
	 * @return the parsed pattern
	 * @throws IllegalArgumentException if the pattern does not start with {@code /} or has a {@code *} anywhere but the end
	 */
	@NonNull
	public static UriPattern of(@NonNull String pattern) {
		requireNonNull(pattern);
		return new UriPattern(pattern);
	}

	private UriPattern(@NonNull String pattern) {
		String trimmed = Utilities.trimAggressivelyToEmpty(pattern);

		if (!trimmed.startsWith("/"))
			throw new IllegalArgumentException(format("URI pattern '%s' must start with '/'", pattern));

		int star = trimmed.indexOf('*');

		if (star >= 0 && star != trimmed.length() - 1)
			throw new IllegalArgumentException(format("URI pattern '%s' may only contain '*' as its final character", pattern));

		this.pattern = trimmed;
		this.prefix = star >= 0;
		this.literal = this.prefix ? trimmed.substring(0, star) : Utilities.normalizePath(trimmed);
	}

	/**
	 * Does the given normalized request path match this pattern?
	 *
	 * @param path a normalized request path
	 * @return {@code true} on match
	 */
	@NonNull
	public Boolean matches(@NonNull String path) {
		requireNonNull(path);

		if (!isPrefix())
			return getLiteral().equals(path);

		if (path.startsWith(getLiteral()))
			return true;

		return getLiteral().length() > 1
				&& getLiteral().endsWith("/")
				&& path.equals(getLiteral().substring(0, getLiteral().length() - 1));
	}

	@Override
	@NonNull
	public String toString() {
		return getPattern();
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof UriPattern uriPattern))
			return false;

		return Objects.equals(getLiteral(), uriPattern.getLiteral())
				&& Objects.equals(isPrefix(), uriPattern.isPrefix());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getLiteral(), isPrefix());
	}

	@NonNull
	public String getPattern() {
		return this.pattern;
	}

	/**
	 * The literal portion: the full normalized path for exact patterns, the text before {@code *} for prefixes.
	 *
	 * @return the literal
	 */
	@NonNull
	public String getLiteral() {
		return this.literal;
	}

	@NonNull
	public Boolean isPrefix() {
		return this.prefix;
	}
}
