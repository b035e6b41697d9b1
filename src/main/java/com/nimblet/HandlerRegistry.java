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

import com.nimblet.exception.DuplicateMappingException;
import com.nimblet.exception.UnknownHandlerException;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Named handlers and the URI patterns bound to them.
 * <p>
 * Built once via {@link #builder()} and immutable afterwards, so lookups need no locking.
 * Resolution prefers an exact pattern; otherwise the prefix pattern with the longest literal wins.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class HandlerRegistry {
	@NonNull
	private final Map<String, Handler> handlersByName;
	@NonNull
	private final Map<String, Mapping> exactMappingsByPath;
	@NonNull
	private final List<Mapping> prefixMappings;

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	protected HandlerRegistry(@NonNull Builder builder) {
		requireNonNull(builder);

		Map<String, Mapping> exactMappingsByPath = new LinkedHashMap<>();
		List<Mapping> prefixMappings = new ArrayList<>();

		for (Map.Entry<UriPattern, String> entry : builder.handlerNamesByPattern.entrySet()) {
			UriPattern uriPattern = entry.getKey();
			String handlerName = entry.getValue();
			Handler handler = builder.handlersByName.get(handlerName);

			if (handler == null)
				throw new UnknownHandlerException(handlerName);

			Mapping mapping = new Mapping(uriPattern, new ResolvedHandler(handlerName, handler, uriPattern));

			if (uriPattern.isPrefix())
				prefixMappings.add(mapping);
			else
				exactMappingsByPath.put(uriPattern.getLiteral(), mapping);
		}

		prefixMappings.sort(Comparator.comparingInt((Mapping mapping) -> mapping.uriPattern().getLiteral().length()).reversed());

		this.handlersByName = Collections.unmodifiableMap(new LinkedHashMap<>(builder.handlersByName));
		this.exactMappingsByPath = Collections.unmodifiableMap(exactMappingsByPath);
		this.prefixMappings = List.copyOf(prefixMappings);
	}

	/**
	 * Finds the handler mapped to a normalized request path.
	 *
	 * @param path the normalized request path
	 * @return the resolved handler, or {@link Optional#empty()} if no pattern matches
	 */
	@NonNull
	public Optional<ResolvedHandler> resolve(@NonNull String path) {
		requireNonNull(path);

		Mapping exactMapping = getExactMappingsByPath().get(path);

		if (exactMapping != null)
			return Optional.of(exactMapping.resolvedHandler());

		for (Mapping prefixMapping : getPrefixMappings())
			if (prefixMapping.uriPattern().matches(path))
				return Optional.of(prefixMapping.resolvedHandler());

		return Optional.empty();
	}

	@NonNull
	public Optional<Handler> getHandler(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(getHandlersByName().get(name));
	}

	@NonNull
	public Set<String> getHandlerNames() {
		return getHandlersByName().keySet();
	}

	@NonNull
	private Map<String, Handler> getHandlersByName() {
		return this.handlersByName;
	}

	@NonNull
	private Map<String, Mapping> getExactMappingsByPath() {
		return this.exactMappingsByPath;
	}

	@NonNull
	private List<Mapping> getPrefixMappings() {
		return this.prefixMappings;
	}

	private record Mapping(@NonNull UriPattern uriPattern,
												 @NonNull ResolvedHandler resolvedHandler) {}

	/**
	 * Builder used to construct instances of {@link HandlerRegistry} via {@link HandlerRegistry#builder()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Map<String, Handler> handlersByName;
		@NonNull
		private final Map<UriPattern, String> handlerNamesByPattern;

		protected Builder() {
			this.handlersByName = new LinkedHashMap<>();
			this.handlerNamesByPattern = new LinkedHashMap<>();
		}

		/**
		 * Registers a handler under a name. Names are referenced by mappings and by RSP {@code <@=name>} tags.
		 *
		 * @throws DuplicateMappingException if the name is already registered
		 */
		@NonNull
		public Builder handler(@NonNull String name,
													 @NonNull Handler handler) {
			requireNonNull(name);
			requireNonNull(handler);

			String normalizedName = Utilities.trimAggressivelyToNull(name);

			if (normalizedName == null)
				throw new IllegalArgumentException("Handler name must not be blank");

			if (this.handlersByName.containsKey(normalizedName))
				throw new DuplicateMappingException(format("A handler named '%s' is already registered", normalizedName));

			this.handlersByName.put(normalizedName, handler);
			return this;
		}

		/**
		 * Binds a URI pattern to a previously or subsequently registered handler name.
		 *
		 * @throws DuplicateMappingException if an equivalent pattern is already mapped
		 */
		@NonNull
		public Builder mapping(@NonNull String uriPattern,
													 @NonNull String name) {
			requireNonNull(uriPattern);
			requireNonNull(name);

			UriPattern parsedUriPattern = UriPattern.of(uriPattern);
			String existingName = this.handlerNamesByPattern.get(parsedUriPattern);

			if (existingName != null)
				throw new DuplicateMappingException(format("URI pattern '%s' is already mapped to handler '%s'", uriPattern, existingName));

			this.handlerNamesByPattern.put(parsedUriPattern, Utilities.trimAggressivelyToEmpty(name));
			return this;
		}

		/**
		 * Registers a handler named after its pattern and maps the pattern to it.
		 */
		@NonNull
		public Builder route(@NonNull String uriPattern,
												 @NonNull Handler handler) {
			requireNonNull(uriPattern);
			requireNonNull(handler);

			return handler(uriPattern, handler).mapping(uriPattern, uriPattern);
		}

		/**
		 * @throws UnknownHandlerException if any mapping refers to a name with no registered handler
		 */
		@NonNull
		public HandlerRegistry build() {
			return new HandlerRegistry(this);
		}
	}
}
