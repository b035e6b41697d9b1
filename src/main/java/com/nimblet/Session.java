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
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Per-client key/value storage that survives across requests, identified by an opaque id carried in a cookie.
 * <p>
 * All reads and writes go through this session's own lock and refresh its last-access time.
 * Once invalidated (explicitly or by the idle sweep) every accessor throws {@link IllegalStateException}.
 * <p>
 * Acquire instances via {@link RequestContext#getSession()}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Session {
	@NonNull
	private final String id;
	@NonNull
	private final Instant createdAt;
	@NonNull
	private final Clock clock;
	@NonNull
	private final Consumer<Session> invalidationListener;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final Map<String, Object> attributes;
	@NonNull
	private Instant lastAccessedAt;
	private boolean invalidated;

	Session(@NonNull String id,
					@NonNull Clock clock,
					@NonNull Consumer<Session> invalidationListener) {
		requireNonNull(id);
		requireNonNull(clock);
		requireNonNull(invalidationListener);

		this.id = id;
		this.clock = clock;
		this.invalidationListener = invalidationListener;
		this.lock = new ReentrantLock();
		this.attributes = new HashMap<>();
		this.createdAt = clock.instant();
		this.lastAccessedAt = this.createdAt;
	}

	@NonNull
	public String getId() {
		return this.id;
	}

	@NonNull
	public Instant getCreatedAt() {
		return this.createdAt;
	}

	@NonNull
	public Instant getLastAccessedAt() {
		getLock().lock();

		try {
			return this.lastAccessedAt;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Optional<Object> getAttribute(@NonNull String name) {
		requireNonNull(name);

		getLock().lock();

		try {
			touch();
			return Optional.ofNullable(getAttributes().get(name));
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Typed variant of {@link #getAttribute(String)}.
	 *
	 * @param name the attribute name
	 * @param type the expected value type
	 * @param <T>  the expected value type
	 * @return the value, or {@link Optional#empty()} if absent
	 * @throws ClassCastException if a value is present but is not of the expected type
	 */
	@NonNull
	public <T> Optional<T> getAttribute(@NonNull String name,
																			@NonNull Class<T> type) {
		requireNonNull(type);

		Object value = getAttribute(name).orElse(null);

		if (value == null)
			return Optional.empty();

		if (!type.isInstance(value))
			throw new ClassCastException(format("Session attribute '%s' is a %s, not a %s", name, value.getClass().getName(), type.getName()));

		return Optional.of(type.cast(value));
	}

	/**
	 * Stores a value. A {@code null} value removes the attribute.
	 */
	public void setAttribute(@NonNull String name,
													 @Nullable Object value) {
		requireNonNull(name);

		getLock().lock();

		try {
			touch();

			if (value == null)
				getAttributes().remove(name);
			else
				getAttributes().put(name, value);
		} finally {
			getLock().unlock();
		}
	}

	public void removeAttribute(@NonNull String name) {
		setAttribute(name, null);
	}

	@NonNull
	public Set<String> getAttributeNames() {
		getLock().lock();

		try {
			touch();
			return Set.copyOf(getAttributes().keySet());
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Discards this session and all of its attributes. Safe to call more than once.
	 */
	public void invalidate() {
		boolean wasValid;

		getLock().lock();

		try {
			wasValid = !this.invalidated;
			this.invalidated = true;
			getAttributes().clear();
		} finally {
			getLock().unlock();
		}

		if (wasValid)
			getInvalidationListener().accept(this);
	}

	@NonNull
	public Boolean isInvalidated() {
		getLock().lock();

		try {
			return this.invalidated;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Refreshes last access if still live and not idle past the timeout.
	 *
	 * @return {@code true} if the session is usable
	 */
	boolean tryAccess(@NonNull Duration timeout) {
		getLock().lock();

		try {
			if (this.invalidated)
				return false;

			if (isIdle(timeout)) {
				expire();
				return false;
			}

			this.lastAccessedAt = getClock().instant();
			return true;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Invalidates this session if it has been idle longer than the timeout.
	 *
	 * @return {@code true} if this call expired the session
	 */
	boolean expireIfIdle(@NonNull Duration timeout) {
		getLock().lock();

		try {
			if (this.invalidated || !isIdle(timeout))
				return false;

			expire();
			return true;
		} finally {
			getLock().unlock();
		}
	}

	private boolean isIdle(@NonNull Duration timeout) {
		return Duration.between(this.lastAccessedAt, getClock().instant()).compareTo(timeout) > 0;
	}

	private void expire() {
		this.invalidated = true;
		getAttributes().clear();
	}

	private void touch() {
		if (this.invalidated)
			throw new IllegalStateException(format("Session %s has been invalidated", getId()));

		this.lastAccessedAt = getClock().instant();
	}

	@NonNull
	private Clock getClock() {
		return this.clock;
	}

	@NonNull
	private Consumer<Session> getInvalidationListener() {
		return this.invalidationListener;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	private Map<String, Object> getAttributes() {
		return this.attributes;
	}
}
