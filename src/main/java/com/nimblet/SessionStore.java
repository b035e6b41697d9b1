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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;

/**
 * In-memory index of live {@link Session}s.
 * <p>
 * Session ids are 128 random bits from {@link SecureRandom}, hex-encoded. A background sweep evicts sessions
 * idle longer than the configured timeout; expiry is also checked on every lookup, so an expired session is
 * never handed out even if the sweep has not reached it yet.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class SessionStore implements AutoCloseable {
	@NonNull
	public static final String DEFAULT_COOKIE_NAME;
	@NonNull
	private static final Duration DEFAULT_TIMEOUT;
	@NonNull
	private static final Duration DEFAULT_SWEEP_INTERVAL;
	@NonNull
	private static final Logger logger;

	static {
		DEFAULT_COOKIE_NAME = "nimbletsessionid";
		DEFAULT_TIMEOUT = Duration.ofMinutes(30);
		DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(1);
		logger = LoggerFactory.getLogger(SessionStore.class);
	}

	@NonNull
	private final Duration timeout;
	@NonNull
	private final Duration sweepInterval;
	@NonNull
	private final String cookieName;
	@NonNull
	private final Clock clock;
	@NonNull
	private final SecureRandom secureRandom;
	@NonNull
	private final ConcurrentHashMap<String, Session> sessionsById;
	@NonNull
	private final ReentrantLock lock;
	@Nullable
	private volatile ScheduledExecutorService sweepExecutorService;

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	@NonNull
	public static SessionStore withDefaults() {
		return builder().build();
	}

	protected SessionStore(@NonNull Builder builder) {
		requireNonNull(builder);

		this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
		this.sweepInterval = builder.sweepInterval != null ? builder.sweepInterval : DEFAULT_SWEEP_INTERVAL;
		this.cookieName = builder.cookieName != null ? builder.cookieName : DEFAULT_COOKIE_NAME;
		this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
		this.secureRandom = new SecureRandom();
		this.sessionsById = new ConcurrentHashMap<>();
		this.lock = new ReentrantLock();

		if (this.timeout.isNegative() || this.timeout.isZero())
			throw new IllegalArgumentException("Session timeout must be > 0");

		if (this.sweepInterval.isNegative() || this.sweepInterval.isZero())
			throw new IllegalArgumentException("Session sweep interval must be > 0");
	}

	/**
	 * Starts the background sweep. Calling more than once has no effect.
	 */
	public void start() {
		getLock().lock();

		try {
			if (this.sweepExecutorService != null)
				return;

			ScheduledExecutorService sweepExecutorService = Executors.newSingleThreadScheduledExecutor(
					new DefaultServer.NonvirtualThreadFactory("nimblet-session-sweep"));
			long intervalMillis = Math.max(1L, getSweepInterval().toMillis());
			sweepExecutorService.scheduleWithFixedDelay(this::sweepSafely, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
			this.sweepExecutorService = sweepExecutorService;
		} finally {
			getLock().unlock();
		}
	}

	public void stop() {
		getLock().lock();

		try {
			ScheduledExecutorService sweepExecutorService = this.sweepExecutorService;
			this.sweepExecutorService = null;

			if (sweepExecutorService != null)
				sweepExecutorService.shutdownNow();
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public void close() {
		stop();
	}

	/**
	 * Looks up a live session by id, refreshing its last-access time.
	 *
	 * @param sessionId the id from the client's session cookie
	 * @return the session, or {@link Optional#empty()} if unknown, invalidated or expired
	 */
	@NonNull
	public Optional<Session> findSession(@Nullable String sessionId) {
		if (sessionId == null)
			return Optional.empty();

		Session session = getSessionsById().get(sessionId);

		if (session == null)
			return Optional.empty();

		if (session.tryAccess(getTimeout()))
			return Optional.of(session);

		getSessionsById().remove(sessionId, session);
		return Optional.empty();
	}

	/**
	 * Creates and indexes a new session with a fresh random id.
	 *
	 * @return the new session
	 */
	@NonNull
	public Session createSession() {
		while (true) {
			Session session = new Session(generateSessionId(), getClock(),
					(invalidatedSession) -> getSessionsById().remove(invalidatedSession.getId(), invalidatedSession));

			if (getSessionsById().putIfAbsent(session.getId(), session) == null)
				return session;
		}
	}

	/**
	 * Evicts every session idle longer than the timeout.
	 *
	 * @return how many sessions were evicted
	 */
	@NonNull
	public Integer sweep() {
		int evicted = 0;

		for (Session session : getSessionsById().values()) {
			if (session.expireIfIdle(getTimeout())) {
				getSessionsById().remove(session.getId(), session);
				++evicted;
			}
		}

		return evicted;
	}

	@NonNull
	public Integer getSessionCount() {
		return getSessionsById().size();
	}

	private void sweepSafely() {
		try {
			int evicted = sweep();

			if (evicted > 0 && logger.isDebugEnabled())
				logger.debug("Evicted {} idle session[s]", evicted);
		} catch (RuntimeException e) {
			logger.error("Session sweep failed", e);
		}
	}

	@NonNull
	private String generateSessionId() {
		byte[] bytes = new byte[16];
		getSecureRandom().nextBytes(bytes);
		return HexFormat.of().formatHex(bytes);
	}

	@NonNull
	public Duration getTimeout() {
		return this.timeout;
	}

	@NonNull
	public Duration getSweepInterval() {
		return this.sweepInterval;
	}

	@NonNull
	public String getCookieName() {
		return this.cookieName;
	}

	@NonNull
	private Clock getClock() {
		return this.clock;
	}

	@NonNull
	private SecureRandom getSecureRandom() {
		return this.secureRandom;
	}

	@NonNull
	private ConcurrentHashMap<String, Session> getSessionsById() {
		return this.sessionsById;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	/**
	 * Builder used to construct instances of {@link SessionStore} via {@link SessionStore#builder()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private Duration timeout;
		@Nullable
		private Duration sweepInterval;
		@Nullable
		private String cookieName;
		@Nullable
		private Clock clock;

		protected Builder() {
			// Only permit construction through SessionStore
		}

		@NonNull
		public Builder timeout(@Nullable Duration timeout) {
			this.timeout = timeout;
			return this;
		}

		@NonNull
		public Builder sweepInterval(@Nullable Duration sweepInterval) {
			this.sweepInterval = sweepInterval;
			return this;
		}

		@NonNull
		public Builder cookieName(@Nullable String cookieName) {
			this.cookieName = cookieName;
			return this;
		}

		@NonNull
		public Builder clock(@Nullable Clock clock) {
			this.clock = clock;
			return this;
		}

		@NonNull
		public SessionStore build() {
			return new SessionStore(this);
		}
	}
}
