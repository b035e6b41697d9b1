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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class SessionStoreTests {
	@Test
	public void createdSessionsAreFoundById() {
		SessionStore sessionStore = SessionStore.withDefaults();
		Session session = sessionStore.createSession();

		Assertions.assertSame(session, sessionStore.findSession(session.getId()).orElse(null));
		Assertions.assertTrue(sessionStore.findSession("unknown").isEmpty());
		Assertions.assertTrue(sessionStore.findSession(null).isEmpty());
		Assertions.assertEquals(1, sessionStore.getSessionCount());
	}

	@Test
	public void sessionIdsAreUnique() {
		SessionStore sessionStore = SessionStore.withDefaults();
		Set<String> ids = new HashSet<>();

		for (int i = 0; i < 1_000; ++i)
			ids.add(sessionStore.createSession().getId());

		Assertions.assertEquals(1_000, ids.size());
	}

	@Test
	public void accessWithinTimeoutKeepsSessionAlive() {
		TestSupport.MutableClock clock = new TestSupport.MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
		SessionStore sessionStore = SessionStore.builder()
				.timeout(Duration.ofMinutes(5))
				.clock(clock)
				.build();

		Session session = sessionStore.createSession();

		for (int i = 0; i < 4; ++i) {
			clock.advance(Duration.ofMinutes(4));
			Assertions.assertTrue(sessionStore.findSession(session.getId()).isPresent());
		}

		Assertions.assertEquals(0, sessionStore.sweep());
	}

	@Test
	public void idleAtExactlyTimeoutIsStillLive() {
		TestSupport.MutableClock clock = new TestSupport.MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
		SessionStore sessionStore = SessionStore.builder()
				.timeout(Duration.ofMinutes(5))
				.clock(clock)
				.build();

		Session session = sessionStore.createSession();
		clock.advance(Duration.ofMinutes(5));

		Assertions.assertEquals(0, sessionStore.sweep());
		Assertions.assertFalse(session.isInvalidated());
	}

	@Test
	public void sweepEvictsIdleSessions() {
		TestSupport.MutableClock clock = new TestSupport.MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
		SessionStore sessionStore = SessionStore.builder()
				.timeout(Duration.ofMinutes(5))
				.clock(clock)
				.build();

		Session stale = sessionStore.createSession();
		stale.setAttribute("user", "alice");
		clock.advance(Duration.ofMinutes(3));
		Session fresh = sessionStore.createSession();
		clock.advance(Duration.ofMinutes(3));

		Assertions.assertEquals(1, sessionStore.sweep());
		Assertions.assertTrue(stale.isInvalidated());
		Assertions.assertFalse(fresh.isInvalidated());
		Assertions.assertEquals(1, sessionStore.getSessionCount());
		Assertions.assertThrows(IllegalStateException.class, () -> stale.getAttribute("user"));
	}

	@Test
	public void expiredSessionIsNotFoundEvenBeforeSweep() {
		TestSupport.MutableClock clock = new TestSupport.MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
		SessionStore sessionStore = SessionStore.builder()
				.timeout(Duration.ofSeconds(10))
				.clock(clock)
				.build();

		Session session = sessionStore.createSession();
		clock.advance(Duration.ofSeconds(11));

		Assertions.assertTrue(sessionStore.findSession(session.getId()).isEmpty());
		Assertions.assertTrue(session.isInvalidated());
		Assertions.assertEquals(0, sessionStore.getSessionCount());
	}

	@Test
	public void invalidateRemovesFromStore() {
		SessionStore sessionStore = SessionStore.withDefaults();
		Session session = sessionStore.createSession();

		session.invalidate();
		session.invalidate();

		Assertions.assertEquals(0, sessionStore.getSessionCount());
		Assertions.assertTrue(sessionStore.findSession(session.getId()).isEmpty());
		Assertions.assertThrows(IllegalStateException.class, () -> session.setAttribute("a", 1));
	}

	@Test
	public void typedAttributes() {
		Session session = SessionStore.withDefaults().createSession();
		session.setAttribute("count", 3);

		Assertions.assertEquals(3, session.getAttribute("count", Integer.class).orElseThrow());
		Assertions.assertThrows(ClassCastException.class, () -> session.getAttribute("count", String.class));
		Assertions.assertTrue(session.getAttribute("missing", String.class).isEmpty());

		session.setAttribute("count", null);
		Assertions.assertTrue(session.getAttributeNames().isEmpty());
	}

	@Test
	public void backgroundSweepEvictsOnSchedule() throws InterruptedException {
		SessionStore sessionStore = SessionStore.builder()
				.timeout(Duration.ofMillis(50))
				.sweepInterval(Duration.ofMillis(20))
				.build();

		try {
			sessionStore.start();
			sessionStore.start();
			sessionStore.createSession();

			TestSupport.waitFor(() -> sessionStore.getSessionCount() == 0, Duration.ofSeconds(5));
		} finally {
			sessionStore.stop();
		}
	}

	@Test
	public void illegalTimeoutsAreRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> SessionStore.builder().timeout(Duration.ZERO).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> SessionStore.builder().sweepInterval(Duration.ofSeconds(-1)).build());
	}
}
