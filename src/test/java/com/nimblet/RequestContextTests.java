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
import com.nimblet.exception.ProtocolMisuseException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static java.lang.String.format;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RequestContextTests {
	@Test
	public void requestSideAccessors() {
		RequestContext requestContext = RequestContext.withRequest(HttpMethod.POST, "/a/./b/../echo/?x=1&y=two&x=3")
				.headers(List.of(
						new HttpHeader("User-Agent", "test"),
						new HttpHeader("Accept", "text/plain"),
						new HttpHeader("accept", "text/html"),
						new HttpHeader("Cookie", "flavor=oatmeal")))
				.body("payload".getBytes(StandardCharsets.UTF_8))
				.build();

		Assertions.assertEquals(HttpMethod.POST, requestContext.getHttpMethod());
		Assertions.assertEquals("/a/./b/../echo/?x=1&y=two&x=3", requestContext.getUri());
		Assertions.assertEquals("/a/echo", requestContext.getPath());
		Assertions.assertEquals("x=1&y=two&x=3", requestContext.getQuery().orElse(null));
		Assertions.assertEquals("1", requestContext.getQueryParameter("x").orElse(null));
		Assertions.assertEquals(List.of("1", "3"), requestContext.getQueryParameterValues("x"));
		Assertions.assertTrue(requestContext.getQueryParameterValues("z").isEmpty());
		Assertions.assertEquals("text/plain", requestContext.getHeader("ACCEPT").orElse(null));
		Assertions.assertEquals(List.of("text/plain", "text/html"), requestContext.getHeaderValues("Accept"));
		Assertions.assertEquals("payload", requestContext.getBodyAsString());
		Assertions.assertEquals("oatmeal", requestContext.getCookie("flavor").orElse(null));
		Assertions.assertTrue(requestContext.getRemoteAddress().isEmpty());
	}

	@Test
	public void undecodableUriIsBadRequest() {
		Assertions.assertThrows(BadRequestException.class,
				() -> RequestContext.withRequest(HttpMethod.GET, "/bad%zzpath").build());
	}

	@Test
	public void responseHeadersAndStatus() {
		RequestContext requestContext = RequestContext.withRequest(HttpMethod.GET, "/").build();

		Assertions.assertEquals(200, requestContext.getStatusCode());

		requestContext.addHeader("X-Trace", "1");
		requestContext.addHeader("X-Trace", "2");
		requestContext.setHeader("X-Trace", "3");
		requestContext.setContentType("text/plain");
		requestContext.addCookie("a", "b", "Path=/");
		requestContext.addCookie("c", "d", null);

		Assertions.assertEquals(List.of("3"), requestContext.getResponseHeaders().stream()
				.filter((header) -> header.hasName("x-trace"))
				.map(HttpHeader::value)
				.toList());
		Assertions.assertEquals("text/plain", requestContext.getContentType().orElse(null));
		Assertions.assertEquals(List.of("a=b; Path=/", "c=d"), requestContext.getResponseHeaders().stream()
				.filter((header) -> header.hasName("Set-Cookie"))
				.map(HttpHeader::value)
				.toList());

		requestContext.setRedirect("/elsewhere");
		Assertions.assertEquals(302, requestContext.getStatusCode());
		Assertions.assertEquals("/elsewhere", requestContext.getResponseHeader("Location").orElse(null));
		Assertions.assertEquals("/elsewhere", requestContext.getRedirectUrl().orElse(null));

		Assertions.assertThrows(IllegalArgumentException.class, () -> requestContext.setStatusCode(42));
	}

	@Test
	public void resetResponseDiscardsEverything() {
		RequestContext requestContext = RequestContext.withRequest(HttpMethod.GET, "/").build();
		requestContext.setStatusCode(201);
		requestContext.addHeader("X-A", "b");
		requestContext.write("partial");

		requestContext.resetResponse();

		Assertions.assertEquals(200, requestContext.getStatusCode());
		Assertions.assertTrue(requestContext.getResponseHeaders().isEmpty());
		Assertions.assertEquals(0, requestContext.getResponseBody().length);
	}

	@Test
	public void completionHandlerRunsOnce() {
		AtomicInteger completions = new AtomicInteger();
		RequestContext requestContext = RequestContext.withRequest(HttpMethod.GET, "/")
				.completionHandler((ignored) -> completions.incrementAndGet())
				.build();

		Assertions.assertTrue(requestContext.complete());
		Assertions.assertFalse(requestContext.complete());
		Assertions.assertFalse(requestContext.abandon());
		Assertions.assertTrue(requestContext.isCompleted());
		Assertions.assertEquals(1, completions.get());
	}

	@Test
	public void sessionRequiresStore() {
		RequestContext requestContext = RequestContext.withRequest(HttpMethod.GET, "/").build();

		Assertions.assertThrows(IllegalStateException.class, requestContext::getSession);
		Assertions.assertTrue(requestContext.getExistingSession().isEmpty());
	}

	@Test
	public void newSessionSetsCookie() {
		SessionStore sessionStore = SessionStore.withDefaults();
		RequestContext requestContext = RequestContext.withRequest(HttpMethod.GET, "/")
				.sessionStore(sessionStore)
				.build();

		Assertions.assertTrue(requestContext.getExistingSession().isEmpty());

		Session session = requestContext.getSession();

		Assertions.assertSame(session, requestContext.getSession());
		Assertions.assertEquals(format("nimbletsessionid=%s; Path=/; HttpOnly", session.getId()),
				requestContext.getResponseHeader("Set-Cookie").orElse(null));
	}

	@Test
	public void existingSessionIsFoundFromCookie() {
		SessionStore sessionStore = SessionStore.withDefaults();
		Session session = sessionStore.createSession();

		RequestContext requestContext = RequestContext.withRequest(HttpMethod.GET, "/")
				.headers(List.of(new HttpHeader("Cookie", "nimbletsessionid=" + session.getId())))
				.sessionStore(sessionStore)
				.build();

		Assertions.assertSame(session, requestContext.getSession());
		Assertions.assertTrue(requestContext.getResponseHeader("Set-Cookie").isEmpty());
	}

	@Test
	public void invalidatedSessionIsReplaced() {
		SessionStore sessionStore = SessionStore.withDefaults();
		RequestContext requestContext = RequestContext.withRequest(HttpMethod.GET, "/")
				.sessionStore(sessionStore)
				.build();

		Session first = requestContext.getSession();
		first.invalidate();
		Session second = requestContext.getSession();

		Assertions.assertNotSame(first, second);
		Assertions.assertEquals(1, sessionStore.getSessionCount());
	}

	@Test
	public void asyncCompleteFlushesExactlyOnce() {
		AtomicInteger completions = new AtomicInteger();
		List<LogEvent> logEvents = new ArrayList<>();
		RequestContext requestContext = RequestContext.withRequest(HttpMethod.GET, "/")
				.completionHandler((ignored) -> completions.incrementAndGet())
				.logEventHandler(logEvents::add)
				.build();

		AsyncContext asyncContext = requestContext.startAsync();

		Assertions.assertTrue(requestContext.isAsyncStarted());
		Assertions.assertSame(asyncContext, requestContext.getAsyncContext().orElse(null));
		Assertions.assertSame(requestContext, asyncContext.getRequestContext());

		asyncContext.complete();

		Assertions.assertTrue(asyncContext.isCompleted());
		Assertions.assertEquals(1, completions.get());

		Assertions.assertThrows(ProtocolMisuseException.class, asyncContext::complete);
		Assertions.assertEquals(1, completions.get());
		Assertions.assertEquals(1, logEvents.size());
		Assertions.assertEquals(LogEventType.PROTOCOL_MISUSE, logEvents.get(0).getLogEventType());
		Assertions.assertEquals("/", logEvents.get(0).getUri().orElse(null));
	}

	@Test
	public void lateAsyncCompleteAfterAbandonIsMisuse() {
		AtomicInteger completions = new AtomicInteger();
		List<LogEvent> logEvents = new ArrayList<>();
		RequestContext requestContext = RequestContext.withRequest(HttpMethod.GET, "/")
				.completionHandler((ignored) -> completions.incrementAndGet())
				.logEventHandler(logEvents::add)
				.build();

		AsyncContext asyncContext = requestContext.startAsync();
		Assertions.assertTrue(requestContext.abandon());

		Assertions.assertThrows(ProtocolMisuseException.class, asyncContext::complete);
		Assertions.assertEquals(0, completions.get());
		Assertions.assertEquals(1, logEvents.size());
	}

	@Test
	public void startAsyncTwiceIsMisuse() {
		RequestContext requestContext = RequestContext.withRequest(HttpMethod.GET, "/").build();
		requestContext.startAsync();

		Assertions.assertThrows(ProtocolMisuseException.class, requestContext::startAsync);
	}

	@Test
	public void startAsyncAfterCompletionIsMisuse() {
		RequestContext requestContext = RequestContext.withRequest(HttpMethod.GET, "/").build();
		requestContext.complete();

		Assertions.assertThrows(ProtocolMisuseException.class, requestContext::startAsync);
		Assertions.assertFalse(requestContext.isAsyncStarted());
	}
}
