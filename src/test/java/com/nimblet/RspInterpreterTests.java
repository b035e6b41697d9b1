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

import com.nimblet.exception.HandlerFaultException;
import com.nimblet.exception.MalformedDocumentException;
import com.nimblet.exception.ProtocolMisuseException;
import com.nimblet.exception.UnknownHandlerException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RspInterpreterTests {
	@TempDir
	Path webroot;

	@Test
	public void rendersStaticTextAndHandlerOutputInOrder() throws IOException {
		write("index.rsp", "<html><@=header>mid<@=footer></html>");

		RspInterpreter rspInterpreter = RspInterpreter.withWebroot(this.webroot, pageHandlers()).build();
		RequestContext requestContext = requestContext("/index.rsp");

		Assertions.assertTrue(rspInterpreter.render("/index.rsp", requestContext));
		Assertions.assertEquals("<html>HmidF</html>", body(requestContext));
		Assertions.assertEquals("text/html; charset=UTF-8", requestContext.getContentType().orElse(null));
	}

	@Test
	public void explicitContentTypeIsKept() throws IOException {
		write("data.rsp", "x");

		RspInterpreter rspInterpreter = RspInterpreter.withWebroot(this.webroot, pageHandlers()).build();
		RequestContext requestContext = requestContext("/data.rsp");
		requestContext.setContentType("application/json");

		rspInterpreter.render("/data.rsp", requestContext);

		Assertions.assertEquals("application/json", requestContext.getContentType().orElse(null));
	}

	@Test
	public void missingPageIsNotRendered() throws IOException {
		RspInterpreter rspInterpreter = RspInterpreter.withWebroot(this.webroot, pageHandlers()).build();
		RequestContext requestContext = requestContext("/missing.rsp");

		Assertions.assertFalse(rspInterpreter.render("/missing.rsp", requestContext));
		Assertions.assertEquals(0, requestContext.getResponseBody().length);
	}

	@Test
	public void directoriesAreNotPages() throws IOException {
		Files.createDirectories(this.webroot.resolve("dir.rsp"));

		RspInterpreter rspInterpreter = RspInterpreter.withWebroot(this.webroot, pageHandlers()).build();
		Assertions.assertFalse(rspInterpreter.render("/dir.rsp", requestContext("/dir.rsp")));
	}

	@Test
	public void pathsOutsideWebrootAreRejected() throws IOException {
		Path inner = Files.createDirectories(this.webroot.resolve("www"));
		Files.writeString(this.webroot.resolve("secret.rsp"), "secret", StandardCharsets.UTF_8);

		RspInterpreter rspInterpreter = RspInterpreter.withWebroot(inner, pageHandlers()).build();

		Assertions.assertNull(rspInterpreter.resolvePagePath("/../secret.rsp"));
		Assertions.assertFalse(rspInterpreter.render("/../secret.rsp", requestContext("/x.rsp")));
		Assertions.assertEquals(inner.resolve("a/b.rsp").toAbsolutePath().normalize(), rspInterpreter.resolvePagePath("/a/b.rsp"));
	}

	@Test
	public void oversizedPageIsMalformed() throws IOException {
		write("big.rsp", "0123456789");

		RspInterpreter rspInterpreter = RspInterpreter.withWebroot(this.webroot, pageHandlers())
				.maximumPageSizeInBytes(5L)
				.build();

		Assertions.assertThrows(MalformedDocumentException.class,
				() -> rspInterpreter.render("/big.rsp", requestContext("/big.rsp")));
	}

	@Test
	public void unknownHandlerNameFails() throws IOException {
		write("broken.rsp", "a<@=nope>b");

		RspInterpreter rspInterpreter = RspInterpreter.withWebroot(this.webroot, pageHandlers()).build();

		UnknownHandlerException exception = Assertions.assertThrows(UnknownHandlerException.class,
				() -> rspInterpreter.render("/broken.rsp", requestContext("/broken.rsp")));
		Assertions.assertEquals("nope", exception.getHandlerName());
	}

	@Test
	public void handlerExceptionsAreWrappedWithHandlerName() throws IOException {
		write("fault.rsp", "<@=explode>");

		HandlerRegistry handlerRegistry = HandlerRegistry.builder()
				.handler("explode", (requestContext) -> {
					throw new IOException("disk on fire");
				})
				.build();

		RspInterpreter rspInterpreter = RspInterpreter.withWebroot(this.webroot, handlerRegistry).build();

		HandlerFaultException exception = Assertions.assertThrows(HandlerFaultException.class,
				() -> rspInterpreter.render("/fault.rsp", requestContext("/fault.rsp")));
		Assertions.assertEquals("explode", exception.getHandlerName());
		Assertions.assertInstanceOf(IOException.class, exception.getCause());
	}

	@Test
	public void startAsyncFromPageHandlerIsMisuse() throws IOException {
		write("async.rsp", "<@=async>");

		HandlerRegistry handlerRegistry = HandlerRegistry.builder()
				.handler("async", RequestContext::startAsync)
				.build();

		List<LogEvent> logEvents = new ArrayList<>();
		RequestContext requestContext = RequestContext.withRequest(HttpMethod.GET, "/async.rsp")
				.logEventHandler(logEvents::add)
				.build();

		RspInterpreter rspInterpreter = RspInterpreter.withWebroot(this.webroot, handlerRegistry).build();

		Assertions.assertThrows(ProtocolMisuseException.class, () -> rspInterpreter.render("/async.rsp", requestContext));
		Assertions.assertFalse(requestContext.isAsyncStarted());
		Assertions.assertFalse(requestContext.isRenderingPage());
		Assertions.assertEquals(1, logEvents.size());
		Assertions.assertEquals(LogEventType.PROTOCOL_MISUSE, logEvents.get(0).getLogEventType());
	}

	@Test
	public void cacheReparsesWhenPageChanges() throws IOException {
		Path page = write("cached.rsp", "one");

		RspInterpreter rspInterpreter = RspInterpreter.withWebroot(this.webroot, pageHandlers())
				.cacheEnabled(true)
				.build();

		RequestContext first = requestContext("/cached.rsp");
		rspInterpreter.render("/cached.rsp", first);
		Assertions.assertEquals("one", body(first));
		Assertions.assertEquals(1, rspInterpreter.getCacheSize());

		Files.writeString(page, "two", StandardCharsets.UTF_8);
		Files.setLastModifiedTime(page, FileTime.from(Instant.now().plusSeconds(60)));

		RequestContext second = requestContext("/cached.rsp");
		rspInterpreter.render("/cached.rsp", second);
		Assertions.assertEquals("two", body(second));
		Assertions.assertEquals(1, rspInterpreter.getCacheSize());
	}

	@Test
	public void cacheEvictsLeastRecentlyUsed() throws IOException {
		write("a.rsp", "a");
		write("b.rsp", "b");
		write("c.rsp", "c");

		RspInterpreter rspInterpreter = RspInterpreter.withWebroot(this.webroot, pageHandlers())
				.cacheEnabled(true)
				.cacheCapacity(2)
				.build();

		for (String path : List.of("/a.rsp", "/b.rsp", "/c.rsp"))
			rspInterpreter.render(path, requestContext(path));

		Assertions.assertEquals(2, rspInterpreter.getCacheSize());
	}

	@Test
	public void disabledCacheStaysEmpty() throws IOException {
		write("a.rsp", "a");

		RspInterpreter rspInterpreter = RspInterpreter.withWebroot(this.webroot, pageHandlers()).build();
		rspInterpreter.render("/a.rsp", requestContext("/a.rsp"));

		Assertions.assertFalse(rspInterpreter.isCacheEnabled());
		Assertions.assertEquals(0, rspInterpreter.getCacheSize());
	}

	private Path write(String name, String content) throws IOException {
		Path path = this.webroot.resolve(name);
		Files.writeString(path, content, StandardCharsets.UTF_8);
		return path;
	}

	private static HandlerRegistry pageHandlers() {
		return HandlerRegistry.builder()
				.handler("header", (requestContext) -> requestContext.write("H"))
				.handler("footer", (requestContext) -> requestContext.write("F"))
				.build();
	}

	private static RequestContext requestContext(String uri) {
		return RequestContext.withRequest(HttpMethod.GET, uri).build();
	}

	private static String body(RequestContext requestContext) {
		return new String(requestContext.getResponseBody(), StandardCharsets.UTF_8);
	}
}
