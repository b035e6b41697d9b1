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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class HandlerRegistryTests {
	private static final Handler NOOP = (requestContext) -> {};

	@Test
	public void exactMappingBeatsPrefix() {
		HandlerRegistry handlerRegistry = HandlerRegistry.builder()
				.handler("all", NOOP)
				.handler("echo", NOOP)
				.mapping("/*", "all")
				.mapping("/echo", "echo")
				.build();

		Assertions.assertEquals("echo", handlerRegistry.resolve("/echo").get().name());
		Assertions.assertEquals("all", handlerRegistry.resolve("/echo/more").get().name());
		Assertions.assertEquals("all", handlerRegistry.resolve("/").get().name());
	}

	@Test
	public void longestLiteralPrefixWins() {
		HandlerRegistry handlerRegistry = HandlerRegistry.builder()
				.handler("static", NOOP)
				.handler("images", NOOP)
				.mapping("/static/*", "static")
				.mapping("/static/images/*", "images")
				.build();

		Assertions.assertEquals("images", handlerRegistry.resolve("/static/images/logo.png").get().name());
		Assertions.assertEquals("static", handlerRegistry.resolve("/static/app.js").get().name());
		Assertions.assertEquals("static", handlerRegistry.resolve("/static").get().name());
		Assertions.assertTrue(handlerRegistry.resolve("/staticky").isEmpty());
		Assertions.assertTrue(handlerRegistry.resolve("/other").isEmpty());
	}

	@Test
	public void routeRegistersUnderPatternName() {
		Handler handler = (requestContext) -> requestContext.write("hi");
		HandlerRegistry handlerRegistry = HandlerRegistry.builder()
				.route("/hello", handler)
				.build();

		ResolvedHandler resolvedHandler = handlerRegistry.resolve("/hello").orElseThrow();
		Assertions.assertEquals("/hello", resolvedHandler.name());
		Assertions.assertSame(handler, resolvedHandler.handler());
		Assertions.assertSame(handler, handlerRegistry.getHandler("/hello").orElseThrow());
	}

	@Test
	public void exactPatternsAreNormalized() {
		HandlerRegistry handlerRegistry = HandlerRegistry.builder()
				.handler("echo", NOOP)
				.mapping("/echo/", "echo")
				.build();

		Assertions.assertTrue(handlerRegistry.resolve("/echo").isPresent());
	}

	@Test
	public void duplicatePatternFails() {
		HandlerRegistry.Builder builder = HandlerRegistry.builder()
				.handler("a", NOOP)
				.handler("b", NOOP)
				.mapping("/x/*", "a");

		Assertions.assertThrows(DuplicateMappingException.class, () -> builder.mapping("/x/*", "b"));
	}

	@Test
	public void duplicateHandlerNameFails() {
		HandlerRegistry.Builder builder = HandlerRegistry.builder().handler("a", NOOP);
		Assertions.assertThrows(DuplicateMappingException.class, () -> builder.handler("a", NOOP));
	}

	@Test
	public void mappingToUnknownNameFailsAtBuild() {
		HandlerRegistry.Builder builder = HandlerRegistry.builder().mapping("/x", "missing");

		UnknownHandlerException exception = Assertions.assertThrows(UnknownHandlerException.class, builder::build);
		Assertions.assertEquals("missing", exception.getHandlerName());
	}

	@Test
	public void illegalPatternsAreRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> UriPattern.of("no-slash"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> UriPattern.of("/a/*/b"));
	}

	@Test
	public void handlersAreAvailableByNameWithoutMapping() {
		HandlerRegistry handlerRegistry = HandlerRegistry.builder()
				.handler("header", NOOP)
				.build();

		Assertions.assertTrue(handlerRegistry.getHandler("header").isPresent());
		Assertions.assertTrue(handlerRegistry.resolve("/header").isEmpty());
	}
}
