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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Map;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class UtilitiesTests {
	@Test
	public void normalizePathResolvesDotSegmentsAndSlashes() {
		Assertions.assertEquals("/", Utilities.normalizePath(""));
		Assertions.assertEquals("/", Utilities.normalizePath("/"));
		Assertions.assertEquals("/a/c", Utilities.normalizePath("/a/b/../c"));
		Assertions.assertEquals("/a/b", Utilities.normalizePath("//a/./b/"));
		Assertions.assertEquals("/etc/passwd", Utilities.normalizePath("/../../etc/passwd"));
	}

	@Test
	public void normalizePathDecodesBeforeResolving() {
		Assertions.assertEquals("/hello world", Utilities.normalizePath("/hello%20world"));
		Assertions.assertEquals("/secret", Utilities.normalizePath("/pages/%2e%2e/secret"));
		Assertions.assertEquals("/café", Utilities.normalizePath("/caf%C3%A9"));
	}

	@Test
	public void malformedPercentEncodingIsBadRequest() {
		Assertions.assertThrows(BadRequestException.class, () -> Utilities.normalizePath("/a%2"));
		Assertions.assertThrows(BadRequestException.class, () -> Utilities.normalizePath("/a%zz"));
		Assertions.assertThrows(BadRequestException.class, () -> Utilities.extractQueryParameters("a=%"));
	}

	@Test
	public void splitRequestTarget() {
		Assertions.assertArrayEquals(new String[]{"/echo", "a=1"}, Utilities.splitRequestTarget("/echo?a=1"));
		Assertions.assertArrayEquals(new String[]{"/echo", null}, Utilities.splitRequestTarget("/echo"));
		Assertions.assertArrayEquals(new String[]{"/echo", null}, Utilities.splitRequestTarget("/echo?"));
		Assertions.assertArrayEquals(new String[]{"/x", "y=2"}, Utilities.splitRequestTarget("http://example.com/x?y=2#frag"));
		Assertions.assertArrayEquals(new String[]{"/", null}, Utilities.splitRequestTarget("http://example.com"));
	}

	@Test
	public void queryParametersKeepOrderAndRepeats() {
		Map<String, List<String>> parameters = Utilities.extractQueryParameters("a=1&b=two+words&a=3&flag&=ignored");

		Assertions.assertEquals(List.of("a", "b", "flag"), List.copyOf(parameters.keySet()));
		Assertions.assertEquals(List.of("1", "3"), parameters.get("a"));
		Assertions.assertEquals(List.of("two words"), parameters.get("b"));
		Assertions.assertEquals(List.of(""), parameters.get("flag"));
		Assertions.assertTrue(Utilities.extractQueryParameters(null).isEmpty());
	}

	@Test
	public void cookiesFirstOccurrenceWins() {
		Map<String, String> cookies = Utilities.extractCookies(List.of(
				new HttpHeader("Cookie", "a=1; b=\"quoted\""),
				new HttpHeader("cookie", "a=2; c=3"),
				new HttpHeader("Accept", "text/plain")));

		Assertions.assertEquals("1", cookies.get("a"));
		Assertions.assertEquals("quoted", cookies.get("b"));
		Assertions.assertEquals("3", cookies.get("c"));
		Assertions.assertEquals(3, cookies.size());
	}

	@Test
	public void trimAggressively() {
		Assertions.assertNull(Utilities.trimAggressivelyToNull("  \t "));
		Assertions.assertEquals("", Utilities.trimAggressivelyToEmpty(null));
		Assertions.assertEquals("x", Utilities.trimAggressively(" x "));
	}
}
