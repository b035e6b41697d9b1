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

import com.nimblet.exception.MalformedDocumentException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RspParserTests {
	@Test
	public void staticAndInvokeSegmentsInOrder() {
		List<RspDocument.Segment> segments = parse("<html><@=header>mid<@= footer ></html>").segments();

		Assertions.assertEquals(5, segments.size());
		Assertions.assertEquals("<html>", text(segments.get(0)));
		Assertions.assertEquals("header", ((RspDocument.InvokeSegment) segments.get(1)).handlerName());
		Assertions.assertEquals(6, ((RspDocument.InvokeSegment) segments.get(1)).offset());
		Assertions.assertEquals("mid", text(segments.get(2)));
		Assertions.assertEquals("footer", ((RspDocument.InvokeSegment) segments.get(3)).handlerName());
		Assertions.assertEquals("</html>", text(segments.get(4)));
	}

	@Test
	public void documentWithoutTagsIsOneStaticSegment() {
		List<RspDocument.Segment> segments = parse("plain <@ text > here").segments();

		Assertions.assertEquals(1, segments.size());
		Assertions.assertEquals("plain <@ text > here", text(segments.get(0)));
	}

	@Test
	public void emptyDocumentHasNoSegments() {
		Assertions.assertTrue(parse("").segments().isEmpty());
	}

	@Test
	public void adjacentTags() {
		List<RspDocument.Segment> segments = parse("<@=a><@=b>").segments();

		Assertions.assertEquals(2, segments.size());
		Assertions.assertInstanceOf(RspDocument.InvokeSegment.class, segments.get(0));
		Assertions.assertInstanceOf(RspDocument.InvokeSegment.class, segments.get(1));
	}

	@Test
	public void unterminatedTagReportsOffset() {
		MalformedDocumentException exception = Assertions.assertThrows(MalformedDocumentException.class,
				() -> parse("abc<@=header"));

		Assertions.assertEquals(3, exception.getOffset().orElseThrow());
	}

	@Test
	public void emptyHandlerNameIsMalformed() {
		Assertions.assertThrows(MalformedDocumentException.class, () -> parse("x<@=  >y"));
	}

	private static RspDocument parse(String document) {
		return RspParser.parse(document.getBytes(StandardCharsets.UTF_8));
	}

	private static String text(RspDocument.Segment segment) {
		return new String(((RspDocument.StaticSegment) segment).bytes(), StandardCharsets.UTF_8);
	}
}
