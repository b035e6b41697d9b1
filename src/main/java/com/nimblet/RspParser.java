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
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Single-pass parser for RSP pages.
 * <p>
 * {@code <@=name>} names a handler to invoke. Everything else, including a lone {@code <@} or {@code >},
 * is literal. There is no escape syntax.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class RspParser {
	@NonNull
	private static final byte[] OPEN_TOKEN;
	@NonNull
	private static final byte CLOSE_TOKEN;

	static {
		OPEN_TOKEN = "<@=".getBytes(StandardCharsets.US_ASCII);
		CLOSE_TOKEN = '>';
	}

	private RspParser() {
		// Non-instantiable
	}

	/**
	 * Parses page bytes into segments.
	 *
	 * @param bytes the raw page
	 * @return the parsed document
	 * @throws MalformedDocumentException if a tag is unterminated or names no handler
	 */
	@NonNull
	public static RspDocument parse(@NonNull byte[] bytes) {
		requireNonNull(bytes);

		List<RspDocument.Segment> segments = new ArrayList<>();
		int position = 0;

		while (position < bytes.length) {
			int open = indexOfOpenToken(bytes, position);

			if (open < 0) {
				segments.add(new RspDocument.StaticSegment(Arrays.copyOfRange(bytes, position, bytes.length)));
				break;
			}

			if (open > position)
				segments.add(new RspDocument.StaticSegment(Arrays.copyOfRange(bytes, position, open)));

			int nameStart = open + OPEN_TOKEN.length;
			int close = indexOf(bytes, CLOSE_TOKEN, nameStart);

			if (close < 0)
				throw new MalformedDocumentException(format("Unterminated handler tag at byte offset %d", open), open);

			String handlerName = Utilities.trimAggressivelyToEmpty(new String(bytes, nameStart, close - nameStart, StandardCharsets.UTF_8));

			if (handlerName.isEmpty())
				throw new MalformedDocumentException(format("Handler tag at byte offset %d does not name a handler", open), open);

			segments.add(new RspDocument.InvokeSegment(handlerName, open));
			position = close + 1;
		}

		return new RspDocument(segments);
	}

	private static int indexOfOpenToken(@NonNull byte[] bytes,
																			int fromIndex) {
		outer:
		for (int i = fromIndex; i <= bytes.length - OPEN_TOKEN.length; ++i) {
			for (int j = 0; j < OPEN_TOKEN.length; ++j)
				if (bytes[i + j] != OPEN_TOKEN[j])
					continue outer;

			return i;
		}

		return -1;
	}

	private static int indexOf(@NonNull byte[] bytes,
														 byte b,
														 int fromIndex) {
		for (int i = fromIndex; i < bytes.length; ++i)
			if (bytes[i] == b)
				return i;

		return -1;
	}
}
