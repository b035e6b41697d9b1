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

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A parsed RSP page: literal byte runs interleaved with handler invocations, in document order.
 * <p>
 * Documents are immutable and may be cached and rendered concurrently.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public record RspDocument(@NonNull List<@NonNull Segment> segments) {
	public RspDocument {
		requireNonNull(segments);
		segments = List.copyOf(segments);
	}

	/**
	 * One piece of a page.
	 */
	public sealed interface Segment permits StaticSegment, InvokeSegment {}

	/**
	 * Bytes copied to the response verbatim.
	 */
	public record StaticSegment(@NonNull byte[] bytes) implements Segment {
		public StaticSegment {
			requireNonNull(bytes);
		}
	}

	/**
	 * A {@code <@=name>} tag.
	 *
	 * @param handlerName the trimmed handler name
	 * @param offset      byte offset of the tag's {@code <@=} in the page
	 */
	public record InvokeSegment(@NonNull String handlerName,
															@NonNull Integer offset) implements Segment {
		public InvokeSegment {
			requireNonNull(handlerName);
			requireNonNull(offset);
		}
	}
}
