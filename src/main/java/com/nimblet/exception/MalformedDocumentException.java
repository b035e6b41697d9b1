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

package com.nimblet.exception;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Optional;

/**
 * Thrown when an RSP page document cannot be parsed, e.g. an {@code <@=} tag with no closing {@code >}.
 * <p>
 * Results in an HTTP 400 response.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class MalformedDocumentException extends NimbletException {
	@Nullable
	private final Integer offset;

	public MalformedDocumentException(@Nullable String message) {
		this(message, null);
	}

	public MalformedDocumentException(@Nullable String message,
																		@Nullable Integer offset) {
		super(message);
		this.offset = offset;
	}

	/**
	 * Byte offset into the document at which the problem was detected, if known.
	 *
	 * @return the offset, or {@link Optional#empty()} if not applicable
	 */
	@NonNull
	public Optional<Integer> getOffset() {
		return Optional.ofNullable(this.offset);
	}
}
