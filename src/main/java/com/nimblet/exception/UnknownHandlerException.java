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

import javax.annotation.concurrent.NotThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when a handler name is referenced (by a URI mapping or an RSP tag) but no handler was registered under it.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class UnknownHandlerException extends NimbletException {
	@NonNull
	private final String handlerName;

	public UnknownHandlerException(@NonNull String handlerName) {
		super(format("No handler is registered with name '%s'", requireNonNull(handlerName)));
		this.handlerName = handlerName;
	}

	@NonNull
	public String getHandlerName() {
		return this.handlerName;
	}
}
