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

import static java.util.Objects.requireNonNull;

/**
 * Wraps anything thrown out of handler code so the dispatch boundary can turn it into an HTTP 500.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class HandlerFaultException extends NimbletException {
	@NonNull
	private final String handlerName;

	public HandlerFaultException(@NonNull String handlerName,
															 @Nullable Throwable cause) {
		super("Handler '" + requireNonNull(handlerName) + "' failed", cause);
		this.handlerName = handlerName;
	}

	@NonNull
	public String getHandlerName() {
		return this.handlerName;
	}
}
