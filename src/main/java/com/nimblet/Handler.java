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

/**
 * Application code that serves a request.
 * <p>
 * Handlers are registered by name in a {@link HandlerRegistry} and invoked by URI mapping or from an RSP page tag.
 * Any state a handler needs lives in the implementing object. Anything thrown is caught at the dispatch boundary
 * and turned into an HTTP 500; the worker thread survives.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface Handler {
	/**
	 * Reads the request from, and writes the response to, the given context.
	 * <p>
	 * Return normally to have the response flushed. Call {@link RequestContext#startAsync()} to take ownership of
	 * the response and flush it later from another thread via {@link AsyncContext#complete()}.
	 *
	 * @param requestContext the per-request state
	 * @throws Exception if the handler fails
	 */
	void handle(@NonNull RequestContext requestContext) throws Exception;
}
