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

import com.nimblet.exception.ProtocolMisuseException;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * Ownership token for a response detached via {@link RequestContext#startAsync()}.
 * <p>
 * The holder may write to {@link #getRequestContext()} from any single thread and must then call {@link #complete()}
 * exactly once. If it never does, the server's async timeout closes the connection and a late {@code complete()}
 * is rejected.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class AsyncContext {
	@NonNull
	private final RequestContext requestContext;
	@NonNull
	private final AtomicBoolean completeCalled;

	AsyncContext(@NonNull RequestContext requestContext) {
		requireNonNull(requestContext);

		this.requestContext = requestContext;
		this.completeCalled = new AtomicBoolean(false);
	}

	/**
	 * Flushes the response.
	 *
	 * @throws ProtocolMisuseException if already called, or if the response was finalized by a timeout or failure
	 */
	public void complete() {
		if (!this.completeCalled.compareAndSet(false, true))
			throw getRequestContext().reportProtocolMisuse("AsyncContext.complete() was called more than once");

		if (!getRequestContext().complete())
			throw getRequestContext().reportProtocolMisuse("AsyncContext.complete() was called after the response was already finalized");
	}

	@NonNull
	public Boolean isCompleted() {
		return this.completeCalled.get();
	}

	@NonNull
	public RequestContext getRequestContext() {
		return this.requestContext;
	}
}
