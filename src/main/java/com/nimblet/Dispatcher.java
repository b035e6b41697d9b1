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
import com.nimblet.exception.HandlerFaultException;
import com.nimblet.exception.MalformedDocumentException;
import com.nimblet.exception.NimbletException;
import com.nimblet.exception.ProtocolMisuseException;
import com.nimblet.exception.UnknownHandlerException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Routes a {@link RequestContext} to its handler or RSP page and turns failures into error responses.
 * <p>
 * Unless the handler started async processing, the response is flushed as soon as dispatch returns.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Dispatcher implements Server.RequestHandler {
	@NonNull
	public static final String DEFAULT_RSP_EXTENSION;

	static {
		DEFAULT_RSP_EXTENSION = ".rsp";
	}

	@NonNull
	private final HandlerRegistry handlerRegistry;
	@Nullable
	private final RspInterpreter rspInterpreter;
	@NonNull
	private final String rspExtension;
	@NonNull
	private final Consumer<LogEvent> logEventHandler;

	public Dispatcher(@NonNull HandlerRegistry handlerRegistry,
										@Nullable RspInterpreter rspInterpreter,
										@Nullable String rspExtension,
										@NonNull Consumer<LogEvent> logEventHandler) {
		requireNonNull(handlerRegistry);
		requireNonNull(logEventHandler);

		String normalizedRspExtension = Utilities.trimAggressivelyToNull(rspExtension);

		if (normalizedRspExtension == null)
			normalizedRspExtension = DEFAULT_RSP_EXTENSION;
		else if (!normalizedRspExtension.startsWith("."))
			normalizedRspExtension = "." + normalizedRspExtension;

		this.handlerRegistry = handlerRegistry;
		this.rspInterpreter = rspInterpreter;
		this.rspExtension = normalizedRspExtension.toLowerCase(Locale.ROOT);
		this.logEventHandler = logEventHandler;
	}

	@Override
	public void handleRequest(@NonNull RequestContext requestContext) {
		requireNonNull(requestContext);

		try {
			dispatch(requestContext);
		} catch (Throwable t) {
			handleFailure(requestContext, t);
		}

		if (!requestContext.isAsyncStarted())
			requestContext.complete();
	}

	private void dispatch(@NonNull RequestContext requestContext) throws Exception {
		requireNonNull(requestContext);

		String path = requestContext.getPath();
		Optional<ResolvedHandler> resolvedHandler = getHandlerRegistry().resolve(path);

		if (resolvedHandler.isPresent()) {
			try {
				resolvedHandler.get().handler().handle(requestContext);
			} catch (NimbletException e) {
				throw e;
			} catch (Exception e) {
				throw new HandlerFaultException(resolvedHandler.get().name(), e);
			}

			return;
		}

		RspInterpreter rspInterpreter = getRspInterpreter().orElse(null);

		if (rspInterpreter != null
				&& path.toLowerCase(Locale.ROOT).endsWith(getRspExtension())
				&& rspInterpreter.render(path, requestContext))
			return;

		writeErrorResponse(requestContext, 404);
	}

	private void handleFailure(@NonNull RequestContext requestContext,
														 @NonNull Throwable throwable) {
		requireNonNull(requestContext);
		requireNonNull(throwable);

		Integer statusCode = 500;

		if (throwable instanceof MalformedDocumentException) {
			statusCode = 400;
			safelyLog(LogEvent.with(LogEventType.MALFORMED_DOCUMENT, throwable.getMessage())
					.throwable(throwable)
					.uri(requestContext.getUri())
					.build());
		} else if (throwable instanceof BadRequestException) {
			statusCode = 400;
			safelyLog(LogEvent.with(LogEventType.BAD_REQUEST, throwable.getMessage())
					.throwable(throwable)
					.uri(requestContext.getUri())
					.build());
		} else if (throwable instanceof UnknownHandlerException unknownHandlerException) {
			safelyLog(LogEvent.with(LogEventType.UNKNOWN_HANDLER, format("No handler named '%s' is registered", unknownHandlerException.getHandlerName()))
					.throwable(throwable)
					.uri(requestContext.getUri())
					.build());
		} else if (throwable instanceof ProtocolMisuseException) {
			// Reported to the log at the point of misuse
		} else if (throwable instanceof HandlerFaultException handlerFaultException) {
			safelyLog(LogEvent.with(LogEventType.HANDLER_FAULT, format("Handler '%s' failed", handlerFaultException.getHandlerName()))
					.throwable(throwable.getCause() == null ? throwable : throwable.getCause())
					.uri(requestContext.getUri())
					.build());
		} else {
			safelyLog(LogEvent.with(LogEventType.HANDLER_FAULT, format("Unexpected failure while dispatching %s", requestContext.getPath()))
					.throwable(throwable)
					.uri(requestContext.getUri())
					.build());
		}

		if (requestContext.isCompleted())
			return;

		writeErrorResponse(requestContext, statusCode);

		// A failing handler that already went async loses ownership of the response
		if (requestContext.isAsyncStarted())
			requestContext.complete();
	}

	private void writeErrorResponse(@NonNull RequestContext requestContext,
																	@NonNull Integer statusCode) {
		requireNonNull(requestContext);
		requireNonNull(statusCode);

		requestContext.resetResponse();
		requestContext.setStatusCode(statusCode);
		requestContext.setContentType("text/plain; charset=UTF-8");
		requestContext.write(format("HTTP %d: %s", statusCode, StatusCode.reasonPhraseFor(statusCode)).getBytes(StandardCharsets.UTF_8));
	}

	private void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);
		getLogEventHandler().accept(logEvent);
	}

	@NonNull
	public HandlerRegistry getHandlerRegistry() {
		return this.handlerRegistry;
	}

	@NonNull
	public Optional<RspInterpreter> getRspInterpreter() {
		return Optional.ofNullable(this.rspInterpreter);
	}

	@NonNull
	public String getRspExtension() {
		return this.rspExtension;
	}

	@NonNull
	private Consumer<LogEvent> getLogEventHandler() {
		return this.logEventHandler;
	}
}
