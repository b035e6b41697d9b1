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

import com.nimblet.exception.HandlerFaultException;
import com.nimblet.exception.MalformedDocumentException;
import com.nimblet.exception.NimbletException;
import com.nimblet.exception.UnknownHandlerException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Loads RSP pages from the webroot and renders them into a {@link RequestContext}.
 * <p>
 * Static bytes are appended to the response buffer; each {@code <@=name>} tag invokes the named handler with the
 * same context, so everything the handlers write lands in page order within one response.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class RspInterpreter {
	@NonNull
	public static final Long DEFAULT_MAXIMUM_PAGE_SIZE_IN_BYTES;
	@NonNull
	public static final String DEFAULT_CONTENT_TYPE;
	@NonNull
	private static final Integer DEFAULT_CACHE_CAPACITY;

	static {
		DEFAULT_MAXIMUM_PAGE_SIZE_IN_BYTES = 10L * 1_024L * 1_024L;
		DEFAULT_CONTENT_TYPE = "text/html; charset=UTF-8";
		DEFAULT_CACHE_CAPACITY = 128;
	}

	@NonNull
	private final Path webroot;
	@NonNull
	private final HandlerRegistry handlerRegistry;
	@NonNull
	private final Long maximumPageSizeInBytes;
	@NonNull
	private final Boolean cacheEnabled;
	@NonNull
	private final Map<Path, CachedDocument> cache;
	@NonNull
	private final ReentrantLock lock;

	@NonNull
	public static Builder withWebroot(@NonNull Path webroot,
																		@NonNull HandlerRegistry handlerRegistry) {
		requireNonNull(webroot);
		requireNonNull(handlerRegistry);

		return new Builder(webroot, handlerRegistry);
	}

	protected RspInterpreter(@NonNull Builder builder) {
		requireNonNull(builder);

		this.webroot = builder.webroot.toAbsolutePath().normalize();
		this.handlerRegistry = builder.handlerRegistry;
		this.maximumPageSizeInBytes = builder.maximumPageSizeInBytes == null ? DEFAULT_MAXIMUM_PAGE_SIZE_IN_BYTES : builder.maximumPageSizeInBytes;
		this.cacheEnabled = builder.cacheEnabled == null ? false : builder.cacheEnabled;
		this.lock = new ReentrantLock();

		int cacheCapacity = builder.cacheCapacity == null ? DEFAULT_CACHE_CAPACITY : builder.cacheCapacity;

		if (cacheCapacity < 1)
			throw new IllegalArgumentException("Cache capacity must be > 0");

		if (this.maximumPageSizeInBytes < 1)
			throw new IllegalArgumentException("Maximum page size must be > 0");

		this.cache = new LinkedHashMap<>(16, 0.75f, true) {
			@Override
			protected boolean removeEldestEntry(Map.Entry<Path, CachedDocument> eldest) {
				return size() > cacheCapacity;
			}
		};
	}

	/**
	 * Renders the page at the given request path.
	 *
	 * @param path           normalized request path, e.g. {@code /index.rsp}
	 * @param requestContext the context to render into
	 * @return {@code false} if no such page exists inside the webroot, {@code true} once rendered
	 * @throws MalformedDocumentException if the page is too large or cannot be parsed
	 * @throws UnknownHandlerException    if the page names a handler that is not registered
	 * @throws HandlerFaultException      if an invoked handler throws
	 * @throws IOException                if the page cannot be read
	 */
	@NonNull
	public Boolean render(@NonNull String path,
												@NonNull RequestContext requestContext) throws IOException {
		requireNonNull(path);
		requireNonNull(requestContext);

		Path pagePath = resolvePagePath(path);

		if (pagePath == null || !Files.isRegularFile(pagePath))
			return false;

		RspDocument rspDocument;

		try {
			rspDocument = loadDocument(pagePath);
		} catch (NoSuchFileException e) {
			return false;
		}

		if (requestContext.getContentType().isEmpty())
			requestContext.setContentType(DEFAULT_CONTENT_TYPE);

		for (RspDocument.Segment segment : rspDocument.segments()) {
			if (segment instanceof RspDocument.StaticSegment staticSegment) {
				requestContext.write(staticSegment.bytes());
			} else if (segment instanceof RspDocument.InvokeSegment invokeSegment) {
				invoke(invokeSegment.handlerName(), requestContext);
			}
		}

		return true;
	}

	/**
	 * Maps a request path onto a file under the webroot.
	 *
	 * @return the file path, or {@code null} if it would escape the webroot
	 */
	@Nullable
	Path resolvePagePath(@NonNull String path) {
		requireNonNull(path);

		String relativePath = path.startsWith("/") ? path.substring(1) : path;
		Path pagePath;

		try {
			pagePath = getWebroot().resolve(relativePath).normalize();
		} catch (InvalidPathException e) {
			return null;
		}

		return pagePath.startsWith(getWebroot()) ? pagePath : null;
	}

	@NonNull
	private RspDocument loadDocument(@NonNull Path pagePath) throws IOException {
		requireNonNull(pagePath);

		BasicFileAttributes attributes = Files.readAttributes(pagePath, BasicFileAttributes.class);

		if (attributes.size() > getMaximumPageSizeInBytes())
			throw new MalformedDocumentException(format("Page %s is %d bytes, which exceeds the %d byte limit",
					getWebroot().relativize(pagePath), attributes.size(), getMaximumPageSizeInBytes()));

		if (!isCacheEnabled())
			return RspParser.parse(Files.readAllBytes(pagePath));

		FileTime lastModified = attributes.lastModifiedTime();

		getLock().lock();

		try {
			CachedDocument cachedDocument = getCache().get(pagePath);

			if (cachedDocument != null && cachedDocument.lastModified().equals(lastModified))
				return cachedDocument.rspDocument();
		} finally {
			getLock().unlock();
		}

		// Parse outside the lock; two threads racing on the same page both parse and the last one wins
		RspDocument rspDocument = RspParser.parse(Files.readAllBytes(pagePath));

		getLock().lock();

		try {
			getCache().put(pagePath, new CachedDocument(lastModified, rspDocument));
		} finally {
			getLock().unlock();
		}

		return rspDocument;
	}

	private void invoke(@NonNull String handlerName,
											@NonNull RequestContext requestContext) {
		requireNonNull(handlerName);
		requireNonNull(requestContext);

		Handler handler = getHandlerRegistry().getHandler(handlerName)
				.orElseThrow(() -> new UnknownHandlerException(handlerName));

		requestContext.enterPage();

		try {
			handler.handle(requestContext);
		} catch (NimbletException e) {
			throw e;
		} catch (Exception e) {
			throw new HandlerFaultException(handlerName, e);
		} finally {
			requestContext.exitPage();
		}
	}

	@NonNull
	Integer getCacheSize() {
		getLock().lock();

		try {
			return getCache().size();
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Path getWebroot() {
		return this.webroot;
	}

	@NonNull
	public Long getMaximumPageSizeInBytes() {
		return this.maximumPageSizeInBytes;
	}

	@NonNull
	public Boolean isCacheEnabled() {
		return this.cacheEnabled;
	}

	@NonNull
	private HandlerRegistry getHandlerRegistry() {
		return this.handlerRegistry;
	}

	@NonNull
	private Map<Path, CachedDocument> getCache() {
		return this.cache;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	private record CachedDocument(@NonNull FileTime lastModified,
																@NonNull RspDocument rspDocument) {}

	/**
	 * Builder used to construct instances of {@link RspInterpreter} via {@link RspInterpreter#withWebroot(Path, HandlerRegistry)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Path webroot;
		@NonNull
		private final HandlerRegistry handlerRegistry;
		@Nullable
		private Long maximumPageSizeInBytes;
		@Nullable
		private Boolean cacheEnabled;
		@Nullable
		private Integer cacheCapacity;

		protected Builder(@NonNull Path webroot,
											@NonNull HandlerRegistry handlerRegistry) {
			this.webroot = webroot;
			this.handlerRegistry = handlerRegistry;
		}

		@NonNull
		public Builder maximumPageSizeInBytes(@Nullable Long maximumPageSizeInBytes) {
			this.maximumPageSizeInBytes = maximumPageSizeInBytes;
			return this;
		}

		@NonNull
		public Builder cacheEnabled(@Nullable Boolean cacheEnabled) {
			this.cacheEnabled = cacheEnabled;
			return this;
		}

		@NonNull
		public Builder cacheCapacity(@Nullable Integer cacheCapacity) {
			this.cacheCapacity = cacheCapacity;
			return this;
		}

		@NonNull
		public RspInterpreter build() {
			return new RspInterpreter(this);
		}
	}
}
