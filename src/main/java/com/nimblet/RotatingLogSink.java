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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Append-only log file that rotates itself when it grows past a size limit or gets older than an age limit.
 * <p>
 * Rotation is checked before every write. A rotated file is renamed alongside the live one to
 * {@code <name>.r_<yyyyMMdd_HHmmss>_<random>.log}, or deleted outright when {@code deleteOnRotation} is set.
 * <p>
 * Until {@link #stopMirroringToConsole()} is called, every line is also echoed to a console stream so that
 * startup output is visible before the logging pipeline is running.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class RotatingLogSink implements AutoCloseable {
	@NonNull
	private static final DateTimeFormatter ROTATION_TIMESTAMP_FORMATTER;

	static {
		ROTATION_TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss", Locale.US);
	}

	@NonNull
	private final String name;
	@Nullable
	private final Path location;
	@NonNull
	private final Long maximumSizeInBytes;
	@NonNull
	private final Duration maximumAge;
	@NonNull
	private final Boolean deleteOnRotation;
	@NonNull
	private final Clock clock;
	@Nullable
	private final PrintStream console;
	@NonNull
	private final Consumer<LogEvent> rotationListener;
	@NonNull
	private final ReentrantLock lock;
	private volatile boolean mirroringToConsole;
	@Nullable
	private OutputStream outputStream;
	private long currentSizeInBytes;
	@Nullable
	private Instant openedAt;
	private boolean closed;

	/**
	 * Acquires a builder for a sink with the given stream name, e.g. {@code mainlog}.
	 *
	 * @param name the stream name, used in rotation messages
	 * @return the builder
	 */
	@NonNull
	public static Builder withName(@NonNull String name) {
		requireNonNull(name);
		return new Builder(name);
	}

	protected RotatingLogSink(@NonNull Builder builder) {
		requireNonNull(builder);

		this.name = builder.name;
		this.location = builder.location;
		this.maximumSizeInBytes = builder.maximumSizeInBytes != null ? builder.maximumSizeInBytes : 0L;
		this.maximumAge = builder.maximumAge != null ? builder.maximumAge : Duration.ZERO;
		this.deleteOnRotation = builder.deleteOnRotation != null ? builder.deleteOnRotation : false;
		this.clock = builder.clock != null ? builder.clock : Clock.systemDefaultZone();
		this.console = builder.console;
		this.rotationListener = builder.rotationListener != null ? builder.rotationListener : (logEvent) -> {};
		this.mirroringToConsole = builder.console != null;
		this.lock = new ReentrantLock();

		if (this.maximumSizeInBytes < 0)
			throw new IllegalArgumentException("Maximum log size must be >= 0");

		if (this.maximumAge.isNegative())
			throw new IllegalArgumentException("Maximum log age must be >= 0");
	}

	/**
	 * Appends a line (a trailing newline is added) to the log, rotating first if a limit has been reached.
	 *
	 * @param line the line to write
	 * @throws IOException if the file cannot be opened, rotated or written
	 */
	public void write(@NonNull String line) throws IOException {
		requireNonNull(line);

		byte[] bytes = (line + "\n").getBytes(StandardCharsets.UTF_8);

		getLock().lock();

		try {
			if (this.closed)
				throw new IOException(format("Log '%s' is closed", getName()));

			if (this.mirroringToConsole && getConsole().isPresent())
				getConsole().get().print(line + "\n");

			if (getLocation().isEmpty())
				return;

			if (this.outputStream == null)
				open();

			// A file left over from an earlier run may already be past its limits
			if (shouldRotate())
				rotate();

			this.outputStream.write(bytes);
			this.outputStream.flush();
			this.currentSizeInBytes += bytes.length;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Rotates the log regardless of size or age. No-op if nothing has been written yet.
	 *
	 * @throws IOException if the rotation fails
	 */
	public void rotate() throws IOException {
		getLock().lock();

		try {
			if (this.outputStream == null || getLocation().isEmpty())
				return;

			Path location = getLocation().get();
			long rotatedSize = this.currentSizeInBytes;

			this.outputStream.close();
			this.outputStream = null;

			String description;

			if (getDeleteOnRotation()) {
				Files.deleteIfExists(location);
				description = format("Rotated %s: deleted %s (%d bytes)", getName(), location, rotatedSize);
			} else {
				Path archive = archivePathFor(location);
				Files.move(location, archive);
				description = format("Rotated %s: %s -> %s (%d bytes)", getName(), location, archive, rotatedSize);
			}

			open();

			getRotationListener().accept(LogEvent.with(LogEventType.LOG_ROTATION, description).build());
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Stops echoing lines to the console; subsequent writes go to the file only.
	 */
	public void stopMirroringToConsole() {
		this.mirroringToConsole = false;
	}

	@Override
	public void close() throws IOException {
		getLock().lock();

		try {
			if (this.closed)
				return;

			this.closed = true;

			if (this.outputStream != null) {
				this.outputStream.close();
				this.outputStream = null;
			}
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Long getCurrentSizeInBytes() {
		getLock().lock();

		try {
			return this.currentSizeInBytes;
		} finally {
			getLock().unlock();
		}
	}

	private boolean shouldRotate() {
		if (getMaximumSizeInBytes() > 0 && this.currentSizeInBytes >= getMaximumSizeInBytes())
			return true;

		if (!getMaximumAge().isZero() && this.openedAt != null)
			return !Duration.between(this.openedAt, getClock().instant()).minus(getMaximumAge()).isNegative();

		return false;
	}

	private void open() throws IOException {
		Path location = getLocation().get();
		Path parent = location.toAbsolutePath().getParent();

		if (parent != null)
			Files.createDirectories(parent);

		if (Files.exists(location)) {
			BasicFileAttributes attributes = Files.readAttributes(location, BasicFileAttributes.class);
			this.currentSizeInBytes = attributes.size();
			this.openedAt = attributes.creationTime().toInstant();

			// Some filesystems report the epoch when creation time is unsupported
			if (this.openedAt.equals(Instant.EPOCH))
				this.openedAt = getClock().instant();
		} else {
			this.currentSizeInBytes = 0;
			this.openedAt = getClock().instant();
		}

		this.outputStream = new BufferedOutputStream(Files.newOutputStream(location,
				StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE));
	}

	@NonNull
	private Path archivePathFor(@NonNull Path location) {
		requireNonNull(location);

		String fileName = location.getFileName().toString();
		int dot = fileName.lastIndexOf('.');
		String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
		String timestamp = ROTATION_TIMESTAMP_FORMATTER.format(getClock().instant().atZone(ZoneId.systemDefault()));
		String suffix = Long.toHexString(ThreadLocalRandom.current().nextLong() & 0xFFFFFFFFL);

		return location.resolveSibling(format("%s.r_%s_%s.log", stem, timestamp, suffix));
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public Optional<Path> getLocation() {
		return Optional.ofNullable(this.location);
	}

	@NonNull
	public Long getMaximumSizeInBytes() {
		return this.maximumSizeInBytes;
	}

	@NonNull
	public Duration getMaximumAge() {
		return this.maximumAge;
	}

	@NonNull
	public Boolean getDeleteOnRotation() {
		return this.deleteOnRotation;
	}

	@NonNull
	private Clock getClock() {
		return this.clock;
	}

	@NonNull
	private Optional<PrintStream> getConsole() {
		return Optional.ofNullable(this.console);
	}

	@NonNull
	private Consumer<LogEvent> getRotationListener() {
		return this.rotationListener;
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	/**
	 * Builder used to construct instances of {@link RotatingLogSink}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String name;
		@Nullable
		private Path location;
		@Nullable
		private Long maximumSizeInBytes;
		@Nullable
		private Duration maximumAge;
		@Nullable
		private Boolean deleteOnRotation;
		@Nullable
		private Clock clock;
		@Nullable
		private PrintStream console;
		@Nullable
		private Consumer<LogEvent> rotationListener;

		protected Builder(@NonNull String name) {
			requireNonNull(name);
			this.name = name;
		}

		@NonNull
		public Builder location(@Nullable Path location) {
			this.location = location;
			return this;
		}

		/**
		 * Size in bytes at which the file rotates. {@code 0} disables size-based rotation.
		 */
		@NonNull
		public Builder maximumSizeInBytes(@Nullable Long maximumSizeInBytes) {
			this.maximumSizeInBytes = maximumSizeInBytes;
			return this;
		}

		/**
		 * Age at which the file rotates. {@link Duration#ZERO} disables age-based rotation.
		 */
		@NonNull
		public Builder maximumAge(@Nullable Duration maximumAge) {
			this.maximumAge = maximumAge;
			return this;
		}

		@NonNull
		public Builder deleteOnRotation(@Nullable Boolean deleteOnRotation) {
			this.deleteOnRotation = deleteOnRotation;
			return this;
		}

		@NonNull
		public Builder clock(@Nullable Clock clock) {
			this.clock = clock;
			return this;
		}

		@NonNull
		public Builder console(@Nullable PrintStream console) {
			this.console = console;
			return this;
		}

		@NonNull
		public Builder rotationListener(@Nullable Consumer<LogEvent> rotationListener) {
			this.rotationListener = rotationListener;
			return this;
		}

		@NonNull
		public RotatingLogSink build() {
			return new RotatingLogSink(this);
		}
	}
}
