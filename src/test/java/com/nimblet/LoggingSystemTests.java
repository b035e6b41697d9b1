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

import com.nimblet.StatsCounters.Counts;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class LoggingSystemTests {
	@TempDir
	Path directory;

	@Test
	public void entriesAreRoutedToTheirSinks() throws IOException {
		LoggingSystem loggingSystem = loggingSystem(new LogQueue(100));

		loggingSystem.log(LogEvent.with(LogEventType.LIFECYCLE, "hello").build());
		loggingSystem.log(new RequestEvent(Instant.now(), "GET", "/echo", "a=1", "curl", null, 200, Duration.ofMillis(2)));
		loggingSystem.log(new StatsSnapshot(Instant.now(), Duration.ofSeconds(5), Duration.ofSeconds(5), emptyCounts(), emptyCounts()));

		Assertions.assertEquals(3, loggingSystem.drain());

		List<String> main = Files.readAllLines(this.directory.resolve("main.log"));
		List<String> request = Files.readAllLines(this.directory.resolve("request.log"));
		List<String> stats = Files.readAllLines(this.directory.resolve("stats.log"));

		Assertions.assertEquals(1, main.size());
		Assertions.assertTrue(main.get(0).endsWith("(INFO) [LIFECYCLE] hello"), main.get(0));
		Assertions.assertEquals(1, request.size());
		Assertions.assertTrue(request.get(0).contains("|GET|/echo|a=1|curl||"), request.get(0));
		Assertions.assertEquals(7, stats.size());
		Assertions.assertTrue(stats.get(0).startsWith("Statistics: ["));

		loggingSystem.shutdown();
	}

	@Test
	public void overflowIsReportedOnceOnMainSink() throws IOException {
		LoggingSystem loggingSystem = loggingSystem(new LogQueue(2));

		for (int i = 0; i < 5; ++i)
			loggingSystem.log(LogEvent.with(LogEventType.LIFECYCLE, "event " + i).build());

		Assertions.assertEquals(2, loggingSystem.drain());
		Assertions.assertEquals(0, loggingSystem.drain());

		List<String> main = Files.readAllLines(this.directory.resolve("main.log"));

		Assertions.assertEquals(3, main.size());
		Assertions.assertTrue(main.get(0).endsWith("event 0"), main.get(0));
		Assertions.assertTrue(main.get(1).endsWith("event 1"), main.get(1));
		Assertions.assertTrue(main.get(2).contains("[LOG_QUEUE_OVERFLOW]"), main.get(2));
		Assertions.assertTrue(main.get(2).contains("dropped 3 entries, 3 total"), main.get(2));

		loggingSystem.shutdown();
	}

	@Test
	public void consumerThreadDrainsPeriodically() throws Exception {
		LoggingSystem loggingSystem = loggingSystem(new LogQueue(100));
		Path main = this.directory.resolve("main.log");

		try {
			loggingSystem.start();
			loggingSystem.start();
			Assertions.assertTrue(loggingSystem.isStarted());

			loggingSystem.log(LogEvent.with(LogEventType.LIFECYCLE, "background").build());

			TestSupport.waitFor(() -> {
				try {
					return Files.exists(main) && Files.readString(main).contains("background");
				} catch (IOException e) {
					throw new RuntimeException(e);
				}
			}, Duration.ofSeconds(5));
		} finally {
			loggingSystem.shutdown();
		}
	}

	@Test
	public void shutdownDrainsAndIsTerminal() throws IOException {
		LoggingSystem loggingSystem = loggingSystem(new LogQueue(100));
		loggingSystem.start();
		loggingSystem.log(LogEvent.with(LogEventType.LIFECYCLE, "last words").build());

		loggingSystem.shutdown();
		loggingSystem.shutdown();

		Assertions.assertTrue(Files.readString(this.directory.resolve("main.log")).contains("last words"));
		Assertions.assertFalse(loggingSystem.isStarted());
		Assertions.assertThrows(IllegalStateException.class, loggingSystem::start);
	}

	@Test
	public void logImmediatelyBypassesQueue() throws IOException {
		LoggingSystem loggingSystem = loggingSystem(new LogQueue(100));

		loggingSystem.logImmediately(LogEvent.with(LogEventType.CONFIGURATION, "thread_pool_size=4").build());

		Assertions.assertEquals(0, loggingSystem.getLogQueue().size());
		Assertions.assertTrue(Files.readString(this.directory.resolve("main.log")).contains("[CONFIGURATION] thread_pool_size=4"));

		loggingSystem.shutdown();
	}

	@Test
	public void requestLineFormat() {
		RequestEvent requestEvent = new RequestEvent(Instant.now(), "GET", "/echo", "a=1", "curl/8", "http://ref", 200,
				Duration.ofNanos(1_500_000));

		String line = LoggingSystem.formatRequestEvent(requestEvent);

		Assertions.assertTrue(line.startsWith("["));
		Assertions.assertTrue(line.endsWith("]|GET|/echo|a=1|curl/8|http://ref|1.500"), line);
	}

	@Test
	public void requestLineWithoutOptionalFields() {
		RequestEvent requestEvent = new RequestEvent(Instant.now(), "HEAD", "/", null, null, null, 404, Duration.ZERO);

		Assertions.assertTrue(LoggingSystem.formatRequestEvent(requestEvent).endsWith("]|HEAD|/||||0.000"));
	}

	@Test
	public void mainLineIncludesUriAndStackTrace() {
		LogEvent logEvent = LogEvent.with(LogEventType.HANDLER_FAULT, "Handler 'x' failed")
				.uri("/x")
				.throwable(new IllegalStateException("boom"))
				.build();

		String line = LoggingSystem.formatLogEvent(logEvent);

		Assertions.assertTrue(line.contains("(ERROR) [HANDLER_FAULT] Handler 'x' failed (uri=/x)"), line);
		Assertions.assertTrue(line.contains("java.lang.IllegalStateException: boom"), line);
	}

	@Test
	public void statsBlockLayout() {
		Counts cumulative = new Counts(20, 2, 5, 1, 1, 20, 20_000_000L, 4_000_000L);
		Counts windowed = new Counts(10, 2, 3, 0, 1, 10, 10_000_000L, 4_000_000L);

		String[] lines = LoggingSystem.formatStatsSnapshot(new StatsSnapshot(Instant.now(), Duration.ofSeconds(20),
				Duration.ofSeconds(10), cumulative, windowed)).split("\n");

		Assertions.assertEquals(7, lines.length);
		Assertions.assertTrue(lines[0].contains("uptime=20s window=10000ms"), lines[0]);
		Assertions.assertTrue(lines[1].matches("-+"));
		Assertions.assertTrue(lines[2].startsWith("SCOPE"));
		Assertions.assertTrue(lines[4].startsWith("ALL_TIME"));
		Assertions.assertTrue(lines[5].startsWith("WINDOW"));
		Assertions.assertEquals(List.of("WINDOW", "10", "2", "3", "1.00", "0", "1", "1.000", "4.000"),
				List.of(lines[5].split("\\|")).stream().map(String::trim).toList());
	}

	private LoggingSystem loggingSystem(LogQueue logQueue) {
		return LoggingSystem.withSinks(
						RotatingLogSink.withName("mainlog").location(this.directory.resolve("main.log")).build(),
						RotatingLogSink.withName("requestlog").location(this.directory.resolve("request.log")).build(),
						RotatingLogSink.withName("statslog").location(this.directory.resolve("stats.log")).build())
				.logQueue(logQueue)
				.flushInterval(Duration.ofMillis(20))
				.build();
	}

	private static Counts emptyCounts() {
		return new Counts(0, 0, 0, 0, 0, 0, 0, 0);
	}
}
