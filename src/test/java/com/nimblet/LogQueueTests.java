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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class LogQueueTests {
	@Test
	public void drainsInFifoOrder() {
		LogQueue logQueue = new LogQueue(10);

		for (int i = 0; i < 5; ++i)
			Assertions.assertTrue(logQueue.enqueue(event("m" + i)));

		List<LogEntry> drained = new ArrayList<>();

		Assertions.assertEquals(5, logQueue.drainTo(drained));
		Assertions.assertEquals(List.of("m0", "m1", "m2", "m3", "m4"), drained.stream()
				.map((logEntry) -> ((LogEvent) logEntry).getMessage())
				.toList());
		Assertions.assertEquals(0, logQueue.size());
	}

	@Test
	public void fullQueueDropsNewestAndCounts() {
		LogQueue logQueue = new LogQueue(2);

		Assertions.assertTrue(logQueue.enqueue(event("a")));
		Assertions.assertTrue(logQueue.enqueue(event("b")));
		Assertions.assertFalse(logQueue.enqueue(event("c")));
		Assertions.assertFalse(logQueue.enqueue(event("d")));

		Assertions.assertEquals(2L, logQueue.getDropCount());

		List<LogEntry> drained = new ArrayList<>();
		logQueue.drainTo(drained);

		Assertions.assertEquals("a", ((LogEvent) drained.get(0)).getMessage());
		Assertions.assertEquals("b", ((LogEvent) drained.get(1)).getMessage());
		Assertions.assertTrue(logQueue.enqueue(event("e")));
		Assertions.assertEquals(2L, logQueue.getDropCount());
	}

	@Test
	public void acceptedPlusDroppedEqualsOffered() throws InterruptedException {
		LogQueue logQueue = new LogQueue(100);
		int producers = 8;
		int perProducer = 500;
		CountDownLatch done = new CountDownLatch(producers);
		ExecutorService executorService = Executors.newFixedThreadPool(producers);
		List<LogEntry> drained = new ArrayList<>();

		try {
			for (int p = 0; p < producers; ++p) {
				executorService.submit(() -> {
					for (int i = 0; i < perProducer; ++i)
						logQueue.enqueue(event("x"));

					done.countDown();
				});
			}

			Assertions.assertTrue(done.await(10, TimeUnit.SECONDS));
		} finally {
			executorService.shutdownNow();
		}

		logQueue.drainTo(drained);

		Assertions.assertEquals(producers * perProducer, drained.size() + logQueue.getDropCount());
	}

	@Test
	public void capacityMustBePositive() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> new LogQueue(0));
	}

	private static LogEvent event(String message) {
		return LogEvent.with(LogEventType.LIFECYCLE, message).build();
	}
}
