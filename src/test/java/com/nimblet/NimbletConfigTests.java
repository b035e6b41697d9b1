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
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class NimbletConfigTests {
	@TempDir
	Path directory;

	@Test
	public void defaults() {
		NimbletConfig config = NimbletConfig.withHandlerRegistry(HandlerRegistry.builder().build())
				.rootDirectory(this.directory)
				.build();

		Path root = this.directory.toAbsolutePath().normalize();

		Assertions.assertEquals(root.resolve("www"), config.getWebroot());
		Assertions.assertEquals("0.0.0.0", config.getHost());
		Assertions.assertEquals(8080, config.getPort());
		Assertions.assertEquals(root.resolve("logs/mainlog.log"), config.getMainLog().getLocation().orElse(null));
		Assertions.assertEquals(root.resolve("logs/requestlog.log"), config.getRequestLog().getLocation().orElse(null));
		Assertions.assertEquals(Duration.ofSeconds(10), config.getStatsFrequency());
		Assertions.assertEquals(10_000, config.getMaximumLogQueueSize());
		Assertions.assertEquals(Duration.ofMinutes(30), config.getSessionTimeout());
		Assertions.assertEquals(".rsp", config.getRspExtension());
		Assertions.assertEquals("Nimblet/" + Nimblet.VERSION, config.getServerName());
		Assertions.assertFalse(config.getRspCacheEnabled());
		Assertions.assertTrue(config.getTlsCertificate().isEmpty());
	}

	@Test
	public void propertiesFileIsLoadedRelativeToItsDirectory() throws IOException {
		Path propertiesFile = this.directory.resolve("nimblet.properties");
		Files.writeString(propertiesFile, String.join("\n",
				"webroot=site",
				"bind_address=127.0.0.1:9090",
				"thread_pool_size=4",
				"mainlog.location=var/main.log",
				"mainlog.max_size=2048",
				"mainlog.max_age=PT1H",
				"requestlog.delete_rotation=true",
				"stats_frequency=PT5S",
				"max_log_queue=500",
				"log_flush_interval=250",
				"session_timeout=PT10M",
				"idle_timeout=1500",
				"rsp_extension=.page",
				"rsp_cache_enabled=TRUE",
				"tls_certificate=certs/server.pem"), StandardCharsets.UTF_8);

		NimbletConfig config = NimbletConfig.fromProperties(propertiesFile, HandlerRegistry.builder().build()).build();
		Path root = this.directory.toAbsolutePath().normalize();

		Assertions.assertEquals(root, config.getRootDirectory());
		Assertions.assertEquals(root.resolve("site"), config.getWebroot());
		Assertions.assertEquals("127.0.0.1", config.getHost());
		Assertions.assertEquals(9090, config.getPort());
		Assertions.assertEquals(4, config.getThreadPoolSize());
		Assertions.assertEquals(root.resolve("var/main.log"), config.getMainLog().getLocation().orElse(null));
		Assertions.assertEquals(2048L, config.getMainLog().getMaximumSizeInBytes());
		Assertions.assertEquals(Duration.ofHours(1), config.getMainLog().getMaximumAge());
		Assertions.assertTrue(config.getRequestLog().getDeleteOnRotation());
		Assertions.assertEquals(Duration.ofSeconds(5), config.getStatsFrequency());
		Assertions.assertEquals(500, config.getMaximumLogQueueSize());
		Assertions.assertEquals(Duration.ofMillis(250), config.getLogFlushInterval());
		Assertions.assertEquals(Duration.ofMinutes(10), config.getSessionTimeout());
		Assertions.assertEquals(Duration.ofMillis(1500), config.getIdleTimeout());
		Assertions.assertEquals(".page", config.getRspExtension());
		Assertions.assertTrue(config.getRspCacheEnabled());
		Assertions.assertEquals(root.resolve("certs/server.pem"), config.getTlsCertificate().orElse(null));
	}

	@Test
	public void explicitRootDirectoryWins() {
		Properties properties = new Properties();
		properties.setProperty("root_dir", this.directory.resolve("app").toString());

		NimbletConfig config = NimbletConfig.fromProperties(properties, Path.of("/elsewhere"), HandlerRegistry.builder().build()).build();

		Assertions.assertEquals(this.directory.resolve("app").toAbsolutePath().normalize(), config.getRootDirectory());
		Assertions.assertEquals(config.getRootDirectory().resolve("www"), config.getWebroot());
	}

	@Test
	public void invalidValuesAreRejected() {
		for (Map.Entry<String, String> invalid : Map.of(
				"thread_pool_size", "many",
				"idle_timeout", "soon",
				"rsp_cache_enabled", "yes",
				"bind_address", "localhost",
				"max_log_queue", "0").entrySet()) {
			Properties properties = new Properties();
			properties.setProperty(invalid.getKey(), invalid.getValue());

			Assertions.assertThrows(IllegalArgumentException.class,
					() -> NimbletConfig.fromProperties(properties, this.directory, HandlerRegistry.builder().build()).build(),
					invalid.getKey());
		}
	}

	@Test
	public void subMillisecondStatsFrequencyIsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> NimbletConfig.withHandlerRegistry(HandlerRegistry.builder().build())
						.rootDirectory(this.directory)
						.statsFrequency(Duration.ofNanos(999_999))
						.build());
	}

	@Test
	public void illegalPortIsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> NimbletConfig.withHandlerRegistry(HandlerRegistry.builder().build()).port(70_000).build());
	}

	@Test
	public void describeListsEveryKeyInOrder() {
		NimbletConfig config = NimbletConfig.withHandlerRegistry(HandlerRegistry.builder().build())
				.rootDirectory(this.directory)
				.bindAddress("127.0.0.1:0")
				.build();

		Map<String, String> description = config.describe();
		List<String> keys = List.copyOf(description.keySet());

		Assertions.assertEquals("root_dir", keys.get(0));
		Assertions.assertEquals("127.0.0.1:0", description.get("bind_address"));
		Assertions.assertEquals("(none)", description.get("tls_certificate"));
		Assertions.assertTrue(keys.containsAll(List.of("mainlog.location", "requestlog.max_size", "statslog.delete_rotation",
				"session_sweep_interval", "rsp_cache_enabled")));
	}
}
