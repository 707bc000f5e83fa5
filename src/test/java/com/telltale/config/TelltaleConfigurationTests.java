/*
 * Copyright 2022-2026 Revetware LLC.
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

package com.telltale.config;

import com.telltale.auth.ApiKeyFilter;
import com.telltale.auth.DefaultAuthenticationErrorHandler;
import com.telltale.sink.CompositeRequestLogSink;
import com.telltale.sink.HealthdRequestLogSink;
import com.telltale.sink.StatsdRequestLogSink;
import com.telltale.sink.StructuredRequestLogSink;
import com.telltale.statsd.DatagramStatsdClient;
import com.telltale.statsd.NoOpStatsdClient;
import com.telltale.statsd.StatsdClient;
import com.telltale.util.PropertiesFileReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class TelltaleConfigurationTests {
	@Test
	public void defaults() {
		TelltaleConfiguration configuration = new TelltaleConfiguration(new PropertiesFileReader(Map.of()));

		assertTrue(configuration.isStructuredEnabled());
		assertEquals("request.handler", configuration.getStructuredLoggerName());
		assertEquals(ZoneId.systemDefault(), configuration.getStructuredZoneId());
		assertTrue(configuration.getStructuredLogContext().getFields().isEmpty());
		assertFalse(configuration.isStatsdEnabled());
		assertEquals("127.0.0.1", configuration.getStatsdHost());
		assertEquals(8125, configuration.getStatsdPort());
		assertEquals("", configuration.getStatsdNamespace());
		assertEquals(List.of(), configuration.getStatsdTags());
		assertFalse(configuration.isHealthdEnabled());
		assertEquals("healthd", configuration.getHealthdLoggerName());
		assertTrue(configuration.getAuthProvider().isEmpty());
		assertSame(NoOpStatsdClient.defaultInstance(), configuration.createStatsdClient());

		CompositeRequestLogSink sink = (CompositeRequestLogSink) configuration.createRequestLogSink(NoOpStatsdClient.defaultInstance());

		assertEquals(1, sink.getRequestLogSinks().size());
		assertInstanceOf(StructuredRequestLogSink.class, sink.getRequestLogSinks().get(0));
	}

	@Test
	public void fromPropertiesFile(@TempDir Path tempDirectory) throws IOException {
		Path propertiesFile = tempDirectory.resolve("telltale.properties");
		Files.writeString(propertiesFile, String.join("\n",
				"telltale.structured.enabled=false",
				"telltale.structured.zone=UTC",
				"telltale.structured.context.module=request.handler",
				"telltale.structured.context.env=prod",
				"telltale.statsd.enabled=true",
				"telltale.statsd.port=9125",
				"telltale.statsd.namespace=service.logging.live.",
				"telltale.statsd.tags=test, env:prod",
				"telltale.healthd.enabled=true",
				"telltale.auth.provider=Graze"), UTF_8);

		TelltaleConfiguration configuration = TelltaleConfiguration.fromPropertiesFile(propertiesFile);

		assertFalse(configuration.isStructuredEnabled());
		assertEquals(ZoneId.of("UTC"), configuration.getStructuredZoneId());
		assertEquals(Map.of("module", "request.handler", "env", "prod"), configuration.getStructuredLogContext().getFields());
		assertEquals("service.logging.live.", configuration.getStatsdNamespace());
		assertEquals(List.of("test", "env:prod"), configuration.getStatsdTags());

		StatsdClient statsdClient = configuration.createStatsdClient();

		try {
			DatagramStatsdClient datagramStatsdClient = assertInstanceOf(DatagramStatsdClient.class, statsdClient);
			assertEquals(9125, datagramStatsdClient.getAddress().getPort());
			assertEquals(List.of("test", "env:prod"), datagramStatsdClient.getConstantTags());

			CompositeRequestLogSink sink = (CompositeRequestLogSink) configuration.createRequestLogSink(statsdClient);

			assertEquals(2, sink.getRequestLogSinks().size());
			assertInstanceOf(StatsdRequestLogSink.class, sink.getRequestLogSinks().get(0));
			assertInstanceOf(HealthdRequestLogSink.class, sink.getRequestLogSinks().get(1));
		} finally {
			((DatagramStatsdClient) statsdClient).close();
		}

		ApiKeyFilter apiKeyFilter = configuration.createApiKeyFilter((apiKey, httpServletRequest) -> "user",
				DefaultAuthenticationErrorHandler.defaultInstance());
		assertEquals("Graze", apiKeyFilter.getProvider());
	}

	@Test
	public void apiKeyFilterRequiresProvider() {
		TelltaleConfiguration configuration = new TelltaleConfiguration(new PropertiesFileReader(Map.of()));

		assertThrows(IllegalStateException.class, () -> configuration.createApiKeyFilter((apiKey, httpServletRequest) -> "user",
				DefaultAuthenticationErrorHandler.defaultInstance()));
	}

	@Test
	public void illegalValuesRejected() {
		assertThrows(IllegalArgumentException.class, () ->
				new TelltaleConfiguration(new PropertiesFileReader(Map.of("telltale.structured.zone", "Mars/Olympus"))).getStructuredZoneId());
		assertThrows(IllegalArgumentException.class, () ->
				new TelltaleConfiguration(new PropertiesFileReader(Map.of("telltale.statsd.enabled", "yes"))).isStatsdEnabled());
		assertThrows(IllegalArgumentException.class, () ->
				new TelltaleConfiguration(new PropertiesFileReader(Map.of("telltale.statsd.port", "eighty"))).getStatsdPort());
	}
}
