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

import com.telltale.RequestLogSink;
import com.telltale.auth.ApiKeyFilter;
import com.telltale.auth.ApiKeyFinder;
import com.telltale.auth.AuthenticationErrorHandler;
import com.telltale.sink.CompositeRequestLogSink;
import com.telltale.sink.HealthdRequestLogSink;
import com.telltale.sink.LogContext;
import com.telltale.sink.StatsdRequestLogSink;
import com.telltale.sink.StructuredRequestLogSink;
import com.telltale.statsd.DatagramStatsdClient;
import com.telltale.statsd.NoOpStatsdClient;
import com.telltale.statsd.StatsdClient;
import com.telltale.util.PropertiesFileReader;
import org.jspecify.annotations.NonNull;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Middleware configuration read from a properties file.
 * <p>
 * Recognized keys:
 * <ul>
 * <li>{@code telltale.structured.enabled} (default {@code true}), {@code telltale.structured.logger}
 * (default {@code request.handler}), {@code telltale.structured.zone} (default system zone) and any number of
 * {@code telltale.structured.context.<field>=<value>}</li>
 * <li>{@code telltale.statsd.enabled} (default {@code false}), {@code telltale.statsd.host} (default
 * {@code 127.0.0.1}), {@code telltale.statsd.port} (default {@code 8125}), {@code telltale.statsd.namespace},
 * {@code telltale.statsd.tags} (comma separated)</li>
 * <li>{@code telltale.healthd.enabled} (default {@code false}), {@code telltale.healthd.logger} (default
 * {@code healthd})</li>
 * <li>{@code telltale.auth.provider}</li>
 * </ul>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class TelltaleConfiguration {
	@NonNull
	public static final String DEFAULT_STATSD_HOST = "127.0.0.1";
	public static final int DEFAULT_STATSD_PORT = 8125;

	@NonNull
	private static final String STRUCTURED_CONTEXT_PREFIX = "telltale.structured.context.";

	@NonNull
	private final PropertiesFileReader propertiesFileReader;

	public TelltaleConfiguration(@NonNull PropertiesFileReader propertiesFileReader) {
		this.propertiesFileReader = requireNonNull(propertiesFileReader);
	}

	@NonNull
	public static TelltaleConfiguration fromPropertiesFile(@NonNull Path propertiesFile) {
		requireNonNull(propertiesFile);
		return new TelltaleConfiguration(new PropertiesFileReader(propertiesFile));
	}

	/**
	 * Assembles every enabled sink into one.
	 *
	 * @param statsdClient the client used when statsd reporting is enabled, see {@link #createStatsdClient()}
	 * @return the sink
	 */
	@NonNull
	public RequestLogSink createRequestLogSink(@NonNull StatsdClient statsdClient) {
		requireNonNull(statsdClient);

		List<RequestLogSink> requestLogSinks = new ArrayList<>(3);

		if (isStructuredEnabled())
			requestLogSinks.add(new StructuredRequestLogSink(LoggerFactory.getLogger(getStructuredLoggerName()),
					getStructuredLogContext(), getStructuredZoneId()));

		if (isStatsdEnabled())
			requestLogSinks.add(new StatsdRequestLogSink(statsdClient));

		if (isHealthdEnabled())
			requestLogSinks.add(new HealthdRequestLogSink(LoggerFactory.getLogger(getHealthdLoggerName())));

		return new CompositeRequestLogSink(requestLogSinks);
	}

	/**
	 * A UDP statsd client if statsd reporting is enabled, otherwise a no-op client. The caller owns the client and
	 * should close it on shutdown when it is {@link AutoCloseable}.
	 *
	 * @return the client
	 */
	@NonNull
	public StatsdClient createStatsdClient() {
		if (!isStatsdEnabled())
			return NoOpStatsdClient.defaultInstance();

		return DatagramStatsdClient.withAddress(getStatsdHost(), getStatsdPort())
				.namespace(getStatsdNamespace())
				.constantTags(getStatsdTags())
				.build();
	}

	@NonNull
	public ApiKeyFilter createApiKeyFilter(@NonNull ApiKeyFinder apiKeyFinder,
																				 @NonNull AuthenticationErrorHandler authenticationErrorHandler) {
		requireNonNull(apiKeyFinder);
		requireNonNull(authenticationErrorHandler);

		String provider = getAuthProvider().orElseThrow(() ->
				new IllegalStateException(format("No API key provider configured, set '%s'", "telltale.auth.provider")));

		return new ApiKeyFilter(provider, apiKeyFinder, authenticationErrorHandler);
	}

	public boolean isStructuredEnabled() {
		return getPropertiesFileReader().optionalBooleanValueFor("telltale.structured.enabled").orElse(true);
	}

	@NonNull
	public String getStructuredLoggerName() {
		return getPropertiesFileReader().optionalValueFor("telltale.structured.logger")
				.orElse(StructuredRequestLogSink.DEFAULT_LOGGER_NAME);
	}

	@NonNull
	public ZoneId getStructuredZoneId() {
		Optional<String> zone = getPropertiesFileReader().optionalValueFor("telltale.structured.zone");

		if (zone.isEmpty())
			return ZoneId.systemDefault();

		try {
			return ZoneId.of(zone.get());
		} catch (RuntimeException e) {
			throw new IllegalArgumentException(format("Illegal zone '%s' for key '%s'", zone.get(), "telltale.structured.zone"), e);
		}
	}

	@NonNull
	public LogContext getStructuredLogContext() {
		Map<String, Object> fields = new LinkedHashMap<>(getPropertiesFileReader().valuesWithPrefix(STRUCTURED_CONTEXT_PREFIX));
		return LogContext.of(fields);
	}

	public boolean isStatsdEnabled() {
		return getPropertiesFileReader().optionalBooleanValueFor("telltale.statsd.enabled").orElse(false);
	}

	@NonNull
	public String getStatsdHost() {
		return getPropertiesFileReader().optionalValueFor("telltale.statsd.host").orElse(DEFAULT_STATSD_HOST);
	}

	public int getStatsdPort() {
		return getPropertiesFileReader().optionalIntegerValueFor("telltale.statsd.port").orElse(DEFAULT_STATSD_PORT);
	}

	@NonNull
	public String getStatsdNamespace() {
		return getPropertiesFileReader().optionalValueFor("telltale.statsd.namespace").orElse("");
	}

	@NonNull
	public List<@NonNull String> getStatsdTags() {
		return getPropertiesFileReader().listValueFor("telltale.statsd.tags");
	}

	public boolean isHealthdEnabled() {
		return getPropertiesFileReader().optionalBooleanValueFor("telltale.healthd.enabled").orElse(false);
	}

	@NonNull
	public String getHealthdLoggerName() {
		return getPropertiesFileReader().optionalValueFor("telltale.healthd.logger")
				.orElse(HealthdRequestLogSink.DEFAULT_LOGGER_NAME);
	}

	@NonNull
	public Optional<String> getAuthProvider() {
		return getPropertiesFileReader().optionalValueFor("telltale.auth.provider");
	}

	@NonNull
	protected PropertiesFileReader getPropertiesFileReader() {
		return this.propertiesFileReader;
	}
}
