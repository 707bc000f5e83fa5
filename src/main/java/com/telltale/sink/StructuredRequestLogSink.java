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

package com.telltale.sink;

import com.telltale.RequestLogEntry;
import com.telltale.RequestLogSink;
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LoggingEventBuilder;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Writes one INFO record per request through SLF4J, with the request data attached as key/value pairs so a JSON or
 * logfmt encoder can emit them as fields.
 * <p>
 * The record's message is {@code "<method> <uri> <protocol>"}. Fields come from three places, later ones winning
 * on name clashes: the context attached to the request via
 * {@link LogContext#attachToRequest(javax.servlet.http.HttpServletRequest, LogContext)}, the sink's {@link LogContext},
 * and the request fields
 * themselves ({@code tag}, {@code http.method}, {@code http.protocol}, {@code http.uri}, {@code http.path},
 * {@code http.host}, {@code http.status}, {@code http.bytes}, {@code dur}, {@code ts}, {@code http.ref},
 * {@code http.user}).
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class StructuredRequestLogSink implements RequestLogSink {
	@NonNull
	public static final String DEFAULT_LOGGER_NAME = "request.handler";
	@NonNull
	public static final String TAG = "request_handled";

	private static final double NANOS_PER_SECOND = Duration.ofSeconds(1).toNanos();

	@NonNull
	private final Logger logger;
	@NonNull
	private final LogContext logContext;
	@NonNull
	private final DateTimeFormatter timestampFormatter;

	public StructuredRequestLogSink(@NonNull Logger logger,
																	@NonNull LogContext logContext) {
		this(logger, logContext, ZoneId.systemDefault());
	}

	public StructuredRequestLogSink(@NonNull Logger logger,
																	@NonNull LogContext logContext,
																	@NonNull ZoneId zoneId) {
		this.logger = requireNonNull(logger);
		this.logContext = requireNonNull(logContext);
		this.timestampFormatter = DateTimeFormatter.ISO_OFFSET_DATE_TIME.withZone(requireNonNull(zoneId));
	}

	/**
	 * Vends a sink that writes to the {@value #DEFAULT_LOGGER_NAME} logger with the context
	 * {@code module=request.handler}.
	 *
	 * @return the sink
	 */
	@NonNull
	public static StructuredRequestLogSink withDefaults() {
		return new StructuredRequestLogSink(LoggerFactory.getLogger(DEFAULT_LOGGER_NAME),
				LogContext.empty().with("module", DEFAULT_LOGGER_NAME));
	}

	@Override
	public void log(@NonNull RequestLogEntry requestLogEntry) {
		requireNonNull(requestLogEntry);

		if (!getLogger().isInfoEnabled())
			return;

		LoggingEventBuilder loggingEventBuilder = getLogger().atInfo();

		for (Map.Entry<String, Object> field : fieldsFor(requestLogEntry).entrySet())
			loggingEventBuilder = loggingEventBuilder.addKeyValue(field.getKey(), field.getValue());

		loggingEventBuilder.log("{} {} {}", requestLogEntry.getMethod(), requestLogEntry.getUri(), requestLogEntry.getProtocol());
	}

	/**
	 * The complete set of fields for a request, context fields first.
	 *
	 * @param requestLogEntry the request data
	 * @return the fields, in emission order
	 */
	@NonNull
	protected Map<@NonNull String, @NonNull Object> fieldsFor(@NonNull RequestLogEntry requestLogEntry) {
		requireNonNull(requestLogEntry);

		Map<String, Object> fields = new LinkedHashMap<>(LogContext.forRequest(requestLogEntry.getHttpServletRequest()).getFields());
		fields.putAll(getLogContext().getFields());

		fields.put("tag", TAG);
		fields.put("http.method", requestLogEntry.getMethod());
		fields.put("http.protocol", requestLogEntry.getProtocol());
		fields.put("http.uri", requestLogEntry.getUri());
		fields.put("http.path", requestLogEntry.getPath());
		fields.put("http.host", requestLogEntry.getHost());
		fields.put("http.status", requestLogEntry.getStatus());
		fields.put("http.bytes", requestLogEntry.getBytes());
		fields.put("dur", durationInSeconds(requestLogEntry.getDuration()));
		fields.put("ts", getTimestampFormatter().format(requestLogEntry.getTimestamp()));
		fields.put("http.ref", requestLogEntry.getReferer());
		fields.put("http.user", requestLogEntry.getForwardedFor());

		return fields;
	}

	/**
	 * Converts a duration to fractional seconds.
	 *
	 * @param duration the duration
	 * @return the duration in seconds
	 */
	public static double durationInSeconds(@NonNull Duration duration) {
		requireNonNull(duration);
		return duration.toNanos() / NANOS_PER_SECOND;
	}

	@NonNull
	public Logger getLogger() {
		return this.logger;
	}

	@NonNull
	public LogContext getLogContext() {
		return this.logContext;
	}

	@NonNull
	protected DateTimeFormatter getTimestampFormatter() {
		return this.timestampFormatter;
	}
}
