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

import javax.annotation.concurrent.ThreadSafe;
import java.time.Instant;
import java.util.Locale;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Writes one line per request in the AWS Elastic Beanstalk enhanced health ("healthd") format:
 * <pre>{@code <msec>"<uri>"<status>"<request_time>"<upstream_response_time>"<x_forwarded_for>}</pre>
 * e.g. {@code 1462886755.123"/widgets"200"0.302"0.302"10.0.0.1}.
 * <p>
 * {@code msec} is the completion time in epoch seconds with millisecond precision and both times are the request
 * duration in seconds. The uri is the normalized path. Lines go to an SLF4J logger (default {@value #DEFAULT_LOGGER_NAME})
 * which should be routed to an hourly file under {@code /var/log/nginx/healthd/} for the healthd agent to pick up.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class HealthdRequestLogSink implements RequestLogSink {
	@NonNull
	public static final String DEFAULT_LOGGER_NAME = "healthd";

	@NonNull
	private final Logger logger;

	public HealthdRequestLogSink() {
		this(LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	public HealthdRequestLogSink(@NonNull Logger logger) {
		this.logger = requireNonNull(logger);
	}

	@Override
	public void log(@NonNull RequestLogEntry requestLogEntry) {
		requireNonNull(requestLogEntry);

		if (getLogger().isInfoEnabled())
			getLogger().info(formatLine(requestLogEntry));
	}

	@NonNull
	public String formatLine(@NonNull RequestLogEntry requestLogEntry) {
		requireNonNull(requestLogEntry);

		Instant completedAt = requestLogEntry.getTimestamp().plus(requestLogEntry.getDuration());
		double durationInSeconds = StructuredRequestLogSink.durationInSeconds(requestLogEntry.getDuration());

		return format(Locale.ROOT, "%d.%03d\"%s\"%d\"%.3f\"%.3f\"%s",
				completedAt.getEpochSecond(),
				completedAt.getNano() / 1_000_000,
				requestLogEntry.getPath(),
				requestLogEntry.getStatus(),
				durationInSeconds,
				durationInSeconds,
				requestLogEntry.getForwardedFor());
	}

	@NonNull
	public Logger getLogger() {
		return this.logger;
	}
}
