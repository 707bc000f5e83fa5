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
import com.telltale.statsd.StatsdClient;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Reports a {@code request.response_time} timing and a {@code request.count} counter for every request.
 * <p>
 * Both metrics are tagged {@code endpoint:<path>}, {@code statusCode:<status>} and {@code method:<method>}. The
 * endpoint is the normalized path, never the full uri, so query strings cannot blow up tag cardinality.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class StatsdRequestLogSink implements RequestLogSink {
	@NonNull
	public static final String RESPONSE_TIME_METRIC_NAME = "request.response_time";
	@NonNull
	public static final String COUNT_METRIC_NAME = "request.count";

	private static final double NANOS_PER_MILLISECOND = Duration.ofMillis(1).toNanos();

	@NonNull
	private final StatsdClient statsdClient;

	public StatsdRequestLogSink(@NonNull StatsdClient statsdClient) {
		this.statsdClient = requireNonNull(statsdClient);
	}

	@Override
	public void log(@NonNull RequestLogEntry requestLogEntry) {
		requireNonNull(requestLogEntry);

		List<String> tags = tagsFor(requestLogEntry);

		getStatsdClient().timing(RESPONSE_TIME_METRIC_NAME, durationInMilliseconds(requestLogEntry.getDuration()), tags);
		getStatsdClient().count(COUNT_METRIC_NAME, 1, tags);
	}

	@NonNull
	protected List<@NonNull String> tagsFor(@NonNull RequestLogEntry requestLogEntry) {
		requireNonNull(requestLogEntry);

		return List.of(
				format("endpoint:%s", requestLogEntry.getPath()),
				format("statusCode:%d", requestLogEntry.getStatus()),
				format("method:%s", requestLogEntry.getMethod())
		);
	}

	public static double durationInMilliseconds(@NonNull Duration duration) {
		requireNonNull(duration);
		return duration.toNanos() / NANOS_PER_MILLISECOND;
	}

	@NonNull
	public StatsdClient getStatsdClient() {
		return this.statsdClient;
	}
}
