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

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.logging.Logger;

import static com.telltale.util.FormatUtils.stackTraceForThrowable;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Fans a request out to several sinks in order. A failing sink is logged and skipped so the others still run.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class CompositeRequestLogSink implements RequestLogSink {
	@NonNull
	private final List<@NonNull RequestLogSink> requestLogSinks;
	@NonNull
	private final Logger logger = Logger.getLogger(CompositeRequestLogSink.class.getName());

	public CompositeRequestLogSink(@NonNull RequestLogSink... requestLogSinks) {
		this(List.of(requireNonNull(requestLogSinks)));
	}

	public CompositeRequestLogSink(@NonNull List<@NonNull RequestLogSink> requestLogSinks) {
		this.requestLogSinks = List.copyOf(requireNonNull(requestLogSinks));
	}

	@Override
	public void log(@NonNull RequestLogEntry requestLogEntry) {
		requireNonNull(requestLogEntry);

		for (RequestLogSink requestLogSink : getRequestLogSinks()) {
			try {
				requestLogSink.log(requestLogEntry);
			} catch (RuntimeException e) {
				logger.warning(format("%s failed for %s, continuing on...\n%s", requestLogSink.getClass().getSimpleName(),
						requestLogEntry, stackTraceForThrowable(e)));
			}
		}
	}

	@NonNull
	public List<@NonNull RequestLogSink> getRequestLogSinks() {
		return this.requestLogSinks;
	}
}
