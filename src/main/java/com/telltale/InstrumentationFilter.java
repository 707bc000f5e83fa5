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

package com.telltale;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import javax.inject.Inject;
import javax.inject.Singleton;
import javax.servlet.Filter;
import javax.servlet.FilterChain;
import javax.servlet.FilterConfig;
import javax.servlet.ServletException;
import javax.servlet.ServletRequest;
import javax.servlet.ServletResponse;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.logging.Logger;

import static com.telltale.util.FormatUtils.httpServletRequestDescription;
import static com.telltale.util.FormatUtils.stackTraceForThrowable;
import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;

/**
 * Times every request passing through the filter chain and hands the result to a {@link RequestLogSink}.
 * <p>
 * The response is wrapped in a {@link CapturingHttpServletResponse} so the sink sees the status and byte count the
 * client received. The sink is invoked exactly once per request, after the chain returns.
 * <p>
 * If the chain throws, the sink still fires and the exception is rethrown unchanged. When the response had not been
 * committed at that point the container will answer with a 500, so that is the status reported to the sink.
 * <p>
 * Usage:
 * <pre>{@code RequestLogSink sink = new CompositeRequestLogSink(
 *   StructuredRequestLogSink.withDefaults(),
 *   new StatsdRequestLogSink(statsdClient));
 *
 * servletContext.addFilter("instrumentation", new InstrumentationFilter(sink))
 *   .addMappingForUrlPatterns(null, false, "/*");}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Singleton
@ThreadSafe
public class InstrumentationFilter implements Filter {
	@NonNull
	private final RequestLogSink requestLogSink;
	@NonNull
	private final Clock clock;
	@NonNull
	private final Logger logger = Logger.getLogger(InstrumentationFilter.class.getName());

	@Inject
	public InstrumentationFilter(@NonNull RequestLogSink requestLogSink) {
		this(requestLogSink, Clock.systemUTC());
	}

	public InstrumentationFilter(@NonNull RequestLogSink requestLogSink,
															 @NonNull Clock clock) {
		this.requestLogSink = requireNonNull(requestLogSink);
		this.clock = requireNonNull(clock);
	}

	@Override
	public void init(FilterConfig filterConfig) throws ServletException {}

	@Override
	public void destroy() {}

	@Override
	public void doFilter(ServletRequest servletRequest, ServletResponse servletResponse, FilterChain filterChain)
			throws IOException, ServletException {
		if (!(servletRequest instanceof HttpServletRequest httpServletRequest)
				|| !(servletResponse instanceof HttpServletResponse httpServletResponse)) {
			filterChain.doFilter(servletRequest, servletResponse);
			return;
		}

		Instant timestamp = getClock().instant();
		long time = nanoTime();

		// Capture before the chain runs, later filters may wrap or forward the request
		RequestTarget requestTarget = RequestTarget.fromRequest(httpServletRequest);
		String uri = RequestUris.uri(httpServletRequest, requestTarget);
		String path = RequestUris.path(httpServletRequest, requestTarget);

		CapturingHttpServletResponse capturingHttpServletResponse = createCapturingResponse(httpServletResponse);
		Throwable throwable = null;

		try {
			filterChain.doFilter(httpServletRequest, capturingHttpServletResponse);
		} catch (IOException | ServletException | RuntimeException | Error e) {
			throwable = e;
			throw e;
		} finally {
			Duration duration = Duration.ofNanos(nanoTime() - time);
			int status = capturingHttpServletResponse.getCapturedStatus();

			if (throwable != null && !capturingHttpServletResponse.isStatusFinal() && !httpServletResponse.isCommitted())
				status = HttpServletResponse.SC_INTERNAL_SERVER_ERROR;

			RequestLogEntry requestLogEntry = RequestLogEntry.with(httpServletRequest, capturingHttpServletResponse, requestTarget)
					.uri(uri)
					.path(path)
					.timestamp(timestamp)
					.duration(duration)
					.status(status)
					.bytes(capturingHttpServletResponse.getBytesWritten())
					.throwable(throwable)
					.build();

			logRequestEnd(httpServletRequest, duration);
			logRequest(requestLogEntry);
		}
	}

	@NonNull
	protected CapturingHttpServletResponse createCapturingResponse(@NonNull HttpServletResponse httpServletResponse) {
		requireNonNull(httpServletResponse);
		return new CapturingHttpServletResponse(httpServletResponse);
	}

	protected void logRequest(@NonNull RequestLogEntry requestLogEntry) {
		requireNonNull(requestLogEntry);

		try {
			getRequestLogSink().log(requestLogEntry);
		} catch (RuntimeException e) {
			logger.warning(format("Unable to log %s, continuing on...\n%s",
					httpServletRequestDescription(requestLogEntry.getHttpServletRequest()), stackTraceForThrowable(e)));
		}
	}

	protected void logRequestEnd(@NonNull HttpServletRequest httpServletRequest,
															 @Nullable Duration duration) {
		if (duration != null && logger.isLoggable(FINE))
			logger.fine(format("Took %.2fms to handle %s", duration.toNanos() / 1_000_000f,
					httpServletRequestDescription(httpServletRequest)));
	}

	@NonNull
	public RequestLogSink getRequestLogSink() {
		return this.requestLogSink;
	}

	@NonNull
	protected Clock getClock() {
		return this.clock;
	}
}
