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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import javax.servlet.http.HttpServletRequest;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An immutable set of ambient fields added to every structured log record, e.g. {@code module=request.handler}.
 * <p>
 * A context can be supplied when constructing a {@link StructuredRequestLogSink}, and filters earlier in the chain
 * can attach additional per-request fields via {@link #attachToRequest(HttpServletRequest, LogContext)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class LogContext {
	@NonNull
	public static final String REQUEST_ATTRIBUTE_NAME = LogContext.class.getName();

	@NonNull
	private static final LogContext EMPTY_INSTANCE;

	static {
		EMPTY_INSTANCE = new LogContext(Map.of());
	}

	@NonNull
	private final Map<@NonNull String, @NonNull Object> fields;

	private LogContext(@NonNull Map<@NonNull String, @NonNull Object> fields) {
		requireNonNull(fields);
		this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
	}

	@NonNull
	public static LogContext empty() {
		return EMPTY_INSTANCE;
	}

	@NonNull
	public static LogContext of(@NonNull Map<@NonNull String, @NonNull Object> fields) {
		requireNonNull(fields);
		return empty().with(fields);
	}

	/**
	 * Vends a new context with {@code fields} added, replacing any existing fields of the same name.
	 *
	 * @param fields the fields to add
	 * @return the new context
	 */
	@NonNull
	public LogContext with(@NonNull Map<@NonNull String, @NonNull Object> fields) {
		requireNonNull(fields);

		if (fields.isEmpty())
			return this;

		Map<String, Object> mergedFields = new LinkedHashMap<>(getFields());

		for (Map.Entry<String, Object> entry : fields.entrySet())
			mergedFields.put(requireNonNull(entry.getKey()), requireNonNull(entry.getValue(),
					format("Value for log context field '%s' must not be null", entry.getKey())));

		return new LogContext(mergedFields);
	}

	@NonNull
	public LogContext with(@NonNull String name,
												 @NonNull Object value) {
		requireNonNull(name);
		requireNonNull(value);

		return with(Map.of(name, value));
	}

	@NonNull
	public LogContext with(@NonNull LogContext logContext) {
		requireNonNull(logContext);
		return with(logContext.getFields());
	}

	/**
	 * The context attached to {@code httpServletRequest}, or an empty context if none was attached.
	 *
	 * @param httpServletRequest the request
	 * @return the request's context
	 */
	@NonNull
	public static LogContext forRequest(@NonNull HttpServletRequest httpServletRequest) {
		requireNonNull(httpServletRequest);

		Object attribute = httpServletRequest.getAttribute(REQUEST_ATTRIBUTE_NAME);
		return attribute instanceof LogContext logContext ? logContext : empty();
	}

	/**
	 * Merges {@code logContext} into whatever context is already attached to the request.
	 *
	 * @param httpServletRequest the request
	 * @param logContext         fields to add
	 * @return the context now attached to the request
	 */
	@NonNull
	public static LogContext attachToRequest(@NonNull HttpServletRequest httpServletRequest,
																					 @NonNull LogContext logContext) {
		requireNonNull(httpServletRequest);
		requireNonNull(logContext);

		LogContext mergedLogContext = forRequest(httpServletRequest).with(logContext);
		httpServletRequest.setAttribute(REQUEST_ATTRIBUTE_NAME, mergedLogContext);
		return mergedLogContext;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{fields=%s}", getClass().getSimpleName(), getFields());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof LogContext logContext))
			return false;

		return Objects.equals(getFields(), logContext.getFields());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getFields());
	}

	@NonNull
	public Map<@NonNull String, @NonNull Object> getFields() {
		return this.fields;
	}
}
