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

package com.telltale.util;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import javax.servlet.http.HttpServletRequest;
import java.io.PrintWriter;
import java.io.StringWriter;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Formatting helpers for diagnostic log messages.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class FormatUtils {
	private FormatUtils() {
		// Non-instantiable
	}

	/**
	 * A short human-readable description of a request, e.g. {@code GET /widgets?color=red}.
	 *
	 * @param httpServletRequest the request to describe
	 * @return the description
	 */
	@NonNull
	public static String httpServletRequestDescription(@NonNull HttpServletRequest httpServletRequest) {
		requireNonNull(httpServletRequest);

		String queryString = httpServletRequest.getQueryString();
		return format("%s %s%s", httpServletRequest.getMethod(), httpServletRequest.getRequestURI(),
				queryString == null || queryString.length() == 0 ? "" : "?" + queryString);
	}

	@NonNull
	public static String stackTraceForThrowable(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		StringWriter stringWriter = new StringWriter();

		try (PrintWriter printWriter = new PrintWriter(stringWriter)) {
			throwable.printStackTrace(printWriter);
		}

		return stringWriter.toString().trim();
	}
}
