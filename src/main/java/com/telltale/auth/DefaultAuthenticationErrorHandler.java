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

package com.telltale.auth;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.OutputStream;
import java.util.logging.Logger;

import static com.telltale.util.FormatUtils.httpServletRequestDescription;
import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;

/**
 * Responds with the given status and a short {@code text/plain} explanation.
 * <p>
 * For {@link ApiKeyAuthenticationException.InvalidKey} the finder's failure is logged at {@code FINE} but not sent to
 * the client.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class DefaultAuthenticationErrorHandler implements AuthenticationErrorHandler {
	@NonNull
	private static final DefaultAuthenticationErrorHandler DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new DefaultAuthenticationErrorHandler();
	}

	@NonNull
	private final Logger logger = Logger.getLogger(DefaultAuthenticationErrorHandler.class.getName());

	@NonNull
	public static DefaultAuthenticationErrorHandler defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	@Override
	public void handle(@NonNull HttpServletRequest httpServletRequest,
										 @NonNull HttpServletResponse httpServletResponse,
										 @NonNull ApiKeyAuthenticationException error,
										 int statusCode) throws IOException {
		requireNonNull(httpServletRequest);
		requireNonNull(httpServletResponse);
		requireNonNull(error);

		if (logger.isLoggable(FINE))
			logger.log(FINE, format("Rejected %s: %s", httpServletRequestDescription(httpServletRequest), error.getMessage()), error);

		httpServletResponse.setStatus(statusCode);
		httpServletResponse.setContentType("text/plain;charset=UTF-8");

		try (OutputStream outputStream = httpServletResponse.getOutputStream()) {
			outputStream.write(responseBodyFor(error).getBytes(UTF_8));
		}
	}

	@NonNull
	protected String responseBodyFor(@NonNull ApiKeyAuthenticationException error) {
		requireNonNull(error);

		if (error instanceof ApiKeyAuthenticationException.InvalidKey invalidKey)
			return format("provided api key: '%s' is not valid", invalidKey.getKey());

		return error.getMessage();
	}
}
