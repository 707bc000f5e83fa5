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

import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * Writes the response for a request that {@link ApiKeyFilter} rejected. The filter itself writes nothing.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface AuthenticationErrorHandler {
	/**
	 * Handles a rejected request.
	 *
	 * @param httpServletRequest  the rejected request
	 * @param httpServletResponse the response to write
	 * @param error               why the request was rejected
	 * @param statusCode          the HTTP status to respond with
	 * @throws IOException      if the response cannot be written
	 * @throws ServletException if the response cannot be written
	 */
	void handle(@NonNull HttpServletRequest httpServletRequest,
							@NonNull HttpServletResponse httpServletResponse,
							@NonNull ApiKeyAuthenticationException error,
							int statusCode) throws IOException, ServletException;
}
