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
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Stores and retrieves the identity {@link ApiKeyFilter} resolved for a request.
 * <p>
 * The identity lives in a request attribute, so it is visible to every filter and servlet that runs after
 * authentication.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Identities {
	@NonNull
	public static final String REQUEST_ATTRIBUTE_NAME = Identities.class.getName() + ".IDENTITY";

	private Identities() {
		// Non-instantiable
	}

	public static void attach(@NonNull HttpServletRequest httpServletRequest,
														@NonNull Object identity) {
		requireNonNull(httpServletRequest);
		requireNonNull(identity);

		httpServletRequest.setAttribute(REQUEST_ATTRIBUTE_NAME, identity);
	}

	@NonNull
	public static Optional<Object> get(@NonNull HttpServletRequest httpServletRequest) {
		requireNonNull(httpServletRequest);
		return Optional.ofNullable(httpServletRequest.getAttribute(REQUEST_ATTRIBUTE_NAME));
	}

	/**
	 * The request's identity, if there is one and it is of the given type.
	 *
	 * @param httpServletRequest the request
	 * @param identityType       the expected identity type
	 * @param <T>                the expected identity type
	 * @return the identity, or an empty value
	 */
	@NonNull
	public static <T> Optional<T> get(@NonNull HttpServletRequest httpServletRequest,
																		@NonNull Class<T> identityType) {
		requireNonNull(httpServletRequest);
		requireNonNull(identityType);

		return get(httpServletRequest).filter(identityType::isInstance).map(identityType::cast);
	}
}
