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

import javax.servlet.http.HttpServletRequest;

/**
 * Resolves an API key to the identity it belongs to.
 * <p>
 * Usage:
 * <pre>{@code ApiKeyFinder finder = (apiKey, request) -> {
 *   User user = usersByApiKey.get(apiKey);
 *
 *   if (user == null)
 *     throw new ApiKeyLookupException(format("No user found for: %s", apiKey));
 *
 *   return user;
 * };}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface ApiKeyFinder {
	/**
	 * Looks up the identity for {@code apiKey}.
	 *
	 * @param apiKey             the key taken from the {@code Authorization} header
	 * @param httpServletRequest the request being authenticated
	 * @return the identity, which is attached to the request via {@link Identities}
	 * @throws ApiKeyLookupException if the key is not valid
	 */
	@NonNull
	Object find(@NonNull String apiKey,
							@NonNull HttpServletRequest httpServletRequest) throws ApiKeyLookupException;
}
