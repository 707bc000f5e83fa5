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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Authenticates requests carrying an {@code Authorization: <provider> <apiKey>} header.
 * <p>
 * The provider must equal the configured one exactly and the key must be resolvable by the {@link ApiKeyFinder}; the
 * resulting identity is attached to the request (see {@link Identities}) and the chain continues. Any failure is
 * handed to the {@link AuthenticationErrorHandler} with status {@code 401} and the chain stops.
 * <p>
 * Usage:
 * <pre>{@code ApiKeyFilter apiKeyFilter = new ApiKeyFilter("Graze", finder,
 *   DefaultAuthenticationErrorHandler.defaultInstance());
 *
 * servletContext.addFilter("apiKey", apiKeyFilter)
 *   .addMappingForUrlPatterns(null, false, "/api/*");}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Singleton
@ThreadSafe
public class ApiKeyFilter implements Filter {
	@NonNull
	public static final String AUTHORIZATION_HEADER_NAME = "Authorization";
	@NonNull
	public static final String EXPECTED_FORMAT = "<provider> <apiKey>";

	@NonNull
	private final String provider;
	@NonNull
	private final ApiKeyFinder apiKeyFinder;
	@NonNull
	private final AuthenticationErrorHandler authenticationErrorHandler;

	public ApiKeyFilter(@NonNull String provider,
											@NonNull ApiKeyFinder apiKeyFinder,
											@NonNull AuthenticationErrorHandler authenticationErrorHandler) {
		requireNonNull(provider);
		requireNonNull(apiKeyFinder);
		requireNonNull(authenticationErrorHandler);

		if (provider.length() == 0 || provider.contains(" "))
			throw new IllegalArgumentException(format("Illegal API key provider '%s', it must be non-empty and contain no spaces", provider));

		this.provider = provider;
		this.apiKeyFinder = apiKeyFinder;
		this.authenticationErrorHandler = authenticationErrorHandler;
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

		Object identity;

		try {
			identity = authenticate(httpServletRequest);
		} catch (ApiKeyAuthenticationException e) {
			getAuthenticationErrorHandler().handle(httpServletRequest, httpServletResponse, e, HttpServletResponse.SC_UNAUTHORIZED);
			return;
		}

		Identities.attach(httpServletRequest, identity);
		filterChain.doFilter(httpServletRequest, httpServletResponse);
	}

	/**
	 * Resolves the identity for a request's {@code Authorization} header.
	 *
	 * @param httpServletRequest the request
	 * @return the identity
	 * @throws ApiKeyAuthenticationException if the request cannot be authenticated
	 */
	@NonNull
	public Object authenticate(@NonNull HttpServletRequest httpServletRequest) throws ApiKeyAuthenticationException {
		requireNonNull(httpServletRequest);

		String header = httpServletRequest.getHeader(AUTHORIZATION_HEADER_NAME);

		if (header == null)
			throw new ApiKeyAuthenticationException.NoHeader();

		// Exactly one space: "Graze  key" or "Graze key extra" are both malformed
		String[] parts = header.split(" ", -1);

		if (parts.length != 2)
			throw new ApiKeyAuthenticationException.InvalidFormat(EXPECTED_FORMAT, header);

		String provider = parts[0];
		String apiKey = parts[1];

		if (!getProvider().equals(provider))
			throw new ApiKeyAuthenticationException.BadProvider(provider, getProvider());

		Object identity;

		try {
			identity = getApiKeyFinder().find(apiKey, httpServletRequest);
		} catch (ApiKeyLookupException e) {
			throw new ApiKeyAuthenticationException.InvalidKey(apiKey, e);
		}

		if (identity == null)
			throw new ApiKeyAuthenticationException.InvalidKey(apiKey,
					new ApiKeyLookupException(format("%s returned no identity", getApiKeyFinder().getClass().getSimpleName())));

		return identity;
	}

	@NonNull
	public String getProvider() {
		return this.provider;
	}

	@NonNull
	public ApiKeyFinder getApiKeyFinder() {
		return this.apiKeyFinder;
	}

	@NonNull
	public AuthenticationErrorHandler getAuthenticationErrorHandler() {
		return this.authenticationErrorHandler;
	}
}
