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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Why {@link ApiKeyFilter} rejected a request.
 * <p>
 * There are exactly four kinds, so an {@link AuthenticationErrorHandler} can tell them apart with {@code instanceof}:
 * <pre>{@code if (e instanceof ApiKeyAuthenticationException.InvalidKey invalidKey)
 *   auditLog.rejectedKey(invalidKey.getKey());}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public abstract sealed class ApiKeyAuthenticationException extends Exception
		permits ApiKeyAuthenticationException.NoHeader,
		ApiKeyAuthenticationException.InvalidFormat,
		ApiKeyAuthenticationException.BadProvider,
		ApiKeyAuthenticationException.InvalidKey {
	private static final long serialVersionUID = 1L;

	protected ApiKeyAuthenticationException(@NonNull String message) {
		super(requireNonNull(message));
	}

	protected ApiKeyAuthenticationException(@NonNull String message,
																					@NonNull Throwable cause) {
		super(requireNonNull(message), requireNonNull(cause));
	}

	/**
	 * The request had no {@code Authorization} header.
	 */
	@ThreadSafe
	public static final class NoHeader extends ApiKeyAuthenticationException {
		private static final long serialVersionUID = 1L;

		public NoHeader() {
			super("no Authorization header provided");
		}
	}

	/**
	 * The {@code Authorization} header was not of the form {@code <provider> <apiKey>}.
	 */
	@ThreadSafe
	public static final class InvalidFormat extends ApiKeyAuthenticationException {
		private static final long serialVersionUID = 1L;

		@NonNull
		private final String expectedFormat;
		@NonNull
		private final String header;

		public InvalidFormat(@NonNull String expectedFormat,
												 @NonNull String header) {
			super(format("provided Authorization header in invalid format, expecting: %s got: %s",
					requireNonNull(expectedFormat), requireNonNull(header)));
			this.expectedFormat = expectedFormat;
			this.header = header;
		}

		@NonNull
		public String getExpectedFormat() {
			return this.expectedFormat;
		}

		@NonNull
		public String getHeader() {
			return this.header;
		}
	}

	/**
	 * The provider named in the {@code Authorization} header was not the configured one.
	 */
	@ThreadSafe
	public static final class BadProvider extends ApiKeyAuthenticationException {
		private static final long serialVersionUID = 1L;

		@NonNull
		private final String provider;
		@NonNull
		private final String expectedProvider;

		public BadProvider(@NonNull String provider,
											 @NonNull String expectedProvider) {
			super(format("Authorization provider does not match. Expecting: %s got: %s",
					requireNonNull(expectedProvider), requireNonNull(provider)));
			this.provider = provider;
			this.expectedProvider = expectedProvider;
		}

		@NonNull
		public String getProvider() {
			return this.provider;
		}

		@NonNull
		public String getExpectedProvider() {
			return this.expectedProvider;
		}
	}

	/**
	 * The {@link ApiKeyFinder} could not resolve the key to an identity. The finder's failure is the cause.
	 */
	@ThreadSafe
	public static final class InvalidKey extends ApiKeyAuthenticationException {
		private static final long serialVersionUID = 1L;

		@NonNull
		private final String key;

		public InvalidKey(@NonNull String key,
											@NonNull Throwable cause) {
			super(format("provided api key: '%s' is not valid: %s", requireNonNull(key), requireNonNull(cause).getMessage()), cause);
			this.key = key;
		}

		@NonNull
		public String getKey() {
			return this.key;
		}
	}
}
