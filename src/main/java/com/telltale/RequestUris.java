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
import javax.servlet.http.HttpServletRequest;

import static java.util.Objects.requireNonNull;

/**
 * Normalizes a request target into the "uri" and "path" values used by log sinks.
 * <p>
 * HTTP/2 {@code CONNECT} requests have no path or query, so both values are the raw authority for them.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class RequestUris {
	private RequestUris() {
		// Non-instantiable
	}

	/**
	 * Path plus {@code ?query} when the query is non-empty, or the authority for an HTTP/2 {@code CONNECT}.
	 *
	 * @param httpServletRequest the request
	 * @param requestTarget      the target captured from the request
	 * @return the normalized uri
	 */
	@NonNull
	public static String uri(@NonNull HttpServletRequest httpServletRequest,
													 @NonNull RequestTarget requestTarget) {
		requireNonNull(httpServletRequest);
		requireNonNull(requestTarget);

		if (isHttp2Connect(httpServletRequest))
			return requestTarget.getAuthority();

		String path = normalizedPath(requestTarget);

		if (requestTarget.getQuery().length() == 0)
			return path;

		return path + "?" + requestTarget.getQuery();
	}

	/**
	 * The path without any query, or the authority for an HTTP/2 {@code CONNECT}.
	 *
	 * @param httpServletRequest the request
	 * @param requestTarget      the target captured from the request
	 * @return the normalized path
	 */
	@NonNull
	public static String path(@NonNull HttpServletRequest httpServletRequest,
														@NonNull RequestTarget requestTarget) {
		requireNonNull(httpServletRequest);
		requireNonNull(requestTarget);

		if (isHttp2Connect(httpServletRequest))
			return requestTarget.getAuthority();

		return normalizedPath(requestTarget);
	}

	/**
	 * Is this a protocol-upgrade {@code CONNECT} request made over HTTP/2?
	 *
	 * @param httpServletRequest the request
	 * @return {@code true} for HTTP/2 {@code CONNECT}
	 */
	public static boolean isHttp2Connect(@NonNull HttpServletRequest httpServletRequest) {
		requireNonNull(httpServletRequest);
		return "CONNECT".equals(httpServletRequest.getMethod())
				&& protocolMajorVersion(httpServletRequest.getProtocol()) == 2;
	}

	/**
	 * Parses the major version out of a protocol string like {@code HTTP/2.0} or {@code HTTP/1.1}.
	 *
	 * @param protocol the protocol string, may be {@code null}
	 * @return the major version, or {@code -1} if it cannot be determined
	 */
	public static int protocolMajorVersion(@Nullable String protocol) {
		if (protocol == null)
			return -1;

		int slashIndex = protocol.indexOf('/');

		if (slashIndex == -1 || slashIndex == protocol.length() - 1)
			return -1;

		int end = slashIndex + 1;

		while (end < protocol.length() && Character.isDigit(protocol.charAt(end)))
			++end;

		if (end == slashIndex + 1)
			return -1;

		try {
			return Integer.parseInt(protocol.substring(slashIndex + 1, end));
		} catch (NumberFormatException e) {
			// Absurdly long digit run
			return -1;
		}
	}

	@NonNull
	private static String normalizedPath(@NonNull RequestTarget requestTarget) {
		String path = requestTarget.getPath();
		return path.length() == 0 ? "/" : path;
	}
}
