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
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The request target as it arrived: raw path, raw query and authority.
 * <p>
 * {@link InstrumentationFilter} captures an instance before the filter chain runs so that later wrappers or
 * forwards cannot change what gets logged.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class RequestTarget {
	@NonNull
	private final String path;
	@NonNull
	private final String query;
	@NonNull
	private final String authority;

	public RequestTarget(@Nullable String path,
											 @Nullable String query,
											 @Nullable String authority) {
		this.path = path == null ? "" : path;
		this.query = query == null ? "" : query;
		this.authority = authority == null ? "" : authority;
	}

	/**
	 * Captures the target of {@code httpServletRequest}.
	 * <p>
	 * The authority is the authority-form request target when there is one (as with {@code CONNECT}), otherwise the
	 * {@code Host} header, otherwise {@code serverName:serverPort}.
	 *
	 * @param httpServletRequest the request to read
	 * @return the captured target
	 */
	@NonNull
	public static RequestTarget fromRequest(@NonNull HttpServletRequest httpServletRequest) {
		requireNonNull(httpServletRequest);

		String requestUri = httpServletRequest.getRequestURI();
		String path = "";
		String authority = null;

		if (requestUri != null) {
			if (requestUri.startsWith("/"))
				path = requestUri;
			else if (requestUri.length() > 0 && !"*".equals(requestUri))
				authority = requestUri;
		}

		if (authority == null)
			authority = httpServletRequest.getHeader("Host");

		if (authority == null || authority.length() == 0) {
			String serverName = httpServletRequest.getServerName();
			authority = serverName == null ? "" : format("%s:%d", serverName, httpServletRequest.getServerPort());
		}

		return new RequestTarget(path, httpServletRequest.getQueryString(), authority);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{path=%s, query=%s, authority=%s}", getClass().getSimpleName(), getPath(), getQuery(), getAuthority());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RequestTarget requestTarget))
			return false;

		return Objects.equals(getPath(), requestTarget.getPath())
				&& Objects.equals(getQuery(), requestTarget.getQuery())
				&& Objects.equals(getAuthority(), requestTarget.getAuthority());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getPath(), getQuery(), getAuthority());
	}

	/**
	 * The raw (undecoded) path, possibly empty.
	 *
	 * @return the path
	 */
	@NonNull
	public String getPath() {
		return this.path;
	}

	/**
	 * The raw query string without the leading {@code ?}, possibly empty.
	 *
	 * @return the query
	 */
	@NonNull
	public String getQuery() {
		return this.query;
	}

	/**
	 * The {@code host[:port]} authority, possibly empty.
	 *
	 * @return the authority
	 */
	@NonNull
	public String getAuthority() {
		return this.authority;
	}
}
