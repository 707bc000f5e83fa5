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

import javax.annotation.concurrent.NotThreadSafe;
import javax.servlet.http.HttpServletRequest;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Everything a {@link RequestLogSink} needs to know about one handled request.
 * <p>
 * Instances are created by {@link InstrumentationFilter} after the filter chain returns and are not retained once the
 * sink has been called.
 * <p>
 * Instances can be acquired via the {@link #with(HttpServletRequest, CapturingHttpServletResponse, RequestTarget)}
 * builder factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public final class RequestLogEntry {
	// Dotted-quad IPv4 or anything with a colon (IPv6), so InetAddress never falls back to a DNS lookup
	@NonNull
	private static final Pattern IP_LITERAL_PATTERN =
			Pattern.compile("^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$|^[0-9A-Fa-f:.]*:[0-9A-Fa-f:.]*$");

	@NonNull
	private final HttpServletRequest httpServletRequest;
	@NonNull
	private final CapturingHttpServletResponse httpServletResponse;
	@NonNull
	private final RequestTarget requestTarget;
	@NonNull
	private final String uri;
	@NonNull
	private final String path;
	@NonNull
	private final Instant timestamp;
	@NonNull
	private final Duration duration;
	private final int status;
	private final long bytes;
	@Nullable
	private final Throwable throwable;

	/**
	 * Acquires a builder for {@link RequestLogEntry} instances.
	 *
	 * @param httpServletRequest  the request as it entered the filter
	 * @param httpServletResponse the capturing response handed down the chain
	 * @param requestTarget       the target captured before the chain ran
	 * @return the builder
	 */
	@NonNull
	public static Builder with(@NonNull HttpServletRequest httpServletRequest,
														 @NonNull CapturingHttpServletResponse httpServletResponse,
														 @NonNull RequestTarget requestTarget) {
		requireNonNull(httpServletRequest);
		requireNonNull(httpServletResponse);
		requireNonNull(requestTarget);

		return new Builder(httpServletRequest, httpServletResponse, requestTarget);
	}

	protected RequestLogEntry(@NonNull Builder builder) {
		requireNonNull(builder);

		this.httpServletRequest = builder.httpServletRequest;
		this.httpServletResponse = builder.httpServletResponse;
		this.requestTarget = builder.requestTarget;
		this.uri = builder.uri == null ? RequestUris.uri(builder.httpServletRequest, builder.requestTarget) : builder.uri;
		this.path = builder.path == null ? RequestUris.path(builder.httpServletRequest, builder.requestTarget) : builder.path;
		this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
		this.duration = builder.duration == null ? Duration.ZERO : builder.duration;
		this.status = builder.status == null ? builder.httpServletResponse.getCapturedStatus() : builder.status;
		this.bytes = builder.bytes == null ? builder.httpServletResponse.getBytesWritten() : builder.bytes;
		this.throwable = builder.throwable;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{method=%s, uri=%s, status=%d, bytes=%d, duration=%s}", getClass().getSimpleName(),
				getMethod(), getUri(), getStatus(), getBytes(), getDuration());
	}

	@NonNull
	public HttpServletRequest getHttpServletRequest() {
		return this.httpServletRequest;
	}

	@NonNull
	public CapturingHttpServletResponse getHttpServletResponse() {
		return this.httpServletResponse;
	}

	@NonNull
	public RequestTarget getRequestTarget() {
		return this.requestTarget;
	}

	/**
	 * The normalized uri (path and query), see {@link RequestUris#uri(HttpServletRequest, RequestTarget)}.
	 *
	 * @return the normalized uri
	 */
	@NonNull
	public String getUri() {
		return this.uri;
	}

	/**
	 * The normalized path (no query), see {@link RequestUris#path(HttpServletRequest, RequestTarget)}.
	 *
	 * @return the normalized path
	 */
	@NonNull
	public String getPath() {
		return this.path;
	}

	/**
	 * When the request entered the filter.
	 *
	 * @return the start timestamp
	 */
	@NonNull
	public Instant getTimestamp() {
		return this.timestamp;
	}

	/**
	 * How long the filter chain took.
	 *
	 * @return the elapsed time
	 */
	@NonNull
	public Duration getDuration() {
		return this.duration;
	}

	public int getStatus() {
		return this.status;
	}

	public long getBytes() {
		return this.bytes;
	}

	/**
	 * The exception thrown by the filter chain, if any.
	 *
	 * @return the exception, or an empty value if the chain completed normally
	 */
	@NonNull
	public Optional<Throwable> getThrowable() {
		return Optional.ofNullable(this.throwable);
	}

	@NonNull
	public String getMethod() {
		String method = getHttpServletRequest().getMethod();
		return method == null ? "" : method;
	}

	@NonNull
	public String getProtocol() {
		String protocol = getHttpServletRequest().getProtocol();
		return protocol == null ? "" : protocol;
	}

	/**
	 * The {@code Host} header, falling back to the captured authority.
	 *
	 * @return the host
	 */
	@NonNull
	public String getHost() {
		String host = getHttpServletRequest().getHeader("Host");
		return host == null ? getRequestTarget().getAuthority() : host;
	}

	@NonNull
	public String getReferer() {
		String referer = getHttpServletRequest().getHeader("Referer");
		return referer == null ? "" : referer;
	}

	@NonNull
	public String getForwardedFor() {
		String forwardedFor = getHttpServletRequest().getHeader("X-Forwarded-For");
		return forwardedFor == null ? "" : forwardedFor;
	}

	/**
	 * The client's IP address: the first {@code X-Forwarded-For} entry if present, otherwise the remote address.
	 *
	 * @return the address, or an empty value if neither holds an IP literal
	 */
	@NonNull
	public Optional<InetAddress> getUserIp() {
		String forwardedFor = getForwardedFor();

		if (forwardedFor.length() > 0)
			return parseIpAddress(forwardedFor.split(",", 2)[0]);

		return parseIpAddress(getHttpServletRequest().getRemoteAddr());
	}

	@NonNull
	static Optional<InetAddress> parseIpAddress(@Nullable String value) {
		if (value == null)
			return Optional.empty();

		String address = value.trim();

		if (address.startsWith("[") && address.endsWith("]"))
			address = address.substring(1, address.length() - 1);

		if (!IP_LITERAL_PATTERN.matcher(address).matches())
			return Optional.empty();

		try {
			return Optional.of(InetAddress.getByName(address));
		} catch (UnknownHostException e) {
			// Malformed IPv6 literal
			return Optional.empty();
		}
	}

	/**
	 * Builder used to construct instances of {@link RequestLogEntry}.
	 * <p>
	 * Values left unset are taken from the capturing response (status, bytes), computed from the request and target
	 * (uri, path) or defaulted (timestamp to now, duration to zero).
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final HttpServletRequest httpServletRequest;
		@NonNull
		private final CapturingHttpServletResponse httpServletResponse;
		@NonNull
		private final RequestTarget requestTarget;
		@Nullable
		private String uri;
		@Nullable
		private String path;
		@Nullable
		private Instant timestamp;
		@Nullable
		private Duration duration;
		@Nullable
		private Integer status;
		@Nullable
		private Long bytes;
		@Nullable
		private Throwable throwable;

		protected Builder(@NonNull HttpServletRequest httpServletRequest,
											@NonNull CapturingHttpServletResponse httpServletResponse,
											@NonNull RequestTarget requestTarget) {
			this.httpServletRequest = httpServletRequest;
			this.httpServletResponse = httpServletResponse;
			this.requestTarget = requestTarget;
		}

		@NonNull
		public Builder uri(@Nullable String uri) {
			this.uri = uri;
			return this;
		}

		@NonNull
		public Builder path(@Nullable String path) {
			this.path = path;
			return this;
		}

		@NonNull
		public Builder timestamp(@Nullable Instant timestamp) {
			this.timestamp = timestamp;
			return this;
		}

		@NonNull
		public Builder duration(@Nullable Duration duration) {
			this.duration = duration;
			return this;
		}

		@NonNull
		public Builder status(@Nullable Integer status) {
			this.status = status;
			return this;
		}

		@NonNull
		public Builder bytes(@Nullable Long bytes) {
			this.bytes = bytes;
			return this;
		}

		@NonNull
		public Builder throwable(@Nullable Throwable throwable) {
			this.throwable = throwable;
			return this;
		}

		@NonNull
		public RequestLogEntry build() {
			return new RequestLogEntry(this);
		}
	}
}
