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

package com.telltale.statsd;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.DatagramChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;

/**
 * Sends DogStatsD lines over UDP, one datagram per metric.
 * <p>
 * Lines look like {@code <namespace><name>:<value>|<type>|#<constant tags>,<tags>}. Sends are non-blocking and
 * fire-and-forget: if the datagram cannot be sent it is dropped and the failure is logged at {@code FINE}.
 * <p>
 * Instances can be acquired via the {@link #withAddress(String, int)} builder factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class DatagramStatsdClient implements StatsdClient, AutoCloseable {
	@NonNull
	private final InetSocketAddress address;
	@NonNull
	private final String namespace;
	@NonNull
	private final List<@NonNull String> constantTags;
	@NonNull
	private final DatagramChannel datagramChannel;
	@NonNull
	private final Logger logger = Logger.getLogger(DatagramStatsdClient.class.getName());

	/**
	 * Acquires a builder for a client that sends to {@code host:port}.
	 *
	 * @param host the statsd host, e.g. {@code 127.0.0.1}
	 * @param port the statsd port, usually {@code 8125}
	 * @return the builder
	 */
	@NonNull
	public static Builder withAddress(@NonNull String host,
																		int port) {
		requireNonNull(host);
		return new Builder(host, port);
	}

	protected DatagramStatsdClient(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.port < 1 || builder.port > 65535)
			throw new IllegalArgumentException(format("Illegal statsd port %d", builder.port));

		this.address = new InetSocketAddress(builder.host, builder.port);
		this.namespace = builder.namespace == null ? "" : builder.namespace;
		this.constantTags = builder.constantTags == null ? List.of() : List.copyOf(builder.constantTags);

		if (this.address.isUnresolved())
			throw new IllegalArgumentException(format("Unable to resolve statsd host '%s'", builder.host));

		try {
			this.datagramChannel = DatagramChannel.open();
			this.datagramChannel.configureBlocking(false);
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to open statsd datagram channel", e);
		}
	}

	@Override
	public void timing(@NonNull String name,
										 double milliseconds,
										 @NonNull List<@NonNull String> tags) {
		send(name, format(Locale.ROOT, "%f", milliseconds), "ms", tags);
	}

	@Override
	public void count(@NonNull String name,
										long delta,
										@NonNull List<@NonNull String> tags) {
		send(name, String.valueOf(delta), "c", tags);
	}

	/**
	 * Formats a complete DogStatsD line, including namespace and constant tags.
	 *
	 * @param name  the metric name, without namespace
	 * @param value the formatted value
	 * @param type  the metric type, e.g. {@code ms} or {@code c}
	 * @param tags  per-metric tags
	 * @return the line
	 */
	@NonNull
	public String formatLine(@NonNull String name,
													 @NonNull String value,
													 @NonNull String type,
													 @NonNull List<@NonNull String> tags) {
		requireNonNull(name);
		requireNonNull(value);
		requireNonNull(type);
		requireNonNull(tags);

		StringBuilder line = new StringBuilder(getNamespace())
				.append(name)
				.append(':')
				.append(value)
				.append('|')
				.append(type);

		if (getConstantTags().size() > 0 || tags.size() > 0) {
			List<String> allTags = new ArrayList<>(getConstantTags().size() + tags.size());
			allTags.addAll(getConstantTags());
			allTags.addAll(tags);

			line.append("|#").append(String.join(",", allTags));
		}

		return line.toString();
	}

	protected void send(@NonNull String name,
											@NonNull String value,
											@NonNull String type,
											@NonNull List<@NonNull String> tags) {
		String line = formatLine(name, value, type, tags);

		try {
			int bytesSent = getDatagramChannel().send(ByteBuffer.wrap(line.getBytes(UTF_8)), getAddress());

			if (bytesSent == 0 && logger.isLoggable(FINE))
				logger.fine(format("Statsd send buffer full, dropped '%s'", line));
		} catch (IOException e) {
			if (logger.isLoggable(FINE))
				logger.log(FINE, format("Unable to send '%s' to statsd at %s", line, getAddress()), e);
		}
	}

	@Override
	public void close() {
		try {
			getDatagramChannel().close();
		} catch (IOException e) {
			logger.log(FINE, "Unable to close statsd datagram channel", e);
		}
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{address=%s, namespace=%s, constantTags=%s}", getClass().getSimpleName(), getAddress(),
				getNamespace(), getConstantTags());
	}

	@NonNull
	public InetSocketAddress getAddress() {
		return this.address;
	}

	@NonNull
	public String getNamespace() {
		return this.namespace;
	}

	@NonNull
	public List<@NonNull String> getConstantTags() {
		return this.constantTags;
	}

	@NonNull
	protected DatagramChannel getDatagramChannel() {
		return this.datagramChannel;
	}

	/**
	 * Builder used to construct instances of {@link DatagramStatsdClient}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String host;
		private final int port;
		@Nullable
		private String namespace;
		@Nullable
		private List<@NonNull String> constantTags;

		protected Builder(@NonNull String host,
											int port) {
			this.host = host;
			this.port = port;
		}

		/**
		 * Prefix prepended verbatim to every metric name, e.g. {@code service.logging.live.}.
		 *
		 * @param namespace the prefix
		 * @return this builder
		 */
		@NonNull
		public Builder namespace(@Nullable String namespace) {
			this.namespace = namespace;
			return this;
		}

		/**
		 * Tags sent with every metric, ahead of the per-metric tags.
		 *
		 * @param constantTags the tags
		 * @return this builder
		 */
		@NonNull
		public Builder constantTags(@Nullable List<@NonNull String> constantTags) {
			this.constantTags = constantTags;
			return this;
		}

		@NonNull
		public DatagramStatsdClient build() {
			return new DatagramStatsdClient(this);
		}
	}
}
