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

package com.telltale.util;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Reads a properties file from disk and converts values to the handful of types configuration needs.
 * <p>
 * Blank values are treated the same as missing ones.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class PropertiesFileReader {
	@NonNull
	private final Map<@NonNull String, @NonNull String> properties;

	public PropertiesFileReader(@NonNull Path propertiesFile) {
		requireNonNull(propertiesFile);
		this.properties = unmodifiableMap(new HashMap<>(loadPropertiesForPath(propertiesFile)));
	}

	public PropertiesFileReader(@NonNull Map<@NonNull String, @NonNull String> properties) {
		requireNonNull(properties);
		this.properties = unmodifiableMap(new HashMap<>(properties));
	}

	@NonNull
	public String valueFor(@NonNull String key) {
		requireNonNull(key);

		return optionalValueFor(key).orElseThrow(() ->
				new IllegalStateException(format("No properties file value was found for key '%s'", key)));
	}

	@NonNull
	public Optional<String> optionalValueFor(@NonNull String key) {
		requireNonNull(key);

		String value = properties().get(key);

		if (value == null || value.trim().length() == 0)
			return Optional.empty();

		return Optional.of(value.trim());
	}

	@NonNull
	public Optional<Integer> optionalIntegerValueFor(@NonNull String key) {
		requireNonNull(key);

		Optional<String> value = optionalValueFor(key);

		if (value.isEmpty())
			return Optional.empty();

		try {
			return Optional.of(Integer.valueOf(value.get()));
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(format("Properties file value '%s' for key '%s' is not an integer", value.get(), key), e);
		}
	}

	@NonNull
	public Optional<Boolean> optionalBooleanValueFor(@NonNull String key) {
		requireNonNull(key);

		Optional<String> value = optionalValueFor(key);

		if (value.isEmpty())
			return Optional.empty();

		String normalizedValue = value.get().toLowerCase(Locale.ENGLISH);

		if ("true".equals(normalizedValue))
			return Optional.of(true);
		if ("false".equals(normalizedValue))
			return Optional.of(false);

		throw new IllegalArgumentException(format("Properties file value '%s' for key '%s' is not a boolean", value.get(), key));
	}

	/**
	 * A comma-separated value split into its trimmed, non-empty parts.
	 *
	 * @param key the key to look up
	 * @return the parts, empty if the key is missing
	 */
	@NonNull
	public List<@NonNull String> listValueFor(@NonNull String key) {
		requireNonNull(key);

		return optionalValueFor(key)
				.map(value -> Arrays.stream(value.split(","))
						.map(String::trim)
						.filter(part -> part.length() > 0)
						.collect(Collectors.toList()))
				.orElse(List.of());
	}

	/**
	 * All entries whose key starts with {@code prefix}, keyed by the remainder of the key, in key order.
	 *
	 * @param prefix the key prefix, e.g. {@code telltale.structured.context.}
	 * @return the matching entries
	 */
	@NonNull
	public Map<@NonNull String, @NonNull String> valuesWithPrefix(@NonNull String prefix) {
		requireNonNull(prefix);

		Map<String, String> values = new TreeMap<>();

		for (Map.Entry<String, String> entry : properties().entrySet())
			if (entry.getKey().startsWith(prefix) && entry.getKey().length() > prefix.length())
				values.put(entry.getKey().substring(prefix.length()), entry.getValue().trim());

		return values;
	}

	@NonNull
	protected Map<@NonNull String, @NonNull String> loadPropertiesForPath(@NonNull Path propertiesFile) {
		requireNonNull(propertiesFile);

		Properties properties = new Properties();

		if (!Files.exists(propertiesFile))
			throw new IllegalArgumentException(
					format("Unable to find properties file at %s", propertiesFile.toAbsolutePath()));

		if (!Files.isRegularFile(propertiesFile))
			throw new IllegalArgumentException(format("Properties file at %s is not a regular file",
					propertiesFile.toAbsolutePath()));

		try (InputStream inputStream = Files.newInputStream(propertiesFile);
				 Reader reader = new InputStreamReader(inputStream, UTF_8)) {
			properties.load(reader);
		} catch (IOException | IllegalArgumentException e) {
			throw new IllegalArgumentException(format("Invalid format for properties file at %s",
					propertiesFile.toAbsolutePath()), e);
		}

		Map<String, String> propertiesMap = new HashMap<>();

		for (String key : properties.stringPropertyNames())
			propertiesMap.put(key, properties.getProperty(key));

		return propertiesMap;
	}

	@NonNull
	public Map<@NonNull String, @NonNull String> properties() {
		return this.properties;
	}
}
