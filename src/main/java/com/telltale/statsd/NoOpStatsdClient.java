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

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;

/**
 * Discards all metrics. Used when statsd reporting is disabled.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class NoOpStatsdClient implements StatsdClient {
	@NonNull
	private static final NoOpStatsdClient DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new NoOpStatsdClient();
	}

	private NoOpStatsdClient() {}

	@NonNull
	public static NoOpStatsdClient defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	@Override
	public void timing(@NonNull String name, double milliseconds, @NonNull List<@NonNull String> tags) {}

	@Override
	public void count(@NonNull String name, long delta, @NonNull List<@NonNull String> tags) {}
}
