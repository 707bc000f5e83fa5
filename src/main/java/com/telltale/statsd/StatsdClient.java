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

import java.util.List;

/**
 * Best-effort sender of DogStatsD metrics.
 * <p>
 * Implementations may prefix a namespace and append static tags before sending. Calls must not block on delivery and
 * must not throw on send failure.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface StatsdClient {
	/**
	 * Records a timing value, e.g. {@code request.response_time:302.000000|ms|#endpoint:/}.
	 *
	 * @param name         the metric name, without namespace
	 * @param milliseconds the timing value
	 * @param tags         tags in {@code key:value} form
	 */
	void timing(@NonNull String name,
							double milliseconds,
							@NonNull List<@NonNull String> tags);

	/**
	 * Adjusts a counter, e.g. {@code request.count:1|c|#endpoint:/}.
	 *
	 * @param name  the metric name, without namespace
	 * @param delta the amount to add
	 * @param tags  tags in {@code key:value} form
	 */
	void count(@NonNull String name,
						 long delta,
						 @NonNull List<@NonNull String> tags);
}
