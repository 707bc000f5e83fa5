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

/**
 * Receives one {@link RequestLogEntry} for every request handled by an {@link InstrumentationFilter}.
 * <p>
 * Implementations are invoked on the request-handling thread after the filter chain returns, so they should be fast
 * and must be threadsafe. Exceptions thrown here are logged by the filter and never reach the client.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface RequestLogSink {
	/**
	 * Called once per request with the captured request data.
	 *
	 * @param requestLogEntry the request data
	 */
	void log(@NonNull RequestLogEntry requestLogEntry);
}
