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
import org.jspecify.annotations.Nullable;

/**
 * Thrown by an {@link ApiKeyFinder} when a key does not resolve to an identity.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public class ApiKeyLookupException extends Exception {
	private static final long serialVersionUID = 1L;

	public ApiKeyLookupException(@NonNull String message) {
		super(message);
	}

	public ApiKeyLookupException(@NonNull String message,
															 @Nullable Throwable cause) {
		super(message, cause);
	}
}
