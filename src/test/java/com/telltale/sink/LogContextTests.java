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

package com.telltale.sink;

import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import javax.servlet.http.HttpServletRequest;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.telltale.TestSupport.mockRequest;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class LogContextTests {
	@Test
	public void withReturnsNewContext() {
		LogContext base = LogContext.empty().with("module", "request.handler");
		LogContext extended = base.with("env", "prod");

		assertEquals(Map.of("module", "request.handler"), base.getFields());
		assertEquals(Map.of("module", "request.handler", "env", "prod"), extended.getFields());
	}

	@Test
	public void laterFieldsReplaceEarlierOnesAndKeepOrder() {
		LogContext logContext = LogContext.empty()
				.with("a", 1)
				.with("b", 2)
				.with("a", 3);

		assertEquals(List.of("a", "b"), List.copyOf(logContext.getFields().keySet()));
		assertEquals(3, logContext.getFields().get("a"));
	}

	@Test
	public void nullValuesRejected() {
		Map<String, Object> fields = new HashMap<>();
		fields.put("broken", null);

		assertThrows(NullPointerException.class, () -> LogContext.of(fields));
	}

	@Test
	public void fieldsAreImmutable() {
		LogContext logContext = LogContext.empty().with("a", 1);
		assertThrows(UnsupportedOperationException.class, () -> logContext.getFields().put("b", 2));
	}

	@Test
	public void emptyMergeReturnsSameInstance() {
		LogContext logContext = LogContext.empty().with("a", 1);
		assertSame(logContext, logContext.with(Map.of()));
	}

	@Test
	public void requestContextMerges() {
		HttpServletRequest request = mockRequest("GET", "/");

		assertTrue(LogContext.forRequest(request).getFields().isEmpty());

		LogContext.attachToRequest(request, LogContext.empty().with("requestId", "abc"));
		LogContext merged = LogContext.attachToRequest(request, LogContext.empty().with("userId", 42));

		assertEquals(Map.of("requestId", "abc", "userId", 42), merged.getFields());
		assertEquals(merged, LogContext.forRequest(request));
	}
}
