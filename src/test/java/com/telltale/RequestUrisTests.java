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

import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import javax.servlet.http.HttpServletRequest;
import java.util.Map;

import static com.telltale.TestSupport.mockRequest;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RequestUrisTests {
	@Test
	public void uriIncludesQuery() {
		HttpServletRequest request = mockRequest("GET", "HTTP/1.1", "/path", "query=value", Map.of("Host", "example.com"));
		RequestTarget requestTarget = RequestTarget.fromRequest(request);

		assertEquals("/path?query=value", RequestUris.uri(request, requestTarget));
		assertEquals("/path", RequestUris.path(request, requestTarget));
	}

	@Test
	public void uriWithoutQuery() {
		HttpServletRequest request = mockRequest("GET", "HTTP/1.1", "/path", null, Map.of("Host", "example.com"));
		RequestTarget requestTarget = RequestTarget.fromRequest(request);

		assertEquals("/path", RequestUris.uri(request, requestTarget));
		assertEquals("/path", RequestUris.path(request, requestTarget));
	}

	@Test
	public void emptyQueryIsDropped() {
		HttpServletRequest request = mockRequest("GET", "HTTP/1.1", "/path", "", Map.of("Host", "example.com"));
		RequestTarget requestTarget = RequestTarget.fromRequest(request);

		assertEquals("/path", RequestUris.uri(request, requestTarget));
	}

	@Test
	public void emptyPathNormalizesToSlash() {
		HttpServletRequest request = mockRequest("GET", "HTTP/1.1", "", null, Map.of("Host", "example.com"));
		RequestTarget requestTarget = RequestTarget.fromRequest(request);

		assertEquals("/", RequestUris.uri(request, requestTarget));
		assertEquals("/", RequestUris.path(request, requestTarget));

		requestTarget = new RequestTarget(null, "a=b", "example.com");

		assertEquals("/?a=b", RequestUris.uri(request, requestTarget));
		assertEquals("/", RequestUris.path(request, requestTarget));
	}

	@Test
	public void http2ConnectUsesAuthority() {
		HttpServletRequest request = mockRequest("CONNECT", "HTTP/2.0", "www.example.com:443", null,
				Map.of("Host", "www.example.com:443"));
		RequestTarget requestTarget = RequestTarget.fromRequest(request);

		assertTrue(RequestUris.isHttp2Connect(request));
		assertEquals("www.example.com:443", RequestUris.uri(request, requestTarget));
		assertEquals("www.example.com:443", RequestUris.path(request, requestTarget));
	}

	@Test
	public void http2ConnectWithoutRequestUriFallsBackToHost() {
		HttpServletRequest request = mockRequest("CONNECT", "HTTP/2", null, null, Map.of("Host", "www.example.com:443"));
		RequestTarget requestTarget = RequestTarget.fromRequest(request);

		assertEquals("www.example.com:443", RequestUris.uri(request, requestTarget));
		assertEquals("www.example.com:443", RequestUris.path(request, requestTarget));
	}

	@Test
	public void connectOverHttp1IsNotSpecial() {
		HttpServletRequest request = mockRequest("CONNECT", "HTTP/1.1", "/tunnel", "x=1", Map.of("Host", "www.example.com:443"));
		RequestTarget requestTarget = RequestTarget.fromRequest(request);

		assertFalse(RequestUris.isHttp2Connect(request));
		assertEquals("/tunnel?x=1", RequestUris.uri(request, requestTarget));
		assertEquals("/tunnel", RequestUris.path(request, requestTarget));
	}

	@Test
	public void http2GetIsNotSpecial() {
		HttpServletRequest request = mockRequest("GET", "HTTP/2.0", "/path", "query=value", Map.of("Host", "example.com"));
		RequestTarget requestTarget = RequestTarget.fromRequest(request);

		assertEquals("/path?query=value", RequestUris.uri(request, requestTarget));
	}

	@Test
	public void repeatedCallsAgree() {
		HttpServletRequest request = mockRequest("GET", "HTTP/1.1", "/widgets/123", "color=red&size=l", Map.of("Host", "example.com"));
		RequestTarget requestTarget = RequestTarget.fromRequest(request);

		assertEquals(RequestUris.uri(request, requestTarget), RequestUris.uri(request, requestTarget));
		assertEquals(RequestUris.path(request, requestTarget), RequestUris.path(request, requestTarget));
		assertEquals(requestTarget, RequestTarget.fromRequest(request));
	}

	@Test
	public void protocolMajorVersion() {
		assertEquals(1, RequestUris.protocolMajorVersion("HTTP/1.1"));
		assertEquals(1, RequestUris.protocolMajorVersion("HTTP/1.0"));
		assertEquals(2, RequestUris.protocolMajorVersion("HTTP/2.0"));
		assertEquals(2, RequestUris.protocolMajorVersion("HTTP/2"));
		assertEquals(3, RequestUris.protocolMajorVersion("HTTP/3"));
		assertEquals(-1, RequestUris.protocolMajorVersion(null));
		assertEquals(-1, RequestUris.protocolMajorVersion(""));
		assertEquals(-1, RequestUris.protocolMajorVersion("HTTP"));
		assertEquals(-1, RequestUris.protocolMajorVersion("HTTP/"));
		assertEquals(-1, RequestUris.protocolMajorVersion("HTTP/x.y"));
		assertEquals(-1, RequestUris.protocolMajorVersion("HTTP/99999999999999999999"));
	}

	@Test
	public void requestTargetAuthorityFallsBackToServerNameAndPort() {
		HttpServletRequest request = mockRequest("GET", "HTTP/1.1", "/", null, Map.of());
		RequestTarget requestTarget = RequestTarget.fromRequest(request);

		assertEquals("localhost:8080", requestTarget.getAuthority());
		assertEquals("/", requestTarget.getPath());
		assertEquals("", requestTarget.getQuery());
	}
}
