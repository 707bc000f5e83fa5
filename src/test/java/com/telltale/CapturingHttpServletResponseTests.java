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

import com.telltale.TestSupport.ByteArrayServletOutputStream;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import javax.servlet.ServletOutputStream;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;

import static com.telltale.TestSupport.mockResponse;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class CapturingHttpServletResponseTests {
	@Test
	public void defaultsTo200WhenBytesWrittenWithoutStatus() throws IOException {
		ByteArrayServletOutputStream body = new ByteArrayServletOutputStream();
		CapturingHttpServletResponse response = new CapturingHttpServletResponse(mockResponse(body));

		assertFalse(response.isStatusFinal());

		response.getOutputStream().write("hello".getBytes(UTF_8));

		assertEquals(200, response.getCapturedStatus());
		assertEquals(5, response.getBytesWritten());
		assertTrue(response.isStatusFinal());
		assertEquals("hello", body.toUtf8String());
	}

	@Test
	public void explicitStatusIsRecordedAndPassedThrough() throws IOException {
		ByteArrayServletOutputStream body = new ByteArrayServletOutputStream();
		HttpServletResponse underlying = mockResponse(body);
		CapturingHttpServletResponse response = new CapturingHttpServletResponse(underlying);

		response.setStatus(404);
		response.getOutputStream().write("missing".getBytes(UTF_8));

		assertEquals(404, response.getCapturedStatus());
		verify(underlying).setStatus(404);
	}

	@Test
	public void statusIsFixedOnceBodyIsWritten() throws IOException {
		ByteArrayServletOutputStream body = new ByteArrayServletOutputStream();
		HttpServletResponse underlying = mockResponse(body);
		CapturingHttpServletResponse response = new CapturingHttpServletResponse(underlying);

		response.setStatus(201);
		response.getOutputStream().write('x');
		response.setStatus(500);

		assertEquals(201, response.getCapturedStatus());
		// Still passed through, the container decides what to do with it
		verify(underlying).setStatus(500);
	}

	@Test
	public void bodyWithoutStatusThenStatusStays200() throws IOException {
		CapturingHttpServletResponse response = new CapturingHttpServletResponse(mockResponse(new ByteArrayServletOutputStream()));

		response.getOutputStream().write('x');
		response.setStatus(418);

		assertEquals(200, response.getCapturedStatus());
	}

	@Test
	public void bytesAccumulateAcrossWrites() throws IOException {
		ByteArrayServletOutputStream body = new ByteArrayServletOutputStream();
		CapturingHttpServletResponse response = new CapturingHttpServletResponse(mockResponse(body));
		ServletOutputStream outputStream = response.getOutputStream();

		outputStream.write(new byte[10]);
		outputStream.write(new byte[20], 5, 7);
		outputStream.write(1);
		outputStream.write(new byte[0]);

		assertEquals(18, response.getBytesWritten());
		assertEquals(18, body.toByteArray().length);
		assertSame(outputStream, response.getOutputStream());
	}

	@Test
	public void writerBytesAreCountedAfterEncoding() throws IOException {
		ByteArrayServletOutputStream body = new ByteArrayServletOutputStream();
		CapturingHttpServletResponse response = new CapturingHttpServletResponse(mockResponse(body));
		PrintWriter writer = response.getWriter();

		writer.write("héllo");
		writer.print('!');
		writer.flush();

		// é is two bytes in UTF-8
		assertEquals(7, response.getBytesWritten());
		assertEquals(200, response.getCapturedStatus());
		assertArrayEquals("héllo!".getBytes(UTF_8), body.toByteArray());
	}

	@Test
	public void sendErrorFixesStatus() throws IOException {
		HttpServletResponse underlying = mockResponse(new ByteArrayServletOutputStream());
		CapturingHttpServletResponse response = new CapturingHttpServletResponse(underlying);

		response.sendError(503, "Down for maintenance");
		response.setStatus(200);

		assertEquals(503, response.getCapturedStatus());
		verify(underlying).sendError(503, "Down for maintenance");
	}

	@Test
	public void sendRedirectRecords302() throws IOException {
		HttpServletResponse underlying = mockResponse(new ByteArrayServletOutputStream());
		CapturingHttpServletResponse response = new CapturingHttpServletResponse(underlying);

		response.sendRedirect("/elsewhere");

		assertEquals(302, response.getCapturedStatus());
		verify(underlying).sendRedirect("/elsewhere");
	}

	@Test
	public void flushBufferFixesStatus() throws IOException {
		CapturingHttpServletResponse response = new CapturingHttpServletResponse(mockResponse(new ByteArrayServletOutputStream()));

		response.setStatus(204);
		response.flushBuffer();
		response.setStatus(500);

		assertEquals(204, response.getCapturedStatus());
		assertEquals(0, response.getBytesWritten());
	}

	@Test
	public void lastStatusBeforeCommitWins() {
		CapturingHttpServletResponse response = new CapturingHttpServletResponse(mock(HttpServletResponse.class));

		response.setStatus(200);
		response.setStatus(404);

		assertEquals(404, response.getCapturedStatus());
		assertFalse(response.isStatusFinal());
	}

	@Test
	public void resetBeforeCommitRestores200() {
		HttpServletResponse underlying = mock(HttpServletResponse.class);
		CapturingHttpServletResponse response = new CapturingHttpServletResponse(underlying);

		response.setStatus(404);
		response.reset();

		assertEquals(200, response.getCapturedStatus());
		verify(underlying).reset();
	}

	@Test
	public void resetAfterCommitKeepsStatus() throws IOException {
		CapturingHttpServletResponse response = new CapturingHttpServletResponse(mockResponse(new ByteArrayServletOutputStream()));

		response.setStatus(404);
		response.flushBuffer();
		response.reset();

		assertEquals(404, response.getCapturedStatus());
	}

	@Test
	public void surrogatePairSplitAcrossWritesIsCountedOnce() throws IOException {
		ByteArrayServletOutputStream body = new ByteArrayServletOutputStream();
		CapturingHttpServletResponse response = new CapturingHttpServletResponse(mockResponse(body));
		PrintWriter writer = response.getWriter();
		String grinningFace = new String(Character.toChars(0x1F600));

		writer.write(grinningFace.charAt(0));
		writer.write(grinningFace.charAt(1));
		writer.write("ok");
		writer.flush();

		// Four bytes for the emoji in UTF-8, not two replacement characters
		assertEquals(6, response.getBytesWritten());
		assertArrayEquals((grinningFace + "ok").getBytes(UTF_8), body.toByteArray());
	}
}
