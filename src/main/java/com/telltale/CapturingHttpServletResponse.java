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
import javax.servlet.ServletOutputStream;
import javax.servlet.WriteListener;
import javax.servlet.http.HttpServletResponse;
import javax.servlet.http.HttpServletResponseWrapper;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Passes every call through to the wrapped response while recording the status code and the number of body
 * bytes written.
 * <p>
 * The recorded status tracks {@link #setStatus(int)} until the response is committed (first body byte,
 * {@link #flushBuffer()}, {@link #sendError(int)} or {@link #sendRedirect(String)}); after that it no longer changes,
 * matching what the client actually receives. If bytes are written before any status is set, the recorded status
 * is {@code 200}, and an uncommitted {@link #reset()} sets it back to {@code 200}.
 * <p>
 * Bytes written through {@link #getWriter()} are counted after encoding with the response's character encoding.
 * <p>
 * This class is intended for use by a single request-handling thread.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class CapturingHttpServletResponse extends HttpServletResponseWrapper {
	private int capturedStatus;
	private boolean statusFinal;
	private long bytesWritten;
	@Nullable
	private CountingServletOutputStream outputStream;
	@Nullable
	private PrintWriter writer;

	public CapturingHttpServletResponse(@NonNull HttpServletResponse httpServletResponse) {
		super(requireNonNull(httpServletResponse));
		this.capturedStatus = HttpServletResponse.SC_OK;
	}

	@Override
	public void setStatus(int sc) {
		recordStatus(sc);
		super.setStatus(sc);
	}

	@Override
	@Deprecated
	public void setStatus(int sc, String sm) {
		recordStatus(sc);
		super.setStatus(sc, sm);
	}

	@Override
	public void sendError(int sc) throws IOException {
		recordStatus(sc);
		this.statusFinal = true;
		super.sendError(sc);
	}

	@Override
	public void sendError(int sc, String msg) throws IOException {
		recordStatus(sc);
		this.statusFinal = true;
		super.sendError(sc, msg);
	}

	@Override
	public void sendRedirect(String location) throws IOException {
		recordStatus(HttpServletResponse.SC_FOUND);
		this.statusFinal = true;
		super.sendRedirect(location);
	}

	@Override
	public void flushBuffer() throws IOException {
		this.statusFinal = true;
		super.flushBuffer();
	}

	@Override
	public void reset() {
		super.reset();

		// An uncommitted reset clears the status along with headers and buffer
		if (!this.statusFinal)
			this.capturedStatus = HttpServletResponse.SC_OK;
	}

	@Override
	@NonNull
	public ServletOutputStream getOutputStream() throws IOException {
		if (this.outputStream == null)
			this.outputStream = new CountingServletOutputStream(super.getOutputStream());

		return this.outputStream;
	}

	@Override
	@NonNull
	public PrintWriter getWriter() throws IOException {
		if (this.writer == null)
			this.writer = new PrintWriter(new CountingWriter(super.getWriter(), writerCharset()));

		return this.writer;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{capturedStatus=%d, bytesWritten=%d}", getClass().getSimpleName(), getCapturedStatus(), getBytesWritten());
	}

	/**
	 * The status code the client receives (or will receive) for this response.
	 *
	 * @return the captured status code
	 */
	public int getCapturedStatus() {
		return this.capturedStatus;
	}

	/**
	 * Total body bytes written so far.
	 *
	 * @return the byte count
	 */
	public long getBytesWritten() {
		return this.bytesWritten;
	}

	/**
	 * Has the status been fixed by a commit of the response?
	 *
	 * @return {@code true} if later status changes will not be recorded
	 */
	public boolean isStatusFinal() {
		return this.statusFinal;
	}

	protected void recordStatus(int sc) {
		if (!this.statusFinal)
			this.capturedStatus = sc;
	}

	protected void recordBytesWritten(long count) {
		if (count <= 0)
			return;

		this.statusFinal = true;
		this.bytesWritten += count;
	}

	@NonNull
	protected Charset writerCharset() {
		String characterEncoding = getCharacterEncoding();

		if (characterEncoding == null)
			return StandardCharsets.ISO_8859_1;

		try {
			return Charset.forName(characterEncoding);
		} catch (IllegalArgumentException e) {
			return StandardCharsets.ISO_8859_1;
		}
	}

	@NotThreadSafe
	protected class CountingServletOutputStream extends ServletOutputStream {
		@NonNull
		private final ServletOutputStream servletOutputStream;

		protected CountingServletOutputStream(@NonNull ServletOutputStream servletOutputStream) {
			this.servletOutputStream = requireNonNull(servletOutputStream);
		}

		@Override
		public void write(int b) throws IOException {
			this.servletOutputStream.write(b);
			recordBytesWritten(1);
		}

		@Override
		public void write(byte[] b, int off, int len) throws IOException {
			this.servletOutputStream.write(b, off, len);
			recordBytesWritten(len);
		}

		@Override
		public void flush() throws IOException {
			CapturingHttpServletResponse.this.statusFinal = true;
			this.servletOutputStream.flush();
		}

		@Override
		public void close() throws IOException {
			this.servletOutputStream.close();
		}

		@Override
		public boolean isReady() {
			return this.servletOutputStream.isReady();
		}

		@Override
		public void setWriteListener(WriteListener writeListener) {
			this.servletOutputStream.setWriteListener(writeListener);
		}
	}

	@NotThreadSafe
	protected class CountingWriter extends Writer {
		@NonNull
		private final Writer writer;
		@NonNull
		private final Charset charset;
		// High surrogate whose low half has not been written yet
		@Nullable
		private Character pendingHighSurrogate;

		protected CountingWriter(@NonNull Writer writer,
														 @NonNull Charset charset) {
			this.writer = requireNonNull(writer);
			this.charset = requireNonNull(charset);
		}

		@Override
		public void write(char[] cbuf, int off, int len) throws IOException {
			this.writer.write(cbuf, off, len);

			if (len <= 0)
				return;

			StringBuilder chars = new StringBuilder(len + 1);

			if (this.pendingHighSurrogate != null) {
				chars.append(this.pendingHighSurrogate.charValue());
				this.pendingHighSurrogate = null;
			}

			chars.append(cbuf, off, len);

			int lastIndex = chars.length() - 1;

			if (Character.isHighSurrogate(chars.charAt(lastIndex))) {
				this.pendingHighSurrogate = chars.charAt(lastIndex);
				chars.setLength(lastIndex);
			}

			if (chars.length() > 0)
				recordBytesWritten(chars.toString().getBytes(this.charset).length);
		}

		@Override
		public void flush() throws IOException {
			CapturingHttpServletResponse.this.statusFinal = true;
			this.writer.flush();
		}

		@Override
		public void close() throws IOException {
			// A dangling high surrogate is still encoded, as a replacement
			if (this.pendingHighSurrogate != null) {
				recordBytesWritten(String.valueOf(this.pendingHighSurrogate.charValue()).getBytes(this.charset).length);
				this.pendingHighSurrogate = null;
			}

			this.writer.close();
		}
	}
}
