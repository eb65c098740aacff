/**
The MIT License (MIT)
Copyright (c) 2018 AroDev, adaptation portions (c) 2018 ProgrammerDan (Daniel Boston)

www.arionum.com

Permission is hereby granted, free of charge, to any person obtaining a copy
of this software and associated documentation files (the "Software"), to deal
in the Software without restriction, including without limitation the rights
to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
copies of the Software, and to permit persons to whom the Software is
furnished to do so, subject to the following conditions:

The above copyright notice and this permission notice shall be included in all
copies or substantial portions of
the Software.

THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF
MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT.
IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM,
DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR
OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE
OR OTHER DEALINGS IN THE SOFTWARE.

 */
package com.programmerdan.scavenger.scavenger_miner;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Talks to the local hash daemon over a persistent TCP connection, one line out, one line back.
 *
 * Any trouble on the socket throws the connection away; the next call reconnects. Nothing here
 * propagates I/O errors to the worker, it just sees "no result" and moves on.
 *
 * @author ProgrammerDan (Daniel Boston)
 */
public class DaemonHashOracle implements HashOracle {

	public static final int DEFAULT_TIMEOUT = 5000;

	/**
	 * Longest reply line we accept, in bytes. A hash is a few hundred hex chars at most.
	 */
	public static final int MAX_LINE = 1024;

	private final String host;
	private final int port;
	private final int timeout;

	private Socket socket;
	private InputStream in;
	private OutputStream out;

	public DaemonHashOracle(String host, int port) {
		this(host, port, DEFAULT_TIMEOUT);
	}

	/**
	 * @param timeout connect and read timeout, millis
	 */
	public DaemonHashOracle(String host, int port, int timeout) {
		this.host = host;
		this.port = port;
		this.timeout = timeout;
	}

	@Override
	public synchronized boolean ensureConnected() {
		if (socket != null) {
			return true;
		}
		Socket s = new Socket();
		try {
			s.connect(new InetSocketAddress(host, port), timeout);
			s.setSoTimeout(timeout);
			s.setTcpNoDelay(true);
			this.in = new BufferedInputStream(s.getInputStream());
			this.out = s.getOutputStream();
			this.socket = s;
			return true;
		} catch (IOException ioe) {
			closeQuietly(s);
			drop();
			return false;
		}
	}

	@Override
	public synchronized String exchange(String payload) {
		if (!ensureConnected()) {
			return null;
		}
		try {
			out.write((payload + "\n").getBytes(StandardCharsets.UTF_8));
			out.flush();

			String line = readLine().trim();
			if (line.isEmpty()) {
				drop();
				return null;
			}
			return line;
		} catch (IOException ioe) {
			drop();
			return null;
		}
	}

	/**
	 * Reads through the first newline. Whatever else the daemon already pushed is discarded, we
	 * only ever want the first line of a reply.
	 *
	 * @throws IOException if no complete line of at most {@link #MAX_LINE} bytes arrives
	 */
	private String readLine() throws IOException {
		ByteArrayOutputStream buffer = new ByteArrayOutputStream(128);
		int b;
		while ((b = in.read()) != '\n') {
			if (b < 0) {
				throw new EOFException("daemon closed");
			}
			if (buffer.size() >= MAX_LINE) {
				throw new IOException("daemon reply longer than " + MAX_LINE + " bytes");
			}
			buffer.write(b);
		}
		int extra = in.available();
		if (extra > 0) {
			in.skip(extra);
		}
		return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
	}

	@Override
	public synchronized void close() {
		drop();
	}

	public synchronized boolean isConnected() {
		return socket != null;
	}

	private void drop() {
		closeQuietly(socket);
		socket = null;
		in = null;
		out = null;
	}

	private static void closeQuietly(Socket s) {
		if (s == null) {
			return;
		}
		try {
			s.close();
		} catch (IOException ignored) {
			// already dead, reconnect handles it
		}
	}

	@Override
	public String toString() {
		return "daemon@" + host + ":" + port;
	}
}
