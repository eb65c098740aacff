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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;

import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * POSTs solutions to {@code <base>/solution/<address>/<challenge_id>/<nonce>}.
 *
 * @author ProgrammerDan (Daniel Boston)
 */
public class HttpSubmissionClient implements SubmissionClient {

	public static final int DEFAULT_TIMEOUT = 10000;

	private final String baseUrl;
	private final int timeout;

	public HttpSubmissionClient(String baseUrl) {
		this(baseUrl, DEFAULT_TIMEOUT);
	}

	public HttpSubmissionClient(String baseUrl, int timeout) {
		String base = baseUrl.trim();
		while (base.endsWith("/")) {
			base = base.substring(0, base.length() - 1);
		}
		this.baseUrl = base;
		this.timeout = timeout;
	}

	public String solutionUrl(String address, String challengeId, String nonce) {
		return new StringBuilder(baseUrl).append("/solution/").append(address).append('/').append(challengeId)
				.append('/').append(nonce).toString();
	}

	@Override
	public SubmitResult submit(String address, String challengeId, String nonce) {
		HttpURLConnection con = null;
		try {
			URL url = new URL(solutionUrl(address, challengeId, nonce));
			con = (HttpURLConnection) url.openConnection();
			con.setRequestMethod("POST");
			con.setRequestProperty("Content-Type", "application/json");
			con.setRequestProperty("Accept", "application/json");
			con.setConnectTimeout(timeout);
			con.setReadTimeout(timeout);
			con.setDoOutput(true);

			byte[] data = new JSONObject().toJSONString().getBytes(StandardCharsets.UTF_8);
			try (OutputStream out = con.getOutputStream()) {
				out.write(data);
				out.flush();
			}

			int status = con.getResponseCode();
			String text = readBody(status >= 400 ? con.getErrorStream() : con.getInputStream());
			return SubmitResult.response(status, parseBody(text));
		} catch (IOException | RuntimeException e) {
			String message = e.getMessage();
			return SubmitResult.failure(e.getClass().getSimpleName() + (message == null ? "" : ": " + message));
		} finally {
			if (con != null) {
				con.disconnect();
			}
		}
	}

	private static String readBody(InputStream in) throws IOException {
		if (in == null) {
			return "";
		}
		try (InputStream is = in) {
			ByteArrayOutputStream buffer = new ByteArrayOutputStream();
			byte[] chunk = new byte[4096];
			int read;
			while ((read = is.read(chunk)) >= 0) {
				buffer.write(chunk, 0, read);
			}
			return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
		}
	}

	/**
	 * JSON if it parses, otherwise the text as-is.
	 */
	static Object parseBody(String text) {
		if (text == null || text.trim().isEmpty()) {
			return text == null ? "" : text;
		}
		try {
			Object parsed = new JSONParser().parse(text);
			return parsed == null ? text : parsed;
		} catch (ParseException pe) {
			return text;
		}
	}

	@Override
	public String toString() {
		return baseUrl;
	}
}
