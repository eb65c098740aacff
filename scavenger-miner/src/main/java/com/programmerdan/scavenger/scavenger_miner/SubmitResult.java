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

/**
 * Outcome of a single submission attempt: either the server answered (with some status), or the
 * request itself failed.
 *
 * @author ProgrammerDan (Daniel Boston)
 */
public class SubmitResult {

	public static final int HTTP_CREATED = 201;

	private final int status;
	private final Object body;
	private final String error;

	private SubmitResult(int status, Object body, String error) {
		this.status = status;
		this.body = body;
		this.error = error;
	}

	/**
	 * @param body parsed JSON if it parsed, else the raw text
	 */
	public static SubmitResult response(int status, Object body) {
		return new SubmitResult(status, body, null);
	}

	public static SubmitResult failure(String error) {
		return new SubmitResult(-1, null, error);
	}

	public boolean isAccepted() {
		return status == HTTP_CREATED;
	}

	/**
	 * @return true if the request never got a response
	 */
	public boolean isRequestError() {
		return error != null;
	}

	/**
	 * @return HTTP status, -1 for request errors
	 */
	public int getStatus() {
		return status;
	}

	public Object getBody() {
		return body;
	}

	public String getError() {
		return error;
	}

	/**
	 * What goes in the error log for a failed attempt.
	 */
	public String describe() {
		if (isRequestError()) {
			return error;
		}
		return "HTTP " + status + ": " + body;
	}

	@Override
	public String toString() {
		return isRequestError() ? "error " + error : status + " " + body;
	}
}
