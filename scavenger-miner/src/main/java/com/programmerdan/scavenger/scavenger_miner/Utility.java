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

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Random;

/**
 * Small grab bag of helpers shared by the workers and the run loop.
 *
 * @author ProgrammerDan (Daniel Boston)
 *
 */
public class Utility {

	private static final char[] HEX = "0123456789abcdef".toCharArray();

	/**
	 * @param random source of randomness, one per worker
	 * @return a 64-bit nonce as exactly 16 lowercase hex characters
	 */
	public static String randomNonce(Random random) {
		long nonce = random.nextLong();
		char[] out = new char[16];
		for (int i = 15; i >= 0; i--) {
			out[i] = HEX[(int) (nonce & 0xF)];
			nonce >>>= 4;
		}
		return new String(out);
	}

	/**
	 * Accepts ISO-8601 with an offset or a trailing Z ("2025-10-30T23:59:59Z",
	 * "2025-10-30T23:59:59.000+00:00"). A timestamp with no offset at all is read as local time.
	 *
	 * @param timestamp the challenge's latest submission field
	 * @return epoch millis, or null if the timestamp can't be read
	 */
	public static Long parseDeadline(String timestamp) {
		if (timestamp == null || timestamp.trim().isEmpty()) {
			return null;
		}
		String ts = timestamp.trim();
		try {
			return OffsetDateTime.parse(ts).toInstant().toEpochMilli();
		} catch (DateTimeParseException e) {
			// no offset? fall through
		}
		try {
			return LocalDateTime.parse(ts).atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
		} catch (DateTimeParseException e) {
			return null;
		}
	}

	/**
	 * @return current UTC time, ISO-8601
	 */
	public static String nowIso() {
		return OffsetDateTime.now(ZoneOffset.UTC).toString();
	}

	/**
	 * @param c a character
	 * @return true for 0-9, a-f, A-F
	 */
	public static boolean isHex(char c) {
		return Character.digit(c, 16) >= 0;
	}

	/**
	 * Sleeps, restoring the interrupt flag instead of throwing.
	 *
	 * @param millis how long
	 * @return false if we were interrupted
	 */
	public static boolean pause(long millis) {
		try {
			Thread.sleep(millis);
			return true;
		} catch (InterruptedException ie) {
			Thread.currentThread().interrupt();
			return false;
		}
	}
}
