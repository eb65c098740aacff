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
 * Difficulty check against a 32-bit mask.
 *
 * The left 4 bytes of the hash are read as an unsigned int; every bit that is zero in the mask
 * must also be zero in those 4 bytes. Bits set in the mask are don't-care.
 *
 * @author ProgrammerDan (Daniel Boston)
 */
public final class Difficulty {

	private static final long MASK_32 = 0xFFFFFFFFL;

	private Difficulty() {
	}

	/**
	 * @param left4 first 4 bytes of the hash, unsigned, in the low 32 bits
	 * @param mask difficulty mask, unsigned, in the low 32 bits
	 * @return true iff (left4 &amp; ~mask) is zero over 32 bits
	 */
	public static boolean meets(long left4, long mask) {
		return (left4 & ~mask & MASK_32) == 0;
	}

	/**
	 * Never throws; anything malformed just doesn't meet the difficulty.
	 *
	 * @param hashHex hex hash as returned by the daemon, at least 8 characters
	 * @param difficultyHex hex mask, optionally 0x prefixed
	 * @return true if the hash meets the mask
	 */
	public static boolean meets(String hashHex, String difficultyHex) {
		if (hashHex == null || hashHex.length() < 8 || difficultyHex == null) {
			return false;
		}
		long left4 = parseHex(hashHex.substring(0, 8));
		long mask = parseHex(stripPrefix(difficultyHex.trim()));
		if (left4 < 0 || mask < 0) {
			return false;
		}
		return meets(left4, mask);
	}

	private static String stripPrefix(String hex) {
		if (hex.startsWith("0x") || hex.startsWith("0X")) {
			return hex.substring(2);
		}
		return hex;
	}

	/**
	 * Keeps only the low 32 bits of wide values.
	 *
	 * @return the value, or -1 if empty or not hex
	 */
	private static long parseHex(String hex) {
		if (hex.isEmpty()) {
			return -1;
		}
		long value = 0;
		for (int i = 0; i < hex.length(); i++) {
			char c = hex.charAt(i);
			if (!Utility.isHex(c)) {
				return -1;
			}
			value = ((value << 4) | Character.digit(c, 16)) & MASK_32;
		}
		return value;
	}
}
