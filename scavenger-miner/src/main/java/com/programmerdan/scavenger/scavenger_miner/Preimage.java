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
 * Builds what gets hashed. Field order is fixed and must match what the hash daemon expects:
 * nonce, address, challenge id, difficulty, no_pre_mine, latest submission, no_pre_mine hour, no delimiters.
 *
 * @author ProgrammerDan (Daniel Boston)
 */
public final class Preimage {

	/**
	 * Separates the daemon's cache key from the preimage on the wire.
	 */
	public static final char KEY_DELIMITER = '|';

	private Preimage() {
	}

	public static String build(String nonce, String address, Challenge challenge) {
		StringBuilder sb = new StringBuilder(160);
		sb.append(nonce)
			.append(address)
			.append(challenge.getChallengeId())
			.append(challenge.getDifficulty())
			.append(challenge.getNoPreMine())
			.append(challenge.getLatestSubmission())
			.append(challenge.getNoPreMineHour());
		return sb.toString();
	}

	/**
	 * The daemon line: no_pre_mine, then '|', then the preimage. The daemon keys its expensive
	 * init state on the part before the delimiter, so no separate init call is needed.
	 */
	public static String payload(String nonce, String address, Challenge challenge) {
		return challenge.getNoPreMine() + KEY_DELIMITER + build(nonce, address, challenge);
	}
}
