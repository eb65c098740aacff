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

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads challenges from a CSV file.
 *
 * <pre>
 * Column A: challengeId
 * Column B: difficulty
 * Column C: noPreMine
 * Column D: noPreMineHour
 * Column E: latestSubmission
 * </pre>
 *
 * The first row is a header. Rows with fewer than five columns, or missing id, difficulty or
 * noPreMine, are skipped.
 *
 * @author ProgrammerDan (Daniel Boston)
 */
public class ChallengeReader {

	public static final int COLUMNS = 5;

	public List<Challenge> read(File csv) throws IOException {
		try (BufferedReader in = Files.newBufferedReader(csv.toPath(), StandardCharsets.UTF_8)) {
			return read(in);
		}
	}

	public List<Challenge> read(Reader source) throws IOException {
		BufferedReader in = source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);
		List<Challenge> challenges = new ArrayList<>();

		String line = in.readLine(); // header
		if (line == null) {
			return challenges;
		}
		while ((line = in.readLine()) != null) {
			List<String> row = splitRow(line);
			if (row.size() < COLUMNS) {
				continue;
			}
			Challenge challenge = toChallenge(row);
			if (challenge != null) {
				challenges.add(challenge);
			}
		}
		return challenges;
	}

	/**
	 * @return null if a required field is blank
	 */
	static Challenge toChallenge(List<String> row) {
		String challengeId = row.get(0).trim();
		String difficulty = row.get(1).trim();
		String noPreMine = row.get(2).trim();
		String noPreMineHour = row.get(3).trim();
		String latestSubmission = row.get(4).trim();

		if (challengeId.isEmpty() || difficulty.isEmpty() || noPreMine.isEmpty()) {
			return null;
		}
		if (latestSubmission.isEmpty()) {
			latestSubmission = Challenge.FAR_FUTURE;
		}
		return new Challenge(challengeId, difficulty, noPreMine, noPreMineHour, latestSubmission);
	}

	/**
	 * Comma split honoring double quotes; "" inside quotes is a literal quote.
	 */
	static List<String> splitRow(String line) {
		List<String> fields = new ArrayList<>();
		if (line.isEmpty()) {
			return fields;
		}
		StringBuilder field = new StringBuilder();
		boolean quoted = false;
		for (int i = 0; i < line.length(); i++) {
			char c = line.charAt(i);
			if (quoted) {
				if (c == '"') {
					if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
						field.append('"');
						i++;
					} else {
						quoted = false;
					}
				} else {
					field.append(c);
				}
			} else if (c == '"') {
				quoted = true;
			} else if (c == ',') {
				fields.add(field.toString());
				field.setLength(0);
			} else {
				field.append(c);
			}
		}
		fields.add(field.toString());
		return fields;
	}
}
