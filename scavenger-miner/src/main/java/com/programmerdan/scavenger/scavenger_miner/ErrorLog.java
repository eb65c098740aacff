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

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Submission failures, kept in memory for the whole run and written out once when we exit.
 *
 * @author ProgrammerDan (Daniel Boston)
 */
public class ErrorLog {

	public static class Entry {
		final String timestamp;
		final String address;
		final String challengeId;
		final String nonce;
		final String error;

		Entry(String timestamp, String address, String challengeId, String nonce, String error) {
			this.timestamp = timestamp;
			this.address = address;
			this.challengeId = challengeId;
			this.nonce = nonce;
			this.error = error;
		}

		public String getError() {
			return error;
		}

		public String getChallengeId() {
			return challengeId;
		}

		public String getNonce() {
			return nonce;
		}

		/**
		 * {@code <timestamp> - <address>/<challenge_id>/<nonce> - <error>}
		 */
		public String format() {
			return timestamp + " - " + address + "/" + challengeId + "/" + nonce + " - " + error;
		}
	}

	private final ConcurrentLinkedQueue<Entry> entries = new ConcurrentLinkedQueue<>();

	public void record(String address, String challengeId, String nonce, String error) {
		entries.offer(new Entry(Utility.nowIso(), address, challengeId, nonce, error));
	}

	public List<Entry> getEntries() {
		return new ArrayList<>(entries);
	}

	public int size() {
		return entries.size();
	}

	/**
	 * Writes every entry to {@code <address>.<yyyyMMdd_HHmmss>.txt} in the given directory.
	 *
	 * @return the file written, or null if there was nothing to write
	 * @throws IOException if the file can't be written
	 */
	public File save(File directory, String address) throws IOException {
		if (entries.isEmpty()) {
			return null;
		}
		String stamp = new SimpleDateFormat("yyyyMMdd_HHmmss").format(new Date());
		File target = new File(directory, address + "." + stamp + ".txt");

		try (PrintWriter os = new PrintWriter(target, StandardCharsets.UTF_8)) {
			for (Entry entry : entries) {
				os.println(entry.format());
			}
			os.flush();
			if (os.checkError()) {
				throw new IOException("Failed writing " + target);
			}
		}
		return target;
	}
}
