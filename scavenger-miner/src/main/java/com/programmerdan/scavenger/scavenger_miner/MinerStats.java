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
 * Process-wide counters, shared by every worker. Reset between challenges.
 *
 * @author ProgrammerDan (Daniel Boston)
 */
public class MinerStats {

	private long hashes;
	private long solutions;
	private long lastReport;
	private long lastReportHashes;

	public MinerStats() {
		reset();
	}

	public synchronized void addHashes(long n) {
		this.hashes += n;
	}

	public synchronized void incSolutions() {
		this.solutions++;
	}

	public synchronized long getHashes() {
		return hashes;
	}

	public synchronized long getSolutions() {
		return solutions;
	}

	public synchronized void reset() {
		this.hashes = 0l;
		this.solutions = 0l;
		this.lastReport = System.currentTimeMillis();
		this.lastReportHashes = 0l;
	}

	/**
	 * Snapshot since the last call (or reset), and start the next interval.
	 */
	public synchronized Report report() {
		long now = System.currentTimeMillis();
		Report report = new Report(now, now - lastReport, hashes - lastReportHashes, hashes, solutions);
		lastReport = now;
		lastReportHashes = hashes;
		return report;
	}
}
