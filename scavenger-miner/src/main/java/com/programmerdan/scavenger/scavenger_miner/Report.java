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
 * A throughput snapshot, one per stats interval.
 *
 * @author ProgrammerDan (Daniel Boston)
 *
 */
public class Report {
	/**
	 * When report was taken
	 */
	final long reportTime;

	/**
	 * Millis since the previous report (or since reset)
	 */
	final long interval;

	/**
	 * Hashes completed during the interval
	 */
	final long intervalHashes;

	/**
	 * Hashes since the challenge started
	 */
	final long hashes;

	final long solutions;

	Report(long reportTime, long interval, long intervalHashes, long hashes, long solutions) {
		this.reportTime = reportTime;
		this.interval = interval;
		this.intervalHashes = intervalHashes;
		this.hashes = hashes;
		this.solutions = solutions;
	}

	public double getHashesPerSecond() {
		return (double) intervalHashes / (Math.max(1l, interval) / 1000d);
	}

	public long getHashes() {
		return hashes;
	}

	public long getIntervalHashes() {
		return intervalHashes;
	}

	public long getSolutions() {
		return solutions;
	}

	public long getInterval() {
		return interval;
	}

	public long getReportTime() {
		return reportTime;
	}
}
