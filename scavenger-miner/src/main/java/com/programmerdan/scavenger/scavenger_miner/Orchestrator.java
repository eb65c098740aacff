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

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Runs one challenge: publishes it to a fresh pool of {@link Worker}s, prints throughput every
 * stats interval, and joins everybody once the stop signal goes up.
 *
 * @author ProgrammerDan (Daniel Boston)
 */
public class Orchestrator {

	public static final long DEFAULT_STATS_INTERVAL = 10000l;
	public static final long POLL_DELAY = 100l;
	/**
	 * How often we complain while waiting on workers. The wait itself is unbounded: a worker may be
	 * mid-submission, and the stop signal and stats get reused by the next challenge.
	 */
	public static final long JOIN_NOTICE = 30000l;

	private final String address;
	private final int workersCount;
	private final boolean colors;
	private final HashOracleFactory oracles;
	private final Submission submission;
	private final MinerStats stats;
	private final AtomicBoolean stop;
	private final UncaughtExceptionHandler deathHandler;

	private final CPrint coPrint;
	private final ReentrantReadWriteLock challengeLock = new ReentrantReadWriteLock();
	private Challenge currentChallenge;

	private long joinNotice = JOIN_NOTICE;

	private final List<Worker> workers = Collections.synchronizedList(new ArrayList<>());

	/**
	 * @param submission null disables submit-on-find
	 * @param deathHandler handler for worker threads, may be null
	 */
	public Orchestrator(String address, int workersCount, boolean colors, HashOracleFactory oracles,
			Submission submission, MinerStats stats, AtomicBoolean stop, UncaughtExceptionHandler deathHandler) {
		if (workersCount < 1) {
			throw new IllegalArgumentException("Need at least one worker");
		}
		this.address = address;
		this.workersCount = workersCount;
		this.colors = colors;
		this.oracles = oracles;
		this.submission = submission;
		this.stats = stats;
		this.stop = stop;
		this.deathHandler = deathHandler;
		this.coPrint = new CPrint(colors);
	}

	public Challenge getChallenge() {
		challengeLock.readLock().lock();
		try {
			return currentChallenge;
		} finally {
			challengeLock.readLock().unlock();
		}
	}

	public void setChallenge(Challenge challenge) {
		challengeLock.writeLock().lock();
		try {
			this.currentChallenge = challenge;
		} finally {
			challengeLock.writeLock().unlock();
		}
	}

	/**
	 * Blocks until the stop signal is raised, the challenge expires, or this thread is interrupted,
	 * then joins the workers.
	 *
	 * @param statsInterval millis between throughput reports
	 */
	public void run(long statsInterval) {
		Challenge ch = getChallenge();
		if (ch == null) {
			coPrint.tag("orchestrator").alert().ln("No challenge set").clr();
			return;
		}

		coPrint.tag("orchestrator").info().p(Utility.nowIso()).label().p(" Starting with challenge: id=")
			.normData().p(ch.getChallengeId())
			.label().p(" difficulty=").hashData().p(ch.getDifficulty())
			.label().p(" expires=").textData().ln(ch.getLatestSubmission().isEmpty() ? "N/A" : ch.getLatestSubmission()).clr();

		ExecutorService hashers = startWorkers();
		long lastStats = System.currentTimeMillis();

		try {
			while (!stop.get()) {
				long now = System.currentTimeMillis();
				if (ch.isExpired(now)) {
					coPrint.tag("orchestrator").alert().p("Challenge ").normData().p(ch.getChallengeId())
						.alert().ln(" is past its latest submission time.").clr();
					break;
				}
				if (now - lastStats >= statsInterval) {
					printReport(stats.report());
					lastStats = now;
				}
				Thread.sleep(POLL_DELAY);
			}
		} catch (InterruptedException ie) {
			coPrint.ln().tag("orchestrator").alert().ln("Stopping...").clr();
			Thread.currentThread().interrupt();
		} finally {
			coPrint.tag("orchestrator").msg().ln("Stopping workers...").clr();
			stop.set(true);
			join(hashers);
			coPrint.tag("orchestrator").info().p("Challenge ").normData().p(ch.getChallengeId())
				.info().p(" done. Hashes: ").normData().fd(stats.getHashes())
				.info().p("  Solutions: ").normData().fd(stats.getSolutions()).ln().clr();
		}
	}

	private ExecutorService startWorkers() {
		workers.clear();
		ExecutorService hashers = Executors.newFixedThreadPool(workersCount,
				new WorkerThreadFactory("ScavengerWorker", true, deathHandler));
		for (int i = 0; i < workersCount; i++) {
			Worker w = new Worker(i, oracles.createOracle(i), address, this::getChallenge, stats, stop, submission,
					colors);
			workers.add(w);
			hashers.execute(w);
		}
		coPrint.tag("orchestrator").msg().p("started ").normData().fd(workersCount).msg().ln(" workers").clr();
		return hashers;
	}

	private void join(ExecutorService hashers) {
		boolean interrupted = Thread.interrupted();
		hashers.shutdown();
		try {
			while (true) {
				try {
					if (hashers.awaitTermination(joinNotice, TimeUnit.MILLISECONDS)) {
						return;
					}
					coPrint.tag("orchestrator").alert().p("Still waiting on ").normData().fd(activeWorkers())
						.alert().ln(" workers to finish up...").clr();
				} catch (InterruptedException ie) {
					// workers finish on their own, every call they make is bounded
					interrupted = true;
				}
			}
		} finally {
			if (interrupted) {
				Thread.currentThread().interrupt();
			}
		}
	}

	private long activeWorkers() {
		long count = 0;
		for (Worker w : getWorkers()) {
			if (w.isActive()) {
				count++;
			}
		}
		return count;
	}

	private void printReport(Report report) {
		coPrint.tag("stats").info().p("hashes=").normData().fd(report.getHashes())
			.info().p(" (").normData().fp("%.1f", report.getHashesPerSecond()).unitLabel().p(" H/s")
			.info().p(") solutions=").normData().fd(report.getSolutions()).ln().clr();
	}

	public List<Worker> getWorkers() {
		synchronized (workers) {
			return new ArrayList<>(workers);
		}
	}

	void setJoinNotice(long joinNotice) {
		this.joinNotice = joinNotice;
	}
}
