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

import java.security.SecureRandom;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import com.diogonunes.jcdp.color.api.Ansi.Attribute;
import com.diogonunes.jcdp.color.api.Ansi.FColor;

/**
 * One nonce searcher. Pulls the published challenge, throws random nonces at its own
 * {@link HashOracle}, and checks what comes back against the difficulty mask. On a find it
 * drives the {@link Submission} and then raises the shared stop signal, which ends the
 * challenge for everybody.
 *
 * Shares nothing with other workers except the challenge getter, the {@link MinerStats} and the
 * stop signal.
 *
 * @author ProgrammerDan (Daniel Boston)
 */
public class Worker implements Runnable {

	/**
	 * Nonces tried per challenge acquisition before re-reading the challenge.
	 */
	public static final int NONCE_BATCH = 1024;

	public static final long IDLE_DELAY = 500l;
	public static final long CONNECT_BACKOFF = 100l;
	public static final long NO_RESULT_BACKOFF = 10l;
	public static final long FOUND_PAUSE = 500l;

	private final String who;
	private final HashOracle oracle;
	private final String address;
	private final Supplier<Challenge> challengeGetter;
	private final MinerStats stats;
	private final AtomicBoolean stop;
	/* null when submit-on-find is off */
	private final Submission submission;
	private final CPrint coPrint;
	private final Random random;

	protected volatile boolean active;
	protected volatile long hashCount;
	protected volatile long finds;

	public Worker(int id, HashOracle oracle, String address, Supplier<Challenge> challengeGetter, MinerStats stats,
			AtomicBoolean stop, Submission submission, boolean colors) {
		this.who = "worker " + id;
		this.oracle = oracle;
		this.address = address;
		this.challengeGetter = challengeGetter;
		this.stats = stats;
		this.stop = stop;
		this.submission = submission;
		this.coPrint = new CPrint(colors);
		this.random = new SecureRandom();
	}

	@Override
	public void run() {
		active = true;
		try {
			go();
		} catch (RuntimeException | Error e) {
			coPrint.a(Attribute.BOLD).f(FColor.RED)
				.p("Detected thread ").f(FColor.WHITE).p(Thread.currentThread().getName())
				.f(FColor.RED).p(" death due to error: ").a(Attribute.LIGHT).ln(e.getMessage()).clr();
			throw e;
		} finally {
			active = false;
			oracle.close();
			coPrint.tag(who).msg().p("stopping after ").normData().fd(hashCount).unitLabel().ln(" hashes").clr();
		}
	}

	/**
	 * Main loop. Returns when the stop signal is raised or the thread is interrupted.
	 */
	protected void go() {
		coPrint.tag(who).msg().ln("started").clr();
		while (!stop.get() && !Thread.currentThread().isInterrupted()) {
			Challenge challenge = challengeGetter.get();
			if (challenge == null || challenge.isExpired(System.currentTimeMillis())) {
				if (!Utility.pause(IDLE_DELAY)) {
					return;
				}
				continue;
			}
			if (!search(challenge)) {
				return;
			}
		}
	}

	/**
	 * Tries up to {@link #NONCE_BATCH} nonces against one challenge.
	 *
	 * @return false if interrupted
	 */
	protected boolean search(Challenge challenge) {
		for (int i = 0; i < NONCE_BATCH; i++) {
			if (stop.get() || challenge.isExpired(System.currentTimeMillis())) {
				return true;
			}
			if (!oracle.ensureConnected()) {
				if (!Utility.pause(CONNECT_BACKOFF)) {
					return false;
				}
				continue;
			}

			String nonce = Utility.randomNonce(random);
			String hash = oracle.exchange(Preimage.payload(nonce, address, challenge));
			if (hash == null) {
				if (!Utility.pause(NO_RESULT_BACKOFF)) {
					return false;
				}
				continue;
			}
			hashCount++;
			stats.addHashes(1);

			if (Difficulty.meets(hash, challenge.getDifficulty())) {
				found(challenge, nonce, hash);
				// re-read the challenge, it may have rotated
				return Utility.pause(FOUND_PAUSE);
			}
		}
		return true;
	}

	private void found(Challenge challenge, String nonce, String hash) {
		finds++;
		stats.incSolutions();
		coPrint.tag(who).label().p("FOUND nonce=").hashData().p(nonce)
			.label().p(" hash=").textData().p(hash)
			.label().p(" challenge=").normData().ln(challenge.getChallengeId()).clr();

		if (submission == null) {
			return;
		}
		Submission.Result result = submission.submit(address, challenge.getChallengeId(), nonce, coPrint, who);
		if (!result.isAccepted()) {
			coPrint.tag(who).alert().p("FAILED TO SUBMIT VALID NONCE ").hashData().p(nonce)
				.alert().ln(" after " + result.getAttempts() + " attempts -- stopping so it is not lost").clr();
		}
		// one solution per challenge either way
		stop.set(true);
	}

	public long getHashes() {
		return hashCount;
	}

	public long getFinds() {
		return finds;
	}

	public boolean isActive() {
		return active;
	}
}
