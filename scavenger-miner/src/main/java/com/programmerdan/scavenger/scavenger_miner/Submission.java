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

import com.diogonunes.jcdp.color.api.Ansi.FColor;

/**
 * Bounded retry around a {@link SubmissionClient}. A 201 ends it; anything else is logged to the
 * {@link ErrorLog} and retried after a fixed delay, up to the attempt cap.
 *
 * @author ProgrammerDan (Daniel Boston)
 */
public class Submission {

	public static final int MAX_ATTEMPTS = 3;
	public static final long RETRY_DELAY = 1000l;

	public enum Outcome {
		/** server answered 201 */
		ACCEPTED,
		/** ran out of attempts (or was interrupted) without a 201 */
		EXHAUSTED
	}

	/**
	 * What happened, and after how many tries.
	 */
	public static class Result {
		private final Outcome outcome;
		private final int attempts;
		private final SubmitResult last;

		Result(Outcome outcome, int attempts, SubmitResult last) {
			this.outcome = outcome;
			this.attempts = attempts;
			this.last = last;
		}

		public Outcome getOutcome() {
			return outcome;
		}

		public int getAttempts() {
			return attempts;
		}

		public SubmitResult getLast() {
			return last;
		}

		public boolean isAccepted() {
			return Outcome.ACCEPTED.equals(outcome);
		}
	}

	private final SubmissionClient client;
	private final ErrorLog errorLog;
	private final int maxAttempts;
	private final long retryDelay;

	public Submission(SubmissionClient client, ErrorLog errorLog) {
		this(client, errorLog, MAX_ATTEMPTS, RETRY_DELAY);
	}

	public Submission(SubmissionClient client, ErrorLog errorLog, int maxAttempts, long retryDelay) {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be at least 1");
		}
		this.client = client;
		this.errorLog = errorLog;
		this.maxAttempts = maxAttempts;
		this.retryDelay = retryDelay;
	}

	/**
	 * Blocks the calling worker for the duration, including the delays between attempts.
	 *
	 * @param coPrint where progress gets reported, the caller's own printer
	 * @param who label for progress lines
	 */
	public Result submit(String address, String challengeId, String nonce, CPrint coPrint, String who) {
		SubmitResult last = null;
		int attempts = 0;
		while (attempts < maxAttempts) {
			if (attempts > 0 && !Utility.pause(retryDelay)) {
				coPrint.tag(who).alert().ln("Interrupted while retrying submit of " + nonce).clr();
				return new Result(Outcome.EXHAUSTED, attempts, last);
			}
			attempts++;
			last = client.submit(address, challengeId, nonce);

			if (last.isAccepted()) {
				coPrint.tag(who).label().p("Submit of ").textData().p(nonce)
					.label().p(" accepted: ").normData().p(last.getStatus()).p(" ").textData().ln(last.getBody()).clr();
				return new Result(Outcome.ACCEPTED, attempts, last);
			}

			errorLog.record(address, challengeId, nonce, last.describe());
			if (last.isRequestError()) {
				coPrint.tag(who).label().p("Non-fatal but tragic: submit attempt ").normData().p(attempts + "/" + maxAttempts)
					.label().p(" failed: ").textData().f(FColor.RED).ln(last.getError()).clr();
			} else {
				coPrint.tag(who).label().p("Submit attempt ").normData().p(attempts + "/" + maxAttempts)
					.label().p(" returned ").textData().f(FColor.RED).p(last.getStatus()).p(" ")
					.textData().ln(last.getBody()).clr();
			}
		}
		return new Result(Outcome.EXHAUSTED, attempts, last);
	}
}
