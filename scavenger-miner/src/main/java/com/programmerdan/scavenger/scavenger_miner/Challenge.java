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

import java.util.Objects;

/**
 * One challenge to be solved, as read from the challenge source. Never mutated once built;
 * a new challenge replaces the old one in the {@link Orchestrator}, it is not updated in place.
 *
 * @author ProgrammerDan (Daniel Boston)
 */
public final class Challenge {

	/**
	 * Deadline used when the source leaves the latest submission column blank.
	 */
	public static final String FAR_FUTURE = "2099-12-31T23:59:59.000Z";

	private final String challengeId;
	private final String difficulty;
	private final String noPreMine;
	private final String noPreMineHour;
	private final String latestSubmission;

	/* parsed once, null if the timestamp could not be read */
	private final Long deadline;

	public Challenge(String challengeId, String difficulty, String noPreMine, String noPreMineHour,
			String latestSubmission) {
		this.challengeId = Objects.requireNonNull(challengeId, "challengeId");
		this.difficulty = Objects.requireNonNull(difficulty, "difficulty");
		this.noPreMine = Objects.requireNonNull(noPreMine, "noPreMine");
		this.noPreMineHour = noPreMineHour == null ? "" : noPreMineHour;
		this.latestSubmission = latestSubmission == null ? "" : latestSubmission;
		this.deadline = Utility.parseDeadline(this.latestSubmission);
	}

	public String getChallengeId() {
		return challengeId;
	}

	public String getDifficulty() {
		return difficulty;
	}

	public String getNoPreMine() {
		return noPreMine;
	}

	public String getNoPreMineHour() {
		return noPreMineHour;
	}

	public String getLatestSubmission() {
		return latestSubmission;
	}

	/**
	 * @return epoch millis after which submissions are no longer accepted, or null if
	 *         latestSubmission could not be parsed (no deadline is enforced then).
	 */
	public Long getDeadline() {
		return deadline;
	}

	/**
	 * @param now epoch millis
	 * @return true if a deadline is known and now is past it
	 */
	public boolean isExpired(long now) {
		return deadline != null && now > deadline;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Challenge)) {
			return false;
		}
		Challenge other = (Challenge) obj;
		return challengeId.equals(other.challengeId) && difficulty.equals(other.difficulty)
				&& noPreMine.equals(other.noPreMine) && noPreMineHour.equals(other.noPreMineHour)
				&& latestSubmission.equals(other.latestSubmission);
	}

	@Override
	public int hashCode() {
		return Objects.hash(challengeId, difficulty, noPreMine, noPreMineHour, latestSubmission);
	}

	@Override
	public String toString() {
		return "Challenge{id=" + challengeId + ", difficulty=" + difficulty + ", expires=" + latestSubmission + "}";
	}
}
