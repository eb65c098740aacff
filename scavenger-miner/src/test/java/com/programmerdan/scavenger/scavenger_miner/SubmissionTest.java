package com.programmerdan.scavenger.scavenger_miner;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

public class SubmissionTest {

	private final ErrorLog errorLog = new ErrorLog();
	private final CPrint coPrint = new CPrint(false);

	@Test
	public void firstTryAccepted() {
		ScriptedSubmissionClient client = new ScriptedSubmissionClient(ScriptedSubmissionClient.status(201));
		Submission.Result result = new Submission(client, errorLog).submit("a", "c", "n", coPrint, "test");

		assertTrue(result.isAccepted());
		assertEquals(Submission.Outcome.ACCEPTED, result.getOutcome());
		assertEquals(1, result.getAttempts());
		assertEquals(201, result.getLast().getStatus());
		assertEquals(0, errorLog.size());
	}

	@Test(timeout = 10000)
	public void retriesAreSpacedOut() {
		ScriptedSubmissionClient client = new ScriptedSubmissionClient(ScriptedSubmissionClient.status(201),
				ScriptedSubmissionClient.status(503), SubmitResult.failure("SocketTimeoutException: Read timed out"));
		Submission.Result result = new Submission(client, errorLog).submit("a", "c", "n", coPrint, "test");

		assertTrue(result.isAccepted());
		assertEquals(3, result.getAttempts());
		List<Long> times = client.getTimes();
		assertTrue(times.get(1) - times.get(0) >= Submission.RETRY_DELAY - 100);
		assertTrue(times.get(2) - times.get(1) >= Submission.RETRY_DELAY - 100);
	}

	@Test
	public void exhaustionLogsEveryFailure() {
		ScriptedSubmissionClient client = new ScriptedSubmissionClient(SubmitResult.response(400, "bad nonce"));
		Submission.Result result = new Submission(client, errorLog, 3, 10).submit("addr", "cid", "beef", coPrint,
				"test");

		assertFalse(result.isAccepted());
		assertEquals(Submission.Outcome.EXHAUSTED, result.getOutcome());
		assertEquals(3, result.getAttempts());
		assertEquals(3, client.getAttempts());
		assertEquals(3, errorLog.size());
		ErrorLog.Entry entry = errorLog.getEntries().get(2);
		assertTrue(entry.format().endsWith(" - addr/cid/beef - HTTP 400: bad nonce"));
	}

	@Test
	public void otherSuccessCodesAreNotAccepted() {
		ScriptedSubmissionClient client = new ScriptedSubmissionClient(ScriptedSubmissionClient.status(200));
		Submission.Result result = new Submission(client, errorLog, 2, 10).submit("a", "c", "n", coPrint, "test");

		assertFalse(result.isAccepted());
		assertEquals(2, client.getAttempts());
	}

	@Test(timeout = 10000)
	public void interruptDuringBackoffGivesUp() {
		ScriptedSubmissionClient client = new ScriptedSubmissionClient(ScriptedSubmissionClient.status(500));
		Thread.currentThread().interrupt();
		try {
			Submission.Result result = new Submission(client, errorLog, 3, 5000).submit("a", "c", "n", coPrint,
					"test");
			assertEquals(Submission.Outcome.EXHAUSTED, result.getOutcome());
			assertEquals(1, result.getAttempts());
			assertTrue(Thread.currentThread().isInterrupted());
		} finally {
			Thread.interrupted();
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void needsAnAttempt() {
		new Submission(new ScriptedSubmissionClient(ScriptedSubmissionClient.status(201)), errorLog, 0, 10);
	}
}
