package com.programmerdan.scavenger.scavenger_miner;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class MinerTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static MinerConfig config(int workers, boolean submit) {
		return new MinerConfig("addr1test", "unused.csv", "http://127.0.0.1:1", workers, null, 4002, submit, false);
	}

	private static Challenge open(String id) {
		return new Challenge(id, "0000FFFF", "rom" + id, "1", Challenge.FAR_FUTURE);
	}

	@Test(timeout = 30000)
	public void runsEveryChallengeInOrder() {
		ScriptedSubmissionClient client = new ScriptedSubmissionClient(ScriptedSubmissionClient.status(201));
		final AtomicInteger oraclesMade = new AtomicInteger();
		Miner miner = new Miner(config(1, true), workerId -> {
			oraclesMade.incrementAndGet();
			return new ScriptedOracle(ScriptedOracle.MEETS);
		}, client);
		miner.setStatsInterval(100);

		int done = miner.run(Arrays.asList(open("c1"), open("c2")));

		assertEquals(2, done);
		assertEquals(2, oraclesMade.get());
		assertEquals(Arrays.asList("c1", "c2"), client.getChallengeIds());
		assertFalse(miner.isActive());
		assertEquals(0, miner.getErrorLog().size());
	}

	@Test(timeout = 30000)
	public void expiredChallengeIsPassedOver() {
		ScriptedSubmissionClient client = new ScriptedSubmissionClient(ScriptedSubmissionClient.status(201));
		Miner miner = new Miner(config(2, true), workerId -> new ScriptedOracle(ScriptedOracle.MEETS), client);

		Challenge expired = new Challenge("old", "FFFFFFFF", "rom", "1", "2000-01-01T00:00:00Z");
		int done = miner.run(Arrays.asList(expired, open("c2")));

		assertEquals(2, done);
		assertEquals(Collections.singletonList("c2"), client.getChallengeIds());
	}

	@Test(timeout = 30000)
	public void shutdownStopsEarly() throws InterruptedException {
		ScriptedSubmissionClient client = new ScriptedSubmissionClient(ScriptedSubmissionClient.status(201));
		final Miner miner = new Miner(config(2, true), workerId -> new ScriptedOracle(ScriptedOracle.MISSES), client);
		final List<Challenge> challenges = Arrays.asList(open("c1"), open("c2"), open("c3"));
		final AtomicInteger done = new AtomicInteger(-1);

		Thread runner = new Thread(() -> done.set(miner.run(challenges)), "TestMiner");
		runner.start();
		Thread.sleep(500);
		assertTrue(miner.isActive());
		assertTrue(miner.getStats().getHashes() > 0);

		miner.shutdown();
		runner.join(20000);

		assertFalse(runner.isAlive());
		assertEquals(1, done.get());
		assertTrue(miner.getStop().get());
		assertEquals(0, client.getAttempts());
	}

	@Test(timeout = 30000)
	public void submitOffJustCounts() throws InterruptedException {
		ScriptedSubmissionClient client = new ScriptedSubmissionClient(ScriptedSubmissionClient.status(201));
		final Miner miner = new Miner(config(1, false), workerId -> new ScriptedOracle(ScriptedOracle.MEETS), client);
		final AtomicInteger done = new AtomicInteger(-1);

		Thread runner = new Thread(() -> done.set(miner.run(Collections.singletonList(open("c1")))), "TestMiner");
		runner.start();
		Thread.sleep(1200);
		assertTrue(miner.getStats().getSolutions() >= 2);
		miner.shutdown();
		runner.join(20000);

		assertEquals(1, done.get());
		assertEquals(0, client.getAttempts());
	}

	@Test(timeout = 30000)
	public void failedSubmissionsAreSaved() throws IOException {
		ScriptedSubmissionClient client = new ScriptedSubmissionClient(SubmitResult.response(500, "oops"));
		Miner miner = new Miner(config(1, true), workerId -> new ScriptedOracle(ScriptedOracle.MEETS), client);

		assertNull(miner.saveErrors(folder.getRoot()));

		assertEquals(1, miner.run(Collections.singletonList(open("c1"))));
		assertEquals(Submission.MAX_ATTEMPTS, client.getAttempts());

		File saved = miner.saveErrors(folder.getRoot());
		assertNotNull(saved);
		assertTrue(saved.getName().startsWith("addr1test."));
		List<String> lines = Files.readAllLines(saved.toPath(), StandardCharsets.UTF_8);
		assertEquals(Submission.MAX_ATTEMPTS, lines.size());
		for (String line : lines) {
			assertTrue(line, line.contains(" - addr1test/c1/"));
			assertTrue(line, line.endsWith(" - HTTP 500: oops"));
		}
	}
}
