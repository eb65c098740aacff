package com.programmerdan.scavenger.scavenger_miner;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

public class MinerConfigTest {

	@Test
	public void defaults() {
		MinerConfig config = MinerConfig.parse(new String[] { "addr1", "challenges.csv" });

		assertEquals("addr1", config.getAddress());
		assertEquals("challenges.csv", config.getCsvFile());
		assertEquals(MinerConfig.DEFAULT_BASE_URL, config.getBaseUrl());
		assertEquals(MinerConfig.DEFAULT_WORKERS, config.getWorkers());
		assertEquals("127.0.0.1", config.getDaemonHost());
		assertEquals(4002, config.getDaemonPort());
		assertTrue(config.isSubmit());
		assertFalse(config.isColors());
	}

	@Test
	public void everythingGiven() {
		MinerConfig config = MinerConfig.parse(new String[] { " addr1 ", "c.csv", "http://localhost:8080", "3",
				"10.0.0.2", "5000", "n", "y" });

		assertEquals("addr1", config.getAddress());
		assertEquals("http://localhost:8080", config.getBaseUrl());
		assertEquals(3, config.getWorkers());
		assertEquals("10.0.0.2", config.getDaemonHost());
		assertEquals(5000, config.getDaemonPort());
		assertFalse(config.isSubmit());
		assertTrue(config.isColors());
	}

	@Test
	public void blankOptionalsFallBack() {
		MinerConfig config = MinerConfig.parse(new String[] { "addr1", "c.csv", "", " ", "", "", "", "" });

		assertEquals(MinerConfig.DEFAULT_BASE_URL, config.getBaseUrl());
		assertEquals(MinerConfig.DEFAULT_WORKERS, config.getWorkers());
		assertEquals(MinerConfig.DEFAULT_DAEMON_HOST, config.getDaemonHost());
		assertEquals(MinerConfig.DEFAULT_DAEMON_PORT, config.getDaemonPort());
		assertTrue(config.isSubmit());
		assertFalse(config.isColors());
	}

	@Test
	public void linesRoundTrip() {
		MinerConfig config = MinerConfig.parse(new String[] { "addr1", "c.csv", "", "2", "", "4100", "false" });
		List<String> lines = config.toLines();
		assertEquals(8, lines.size());

		MinerConfig again = MinerConfig.parse(lines.toArray(new String[] {}));
		assertEquals(config.toLines(), again.toLines());
		assertEquals(2, again.getWorkers());
		assertEquals(4100, again.getDaemonPort());
		assertFalse(again.isSubmit());
	}

	@Test(expected = IllegalArgumentException.class)
	public void addressRequired() {
		MinerConfig.parse(new String[] { "addr1" });
	}

	@Test(expected = IllegalArgumentException.class)
	public void blankAddressRejected() {
		MinerConfig.parse(new String[] { "  ", "c.csv" });
	}

	@Test(expected = IllegalArgumentException.class)
	public void workersMustBeNumeric() {
		MinerConfig.parse(new String[] { "addr1", "c.csv", "", "lots" });
	}

	@Test(expected = IllegalArgumentException.class)
	public void workersMustBePositive() {
		MinerConfig.parse(new String[] { "addr1", "c.csv", "", "0" });
	}

	@Test(expected = IllegalArgumentException.class)
	public void portInRange() {
		MinerConfig.parse(new String[] { "addr1", "c.csv", "", "", "", "70000" });
	}

	@Test(expected = IllegalArgumentException.class)
	public void booleansAreStrict() {
		MinerConfig.parse(new String[] { "addr1", "c.csv", "", "", "", "", "maybe" });
	}
}
