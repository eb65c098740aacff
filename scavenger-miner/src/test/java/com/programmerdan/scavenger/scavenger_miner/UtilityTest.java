package com.programmerdan.scavenger.scavenger_miner;

import static org.junit.Assert.*;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import org.junit.Test;

public class UtilityTest {

	@Test
	public void nonceIsSixteenLowercaseHex() {
		Random random = new Random(7);
		Set<String> seen = new HashSet<>();
		for (int i = 0; i < 1000; i++) {
			String nonce = Utility.randomNonce(random);
			assertTrue(nonce, nonce.matches("[0-9a-f]{16}"));
			seen.add(nonce);
		}
		assertEquals(1000, seen.size());
	}

	@Test
	public void nonceKeepsLeadingZeros() {
		Random zeros = new Random() {
			private static final long serialVersionUID = 1L;

			@Override
			public long nextLong() {
				return 0xABCL;
			}
		};
		assertEquals("0000000000000abc", Utility.randomNonce(zeros));

		Random negative = new Random() {
			private static final long serialVersionUID = 1L;

			@Override
			public long nextLong() {
				return -1L;
			}
		};
		assertEquals("ffffffffffffffff", Utility.randomNonce(negative));
	}

	@Test
	public void deadlineFormats() {
		assertEquals(Long.valueOf(1761955199000L), Utility.parseDeadline("2025-10-31T23:59:59Z"));
		assertEquals(Long.valueOf(1761955199000L), Utility.parseDeadline("2025-10-31T23:59:59.000Z"));
		assertEquals(Long.valueOf(1761955199000L), Utility.parseDeadline("2025-11-01T00:59:59+01:00"));
		assertNotNull(Utility.parseDeadline("2025-10-31T23:59:59"));
	}

	@Test
	public void unreadableDeadlineIsNull() {
		assertNull(Utility.parseDeadline(null));
		assertNull(Utility.parseDeadline(""));
		assertNull(Utility.parseDeadline("   "));
		assertNull(Utility.parseDeadline("tomorrow-ish"));
		assertNull(Utility.parseDeadline("2025-13-45T99:99:99Z"));
	}

	@Test
	public void challengeExpiry() {
		Challenge past = new Challenge("c", "FFFFFFFF", "rom", "", "2000-01-01T00:00:00Z");
		Challenge future = new Challenge("c", "FFFFFFFF", "rom", "", Challenge.FAR_FUTURE);
		Challenge unknown = new Challenge("c", "FFFFFFFF", "rom", "", "whenever");

		long now = System.currentTimeMillis();
		assertTrue(past.isExpired(now));
		assertFalse(future.isExpired(now));
		assertNull(unknown.getDeadline());
		assertFalse(unknown.isExpired(now));
	}
}
