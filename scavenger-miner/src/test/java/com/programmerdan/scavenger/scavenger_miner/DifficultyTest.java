package com.programmerdan.scavenger.scavenger_miner;

import static org.junit.Assert.*;

import java.util.Random;

import org.junit.Test;

public class DifficultyTest {

	/* bit-by-bit statement of the rule, for comparison */
	private static boolean zeroBitsRespected(long left4, long mask) {
		for (int bit = 0; bit < 32; bit++) {
			boolean maskBit = ((mask >>> bit) & 1) == 1;
			boolean hashBit = ((left4 >>> bit) & 1) == 1;
			if (!maskBit && hashBit) {
				return false;
			}
		}
		return true;
	}

	@Test
	public void allOnesMaskAlwaysMeets() {
		assertTrue(Difficulty.meets(0x00000000L, 0xFFFFFFFFL));
		assertTrue(Difficulty.meets(0xFFFFFFFFL, 0xFFFFFFFFL));
		assertTrue(Difficulty.meets(0x8badf00dL, 0xFFFFFFFFL));
		assertTrue(Difficulty.meets("deadbeef00", "FFFFFFFF"));
	}

	@Test
	public void zeroMaskMeetsOnlyZero() {
		assertTrue(Difficulty.meets(0L, 0L));
		assertFalse(Difficulty.meets(1L, 0L));
		assertFalse(Difficulty.meets(0x80000000L, 0L));
		assertTrue(Difficulty.meets("00000000ffff", "00000000"));
		assertFalse(Difficulty.meets("00000001ffff", "00000000"));
	}

	@Test
	public void setMaskBitsAreDontCare() {
		// low 16 bits are free, high 16 must be zero
		assertTrue(Difficulty.meets(0x00001234L, 0x0000FFFFL));
		assertFalse(Difficulty.meets(0x00011234L, 0x0000FFFFL));
		// low 16 bits must be zero here
		assertFalse(Difficulty.meets(0x00001234L, 0xFFFF0000L));
		assertTrue(Difficulty.meets(0x12340000L, 0xFFFF0000L));
	}

	@Test
	public void matchesBitwiseDefinition() {
		Random random = new Random(42);
		for (int i = 0; i < 5000; i++) {
			long left4 = random.nextInt() & 0xFFFFFFFFL;
			// sparse masks so both outcomes actually show up
			long mask = (random.nextInt() | random.nextInt() | random.nextInt()) & 0xFFFFFFFFL;
			if (i % 3 == 0) {
				left4 &= mask;
			}
			assertEquals(zeroBitsRespected(left4, mask), Difficulty.meets(left4, mask));
			String hash = String.format("%08x", left4) + "00ff00ff";
			String maskHex = String.format("%08X", mask);
			assertEquals(zeroBitsRespected(left4, mask), Difficulty.meets(hash, maskHex));
		}
	}

	@Test
	public void onlyLeftFourBytesMatter() {
		assertTrue(Difficulty.meets("0000ffffffffffffffffffff", "0000FFFF"));
		assertTrue(Difficulty.meets("0000abcd", "0000ffff"));
	}

	@Test
	public void shortHashNeverMeets() {
		assertFalse(Difficulty.meets("", "FFFFFFFF"));
		assertFalse(Difficulty.meets("0", "FFFFFFFF"));
		assertFalse(Difficulty.meets("0000000", "FFFFFFFF"));
	}

	@Test
	public void malformedInputDoesNotMeet() {
		assertFalse(Difficulty.meets(null, "FFFFFFFF"));
		assertFalse(Difficulty.meets("00000000", null));
		assertFalse(Difficulty.meets("0000000g", "FFFFFFFF"));
		assertFalse(Difficulty.meets("+0000000", "FFFFFFFF"));
		assertFalse(Difficulty.meets("00000000", ""));
		assertFalse(Difficulty.meets("00000000", "zzzz"));
		assertFalse(Difficulty.meets("00000000", "0x"));
	}

	@Test
	public void maskPrefixAndWidth() {
		assertTrue(Difficulty.meets("00001234", "0x0000FFFF"));
		assertTrue(Difficulty.meets("00001234", " 0000ffff "));
		// only the low 32 bits of a wide mask count
		assertTrue(Difficulty.meets("00001234", "FFFFFFFF0000FFFF"));
		assertFalse(Difficulty.meets("00011234", "FFFFFFFF0000FFFF"));
	}
}
