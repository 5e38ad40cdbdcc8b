package org.bvbounds.analysis.bounds;

import org.junit.Test;

import static org.junit.Assert.*;

public class BitsTest {

	@Test
	public void masksAndSignBits() {
		assertEquals(1L, Bits.BIT1.getMask());
		assertEquals(0xFFL, Bits.BIT8.getMask());
		assertEquals(~0L, Bits.BIT64.getMask());
		assertEquals(0x80L, Bits.BIT8.getSignBit());
		assertEquals(0x7FL, Bits.BIT8.getMaxSigned());
		assertEquals(1L, Bits.BIT1.getSignBit());
		assertEquals(0L, Bits.BIT1.getMaxSigned());
		assertEquals(Long.MIN_VALUE, Bits.BIT64.getSignBit());
		assertEquals(Long.MAX_VALUE, Bits.BIT64.getMaxSigned());
	}

	@Test
	public void fromIntIsShared() {
		assertSame(Bits.BIT8, Bits.fromInt(8));
		assertEquals(13, Bits.fromInt(13).getBits());
		assertEquals(0x1FFFL, Bits.fromInt(13).getMask());
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsZeroWidth() {
		Bits.fromInt(0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsTooWide() {
		Bits.fromInt(65);
	}

	@Test
	public void relativeComparison() {
		Bits b = Bits.BIT8;
		// counting upwards from 250: 250, ..., 255, 0, ..., 5
		assertTrue(b.leq(250L, 255L, 5L));
		assertTrue(b.leq(250L, 250L, 250L));
		assertFalse(b.leq(250L, 5L, 255L));
		assertTrue(b.leq(0L, 3L, 4L));
	}

	@Test
	public void unsignedHelpers() {
		assertTrue(Bits.ule(1L, -1L));
		assertTrue(Bits.ult(Long.MAX_VALUE, Long.MIN_VALUE));
		assertEquals(-1L, Bits.umax(-1L, 7L));
		assertEquals(7L, Bits.umin(-1L, 7L));
	}

	@Test
	public void narrowSignExtends() {
		assertEquals(-1L, Bits.BIT8.narrow(0xFFL));
		assertEquals(127L, Bits.BIT8.narrow(0x7FL));
		assertEquals(-1L, Bits.BIT1.narrow(1L));
		assertEquals(-8L, Bits.narrow(8L, 4));
		assertEquals(42L, Bits.BIT64.narrow(42L));
	}
}
