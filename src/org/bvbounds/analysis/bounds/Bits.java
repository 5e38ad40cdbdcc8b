package org.bvbounds.analysis.bounds;

import org.bvbounds.rtl.BitVectorType;

/**
 * Bit widths from 1 to 64. Values of a width are kept as unsigned bit patterns in a long, with all bits
 * above the width cleared.
 */
public final class Bits implements BitVectorType {

	private static final Bits[] widths = new Bits[64];

	static {
		for (int i = 1; i <= 64; i++) {
			widths[i - 1] = new Bits(i);
		}
	}

	public static final Bits BIT1 = fromInt(1);
	public static final Bits BIT8 = fromInt(8);
	public static final Bits BIT16 = fromInt(16);
	public static final Bits BIT32 = fromInt(32);
	public static final Bits BIT64 = fromInt(64);

	private final int bits;
	private final long mask;

	private Bits(int bits) {
		this.bits = bits;
		if (bits == 64) {
			mask = ~0L; // all bits set
		} else {
			mask = (1L << (long)bits) - 1L; // 2^bits - 1
		}
	}

	public static Bits fromInt(int bitWidth) {
		if (bitWidth < 1 || bitWidth > 64) {
			throw new IllegalArgumentException("Unknown bit-width: " + bitWidth);
		}
		return widths[bitWidth - 1];
	}

	/**
	 * Get the number of bits of this data type.
	 * @return bits.
	 */
	public int getBits() {
		return bits;
	}

	@Override
	public int getBitWidth() {
		return bits;
	}

	/**
	 * Get the mask to shrink a value to this data type. This is also the largest unsigned value.
	 * @return 2^bits - 1.
	 */
	public long getMask() {
		return mask;
	}

	/**
	 * @return 2^(bits - 1), the smallest signed value as a bit pattern.
	 */
	public long getSignBit() {
		return 1L << (bits - 1);
	}

	/**
	 * @return 2^(bits - 1) - 1, the largest signed value.
	 */
	public long getMaxSigned() {
		return mask >>> 1;
	}

	/**
	 * Compute b <=_a c, i.e. compare two numbers relative to some other number. The numbers are
	 * ordered as they are encountered when counting upwards (with wrap around) from a.
	 * @param a The number to be relative to.
	 * @param b The first number to compare.
	 * @param c The second number to compare.
	 * @return boolean
	 */
	public boolean leq(long a, long b, long c) {
		return ule((b - a) & mask, (c - a) & mask);
	}

	/**
	 * Unsigned comparison of two bit patterns.
	 */
	public static boolean ule(long a, long b) {
		return Long.compareUnsigned(a, b) <= 0;
	}

	public static boolean ult(long a, long b) {
		return Long.compareUnsigned(a, b) < 0;
	}

	public static long umax(long a, long b) {
		return ule(a, b) ? b : a;
	}

	public static long umin(long a, long b) {
		return ule(a, b) ? a : b;
	}

	public static long narrow(long val, int bitWidth) {
		return fromInt(bitWidth).narrow(val);
	}

	/**
	 * Return the long value of the lower n-bits as a signed value.
	 *
	 * @param val The input.
	 * @return The output.
	 */
	public long narrow(long val) {
		int shift = 64 - bits;
		return (val << shift) >> shift;
	}

	@Override
	public String toString() {
		return "BIT" + bits;
	}
}
