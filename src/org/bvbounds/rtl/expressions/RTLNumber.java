package org.bvbounds.rtl.expressions;

import org.bvbounds.analysis.bounds.Bits;

/**
 * A numeral of a fixed bit width. The value is stored as an unsigned bit pattern, i.e. all bits above
 * the bit width are zero.
 */
public final class RTLNumber implements RTLExpression {

	private static final RTLExpression[] noOperands = {};

	private final long value;
	private final int bitWidth;

	RTLNumber(long value, int bitWidth) {
		this.bitWidth = bitWidth;
		this.value = value & Bits.fromInt(bitWidth).getMask();
	}

	/**
	 * @return The unsigned bit pattern of this number.
	 */
	public long longValue() {
		return value;
	}

	/**
	 * @return The value interpreted as a two's complement number.
	 */
	public long signedValue() {
		return Bits.fromInt(bitWidth).narrow(value);
	}

	@Override
	public int getBitWidth() {
		return bitWidth;
	}

	@Override
	public RTLExpression[] getOperands() {
		return noOperands;
	}

	@Override
	public int getOperandCount() {
		return 0;
	}

	@Override
	public RTLExpression getOperand(int i) {
		throw new IndexOutOfBoundsException("A number has no operands");
	}

	public boolean isTrue() {
		return bitWidth == 1 && value == 1L;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof RTLNumber)) {
			return false;
		}
		RTLNumber n = (RTLNumber) o;
		return value == n.value && bitWidth == n.bitWidth;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(value) * 31 + bitWidth;
	}

	@Override
	public String toString() {
		if (bitWidth == 1) {
			return value == 0L ? "false" : "true";
		}
		return Long.toUnsignedString(value) + "<" + bitWidth + ">";
	}
}
