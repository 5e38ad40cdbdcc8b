package org.bvbounds.rtl.expressions;

/**
 * A free variable of a fixed bit width.
 */
public final class RTLVariable implements RTLExpression {

	private static final RTLExpression[] noOperands = {};

	private final String name;
	private final int bitWidth;

	RTLVariable(String name, int bitWidth) {
		assert name != null;
		this.name = name;
		this.bitWidth = bitWidth;
	}

	public String getName() {
		return name;
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
		throw new IndexOutOfBoundsException("A variable has no operands");
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof RTLVariable)) {
			return false;
		}
		RTLVariable v = (RTLVariable) o;
		return name.equals(v.name) && bitWidth == v.bitWidth;
	}

	@Override
	public int hashCode() {
		return name.hashCode() * 31 + bitWidth;
	}

	@Override
	public String toString() {
		return name;
	}
}
