package org.bvbounds.rtl.expressions;

/**
 * Application of an {@link Operator} to operands. Operands are shared expressions, so equality only has to
 * compare them by reference.
 */
public final class RTLOperation implements RTLExpression {

	private final Operator operator;
	private final RTLExpression[] operands;
	private final int bitWidth;
	private final int hash;

	RTLOperation(Operator operator, int bitWidth, RTLExpression... operands) {
		assert operator != null && operands.length > 0;
		this.operator = operator;
		this.operands = operands.clone();
		this.bitWidth = bitWidth;
		int h = operator.hashCode();
		for (RTLExpression e : this.operands) {
			h = h * 31 + System.identityHashCode(e);
		}
		hash = h;
	}

	public Operator getOperator() {
		return operator;
	}

	@Override
	public RTLExpression[] getOperands() {
		return operands.clone();
	}

	@Override
	public int getOperandCount() {
		return operands.length;
	}

	@Override
	public RTLExpression getOperand(int i) {
		return operands[i];
	}

	@Override
	public int getBitWidth() {
		return bitWidth;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof RTLOperation)) {
			return false;
		}
		RTLOperation op = (RTLOperation) o;
		if (operator != op.operator || bitWidth != op.bitWidth || operands.length != op.operands.length) {
			return false;
		}
		for (int i = 0; i < operands.length; i++) {
			if (operands[i] != op.operands[i]) {
				return false;
			}
		}
		return true;
	}

	@Override
	public int hashCode() {
		return hash;
	}

	@Override
	public String toString() {
		if (operator.isUnary()) {
			return operator.getSymbol() + operands[0];
		}
		StringBuilder sb = new StringBuilder("(");
		for (int i = 0; i < operands.length; i++) {
			if (i > 0) {
				sb.append(' ').append(operator.getSymbol()).append(' ');
			}
			sb.append(operands[i]);
		}
		return sb.append(')').toString();
	}
}
