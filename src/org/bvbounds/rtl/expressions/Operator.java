package org.bvbounds.rtl.expressions;

/**
 * Operators of {@link RTLOperation}s. LESS and LESS_OR_EQUAL compare signed values.
 */
public enum Operator {
	EQUAL("=="),
	LESS("<"),
	LESS_OR_EQUAL("<="),
	UNSIGNED_LESS("<u"),
	UNSIGNED_LESS_OR_EQUAL("<=u"),
	NOT("!"),
	AND("&"),
	OR("|"),
	XOR("^"),
	NEG("-"),
	PLUS("+"),
	MUL("*");

	private final String symbol;

	Operator(String symbol) {
		this.symbol = symbol;
	}

	public String getSymbol() {
		return symbol;
	}

	/**
	 * @return True if the operator yields a boolean regardless of the width of its operands.
	 */
	public boolean isRelational() {
		switch (this) {
			case EQUAL:
			case LESS:
			case LESS_OR_EQUAL:
			case UNSIGNED_LESS:
			case UNSIGNED_LESS_OR_EQUAL:
				return true;
			default:
				return false;
		}
	}

	public boolean isUnary() {
		return this == NOT || this == NEG;
	}
}
