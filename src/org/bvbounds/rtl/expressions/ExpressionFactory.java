package org.bvbounds.rtl.expressions;

import org.bvbounds.analysis.bounds.Bits;

import java.util.HashMap;
import java.util.Map;

/**
 * Creates expressions. Every factory keeps a table of all expressions it created and returns the existing
 * expression when asked for a structurally equal one, so expressions from the same factory are shared and
 * can be identified by reference. A factory is not thread safe.
 */
public final class ExpressionFactory {

	private final Map<RTLExpression, RTLExpression> table = new HashMap<>();

	private final RTLNumber trueNumber;
	private final RTLNumber falseNumber;

	public ExpressionFactory() {
		trueNumber = createNumber(1L, 1);
		falseNumber = createNumber(0L, 1);
	}

	@SuppressWarnings("unchecked")
	private <T extends RTLExpression> T intern(T e) {
		RTLExpression existing = table.get(e);
		if (existing == null) {
			table.put(e, e);
			return e;
		}
		return (T) existing;
	}

	/**
	 * @return Number of distinct expressions created so far.
	 */
	public int size() {
		return table.size();
	}

	public RTLNumber getTrue() {
		return trueNumber;
	}

	public RTLNumber getFalse() {
		return falseNumber;
	}

	public RTLNumber createNumber(long value, int bitWidth) {
		return intern(new RTLNumber(value, bitWidth));
	}

	public RTLNumber createBoolean(boolean value) {
		return value ? trueNumber : falseNumber;
	}

	public RTLVariable createVariable(String name, int bitWidth) {
		Bits.fromInt(bitWidth);
		return intern(new RTLVariable(name, bitWidth));
	}

	/**
	 * Create an operation. Relational operators yield a 1-bit value, all others have the width of their operands.
	 *
	 * @param operator The operator.
	 * @param operands The operands, all of the same bit width.
	 * @return The shared operation.
	 */
	public RTLExpression createOperation(Operator operator, RTLExpression... operands) {
		if (operands.length == 0) {
			throw new IllegalArgumentException("No operands for " + operator);
		}
		if (operator.isUnary() != (operands.length == 1)) {
			throw new IllegalArgumentException(operator + " called with " + operands.length + " operands");
		}
		int width = operands[0].getBitWidth();
		for (RTLExpression e : operands) {
			if (e.getBitWidth() != width) {
				throw new IllegalArgumentException("Mixed bit widths in " + operator + ": " + width + " and " + e.getBitWidth());
			}
		}
		return intern(new RTLOperation(operator, operator.isRelational() ? 1 : width, operands));
	}

	public RTLExpression createEqual(RTLExpression a, RTLExpression b) {
		return createOperation(Operator.EQUAL, a, b);
	}

	public RTLExpression createLessOrEqual(RTLExpression a, RTLExpression b) {
		return createOperation(Operator.LESS_OR_EQUAL, a, b);
	}

	public RTLExpression createLessThan(RTLExpression a, RTLExpression b) {
		return createOperation(Operator.LESS, a, b);
	}

	public RTLExpression createUnsignedLessOrEqual(RTLExpression a, RTLExpression b) {
		return createOperation(Operator.UNSIGNED_LESS_OR_EQUAL, a, b);
	}

	public RTLExpression createUnsignedLessThan(RTLExpression a, RTLExpression b) {
		return createOperation(Operator.UNSIGNED_LESS, a, b);
	}

	/**
	 * Bitwise (and for 1-bit values logical) negation. Numbers are folded.
	 */
	public RTLExpression createNot(RTLExpression e) {
		if (e instanceof RTLNumber) {
			RTLNumber n = (RTLNumber) e;
			return createNumber(~n.longValue(), n.getBitWidth());
		}
		return createOperation(Operator.NOT, e);
	}

	public RTLExpression createNeg(RTLExpression e) {
		return createOperation(Operator.NEG, e);
	}

	/**
	 * Conjunction. The empty conjunction is true, a single conjunct is returned as it is.
	 */
	public RTLExpression createAnd(RTLExpression... operands) {
		switch (operands.length) {
			case 0: return trueNumber;
			case 1: return operands[0];
			default: return createOperation(Operator.AND, operands);
		}
	}

	/**
	 * Disjunction. The empty disjunction is false, a single disjunct is returned as it is.
	 */
	public RTLExpression createOr(RTLExpression... operands) {
		switch (operands.length) {
			case 0: return falseNumber;
			case 1: return operands[0];
			default: return createOperation(Operator.OR, operands);
		}
	}

	public RTLExpression createPlus(RTLExpression... operands) {
		return createOperation(Operator.PLUS, operands);
	}

	/**
	 * Rebuild an operation with new operands, returning the old one if nothing changed. Comparisons of two
	 * numbers are evaluated.
	 */
	public RTLExpression rebuild(RTLOperation op, RTLExpression[] operands) {
		if (operands.length == op.getOperandCount()) {
			boolean changed = false;
			for (int i = 0; i < operands.length && !changed; i++) {
				changed = operands[i] != op.getOperand(i);
			}
			if (!changed) {
				return op;
			}
		}
		RTLNumber folded = evaluateComparison(op.getOperator(), operands);
		if (folded != null) {
			return folded;
		}
		switch (op.getOperator()) {
			case NOT: return createNot(operands[0]);
			case AND: return createAnd(operands);
			case OR: return createOr(operands);
			default: return createOperation(op.getOperator(), operands);
		}
	}

	private RTLNumber evaluateComparison(Operator operator, RTLExpression[] operands) {
		if (!operator.isRelational() || operands.length != 2
				|| !(operands[0] instanceof RTLNumber) || !(operands[1] instanceof RTLNumber)) {
			return null;
		}
		RTLNumber a = (RTLNumber) operands[0];
		RTLNumber b = (RTLNumber) operands[1];
		switch (operator) {
			case EQUAL: return createBoolean(a.longValue() == b.longValue());
			case LESS: return createBoolean(a.signedValue() < b.signedValue());
			case LESS_OR_EQUAL: return createBoolean(a.signedValue() <= b.signedValue());
			case UNSIGNED_LESS: return createBoolean(Bits.ult(a.longValue(), b.longValue()));
			case UNSIGNED_LESS_OR_EQUAL: return createBoolean(Bits.ule(a.longValue(), b.longValue()));
			default: throw new IllegalArgumentException("Not a comparison: " + operator);
		}
	}
}
