package org.bvbounds.analysis.bounds;

import org.bvbounds.rtl.expressions.RTLExpression;
import org.bvbounds.rtl.expressions.RTLNumber;
import org.bvbounds.rtl.expressions.RTLOperation;
import org.bvbounds.util.Optional;
import org.bvbounds.util.Pair;

/**
 * Reads bounds off atoms comparing a term against a number. Recognized are unsigned and signed less-or-equal
 * and equality, with the number on either side. All bounds are tight.
 */
public final class BoundExtractor {

	private BoundExtractor() {
	}

	/**
	 * Check whether an expression has the shape of an atom bounds can be extracted from. Unlike
	 * {@link #extract(RTLExpression)}, comparisons of two numbers count as well.
	 *
	 * @param e The expression.
	 * @return True if e compares something to a number.
	 */
	public static boolean isBoundShaped(RTLExpression e) {
		if (!(e instanceof RTLOperation)) {
			return false;
		}
		RTLOperation op = (RTLOperation) e;
		switch (op.getOperator()) {
			case UNSIGNED_LESS_OR_EQUAL:
			case LESS_OR_EQUAL:
			case EQUAL:
				return op.getOperand(0) instanceof RTLNumber || op.getOperand(1) instanceof RTLNumber;
			default:
				return false;
		}
	}

	/**
	 * Extract the bound an atom puts on its non-constant side.
	 *
	 * @param e The atom.
	 * @return The bounded term together with the interval of values satisfying the atom, or none if e
	 * is not a comparison of exactly one number and some other term.
	 */
	public static Optional<Pair<RTLExpression, Interval>> extract(RTLExpression e) {
		if (!(e instanceof RTLOperation)) {
			return Optional.none();
		}
		RTLOperation op = (RTLOperation) e;
		if (op.getOperandCount() != 2) {
			return Optional.none();
		}
		RTLExpression lhs = op.getOperand(0);
		RTLExpression rhs = op.getOperand(1);
		boolean numberLeft = lhs instanceof RTLNumber;
		boolean numberRight = rhs instanceof RTLNumber;
		if (numberLeft == numberRight) {
			return Optional.none();
		}
		RTLNumber n = (RTLNumber) (numberLeft ? lhs : rhs);
		RTLExpression v = numberLeft ? rhs : lhs;
		Bits bits = Bits.fromInt(n.getBitWidth());
		long c = n.longValue();

		final Interval b;
		switch (op.getOperator()) {
			case UNSIGNED_LESS_OR_EQUAL:
				// C <=u x  <=>  x >=u C
				b = numberLeft ? new Interval(c, bits.getMask(), bits, true) : new Interval(0L, c, bits, true);
				break;
			case LESS_OR_EQUAL:
				// signed values start at the sign bit when counting upwards
				b = numberLeft ? new Interval(c, bits.getMaxSigned(), bits, true) : new Interval(bits.getSignBit(), c, bits, true);
				break;
			case EQUAL:
				b = Interval.singleton(c, bits);
				break;
			default:
				return Optional.none();
		}
		return Optional.some(new Pair<>(v, b));
	}
}
