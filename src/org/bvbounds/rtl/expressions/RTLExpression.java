package org.bvbounds.rtl.expressions;

import org.bvbounds.rtl.BitVectorType;

/**
 * A node in an expression graph. Expressions are immutable and shared: every expression created by one
 * {@link ExpressionFactory} exists only once, so expressions may be compared and hashed by reference.
 * Boolean values are 1-bit values.
 */
public interface RTLExpression extends BitVectorType {

	/**
	 * @return A copy of the operands of this expression, an empty array for leaves.
	 */
	RTLExpression[] getOperands();

	int getOperandCount();

	/**
	 * @param i Index of the operand, less than {@link #getOperandCount()}.
	 * @return The i-th operand.
	 */
	RTLExpression getOperand(int i);

}
