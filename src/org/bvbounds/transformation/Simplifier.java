package org.bvbounds.transformation;

import org.bvbounds.rtl.expressions.ExpressionFactory;
import org.bvbounds.rtl.expressions.RTLExpression;
import org.bvbounds.util.Optional;

/**
 * A simplifier that rewrites expressions using facts collected along the path to them. The
 * {@link ContextSimplification} driver asserts the facts of the enclosing context before it descends into an
 * expression and pops them again when it backtracks.
 *
 * Every assertion which taught the simplifier something opens exactly one scope. A driver records
 * {@link #scopeLevel()} before asserting and pops the difference afterwards; simplifiers do not check this.
 */
public interface Simplifier {

	/**
	 * Add a fact to the context.
	 *
	 * @param e The fact.
	 * @param negated If true, the negation of e is asserted.
	 * @return False if the fact contradicts the context, true otherwise.
	 */
	boolean assertExpr(RTLExpression e, boolean negated);

	/**
	 * Try to rewrite an expression using the current context.
	 *
	 * @param e The expression.
	 * @return An equivalent (under the context) simpler expression, or none.
	 */
	Optional<RTLExpression> simplify(RTLExpression e);

	/**
	 * Cheap check before calling {@link #simplify(RTLExpression)}. If this returns false, simplify would
	 * not rewrite e.
	 */
	boolean maySimplify(RTLExpression e);

	/**
	 * Forget the facts of the last numScopes scopes.
	 */
	void pop(int numScopes);

	int scopeLevel();

	/**
	 * Create a new simplifier with the same configuration but an empty context, creating expressions with
	 * the given factory.
	 */
	Simplifier translate(ExpressionFactory factory);
}
