package org.bvbounds.analysis.bounds;

import org.bvbounds.Options;
import org.bvbounds.analysis.bounds.statistic.Statistic;
import org.bvbounds.rtl.expressions.ExpressionFactory;
import org.bvbounds.rtl.expressions.Operator;
import org.bvbounds.rtl.expressions.RTLExpression;
import org.bvbounds.rtl.expressions.RTLNumber;
import org.bvbounds.rtl.expressions.RTLOperation;
import org.bvbounds.transformation.Simplifier;
import org.bvbounds.util.Logger;
import org.bvbounds.util.Optional;
import org.bvbounds.util.Pair;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Simplifies comparisons of bit-vector terms with numbers using the bounds asserted for those terms along
 * the current path. Keeps an interval for every bounded term and an undo record for every assertion which
 * narrowed one.
 *
 * Not thread safe; use {@link #translate(ExpressionFactory)} to get an independent copy.
 */
public final class BoundsSimplifier implements Simplifier {

	private static final Logger logger = Logger.getLogger(BoundsSimplifier.class);

	/**
	 * Undo information for one narrowing assertion.
	 */
	private static final class UndoBound {
		final RTLExpression expression;
		final Interval previous;
		final boolean fresh;

		UndoBound(RTLExpression expression, Interval previous, boolean fresh) {
			this.expression = expression;
			this.previous = previous;
			this.fresh = fresh;
		}
	}

	private final ExpressionFactory factory;
	private final boolean propagateEq;
	private final Map<RTLExpression, Interval> bounds = new IdentityHashMap<>();
	private final List<UndoBound> scopes = new ArrayList<>();
	private final VariableCache variables = new VariableCache();
	private final BoundPresenceCache boundPresence = new BoundPresenceCache();

	/**
	 * Create a simplifier configured by the global options.
	 *
	 * @param factory Factory used to build rewritten expressions.
	 */
	public BoundsSimplifier(ExpressionFactory factory) {
		this(factory, Options.propagateEq.getValue());
	}

	/**
	 * @param factory Factory used to build rewritten expressions.
	 * @param propagateEq If true, inequalities which admit only one value in the context are rewritten to equalities.
	 */
	public BoundsSimplifier(ExpressionFactory factory, boolean propagateEq) {
		assert factory != null;
		this.factory = factory;
		this.propagateEq = propagateEq;
		Statistic.activateStatistic();
	}

	public boolean isPropagateEq() {
		return propagateEq;
	}

	/**
	 * @param e A term.
	 * @return The interval known for e on the current path, or null.
	 */
	public Interval getBound(RTLExpression e) {
		return bounds.get(e);
	}

	private static boolean isNot(RTLExpression e) {
		return e instanceof RTLOperation && ((RTLOperation) e).getOperator() == Operator.NOT && e.getBitWidth() == 1;
	}

	private static RTLExpression notOperand(RTLExpression e) {
		return ((RTLOperation) e).getOperand(0);
	}

	@Override
	public boolean assertExpr(RTLExpression t, boolean negated) {
		while (isNot(t)) {
			t = notOperand(t);
			negated = !negated;
		}
		Statistic.countAssert();

		Optional<Pair<RTLExpression, Interval>> bound = BoundExtractor.extract(t);
		if (!bound.hasValue()) {
			return true;
		}
		RTLExpression v = bound.getValue().getLeft();
		Interval b = bound.getValue().getRight();
		if (negated) {
			Optional<Interval> complement = b.negate();
			if (!complement.hasValue()) {
				// only a tight full interval has an empty complement
				assert !Options.failFast.getValue() || b.isTight() : "Empty complement of loose bound " + b;
				logger.verbose("Asserting the negation of a tautology");
				Statistic.countContradiction();
				return false;
			}
			b = complement.getValue();
		}
		if (logger.isDebugEnabled()) {
			logger.debug((negated ? "(not " + t + ")" : t) + ": " + v + " in " + b);
		}

		Interval old = bounds.get(v);
		if (old == null) {
			bounds.put(v, b);
			scopes.add(new UndoBound(v, null, true));
			Statistic.countNarrow();
			return true;
		}
		Optional<Interval> intersection = old.intersect(b);
		if (!intersection.hasValue()) {
			logger.verbose("Contradicting bound " + b + ", known: " + old);
			Statistic.countContradiction();
			return false;
		}
		if (old.equals(intersection.getValue())) {
			return true;
		}
		scopes.add(new UndoBound(v, old, false));
		bounds.put(v, intersection.getValue());
		Statistic.countNarrow();
		return true;
	}

	@Override
	public Optional<RTLExpression> simplify(RTLExpression t) {
		Statistic.countSimplify();
		Interval known = bounds.get(t);
		if (known != null && known.isSingleton()) {
			return rewritten(t, factory.createNumber(known.getMin(), t.getBitWidth()));
		}

		if (t.getBitWidth() != 1) {
			return Optional.none();
		}

		RTLExpression atom = t;
		boolean negated = false;
		while (isNot(atom)) {
			atom = notOperand(atom);
			negated = !negated;
		}

		Optional<Pair<RTLExpression, Interval>> bound = BoundExtractor.extract(atom);
		if (!bound.hasValue()) {
			return Optional.none();
		}
		RTLExpression v = bound.getValue().getLeft();
		Interval b = bound.getValue().getRight();

		if (negated && b.isTight()) {
			negated = false;
			Optional<Interval> complement = b.negate();
			if (!complement.hasValue()) {
				return rewritten(t, factory.getFalse());
			}
			b = complement.getValue();
		}

		RTLExpression result = null;
		Interval ctx = bounds.get(v);
		if (b.isFull() && b.isTight()) {
			result = factory.getTrue();
		} else if (ctx != null) {
			Optional<Interval> intersection;
			if (ctx.implies(b)) {
				result = factory.getTrue();
			} else if (!(intersection = b.intersect(ctx)).hasValue()) {
				result = factory.getFalse();
			} else if (propagateEq && intersection.getValue().isSingleton()) {
				result = factory.createEqual(v, factory.createNumber(intersection.getValue().getMin(), v.getBitWidth()));
			}
		}

		if (logger.isDebugEnabled()) {
			logger.debug(t + " " + b + " (ctx: " + ctx + "): " + result);
		}
		if (result == null || result == atom) {
			return Optional.none();
		}
		if (negated) {
			result = factory.createNot(result);
		}
		return rewritten(t, result);
	}

	private Optional<RTLExpression> rewritten(RTLExpression t, RTLExpression result) {
		Statistic.countRewrite();
		if (logger.isDebugEnabled()) {
			logger.debug("Rewriting " + t + " to " + result);
		}
		return Optional.some(result);
	}

	@Override
	public boolean maySimplify(RTLExpression t) {
		if (t instanceof RTLNumber) {
			return false;
		}
		while (isNot(t)) {
			t = notOperand(t);
		}

		Set<RTLExpression> used = null;
		for (Map.Entry<RTLExpression, Interval> entry : bounds.entrySet()) {
			if (!entry.getValue().isSingleton()) {
				continue;
			}
			if (used == null) {
				used = variables.getVariables(t);
			}
			if (used.contains(entry.getKey())) {
				return true;
			}
		}

		// skip common case: single bound constraint without any context for simplification
		Optional<Pair<RTLExpression, Interval>> bound = BoundExtractor.extract(t);
		if (bound.hasValue()) {
			return bound.getValue().getRight().isFull() || bounds.containsKey(bound.getValue().getLeft());
		}
		return boundPresence.hasBounds(t);
	}

	@Override
	public void pop(int numScopes) {
		logger.debug("pop: " + numScopes);
		if (numScopes < 0) {
			throw new IllegalArgumentException("Negative number of scopes: " + numScopes);
		}
		if (scopes.isEmpty()) {
			return;
		}
		int target = scopes.size() - numScopes;
		if (target < 0) {
			throw new IllegalArgumentException("Cannot pop " + numScopes + " scopes, only " + scopes.size() + " are open");
		}
		if (target == 0) {
			bounds.clear();
			scopes.clear();
			return;
		}
		for (int i = scopes.size() - 1; i >= target; i--) {
			UndoBound undo = scopes.remove(i);
			if (!bounds.containsKey(undo.expression)) {
				logger.warn("No bound to undo for " + undo.expression);
				assert !Options.failFast.getValue() : "Undo without bound";
			}
			if (undo.fresh) {
				bounds.remove(undo.expression);
			} else {
				bounds.put(undo.expression, undo.previous);
			}
		}
	}

	@Override
	public int scopeLevel() {
		return scopes.size();
	}

	@Override
	public BoundsSimplifier translate(ExpressionFactory factory) {
		return new BoundsSimplifier(factory, propagateEq);
	}
}
