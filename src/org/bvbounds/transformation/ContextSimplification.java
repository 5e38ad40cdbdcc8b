package org.bvbounds.transformation;

import org.bvbounds.analysis.bounds.statistic.Statistic;
import org.bvbounds.rtl.expressions.ExpressionFactory;
import org.bvbounds.rtl.expressions.Operator;
import org.bvbounds.rtl.expressions.RTLExpression;
import org.bvbounds.rtl.expressions.RTLNumber;
import org.bvbounds.rtl.expressions.RTLOperation;
import org.bvbounds.util.Logger;
import org.bvbounds.util.Optional;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks a formula and lets a {@link Simplifier} rewrite its parts under the context of the enclosing
 * conjunctions and disjunctions. Every conjunct is simplified assuming the conjuncts before it, every
 * disjunct assuming the negations of the disjuncts before it.
 *
 * Results are remembered per scope level of the simplifier, so shared sub-expressions are simplified once
 * per context. The walk uses an explicit stack.
 */
public class ContextSimplification {

	private static final Logger logger = Logger.getLogger(ContextSimplification.class);

	/**
	 * An operation whose operands are being simplified.
	 */
	private static final class Frame {
		final RTLOperation op;
		final boolean junction;
		final boolean conjunction;
		final int level;
		final RTLExpression[] operands;
		final List<RTLExpression> kept;
		int next = 0;
		RTLExpression result;

		Frame(RTLOperation op, int level) {
			this.op = op;
			this.level = level;
			Operator operator = op.getOperator();
			junction = op.getBitWidth() == 1 && (operator == Operator.AND || operator == Operator.OR);
			conjunction = operator == Operator.AND;
			operands = junction ? null : new RTLExpression[op.getOperandCount()];
			kept = junction ? new ArrayList<RTLExpression>() : null;
		}

		boolean hasNext() {
			return result == null && next < op.getOperandCount();
		}
	}

	private final ExpressionFactory factory;
	private final Simplifier simplifier;

	// index is the scope level the results were computed at
	private final List<Map<RTLExpression, RTLExpression>> cache = new ArrayList<>();

	public ContextSimplification(ExpressionFactory factory, Simplifier simplifier) {
		this.factory = factory;
		this.simplifier = simplifier;
	}

	public Simplifier getSimplifier() {
		return simplifier;
	}

	/**
	 * Simplify a formula. The context of the simplifier is the same before and after the call.
	 *
	 * @param e The formula, created by the factory of this driver.
	 * @return The simplified formula.
	 */
	public RTLExpression simplify(RTLExpression e) {
		// the context may have changed since the last call
		cache.clear();
		int level = simplifier.scopeLevel();
		RTLExpression result = visit(e);
		assert simplifier.scopeLevel() == level : "Unbalanced scopes: " + simplifier.scopeLevel() + " instead of " + level;
		cache.clear();
		return result;
	}

	private RTLExpression visit(RTLExpression root) {
		Deque<Frame> todo = new ArrayDeque<>();
		RTLExpression value = enter(root, todo);
		while (!todo.isEmpty()) {
			Frame frame = todo.peek();
			if (value != null) {
				accept(frame, value);
				value = null;
			}
			if (frame.hasNext()) {
				value = enter(frame.op.getOperand(frame.next++), todo);
			} else {
				todo.pop();
				value = leave(frame);
			}
		}
		return value;
	}

	/**
	 * Start simplifying e.
	 *
	 * @return The result, or null if a frame for e was pushed.
	 */
	private RTLExpression enter(RTLExpression e, Deque<Frame> todo) {
		if (e instanceof RTLNumber) {
			return e;
		}
		RTLExpression known = cached(e);
		if (known != null) {
			Statistic.countCacheReuse();
			return known;
		}
		if (e instanceof RTLOperation) {
			todo.push(new Frame((RTLOperation) e, simplifier.scopeLevel()));
			return null;
		}
		RTLExpression result = rewrite(e);
		remember(e, result);
		return result;
	}

	/**
	 * Take the simplified operand frame.next - 1.
	 */
	private void accept(Frame frame, RTLExpression a) {
		if (!frame.junction) {
			frame.operands[frame.next - 1] = a;
			return;
		}
		RTLNumber neutral = factory.createBoolean(frame.conjunction);
		RTLNumber absorbing = factory.createBoolean(!frame.conjunction);
		if (a == absorbing) {
			frame.result = absorbing;
		} else if (a != neutral) {
			frame.kept.add(a);
			// under a disjunction, the later disjuncts only matter if the earlier ones are false
			if (!simplifier.assertExpr(a, !frame.conjunction)) {
				logger.verbose("Context of " + frame.op.getOperator() + " became inconsistent");
				frame.result = absorbing;
			}
		}
	}

	private RTLExpression leave(Frame frame) {
		RTLExpression r;
		if (frame.junction) {
			simplifier.pop(simplifier.scopeLevel() - frame.level);
			forgetAbove(frame.level);
			if (frame.result != null) {
				r = frame.result;
			} else {
				RTLExpression[] operands = frame.kept.toArray(new RTLExpression[frame.kept.size()]);
				r = frame.conjunction ? factory.createAnd(operands) : factory.createOr(operands);
			}
		} else {
			r = factory.rebuild(frame.op, frame.operands);
		}
		RTLExpression result = rewrite(r);
		remember(frame.op, result);
		return result;
	}

	private RTLExpression rewrite(RTLExpression r) {
		if (r instanceof RTLNumber || !simplifier.maySimplify(r)) {
			return r;
		}
		Optional<RTLExpression> simplified = simplifier.simplify(r);
		if (simplified.hasValue()) {
			if (logger.isDebugEnabled()) {
				logger.debug("Simplified " + r + " to " + simplified.getValue());
			}
			return simplified.getValue();
		}
		return r;
	}

	private RTLExpression cached(RTLExpression e) {
		int level = simplifier.scopeLevel();
		return level < cache.size() ? cache.get(level).get(e) : null;
	}

	private void remember(RTLExpression e, RTLExpression result) {
		int level = simplifier.scopeLevel();
		while (cache.size() <= level) {
			cache.add(new IdentityHashMap<RTLExpression, RTLExpression>());
		}
		cache.get(level).put(e, result);
	}

	/**
	 * Drop the results computed in contexts which were popped.
	 */
	private void forgetAbove(int level) {
		while (cache.size() > level + 1) {
			cache.remove(cache.size() - 1);
		}
	}
}
