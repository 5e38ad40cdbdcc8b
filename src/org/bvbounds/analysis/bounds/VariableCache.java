package org.bvbounds.analysis.bounds;

import org.bvbounds.analysis.bounds.statistic.Statistic;
import org.bvbounds.rtl.expressions.RTLExpression;
import org.bvbounds.rtl.expressions.RTLNumber;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Memoizes the set of all non-numeral sub-expressions of an expression, the expression itself included.
 * Sub-expressions are shared, so every expression is visited only once, and the traversal uses an explicit
 * stack to cope with deeply nested expressions.
 */
final class VariableCache {

	private static final Set<RTLExpression> noVariables = Collections.emptySet();

	private final Map<RTLExpression, Set<RTLExpression>> cache = new IdentityHashMap<>();

	/**
	 * @param t The expression.
	 * @return All non-numeral sub-expressions of t. The set is shared and must not be modified.
	 */
	Set<RTLExpression> getVariables(RTLExpression t) {
		Set<RTLExpression> result = cache.get(t);
		if (result != null) {
			Statistic.countCacheReuse();
			return result;
		}

		Deque<RTLExpression> todo = new ArrayDeque<>();
		todo.push(t);
		while (!todo.isEmpty()) {
			RTLExpression e = todo.peek();
			if (cache.containsKey(e)) {
				todo.pop();
				continue;
			}
			boolean ready = true;
			for (int i = 0; i < e.getOperandCount(); i++) {
				RTLExpression arg = e.getOperand(i);
				if (!cache.containsKey(arg)) {
					todo.push(arg);
					ready = false;
				}
			}
			if (!ready) {
				continue;
			}
			todo.pop();
			cache.put(e, collect(e));
		}
		return cache.get(t);
	}

	private Set<RTLExpression> collect(RTLExpression e) {
		if (e instanceof RTLNumber) {
			return noVariables;
		}
		Set<RTLExpression> set = Collections.newSetFromMap(new IdentityHashMap<RTLExpression, Boolean>());
		set.add(e);
		for (int i = 0; i < e.getOperandCount(); i++) {
			set.addAll(cache.get(e.getOperand(i)));
		}
		return Collections.unmodifiableSet(set);
	}

	int size() {
		return cache.size();
	}
}
