package org.bvbounds.analysis.bounds;

import org.bvbounds.analysis.bounds.statistic.Statistic;
import org.bvbounds.rtl.expressions.RTLExpression;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Memoizes whether an expression contains an atom bounds could be extracted from.
 */
final class BoundPresenceCache {

	private final Map<RTLExpression, Boolean> cache = new IdentityHashMap<>();

	boolean hasBounds(RTLExpression t) {
		Boolean result = cache.get(t);
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
			if (BoundExtractor.isBoundShaped(e)) {
				// no need to look any further
				todo.pop();
				cache.put(e, Boolean.TRUE);
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
			boolean found = false;
			for (int i = 0; i < e.getOperandCount(); i++) {
				if (cache.get(e.getOperand(i))) {
					found = true;
					break;
				}
			}
			cache.put(e, found);
		}
		return cache.get(t);
	}

	int size() {
		return cache.size();
	}
}
