package org.bvbounds.analysis.bounds;

import org.bvbounds.rtl.expressions.ExpressionFactory;
import org.bvbounds.rtl.expressions.RTLExpression;
import org.bvbounds.rtl.expressions.RTLVariable;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class BoundPresenceCacheTest {

	private ExpressionFactory f;
	private RTLVariable x;
	private RTLVariable p;

	@Before
	public void setUp() {
		f = new ExpressionFactory();
		x = f.createVariable("x", 8);
		p = f.createVariable("p", 1);
	}

	@Test
	public void findsNestedBounds() {
		BoundPresenceCache cache = new BoundPresenceCache();
		RTLExpression atom = f.createUnsignedLessOrEqual(x, f.createNumber(5L, 8));
		assertTrue(cache.hasBounds(atom));
		assertTrue(cache.hasBounds(f.createAnd(p, f.createNot(atom))));
		assertFalse(cache.hasBounds(f.createAnd(p, f.createNot(p))));
		assertFalse(cache.hasBounds(f.createUnsignedLessThan(x, f.createNumber(5L, 8))));
		assertFalse(cache.hasBounds(x));
	}

	@Test
	public void stopsAtFirstBound() {
		BoundPresenceCache cache = new BoundPresenceCache();
		RTLExpression inner = f.createPlus(x, f.createVariable("y", 8));
		RTLExpression atom = f.createEqual(inner, f.createNumber(1L, 8));
		assertTrue(cache.hasBounds(atom));
		// the operands of the atom were never looked at
		assertEquals(1, cache.size());
	}

	@Test
	public void deepExpressions() {
		BoundPresenceCache cache = new BoundPresenceCache();
		RTLExpression without = p;
		RTLExpression with = f.createLessOrEqual(x, f.createNumber(0L, 8));
		for (int i = 0; i < 100000; i++) {
			without = f.createNot(without);
			with = f.createNot(with);
		}
		assertFalse(cache.hasBounds(without));
		assertTrue(cache.hasBounds(with));
		assertTrue(cache.hasBounds(f.createAnd(without, with)));
	}
}
