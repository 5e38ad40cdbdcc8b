package org.bvbounds.transformation;

import org.bvbounds.analysis.bounds.BoundsSimplifier;
import org.bvbounds.rtl.expressions.ExpressionFactory;
import org.bvbounds.rtl.expressions.Operator;
import org.bvbounds.rtl.expressions.RTLExpression;
import org.bvbounds.rtl.expressions.RTLNumber;
import org.bvbounds.rtl.expressions.RTLVariable;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class ContextSimplificationTest {

	private ExpressionFactory f;
	private RTLVariable x;
	private RTLVariable y;
	private RTLVariable p;
	private ContextSimplification driver;

	@Before
	public void setUp() {
		f = new ExpressionFactory();
		x = f.createVariable("x", 8);
		y = f.createVariable("y", 8);
		p = f.createVariable("p", 1);
		driver = new ContextSimplification(f, new BoundsSimplifier(f, false));
	}

	private RTLNumber n(long value) {
		return f.createNumber(value, 8);
	}

	private RTLExpression ule(RTLExpression a, RTLExpression b) {
		return f.createUnsignedLessOrEqual(a, b);
	}

	private RTLExpression run(RTLExpression e) {
		RTLExpression result = driver.simplify(e);
		assertEquals(0, driver.getSimplifier().scopeLevel());
		return result;
	}

	@Test
	public void redundantConjunct() {
		assertSame(ule(x, n(5)), run(f.createAnd(ule(x, n(5)), ule(x, n(10)))));
	}

	@Test
	public void contradictingConjuncts() {
		assertSame(f.getFalse(), run(f.createAnd(ule(x, n(3)), ule(n(5), x))));
		assertSame(f.getFalse(), run(f.createAnd(p, ule(x, n(3)), ule(n(5), x))));
	}

	@Test
	public void disjunctsSeeNegatedPredecessors() {
		RTLExpression unchanged = f.createOr(ule(x, n(5)), ule(x, n(10)));
		assertSame(unchanged, run(unchanged));
		assertSame(ule(x, n(10)), run(f.createOr(ule(x, n(10)), ule(x, n(5)))));
		assertSame(f.getTrue(), run(f.createOr(f.createNot(ule(x, n(5))), ule(x, n(10)))));
	}

	@Test
	public void numbersAreSubstituted() {
		RTLExpression eq = f.createEqual(x, n(5));
		RTLExpression formula = f.createAnd(eq, ule(f.createPlus(x, y), n(3)));
		RTLExpression expected = f.createAnd(eq, ule(f.createPlus(n(5), y), n(3)));
		assertSame(expected, run(formula));
	}

	@Test
	public void substitutedComparisonsAreEvaluated() {
		RTLExpression eq = f.createEqual(x, n(5));
		assertSame(eq, run(f.createAnd(eq, ule(x, n(10)))));
		assertSame(f.getFalse(), run(f.createAnd(eq, f.createLessOrEqual(x, n(-1)))));
		assertSame(f.getTrue(), run(f.createOr(f.createNot(eq), f.createEqual(x, n(5)))));
	}

	@Test
	public void otherOperatorsAreRebuilt() {
		RTLExpression eq = f.createEqual(x, n(5));
		RTLExpression product = f.createOperation(Operator.MUL, x, y);
		RTLExpression expected = f.createAnd(eq, f.createEqual(f.createOperation(Operator.MUL, n(5), y), n(0)));
		assertSame(expected, run(f.createAnd(eq, f.createEqual(product, n(0)))));
	}

	@Test(timeout = 10000)
	public void sharedSubExpressionsAreSimplifiedOnce() {
		RTLExpression e = x;
		for (int i = 0; i < 40; i++) {
			e = f.createPlus(e, e);
		}
		RTLExpression formula = f.createAnd(ule(y, n(3)), ule(e, n(7)));
		assertSame(formula, run(formula));

		RTLExpression eq = f.createEqual(x, n(2));
		RTLExpression expected = f.createAnd(eq, ule(substitute(40), n(7)));
		assertSame(expected, run(f.createAnd(eq, ule(e, n(7)))));
	}

	private RTLExpression substitute(int depth) {
		RTLExpression e = n(2);
		for (int i = 0; i < depth; i++) {
			e = f.createPlus(e, e);
		}
		return e;
	}

	@Test
	public void resultsDependOnContext() {
		RTLExpression shared = ule(x, n(10));
		// shared is true under the conjunction but not under the negated first disjunct
		RTLExpression formula = f.createOr(f.createAnd(ule(x, n(5)), shared), shared);
		assertSame(f.createOr(ule(x, n(5)), shared), run(formula));
	}

	@Test(timeout = 10000)
	public void deepExpressions() {
		RTLExpression e = x;
		for (int i = 0; i < 100000; i++) {
			e = f.createNeg(e);
		}
		RTLExpression formula = f.createAnd(ule(y, n(3)), ule(e, n(7)));
		assertSame(formula, run(formula));
	}

	@Test
	public void nestedJunctions() {
		assertSame(ule(x, n(5)), run(f.createAnd(ule(x, n(5)), f.createOr(ule(x, n(7)), p))));
		RTLExpression inner = f.createAnd(p, ule(x, n(9)));
		assertSame(f.createAnd(ule(x, n(5)), p), run(f.createAnd(ule(x, n(5)), inner)));
	}

	@Test
	public void contextEndsAtJunction() {
		// the bound of the first conjunct must not leak into the second disjunct
		RTLExpression formula = f.createOr(f.createAnd(ule(x, n(5)), p), ule(x, n(10)));
		assertSame(formula, run(formula));
	}

	@Test
	public void constantsAreFolded() {
		assertSame(f.getFalse(), run(f.createAnd(p, f.getFalse())));
		assertSame(p, run(f.createAnd(f.getTrue(), p)));
		assertSame(f.getTrue(), run(f.createOr(p, ule(n(0), x))));
	}

	@Test
	public void leavesAreKept() {
		assertSame(x, run(x));
		assertSame(n(4), run(n(4)));
		RTLExpression sum = f.createPlus(x, y);
		assertSame(sum, run(sum));
	}

	@Test
	public void outerContextIsKept() {
		Simplifier s = driver.getSimplifier();
		assertTrue(s.assertExpr(ule(x, n(5)), false));
		assertSame(f.getTrue(), driver.simplify(f.createAnd(ule(x, n(6)), ule(x, n(7)))));
		assertEquals(1, s.scopeLevel());
	}
}
