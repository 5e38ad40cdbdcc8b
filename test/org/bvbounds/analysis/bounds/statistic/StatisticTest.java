package org.bvbounds.analysis.bounds.statistic;

import org.bvbounds.analysis.bounds.BoundsSimplifier;
import org.bvbounds.rtl.expressions.ExpressionFactory;
import org.bvbounds.rtl.expressions.RTLExpression;
import org.bvbounds.rtl.expressions.RTLVariable;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class StatisticTest {

	private static final int THREADS = 4;
	private static final int ASSERTIONS = 20000;

	@Test
	public void countsOfTranslatedSimplifiersAddUp() throws InterruptedException {
		BoundsSimplifier simplifier = new BoundsSimplifier(new ExpressionFactory(), false);
		long before = Statistic.getAssertCount();

		List<Thread> threads = new ArrayList<>();
		for (int i = 0; i < THREADS; i++) {
			final ExpressionFactory factory = new ExpressionFactory();
			final BoundsSimplifier copy = simplifier.translate(factory);
			threads.add(new Thread(new Runnable() {
				@Override
				public void run() {
					RTLVariable x = factory.createVariable("x", 16);
					RTLExpression atom = factory.createUnsignedLessOrEqual(x, factory.createNumber(100L, 16));
					for (int j = 0; j < ASSERTIONS; j++) {
						copy.assertExpr(atom, false);
					}
				}
			}));
		}
		for (Thread t : threads) {
			t.start();
		}
		for (Thread t : threads) {
			t.join();
		}

		assertEquals(before + THREADS * ASSERTIONS, Statistic.getAssertCount());
	}
}
