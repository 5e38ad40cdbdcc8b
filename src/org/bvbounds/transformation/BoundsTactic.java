package org.bvbounds.transformation;

import org.bvbounds.analysis.bounds.BoundsSimplifier;
import org.bvbounds.rtl.expressions.ExpressionFactory;
import org.bvbounds.rtl.expressions.RTLExpression;
import org.bvbounds.util.Logger;

/**
 * Contextual bounds simplification: a {@link ContextSimplification} driven by a {@link BoundsSimplifier}.
 */
public final class BoundsTactic {

	public static final String NAME = "bv-bounds";
	public static final String DESCRIPTION = "Contextual bounds simplification of bit-vector comparisons.";

	private static final Logger logger = Logger.getLogger(BoundsTactic.class);

	private final ContextSimplification driver;

	private BoundsTactic(ContextSimplification driver) {
		this.driver = driver;
	}

	/**
	 * Create the tactic, configured by the global options.
	 */
	public static BoundsTactic create(ExpressionFactory factory) {
		return new BoundsTactic(new ContextSimplification(factory, new BoundsSimplifier(factory)));
	}

	public static BoundsTactic create(ExpressionFactory factory, boolean propagateEq) {
		return new BoundsTactic(new ContextSimplification(factory, new BoundsSimplifier(factory, propagateEq)));
	}

	public RTLExpression apply(RTLExpression formula) {
		logger.verbose("Starting bounds simplification.");
		long startTime = System.currentTimeMillis();

		RTLExpression result = driver.simplify(formula);

		long endTime = System.currentTimeMillis();
		logger.verbose("Finished after " + (endTime - startTime) + "ms.");
		return result;
	}

	/**
	 * Create a copy of this tactic for formulas of another factory. The copy shares no state with this tactic.
	 */
	public BoundsTactic translate(ExpressionFactory factory) {
		return new BoundsTactic(new ContextSimplification(factory, driver.getSimplifier().translate(factory)));
	}

	public Simplifier getSimplifier() {
		return driver.getSimplifier();
	}
}
