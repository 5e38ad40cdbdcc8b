package org.bvbounds.analysis.bounds.statistic;

import org.bvbounds.util.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Utility class to record statistic information for the bounds simplifier. The counters are global and
 * shared by all simplifiers, including translated copies used on other threads.
 */
public class Statistic {

	private static final Logger logger = Logger.getLogger(Statistic.class);

	private static volatile boolean hasNoStatistic = true;

	private static final AtomicLong assertCount = new AtomicLong();
	private static final AtomicLong narrowCount = new AtomicLong();
	private static final AtomicLong contradictionCount = new AtomicLong();

	private static final AtomicLong simplifyCount = new AtomicLong();
	private static final AtomicLong rewriteCount = new AtomicLong();

	private static final AtomicLong cacheReuseCount = new AtomicLong();

	static {
		// register a hook to print the generated statistic.
		Runtime.getRuntime().addShutdownHook(new Thread(new Runnable() {
			@Override
			public void run() {
				printStatistic();
			}
		}));
	}

	public static void activateStatistic() {
		hasNoStatistic = false;
	}

	/**
	 * Count the number of asserted expressions.
	 */
	public static void countAssert() {
		assertCount.incrementAndGet();
	}

	/**
	 * Count the number of assertions which narrowed a bound.
	 */
	public static void countNarrow() {
		narrowCount.incrementAndGet();
	}

	/**
	 * Count the number of assertions found to contradict the context.
	 */
	public static void countContradiction() {
		contradictionCount.incrementAndGet();
	}

	public static void countSimplify() {
		simplifyCount.incrementAndGet();
	}

	public static void countRewrite() {
		rewriteCount.incrementAndGet();
	}

	/**
	 * Count the number of times a memoized result could be reused.
	 */
	public static void countCacheReuse() {
		cacheReuseCount.incrementAndGet();
	}

	public static long getAssertCount() {
		return assertCount.get();
	}

	public static long getNarrowCount() {
		return narrowCount.get();
	}

	public static long getContradictionCount() {
		return contradictionCount.get();
	}

	public static long getRewriteCount() {
		return rewriteCount.get();
	}

	/**
	 * Output the generated statistic if one exists, otherwise do nothing.
	 */
	private static void printStatistic() {
		if (hasNoStatistic) {
			return;
		}

		logger.info("*** Bounds ***");
		logger.info("Asserted: " + assertCount.get());
		logger.info("Narrowed: " + narrowCount.get());
		logger.info("Contradictions: " + contradictionCount.get());
		logger.info("");

		logger.info("*** Simplification ***");
		logger.info("Attempted: " + simplifyCount.get());
		logger.info("Rewritten: " + rewriteCount.get());
		logger.info("Cache reuses: " + cacheReuseCount.get());
		logger.info("");
	}

}
