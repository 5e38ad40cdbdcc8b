package org.bvbounds;

import org.bvbounds.analysis.bounds.BoundsSimplifier;
import org.bvbounds.rtl.expressions.ExpressionFactory;
import org.junit.After;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class OptionsTest {

	@After
	public void tearDown() {
		for (JOption<?> option : JOption.getOptions()) {
			option.reset();
		}
	}

	@Test
	public void defaults() {
		assertFalse(Options.propagateEq.getValue());
		assertFalse(Options.failFast.getValue());
		assertSame(Options.propagateEq, JOption.getOption("propagate-eq"));
		assertFalse(new BoundsSimplifier(new ExpressionFactory()).isPropagateEq());
	}

	@Test
	public void parse() {
		List<String> rest = Options.parseOptions(new String[] {"a", "--propagate-eq", "--verbosity", "2", "b"});
		assertEquals(Arrays.asList("a", "b"), rest);
		assertTrue(Options.propagateEq.getValue());
		assertEquals(Integer.valueOf(2), Options.verbosity.getValue());
		assertTrue(new BoundsSimplifier(new ExpressionFactory()).isPropagateEq());
	}

	@Test
	public void explicitFlagValue() {
		Options.propagateEq.setValue(true);
		List<String> rest = Options.parseOptions(new String[] {"--propagate-eq", "false", "file"});
		assertEquals(Arrays.asList("file"), rest);
		assertFalse(Options.propagateEq.getValue());
	}

	@Test(expected = IllegalArgumentException.class)
	public void unknownOption() {
		Options.parseOptions(new String[] {"--no-such-option"});
	}

	@Test(expected = IllegalArgumentException.class)
	public void badNumber() {
		Options.parseOptions(new String[] {"--verbosity", "loud"});
	}

	@Test(expected = IllegalArgumentException.class)
	public void missingValue() {
		Options.parseOptions(new String[] {"--verbosity"});
	}

	@Test
	public void usage() {
		assertTrue(Options.verbosity.toString().startsWith("--verbosity <level>"));
		assertFalse(Options.propagateEq.toString().contains("<"));
	}
}
