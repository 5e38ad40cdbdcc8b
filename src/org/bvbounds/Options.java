package org.bvbounds;

import org.bvbounds.util.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Global options of the bounds simplifier.
 */
public final class Options {

	public static final JOption<Integer> verbosity = JOption.create("verbosity", "level", Logger.Level.INFO.ordinal(), "Set the output level (0 = fatal only, 5 = debug).");

	public static final JOption<Boolean> failFast = JOption.create("fail-fast", false, "Turn soft warnings about internal inconsistencies into assertion failures.");

	public static final JOption<Boolean> propagateEq = JOption.create("propagate-eq", false, "Propagate equalities from inequalities.");

	private static final Logger logger = Logger.getLogger(Options.class);

	private Options() {
	}

	/**
	 * Parse options from the command line. Options have the form --name value, flags may omit the value.
	 *
	 * @param args The arguments.
	 * @return All arguments which are not options, in their original order.
	 */
	public static List<String> parseOptions(String[] args) {
		List<String> rest = new ArrayList<>();
		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			if (!arg.startsWith("--")) {
				rest.add(arg);
				continue;
			}
			JOption<?> option = JOption.getOption(arg.substring(2));
			if (option == null) {
				throw new IllegalArgumentException("Unknown option: " + arg);
			}
			if (option.isFlag() && (i + 1 >= args.length || !isBooleanLiteral(args[i + 1]))) {
				option.setValue("true");
			} else if (i + 1 < args.length) {
				option.setValue(args[++i]);
			} else {
				throw new IllegalArgumentException("Missing value for option " + arg);
			}
			logger.debug("Set option " + option.getName() + " to " + option.getValue());
		}
		return rest;
	}

	private static boolean isBooleanLiteral(String s) {
		return s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false");
	}
}
