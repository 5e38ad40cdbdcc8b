package org.bvbounds.util;

import org.bvbounds.Options;

import java.io.PrintStream;

/**
 * Leveled logger writing to a print stream. The active level is taken from {@link Options#verbosity}.
 */
public class Logger {

	public enum Level { FATAL, ERROR, WARN, INFO, VERBOSE, DEBUG }

	private static String globalPrefix = "";
	private static boolean showClass = false;

	public static Logger getLogger(Class<? extends Object> c) {
		return new Logger(c, System.out);
	}

	public static void setGlobalPrefix(String prefix) {
		globalPrefix = prefix.isEmpty() ? "" : prefix + '\t';
	}

	/**
	 * Prefix the messages of loggers created afterwards with their class name.
	 */
	public static void setShowClass(boolean show) {
		showClass = show;
	}

	private final PrintStream out;
	private final String classPrefix;

	private Logger(Class<? extends Object> clazz, PrintStream outStream) {
		this.out = outStream;
		this.classPrefix = showClass ? clazz.getSimpleName() + ":\t" : "";
	}

	private static int getDebugLevel() {
		return Options.verbosity.getValue();
	}

	public boolean isEnabled(Level level) {
		return level.ordinal() <= getDebugLevel();
	}

	public boolean isDebugEnabled() {
		return isEnabled(Level.DEBUG);
	}

	private String prefix() {
		return globalPrefix + classPrefix;
	}

	public void log(Level level, Object message) {
		if (isEnabled(level)) {
			out.print(prefix() + message + '\n');
		}
	}

	public void debug(Object message) {
		log(Level.DEBUG, message);
	}

	public void verbose(Object message) {
		log(Level.VERBOSE, message);
	}

	public void info(Object message) {
		log(Level.INFO, message);
	}

	public void warn(Object message) {
		log(Level.WARN, message);
	}

	public void error(Object message) {
		log(Level.ERROR, message);
	}
}
