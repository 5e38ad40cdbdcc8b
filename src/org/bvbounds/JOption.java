package org.bvbounds;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A named, typed command line option with a default value. All options register themselves on creation,
 * so they can be looked up by name when parsing arguments.
 *
 * @param <T> Type of the option value.
 */
public final class JOption<T> {

	private static final Map<String, JOption<?>> registry = new TreeMap<>();

	private final String name;
	private final String argName;
	private final T defaultValue;
	private final String description;
	private T value;

	private JOption(String name, String argName, T defaultValue, String description) {
		assert name != null && defaultValue != null;
		this.name = name;
		this.argName = argName;
		this.defaultValue = defaultValue;
		this.description = description;
		this.value = defaultValue;
	}

	/**
	 * Create and register a new option.
	 *
	 * @param name The name, used as --name on the command line.
	 * @param argName Short name of the argument in the usage text, null for flags.
	 * @param defaultValue The default value. Determines the type of the option.
	 * @param description Description for the usage text.
	 * @return The new option.
	 */
	public static <T> JOption<T> create(String name, String argName, T defaultValue, String description) {
		JOption<T> option = new JOption<>(name, argName, defaultValue, description);
		synchronized (registry) {
			if (registry.containsKey(name)) {
				throw new IllegalArgumentException("Duplicate option: " + name);
			}
			registry.put(name, option);
		}
		return option;
	}

	/**
	 * Create and register a boolean flag.
	 */
	public static JOption<Boolean> create(String name, boolean defaultValue, String description) {
		return create(name, null, defaultValue, description);
	}

	public static JOption<?> getOption(String name) {
		synchronized (registry) {
			return registry.get(name);
		}
	}

	public static Collection<JOption<?>> getOptions() {
		synchronized (registry) {
			return Collections.unmodifiableCollection(registry.values());
		}
	}

	public String getName() {
		return name;
	}

	public T getValue() {
		return value;
	}

	public void setValue(T value) {
		assert value != null;
		this.value = value;
	}

	public void reset() {
		value = defaultValue;
	}

	public boolean isFlag() {
		return defaultValue instanceof Boolean;
	}

	/**
	 * Set the value from its textual representation, converted to the type of the default value.
	 *
	 * @param s The string to parse.
	 */
	@SuppressWarnings("unchecked")
	public void setValue(String s) {
		if (defaultValue instanceof Boolean) {
			if (!s.equalsIgnoreCase("true") && !s.equalsIgnoreCase("false")) {
				throw new IllegalArgumentException("Option " + name + " expects true or false, got " + s);
			}
			value = (T) Boolean.valueOf(s);
		} else if (defaultValue instanceof Integer) {
			try {
				value = (T) Integer.valueOf(s);
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Option " + name + " expects a number, got " + s, e);
			}
		} else if (defaultValue instanceof String) {
			value = (T) s;
		} else {
			throw new UnsupportedOperationException("Cannot parse values of type " + defaultValue.getClass().getSimpleName());
		}
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("--").append(name);
		if (argName != null) {
			sb.append(" <").append(argName).append('>');
		}
		return sb.append('\t').append(description).append(" (default: ").append(defaultValue).append(')').toString();
	}
}
