package org.bvbounds.util;

/**
 * A value which may be absent. Used for results of operations which can fail without this being an error,
 * like an empty intersection or a declined rewrite.
 *
 * @param <T> Type of the value.
 */
public final class Optional<T> {
	private final T val;

	private static final Optional<?> NONE = new Optional<>();

	private Optional(T val) {
		assert val != null;
		this.val = val;
	}

	private Optional() {
		val = null;
	}

	public boolean hasValue() {
		return val != null;
	}

	public T getValue() {
		if (val == null) {
			throw new IllegalStateException("getValue called on None");
		}
		return val;
	}

	@Override
	public String toString() {
		return hasValue() ? "Some(" + val + ')' : "None";
	}

	@Override
	public boolean equals(Object other) {
		if (other instanceof Optional<?>) {
			Optional<?> opt = (Optional<?>) other;
			return hasValue() == opt.hasValue() && (!hasValue() || val.equals(opt.val));
		}
		return false;
	}

	@Override
	public int hashCode() {
		return hasValue() ? val.hashCode() : 0;
	}

	@SuppressWarnings("unchecked")
	public static <T> Optional<T> none() {
		return (Optional<T>) NONE;
	}

	public static <T> Optional<T> some(T val) {
		return new Optional<>(val);
	}

	public static <T> Optional<T> optional(T val) {
		return val == null ? Optional.<T>none() : new Optional<>(val);
	}
}
