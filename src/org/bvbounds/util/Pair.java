package org.bvbounds.util;

/**
 * Immutable pair of two non-null values.
 */
public final class Pair<L, R> {

	private final L left;
	private final R right;

	public Pair(L left, R right) {
		assert left != null && right != null;
		this.left = left;
		this.right = right;
	}

	public L getLeft() {
		return left;
	}

	public R getRight() {
		return right;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Pair<?, ?>)) {
			return false;
		}
		Pair<?, ?> p = (Pair<?, ?>) o;
		return left.equals(p.left) && right.equals(p.right);
	}

	@Override
	public int hashCode() {
		return 31 * left.hashCode() + right.hashCode();
	}

	@Override
	public String toString() {
		return "(" + left + ", " + right + ')';
	}
}
