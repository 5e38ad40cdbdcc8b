package org.bvbounds.analysis.bounds;

import org.bvbounds.rtl.BitVectorType;
import org.bvbounds.util.Logger;
import org.bvbounds.util.Optional;

import java.math.BigInteger;

/**
 * A range of unsigned values of a fixed bit width. If min is not larger than max, the interval is the
 * contiguous range [min, max]. Otherwise it wraps around and is [0, max] U [min, 2^w - 1], i.e. all values
 * except the gap between max and min.
 *
 * Tight intervals represent the constraint they were created from exactly; loose intervals are only known
 * to contain it. Only tight intervals may be negated without losing soundness.
 */
public final class Interval implements BitVectorType {

	private static final Logger logger = Logger.getLogger(Interval.class);

	private final long minBits;
	private final long maxBits;
	private final Bits bits;
	private final boolean tight;

	public Interval(long minBits, long maxBits, Bits bits, boolean tight) {
		assert bits != null;
		assert Bits.ule(minBits, bits.getMask()) && Bits.ule(maxBits, bits.getMask()) : "Interval bounds " + Long.toUnsignedString(minBits) + ", " + Long.toUnsignedString(maxBits) + " exceed " + bits;

		this.bits = bits;
		this.tight = tight;
		if (Bits.ult(maxBits, minBits) && minBits == maxBits + 1L) {
			// an empty gap, i.e. every value
			this.minBits = 0L;
			this.maxBits = bits.getMask();
		} else {
			this.minBits = minBits;
			this.maxBits = maxBits;
		}
	}

	public Interval(long minBits, long maxBits, Bits bits) {
		this(minBits, maxBits, bits, false);
	}

	public static Interval full(Bits bits) {
		return new Interval(0L, bits.getMask(), bits, true);
	}

	public static Interval singleton(long value, Bits bits) {
		return new Interval(value, value, bits, true);
	}

	public long getMin() {
		return minBits;
	}

	public long getMax() {
		return maxBits;
	}

	public Bits getBits() {
		return bits;
	}

	@Override
	public int getBitWidth() {
		return bits.getBits();
	}

	public boolean isTight() {
		return tight;
	}

	public boolean isFull() {
		return minBits == 0L && maxBits == bits.getMask();
	}

	public boolean isWrapped() {
		return Bits.ult(maxBits, minBits);
	}

	public boolean isSingleton() {
		return minBits == maxBits;
	}

	/**
	 * Check if a value is in the interval.
	 *
	 * @param e The value as an unsigned bit pattern of the width of this interval.
	 * @return True if the value is in the interval.
	 */
	public boolean contains(long e) {
		assert (e & bits.getMask()) == e : "bad call to contains with " + e + " (" + bits + ')';
		return bits.leq(minBits, e, maxBits);
	}

	/**
	 * Get the size of the interval.
	 *
	 * @return The number of elements in the interval. It can be larger than a long, so it is returned as a BigInteger.
	 */
	public BigInteger size() {
		long span = (maxBits - minBits) & bits.getMask();
		return new BigInteger(Long.toUnsignedString(span)).add(BigInteger.ONE);
	}

	private Interval loose() {
		return tight ? new Interval(minBits, maxBits, bits, false) : this;
	}

	private void assertCompatible(Interval t) {
		assert bits == t.bits : "Wrong bit-size. Got " + t.bits + ", but expected " + bits;
	}

	/**
	 * Check whether every value of this interval is also in another interval.
	 *
	 * @param t The other interval.
	 * @return True if this interval is a subset of t.
	 */
	public boolean implies(Interval t) {
		assertCompatible(t);
		final boolean result;
		if (t.isFull()) {
			result = true;
		} else if (isFull()) {
			result = false;
		} else if (isWrapped()) {
			// min >= t.min > t.max >= max
			result = t.isWrapped() && Bits.ule(maxBits, t.maxBits) && Bits.ule(t.minBits, minBits);
		} else if (t.isWrapped()) {
			// completely in one of the two pieces of t
			result = Bits.ule(maxBits, t.maxBits) || Bits.ule(t.minBits, minBits);
		} else {
			result = Bits.ule(t.minBits, minBits) && Bits.ule(maxBits, t.maxBits);
		}
		logger.debug(this + " implies " + t + ": " + result);
		return result;
	}

	/**
	 * Intersect two intervals. If the intersection consists of two disjoint ranges, the smaller of the two
	 * operands is returned as a loose over-approximation.
	 *
	 * @param t The other interval.
	 * @return The intersection, or none if it is empty.
	 */
	public Optional<Interval> intersect(Interval t) {
		assertCompatible(t);
		final Interval result;
		if (implies(t)) {
			result = this;
		} else if (t.implies(this)) {
			result = t;
		} else if (isWrapped()) {
			if (!t.isWrapped()) {
				return t.intersect(this);
			}
			if (Bits.ule(t.minBits, maxBits) || Bits.ule(minBits, t.maxBits)) {
				result = smaller(this, t).loose();
			} else {
				// ... max' ... max ... gap ... min ... min' ...
				result = new Interval(Bits.umax(minBits, t.minBits), Bits.umin(maxBits, t.maxBits), bits, tight && t.tight);
			}
		} else if (t.isWrapped()) {
			boolean reachesHigh = Bits.ule(t.minBits, maxBits);
			boolean reachesLow = Bits.ule(minBits, t.maxBits);
			if (!reachesHigh && !reachesLow) {
				// ... t.max ... min ... max ... t.min ...
				result = null;
			} else if (reachesHigh && reachesLow) {
				// ... min ... t.max ... t.min ... max ...
				result = smaller(this, t).loose();
			} else if (reachesHigh) {
				// ... t.max ... min ... t.min ... max ...
				result = new Interval(Bits.umax(minBits, t.minBits), maxBits, bits, tight && t.tight);
			} else {
				// ... min ... t.max ... max ... t.min ...
				result = new Interval(minBits, Bits.umin(maxBits, t.maxBits), bits, tight && t.tight);
			}
		} else if (Bits.ult(t.maxBits, minBits) || Bits.ult(maxBits, t.minBits)) {
			result = null;
		} else {
			result = new Interval(Bits.umax(minBits, t.minBits), Bits.umin(maxBits, t.maxBits), bits, tight && t.tight);
		}
		logger.debug("Intersection of " + this + " and " + t + " = " + (result == null ? "empty" : result));
		return Optional.optional(result);
	}

	private static Interval smaller(Interval s, Interval t) {
		int cmp = Long.compareUnsigned((s.maxBits - s.minBits) & s.bits.getMask(), (t.maxBits - t.minBits) & t.bits.getMask());
		if (cmp == 0) {
			cmp = Long.compareUnsigned(s.minBits, t.minBits);
		}
		return cmp <= 0 ? s : t;
	}

	/**
	 * Complement of the interval. The complement of a loose interval is unknown and over-approximated by
	 * the full (loose) interval.
	 *
	 * @return The complement, or none if it is empty.
	 */
	public Optional<Interval> negate() {
		final Interval result;
		long mask = bits.getMask();
		if (!tight) {
			result = new Interval(0L, mask, bits, false);
		} else if (isFull()) {
			result = null;
		} else if (minBits == 0L) {
			result = new Interval(maxBits + 1L, mask, bits, true);
		} else if (maxBits == mask) {
			result = new Interval(0L, minBits - 1L, bits, true);
		} else {
			result = new Interval(maxBits + 1L, minBits - 1L, bits, true);
		}
		logger.debug("Negating " + this + " to " + (result == null ? "empty" : result));
		return Optional.optional(result);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Interval)) {
			return false;
		}
		Interval t = (Interval) o;
		return minBits == t.minBits && maxBits == t.maxBits && bits == t.bits && tight == t.tight;
	}

	@Override
	public int hashCode() {
		return (Long.hashCode(minBits) * 31 + Long.hashCode(maxBits)) * 31 + bits.getBits() * 2 + (tight ? 1 : 0);
	}

	@Override
	public String toString() {
		return "[" + Long.toUnsignedString(minBits) + ", " + Long.toUnsignedString(maxBits) + "]_" + bits.getBits() + (tight ? "" : "~");
	}
}
