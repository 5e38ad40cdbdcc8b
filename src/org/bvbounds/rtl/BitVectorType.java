package org.bvbounds.rtl;

/**
 * Anything that has a fixed bit width.
 */
public interface BitVectorType {

	int getBitWidth();

}
