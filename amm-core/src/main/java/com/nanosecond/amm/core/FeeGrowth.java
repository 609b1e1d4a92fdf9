package com.nanosecond.amm.core;

import com.nanosecond.amm.api.SafeCast;

import java.math.BigInteger;

/**
 * Fee growth accumulators are uint256 values that are only ever compared by
 * difference, so they add and subtract modulo 2^256.
 */
final class FeeGrowth {

    private FeeGrowth() {
        // Prevent instantiation
    }

    static BigInteger add(BigInteger a, BigInteger b) {
        return a.add(b).mod(SafeCast.TWO_POW_256);
    }

    static BigInteger sub(BigInteger a, BigInteger b) {
        return a.subtract(b).mod(SafeCast.TWO_POW_256);
    }
}
