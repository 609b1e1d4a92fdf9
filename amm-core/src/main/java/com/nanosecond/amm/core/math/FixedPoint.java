package com.nanosecond.amm.core.math;

import java.math.BigInteger;

/**
 * Q-format scaling constants: prices are Q64.96, fee growth is Q128.128.
 */
public final class FixedPoint {

    public static final int RESOLUTION_96 = 96;
    public static final BigInteger Q96 = BigInteger.ONE.shiftLeft(RESOLUTION_96);

    public static final int RESOLUTION_128 = 128;
    public static final BigInteger Q128 = BigInteger.ONE.shiftLeft(RESOLUTION_128);

    private FixedPoint() {
        // Prevent instantiation
    }
}
