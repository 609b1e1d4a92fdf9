package com.nanosecond.amm.api;

import java.math.BigInteger;

/**
 * Range-checked narrowing of {@link BigInteger} values to the fixed widths the
 * engine stores (uint128, int128, uint160, int256, uint256).
 * <p>
 * Nothing in the engine relies on truncation: a value that does not fit fails
 * with {@link ErrorCode#SAFE_CAST_OVERFLOW}.
 * </p>
 */
public final class SafeCast {

    public static final BigInteger TWO_POW_128 = BigInteger.ONE.shiftLeft(128);
    public static final BigInteger TWO_POW_160 = BigInteger.ONE.shiftLeft(160);
    public static final BigInteger TWO_POW_256 = BigInteger.ONE.shiftLeft(256);

    public static final BigInteger MAX_UINT128 = TWO_POW_128.subtract(BigInteger.ONE);
    public static final BigInteger MAX_UINT160 = TWO_POW_160.subtract(BigInteger.ONE);
    public static final BigInteger MAX_UINT256 = TWO_POW_256.subtract(BigInteger.ONE);

    public static final BigInteger MAX_INT128 = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
    public static final BigInteger MIN_INT128 = BigInteger.ONE.shiftLeft(127).negate();
    public static final BigInteger MAX_INT256 = BigInteger.ONE.shiftLeft(255).subtract(BigInteger.ONE);
    public static final BigInteger MIN_INT256 = BigInteger.ONE.shiftLeft(255).negate();

    private SafeCast() {
        // Prevent instantiation
    }

    public static BigInteger toInt128(BigInteger value) {
        return checkRange(value, MIN_INT128, MAX_INT128);
    }

    public static BigInteger toUint128(BigInteger value) {
        return checkRange(value, BigInteger.ZERO, MAX_UINT128);
    }

    public static BigInteger toUint160(BigInteger value) {
        return checkRange(value, BigInteger.ZERO, MAX_UINT160);
    }

    public static BigInteger toInt256(BigInteger value) {
        return checkRange(value, MIN_INT256, MAX_INT256);
    }

    public static BigInteger toUint256(BigInteger value) {
        return checkRange(value, BigInteger.ZERO, MAX_UINT256);
    }

    public static boolean isInt128(BigInteger value) {
        return value.compareTo(MIN_INT128) >= 0 && value.compareTo(MAX_INT128) <= 0;
    }

    /**
     * Reads the low 128 bits of {@code word} as a two's complement int128.
     */
    public static BigInteger signedLow128(BigInteger word) {
        BigInteger low = word.and(MAX_UINT128);
        return low.testBit(127) ? low.subtract(TWO_POW_128) : low;
    }

    /**
     * Two's complement bit pattern of an int128, as an unsigned 128-bit value.
     */
    public static BigInteger unsigned128(BigInteger int128) {
        return int128.signum() < 0 ? int128.add(TWO_POW_128) : int128;
    }

    private static BigInteger checkRange(BigInteger value, BigInteger min, BigInteger max) {
        if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
            throw new EngineException(ErrorCode.SAFE_CAST_OVERFLOW, value);
        }
        return value;
    }
}
