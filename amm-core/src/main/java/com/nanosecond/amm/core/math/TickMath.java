package com.nanosecond.amm.core.math;

import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;
import com.nanosecond.amm.api.SafeCast;

import java.math.BigInteger;

/**
 * <h1>Tick Math: Mapping Ticks to Prices and Back</h1>
 *
 * <p>
 * A tick {@code t} is the price {@code 1.0001^t}. The engine never stores that
 * price directly; it stores {@code sqrt(1.0001^t) * 2^96} (a Q64.96 number),
 * because every swap formula is linear in the square root of the price.
 * </p>
 *
 * <h2>Forward: tick to sqrt-price</h2>
 * <p>
 * {@code sqrt(1.0001^|t|)} is a product of precomputed Q128 factors, one per
 * set bit of {@code |t|} (binary exponentiation with the powers baked in).
 * Positive ticks take the reciprocal. The result is rounded up to Q96 so that
 * the inverse mapping is exact.
 * </p>
 *
 * <h2>Inverse: sqrt-price to tick</h2>
 * <p>
 * The greatest tick whose price is at or below the given price: a binary
 * logarithm (integer part from the most significant bit, 14 fractional bits by
 * repeated squaring), rescaled to base {@code sqrt(1.0001)}, then a one-tick
 * correction against the forward mapping.
 * </p>
 */
public final class TickMath {

    public static final int MIN_TICK = -887272;
    public static final int MAX_TICK = 887272;

    public static final int MIN_TICK_SPACING = 1;
    public static final int MAX_TICK_SPACING = 16383;

    /** getSqrtPriceAtTick(MIN_TICK) */
    public static final BigInteger MIN_SQRT_PRICE = new BigInteger("4295128739");
    /** getSqrtPriceAtTick(MAX_TICK) */
    public static final BigInteger MAX_SQRT_PRICE =
            new BigInteger("1461446703485210103287273052203988822378723970342");

    private static final BigInteger ODD_TICK_START = hex("fffcb933bd6fad37aa2d162d1a594001");
    private static final BigInteger EVEN_TICK_START = BigInteger.ONE.shiftLeft(128);

    // sqrt(1.0001^-(2^i)) in Q128, for i = 1..19
    private static final BigInteger[] RATIOS = {
            hex("fff97272373d413259a46990580e213a"),
            hex("fff2e50f5f656932ef12357cf3c7fdcc"),
            hex("ffe5caca7e10e4e61c3624eaa0941cd0"),
            hex("ffcb9843d60f6159c9db58835c926644"),
            hex("ff973b41fa98c081472e6896dfb254c0"),
            hex("ff2ea16466c96a3843ec78b326b52861"),
            hex("fe5dee046a99a2a811c461f1969c3053"),
            hex("fcbe86c7900a88aedcffc83b479aa3a4"),
            hex("f987a7253ac413176f2b074cf7815e54"),
            hex("f3392b0822b70005940c7a398e4b70f3"),
            hex("e7159475a2c29b7443b29c7fa6e889d9"),
            hex("d097f3bdfd2022b8845ad8f792aa5825"),
            hex("a9f746462d870fdf8a65dc1f90e061e5"),
            hex("70d869a156d2a1b890bb3df62baf32f7"),
            hex("31be135f97d08fd981231505542fcfa6"),
            hex("9aa508b5b7a84e1c677de54f3e99bc9"),
            hex("5d6af8dedb81196699c329225ee604"),
            hex("2216e584f5fa1ea926041bedfe98"),
            hex("48a170391f7dc42444e8fa2")
    };

    private static final BigInteger LOG_SQRT10001_MULTIPLIER = new BigInteger("255738958999603826347141");
    private static final BigInteger TICK_LOW_ERROR = new BigInteger("3402992956809132418596140100660247210");
    private static final BigInteger TICK_HIGH_ERROR = new BigInteger("291339464771989622907027621153398088495");
    private static final BigInteger MASK_32 = BigInteger.ONE.shiftLeft(32).subtract(BigInteger.ONE);

    private TickMath() {
        // Prevent instantiation
    }

    public static int maxUsableTick(int tickSpacing) {
        return (MAX_TICK / tickSpacing) * tickSpacing;
    }

    public static int minUsableTick(int tickSpacing) {
        return (MIN_TICK / tickSpacing) * tickSpacing;
    }

    /**
     * @return sqrt(1.0001^tick) * 2^96, rounded up
     * @throws EngineException {@link ErrorCode#INVALID_TICK} if |tick| > MAX_TICK
     */
    public static BigInteger getSqrtPriceAtTick(int tick) {
        int absTick = Math.abs(tick);
        if (absTick > MAX_TICK) {
            throw new EngineException(ErrorCode.INVALID_TICK, tick);
        }

        BigInteger price = (absTick & 1) != 0 ? ODD_TICK_START : EVEN_TICK_START;
        for (int i = 0; i < RATIOS.length; i++) {
            if ((absTick & (2 << i)) != 0) {
                price = price.multiply(RATIOS[i]).shiftRight(128);
            }
        }

        if (tick > 0) {
            price = SafeCast.MAX_UINT256.divide(price);
        }

        // Q128.128 -> Q128.96, rounding up
        BigInteger sqrtPrice = price.shiftRight(32);
        return price.and(MASK_32).signum() == 0 ? sqrtPrice : sqrtPrice.add(BigInteger.ONE);
    }

    /**
     * @return the greatest tick whose sqrt-price is at or below {@code sqrtPriceX96}
     * @throws EngineException {@link ErrorCode#INVALID_SQRT_PRICE} outside
     *                         [MIN_SQRT_PRICE, MAX_SQRT_PRICE)
     */
    public static int getTickAtSqrtPrice(BigInteger sqrtPriceX96) {
        if (sqrtPriceX96.compareTo(MIN_SQRT_PRICE) < 0 || sqrtPriceX96.compareTo(MAX_SQRT_PRICE) >= 0) {
            throw new EngineException(ErrorCode.INVALID_SQRT_PRICE, sqrtPriceX96);
        }

        BigInteger price = sqrtPriceX96.shiftLeft(32);
        int msb = price.bitLength() - 1;

        // Normalise to a 128-bit mantissa in [2^127, 2^128)
        BigInteger r = msb >= 128 ? price.shiftRight(msb - 127) : price.shiftLeft(127 - msb);

        BigInteger log2 = BigInteger.valueOf(msb - 128).shiftLeft(64);
        for (int shift = 63; shift >= 50; shift--) {
            r = r.multiply(r).shiftRight(127);
            int f = r.shiftRight(128).intValue();
            if (f != 0) {
                log2 = log2.or(BigInteger.ONE.shiftLeft(shift));
                r = r.shiftRight(1);
            }
        }

        BigInteger logSqrt10001 = log2.multiply(LOG_SQRT10001_MULTIPLIER);

        int tickLow = logSqrt10001.subtract(TICK_LOW_ERROR).shiftRight(128).intValue();
        int tickHigh = logSqrt10001.add(TICK_HIGH_ERROR).shiftRight(128).intValue();

        if (tickLow == tickHigh) {
            return tickLow;
        }
        return getSqrtPriceAtTick(tickHigh).compareTo(sqrtPriceX96) <= 0 ? tickHigh : tickLow;
    }

    private static BigInteger hex(String digits) {
        return new BigInteger(digits, 16);
    }
}
