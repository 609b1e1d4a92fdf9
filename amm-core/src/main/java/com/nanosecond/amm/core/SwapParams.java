package com.nanosecond.amm.core;

import java.math.BigInteger;

/**
 * A swap request. {@code amountSpecified} is negative for exact input and
 * positive for exact output; the price may not move past
 * {@code sqrtPriceLimitX96}.
 */
public final class SwapParams {

    private final boolean zeroForOne;
    private final BigInteger amountSpecified;
    private final BigInteger sqrtPriceLimitX96;

    public SwapParams(boolean zeroForOne, BigInteger amountSpecified, BigInteger sqrtPriceLimitX96) {
        this.zeroForOne = zeroForOne;
        this.amountSpecified = amountSpecified;
        this.sqrtPriceLimitX96 = sqrtPriceLimitX96;
    }

    public static SwapParams exactInput(boolean zeroForOne, long amountIn, BigInteger sqrtPriceLimitX96) {
        return new SwapParams(zeroForOne, BigInteger.valueOf(amountIn).negate(), sqrtPriceLimitX96);
    }

    public static SwapParams exactOutput(boolean zeroForOne, long amountOut, BigInteger sqrtPriceLimitX96) {
        return new SwapParams(zeroForOne, BigInteger.valueOf(amountOut), sqrtPriceLimitX96);
    }

    public boolean zeroForOne() {
        return zeroForOne;
    }

    public BigInteger amountSpecified() {
        return amountSpecified;
    }

    public BigInteger sqrtPriceLimitX96() {
        return sqrtPriceLimitX96;
    }

    public boolean isExactInput() {
        return amountSpecified.signum() < 0;
    }

    @Override
    public String toString() {
        return "SwapParams{" +
                "zeroForOne=" + zeroForOne +
                ", amountSpecified=" + amountSpecified +
                ", sqrtPriceLimitX96=" + sqrtPriceLimitX96 +
                '}';
    }
}
