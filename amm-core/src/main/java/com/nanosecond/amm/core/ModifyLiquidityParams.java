package com.nanosecond.amm.core;

import java.math.BigInteger;

/**
 * A liquidity change over {@code [tickLower, tickUpper)}: positive delta adds,
 * negative removes, zero only collects accrued fees.
 */
public final class ModifyLiquidityParams {

    private final int tickLower;
    private final int tickUpper;
    private final BigInteger liquidityDelta;
    private final BigInteger salt;

    public ModifyLiquidityParams(int tickLower, int tickUpper, BigInteger liquidityDelta, BigInteger salt) {
        this.tickLower = tickLower;
        this.tickUpper = tickUpper;
        this.liquidityDelta = liquidityDelta;
        this.salt = salt == null ? BigInteger.ZERO : salt;
    }

    public ModifyLiquidityParams(int tickLower, int tickUpper, long liquidityDelta) {
        this(tickLower, tickUpper, BigInteger.valueOf(liquidityDelta), BigInteger.ZERO);
    }

    public int tickLower() {
        return tickLower;
    }

    public int tickUpper() {
        return tickUpper;
    }

    public BigInteger liquidityDelta() {
        return liquidityDelta;
    }

    public BigInteger salt() {
        return salt;
    }

    public boolean isAdd() {
        return liquidityDelta.signum() > 0;
    }

    @Override
    public String toString() {
        return "ModifyLiquidityParams{" +
                "tickLower=" + tickLower +
                ", tickUpper=" + tickUpper +
                ", liquidityDelta=" + liquidityDelta +
                ", salt=" + salt +
                '}';
    }
}
