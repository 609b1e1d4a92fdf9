package com.nanosecond.amm.core;

import java.math.BigInteger;

/**
 * <b>Per-tick liquidity bookkeeping.</b>
 * <p>
 * Exists while at least one position uses the tick as a boundary.
 * {@code liquidityNet} is applied when the price crosses the tick going up
 * (negated going down). The fee-growth-outside values hold the fee growth on
 * the side of the tick away from the current price, as of the last crossing.
 * </p>
 */
public class TickInfo {
    public BigInteger liquidityGross = BigInteger.ZERO;
    public BigInteger liquidityNet = BigInteger.ZERO;
    public BigInteger feeGrowthOutside0X128 = BigInteger.ZERO;
    public BigInteger feeGrowthOutside1X128 = BigInteger.ZERO;

    public TickInfo copy() {
        TickInfo copy = new TickInfo();
        copy.liquidityGross = liquidityGross;
        copy.liquidityNet = liquidityNet;
        copy.feeGrowthOutside0X128 = feeGrowthOutside0X128;
        copy.feeGrowthOutside1X128 = feeGrowthOutside1X128;
        return copy;
    }

    @Override
    public String toString() {
        return "TickInfo{" +
                "liquidityGross=" + liquidityGross +
                ", liquidityNet=" + liquidityNet +
                ", feeGrowthOutside0X128=" + feeGrowthOutside0X128 +
                ", feeGrowthOutside1X128=" + feeGrowthOutside1X128 +
                '}';
    }
}
