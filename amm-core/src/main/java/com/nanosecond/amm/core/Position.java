package com.nanosecond.amm.core;

import com.nanosecond.amm.api.BalanceDelta;
import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;
import com.nanosecond.amm.core.math.FixedPoint;
import com.nanosecond.amm.core.math.FullMath;
import com.nanosecond.amm.core.math.LiquidityMath;

import java.math.BigInteger;

/**
 * <b>A liquidity position and its fee checkpoint.</b>
 * <p>
 * Fees are never pushed to positions during swaps. Instead a position remembers
 * the fee growth inside its range at its last update; the next update pays out
 * {@code (growthInsideNow - growthInsideLast) * liquidity / 2^128}, computed
 * with the liquidity the position held over that interval.
 * </p>
 */
public class Position {
    public BigInteger liquidity = BigInteger.ZERO;
    public BigInteger feeGrowthInside0LastX128 = BigInteger.ZERO;
    public BigInteger feeGrowthInside1LastX128 = BigInteger.ZERO;

    /**
     * Applies {@code liquidityDelta} and checkpoints fee growth.
     *
     * @return fees owed to the owner since the last update (non-negative)
     * @throws EngineException {@link ErrorCode#CANNOT_UPDATE_EMPTY_POSITION} for a
     *                         zero delta on an empty position,
     *                         {@link ErrorCode#LIQUIDITY_UNDERFLOW} when removing
     *                         more than the position holds
     */
    public BalanceDelta update(BigInteger liquidityDelta, BigInteger feeGrowthInside0X128,
            BigInteger feeGrowthInside1X128) {
        BigInteger liquidityBefore = liquidity;

        if (liquidityDelta.signum() == 0) {
            if (liquidityBefore.signum() == 0) {
                throw new EngineException(ErrorCode.CANNOT_UPDATE_EMPTY_POSITION);
            }
        } else {
            liquidity = LiquidityMath.addDelta(liquidityBefore, liquidityDelta);
        }

        BigInteger feesOwed0 = FullMath.mulDiv(
                FeeGrowth.sub(feeGrowthInside0X128, feeGrowthInside0LastX128), liquidityBefore, FixedPoint.Q128);
        BigInteger feesOwed1 = FullMath.mulDiv(
                FeeGrowth.sub(feeGrowthInside1X128, feeGrowthInside1LastX128), liquidityBefore, FixedPoint.Q128);

        feeGrowthInside0LastX128 = feeGrowthInside0X128;
        feeGrowthInside1LastX128 = feeGrowthInside1X128;

        return BalanceDelta.of(feesOwed0, feesOwed1);
    }

    public Position copy() {
        Position copy = new Position();
        copy.liquidity = liquidity;
        copy.feeGrowthInside0LastX128 = feeGrowthInside0LastX128;
        copy.feeGrowthInside1LastX128 = feeGrowthInside1LastX128;
        return copy;
    }

    @Override
    public String toString() {
        return "Position{" +
                "liquidity=" + liquidity +
                ", feeGrowthInside0LastX128=" + feeGrowthInside0LastX128 +
                ", feeGrowthInside1LastX128=" + feeGrowthInside1LastX128 +
                '}';
    }
}
