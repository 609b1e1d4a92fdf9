package com.nanosecond.amm.core.math;

import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;
import com.nanosecond.amm.api.SafeCast;

import java.math.BigInteger;

public final class LiquidityMath {

    private LiquidityMath() {
        // Prevent instantiation
    }

    /**
     * Adds a signed liquidity delta to an unsigned uint128 liquidity.
     *
     * @throws EngineException {@link ErrorCode#LIQUIDITY_UNDERFLOW} below zero,
     *                         {@link ErrorCode#SAFE_CAST_OVERFLOW} above uint128
     */
    public static BigInteger addDelta(BigInteger liquidity, BigInteger delta) {
        BigInteger result = liquidity.add(delta);
        if (result.signum() < 0) {
            throw new EngineException(ErrorCode.LIQUIDITY_UNDERFLOW, liquidity, delta);
        }
        return SafeCast.toUint128(result);
    }
}
