package com.nanosecond.amm.core;

import com.nanosecond.amm.api.BalanceDelta;

/**
 * Outcome of a liquidity change as seen by the caller.
 * <p>
 * {@code callerDelta} is what was booked to the caller: principal plus
 * collected fees, minus whatever a returns-delta hook took on.
 * {@code feesAccrued} is the fee part alone.
 * </p>
 */
public final class ModifyLiquidityResult {

    private final BalanceDelta callerDelta;
    private final BalanceDelta feesAccrued;

    public ModifyLiquidityResult(BalanceDelta callerDelta, BalanceDelta feesAccrued) {
        this.callerDelta = callerDelta;
        this.feesAccrued = feesAccrued;
    }

    public BalanceDelta callerDelta() {
        return callerDelta;
    }

    public BalanceDelta feesAccrued() {
        return feesAccrued;
    }

    @Override
    public String toString() {
        return "ModifyLiquidityResult{callerDelta=" + callerDelta + ", feesAccrued=" + feesAccrued + '}';
    }
}
