package com.nanosecond.amm.core.hooks;

import com.nanosecond.amm.api.BeforeSwapDelta;

/**
 * What a before-swap hook returns: its acknowledgement, the delta it takes on
 * (honoured only with {@link HookFlag#BEFORE_SWAP_RETURNS_DELTA}) and an LP fee
 * override (honoured only on dynamic-fee pools, and only when tagged with
 * {@link com.nanosecond.amm.core.LpFees#OVERRIDE_FEE_FLAG}).
 */
public final class BeforeSwapResult {

    private final HookAck ack;
    private final BeforeSwapDelta delta;
    private final int lpFeeOverride;

    public BeforeSwapResult(HookAck ack, BeforeSwapDelta delta, int lpFeeOverride) {
        this.ack = ack;
        this.delta = delta == null ? BeforeSwapDelta.ZERO : delta;
        this.lpFeeOverride = lpFeeOverride;
    }

    public static BeforeSwapResult proceed() {
        return new BeforeSwapResult(HookAck.BEFORE_SWAP, BeforeSwapDelta.ZERO, 0);
    }

    public HookAck ack() {
        return ack;
    }

    public BeforeSwapDelta delta() {
        return delta;
    }

    public int lpFeeOverride() {
        return lpFeeOverride;
    }
}
