package com.nanosecond.amm.core.hooks;

import com.nanosecond.amm.api.BalanceDelta;

/**
 * What an after-add or after-remove liquidity hook returns. The delta is taken
 * on by the hook and removed from the caller's delta when the matching
 * returns-delta flag is set.
 */
public final class HookDeltaResult {

    private final HookAck ack;
    private final BalanceDelta delta;

    public HookDeltaResult(HookAck ack, BalanceDelta delta) {
        this.ack = ack;
        this.delta = delta == null ? BalanceDelta.ZERO : delta;
    }

    public static HookDeltaResult proceed(HookAck ack) {
        return new HookDeltaResult(ack, BalanceDelta.ZERO);
    }

    public HookAck ack() {
        return ack;
    }

    public BalanceDelta delta() {
        return delta;
    }
}
