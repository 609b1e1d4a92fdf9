package com.nanosecond.amm.core.hooks;

import java.math.BigInteger;

/**
 * What an after-swap hook returns: its acknowledgement and the delta it takes
 * on in the unspecified currency (honoured only with
 * {@link HookFlag#AFTER_SWAP_RETURNS_DELTA}).
 */
public final class AfterSwapResult {

    private final HookAck ack;
    private final BigInteger unspecifiedDelta;

    public AfterSwapResult(HookAck ack, BigInteger unspecifiedDelta) {
        this.ack = ack;
        this.unspecifiedDelta = unspecifiedDelta == null ? BigInteger.ZERO : unspecifiedDelta;
    }

    public static AfterSwapResult proceed() {
        return new AfterSwapResult(HookAck.AFTER_SWAP, BigInteger.ZERO);
    }

    public HookAck ack() {
        return ack;
    }

    public BigInteger unspecifiedDelta() {
        return unspecifiedDelta;
    }
}
