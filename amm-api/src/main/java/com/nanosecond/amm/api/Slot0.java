package com.nanosecond.amm.api;

import java.math.BigInteger;

/**
 * <b>The packed top-of-book of a pool.</b>
 *
 * <h3>Bit Layout (of one 256-bit word):</h3>
 *
 * <pre>
 *   255      232 231    208 207        184 183    160 159            0
 *   +----------+----------+--------------+----------+---------------+
 *   |  unused  |  lpFee   | protocolFee  |   tick   | sqrtPriceX96  |
 *   +----------+----------+--------------+----------+---------------+
 *                (uint24)     (uint24)      (int24)     (uint160)
 * </pre>
 *
 * Immutable: every {@code withX} returns a new value. An all-zero Slot0 means
 * the pool has not been initialized.
 */
public final class Slot0 {

    public static final Slot0 EMPTY = new Slot0(BigInteger.ZERO, 0, 0, 0);

    private static final int TICK_SHIFT = 160;
    private static final int PROTOCOL_FEE_SHIFT = 184;
    private static final int LP_FEE_SHIFT = 208;
    private static final int MASK_24 = 0xFFFFFF;

    private final BigInteger sqrtPriceX96;
    private final int tick;
    private final int protocolFee;
    private final int lpFee;

    private Slot0(BigInteger sqrtPriceX96, int tick, int protocolFee, int lpFee) {
        this.sqrtPriceX96 = sqrtPriceX96;
        this.tick = tick;
        this.protocolFee = protocolFee;
        this.lpFee = lpFee;
    }

    public static Slot0 of(BigInteger sqrtPriceX96, int tick, int protocolFee, int lpFee) {
        return new Slot0(SafeCast.toUint160(sqrtPriceX96), checkInt24(tick), checkUint24(protocolFee),
                checkUint24(lpFee));
    }

    public static Slot0 unpack(BigInteger word) {
        SafeCast.toUint256(word);
        BigInteger sqrtPrice = word.and(SafeCast.MAX_UINT160);
        int rawTick = word.shiftRight(TICK_SHIFT).intValue() & MASK_24;
        // Sign-extend int24
        int tick = (rawTick << 8) >> 8;
        int protocolFee = word.shiftRight(PROTOCOL_FEE_SHIFT).intValue() & MASK_24;
        int lpFee = word.shiftRight(LP_FEE_SHIFT).intValue() & MASK_24;
        return new Slot0(sqrtPrice, tick, protocolFee, lpFee);
    }

    public BigInteger pack() {
        return BigInteger.valueOf(lpFee).shiftLeft(LP_FEE_SHIFT)
                .or(BigInteger.valueOf(protocolFee).shiftLeft(PROTOCOL_FEE_SHIFT))
                .or(BigInteger.valueOf(tick & MASK_24).shiftLeft(TICK_SHIFT))
                .or(sqrtPriceX96);
    }

    public BigInteger sqrtPriceX96() {
        return sqrtPriceX96;
    }

    public int tick() {
        return tick;
    }

    public int protocolFee() {
        return protocolFee;
    }

    public int lpFee() {
        return lpFee;
    }

    public boolean isInitialized() {
        return sqrtPriceX96.signum() != 0;
    }

    public Slot0 withSqrtPriceX96(BigInteger value) {
        return new Slot0(SafeCast.toUint160(value), tick, protocolFee, lpFee);
    }

    public Slot0 withTick(int value) {
        return new Slot0(sqrtPriceX96, checkInt24(value), protocolFee, lpFee);
    }

    public Slot0 withProtocolFee(int value) {
        return new Slot0(sqrtPriceX96, tick, checkUint24(value), lpFee);
    }

    public Slot0 withLpFee(int value) {
        return new Slot0(sqrtPriceX96, tick, protocolFee, checkUint24(value));
    }

    private static int checkInt24(int value) {
        if (value < -(1 << 23) || value >= (1 << 23)) {
            throw new EngineException(ErrorCode.SAFE_CAST_OVERFLOW, value);
        }
        return value;
    }

    private static int checkUint24(int value) {
        if (value < 0 || value > MASK_24) {
            throw new EngineException(ErrorCode.SAFE_CAST_OVERFLOW, value);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Slot0)) {
            return false;
        }
        Slot0 other = (Slot0) o;
        return tick == other.tick
                && protocolFee == other.protocolFee
                && lpFee == other.lpFee
                && sqrtPriceX96.equals(other.sqrtPriceX96);
    }

    @Override
    public int hashCode() {
        int result = sqrtPriceX96.hashCode();
        result = 31 * result + tick;
        result = 31 * result + protocolFee;
        return 31 * result + lpFee;
    }

    @Override
    public String toString() {
        return "Slot0{" +
                "sqrtPriceX96=" + sqrtPriceX96 +
                ", tick=" + tick +
                ", protocolFee=" + protocolFee +
                ", lpFee=" + lpFee +
                '}';
    }
}
