package com.nanosecond.amm.api;

import java.math.BigInteger;

/**
 * <b>Two signed int128 amounts, one per pool currency.</b>
 * <p>
 * Sign convention: negative means the actor owes the engine, positive means
 * the engine owes the actor. The packed form is a 256-bit word with
 * {@code amount0} in the upper 128 bits and {@code amount1} in the lower 128
 * bits, both two's complement.
 * </p>
 * <p>
 * {@link #add} and {@link #subtract} are component-wise and fail with
 * {@link ErrorCode#SAFE_CAST_OVERFLOW} rather than wrap.
 * </p>
 */
public final class BalanceDelta {

    public static final BalanceDelta ZERO = new BalanceDelta(BigInteger.ZERO, BigInteger.ZERO);

    private final BigInteger amount0;
    private final BigInteger amount1;

    private BalanceDelta(BigInteger amount0, BigInteger amount1) {
        this.amount0 = amount0;
        this.amount1 = amount1;
    }

    public static BalanceDelta of(BigInteger amount0, BigInteger amount1) {
        return new BalanceDelta(SafeCast.toInt128(amount0), SafeCast.toInt128(amount1));
    }

    public static BalanceDelta of(long amount0, long amount1) {
        return new BalanceDelta(BigInteger.valueOf(amount0), BigInteger.valueOf(amount1));
    }

    public static BalanceDelta unpack(BigInteger word) {
        SafeCast.toUint256(word);
        return new BalanceDelta(SafeCast.signedLow128(word.shiftRight(128)), SafeCast.signedLow128(word));
    }

    public BigInteger pack() {
        return SafeCast.unsigned128(amount0).shiftLeft(128).or(SafeCast.unsigned128(amount1));
    }

    public BigInteger amount0() {
        return amount0;
    }

    public BigInteger amount1() {
        return amount1;
    }

    public boolean isZero() {
        return amount0.signum() == 0 && amount1.signum() == 0;
    }

    public BalanceDelta add(BalanceDelta other) {
        return of(amount0.add(other.amount0), amount1.add(other.amount1));
    }

    public BalanceDelta subtract(BalanceDelta other) {
        return of(amount0.subtract(other.amount0), amount1.subtract(other.amount1));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BalanceDelta)) {
            return false;
        }
        BalanceDelta other = (BalanceDelta) o;
        return amount0.equals(other.amount0) && amount1.equals(other.amount1);
    }

    @Override
    public int hashCode() {
        return 31 * amount0.hashCode() + amount1.hashCode();
    }

    @Override
    public String toString() {
        return "BalanceDelta{amount0=" + amount0 + ", amount1=" + amount1 + '}';
    }
}
