package com.nanosecond.amm.api;

import java.math.BigInteger;

/**
 * The adjustment a before-swap hook returns, expressed relative to the swap
 * rather than to the pool's currency order: {@code specified} applies to the
 * currency of {@code amountSpecified}, {@code unspecified} to the other one.
 * <p>
 * Packed as a 256-bit word, specified delta in the upper 128 bits.
 * </p>
 */
public final class BeforeSwapDelta {

    public static final BeforeSwapDelta ZERO = new BeforeSwapDelta(BigInteger.ZERO, BigInteger.ZERO);

    private final BigInteger specified;
    private final BigInteger unspecified;

    private BeforeSwapDelta(BigInteger specified, BigInteger unspecified) {
        this.specified = specified;
        this.unspecified = unspecified;
    }

    public static BeforeSwapDelta of(BigInteger specified, BigInteger unspecified) {
        return new BeforeSwapDelta(SafeCast.toInt128(specified), SafeCast.toInt128(unspecified));
    }

    public static BeforeSwapDelta of(long specified, long unspecified) {
        return new BeforeSwapDelta(BigInteger.valueOf(specified), BigInteger.valueOf(unspecified));
    }

    public static BeforeSwapDelta unpack(BigInteger word) {
        SafeCast.toUint256(word);
        return new BeforeSwapDelta(SafeCast.signedLow128(word.shiftRight(128)), SafeCast.signedLow128(word));
    }

    public BigInteger pack() {
        return SafeCast.unsigned128(specified).shiftLeft(128).or(SafeCast.unsigned128(unspecified));
    }

    public BigInteger specifiedDelta() {
        return specified;
    }

    public BigInteger unspecifiedDelta() {
        return unspecified;
    }

    public boolean isZero() {
        return specified.signum() == 0 && unspecified.signum() == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BeforeSwapDelta)) {
            return false;
        }
        BeforeSwapDelta other = (BeforeSwapDelta) o;
        return specified.equals(other.specified) && unspecified.equals(other.unspecified);
    }

    @Override
    public int hashCode() {
        return 31 * specified.hashCode() + unspecified.hashCode();
    }

    @Override
    public String toString() {
        return "BeforeSwapDelta{specified=" + specified + ", unspecified=" + unspecified + '}';
    }
}
