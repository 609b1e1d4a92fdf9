package com.nanosecond.amm.core.math;

import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;
import com.nanosecond.amm.api.SafeCast;

import java.math.BigInteger;

/**
 * 512-bit intermediate multiply-then-divide over unsigned 256-bit operands.
 * <p>
 * {@link BigInteger} gives the full-precision product for free; what this class
 * adds is the uint256 contract: a zero denominator or a quotient that does not
 * fit in 256 bits fails with {@link ErrorCode#MUL_DIV_OVERFLOW}.
 * </p>
 */
public final class FullMath {

    private FullMath() {
        // Prevent instantiation
    }

    /**
     * floor(a * b / denominator)
     */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger denominator) {
        if (denominator.signum() <= 0) {
            throw new EngineException(ErrorCode.MUL_DIV_OVERFLOW, a, b, denominator);
        }
        BigInteger result = a.multiply(b).divide(denominator);
        if (result.compareTo(SafeCast.MAX_UINT256) > 0) {
            throw new EngineException(ErrorCode.MUL_DIV_OVERFLOW, a, b, denominator);
        }
        return result;
    }

    /**
     * ceil(a * b / denominator)
     */
    public static BigInteger mulDivRoundingUp(BigInteger a, BigInteger b, BigInteger denominator) {
        if (denominator.signum() <= 0) {
            throw new EngineException(ErrorCode.MUL_DIV_OVERFLOW, a, b, denominator);
        }
        BigInteger[] qr = a.multiply(b).divideAndRemainder(denominator);
        BigInteger result = qr[1].signum() > 0 ? qr[0].add(BigInteger.ONE) : qr[0];
        if (result.compareTo(SafeCast.MAX_UINT256) > 0) {
            throw new EngineException(ErrorCode.MUL_DIV_OVERFLOW, a, b, denominator);
        }
        return result;
    }

    /**
     * ceil(x / y) for y > 0.
     */
    public static BigInteger divRoundingUp(BigInteger x, BigInteger y) {
        BigInteger[] qr = x.divideAndRemainder(y);
        return qr[1].signum() > 0 ? qr[0].add(BigInteger.ONE) : qr[0];
    }
}
