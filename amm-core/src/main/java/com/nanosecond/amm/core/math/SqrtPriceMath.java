package com.nanosecond.amm.core.math;

import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;
import com.nanosecond.amm.api.SafeCast;

import java.math.BigInteger;

/**
 * Closed-form concentrated-liquidity math between two sqrt-prices.
 * <p>
 * Within a range of constant liquidity {@code L}:
 * <ul>
 * <li>{@code amount0 = L * (sqrtB - sqrtA) / (sqrtA * sqrtB)}</li>
 * <li>{@code amount1 = L * (sqrtB - sqrtA)}</li>
 * </ul>
 * Rounding always favours the pool: amounts owed to the pool round up, amounts
 * paid out round down, and the next price is rounded so that it never
 * overshoots in the caller's favour.
 * </p>
 */
public final class SqrtPriceMath {

    private SqrtPriceMath() {
        // Prevent instantiation
    }

    /**
     * Next sqrt-price after adding or removing {@code amount} of currency0.
     * Rounds up: the price moves less when adding, more when removing.
     */
    public static BigInteger getNextSqrtPriceFromAmount0RoundingUp(BigInteger sqrtPX96, BigInteger liquidity,
            BigInteger amount, boolean add) {
        if (amount.signum() == 0) {
            return sqrtPX96;
        }
        BigInteger numerator1 = liquidity.shiftLeft(FixedPoint.RESOLUTION_96);
        BigInteger product = amount.multiply(sqrtPX96);

        if (add) {
            if (product.compareTo(SafeCast.MAX_UINT256) <= 0) {
                BigInteger denominator = numerator1.add(product);
                if (denominator.compareTo(SafeCast.MAX_UINT256) <= 0) {
                    return FullMath.mulDivRoundingUp(numerator1, sqrtPX96, denominator);
                }
            }
            // Fallback form avoids the overflowing product: L / (L / sqrtP + amount)
            return FullMath.divRoundingUp(numerator1, numerator1.divide(sqrtPX96).add(amount));
        }

        if (product.compareTo(SafeCast.MAX_UINT256) > 0 || numerator1.compareTo(product) <= 0) {
            throw new EngineException(ErrorCode.PRICE_OVERFLOW, sqrtPX96, liquidity, amount);
        }
        BigInteger denominator = numerator1.subtract(product);
        return SafeCast.toUint160(FullMath.mulDivRoundingUp(numerator1, sqrtPX96, denominator));
    }

    /**
     * Next sqrt-price after adding or removing {@code amount} of currency1.
     * Rounds down in both directions.
     */
    public static BigInteger getNextSqrtPriceFromAmount1RoundingDown(BigInteger sqrtPX96, BigInteger liquidity,
            BigInteger amount, boolean add) {
        boolean fitsUint160 = amount.compareTo(SafeCast.MAX_UINT160) <= 0;
        if (add) {
            BigInteger quotient = fitsUint160
                    ? amount.shiftLeft(FixedPoint.RESOLUTION_96).divide(liquidity)
                    : FullMath.mulDiv(amount, FixedPoint.Q96, liquidity);
            return SafeCast.toUint160(sqrtPX96.add(quotient));
        }

        BigInteger quotient = fitsUint160
                ? FullMath.divRoundingUp(amount.shiftLeft(FixedPoint.RESOLUTION_96), liquidity)
                : FullMath.mulDivRoundingUp(amount, FixedPoint.Q96, liquidity);
        if (sqrtPX96.compareTo(quotient) <= 0) {
            throw new EngineException(ErrorCode.NOT_ENOUGH_LIQUIDITY, sqrtPX96, liquidity, amount);
        }
        return sqrtPX96.subtract(quotient);
    }

    public static BigInteger getNextSqrtPriceFromInput(BigInteger sqrtPX96, BigInteger liquidity,
            BigInteger amountIn, boolean zeroForOne) {
        checkPriceAndLiquidity(sqrtPX96, liquidity);
        return zeroForOne
                ? getNextSqrtPriceFromAmount0RoundingUp(sqrtPX96, liquidity, amountIn, true)
                : getNextSqrtPriceFromAmount1RoundingDown(sqrtPX96, liquidity, amountIn, true);
    }

    public static BigInteger getNextSqrtPriceFromOutput(BigInteger sqrtPX96, BigInteger liquidity,
            BigInteger amountOut, boolean zeroForOne) {
        checkPriceAndLiquidity(sqrtPX96, liquidity);
        return zeroForOne
                ? getNextSqrtPriceFromAmount1RoundingDown(sqrtPX96, liquidity, amountOut, false)
                : getNextSqrtPriceFromAmount0RoundingUp(sqrtPX96, liquidity, amountOut, false);
    }

    /**
     * Unsigned amount of currency0 between two prices for {@code liquidity}.
     */
    public static BigInteger getAmount0Delta(BigInteger sqrtPriceAX96, BigInteger sqrtPriceBX96,
            BigInteger liquidity, boolean roundUp) {
        BigInteger lower = sqrtPriceAX96.min(sqrtPriceBX96);
        BigInteger upper = sqrtPriceAX96.max(sqrtPriceBX96);
        if (lower.signum() <= 0) {
            throw new EngineException(ErrorCode.INVALID_PRICE_OR_LIQUIDITY, lower, liquidity);
        }

        BigInteger numerator1 = liquidity.shiftLeft(FixedPoint.RESOLUTION_96);
        BigInteger numerator2 = upper.subtract(lower);

        return roundUp
                ? FullMath.divRoundingUp(FullMath.mulDivRoundingUp(numerator1, numerator2, upper), lower)
                : FullMath.mulDiv(numerator1, numerator2, upper).divide(lower);
    }

    /**
     * Unsigned amount of currency1 between two prices for {@code liquidity}.
     */
    public static BigInteger getAmount1Delta(BigInteger sqrtPriceAX96, BigInteger sqrtPriceBX96,
            BigInteger liquidity, boolean roundUp) {
        BigInteger difference = sqrtPriceAX96.subtract(sqrtPriceBX96).abs();
        return roundUp
                ? FullMath.mulDivRoundingUp(liquidity, difference, FixedPoint.Q96)
                : FullMath.mulDiv(liquidity, difference, FixedPoint.Q96);
    }

    /**
     * Signed currency0 amount for a signed liquidity change. Adding liquidity
     * (positive) yields a negative amount owed by the provider, rounded up.
     */
    public static BigInteger getAmount0Delta(BigInteger sqrtPriceAX96, BigInteger sqrtPriceBX96,
            BigInteger liquidityDelta) {
        return liquidityDelta.signum() < 0
                ? SafeCast.toInt256(getAmount0Delta(sqrtPriceAX96, sqrtPriceBX96, liquidityDelta.negate(), false))
                : SafeCast.toInt256(getAmount0Delta(sqrtPriceAX96, sqrtPriceBX96, liquidityDelta, true)).negate();
    }

    public static BigInteger getAmount1Delta(BigInteger sqrtPriceAX96, BigInteger sqrtPriceBX96,
            BigInteger liquidityDelta) {
        return liquidityDelta.signum() < 0
                ? SafeCast.toInt256(getAmount1Delta(sqrtPriceAX96, sqrtPriceBX96, liquidityDelta.negate(), false))
                : SafeCast.toInt256(getAmount1Delta(sqrtPriceAX96, sqrtPriceBX96, liquidityDelta, true)).negate();
    }

    private static void checkPriceAndLiquidity(BigInteger sqrtPX96, BigInteger liquidity) {
        if (sqrtPX96.signum() <= 0 || liquidity.signum() <= 0) {
            throw new EngineException(ErrorCode.INVALID_PRICE_OR_LIQUIDITY, sqrtPX96, liquidity);
        }
    }
}
