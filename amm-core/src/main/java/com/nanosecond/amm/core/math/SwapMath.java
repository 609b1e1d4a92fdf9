package com.nanosecond.amm.core.math;

import java.math.BigInteger;

/**
 * One step of a swap: how far the price moves towards a target within a single
 * range of constant liquidity, and what that costs.
 */
public final class SwapMath {

    /** 100% expressed in hundredths of a basis point. */
    public static final int MAX_SWAP_FEE = 1_000_000;

    private static final BigInteger MAX_SWAP_FEE_BIG = BigInteger.valueOf(MAX_SWAP_FEE);

    private SwapMath() {
        // Prevent instantiation
    }

    /**
     * The result of {@link #computeSwapStep}. Amounts are unsigned.
     */
    public static final class Step {
        public final BigInteger sqrtPriceNextX96;
        public final BigInteger amountIn;
        public final BigInteger amountOut;
        public final BigInteger feeAmount;

        Step(BigInteger sqrtPriceNextX96, BigInteger amountIn, BigInteger amountOut, BigInteger feeAmount) {
            this.sqrtPriceNextX96 = sqrtPriceNextX96;
            this.amountIn = amountIn;
            this.amountOut = amountOut;
            this.feeAmount = feeAmount;
        }

        @Override
        public String toString() {
            return "Step{" +
                    "sqrtPriceNextX96=" + sqrtPriceNextX96 +
                    ", amountIn=" + amountIn +
                    ", amountOut=" + amountOut +
                    ", feeAmount=" + feeAmount +
                    '}';
        }
    }

    /**
     * The price the step should aim for: the next tick's price, clamped by the
     * caller's limit.
     */
    public static BigInteger getSqrtPriceTarget(boolean zeroForOne, BigInteger sqrtPriceNextX96,
            BigInteger sqrtPriceLimitX96) {
        return zeroForOne ? sqrtPriceNextX96.max(sqrtPriceLimitX96) : sqrtPriceNextX96.min(sqrtPriceLimitX96);
    }

    /**
     * @param amountRemaining negative for exact input, positive for exact output
     * @param feePips         total swap fee in pips (LP fee plus protocol share)
     */
    public static Step computeSwapStep(BigInteger sqrtPriceCurrentX96, BigInteger sqrtPriceTargetX96,
            BigInteger liquidity, BigInteger amountRemaining, int feePips) {
        boolean zeroForOne = sqrtPriceCurrentX96.compareTo(sqrtPriceTargetX96) >= 0;
        boolean exactIn = amountRemaining.signum() < 0;
        BigInteger fee = BigInteger.valueOf(feePips);

        BigInteger sqrtPriceNextX96;
        BigInteger amountIn;
        BigInteger amountOut;
        BigInteger feeAmount;

        if (exactIn) {
            BigInteger amountRemainingLessFee =
                    FullMath.mulDiv(amountRemaining.negate(), MAX_SWAP_FEE_BIG.subtract(fee), MAX_SWAP_FEE_BIG);
            amountIn = zeroForOne
                    ? SqrtPriceMath.getAmount0Delta(sqrtPriceTargetX96, sqrtPriceCurrentX96, liquidity, true)
                    : SqrtPriceMath.getAmount1Delta(sqrtPriceCurrentX96, sqrtPriceTargetX96, liquidity, true);
            if (amountRemainingLessFee.compareTo(amountIn) >= 0) {
                // The target is reachable with what is left
                sqrtPriceNextX96 = sqrtPriceTargetX96;
                feeAmount = feePips == MAX_SWAP_FEE
                        ? amountIn
                        : FullMath.mulDivRoundingUp(amountIn, fee, MAX_SWAP_FEE_BIG.subtract(fee));
            } else {
                // Exhausted before the target; whatever input is not swapped is fee
                amountIn = amountRemainingLessFee;
                sqrtPriceNextX96 = SqrtPriceMath.getNextSqrtPriceFromInput(
                        sqrtPriceCurrentX96, liquidity, amountRemainingLessFee, zeroForOne);
                feeAmount = amountRemaining.negate().subtract(amountIn);
            }
            amountOut = zeroForOne
                    ? SqrtPriceMath.getAmount1Delta(sqrtPriceNextX96, sqrtPriceCurrentX96, liquidity, false)
                    : SqrtPriceMath.getAmount0Delta(sqrtPriceCurrentX96, sqrtPriceNextX96, liquidity, false);
        } else {
            amountOut = zeroForOne
                    ? SqrtPriceMath.getAmount1Delta(sqrtPriceTargetX96, sqrtPriceCurrentX96, liquidity, false)
                    : SqrtPriceMath.getAmount0Delta(sqrtPriceCurrentX96, sqrtPriceTargetX96, liquidity, false);
            if (amountRemaining.compareTo(amountOut) >= 0) {
                sqrtPriceNextX96 = sqrtPriceTargetX96;
            } else {
                amountOut = amountRemaining;
                sqrtPriceNextX96 = SqrtPriceMath.getNextSqrtPriceFromOutput(
                        sqrtPriceCurrentX96, liquidity, amountOut, zeroForOne);
            }
            amountIn = zeroForOne
                    ? SqrtPriceMath.getAmount0Delta(sqrtPriceNextX96, sqrtPriceCurrentX96, liquidity, true)
                    : SqrtPriceMath.getAmount1Delta(sqrtPriceCurrentX96, sqrtPriceNextX96, liquidity, true);
            // Exact output with a 100% fee is rejected before the loop starts
            feeAmount = FullMath.mulDivRoundingUp(amountIn, fee, MAX_SWAP_FEE_BIG.subtract(fee));
        }

        return new Step(sqrtPriceNextX96, amountIn, amountOut, feeAmount);
    }
}
