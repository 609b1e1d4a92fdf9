package com.nanosecond.amm.core;

import com.nanosecond.amm.api.Address;
import com.nanosecond.amm.api.BalanceDelta;
import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;
import com.nanosecond.amm.api.SafeCast;
import com.nanosecond.amm.api.Slot0;
import com.nanosecond.amm.core.math.FixedPoint;
import com.nanosecond.amm.core.math.FullMath;
import com.nanosecond.amm.core.math.LiquidityMath;
import com.nanosecond.amm.core.math.SqrtPriceMath;
import com.nanosecond.amm.core.math.SwapMath;
import com.nanosecond.amm.core.math.TickMath;
import org.agrona.collections.Int2ObjectHashMap;
import org.agrona.collections.Object2ObjectHashMap;

import java.math.BigInteger;
import java.util.Map;

/**
 * <h1>The Pool: A Tick-Indexed State Machine</h1>
 *
 * <p>
 * One instance per {@code PoolId}. Where an order book keeps discrete orders at
 * price levels, a concentrated-liquidity pool keeps <b>liquidity over ranges</b>:
 * each position contributes a constant {@code L} between two ticks, and the
 * pool only needs to know how much {@code L} is active at the current price and
 * how it changes at each tick boundary.
 * </p>
 *
 * <h2>State</h2>
 * <ul>
 * <li><b>Top of book</b> ({@link Slot0}): sqrt-price, tick, protocol fee, LP fee.</li>
 * <li><b>Fee growth globals</b>: fees earned per unit of liquidity since
 * inception, Q128.128, one per currency.</li>
 * <li><b>Active liquidity</b>: sum of {@code L} of positions containing the
 * current tick.</li>
 * <li><b>Ticks</b> + {@link TickBitmap}: net liquidity change at each
 * boundary, and which boundaries exist.</li>
 * <li><b>Positions</b>: per owner/range/salt liquidity and fee checkpoints.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <p>
 * {@code Uninitialized -> Initialized}, exactly once. Every other operation on an
 * uninitialized pool fails with {@link ErrorCode#POOL_NOT_INITIALIZED}.
 * </p>
 *
 * <h2>Concurrency Model</h2>
 * <p>
 * <b>NOT Thread-Safe</b>. Pools are mutated only from inside a session, and
 * sessions are exclusive.
 * </p>
 *
 * <h2>Rollback</h2>
 * <p>
 * Sessions mutate the pool in place. {@link #beginUndoLog()} remembers the
 * scalars, and the first write to each tick, position or bitmap word after it
 * records that entry's previous value (or its absence). {@link #undo()} writes
 * those back, so undoing a session costs only what the session touched.
 * </p>
 */
public class Pool {

    private Slot0 slot0 = Slot0.EMPTY;
    private BigInteger feeGrowthGlobal0X128 = BigInteger.ZERO;
    private BigInteger feeGrowthGlobal1X128 = BigInteger.ZERO;
    private BigInteger liquidity = BigInteger.ZERO;

    private final Int2ObjectHashMap<TickInfo> ticks = new Int2ObjectHashMap<>();
    private final TickBitmap tickBitmap = new TickBitmap();
    private final Object2ObjectHashMap<PositionKey, Position> positions = new Object2ObjectHashMap<>();

    // Stand-ins for "did not exist" in the undo log, compared by identity
    private static final TickInfo NO_TICK = new TickInfo();
    private static final Position NO_POSITION = new Position();

    private UndoLog undoLog;

    private static final class UndoLog {
        final Slot0 slot0;
        final BigInteger feeGrowthGlobal0X128;
        final BigInteger feeGrowthGlobal1X128;
        final BigInteger liquidity;
        final Int2ObjectHashMap<TickInfo> ticks = new Int2ObjectHashMap<>();
        final Object2ObjectHashMap<PositionKey, Position> positions = new Object2ObjectHashMap<>();

        UndoLog(Pool pool) {
            this.slot0 = pool.slot0;
            this.feeGrowthGlobal0X128 = pool.feeGrowthGlobal0X128;
            this.feeGrowthGlobal1X128 = pool.feeGrowthGlobal1X128;
            this.liquidity = pool.liquidity;
        }
    }

    // ---------------------------------------------------------------- lifecycle

    /**
     * @return the tick of the starting price
     */
    public int initialize(BigInteger sqrtPriceX96, int lpFee) {
        if (slot0.isInitialized()) {
            throw new EngineException(ErrorCode.POOL_ALREADY_INITIALIZED);
        }
        int tick = TickMath.getTickAtSqrtPrice(sqrtPriceX96);
        // Protocol fee always starts at zero; the controller sets it afterwards
        slot0 = Slot0.of(sqrtPriceX96, tick, 0, lpFee);
        return tick;
    }

    public void checkPoolInitialized() {
        if (!slot0.isInitialized()) {
            throw new EngineException(ErrorCode.POOL_NOT_INITIALIZED);
        }
    }

    public void setProtocolFee(int protocolFee) {
        checkPoolInitialized();
        slot0 = slot0.withProtocolFee(protocolFee);
    }

    public void setLpFee(int lpFee) {
        checkPoolInitialized();
        slot0 = slot0.withLpFee(lpFee);
    }

    // ---------------------------------------------------------------- liquidity

    /**
     * Result of {@link #modifyLiquidity}: principal owed/returned at the current
     * price, and fees collected by the position.
     */
    public static class LiquidityChange {
        public final BalanceDelta principalDelta;
        public final BalanceDelta feesAccrued;

        public LiquidityChange(BalanceDelta principalDelta, BalanceDelta feesAccrued) {
            this.principalDelta = principalDelta;
            this.feesAccrued = feesAccrued;
        }
    }

    /**
     * Applies a liquidity change for {@code owner} over a tick range.
     * <p>
     * <b>Logic Flow:</b>
     * <ol>
     * <li>Update both boundary ticks' gross/net liquidity; flip their bitmap bits
     * when they become used or unused.</li>
     * <li>Compute fee growth inside the range and settle the position's fees.</li>
     * <li>Delete boundary ticks that nothing references any more.</li>
     * <li>Compute the principal at the current price; if the range contains the
     * current tick, the change is also applied to active liquidity.</li>
     * </ol>
     * </p>
     */
    public LiquidityChange modifyLiquidity(Address owner, ModifyLiquidityParams params, int tickSpacing) {
        int tickLower = params.tickLower();
        int tickUpper = params.tickUpper();
        BigInteger liquidityDelta = SafeCast.toInt128(params.liquidityDelta());
        checkTicks(tickLower, tickUpper);

        boolean flippedLower = false;
        boolean flippedUpper = false;

        // 1. Boundary ticks
        if (liquidityDelta.signum() != 0) {
            TickUpdate lower = updateTick(tickLower, liquidityDelta, false);
            TickUpdate upper = updateTick(tickUpper, liquidityDelta, true);
            flippedLower = lower.flipped;
            flippedUpper = upper.flipped;

            if (liquidityDelta.signum() > 0) {
                BigInteger maxLiquidityPerTick = tickSpacingToMaxLiquidityPerTick(tickSpacing);
                if (lower.liquidityGrossAfter.compareTo(maxLiquidityPerTick) > 0) {
                    throw new EngineException(ErrorCode.TICK_LIQUIDITY_OVERFLOW, tickLower);
                }
                if (upper.liquidityGrossAfter.compareTo(maxLiquidityPerTick) > 0) {
                    throw new EngineException(ErrorCode.TICK_LIQUIDITY_OVERFLOW, tickUpper);
                }
            }

            if (flippedLower) {
                tickBitmap.flipTick(tickLower, tickSpacing);
            }
            if (flippedUpper) {
                tickBitmap.flipTick(tickUpper, tickSpacing);
            }
        }

        // 2. Position fees
        BigInteger[] feeGrowthInside = getFeeGrowthInside(tickLower, tickUpper);
        PositionKey key = new PositionKey(owner, tickLower, tickUpper, params.salt());
        logPosition(key);
        Position position = positions.get(key);
        if (position == null) {
            position = new Position();
            positions.put(key, position);
        }
        BalanceDelta feesAccrued = position.update(liquidityDelta, feeGrowthInside[0], feeGrowthInside[1]);
        if (position.liquidity.signum() == 0
                && position.feeGrowthInside0LastX128.signum() == 0
                && position.feeGrowthInside1LastX128.signum() == 0) {
            positions.remove(key);
        }

        // 3. Clear ticks that are no longer referenced
        if (liquidityDelta.signum() < 0) {
            if (flippedLower) {
                ticks.remove(tickLower);
            }
            if (flippedUpper) {
                ticks.remove(tickUpper);
            }
        }

        // 4. Principal at the current price
        BalanceDelta principal = BalanceDelta.ZERO;
        if (liquidityDelta.signum() != 0) {
            int tick = slot0.tick();
            BigInteger sqrtPriceX96 = slot0.sqrtPriceX96();
            BigInteger sqrtLower = TickMath.getSqrtPriceAtTick(tickLower);
            BigInteger sqrtUpper = TickMath.getSqrtPriceAtTick(tickUpper);

            if (tick < tickLower) {
                // Range is above the price: all currency0
                principal = BalanceDelta.of(
                        SqrtPriceMath.getAmount0Delta(sqrtLower, sqrtUpper, liquidityDelta), BigInteger.ZERO);
            } else if (tick < tickUpper) {
                principal = BalanceDelta.of(
                        SqrtPriceMath.getAmount0Delta(sqrtPriceX96, sqrtUpper, liquidityDelta),
                        SqrtPriceMath.getAmount1Delta(sqrtLower, sqrtPriceX96, liquidityDelta));
                liquidity = LiquidityMath.addDelta(liquidity, liquidityDelta);
            } else {
                // Range is below the price: all currency1
                principal = BalanceDelta.of(
                        BigInteger.ZERO, SqrtPriceMath.getAmount1Delta(sqrtLower, sqrtUpper, liquidityDelta));
            }
        }

        return new LiquidityChange(principal, feesAccrued);
    }

    private static class TickUpdate {
        final boolean flipped;
        final BigInteger liquidityGrossAfter;

        TickUpdate(boolean flipped, BigInteger liquidityGrossAfter) {
            this.flipped = flipped;
            this.liquidityGrossAfter = liquidityGrossAfter;
        }
    }

    private TickUpdate updateTick(int tick, BigInteger liquidityDelta, boolean upper) {
        TickInfo info = tickOrCreate(tick);

        BigInteger liquidityGrossBefore = info.liquidityGross;
        BigInteger liquidityGrossAfter = LiquidityMath.addDelta(liquidityGrossBefore, liquidityDelta);
        boolean flipped = (liquidityGrossAfter.signum() == 0) != (liquidityGrossBefore.signum() == 0);

        if (liquidityGrossBefore.signum() == 0 && tick <= slot0.tick()) {
            // By convention all growth before a tick was initialized happened below it
            info.feeGrowthOutside0X128 = feeGrowthGlobal0X128;
            info.feeGrowthOutside1X128 = feeGrowthGlobal1X128;
        }

        // Lower ticks add liquidity when crossed upwards, upper ticks remove it
        BigInteger liquidityNet = upper
                ? info.liquidityNet.subtract(liquidityDelta)
                : info.liquidityNet.add(liquidityDelta);

        info.liquidityGross = liquidityGrossAfter;
        info.liquidityNet = SafeCast.toInt128(liquidityNet);
        return new TickUpdate(flipped, liquidityGrossAfter);
    }

    /**
     * @return {feeGrowthInside0X128, feeGrowthInside1X128}
     */
    public BigInteger[] getFeeGrowthInside(int tickLower, int tickUpper) {
        TickInfo lower = tickOrEmpty(tickLower);
        TickInfo upper = tickOrEmpty(tickUpper);
        int tickCurrent = slot0.tick();

        BigInteger inside0;
        BigInteger inside1;
        if (tickCurrent < tickLower) {
            inside0 = FeeGrowth.sub(lower.feeGrowthOutside0X128, upper.feeGrowthOutside0X128);
            inside1 = FeeGrowth.sub(lower.feeGrowthOutside1X128, upper.feeGrowthOutside1X128);
        } else if (tickCurrent >= tickUpper) {
            inside0 = FeeGrowth.sub(upper.feeGrowthOutside0X128, lower.feeGrowthOutside0X128);
            inside1 = FeeGrowth.sub(upper.feeGrowthOutside1X128, lower.feeGrowthOutside1X128);
        } else {
            inside0 = FeeGrowth.sub(FeeGrowth.sub(feeGrowthGlobal0X128, lower.feeGrowthOutside0X128),
                    upper.feeGrowthOutside0X128);
            inside1 = FeeGrowth.sub(FeeGrowth.sub(feeGrowthGlobal1X128, lower.feeGrowthOutside1X128),
                    upper.feeGrowthOutside1X128);
        }
        return new BigInteger[] {inside0, inside1};
    }

    // ---------------------------------------------------------------- swap

    /**
     * Result of {@link #swap}.
     */
    public static class SwapResult {
        public final BalanceDelta delta;
        public final BigInteger amountToProtocol;
        public final int swapFee;
        public final BigInteger sqrtPriceX96;
        public final int tick;
        public final BigInteger liquidity;

        public SwapResult(BalanceDelta delta, BigInteger amountToProtocol, int swapFee, BigInteger sqrtPriceX96,
                int tick, BigInteger liquidity) {
            this.delta = delta;
            this.amountToProtocol = amountToProtocol;
            this.swapFee = swapFee;
            this.sqrtPriceX96 = sqrtPriceX96;
            this.tick = tick;
            this.liquidity = liquidity;
        }
    }

    /**
     * Walks the price through initialized ticks until the specified amount is
     * used up or the price limit is reached.
     * <p>
     * <b>Logic Flow (one iteration per tick range):</b>
     * <ol>
     * <li><b>Find:</b> next initialized tick in the swap direction (within one
     * bitmap word).</li>
     * <li><b>Step:</b> move the price towards that tick (or the limit, whichever
     * is nearer) with closed-form math; collect amount in/out and fee.</li>
     * <li><b>Accrue:</b> protocol share first, the rest to fee growth per unit of
     * active liquidity.</li>
     * <li><b>Cross:</b> if the tick was reached, flip its outside fee growth and
     * apply its net liquidity.</li>
     * </ol>
     * </p>
     *
     * @param amountSpecified negative exact input, positive exact output
     * @param lpFeeOverride   a fee tagged with {@link LpFees#OVERRIDE_FEE_FLAG}, or 0
     */
    public SwapResult swap(boolean zeroForOne, BigInteger amountSpecified, BigInteger sqrtPriceLimitX96,
            int tickSpacing, int lpFeeOverride) {
        Slot0 slot0Start = slot0;
        int protocolFee = zeroForOne
                ? ProtocolFees.zeroForOneFee(slot0Start.protocolFee())
                : ProtocolFees.oneForZeroFee(slot0Start.protocolFee());

        BigInteger amountSpecifiedRemaining = amountSpecified;
        BigInteger amountCalculated = BigInteger.ZERO;
        BigInteger amountToProtocol = BigInteger.ZERO;

        BigInteger sqrtPriceX96 = slot0Start.sqrtPriceX96();
        int tick = slot0Start.tick();
        BigInteger activeLiquidity = liquidity;

        int lpFee = LpFees.isOverride(lpFeeOverride)
                ? LpFees.removeOverrideFlagAndValidate(lpFeeOverride)
                : slot0Start.lpFee();
        int swapFee = protocolFee == 0 ? lpFee : ProtocolFees.calculateSwapFee(protocolFee, lpFee);

        if (swapFee >= SwapMath.MAX_SWAP_FEE && amountSpecified.signum() > 0) {
            throw new EngineException(ErrorCode.INVALID_FEE_FOR_EXACT_OUT, swapFee);
        }

        if (amountSpecified.signum() == 0) {
            return new SwapResult(BalanceDelta.ZERO, BigInteger.ZERO, swapFee, sqrtPriceX96, tick, activeLiquidity);
        }

        if (zeroForOne) {
            if (sqrtPriceLimitX96.compareTo(slot0Start.sqrtPriceX96()) >= 0) {
                throw new EngineException(ErrorCode.PRICE_LIMIT_ALREADY_EXCEEDED, slot0Start.sqrtPriceX96(),
                        sqrtPriceLimitX96);
            }
            if (sqrtPriceLimitX96.compareTo(TickMath.MIN_SQRT_PRICE) <= 0) {
                throw new EngineException(ErrorCode.PRICE_LIMIT_OUT_OF_BOUNDS, sqrtPriceLimitX96);
            }
        } else {
            if (sqrtPriceLimitX96.compareTo(slot0Start.sqrtPriceX96()) <= 0) {
                throw new EngineException(ErrorCode.PRICE_LIMIT_ALREADY_EXCEEDED, slot0Start.sqrtPriceX96(),
                        sqrtPriceLimitX96);
            }
            if (sqrtPriceLimitX96.compareTo(TickMath.MAX_SQRT_PRICE) >= 0) {
                throw new EngineException(ErrorCode.PRICE_LIMIT_OUT_OF_BOUNDS, sqrtPriceLimitX96);
            }
        }

        boolean exactOutput = amountSpecified.signum() > 0;
        BigInteger feeGrowthGlobalX128 = zeroForOne ? feeGrowthGlobal0X128 : feeGrowthGlobal1X128;

        while (amountSpecifiedRemaining.signum() != 0 && !sqrtPriceX96.equals(sqrtPriceLimitX96)) {
            BigInteger sqrtPriceStartX96 = sqrtPriceX96;

            // 1. Find
            TickBitmap.NextTick next = tickBitmap.nextInitializedTickWithinOneWord(tick, tickSpacing, zeroForOne);
            int tickNext = Math.max(TickMath.MIN_TICK, Math.min(TickMath.MAX_TICK, next.tick));
            BigInteger sqrtPriceNextX96 = TickMath.getSqrtPriceAtTick(tickNext);

            // 2. Step
            SwapMath.Step step = SwapMath.computeSwapStep(
                    sqrtPriceX96,
                    SwapMath.getSqrtPriceTarget(zeroForOne, sqrtPriceNextX96, sqrtPriceLimitX96),
                    activeLiquidity,
                    amountSpecifiedRemaining,
                    swapFee);
            sqrtPriceX96 = step.sqrtPriceNextX96;

            if (exactOutput) {
                amountSpecifiedRemaining = amountSpecifiedRemaining.subtract(step.amountOut);
                amountCalculated = amountCalculated.subtract(step.amountIn.add(step.feeAmount));
            } else {
                amountSpecifiedRemaining = amountSpecifiedRemaining.add(step.amountIn.add(step.feeAmount));
                amountCalculated = amountCalculated.add(step.amountOut);
            }

            // 3. Accrue
            BigInteger lpFeeAmount = step.feeAmount;
            if (protocolFee > 0) {
                BigInteger protocolAmount = swapFee == protocolFee
                        ? step.feeAmount
                        : step.amountIn.add(step.feeAmount).multiply(BigInteger.valueOf(protocolFee))
                                .divide(BigInteger.valueOf(ProtocolFees.PIPS_DENOMINATOR));
                lpFeeAmount = lpFeeAmount.subtract(protocolAmount);
                amountToProtocol = amountToProtocol.add(protocolAmount);
            }

            if (activeLiquidity.signum() > 0) {
                feeGrowthGlobalX128 = FeeGrowth.add(feeGrowthGlobalX128,
                        lpFeeAmount.multiply(FixedPoint.Q128).divide(activeLiquidity));
            }

            // 4. Cross
            if (sqrtPriceX96.equals(sqrtPriceNextX96)) {
                if (next.initialized) {
                    BigInteger global0 = zeroForOne ? feeGrowthGlobalX128 : feeGrowthGlobal0X128;
                    BigInteger global1 = zeroForOne ? feeGrowthGlobal1X128 : feeGrowthGlobalX128;
                    BigInteger liquidityNet = crossTick(tickNext, global0, global1);
                    if (zeroForOne) {
                        liquidityNet = liquidityNet.negate();
                    }
                    activeLiquidity = LiquidityMath.addDelta(activeLiquidity, liquidityNet);
                }
                // Moving down, the price sits at the tick boundary but belongs to the tick below it
                tick = zeroForOne ? tickNext - 1 : tickNext;
            } else if (!sqrtPriceX96.equals(sqrtPriceStartX96)) {
                tick = TickMath.getTickAtSqrtPrice(sqrtPriceX96);
            }
        }

        slot0 = slot0Start.withTick(tick).withSqrtPriceX96(sqrtPriceX96);
        liquidity = activeLiquidity;
        if (zeroForOne) {
            feeGrowthGlobal0X128 = feeGrowthGlobalX128;
        } else {
            feeGrowthGlobal1X128 = feeGrowthGlobalX128;
        }

        BigInteger amountSpecifiedUsed = amountSpecified.subtract(amountSpecifiedRemaining);
        BalanceDelta delta;
        if (zeroForOne != (amountSpecified.signum() < 0)) {
            // Specified amount is in currency1
            delta = BalanceDelta.of(amountCalculated, amountSpecifiedUsed);
        } else {
            delta = BalanceDelta.of(amountSpecifiedUsed, amountCalculated);
        }
        return new SwapResult(delta, amountToProtocol, swapFee, sqrtPriceX96, tick, activeLiquidity);
    }

    private BigInteger crossTick(int tick, BigInteger feeGrowthGlobal0, BigInteger feeGrowthGlobal1) {
        TickInfo info = tickOrCreate(tick);
        info.feeGrowthOutside0X128 = FeeGrowth.sub(feeGrowthGlobal0, info.feeGrowthOutside0X128);
        info.feeGrowthOutside1X128 = FeeGrowth.sub(feeGrowthGlobal1, info.feeGrowthOutside1X128);
        return info.liquidityNet;
    }

    // ---------------------------------------------------------------- donate

    /**
     * Pays {@code amount0}/{@code amount1} straight to in-range liquidity.
     *
     * @return the (negative) amounts the donor owes
     */
    public BalanceDelta donate(BigInteger amount0, BigInteger amount1) {
        if (liquidity.signum() == 0) {
            throw new EngineException(ErrorCode.NO_LIQUIDITY_TO_RECEIVE_FEES);
        }
        BalanceDelta delta = BalanceDelta.of(
                SafeCast.toInt128(SafeCast.toUint256(amount0)).negate(),
                SafeCast.toInt128(SafeCast.toUint256(amount1)).negate());
        if (amount0.signum() > 0) {
            feeGrowthGlobal0X128 = FeeGrowth.add(feeGrowthGlobal0X128,
                    FullMath.mulDiv(amount0, FixedPoint.Q128, liquidity));
        }
        if (amount1.signum() > 0) {
            feeGrowthGlobal1X128 = FeeGrowth.add(feeGrowthGlobal1X128,
                    FullMath.mulDiv(amount1, FixedPoint.Q128, liquidity));
        }
        return delta;
    }

    // ---------------------------------------------------------------- helpers

    public static void checkTicks(int tickLower, int tickUpper) {
        if (tickLower >= tickUpper) {
            throw new EngineException(ErrorCode.TICKS_MISORDERED, tickLower, tickUpper);
        }
        if (tickLower < TickMath.MIN_TICK) {
            throw new EngineException(ErrorCode.TICK_LOWER_OUT_OF_BOUNDS, tickLower);
        }
        if (tickUpper > TickMath.MAX_TICK) {
            throw new EngineException(ErrorCode.TICK_UPPER_OUT_OF_BOUNDS, tickUpper);
        }
    }

    /**
     * Caps per-tick liquidity so that the sum over every usable tick still fits
     * in uint128.
     */
    public static BigInteger tickSpacingToMaxLiquidityPerTick(int tickSpacing) {
        int minTick = TickMath.MIN_TICK / tickSpacing;
        if (TickMath.MIN_TICK % tickSpacing != 0) {
            minTick--;
        }
        int maxTick = TickMath.MAX_TICK / tickSpacing;
        long numTicks = (long) maxTick - minTick + 1;
        return SafeCast.MAX_UINT128.divide(BigInteger.valueOf(numTicks));
    }

    private TickInfo tickOrEmpty(int tick) {
        TickInfo info = ticks.get(tick);
        return info == null ? new TickInfo() : info;
    }

    private TickInfo tickOrCreate(int tick) {
        logTick(tick);
        TickInfo info = ticks.get(tick);
        if (info == null) {
            info = new TickInfo();
            ticks.put(tick, info);
        }
        return info;
    }

    // ---------------------------------------------------------------- views

    public Slot0 slot0() {
        return slot0;
    }

    public BigInteger liquidity() {
        return liquidity;
    }

    public BigInteger feeGrowthGlobal0X128() {
        return feeGrowthGlobal0X128;
    }

    public BigInteger feeGrowthGlobal1X128() {
        return feeGrowthGlobal1X128;
    }

    /**
     * @return a copy of the tick's info, or null if the tick is not initialized
     */
    public TickInfo tickInfo(int tick) {
        TickInfo info = ticks.get(tick);
        return info == null ? null : info.copy();
    }

    public int tickCount() {
        return ticks.size();
    }

    public BigInteger tickBitmapWord(int wordPos) {
        return tickBitmap.getWord(wordPos);
    }

    public boolean isTickInitialized(int tick, int tickSpacing) {
        return tickBitmap.isInitialized(tick, tickSpacing);
    }

    /**
     * @return a copy of the position, or an empty position if it does not exist
     */
    public Position position(PositionKey key) {
        Position position = positions.get(key);
        return position == null ? new Position() : position.copy();
    }

    // ---------------------------------------------------------------- undo log

    public void beginUndoLog() {
        undoLog = new UndoLog(this);
        tickBitmap.beginUndoLog();
    }

    /**
     * Keeps every change made since {@link #beginUndoLog()}.
     */
    public void endUndoLog() {
        undoLog = null;
        tickBitmap.endUndoLog();
    }

    /**
     * Reverts every change made since {@link #beginUndoLog()} and ends the log.
     */
    public void undo() {
        UndoLog log = undoLog;
        if (log == null) {
            return;
        }
        undoLog = null;
        slot0 = log.slot0;
        feeGrowthGlobal0X128 = log.feeGrowthGlobal0X128;
        feeGrowthGlobal1X128 = log.feeGrowthGlobal1X128;
        liquidity = log.liquidity;
        for (Map.Entry<Integer, TickInfo> entry : log.ticks.entrySet()) {
            if (entry.getValue() == NO_TICK) {
                ticks.remove(entry.getKey().intValue());
            } else {
                ticks.put(entry.getKey().intValue(), entry.getValue());
            }
        }
        for (Map.Entry<PositionKey, Position> entry : log.positions.entrySet()) {
            if (entry.getValue() == NO_POSITION) {
                positions.remove(entry.getKey());
            } else {
                positions.put(entry.getKey(), entry.getValue());
            }
        }
        tickBitmap.undo();
    }

    private void logTick(int tick) {
        if (undoLog != null && !undoLog.ticks.containsKey(tick)) {
            TickInfo info = ticks.get(tick);
            undoLog.ticks.put(tick, info == null ? NO_TICK : info.copy());
        }
    }

    private void logPosition(PositionKey key) {
        if (undoLog != null && !undoLog.positions.containsKey(key)) {
            Position position = positions.get(key);
            undoLog.positions.put(key, position == null ? NO_POSITION : position.copy());
        }
    }
}
