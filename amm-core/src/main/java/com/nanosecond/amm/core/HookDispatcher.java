package com.nanosecond.amm.core;

import com.nanosecond.amm.api.Address;
import com.nanosecond.amm.api.BalanceDelta;
import com.nanosecond.amm.api.BeforeSwapDelta;
import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;
import com.nanosecond.amm.api.PoolKey;
import com.nanosecond.amm.core.hooks.AfterSwapResult;
import com.nanosecond.amm.core.hooks.BeforeSwapResult;
import com.nanosecond.amm.core.hooks.Hook;
import com.nanosecond.amm.core.hooks.HookAck;
import com.nanosecond.amm.core.hooks.HookDeltaResult;
import com.nanosecond.amm.core.hooks.HookFlag;
import com.nanosecond.amm.core.hooks.HookPermissions;
import com.nanosecond.amm.core.hooks.HookRegistry;

import java.math.BigInteger;

/**
 * Calls a pool's hook at each extension point and folds what it returns into
 * the operation.
 * <p>
 * A callback is skipped when the pool has no hook, when the hook's registered
 * permissions lack the callback's flag, or when the operation was itself called by
 * the hook. Deltas returned without the matching returns-delta flag are
 * ignored.
 * </p>
 */
final class HookDispatcher {

    /**
     * The swap as adjusted by the before-swap hook.
     */
    static final class SwapPreparation {
        final BigInteger amountToSwap;
        final BeforeSwapDelta beforeSwapDelta;
        final int lpFeeOverride;

        SwapPreparation(BigInteger amountToSwap, BeforeSwapDelta beforeSwapDelta, int lpFeeOverride) {
            this.amountToSwap = amountToSwap;
            this.beforeSwapDelta = beforeSwapDelta;
            this.lpFeeOverride = lpFeeOverride;
        }
    }

    private final HookRegistry registry;

    HookDispatcher(HookRegistry registry) {
        this.registry = registry;
    }

    void beforeInitialize(Session caller, PoolKey key, BigInteger sqrtPriceX96) {
        Hook hook = resolve(caller, key, HookFlag.BEFORE_INITIALIZE);
        if (hook != null) {
            checkAck(HookAck.BEFORE_INITIALIZE,
                    hook.beforeInitialize(caller.actingAs(hook.address()), caller.actor(), key, sqrtPriceX96));
        }
    }

    void afterInitialize(Session caller, PoolKey key, BigInteger sqrtPriceX96, int tick) {
        Hook hook = resolve(caller, key, HookFlag.AFTER_INITIALIZE);
        if (hook != null) {
            checkAck(HookAck.AFTER_INITIALIZE,
                    hook.afterInitialize(caller.actingAs(hook.address()), caller.actor(), key, sqrtPriceX96, tick));
        }
    }

    void beforeModifyLiquidity(Session caller, PoolKey key, ModifyLiquidityParams params, byte[] hookData) {
        if (params.isAdd()) {
            Hook hook = resolve(caller, key, HookFlag.BEFORE_ADD_LIQUIDITY);
            if (hook != null) {
                checkAck(HookAck.BEFORE_ADD_LIQUIDITY, hook.beforeAddLiquidity(
                        caller.actingAs(hook.address()), caller.actor(), key, params, hookData));
            }
        } else {
            Hook hook = resolve(caller, key, HookFlag.BEFORE_REMOVE_LIQUIDITY);
            if (hook != null) {
                checkAck(HookAck.BEFORE_REMOVE_LIQUIDITY, hook.beforeRemoveLiquidity(
                        caller.actingAs(hook.address()), caller.actor(), key, params, hookData));
            }
        }
    }

    /**
     * @return the delta the hook takes on, zero unless it holds the matching
     *         returns-delta flag
     */
    BalanceDelta afterModifyLiquidity(Session caller, PoolKey key, ModifyLiquidityParams params,
            BalanceDelta callerDelta, BalanceDelta feesAccrued, byte[] hookData) {
        boolean add = params.isAdd();
        HookFlag flag = add ? HookFlag.AFTER_ADD_LIQUIDITY : HookFlag.AFTER_REMOVE_LIQUIDITY;
        Hook hook = resolve(caller, key, flag);
        if (hook == null) {
            return BalanceDelta.ZERO;
        }

        Session hookSession = caller.actingAs(hook.address());
        HookDeltaResult result = add
                ? hook.afterAddLiquidity(hookSession, caller.actor(), key, params, callerDelta, feesAccrued, hookData)
                : hook.afterRemoveLiquidity(hookSession, caller.actor(), key, params, callerDelta, feesAccrued,
                        hookData);
        checkAck(add ? HookAck.AFTER_ADD_LIQUIDITY : HookAck.AFTER_REMOVE_LIQUIDITY,
                result == null ? null : result.ack());

        HookFlag returnsDelta = add
                ? HookFlag.AFTER_ADD_LIQUIDITY_RETURNS_DELTA
                : HookFlag.AFTER_REMOVE_LIQUIDITY_RETURNS_DELTA;
        return permissions(key).has(returnsDelta) ? result.delta() : BalanceDelta.ZERO;
    }

    /**
     * Runs the before-swap hook.
     * <p>
     * A specified delta returned by the hook is applied to the amount to swap
     * (the hook has already paid or taken that part). The adjustment may shrink
     * the swap to zero but may not flip it from exact input to exact output or
     * back.
     * </p>
     */
    SwapPreparation beforeSwap(Session caller, PoolKey key, SwapParams params, byte[] hookData) {
        BigInteger amountToSwap = params.amountSpecified();
        Hook hook = resolve(caller, key, HookFlag.BEFORE_SWAP);
        if (hook == null) {
            return new SwapPreparation(amountToSwap, BeforeSwapDelta.ZERO, 0);
        }

        BeforeSwapResult result = hook.beforeSwap(caller.actingAs(hook.address()), caller.actor(), key, params,
                hookData);
        checkAck(HookAck.BEFORE_SWAP, result == null ? null : result.ack());

        int lpFeeOverride = LpFees.isDynamicFee(key.fee()) ? result.lpFeeOverride() : 0;

        BeforeSwapDelta delta = BeforeSwapDelta.ZERO;
        if (permissions(key).has(HookFlag.BEFORE_SWAP_RETURNS_DELTA)) {
            delta = result.delta();
            BigInteger specified = delta.specifiedDelta();
            if (specified.signum() != 0) {
                boolean exactInput = amountToSwap.signum() < 0;
                amountToSwap = amountToSwap.add(specified);
                if (exactInput ? amountToSwap.signum() > 0 : amountToSwap.signum() < 0) {
                    throw new EngineException(ErrorCode.HOOK_DELTA_EXCEEDS_SWAP_AMOUNT,
                            params.amountSpecified(), specified);
                }
            }
        }
        return new SwapPreparation(amountToSwap, delta, lpFeeOverride);
    }

    /**
     * Runs the after-swap hook and combines its unspecified delta with the
     * before-swap delta.
     *
     * @return the hook's total delta in pool currency order
     */
    BalanceDelta afterSwap(Session caller, PoolKey key, SwapParams params, BalanceDelta swapDelta,
            SwapPreparation preparation, byte[] hookData) {
        BigInteger hookDeltaSpecified = preparation.beforeSwapDelta.specifiedDelta();
        BigInteger hookDeltaUnspecified = preparation.beforeSwapDelta.unspecifiedDelta();

        Hook hook = resolve(caller, key, HookFlag.AFTER_SWAP);
        if (hook != null) {
            AfterSwapResult result = hook.afterSwap(caller.actingAs(hook.address()), caller.actor(), key, params,
                    swapDelta, hookData);
            checkAck(HookAck.AFTER_SWAP, result == null ? null : result.ack());
            if (permissions(key).has(HookFlag.AFTER_SWAP_RETURNS_DELTA)) {
                hookDeltaUnspecified = hookDeltaUnspecified.add(result.unspecifiedDelta());
            }
        }

        if (hookDeltaSpecified.signum() == 0 && hookDeltaUnspecified.signum() == 0) {
            return BalanceDelta.ZERO;
        }
        // The specified currency is currency0 for exact-input zeroForOne and exact-output oneForZero
        boolean specifiedIsCurrency0 = (params.amountSpecified().signum() < 0) == params.zeroForOne();
        return specifiedIsCurrency0
                ? BalanceDelta.of(hookDeltaSpecified, hookDeltaUnspecified)
                : BalanceDelta.of(hookDeltaUnspecified, hookDeltaSpecified);
    }

    void beforeDonate(Session caller, PoolKey key, BigInteger amount0, BigInteger amount1, byte[] hookData) {
        Hook hook = resolve(caller, key, HookFlag.BEFORE_DONATE);
        if (hook != null) {
            checkAck(HookAck.BEFORE_DONATE, hook.beforeDonate(
                    caller.actingAs(hook.address()), caller.actor(), key, amount0, amount1, hookData));
        }
    }

    void afterDonate(Session caller, PoolKey key, BigInteger amount0, BigInteger amount1, byte[] hookData) {
        Hook hook = resolve(caller, key, HookFlag.AFTER_DONATE);
        if (hook != null) {
            checkAck(HookAck.AFTER_DONATE, hook.afterDonate(
                    caller.actingAs(hook.address()), caller.actor(), key, amount0, amount1, hookData));
        }
    }

    private Hook resolve(Session caller, PoolKey key, HookFlag flag) {
        Address address = key.hooks();
        if (address.isZero() || address.equals(caller.actor()) || !permissions(key).has(flag)) {
            return null;
        }
        return registry.lookup(address).hook();
    }

    /**
     * @return the permissions the pool's hook was registered with
     */
    private HookPermissions permissions(PoolKey key) {
        if (key.hooks().isZero()) {
            return HookPermissions.NONE;
        }
        HookRegistry.Registration registration = registry.lookup(key.hooks());
        if (registration == null) {
            throw new EngineException(ErrorCode.HOOK_ADDRESS_NOT_VALID, key.hooks());
        }
        return registration.permissions();
    }

    private static void checkAck(HookAck expected, HookAck actual) {
        if (expected != actual) {
            throw new EngineException(ErrorCode.INVALID_HOOK_RESPONSE, expected, actual);
        }
    }
}
