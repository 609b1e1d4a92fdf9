package com.nanosecond.amm.core.hooks;

import com.nanosecond.amm.api.Address;
import com.nanosecond.amm.api.BalanceDelta;
import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;
import com.nanosecond.amm.api.PoolKey;
import com.nanosecond.amm.core.ModifyLiquidityParams;
import com.nanosecond.amm.core.Session;
import com.nanosecond.amm.core.SwapParams;

import java.math.BigInteger;

/**
 * <h1>Hooks: Extension Points Around Every Pool Operation</h1>
 *
 * <p>
 * A pool may name one hook in its {@link PoolKey}. The engine calls the hook
 * before and after initialize, add liquidity, remove liquidity, swap and
 * donate, but only for the callbacks whose {@link HookFlag} bit is set in the
 * hook's address. Callbacks may veto (throw), observe, adjust amounts
 * (returns-delta callbacks) or override the LP fee (before-swap on a dynamic
 * fee pool).
 * </p>
 *
 * <h2>Sessions</h2>
 * <p>
 * Each callback receives a {@link Session} acting as the hook. Through it the
 * hook can settle, take or call pool operations itself; operations a hook
 * calls on its own pool do not dispatch back into the same hook. Deltas the
 * hook takes on are booked under {@link #address()} and must be settled before
 * the session closes, like any other actor's.
 * </p>
 *
 * <p>
 * Every callback defaults to failing with
 * {@link ErrorCode#HOOK_NOT_IMPLEMENTED}: a hook only overrides the callbacks
 * it has permissions for.
 * </p>
 */
public interface Hook {

    Address address();

    HookPermissions getHookPermissions();

    default HookAck beforeInitialize(Session session, Address sender, PoolKey key, BigInteger sqrtPriceX96) {
        throw new EngineException(ErrorCode.HOOK_NOT_IMPLEMENTED, HookFlag.BEFORE_INITIALIZE);
    }

    default HookAck afterInitialize(Session session, Address sender, PoolKey key, BigInteger sqrtPriceX96,
            int tick) {
        throw new EngineException(ErrorCode.HOOK_NOT_IMPLEMENTED, HookFlag.AFTER_INITIALIZE);
    }

    default HookAck beforeAddLiquidity(Session session, Address sender, PoolKey key,
            ModifyLiquidityParams params, byte[] hookData) {
        throw new EngineException(ErrorCode.HOOK_NOT_IMPLEMENTED, HookFlag.BEFORE_ADD_LIQUIDITY);
    }

    default HookDeltaResult afterAddLiquidity(Session session, Address sender, PoolKey key,
            ModifyLiquidityParams params, BalanceDelta delta, BalanceDelta feesAccrued, byte[] hookData) {
        throw new EngineException(ErrorCode.HOOK_NOT_IMPLEMENTED, HookFlag.AFTER_ADD_LIQUIDITY);
    }

    default HookAck beforeRemoveLiquidity(Session session, Address sender, PoolKey key,
            ModifyLiquidityParams params, byte[] hookData) {
        throw new EngineException(ErrorCode.HOOK_NOT_IMPLEMENTED, HookFlag.BEFORE_REMOVE_LIQUIDITY);
    }

    default HookDeltaResult afterRemoveLiquidity(Session session, Address sender, PoolKey key,
            ModifyLiquidityParams params, BalanceDelta delta, BalanceDelta feesAccrued, byte[] hookData) {
        throw new EngineException(ErrorCode.HOOK_NOT_IMPLEMENTED, HookFlag.AFTER_REMOVE_LIQUIDITY);
    }

    default BeforeSwapResult beforeSwap(Session session, Address sender, PoolKey key, SwapParams params,
            byte[] hookData) {
        throw new EngineException(ErrorCode.HOOK_NOT_IMPLEMENTED, HookFlag.BEFORE_SWAP);
    }

    default AfterSwapResult afterSwap(Session session, Address sender, PoolKey key, SwapParams params,
            BalanceDelta delta, byte[] hookData) {
        throw new EngineException(ErrorCode.HOOK_NOT_IMPLEMENTED, HookFlag.AFTER_SWAP);
    }

    default HookAck beforeDonate(Session session, Address sender, PoolKey key, BigInteger amount0,
            BigInteger amount1, byte[] hookData) {
        throw new EngineException(ErrorCode.HOOK_NOT_IMPLEMENTED, HookFlag.BEFORE_DONATE);
    }

    default HookAck afterDonate(Session session, Address sender, PoolKey key, BigInteger amount0,
            BigInteger amount1, byte[] hookData) {
        throw new EngineException(ErrorCode.HOOK_NOT_IMPLEMENTED, HookFlag.AFTER_DONATE);
    }
}
