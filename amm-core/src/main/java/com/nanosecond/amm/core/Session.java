package com.nanosecond.amm.core;

import com.nanosecond.amm.api.Address;
import com.nanosecond.amm.api.BalanceDelta;
import com.nanosecond.amm.api.Currency;
import com.nanosecond.amm.api.PoolKey;
import com.nanosecond.amm.core.ledger.Ledger;

import java.math.BigInteger;

/**
 * <b>The handle to an open unlock.</b>
 * <p>
 * A session binds an actor to the ledger of one {@link PoolManager#unlock}.
 * Every delta an operation produces is booked to {@link #actor()}. The caller's
 * callback gets a session acting as the caller; each hook callback gets one
 * acting as the hook.
 * </p>
 * <p>
 * Once the unlock that created it has returned, every operation on a session
 * fails with {@link com.nanosecond.amm.api.ErrorCode#MANAGER_LOCKED}.
 * </p>
 */
public final class Session {

    private final PoolManager manager;
    private final Ledger ledger;
    private final Address actor;

    Session(PoolManager manager, Ledger ledger, Address actor) {
        this.manager = manager;
        this.ledger = ledger;
        this.actor = actor;
    }

    Session actingAs(Address other) {
        return other.equals(actor) ? this : new Session(manager, ledger, other);
    }

    Ledger ledger() {
        return ledger;
    }

    public Address actor() {
        return actor;
    }

    public PoolManager manager() {
        return manager;
    }

    public boolean isUnlocked() {
        return ledger.isUnlocked();
    }

    // ---------------------------------------------------------------- pool operations

    public int initialize(PoolKey key, BigInteger sqrtPriceX96) {
        return manager.initialize(this, key, sqrtPriceX96);
    }

    public ModifyLiquidityResult modifyLiquidity(PoolKey key, ModifyLiquidityParams params, byte[] hookData) {
        return manager.modifyLiquidity(this, key, params, hookData);
    }

    public BalanceDelta swap(PoolKey key, SwapParams params, byte[] hookData) {
        return manager.swap(this, key, params, hookData);
    }

    public BalanceDelta donate(PoolKey key, BigInteger amount0, BigInteger amount1, byte[] hookData) {
        return manager.donate(this, key, amount0, amount1, hookData);
    }

    public void updateDynamicLPFee(PoolKey key, int newDynamicLPFee) {
        manager.updateDynamicLPFee(this, key, newDynamicLPFee);
    }

    // ---------------------------------------------------------------- ledger operations

    public void sync(Currency currency) {
        manager.sync(this, currency);
    }

    public BigInteger settle() {
        return manager.settle(this, actor);
    }

    public BigInteger settleFor(Address recipient) {
        return manager.settle(this, recipient);
    }

    public void take(Currency currency, Address to, BigInteger amount) {
        manager.take(this, currency, to, amount);
    }

    public void clear(Currency currency, BigInteger amount) {
        manager.clear(this, currency, amount);
    }

    public void mint(Address to, BigInteger id, BigInteger amount) {
        manager.mint(this, to, id, amount);
    }

    public void burn(Address from, BigInteger id, BigInteger amount) {
        manager.burn(this, from, id, amount);
    }

    // ---------------------------------------------------------------- ledger views

    public BigInteger currencyDelta(Currency currency) {
        return ledger.currencyDelta(actor, currency);
    }

    public BigInteger currencyDelta(Address target, Currency currency) {
        return ledger.currencyDelta(target, currency);
    }

    public int nonzeroDeltaCount() {
        return ledger.nonzeroDeltaCount();
    }

    public Currency syncedCurrency() {
        return ledger.syncedCurrency();
    }

    public BigInteger syncedReserves() {
        return ledger.syncedReserves();
    }

    @Override
    public String toString() {
        return "Session{actor=" + actor + ", unlocked=" + ledger.isUnlocked() + '}';
    }
}
