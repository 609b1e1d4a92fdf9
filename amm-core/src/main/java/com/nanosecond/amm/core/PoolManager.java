package com.nanosecond.amm.core;

import com.nanosecond.amm.api.Address;
import com.nanosecond.amm.api.BalanceDelta;
import com.nanosecond.amm.api.Currency;
import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;
import com.nanosecond.amm.api.PoolId;
import com.nanosecond.amm.api.PoolKey;
import com.nanosecond.amm.api.SafeCast;
import com.nanosecond.amm.api.Slot0;
import com.nanosecond.amm.core.hooks.HookRegistry;
import com.nanosecond.amm.core.ledger.ClaimTokenService;
import com.nanosecond.amm.core.ledger.Ledger;
import com.nanosecond.amm.core.ledger.TokenCustody;
import com.nanosecond.amm.core.ledger.Transactional;
import com.nanosecond.amm.core.math.TickMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * <h1>The Pool Manager: One Engine, Every Pool</h1>
 *
 * <p>
 * A singleton that holds the state of every pool and is the only entry point
 * that mutates it. Pools never hold tokens of their own: the manager is the
 * single custodian ({@link #address()}), and pools only move numbers.
 * </p>
 *
 * <h2>Design Rationality</h2>
 *
 * <h3>1. Flash Accounting</h3>
 * <p>
 * A multi-hop trade through three pools would, done naively, transfer tokens
 * six times. Here nothing is transferred while operations run. Each operation
 * books signed deltas in a per-session {@link Ledger}; the caller pays in
 * ({@code sync} + {@code settle}) and pays out ({@code take}, {@code mint})
 * only the <b>net</b> amounts, once, at the end.
 * </p>
 *
 * <h3>2. The Unlock Session</h3>
 * <p>
 * All mutating work happens inside {@link #unlock}: the manager opens a ledger,
 * runs the caller's {@link UnlockCallback} with a {@link Session}, and
 * refuses to return unless every delta is back to zero.
 * <br>
 * {@code unlock -> callback(ops...) -> all deltas == 0 -> commit}
 * </p>
 *
 * <h3>3. All or Nothing</h3>
 * <p>
 * Pool state lives in a {@link PoolStore} that logs how to undo each change; token custody and claim
 * balances join the same boundary when they are {@link Transactional}. If
 * anything throws, from the engine, a hook or the callback, every resource
 * is rolled back and no events are published. Events of a committed session are
 * published in order after the commit.
 * </p>
 *
 * <h3>4. Single Writer</h3>
 * <p>
 * Only one session may be open at a time ({@link ErrorCode#ALREADY_UNLOCKED}).
 * <b>NOT Thread-Safe</b>: callers on many threads go through the infra
 * sequencer, which runs every session on one thread.
 * </p>
 */
public class PoolManager {

    private static final Logger log = LoggerFactory.getLogger(PoolManager.class);

    private final Address address;
    private final Address owner;
    private Address protocolFeeController;

    private final TokenCustody custody;
    private final ClaimTokenService claims;
    private final HookRegistry hookRegistry;
    private final HookDispatcher hooks;
    private final PoolEventListener listener;

    private final PoolStore store = new PoolStore();
    private final List<Consumer<PoolEventListener>> pendingEvents = new ArrayList<>();

    // The open session's ledger, null when locked
    private Ledger ledger;

    public PoolManager(Address address, Address owner, TokenCustody custody, ClaimTokenService claims,
            HookRegistry hookRegistry, PoolEventListener listener) {
        this.address = address;
        this.owner = owner;
        this.custody = custody;
        this.claims = claims;
        this.hookRegistry = hookRegistry;
        this.hooks = new HookDispatcher(hookRegistry);
        this.listener = listener == null ? PoolEventListener.NO_OP : listener;
    }

    // ---------------------------------------------------------------- session

    /**
     * Opens a session, runs {@code callback} in it and closes it.
     * <p>
     * <b>Logic Flow:</b>
     * <ol>
     * <li><b>Open:</b> fail if a session is already open; begin a transaction on
     * every resource.</li>
     * <li><b>Run:</b> the callback performs operations through its session.</li>
     * <li><b>Check:</b> no operation failed, even one whose exception the
     * callback caught; then every delta must be zero
     * ({@link ErrorCode#CURRENCY_NOT_SETTLED}).</li>
     * <li><b>Commit:</b> publish state, then events. On any failure roll back
     * and rethrow.</li>
     * </ol>
     * </p>
     *
     * @return whatever the callback returned
     */
    public byte[] unlock(Address caller, UnlockCallback callback, byte[] data) {
        if (ledger != null || store.isActive()) {
            throw new EngineException(ErrorCode.ALREADY_UNLOCKED);
        }
        Ledger opened = Ledger.open();
        ledger = opened;
        begin();
        byte[] result;
        try {
            result = callback.unlockCallback(new Session(this, opened, caller), data);
            if (opened.failure() != null) {
                throw opened.failure();
            }
            if (opened.nonzeroDeltaCount() != 0) {
                throw new EngineException(ErrorCode.CURRENCY_NOT_SETTLED, opened.nonzeroDeltaCount());
            }
            commit();
        } catch (RuntimeException | Error e) {
            rollback(e);
            throw e;
        } finally {
            opened.close();
            ledger = null;
        }
        publishEvents();
        return result;
    }

    public boolean isUnlocked() {
        return ledger != null && ledger.isUnlocked();
    }

    // ---------------------------------------------------------------- pool lifecycle

    /**
     * Initializes a pool outside of any session. Hooks receive a locked session.
     *
     * @return the starting tick
     */
    public int initialize(Address caller, PoolKey key, BigInteger sqrtPriceX96) {
        return initialize(new Session(this, Ledger.locked(), caller), key, sqrtPriceX96);
    }

    int initialize(Session session, PoolKey key, BigInteger sqrtPriceX96) {
        return transact(() -> doInitialize(session, key, sqrtPriceX96));
    }

    private int doInitialize(Session session, PoolKey key, BigInteger sqrtPriceX96) {
        if (key.tickSpacing() > TickMath.MAX_TICK_SPACING) {
            throw new EngineException(ErrorCode.TICK_SPACING_TOO_LARGE, key.tickSpacing());
        }
        if (key.tickSpacing() < TickMath.MIN_TICK_SPACING) {
            throw new EngineException(ErrorCode.TICK_SPACING_TOO_SMALL, key.tickSpacing());
        }
        if (key.currency0().compareTo(key.currency1()) >= 0) {
            throw new EngineException(ErrorCode.CURRENCIES_OUT_OF_ORDER_OR_EQUAL, key.currency0(), key.currency1());
        }
        hookRegistry.validate(key);

        int lpFee = LpFees.getInitialLpFee(key.fee());
        PoolId id = key.toId();

        hooks.beforeInitialize(session, key, sqrtPriceX96);

        int tick = store.forUpdate(id).initialize(sqrtPriceX96, lpFee);

        hooks.afterInitialize(session, key, sqrtPriceX96, tick);

        log.info("Initialized pool {} at tick {} ({})", id, tick, key);
        emit(l -> l.onInitialize(id, key, sqrtPriceX96, tick));
        return tick;
    }

    // ---------------------------------------------------------------- pool operations

    ModifyLiquidityResult modifyLiquidity(Session session, PoolKey key, ModifyLiquidityParams params,
            byte[] hookData) {
        checkUnlocked(session);
        try {
            PoolId id = key.toId();
            Pool pool = store.forUpdate(id);
            pool.checkPoolInitialized();

            hooks.beforeModifyLiquidity(session, key, params, hookData);

            Pool.LiquidityChange change = pool.modifyLiquidity(session.actor(), params, key.tickSpacing());
            BalanceDelta callerDelta = change.principalDelta.add(change.feesAccrued);

            emit(l -> l.onModifyLiquidity(id, session.actor(), params.tickLower(), params.tickUpper(),
                    params.liquidityDelta(), params.salt()));

            BalanceDelta hookDelta = hooks.afterModifyLiquidity(session, key, params, callerDelta, change.feesAccrued,
                    hookData);
            if (!hookDelta.isZero()) {
                callerDelta = callerDelta.subtract(hookDelta);
                accountPoolBalanceDelta(session.ledger(), key, hookDelta, key.hooks());
            }
            accountPoolBalanceDelta(session.ledger(), key, callerDelta, session.actor());

            return new ModifyLiquidityResult(callerDelta, change.feesAccrued);
        } catch (RuntimeException e) {
            throw abort(session, e);
        }
    }

    /**
     * Swaps against a pool.
     * <p>
     * <b>Logic Flow:</b>
     * <ol>
     * <li><b>Before:</b> the hook may take on part of the specified amount and
     * return an LP fee override.</li>
     * <li><b>Swap:</b> the pool walks its ticks; the protocol share of the fee is
     * accrued in the input currency.</li>
     * <li><b>After:</b> the hook may take on part of the unspecified amount.
     * Whatever the hook takes on is booked to the hook and removed from the
     * caller's delta, so the two always sum to the pool's delta.</li>
     * </ol>
     * </p>
     */
    BalanceDelta swap(Session session, PoolKey key, SwapParams params, byte[] hookData) {
        checkUnlocked(session);
        try {
            if (params.amountSpecified().signum() == 0) {
                throw new EngineException(ErrorCode.SWAP_AMOUNT_CANNOT_BE_ZERO);
            }
            PoolId id = key.toId();
            Pool pool = store.forUpdate(id);
            pool.checkPoolInitialized();

            HookDispatcher.SwapPreparation preparation = hooks.beforeSwap(session, key, params, hookData);

            BalanceDelta swapDelta = BalanceDelta.ZERO;
            if (preparation.amountToSwap.signum() != 0) {
                Pool.SwapResult result = pool.swap(params.zeroForOne(), preparation.amountToSwap,
                        params.sqrtPriceLimitX96(), key.tickSpacing(), preparation.lpFeeOverride);
                swapDelta = result.delta;

                if (result.amountToProtocol.signum() > 0) {
                    Currency input = params.zeroForOne() ? key.currency0() : key.currency1();
                    store.setProtocolFeesAccrued(input, store.protocolFeesAccrued(input).add(result.amountToProtocol));
                }

                BalanceDelta poolDelta = swapDelta;
                emit(l -> l.onSwap(id, session.actor(), poolDelta.amount0(), poolDelta.amount1(), result.sqrtPriceX96,
                        result.liquidity, result.tick, result.swapFee));
            }

            BalanceDelta hookDelta = hooks.afterSwap(session, key, params, swapDelta, preparation, hookData);
            if (!hookDelta.isZero()) {
                swapDelta = swapDelta.subtract(hookDelta);
                accountPoolBalanceDelta(session.ledger(), key, hookDelta, key.hooks());
            }
            accountPoolBalanceDelta(session.ledger(), key, swapDelta, session.actor());
            return swapDelta;
        } catch (RuntimeException e) {
            throw abort(session, e);
        }
    }

    BalanceDelta donate(Session session, PoolKey key, BigInteger amount0, BigInteger amount1, byte[] hookData) {
        checkUnlocked(session);
        try {
            PoolId id = key.toId();
            Pool pool = store.forUpdate(id);
            pool.checkPoolInitialized();

            hooks.beforeDonate(session, key, amount0, amount1, hookData);

            BalanceDelta delta = pool.donate(amount0, amount1);
            accountPoolBalanceDelta(session.ledger(), key, delta, session.actor());
            emit(l -> l.onDonate(id, session.actor(), amount0, amount1));

            hooks.afterDonate(session, key, amount0, amount1, hookData);
            return delta;
        } catch (RuntimeException e) {
            throw abort(session, e);
        }
    }

    /**
     * Sets the LP fee of a dynamic-fee pool. Only the pool's hook may do this.
     */
    public void updateDynamicLPFee(Address caller, PoolKey key, int newDynamicLPFee) {
        updateDynamicLPFee(new Session(this, Ledger.locked(), caller), key, newDynamicLPFee);
    }

    void updateDynamicLPFee(Session session, PoolKey key, int newDynamicLPFee) {
        transact(() -> {
            if (!LpFees.isDynamicFee(key.fee()) || !session.actor().equals(key.hooks())) {
                throw new EngineException(ErrorCode.UNAUTHORIZED_DYNAMIC_LP_FEE_UPDATE, session.actor(), key);
            }
            LpFees.validate(newDynamicLPFee);
            store.forUpdate(key.toId()).setLpFee(newDynamicLPFee);
            return null;
        });
    }

    // ---------------------------------------------------------------- ledger operations

    void sync(Session session, Currency currency) {
        checkUnlocked(session);
        try {
            session.ledger().sync(currency, custody.balanceOf(currency, address));
        } catch (RuntimeException e) {
            throw abort(session, e);
        }
    }

    /**
     * Credits {@code recipient} with what the custody balance of the synced
     * currency grew by since {@code sync}. Without a synced currency nothing is
     * paid.
     */
    BigInteger settle(Session session, Address recipient) {
        checkUnlocked(session);
        try {
            Ledger sessionLedger = session.ledger();
            Currency currency = sessionLedger.syncedCurrency();
            if (currency == null) {
                return BigInteger.ZERO;
            }
            BigInteger paid = SafeCast.toUint256(
                    custody.balanceOf(currency, address).subtract(sessionLedger.syncedReserves()));
            sessionLedger.clearSync();
            sessionLedger.accountDelta(recipient, currency, paid);
            return paid;
        } catch (RuntimeException e) {
            throw abort(session, e);
        }
    }

    void take(Session session, Currency currency, Address to, BigInteger amount) {
        checkUnlocked(session);
        try {
            session.ledger().accountDelta(session.actor(), currency, negativeAmount(amount));
            custody.transfer(currency, address, to, amount);
        } catch (RuntimeException e) {
            throw abort(session, e);
        }
    }

    /**
     * Forfeits a positive balance, typically dust not worth transferring.
     */
    void clear(Session session, Currency currency, BigInteger amount) {
        checkUnlocked(session);
        try {
            BigInteger current = session.ledger().currencyDelta(session.actor(), currency);
            if (amount.signum() < 0 || !current.equals(amount)) {
                throw new EngineException(ErrorCode.MUST_CLEAR_EXACT_POSITIVE_DELTA, currency, current, amount);
            }
            session.ledger().accountDelta(session.actor(), currency, amount.negate());
        } catch (RuntimeException e) {
            throw abort(session, e);
        }
    }

    void mint(Session session, Address to, BigInteger id, BigInteger amount) {
        checkUnlocked(session);
        try {
            Currency currency = Currency.fromId(SafeCast.toUint160(id));
            session.ledger().accountDelta(session.actor(), currency, negativeAmount(amount));
            claims.mint(to, id, amount);
        } catch (RuntimeException e) {
            throw abort(session, e);
        }
    }

    void burn(Session session, Address from, BigInteger id, BigInteger amount) {
        checkUnlocked(session);
        try {
            Currency currency = Currency.fromId(SafeCast.toUint160(id));
            session.ledger().accountDelta(session.actor(), currency, negativeAmount(amount).negate());
            claims.burn(session.actor(), from, id, amount);
        } catch (RuntimeException e) {
            throw abort(session, e);
        }
    }

    // ---------------------------------------------------------------- protocol fees

    public void setProtocolFeeController(Address caller, Address controller) {
        if (!caller.equals(owner)) {
            throw new EngineException(ErrorCode.INVALID_CALLER, caller);
        }
        log.info("Protocol fee controller changed from {} to {}", protocolFeeController, controller);
        protocolFeeController = controller;
    }

    public void setProtocolFee(Address caller, PoolKey key, int newProtocolFee) {
        transact(() -> {
            checkProtocolFeeController(caller);
            if (!ProtocolFees.isValid(newProtocolFee)) {
                throw new EngineException(ErrorCode.PROTOCOL_FEE_TOO_LARGE, newProtocolFee);
            }
            PoolId id = key.toId();
            store.forUpdate(id).setProtocolFee(newProtocolFee);
            emit(l -> l.onProtocolFeeUpdated(id, newProtocolFee));
            return null;
        });
    }

    /**
     * Pays accrued protocol fees out of the engine.
     *
     * @param amount how much to collect, 0 for everything accrued
     * @return the amount collected
     */
    public BigInteger collectProtocolFees(Address caller, Address recipient, Currency currency, BigInteger amount) {
        return transact(() -> {
            checkProtocolFeeController(caller);
            if (isUnlocked() && currency.equals(ledger.syncedCurrency())) {
                // Paying out the synced currency would be counted as a negative payment by settle
                throw new EngineException(ErrorCode.PROTOCOL_FEE_CURRENCY_SYNCED, currency);
            }
            BigInteger accrued = store.protocolFeesAccrued(currency);
            BigInteger collected = amount.signum() == 0 ? accrued : amount;
            if (collected.signum() < 0 || collected.compareTo(accrued) > 0) {
                throw new EngineException(ErrorCode.INSUFFICIENT_BALANCE, currency, accrued, collected);
            }
            store.setProtocolFeesAccrued(currency, accrued.subtract(collected));
            custody.transfer(currency, address, recipient, collected);
            log.info("Collected {} protocol fees in {} to {}", collected, currency, recipient);
            return collected;
        });
    }

    // ---------------------------------------------------------------- queries

    public Address address() {
        return address;
    }

    public Address owner() {
        return owner;
    }

    /**
     * @return the protocol fee controller, or null if none was set
     */
    public Address protocolFeeController() {
        return protocolFeeController;
    }

    public HookRegistry hookRegistry() {
        return hookRegistry;
    }

    public boolean isInitialized(PoolId id) {
        Pool pool = store.read(id);
        return pool != null && pool.slot0().isInitialized();
    }

    public Slot0 getSlot0(PoolId id) {
        Pool pool = store.read(id);
        return pool == null ? Slot0.EMPTY : pool.slot0();
    }

    public BigInteger getLiquidity(PoolId id) {
        Pool pool = store.read(id);
        return pool == null ? BigInteger.ZERO : pool.liquidity();
    }

    /**
     * @return {feeGrowthGlobal0X128, feeGrowthGlobal1X128}
     */
    public BigInteger[] getFeeGrowthGlobals(PoolId id) {
        Pool pool = store.read(id);
        if (pool == null) {
            return new BigInteger[] {BigInteger.ZERO, BigInteger.ZERO};
        }
        return new BigInteger[] {pool.feeGrowthGlobal0X128(), pool.feeGrowthGlobal1X128()};
    }

    /**
     * @return {feeGrowthInside0X128, feeGrowthInside1X128}
     */
    public BigInteger[] getFeeGrowthInside(PoolId id, int tickLower, int tickUpper) {
        Pool pool = store.read(id);
        if (pool == null) {
            return new BigInteger[] {BigInteger.ZERO, BigInteger.ZERO};
        }
        return pool.getFeeGrowthInside(tickLower, tickUpper);
    }

    /**
     * @return a copy of the tick's info; all zero if the tick is not initialized
     */
    public TickInfo getTickInfo(PoolId id, int tick) {
        Pool pool = store.read(id);
        TickInfo info = pool == null ? null : pool.tickInfo(tick);
        return info == null ? new TickInfo() : info;
    }

    public BigInteger getTickBitmap(PoolId id, int wordPos) {
        Pool pool = store.read(id);
        return pool == null ? BigInteger.ZERO : pool.tickBitmapWord(wordPos);
    }

    public Position getPosition(PoolId id, Address positionOwner, int tickLower, int tickUpper, BigInteger salt) {
        Pool pool = store.read(id);
        if (pool == null) {
            return new Position();
        }
        return pool.position(new PositionKey(positionOwner, tickLower, tickUpper, salt));
    }

    public BigInteger getPositionLiquidity(PoolId id, Address positionOwner, int tickLower, int tickUpper,
            BigInteger salt) {
        return getPosition(id, positionOwner, tickLower, tickUpper, salt).liquidity;
    }

    public BigInteger protocolFeesAccrued(Currency currency) {
        return store.protocolFeesAccrued(currency);
    }

    // ---------------------------------------------------------------- internals

    private void checkUnlocked(Session session) {
        session.ledger().checkUnlocked();
        if (session.ledger() != ledger) {
            throw new EngineException(ErrorCode.MANAGER_LOCKED);
        }
    }

    /**
     * Marks the session failed so that {@link #unlock} rolls it back even if the
     * callback swallows {@code cause}.
     */
    private RuntimeException abort(Session session, RuntimeException cause) {
        session.ledger().abort(cause);
        return cause;
    }

    private void checkProtocolFeeController(Address caller) {
        if (protocolFeeController == null || !protocolFeeController.equals(caller)) {
            throw new EngineException(ErrorCode.INVALID_CALLER, caller);
        }
    }

    private static void accountPoolBalanceDelta(Ledger target, PoolKey key, BalanceDelta delta, Address actor) {
        target.accountDelta(actor, key.currency0(), delta.amount0());
        target.accountDelta(actor, key.currency1(), delta.amount1());
    }

    private static BigInteger negativeAmount(BigInteger amount) {
        return SafeCast.toInt128(SafeCast.toUint256(amount)).negate();
    }

    /**
     * Runs {@code work} in the open transaction, or in a transaction of its own
     * when none is open.
     */
    private <T> T transact(Supplier<T> work) {
        if (store.isActive()) {
            if (ledger == null) {
                return work.get();
            }
            ledger.checkUnlocked();
            try {
                return work.get();
            } catch (RuntimeException e) {
                ledger.abort(e);
                throw e;
            }
        }
        begin();
        T result;
        try {
            result = work.get();
            commit();
        } catch (RuntimeException | Error e) {
            rollback(e);
            throw e;
        }
        publishEvents();
        return result;
    }

    private void begin() {
        pendingEvents.clear();
        store.begin();
        if (custody instanceof Transactional) {
            ((Transactional) custody).begin();
        }
        if (claims instanceof Transactional) {
            ((Transactional) claims).begin();
        }
    }

    private void commit() {
        store.commit();
        if (custody instanceof Transactional) {
            ((Transactional) custody).commit();
        }
        if (claims instanceof Transactional) {
            ((Transactional) claims).commit();
        }
    }

    private void rollback(Throwable cause) {
        log.debug("Rolling back: {}", cause.toString());
        pendingEvents.clear();
        store.rollback();
        if (custody instanceof Transactional) {
            ((Transactional) custody).rollback();
        }
        if (claims instanceof Transactional) {
            ((Transactional) claims).rollback();
        }
    }

    private void emit(Consumer<PoolEventListener> event) {
        pendingEvents.add(event);
    }

    private void publishEvents() {
        List<Consumer<PoolEventListener>> events = new ArrayList<>(pendingEvents);
        pendingEvents.clear();
        for (Consumer<PoolEventListener> event : events) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                // State is already committed; a failing listener must not undo it
                log.error("Pool event listener failed", e);
            }
        }
    }
}
