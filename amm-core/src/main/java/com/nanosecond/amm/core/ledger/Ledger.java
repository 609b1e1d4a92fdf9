package com.nanosecond.amm.core.ledger;

import com.nanosecond.amm.api.Address;
import com.nanosecond.amm.api.Currency;
import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;
import com.nanosecond.amm.api.SafeCast;
import org.agrona.collections.Object2ObjectHashMap;

import java.math.BigInteger;
import java.util.Objects;

/**
 * <h1>The Ledger: Flash Accounting for One Session</h1>
 *
 * <p>
 * Nothing moves during a session. Every operation only records who owes what:
 * a signed int256 per {@code (actor, currency)}. Negative means the actor owes
 * the engine, positive means the engine owes the actor. Tokens are moved at the
 * edges ({@code settle}, {@code take}, {@code mint}, {@code burn}) and those
 * edges feed back into the same deltas.
 * </p>
 *
 * <h2>The Non-Zero Counter</h2>
 * <p>
 * Checking "every delta is zero" at the end of a session would mean scanning
 * the map. Instead the ledger counts entries that are non-zero, updating the
 * count only on the 0 to non-zero and non-zero to 0 transitions. The session
 * may close only when the count is back to zero.
 * </p>
 *
 * <h2>Sync Checkpoint</h2>
 * <p>
 * At most one currency is "synced" at a time: its custody balance is
 * remembered so that the next {@code settle} can measure what was paid in.
 * </p>
 *
 * <h2>Abort</h2>
 * <p>
 * An operation that fails part-way may already have booked deltas or moved
 * pool state. The first failure is recorded with {@link #abort}; from then on
 * the session only accepts being rolled back, even if the callback caught the
 * exception.
 * </p>
 *
 * <p>
 * <b>NOT Thread-Safe.</b> One ledger per session, used by the session's thread.
 * </p>
 */
public class Ledger {

    private static final class DeltaKey {
        private final Address actor;
        private final Currency currency;

        DeltaKey(Address actor, Currency currency) {
            this.actor = actor;
            this.currency = currency;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof DeltaKey)) {
                return false;
            }
            DeltaKey other = (DeltaKey) o;
            return actor.equals(other.actor) && currency.equals(other.currency);
        }

        @Override
        public int hashCode() {
            return Objects.hash(actor, currency);
        }
    }

    private final Object2ObjectHashMap<DeltaKey, BigInteger> deltas = new Object2ObjectHashMap<>();
    private int nonzeroDeltaCount;

    private Currency syncedCurrency;
    private BigInteger syncedReserves = BigInteger.ZERO;

    private boolean unlocked;
    private RuntimeException failure;

    private Ledger(boolean unlocked) {
        this.unlocked = unlocked;
    }

    /**
     * A ledger for a new session.
     */
    public static Ledger open() {
        return new Ledger(true);
    }

    /**
     * A ledger that rejects every operation. Handed to hooks that run outside
     * a session (standalone {@code initialize}).
     */
    public static Ledger locked() {
        return new Ledger(false);
    }

    public boolean isUnlocked() {
        return unlocked;
    }

    /**
     * @throws EngineException {@link ErrorCode#MANAGER_LOCKED} if the session is
     *                         not (or no longer) open, or
     *                         {@link ErrorCode#SESSION_ABORTED} if an earlier
     *                         operation of the session failed
     */
    public void checkUnlocked() {
        if (!unlocked) {
            throw new EngineException(ErrorCode.MANAGER_LOCKED);
        }
        if (failure != null) {
            throw new EngineException(ErrorCode.SESSION_ABORTED, failure.getMessage());
        }
    }

    /**
     * Marks the session as failed. Only the first cause is kept.
     */
    public void abort(RuntimeException cause) {
        if (failure == null) {
            failure = cause;
        }
    }

    /**
     * @return the failure that aborted this session, or null
     */
    public RuntimeException failure() {
        return failure;
    }

    public void close() {
        unlocked = false;
    }

    /**
     * Adds {@code delta} to {@code actor}'s balance in {@code currency}.
     *
     * @return the new balance
     * @throws EngineException {@link ErrorCode#SAFE_CAST_OVERFLOW} if the balance
     *                         leaves the int256 range
     */
    public BigInteger accountDelta(Address actor, Currency currency, BigInteger delta) {
        DeltaKey key = new DeltaKey(actor, currency);
        BigInteger previous = deltas.get(key);
        if (previous == null) {
            previous = BigInteger.ZERO;
        }
        if (delta.signum() == 0) {
            return previous;
        }

        BigInteger next = SafeCast.toInt256(previous.add(delta));
        if (next.signum() == 0) {
            nonzeroDeltaCount--;
            deltas.remove(key);
        } else {
            if (previous.signum() == 0) {
                nonzeroDeltaCount++;
            }
            deltas.put(key, next);
        }
        return next;
    }

    public BigInteger currencyDelta(Address actor, Currency currency) {
        BigInteger delta = deltas.get(new DeltaKey(actor, currency));
        return delta == null ? BigInteger.ZERO : delta;
    }

    public int nonzeroDeltaCount() {
        return nonzeroDeltaCount;
    }

    public void sync(Currency currency, BigInteger reserves) {
        syncedCurrency = currency;
        syncedReserves = reserves;
    }

    public void clearSync() {
        syncedCurrency = null;
        syncedReserves = BigInteger.ZERO;
    }

    /**
     * @return the synced currency, or null when nothing is synced
     */
    public Currency syncedCurrency() {
        return syncedCurrency;
    }

    public BigInteger syncedReserves() {
        return syncedReserves;
    }
}
