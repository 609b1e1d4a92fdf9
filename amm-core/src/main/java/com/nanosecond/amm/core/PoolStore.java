package com.nanosecond.amm.core;

import com.nanosecond.amm.api.Currency;
import com.nanosecond.amm.api.PoolId;
import com.nanosecond.amm.core.ledger.Transactional;
import org.agrona.collections.Object2ObjectHashMap;
import org.agrona.collections.ObjectHashSet;

import java.math.BigInteger;
import java.util.Map;

/**
 * <b>Engine state, with an undo log for the open transaction.</b>
 * <p>
 * Pools are updated in place. The first time a transaction touches a pool for
 * update, the pool starts its own undo log (see {@link Pool#beginUndoLog()}).
 * {@link #commit()} ends those logs and drops pools that were created but never
 * initialized; {@link #rollback()} replays them and forgets created pools.
 * Protocol fee balances keep their previous value per currency in the same way.
 * </p>
 * <p>
 * Outside a transaction only reads are allowed.
 * </p>
 */
public class PoolStore implements Transactional {

    private final Object2ObjectHashMap<PoolId, Pool> pools = new Object2ObjectHashMap<>();
    // Pools touched by the open transaction, and which of them it created
    private final Object2ObjectHashMap<PoolId, Pool> touched = new Object2ObjectHashMap<>();
    private final ObjectHashSet<PoolId> created = new ObjectHashSet<>();

    private final Object2ObjectHashMap<Currency, BigInteger> protocolFeesAccrued = new Object2ObjectHashMap<>();
    private final Object2ObjectHashMap<Currency, BigInteger> protocolFeesUndo = new Object2ObjectHashMap<>();

    private boolean active;

    /**
     * @return the pool as the open transaction sees it, or null
     */
    public Pool read(PoolId id) {
        return pools.get(id);
    }

    /**
     * @return the pool, logging its changes for the open transaction; created
     *         empty if the id is unknown
     */
    public Pool forUpdate(PoolId id) {
        checkActive();
        Pool pool = touched.get(id);
        if (pool == null) {
            pool = pools.get(id);
            if (pool == null) {
                pool = new Pool();
                pools.put(id, pool);
                created.add(id);
            } else {
                pool.beginUndoLog();
            }
            touched.put(id, pool);
        }
        return pool;
    }

    public BigInteger protocolFeesAccrued(Currency currency) {
        BigInteger amount = protocolFeesAccrued.get(currency);
        return amount == null ? BigInteger.ZERO : amount;
    }

    public void setProtocolFeesAccrued(Currency currency, BigInteger amount) {
        checkActive();
        if (!protocolFeesUndo.containsKey(currency)) {
            protocolFeesUndo.put(currency, protocolFeesAccrued(currency));
        }
        put(currency, amount);
    }

    public boolean isActive() {
        return active;
    }

    @Override
    public void begin() {
        if (active) {
            throw new IllegalStateException("Transaction already active");
        }
        active = true;
    }

    @Override
    public void commit() {
        checkActive();
        for (Map.Entry<PoolId, Pool> entry : touched.entrySet()) {
            Pool pool = entry.getValue();
            pool.endUndoLog();
            if (!pool.slot0().isInitialized()) {
                pools.remove(entry.getKey());
            }
        }
        end();
    }

    @Override
    public void rollback() {
        checkActive();
        for (Pool pool : touched.values()) {
            pool.undo();
        }
        for (PoolId id : created) {
            pools.remove(id);
        }
        for (Map.Entry<Currency, BigInteger> entry : protocolFeesUndo.entrySet()) {
            put(entry.getKey(), entry.getValue());
        }
        end();
    }

    private void put(Currency currency, BigInteger amount) {
        if (amount.signum() == 0) {
            protocolFeesAccrued.remove(currency);
        } else {
            protocolFeesAccrued.put(currency, amount);
        }
    }

    private void end() {
        touched.clear();
        created.clear();
        protocolFeesUndo.clear();
        active = false;
    }

    private void checkActive() {
        if (!active) {
            throw new IllegalStateException("No active transaction");
        }
    }
}
