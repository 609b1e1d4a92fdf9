package com.nanosecond.amm.core.ledger;

import com.nanosecond.amm.api.Address;
import com.nanosecond.amm.api.Currency;
import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;
import org.agrona.collections.Object2ObjectHashMap;

import java.math.BigInteger;
import java.util.Map;

/**
 * Token balances held in memory, one map per currency.
 * <p>
 * Joins the engine's sessions as a {@link Transactional}. While a transaction
 * is open, the first write to a balance records its previous value in an undo
 * log; {@link #rollback()} writes those values back, so a failed session also
 * undoes its transfers. The cost of a session is proportional to the balances
 * it touches.
 * </p>
 */
public class InMemoryTokenCustody implements TokenCustody, Transactional {

    private final Object2ObjectHashMap<Currency, Object2ObjectHashMap<Address, BigInteger>> balances =
            new Object2ObjectHashMap<>();
    // Previous balance of every holder written since begin(); null when no transaction is open
    private Object2ObjectHashMap<Currency, Object2ObjectHashMap<Address, BigInteger>> undo;

    /**
     * Creates {@code amount} of {@code currency} out of thin air for
     * {@code holder}. Used to fund accounts.
     */
    public void deposit(Currency currency, Address holder, BigInteger amount) {
        checkAmount(amount);
        setBalance(currency, holder, balanceOf(currency, holder).add(amount));
    }

    @Override
    public BigInteger balanceOf(Currency currency, Address holder) {
        Object2ObjectHashMap<Address, BigInteger> holders = balances.get(currency);
        if (holders == null) {
            return BigInteger.ZERO;
        }
        BigInteger balance = holders.get(holder);
        return balance == null ? BigInteger.ZERO : balance;
    }

    @Override
    public void transfer(Currency currency, Address from, Address to, BigInteger amount) {
        checkAmount(amount);
        BigInteger fromBalance = balanceOf(currency, from);
        if (fromBalance.compareTo(amount) < 0) {
            throw new EngineException(ErrorCode.INSUFFICIENT_BALANCE, currency, from, fromBalance, amount);
        }
        setBalance(currency, from, fromBalance.subtract(amount));
        setBalance(currency, to, balanceOf(currency, to).add(amount));
    }

    @Override
    public void begin() {
        undo = new Object2ObjectHashMap<>();
    }

    @Override
    public void commit() {
        undo = null;
    }

    @Override
    public void rollback() {
        if (undo == null) {
            return;
        }
        for (Map.Entry<Currency, Object2ObjectHashMap<Address, BigInteger>> currency : undo.entrySet()) {
            Object2ObjectHashMap<Address, BigInteger> holders = holdings(currency.getKey());
            for (Map.Entry<Address, BigInteger> previous : currency.getValue().entrySet()) {
                holders.put(previous.getKey(), previous.getValue());
            }
        }
        undo = null;
    }

    private void setBalance(Currency currency, Address holder, BigInteger balance) {
        if (undo != null) {
            Object2ObjectHashMap<Address, BigInteger> previous = undo.get(currency);
            if (previous == null) {
                previous = new Object2ObjectHashMap<>();
                undo.put(currency, previous);
            }
            if (!previous.containsKey(holder)) {
                previous.put(holder, balanceOf(currency, holder));
            }
        }
        holdings(currency).put(holder, balance);
    }

    private Object2ObjectHashMap<Address, BigInteger> holdings(Currency currency) {
        Object2ObjectHashMap<Address, BigInteger> holders = balances.get(currency);
        if (holders == null) {
            holders = new Object2ObjectHashMap<>();
            balances.put(currency, holders);
        }
        return holders;
    }

    private static void checkAmount(BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Negative amount: " + amount);
        }
    }
}
