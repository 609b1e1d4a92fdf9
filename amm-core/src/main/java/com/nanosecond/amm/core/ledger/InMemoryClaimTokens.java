package com.nanosecond.amm.core.ledger;

import com.nanosecond.amm.api.Address;
import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;
import com.nanosecond.amm.api.SafeCast;
import org.agrona.collections.Object2ObjectHashMap;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory claim balances, allowances and operator approvals.
 * <p>
 * An allowance of {@link SafeCast#MAX_UINT256} is unlimited and is never
 * decremented. Inside a transaction the first write to each balance, allowance
 * or operator flag records the previous value; {@link #rollback()} writes them
 * back.
 * </p>
 */
public class InMemoryClaimTokens implements ClaimTokenService, Transactional {

    private static final class Slot {
        private final Address owner;
        private final Address other;
        private final BigInteger id;

        Slot(Address owner, Address other, BigInteger id) {
            this.owner = owner;
            this.other = other;
            this.id = id;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Slot)) {
                return false;
            }
            Slot slot = (Slot) o;
            return owner.equals(slot.owner) && Objects.equals(other, slot.other) && Objects.equals(id, slot.id);
        }

        @Override
        public int hashCode() {
            return Objects.hash(owner, other, id);
        }
    }

    private final State state = new State();
    // Previous values of the slots written since begin(); null when no transaction is open
    private State undo;

    private static final class State {
        final Object2ObjectHashMap<Slot, BigInteger> balances = new Object2ObjectHashMap<>();
        final Object2ObjectHashMap<Slot, BigInteger> allowances = new Object2ObjectHashMap<>();
        final Object2ObjectHashMap<Slot, Boolean> operators = new Object2ObjectHashMap<>();
    }

    @Override
    public BigInteger balanceOf(Address owner, BigInteger id) {
        BigInteger balance = state.balances.get(new Slot(owner, null, id));
        return balance == null ? BigInteger.ZERO : balance;
    }

    @Override
    public BigInteger allowance(Address owner, Address spender, BigInteger id) {
        BigInteger allowance = state.allowances.get(new Slot(owner, spender, id));
        return allowance == null ? BigInteger.ZERO : allowance;
    }

    @Override
    public boolean isOperator(Address owner, Address operator) {
        return Boolean.TRUE.equals(state.operators.get(new Slot(owner, operator, null)));
    }

    @Override
    public void mint(Address to, BigInteger id, BigInteger amount) {
        checkAmount(amount);
        setBalance(to, id, SafeCast.toUint256(balanceOf(to, id).add(amount)));
    }

    @Override
    public void burn(Address spender, Address from, BigInteger id, BigInteger amount) {
        checkAmount(amount);
        spendAllowance(spender, from, id, amount);
        debit(from, id, amount);
    }

    @Override
    public void transfer(Address sender, Address to, BigInteger id, BigInteger amount) {
        checkAmount(amount);
        debit(sender, id, amount);
        setBalance(to, id, balanceOf(to, id).add(amount));
    }

    @Override
    public void transferFrom(Address spender, Address from, Address to, BigInteger id, BigInteger amount) {
        checkAmount(amount);
        spendAllowance(spender, from, id, amount);
        debit(from, id, amount);
        setBalance(to, id, balanceOf(to, id).add(amount));
    }

    @Override
    public void approve(Address owner, Address spender, BigInteger id, BigInteger amount) {
        setAllowance(new Slot(owner, spender, id), SafeCast.toUint256(amount));
    }

    @Override
    public void setOperator(Address owner, Address operator, boolean approved) {
        Slot slot = new Slot(owner, operator, null);
        if (undo != null && !undo.operators.containsKey(slot)) {
            undo.operators.put(slot, isOperator(owner, operator));
        }
        if (approved) {
            state.operators.put(slot, Boolean.TRUE);
        } else {
            state.operators.remove(slot);
        }
    }

    @Override
    public void begin() {
        undo = new State();
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
        State previous = undo;
        undo = null;
        for (Map.Entry<Slot, BigInteger> entry : previous.balances.entrySet()) {
            setBalance(entry.getKey(), entry.getValue());
        }
        for (Map.Entry<Slot, BigInteger> entry : previous.allowances.entrySet()) {
            setAllowance(entry.getKey(), entry.getValue());
        }
        for (Map.Entry<Slot, Boolean> entry : previous.operators.entrySet()) {
            Slot slot = entry.getKey();
            setOperator(slot.owner, slot.other, entry.getValue());
        }
    }

    private void spendAllowance(Address spender, Address from, BigInteger id, BigInteger amount) {
        if (spender.equals(from) || isOperator(from, spender)) {
            return;
        }
        BigInteger allowed = allowance(from, spender, id);
        if (allowed.equals(SafeCast.MAX_UINT256)) {
            return;
        }
        if (allowed.compareTo(amount) < 0) {
            throw new EngineException(ErrorCode.INSUFFICIENT_PERMISSION, spender, from, id, amount);
        }
        setAllowance(new Slot(from, spender, id), allowed.subtract(amount));
    }

    private void debit(Address owner, BigInteger id, BigInteger amount) {
        BigInteger balance = balanceOf(owner, id);
        if (balance.compareTo(amount) < 0) {
            throw new EngineException(ErrorCode.INSUFFICIENT_BALANCE, owner, id, balance, amount);
        }
        setBalance(owner, id, balance.subtract(amount));
    }

    private void setBalance(Address owner, BigInteger id, BigInteger balance) {
        setBalance(new Slot(owner, null, id), balance);
    }

    private void setBalance(Slot slot, BigInteger balance) {
        if (undo != null && !undo.balances.containsKey(slot)) {
            BigInteger previous = state.balances.get(slot);
            undo.balances.put(slot, previous == null ? BigInteger.ZERO : previous);
        }
        if (balance.signum() == 0) {
            state.balances.remove(slot);
        } else {
            state.balances.put(slot, balance);
        }
    }

    private void setAllowance(Slot slot, BigInteger allowance) {
        if (undo != null && !undo.allowances.containsKey(slot)) {
            BigInteger previous = state.allowances.get(slot);
            undo.allowances.put(slot, previous == null ? BigInteger.ZERO : previous);
        }
        if (allowance.signum() == 0) {
            state.allowances.remove(slot);
        } else {
            state.allowances.put(slot, allowance);
        }
    }

    private static void checkAmount(BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Negative amount: " + amount);
        }
    }
}
