package com.nanosecond.amm.core.ledger;

import com.nanosecond.amm.api.Address;

import java.math.BigInteger;

/**
 * Multi-token balances that represent currency left inside the engine. The
 * token id of a claim is {@link com.nanosecond.amm.api.Currency#toId()}.
 * <p>
 * The engine calls {@link #mint} and {@link #burn}; holders move claims with
 * {@link #transfer}/{@link #transferFrom} and delegate with
 * {@link #approve}/{@link #setOperator}.
 * </p>
 */
public interface ClaimTokenService {

    BigInteger balanceOf(Address owner, BigInteger id);

    BigInteger allowance(Address owner, Address spender, BigInteger id);

    boolean isOperator(Address owner, Address operator);

    void mint(Address to, BigInteger id, BigInteger amount);

    /**
     * Burns {@code amount} of {@code from}'s claims on behalf of {@code spender}.
     * Unless {@code spender} is {@code from} or one of its operators, the
     * allowance is consumed.
     */
    void burn(Address spender, Address from, BigInteger id, BigInteger amount);

    void transfer(Address sender, Address to, BigInteger id, BigInteger amount);

    void transferFrom(Address spender, Address from, Address to, BigInteger id, BigInteger amount);

    void approve(Address owner, Address spender, BigInteger id, BigInteger amount);

    void setOperator(Address owner, Address operator, boolean approved);
}
