package com.nanosecond.amm.core.ledger;

import com.nanosecond.amm.api.Address;
import com.nanosecond.amm.api.Currency;

import java.math.BigInteger;

/**
 * The external system that actually holds and moves tokens. The engine only
 * reads its own balance (to measure payments after {@code sync}) and transfers
 * out on {@code take} and protocol fee collection.
 */
public interface TokenCustody {

    BigInteger balanceOf(Currency currency, Address holder);

    /**
     * @throws com.nanosecond.amm.api.EngineException
     *         {@link com.nanosecond.amm.api.ErrorCode#INSUFFICIENT_BALANCE} if
     *         {@code from} holds less than {@code amount}
     */
    void transfer(Currency currency, Address from, Address to, BigInteger amount);
}
