package com.nanosecond.amm.core;

import com.nanosecond.amm.api.Address;
import com.nanosecond.amm.api.PoolId;
import com.nanosecond.amm.api.PoolKey;

import java.math.BigInteger;

/**
 * Receives pool events. Events are held back while a session runs and
 * delivered in order once it commits; a rolled back session delivers nothing.
 */
public interface PoolEventListener {

    PoolEventListener NO_OP = new PoolEventListener() {
        @Override
        public void onInitialize(PoolId id, PoolKey key, BigInteger sqrtPriceX96, int tick) {
        }

        @Override
        public void onModifyLiquidity(PoolId id, Address sender, int tickLower, int tickUpper,
                BigInteger liquidityDelta, BigInteger salt) {
        }

        @Override
        public void onSwap(PoolId id, Address sender, BigInteger amount0, BigInteger amount1,
                BigInteger sqrtPriceX96, BigInteger liquidity, int tick, int fee) {
        }

        @Override
        public void onDonate(PoolId id, Address sender, BigInteger amount0, BigInteger amount1) {
        }

        @Override
        public void onProtocolFeeUpdated(PoolId id, int protocolFee) {
        }
    };

    void onInitialize(PoolId id, PoolKey key, BigInteger sqrtPriceX96, int tick);

    void onModifyLiquidity(PoolId id, Address sender, int tickLower, int tickUpper, BigInteger liquidityDelta,
            BigInteger salt);

    void onSwap(PoolId id, Address sender, BigInteger amount0, BigInteger amount1, BigInteger sqrtPriceX96,
            BigInteger liquidity, int tick, int fee);

    void onDonate(PoolId id, Address sender, BigInteger amount0, BigInteger amount1);

    void onProtocolFeeUpdated(PoolId id, int protocolFee);
}
