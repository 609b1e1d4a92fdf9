package com.nanosecond.amm.infra;

import com.nanosecond.amm.api.Address;
import com.nanosecond.amm.api.PoolId;
import com.nanosecond.amm.api.PoolKey;
import com.nanosecond.amm.core.PoolEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Writes committed pool events to the {@code amm.events} logger.
 */
public class Slf4jPoolEventListener implements PoolEventListener {

    private static final Logger log = LoggerFactory.getLogger("amm.events");

    @Override
    public void onInitialize(PoolId id, PoolKey key, BigInteger sqrtPriceX96, int tick) {
        log.info("Initialize pool={} currency0={} currency1={} fee={} tickSpacing={} hooks={} sqrtPriceX96={} tick={}",
                id, key.currency0(), key.currency1(), key.fee(), key.tickSpacing(), key.hooks(), sqrtPriceX96, tick);
    }

    @Override
    public void onModifyLiquidity(PoolId id, Address sender, int tickLower, int tickUpper,
            BigInteger liquidityDelta, BigInteger salt) {
        log.info("ModifyLiquidity pool={} sender={} tickLower={} tickUpper={} liquidityDelta={} salt={}",
                id, sender, tickLower, tickUpper, liquidityDelta, salt);
    }

    @Override
    public void onSwap(PoolId id, Address sender, BigInteger amount0, BigInteger amount1, BigInteger sqrtPriceX96,
            BigInteger liquidity, int tick, int fee) {
        log.info("Swap pool={} sender={} amount0={} amount1={} sqrtPriceX96={} liquidity={} tick={} fee={}",
                id, sender, amount0, amount1, sqrtPriceX96, liquidity, tick, fee);
    }

    @Override
    public void onDonate(PoolId id, Address sender, BigInteger amount0, BigInteger amount1) {
        log.info("Donate pool={} sender={} amount0={} amount1={}", id, sender, amount0, amount1);
    }

    @Override
    public void onProtocolFeeUpdated(PoolId id, int protocolFee) {
        log.info("ProtocolFeeUpdated pool={} protocolFee={}", id, protocolFee);
    }
}
