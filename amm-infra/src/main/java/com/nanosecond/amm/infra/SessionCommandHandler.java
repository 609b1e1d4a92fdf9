package com.nanosecond.amm.infra;

import com.lmax.disruptor.EventHandler;
import com.nanosecond.amm.core.PoolManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The Consumer in the Disruptor pattern.
 * Takes SessionCommands from the RingBuffer and runs each one as an unlock on
 * the Pool Manager, completing the command's future with the outcome.
 */
public class SessionCommandHandler implements EventHandler<SessionCommand> {

    private static final Logger log = LoggerFactory.getLogger(SessionCommandHandler.class);

    private final PoolManager poolManager;

    public SessionCommandHandler(PoolManager poolManager) {
        this.poolManager = poolManager;
    }

    @Override
    public void onEvent(SessionCommand event, long sequence, boolean endOfBatch) {
        try {
            byte[] output = poolManager.unlock(event.caller, event.callback, event.payload);
            event.result.complete(output);
        } catch (RuntimeException e) {
            log.debug("Session {} from {} failed: {}", sequence, event.caller, e.getMessage());
            event.result.completeExceptionally(e);
        } finally {
            event.reset();
        }
    }
}
