package com.nanosecond.amm.infra;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.nanosecond.amm.api.Address;
import com.nanosecond.amm.core.PoolEventListener;
import com.nanosecond.amm.core.PoolManager;
import com.nanosecond.amm.core.UnlockCallback;
import com.nanosecond.amm.core.hooks.HookRegistry;
import com.nanosecond.amm.core.ledger.InMemoryClaimTokens;
import com.nanosecond.amm.core.ledger.InMemoryTokenCustody;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * <b>The Nanosecond AMM Engine Server.</b>
 * <p>
 * This class serves as the <b>Composition Root</b>: it builds the custody,
 * claim, hook and event components, the {@link PoolManager} on top of them,
 * and the sequencer in front of it.
 * </p>
 *
 * <h3>System Topology:</h3>
 *
 * <pre>
 * [Caller threads] -> submit(caller, callback, payload)
 *         |
 *    (Input Ring Buffer, MULTI producer)
 *         |
 *         v
 * [SessionCommandHandler] -> PoolManager.unlock(...)   (single consumer thread)
 *         |
 *         v
 * [CompletableFuture] -> result or EngineException back to the caller
 * </pre>
 *
 * <h3>Key Architecture Decisions:</h3>
 * <ul>
 * <li><b>Single Writer:</b> the pool manager allows one open session and is
 * not thread-safe. Funnelling every session through one Disruptor consumer
 * gives total order without locks.</li>
 * <li><b>Futures, not callbacks:</b> the consumer completes the command's
 * future; the caller decides whether to block.</li>
 * </ul>
 */
public class EngineServer {

    private static final Logger log = LoggerFactory.getLogger(EngineServer.class);

    private final EngineConfig config;
    private final InMemoryTokenCustody custody;
    private final InMemoryClaimTokens claims;
    private final HookRegistry hookRegistry;
    private final PoolManager poolManager;

    private final Disruptor<SessionCommand> disruptor;
    private final RingBuffer<SessionCommand> ringBuffer;

    public EngineServer(EngineConfig config) {
        this(config, new Slf4jPoolEventListener());
    }

    public EngineServer(EngineConfig config, PoolEventListener listener) {
        this.config = config;

        // 1. Core
        this.custody = new InMemoryTokenCustody();
        this.claims = new InMemoryClaimTokens();
        this.hookRegistry = new HookRegistry();
        this.poolManager = new PoolManager(config.engineAddress(), config.ownerAddress(), custody, claims,
                hookRegistry, listener);

        // 2. Sequencer
        this.disruptor = new Disruptor<>(
                SessionCommand.FACTORY,
                config.ringBufferSize(),
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                waitStrategy(config.waitStrategy()));
        this.disruptor.handleEventsWith(new SessionCommandHandler(poolManager));
        this.ringBuffer = disruptor.start();

        log.info("AMM engine started: {}", config);
    }

    /**
     * Queues a session. The future completes on the engine thread with the
     * callback's return value, or exceptionally with whatever aborted the
     * session.
     */
    public CompletableFuture<byte[]> submit(Address caller, UnlockCallback callback, byte[] payload) {
        CompletableFuture<byte[]> result = new CompletableFuture<>();
        ringBuffer.publishEvent((event, sequence) -> {
            event.caller = caller;
            event.callback = callback;
            event.payload = payload;
            event.result = result;
        });
        return result;
    }

    public void stop() {
        disruptor.shutdown();
        log.info("AMM engine stopped");
    }

    public EngineConfig getConfig() {
        return config;
    }

    public PoolManager getPoolManager() {
        return poolManager;
    }

    public InMemoryTokenCustody getCustody() {
        return custody;
    }

    public InMemoryClaimTokens getClaims() {
        return claims;
    }

    public HookRegistry getHookRegistry() {
        return hookRegistry;
    }

    private static WaitStrategy waitStrategy(EngineConfig.WaitStrategyType type) {
        switch (type) {
            case BUSY_SPIN:
                return new BusySpinWaitStrategy();
            case YIELDING:
                return new YieldingWaitStrategy();
            case BLOCKING:
            default:
                return new BlockingWaitStrategy();
        }
    }

    public static void main(String[] args) {
        EngineServer server = new EngineServer(EngineConfig.fromSystemProperties());
        new ShutdownSignalBarrier().await();
        server.stop();
    }
}
