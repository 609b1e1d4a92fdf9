package com.nanosecond.amm.infra;

import com.nanosecond.amm.api.Address;
import com.nanosecond.amm.api.BalanceDelta;
import com.nanosecond.amm.api.Currency;
import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;
import com.nanosecond.amm.api.PoolKey;
import com.nanosecond.amm.core.ModifyLiquidityParams;
import com.nanosecond.amm.core.PoolEventListener;
import com.nanosecond.amm.core.Session;
import com.nanosecond.amm.core.SwapParams;
import com.nanosecond.amm.core.math.FixedPoint;
import com.nanosecond.amm.core.math.TickMath;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EngineServerTest {

    private static final Address ENGINE = Address.of(0xA11CEL);
    private static final Address ALICE = Address.of(0xA11);
    private static final Currency TOKEN0 = Currency.of(0x1000);
    private static final Currency TOKEN1 = Currency.of(0x2000);
    private static final PoolKey KEY = new PoolKey(TOKEN0, TOKEN1, 3000, 60, null);

    private EngineServer server;

    @BeforeEach
    void setUp() {
        EngineConfig config = new EngineConfig(64, EngineConfig.WaitStrategyType.BLOCKING, ENGINE, Address.of(0x0E));
        server = new EngineServer(config, PoolEventListener.NO_OP);
        server.getCustody().deposit(TOKEN0, ALICE, BigInteger.TEN.pow(24));
        server.getCustody().deposit(TOKEN1, ALICE, BigInteger.TEN.pow(24));
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void shouldRunSessionsOnTheEngineThread() throws Exception {
        byte[] result = server.submit(ALICE, (session, data) -> {
            session.initialize(KEY, FixedPoint.Q96);
            BalanceDelta delta = session.modifyLiquidity(KEY,
                    new ModifyLiquidityParams(-120, 120, BigInteger.TEN.pow(18), null), null).callerDelta();
            pay(session, TOKEN0, delta.amount0().negate());
            pay(session, TOKEN1, delta.amount1().negate());
            return data;
        }, "ok".getBytes(StandardCharsets.UTF_8)).get(5, TimeUnit.SECONDS);

        assertEquals("ok", new String(result, StandardCharsets.UTF_8));
        assertEquals(BigInteger.TEN.pow(18), server.getPoolManager().getLiquidity(KEY.toId()));
        assertEquals(BigInteger.valueOf(5981737760509663L), server.getCustody().balanceOf(TOKEN0, ENGINE));
    }

    @Test
    void shouldSurfaceSessionFailures() throws Exception {
        CompletableFuture<byte[]> failed = server.submit(ALICE, (session, data) -> {
            session.initialize(KEY, FixedPoint.Q96);
            session.modifyLiquidity(KEY, new ModifyLiquidityParams(-120, 120, BigInteger.TEN.pow(18), null), null);
            return null;
        }, null);

        ExecutionException e = assertThrows(ExecutionException.class, () -> failed.get(5, TimeUnit.SECONDS));
        EngineException cause = assertInstanceOf(EngineException.class, e.getCause());
        assertEquals(ErrorCode.CURRENCY_NOT_SETTLED, cause.code());

        // The failed session left nothing behind and the engine keeps serving
        assertFalse(server.getPoolManager().isInitialized(KEY.toId()));
        server.submit(ALICE, (session, data) -> {
            session.initialize(KEY, FixedPoint.Q96);
            return null;
        }, null).get(5, TimeUnit.SECONDS);
        assertTrue(server.getPoolManager().isInitialized(KEY.toId()));
    }

    @Test
    void shouldSerializeConcurrentSubmitters() throws Exception {
        server.submit(ALICE, (session, data) -> {
            session.initialize(KEY, FixedPoint.Q96);
            BalanceDelta delta = session.modifyLiquidity(KEY,
                    new ModifyLiquidityParams(-887220, 887220, BigInteger.TEN.pow(21), null), null).callerDelta();
            pay(session, TOKEN0, delta.amount0().negate());
            pay(session, TOKEN1, delta.amount1().negate());
            return null;
        }, null).get(5, TimeUnit.SECONDS);

        int threads = 4;
        int perThread = 250;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<List<CompletableFuture<byte[]>>>> producers = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            boolean zeroForOne = t % 2 == 0;
            producers.add(executor.submit(() -> {
                List<CompletableFuture<byte[]>> futures = new ArrayList<>();
                for (int i = 0; i < perThread; i++) {
                    futures.add(server.submit(ALICE, (session, data) -> {
                        BigInteger limit = zeroForOne
                                ? TickMath.MIN_SQRT_PRICE.add(BigInteger.ONE)
                                : TickMath.MAX_SQRT_PRICE.subtract(BigInteger.ONE);
                        BalanceDelta delta = session.swap(KEY, SwapParams.exactInput(zeroForOne, 1_000_000, limit),
                                null);
                        settle(session, TOKEN0, delta.amount0());
                        settle(session, TOKEN1, delta.amount1());
                        return null;
                    }, null));
                }
                return futures;
            }));
        }

        for (Future<List<CompletableFuture<byte[]>>> producer : producers) {
            for (CompletableFuture<byte[]> future : producer.get(10, TimeUnit.SECONDS)) {
                future.get(10, TimeUnit.SECONDS);
            }
        }
        executor.shutdown();

        BigInteger[] growth = server.getPoolManager().getFeeGrowthGlobals(KEY.toId());
        assertTrue(growth[0].signum() > 0);
        assertTrue(growth[1].signum() > 0);
        assertFalse(server.getPoolManager().isUnlocked());
    }

    private void settle(Session session, Currency currency, BigInteger delta) {
        if (delta.signum() < 0) {
            pay(session, currency, delta.negate());
        } else if (delta.signum() > 0) {
            session.take(currency, session.actor(), delta);
        }
    }

    private void pay(Session session, Currency currency, BigInteger amount) {
        session.sync(currency);
        server.getCustody().transfer(currency, session.actor(), ENGINE, amount);
        session.settle();
    }
}
