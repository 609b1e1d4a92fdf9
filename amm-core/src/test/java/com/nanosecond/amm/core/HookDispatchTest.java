package com.nanosecond.amm.core;

import com.nanosecond.amm.api.Address;
import com.nanosecond.amm.api.BalanceDelta;
import com.nanosecond.amm.api.BeforeSwapDelta;
import com.nanosecond.amm.api.Currency;
import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;
import com.nanosecond.amm.api.PoolKey;
import com.nanosecond.amm.api.Slot0;
import com.nanosecond.amm.core.hooks.AfterSwapResult;
import com.nanosecond.amm.core.hooks.BeforeSwapResult;
import com.nanosecond.amm.core.hooks.Hook;
import com.nanosecond.amm.core.hooks.HookAck;
import com.nanosecond.amm.core.hooks.HookDeltaResult;
import com.nanosecond.amm.core.hooks.HookFlag;
import com.nanosecond.amm.core.hooks.HookPermissions;
import com.nanosecond.amm.core.hooks.HookRegistry;
import com.nanosecond.amm.core.ledger.InMemoryClaimTokens;
import com.nanosecond.amm.core.ledger.InMemoryTokenCustody;
import com.nanosecond.amm.core.math.FixedPoint;
import com.nanosecond.amm.core.math.TickMath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class HookDispatchTest {

    private static final Address ENGINE = Address.of(0xA11CEL);
    private static final Address ALICE = Address.of(0xA11);

    private static final Currency TOKEN0 = Currency.of(0x1000);
    private static final Currency TOKEN1 = Currency.of(0x2000);

    private static final BigInteger E18 = BigInteger.TEN.pow(18);
    private static final BigInteger FUNDS = BigInteger.TEN.pow(24);
    private static final BigInteger MIN_LIMIT = TickMath.MIN_SQRT_PRICE.add(BigInteger.ONE);

    private InMemoryTokenCustody custody;
    private HookRegistry registry;
    private PoolManager manager;

    /**
     * A hook at an address carrying exactly its flags. Callbacks not overridden
     * fail the operation if they are ever dispatched.
     */
    private abstract static class TestHook implements Hook {
        final Address address;
        final List<String> calls = new ArrayList<>();

        TestHook(int salt, HookFlag... flags) {
            this.address = Address.of(((long) salt << 14) | HookPermissions.of(flags).toBits());
        }

        @Override
        public Address address() {
            return address;
        }

        @Override
        public HookPermissions getHookPermissions() {
            return HookPermissions.fromAddress(address);
        }
    }

    @BeforeEach
    public void setUp() {
        custody = new InMemoryTokenCustody();
        registry = new HookRegistry();
        manager = new PoolManager(ENGINE, Address.of(0x0E), custody, new InMemoryClaimTokens(), registry, null);
        custody.deposit(TOKEN0, ALICE, FUNDS);
        custody.deposit(TOKEN1, ALICE, FUNDS);
    }

    @Test
    public void testInitializeHooksSeeALockedSession() {
        AtomicReference<Session> seen = new AtomicReference<>();
        TestHook hook = new TestHook(1, HookFlag.BEFORE_INITIALIZE, HookFlag.AFTER_INITIALIZE) {
            @Override
            public HookAck beforeInitialize(Session session, Address sender, PoolKey key, BigInteger sqrtPriceX96) {
                calls.add("beforeInitialize " + sender);
                return HookAck.BEFORE_INITIALIZE;
            }

            @Override
            public HookAck afterInitialize(Session session, Address sender, PoolKey key, BigInteger sqrtPriceX96,
                    int tick) {
                calls.add("afterInitialize " + tick);
                seen.set(session);
                return HookAck.AFTER_INITIALIZE;
            }
        };
        PoolKey key = poolWith(hook, 3000);

        manager.initialize(ALICE, key, FixedPoint.Q96);

        assertEquals(Arrays.asList("beforeInitialize " + ALICE, "afterInitialize 0"), hook.calls);
        assertEquals(hook.address, seen.get().actor());
        assertFalse(seen.get().isUnlocked());
        EngineException e = assertThrows(EngineException.class, () -> seen.get().sync(TOKEN0));
        assertEquals(ErrorCode.MANAGER_LOCKED, e.code());
    }

    @Test
    public void testOnlyPermittedCallbacksAreDispatched() {
        TestHook hook = new TestHook(2, HookFlag.BEFORE_SWAP) {
            @Override
            public BeforeSwapResult beforeSwap(Session session, Address sender, PoolKey key, SwapParams params,
                    byte[] hookData) {
                calls.add("beforeSwap " + new String(hookData));
                return BeforeSwapResult.proceed();
            }
        };
        PoolKey key = poolWith(hook, 3000);
        manager.initialize(ALICE, key, FixedPoint.Q96);
        addLiquidity(key, E18);

        // afterSwap would throw HOOK_NOT_IMPLEMENTED if it were called
        BalanceDelta delta = swap(key, SwapParams.exactInput(true, 1_000_000_000_000_000L, MIN_LIMIT), "x".getBytes());

        assertEquals(BalanceDelta.of(-1_000_000_000_000_000L, 996006981039903L), delta);
        assertEquals(Arrays.asList("beforeSwap x"), hook.calls);
    }

    @Test
    public void testWrongAcknowledgementAbortsTheSwap() {
        TestHook hook = new TestHook(3, HookFlag.BEFORE_SWAP) {
            @Override
            public BeforeSwapResult beforeSwap(Session session, Address sender, PoolKey key, SwapParams params,
                    byte[] hookData) {
                return new BeforeSwapResult(HookAck.AFTER_SWAP, BeforeSwapDelta.ZERO, 0);
            }
        };
        PoolKey key = poolWith(hook, 3000);
        manager.initialize(ALICE, key, FixedPoint.Q96);
        addLiquidity(key, E18);
        Slot0 before = manager.getSlot0(key.toId());

        EngineException e = assertThrows(EngineException.class,
                () -> swap(key, SwapParams.exactInput(true, 1000, MIN_LIMIT), null));

        assertEquals(ErrorCode.INVALID_HOOK_RESPONSE, e.code());
        assertEquals(before, manager.getSlot0(key.toId()));
        assertEquals(E18, manager.getLiquidity(key.toId()));
    }

    @Test
    public void testBeforeSwapDeltaCanReplaceThePoolEntirely() {
        // The hook fills the whole order itself: it takes the 1000 input and pays 990 out
        TestHook hook = new TestHook(5, HookFlag.BEFORE_SWAP, HookFlag.AFTER_SWAP,
                HookFlag.BEFORE_SWAP_RETURNS_DELTA) {
            @Override
            public BeforeSwapResult beforeSwap(Session session, Address sender, PoolKey key, SwapParams params,
                    byte[] hookData) {
                return new BeforeSwapResult(HookAck.BEFORE_SWAP, BeforeSwapDelta.of(1000, -990), 0);
            }

            @Override
            public AfterSwapResult afterSwap(Session session, Address sender, PoolKey key, SwapParams params,
                    BalanceDelta delta, byte[] hookData) {
                calls.add("afterSwap " + delta);
                session.sync(TOKEN1);
                custody.transfer(TOKEN1, address, ENGINE, BigInteger.valueOf(990));
                session.settle();
                session.take(TOKEN0, address, BigInteger.valueOf(1000));
                return AfterSwapResult.proceed();
            }
        };
        assertEquals(0xC8, hook.address.lowBits(HookFlag.ALL_HOOK_MASK));
        PoolKey key = poolWith(hook, 3000);
        manager.initialize(ALICE, key, FixedPoint.Q96);
        custody.deposit(TOKEN1, hook.address, BigInteger.valueOf(990));
        // Reserves the hook can take before the caller has paid
        custody.deposit(TOKEN0, ENGINE, BigInteger.valueOf(1000));
        Slot0 before = manager.getSlot0(key.toId());

        BalanceDelta delta = swap(key, SwapParams.exactInput(true, 1000, MIN_LIMIT), null);

        assertEquals(BalanceDelta.of(-1000, 990), delta);
        assertEquals(Arrays.asList("afterSwap " + BalanceDelta.ZERO), hook.calls);
        assertEquals(before, manager.getSlot0(key.toId()));
        assertEquals(BigInteger.valueOf(1000), custody.balanceOf(TOKEN0, hook.address));
        assertEquals(BigInteger.ZERO, custody.balanceOf(TOKEN1, hook.address));
        assertEquals(FUNDS.add(BigInteger.valueOf(990)), custody.balanceOf(TOKEN1, ALICE));
    }

    @Test
    public void testBeforeSwapDeltaMayNotFlipTheSwapDirection() {
        TestHook hook = new TestHook(6, HookFlag.BEFORE_SWAP, HookFlag.BEFORE_SWAP_RETURNS_DELTA) {
            @Override
            public BeforeSwapResult beforeSwap(Session session, Address sender, PoolKey key, SwapParams params,
                    byte[] hookData) {
                return new BeforeSwapResult(HookAck.BEFORE_SWAP, BeforeSwapDelta.of(1001, 0), 0);
            }
        };
        PoolKey key = poolWith(hook, 3000);
        manager.initialize(ALICE, key, FixedPoint.Q96);

        EngineException e = assertThrows(EngineException.class,
                () -> swap(key, SwapParams.exactInput(true, 1000, MIN_LIMIT), null));
        assertEquals(ErrorCode.HOOK_DELTA_EXCEEDS_SWAP_AMOUNT, e.code());
    }

    @Test
    public void testDeltaWithoutReturnsDeltaFlagIsIgnored() {
        TestHook hook = new TestHook(7, HookFlag.BEFORE_SWAP) {
            @Override
            public BeforeSwapResult beforeSwap(Session session, Address sender, PoolKey key, SwapParams params,
                    byte[] hookData) {
                return new BeforeSwapResult(HookAck.BEFORE_SWAP, BeforeSwapDelta.of(1000, -990), 0);
            }
        };
        PoolKey key = poolWith(hook, 3000);
        manager.initialize(ALICE, key, FixedPoint.Q96);
        addLiquidity(key, E18);

        assertEquals(BalanceDelta.of(-1_000_000_000_000_000L, 996006981039903L),
                swap(key, SwapParams.exactInput(true, 1_000_000_000_000_000L, MIN_LIMIT), null));
    }

    @Test
    public void testFeeOverrideAppliesToDynamicPoolsOnly() {
        TestHook hook = new TestHook(8, HookFlag.BEFORE_SWAP) {
            @Override
            public BeforeSwapResult beforeSwap(Session session, Address sender, PoolKey key, SwapParams params,
                    byte[] hookData) {
                return new BeforeSwapResult(HookAck.BEFORE_SWAP, BeforeSwapDelta.ZERO,
                        5000 | LpFees.OVERRIDE_FEE_FLAG);
            }
        };
        PoolKey dynamic = poolWith(hook, LpFees.DYNAMIC_FEE_FLAG);
        PoolKey fixed = poolWith(hook, 3000);
        manager.initialize(ALICE, dynamic, FixedPoint.Q96);
        manager.initialize(ALICE, fixed, FixedPoint.Q96);
        addLiquidity(dynamic, E18);
        addLiquidity(fixed, E18);

        assertEquals(BalanceDelta.of(-1_000_000_000_000_000L, 994010959095699L),
                swap(dynamic, SwapParams.exactInput(true, 1_000_000_000_000_000L, MIN_LIMIT), null));
        assertEquals(BalanceDelta.of(-1_000_000_000_000_000L, 996006981039903L),
                swap(fixed, SwapParams.exactInput(true, 1_000_000_000_000_000L, MIN_LIMIT), null));
        // The override never touches the stored fee
        assertEquals(0, manager.getSlot0(dynamic.toId()).lpFee());
    }

    @Test
    public void testAfterAddLiquidityDeltaIsChargedToTheHook() {
        // The hook subsidises 100 of currency0 for every deposit
        TestHook hook = new TestHook(9, HookFlag.AFTER_ADD_LIQUIDITY, HookFlag.AFTER_ADD_LIQUIDITY_RETURNS_DELTA) {
            @Override
            public HookDeltaResult afterAddLiquidity(Session session, Address sender, PoolKey key,
                    ModifyLiquidityParams params, BalanceDelta delta, BalanceDelta feesAccrued, byte[] hookData) {
                session.sync(TOKEN0);
                custody.transfer(TOKEN0, address, ENGINE, BigInteger.valueOf(100));
                session.settle();
                return new HookDeltaResult(HookAck.AFTER_ADD_LIQUIDITY, BalanceDelta.of(-100, 0));
            }
        };
        custody.deposit(TOKEN0, hook.address, BigInteger.valueOf(100));
        PoolKey key = poolWith(hook, 3000);
        manager.initialize(ALICE, key, FixedPoint.Q96);

        ModifyLiquidityResult result = addLiquidity(key, E18);

        assertEquals(BalanceDelta.of(-5981737760509663L + 100, -5981737760509663L), result.callerDelta());
        assertEquals(BigInteger.ZERO, custody.balanceOf(TOKEN0, hook.address));
        assertEquals(BigInteger.valueOf(5981737760509663L), custody.balanceOf(TOKEN0, ENGINE));
    }

    @Test
    public void testAfterRemoveLiquidityDeltaIsChargedToTheHook() {
        // The hook keeps 100 of currency1 from every withdrawal
        TestHook hook = new TestHook(10, HookFlag.AFTER_REMOVE_LIQUIDITY,
                HookFlag.AFTER_REMOVE_LIQUIDITY_RETURNS_DELTA) {
            @Override
            public HookDeltaResult afterRemoveLiquidity(Session session, Address sender, PoolKey key,
                    ModifyLiquidityParams params, BalanceDelta delta, BalanceDelta feesAccrued, byte[] hookData) {
                session.take(TOKEN1, address, BigInteger.valueOf(100));
                return new HookDeltaResult(HookAck.AFTER_REMOVE_LIQUIDITY, BalanceDelta.of(0, 100));
            }
        };
        assertEquals(0x101, hook.address.lowBits(HookFlag.ALL_HOOK_MASK));
        PoolKey key = poolWith(hook, 3000);
        manager.initialize(ALICE, key, FixedPoint.Q96);
        addLiquidity(key, E18);

        ModifyLiquidityResult result = addLiquidity(key, E18.negate());

        assertEquals(BalanceDelta.of(5981737760509662L, 5981737760509662L - 100), result.callerDelta());
        assertEquals(BigInteger.valueOf(100), custody.balanceOf(TOKEN1, hook.address));
    }

    @Test
    public void testHookCallingItsOwnPoolIsNotReentered() {
        TestHook hook = new TestHook(11, HookFlag.BEFORE_DONATE) {
            @Override
            public HookAck beforeDonate(Session session, Address sender, PoolKey key, BigInteger amount0,
                    BigInteger amount1, byte[] hookData) {
                calls.add("beforeDonate " + sender);
                // The hook tops up the donation; its own donate skips the hook
                session.donate(key, BigInteger.ONE, BigInteger.ZERO, null);
                session.sync(TOKEN0);
                custody.transfer(TOKEN0, address, ENGINE, BigInteger.ONE);
                session.settle();
                return HookAck.BEFORE_DONATE;
            }
        };
        custody.deposit(TOKEN0, hook.address, BigInteger.ONE);
        PoolKey key = poolWith(hook, 3000);
        manager.initialize(ALICE, key, FixedPoint.Q96);
        addLiquidity(key, E18);

        manager.unlock(ALICE, (session, data) -> {
            session.donate(key, BigInteger.TEN, BigInteger.ZERO, null);
            settleAll(session, key);
            return null;
        }, null);

        assertEquals(Arrays.asList("beforeDonate " + ALICE), hook.calls);
        assertEquals(BigInteger.ZERO, custody.balanceOf(TOKEN0, hook.address));
    }

    @Test
    public void testUnsettledHookDeltaFailsTheCallersSession() {
        TestHook hook = new TestHook(12, HookFlag.AFTER_ADD_LIQUIDITY, HookFlag.AFTER_ADD_LIQUIDITY_RETURNS_DELTA) {
            @Override
            public HookDeltaResult afterAddLiquidity(Session session, Address sender, PoolKey key,
                    ModifyLiquidityParams params, BalanceDelta delta, BalanceDelta feesAccrued, byte[] hookData) {
                // Promises a subsidy but never pays it
                return new HookDeltaResult(HookAck.AFTER_ADD_LIQUIDITY, BalanceDelta.of(-100, 0));
            }
        };
        PoolKey key = poolWith(hook, 3000);
        manager.initialize(ALICE, key, FixedPoint.Q96);

        EngineException e = assertThrows(EngineException.class, () -> addLiquidity(key, E18));
        assertEquals(ErrorCode.CURRENCY_NOT_SETTLED, e.code());
        assertEquals(BigInteger.ZERO, manager.getLiquidity(key.toId()));
    }

    @Test
    public void testCaughtAfterSwapRejectionStillRevertsThePrice() {
        TestHook hook = new TestHook(13, HookFlag.AFTER_SWAP) {
            @Override
            public AfterSwapResult afterSwap(Session session, Address sender, PoolKey key, SwapParams params,
                    BalanceDelta delta, byte[] hookData) {
                return new AfterSwapResult(HookAck.BEFORE_SWAP, BigInteger.ZERO);
            }
        };
        PoolKey key = poolWith(hook, 3000);
        manager.initialize(ALICE, key, FixedPoint.Q96);
        addLiquidity(key, E18);
        Slot0 before = manager.getSlot0(key.toId());
        BigInteger aliceToken0 = custody.balanceOf(TOKEN0, ALICE);

        // The pool has already moved to tick -20 when the hook answers
        EngineException e = assertThrows(EngineException.class, () -> manager.unlock(ALICE, (session, data) -> {
            EngineException caught = assertThrows(EngineException.class, () -> session.swap(key,
                    SwapParams.exactInput(true, 1_000_000_000_000_000L, MIN_LIMIT), null));
            assertEquals(ErrorCode.INVALID_HOOK_RESPONSE, caught.code());
            return null;
        }, null));

        assertEquals(ErrorCode.INVALID_HOOK_RESPONSE, e.code());
        assertEquals(before, manager.getSlot0(key.toId()));
        assertEquals(0, manager.getSlot0(key.toId()).tick());
        assertEquals(aliceToken0, custody.balanceOf(TOKEN0, ALICE));
    }

    @Test
    public void testNullHookDeltaCountsAsZero() {
        TestHook liquidityHook = new TestHook(14, HookFlag.AFTER_ADD_LIQUIDITY,
                HookFlag.AFTER_ADD_LIQUIDITY_RETURNS_DELTA) {
            @Override
            public HookDeltaResult afterAddLiquidity(Session session, Address sender, PoolKey key,
                    ModifyLiquidityParams params, BalanceDelta delta, BalanceDelta feesAccrued, byte[] hookData) {
                return new HookDeltaResult(HookAck.AFTER_ADD_LIQUIDITY, null);
            }
        };
        PoolKey key = poolWith(liquidityHook, 3000);
        manager.initialize(ALICE, key, FixedPoint.Q96);

        assertEquals(BalanceDelta.of(-5981737760509663L, -5981737760509663L),
                addLiquidity(key, E18).callerDelta());

        TestHook swapHook = new TestHook(15, HookFlag.AFTER_SWAP, HookFlag.AFTER_SWAP_RETURNS_DELTA) {
            @Override
            public AfterSwapResult afterSwap(Session session, Address sender, PoolKey key, SwapParams params,
                    BalanceDelta delta, byte[] hookData) {
                return new AfterSwapResult(HookAck.AFTER_SWAP, null);
            }
        };
        PoolKey swapKey = poolWith(swapHook, 3000);
        manager.initialize(ALICE, swapKey, FixedPoint.Q96);
        addLiquidity(swapKey, E18);

        assertEquals(BalanceDelta.of(-1_000_000_000_000_000L, 996006981039903L),
                swap(swapKey, SwapParams.exactInput(true, 1_000_000_000_000_000L, MIN_LIMIT), null));
    }

    @Test
    public void testNullHookResultIsAnInvalidResponse() {
        TestHook hook = new TestHook(16, HookFlag.AFTER_REMOVE_LIQUIDITY,
                HookFlag.AFTER_REMOVE_LIQUIDITY_RETURNS_DELTA) {
            @Override
            public HookDeltaResult afterRemoveLiquidity(Session session, Address sender, PoolKey key,
                    ModifyLiquidityParams params, BalanceDelta delta, BalanceDelta feesAccrued, byte[] hookData) {
                return null;
            }
        };
        PoolKey key = poolWith(hook, 3000);
        manager.initialize(ALICE, key, FixedPoint.Q96);
        addLiquidity(key, E18);

        EngineException e = assertThrows(EngineException.class, () -> addLiquidity(key, E18.negate()));
        assertEquals(ErrorCode.INVALID_HOOK_RESPONSE, e.code());
        assertEquals(E18, manager.getLiquidity(key.toId()));
    }

    // ---------------------------------------------------------------- helpers

    private PoolKey poolWith(TestHook hook, int fee) {
        if (registry.lookup(hook.address) == null) {
            registry.register(hook);
        }
        return new PoolKey(TOKEN0, TOKEN1, fee, 60, hook.address);
    }

    private ModifyLiquidityResult addLiquidity(PoolKey key, BigInteger liquidityDelta) {
        AtomicReference<ModifyLiquidityResult> result = new AtomicReference<>();
        manager.unlock(ALICE, (session, data) -> {
            result.set(session.modifyLiquidity(key, new ModifyLiquidityParams(-120, 120, liquidityDelta, null),
                    null));
            settleAll(session, key);
            return null;
        }, null);
        return result.get();
    }

    private BalanceDelta swap(PoolKey key, SwapParams params, byte[] hookData) {
        AtomicReference<BalanceDelta> result = new AtomicReference<>();
        manager.unlock(ALICE, (session, data) -> {
            result.set(session.swap(key, params, hookData));
            settleAll(session, key);
            return null;
        }, null);
        return result.get();
    }

    private void settleAll(Session session, PoolKey key) {
        for (Currency currency : new Currency[] {key.currency0(), key.currency1()}) {
            BigInteger delta = session.currencyDelta(currency);
            if (delta.signum() < 0) {
                session.sync(currency);
                custody.transfer(currency, session.actor(), ENGINE, delta.negate());
                session.settle();
            } else if (delta.signum() > 0) {
                session.take(currency, session.actor(), delta);
            }
        }
    }
}
