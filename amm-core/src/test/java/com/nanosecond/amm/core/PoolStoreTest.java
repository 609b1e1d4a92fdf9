package com.nanosecond.amm.core;

import com.nanosecond.amm.api.Address;
import com.nanosecond.amm.api.Currency;
import com.nanosecond.amm.api.PoolId;
import com.nanosecond.amm.api.PoolKey;
import com.nanosecond.amm.core.math.FixedPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class PoolStoreTest {

    private static final Address ALICE = Address.of(0xA11);
    private static final Currency TOKEN0 = Currency.of(0x1000);
    private static final Currency TOKEN1 = Currency.of(0x2000);
    private static final PoolId ID = new PoolKey(TOKEN0, TOKEN1, 3000, 60, Address.ZERO).toId();
    private static final PoolId OTHER = new PoolKey(TOKEN0, TOKEN1, 500, 10, Address.ZERO).toId();
    private static final BigInteger E18 = BigInteger.TEN.pow(18);

    private PoolStore store;

    @BeforeEach
    public void setUp() {
        store = new PoolStore();
        store.begin();
        Pool pool = store.forUpdate(ID);
        pool.initialize(FixedPoint.Q96, 3000);
        pool.modifyLiquidity(ALICE, new ModifyLiquidityParams(-120, 120, E18.longValue()), 60);
        store.setProtocolFeesAccrued(TOKEN0, BigInteger.TEN);
        store.commit();
    }

    @Test
    public void testRollbackUndoesTouchedPoolsAndForgetsCreatedOnes() {
        Pool pool = store.read(ID);

        store.begin();
        assertSame(pool, store.forUpdate(ID));
        pool.modifyLiquidity(ALICE, new ModifyLiquidityParams(-120, 120, E18.negate().longValue()), 60);
        store.forUpdate(OTHER).initialize(FixedPoint.Q96, 500);
        store.setProtocolFeesAccrued(TOKEN0, BigInteger.ZERO);
        store.setProtocolFeesAccrued(TOKEN1, BigInteger.ONE);
        store.rollback();

        assertFalse(store.isActive());
        assertSame(pool, store.read(ID));
        assertEquals(E18, pool.liquidity());
        assertEquals(E18, pool.tickInfo(-120).liquidityGross);
        assertNull(store.read(OTHER));
        assertEquals(BigInteger.TEN, store.protocolFeesAccrued(TOKEN0));
        assertEquals(BigInteger.ZERO, store.protocolFeesAccrued(TOKEN1));
    }

    @Test
    public void testCommitDropsPoolsThatNeverInitialized() {
        store.begin();
        store.forUpdate(OTHER);
        assertNotNull(store.read(OTHER));
        store.commit();

        assertNull(store.read(OTHER));
        assertTrue(store.read(ID).slot0().isInitialized());
    }

    @Test
    public void testCommittedChangesSurviveLaterRollback() {
        store.begin();
        store.forUpdate(ID).setLpFee(500);
        store.commit();

        store.begin();
        store.forUpdate(ID).setLpFee(100);
        store.rollback();

        assertEquals(500, store.read(ID).slot0().lpFee());
    }

    @Test
    public void testUpdatesNeedAnOpenTransaction() {
        assertThrows(IllegalStateException.class, () -> store.forUpdate(ID));
        assertThrows(IllegalStateException.class, () -> store.setProtocolFeesAccrued(TOKEN0, BigInteger.ONE));
        store.begin();
        assertThrows(IllegalStateException.class, () -> store.begin());
    }
}
