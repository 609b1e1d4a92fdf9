package com.nanosecond.amm.core.ledger;

import com.nanosecond.amm.api.Address;
import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;
import com.nanosecond.amm.api.SafeCast;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryClaimTokensTest {

    private static final Address ALICE = Address.of(0xA11);
    private static final Address BOB = Address.of(0xB0B);
    private static final Address CAROL = Address.of(0xCA);
    private static final BigInteger ID = BigInteger.valueOf(0x1000);

    private InMemoryClaimTokens claims;

    @BeforeEach
    public void setUp() {
        claims = new InMemoryClaimTokens();
        claims.mint(ALICE, ID, BigInteger.valueOf(1000));
    }

    @Test
    public void testTransferMovesBalance() {
        claims.transfer(ALICE, BOB, ID, BigInteger.valueOf(300));

        assertEquals(BigInteger.valueOf(700), claims.balanceOf(ALICE, ID));
        assertEquals(BigInteger.valueOf(300), claims.balanceOf(BOB, ID));
        assertEquals(BigInteger.ZERO, claims.balanceOf(BOB, BigInteger.ONE));
    }

    @Test
    public void testTransferBeyondBalance() {
        EngineException e = assertThrows(EngineException.class,
                () -> claims.transfer(ALICE, BOB, ID, BigInteger.valueOf(1001)));
        assertEquals(ErrorCode.INSUFFICIENT_BALANCE, e.code());
        assertEquals(BigInteger.valueOf(1000), claims.balanceOf(ALICE, ID));
    }

    @Test
    public void testTransferFromSpendsAllowance() {
        EngineException e = assertThrows(EngineException.class,
                () -> claims.transferFrom(BOB, ALICE, CAROL, ID, BigInteger.ONE));
        assertEquals(ErrorCode.INSUFFICIENT_PERMISSION, e.code());

        claims.approve(ALICE, BOB, ID, BigInteger.valueOf(400));
        claims.transferFrom(BOB, ALICE, CAROL, ID, BigInteger.valueOf(150));

        assertEquals(BigInteger.valueOf(250), claims.allowance(ALICE, BOB, ID));
        assertEquals(BigInteger.valueOf(150), claims.balanceOf(CAROL, ID));
    }

    @Test
    public void testMaxAllowanceIsNeverSpent() {
        claims.approve(ALICE, BOB, ID, SafeCast.MAX_UINT256);

        claims.transferFrom(BOB, ALICE, CAROL, ID, BigInteger.valueOf(600));
        claims.burn(BOB, ALICE, ID, BigInteger.valueOf(100));

        assertEquals(SafeCast.MAX_UINT256, claims.allowance(ALICE, BOB, ID));
        assertEquals(BigInteger.valueOf(300), claims.balanceOf(ALICE, ID));
    }

    @Test
    public void testOperatorNeedsNoAllowance() {
        claims.setOperator(ALICE, BOB, true);
        assertTrue(claims.isOperator(ALICE, BOB));
        assertFalse(claims.isOperator(BOB, ALICE));

        claims.transferFrom(BOB, ALICE, CAROL, ID, BigInteger.valueOf(1000));
        assertEquals(BigInteger.valueOf(1000), claims.balanceOf(CAROL, ID));

        claims.setOperator(ALICE, BOB, false);
        claims.mint(ALICE, ID, BigInteger.ONE);
        assertThrows(EngineException.class, () -> claims.burn(BOB, ALICE, ID, BigInteger.ONE));
    }

    @Test
    public void testOwnerBurnsWithoutAllowance() {
        claims.burn(ALICE, ALICE, ID, BigInteger.valueOf(1000));
        assertEquals(BigInteger.ZERO, claims.balanceOf(ALICE, ID));
    }

    @Test
    public void testRollbackRestoresTouchedSlots() {
        claims.begin();
        claims.transfer(ALICE, BOB, ID, BigInteger.valueOf(10));
        claims.approve(ALICE, CAROL, ID, BigInteger.TEN);
        claims.setOperator(ALICE, BOB, true);
        claims.rollback();

        assertEquals(BigInteger.valueOf(1000), claims.balanceOf(ALICE, ID));
        assertEquals(BigInteger.ZERO, claims.balanceOf(BOB, ID));
        assertEquals(BigInteger.ZERO, claims.allowance(ALICE, CAROL, ID));
        assertFalse(claims.isOperator(ALICE, BOB));
    }

    @Test
    public void testRollbackRestoresSpentAllowanceAndRevokedOperator() {
        claims.approve(ALICE, BOB, ID, BigInteger.valueOf(50));
        claims.setOperator(ALICE, CAROL, true);

        claims.begin();
        claims.transferFrom(BOB, ALICE, CAROL, ID, BigInteger.valueOf(50));
        claims.setOperator(ALICE, CAROL, false);
        claims.burn(ALICE, ALICE, ID, BigInteger.valueOf(950));
        claims.rollback();

        assertEquals(BigInteger.valueOf(50), claims.allowance(ALICE, BOB, ID));
        assertTrue(claims.isOperator(ALICE, CAROL));
        assertEquals(BigInteger.valueOf(1000), claims.balanceOf(ALICE, ID));
        assertEquals(BigInteger.ZERO, claims.balanceOf(CAROL, ID));
    }

    @Test
    public void testCommitKeepsChanges() {
        claims.begin();
        claims.mint(BOB, ID, BigInteger.TEN);
        claims.commit();
        // Nothing left to roll back to
        claims.rollback();

        assertEquals(BigInteger.TEN, claims.balanceOf(BOB, ID));
    }

    @Test
    public void testNegativeAmountsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> claims.mint(ALICE, ID, BigInteger.ONE.negate()));
        assertThrows(IllegalArgumentException.class,
                () -> claims.transfer(ALICE, BOB, ID, BigInteger.ONE.negate()));
    }
}
