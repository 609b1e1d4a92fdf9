package com.nanosecond.amm.core;

import com.nanosecond.amm.api.BalanceDelta;
import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;
import com.nanosecond.amm.api.SafeCast;
import com.nanosecond.amm.core.math.FixedPoint;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class PositionTest {

    @Test
    public void testFeesUseTheLiquidityHeldOverTheInterval() {
        Position position = new Position();
        assertEquals(BalanceDelta.ZERO, position.update(BigInteger.valueOf(2), BigInteger.ZERO, BigInteger.ZERO));

        // Growth of 3 per unit, then liquidity doubles: fees are on the old liquidity
        BigInteger growth = FixedPoint.Q128.multiply(BigInteger.valueOf(3));
        BalanceDelta fees = position.update(BigInteger.valueOf(2), growth, BigInteger.ZERO);

        assertEquals(BalanceDelta.of(6, 0), fees);
        assertEquals(BigInteger.valueOf(4), position.liquidity);
        assertEquals(growth, position.feeGrowthInside0LastX128);
    }

    @Test
    public void testFeeGrowthWrapsAround() {
        Position position = new Position();
        position.liquidity = FixedPoint.Q128;
        position.feeGrowthInside1LastX128 = SafeCast.MAX_UINT256;

        // From 2^256 - 1 to 1 is a growth of 2
        BalanceDelta fees = position.update(BigInteger.ZERO, BigInteger.ZERO, BigInteger.ONE);

        assertEquals(BalanceDelta.of(0, 2), fees);
    }

    @Test
    public void testPokingAnEmptyPositionFails() {
        EngineException e = assertThrows(EngineException.class,
                () -> new Position().update(BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO));
        assertEquals(ErrorCode.CANNOT_UPDATE_EMPTY_POSITION, e.code());
    }

    @Test
    public void testRemovingMoreThanHeldFails() {
        Position position = new Position();
        position.update(BigInteger.TEN, BigInteger.ZERO, BigInteger.ZERO);

        EngineException e = assertThrows(EngineException.class,
                () -> position.update(BigInteger.valueOf(-11), BigInteger.ZERO, BigInteger.ZERO));
        assertEquals(ErrorCode.LIQUIDITY_UNDERFLOW, e.code());
    }
}
