package com.nanosecond.amm.api;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BalanceDeltaTest {

    @Test
    void shouldPackAmount0IntoUpperHalf() {
        BalanceDelta delta = BalanceDelta.of(1, -1);

        BigInteger expected = BigInteger.ONE.shiftLeft(128).add(SafeCast.MAX_UINT128);
        assertEquals(expected, delta.pack());
        assertEquals(delta, BalanceDelta.unpack(expected));
    }

    @Test
    void shouldRoundTripInt128Extremes() {
        BalanceDelta[] samples = {
                BalanceDelta.ZERO,
                BalanceDelta.of(SafeCast.MIN_INT128, SafeCast.MAX_INT128),
                BalanceDelta.of(SafeCast.MAX_INT128, SafeCast.MIN_INT128),
                BalanceDelta.of(-1, 0),
                BalanceDelta.of(0, -1)
        };
        for (BalanceDelta delta : samples) {
            BigInteger packed = delta.pack();
            assertTrue(packed.signum() >= 0 && packed.bitLength() <= 256, "packed word must be a uint256");
            assertEquals(delta, BalanceDelta.unpack(packed));
        }
    }

    @Test
    void shouldRejectAmountsOutsideInt128() {
        EngineException e = assertThrows(EngineException.class,
                () -> BalanceDelta.of(SafeCast.MAX_INT128.add(BigInteger.ONE), BigInteger.ZERO));
        assertEquals(ErrorCode.SAFE_CAST_OVERFLOW, e.code());
    }

    @Test
    void shouldFailInsteadOfWrappingOnOverflow() {
        BalanceDelta max = BalanceDelta.of(SafeCast.MAX_INT128, BigInteger.ZERO);

        EngineException e = assertThrows(EngineException.class, () -> max.add(BalanceDelta.of(1, 0)));
        assertEquals(ErrorCode.SAFE_CAST_OVERFLOW, e.code());
    }

    @Test
    void addShouldBeCommutativeAndAssociative() {
        Random random = new Random(42);
        for (int i = 0; i < 1000; i++) {
            BalanceDelta a = BalanceDelta.of(random.nextInt(), random.nextInt());
            BalanceDelta b = BalanceDelta.of(random.nextInt(), random.nextInt());
            BalanceDelta c = BalanceDelta.of(random.nextInt(), random.nextInt());

            assertEquals(a.add(b), b.add(a));
            assertEquals(a.add(b).add(c), a.add(b.add(c)));
            assertEquals(a, a.add(b).subtract(b));
        }
    }
}
