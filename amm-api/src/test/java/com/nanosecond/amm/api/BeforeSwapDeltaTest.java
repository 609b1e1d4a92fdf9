package com.nanosecond.amm.api;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BeforeSwapDeltaTest {

    @Test
    void shouldKeepSpecifiedDeltaInUpperHalf() {
        BeforeSwapDelta delta = BeforeSwapDelta.of(-5, 7);

        BigInteger packed = delta.pack();
        assertEquals(BigInteger.valueOf(7), packed.and(SafeCast.MAX_UINT128));
        assertEquals(SafeCast.TWO_POW_128.subtract(BigInteger.valueOf(5)), packed.shiftRight(128));

        BeforeSwapDelta unpacked = BeforeSwapDelta.unpack(packed);
        assertEquals(BigInteger.valueOf(-5), unpacked.specifiedDelta());
        assertEquals(BigInteger.valueOf(7), unpacked.unspecifiedDelta());
    }

    @Test
    void zeroShouldPackToZero() {
        assertEquals(BigInteger.ZERO, BeforeSwapDelta.ZERO.pack());
        assertTrue(BeforeSwapDelta.unpack(BigInteger.ZERO).isZero());
    }
}
