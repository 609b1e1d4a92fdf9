package com.nanosecond.amm.core;

import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class TickBitmapTest {

    private static final int[] INITIALIZED = {-200, -55, -4, 70, 78, 84, 139, 240, 535};

    private TickBitmap bitmap;

    @BeforeEach
    public void setUp() {
        bitmap = new TickBitmap();
        for (int tick : INITIALIZED) {
            bitmap.flipTick(tick, 1);
        }
    }

    @Test
    public void testFlipTogglesAndClearsEmptyWords() {
        TickBitmap fresh = new TickBitmap();
        fresh.flipTick(-230, 1);
        assertTrue(fresh.isInitialized(-230, 1));
        assertEquals(BigInteger.ONE.shiftLeft(26), fresh.getWord(-1));

        fresh.flipTick(-230, 1);
        assertFalse(fresh.isInitialized(-230, 1));
        assertEquals(BigInteger.ZERO, fresh.getWord(-1));
    }

    @Test
    public void testMisalignedTickIsRejected() {
        EngineException e = assertThrows(EngineException.class, () -> bitmap.flipTick(61, 60));
        assertEquals(ErrorCode.TICK_MISALIGNED, e.code());
    }

    @Test
    public void testSearchUpwards() {
        assertNext(84, true, bitmap.nextInitializedTickWithinOneWord(78, 1, false));
        assertNext(78, true, bitmap.nextInitializedTickWithinOneWord(77, 1, false));
        assertNext(-55, true, bitmap.nextInitializedTickWithinOneWord(-56, 1, false));
        // Nothing else in word 1: stop at the word's edge
        assertNext(511, false, bitmap.nextInitializedTickWithinOneWord(255, 1, false));
        assertNext(255, false, bitmap.nextInitializedTickWithinOneWord(240, 1, false));
    }

    @Test
    public void testSearchDownwardsIncludesTheCurrentTick() {
        assertNext(78, true, bitmap.nextInitializedTickWithinOneWord(78, 1, true));
        assertNext(78, true, bitmap.nextInitializedTickWithinOneWord(79, 1, true));
        assertNext(256, false, bitmap.nextInitializedTickWithinOneWord(258, 1, true));
        assertNext(-512, false, bitmap.nextInitializedTickWithinOneWord(-257, 1, true));
        assertNext(-200, true, bitmap.nextInitializedTickWithinOneWord(-56, 1, true));
    }

    @Test
    public void testCompressRoundsTowardsNegativeInfinity() {
        assertEquals(-2, TickBitmap.compress(-61, 60));
        assertEquals(-1, TickBitmap.compress(-60, 60));
        assertEquals(1, TickBitmap.compress(61, 60));

        TickBitmap spaced = new TickBitmap();
        spaced.flipTick(-120, 60);
        assertNext(-120, true, spaced.nextInitializedTickWithinOneWord(-61, 60, true));
    }

    @Test
    public void testUndoRestoresFlippedWords() {
        bitmap.beginUndoLog();
        bitmap.flipTick(78, 1);
        bitmap.flipTick(-1000, 1);
        bitmap.flipTick(-1000, 1);
        bitmap.flipTick(5000, 1);
        bitmap.undo();

        assertTrue(bitmap.isInitialized(78, 1));
        assertFalse(bitmap.isInitialized(-1000, 1));
        assertFalse(bitmap.isInitialized(5000, 1));
        assertEquals(BigInteger.ZERO, bitmap.getWord(5000 >> 8));
    }

    private static void assertNext(int tick, boolean initialized, TickBitmap.NextTick next) {
        assertEquals(tick, next.tick, next.toString());
        assertEquals(initialized, next.initialized, next.toString());
    }
}
