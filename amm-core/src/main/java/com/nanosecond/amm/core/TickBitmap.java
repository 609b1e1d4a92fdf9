package com.nanosecond.amm.core;

import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;
import com.nanosecond.amm.api.SafeCast;
import org.agrona.collections.Int2ObjectHashMap;

import java.math.BigInteger;
import java.util.Map;

/**
 * <h1>The Tick Bitmap: "Where is the Next Liquidity?"</h1>
 *
 * <p>
 * A swap walks the price from tick to tick, and only the ticks where some
 * position starts or ends matter. Scanning every tick would be ~1.7 million
 * steps across the full range, so the initialized ticks are kept as bits.
 * </p>
 *
 * <h2>Layout</h2>
 * <p>
 * Ticks are first <b>compressed</b> by the tick spacing (a pool with spacing 60
 * can only use multiples of 60, so tick 120 is bit 2). The compressed index is
 * split into a 16-bit <b>word position</b> ({@code compressed >> 8}) and an
 * 8-bit <b>bit position</b> ({@code compressed & 0xFF}). Each word is a 256-bit
 * value.
 * </p>
 *
 * <table border="1">
 * <tr>
 * <th>Component</th>
 * <th>Technology</th>
 * <th>Purpose (Time Complexity)</th>
 * </tr>
 * <tr>
 * <td><b>Words</b></td>
 * <td>{@link org.agrona.collections.Int2ObjectHashMap}</td>
 * <td><b>O(1)</b> access to a word by position, no boxing of the key.</td>
 * </tr>
 * <tr>
 * <td><b>Search</b></td>
 * <td>Masking + most/least significant bit</td>
 * <td><b>O(1)</b> "next initialized tick within one word".</td>
 * </tr>
 * </table>
 *
 * <p>
 * The search never crosses a word boundary. If nothing is initialized in the
 * current word, it returns the word's edge as an <i>uninitialized</i> tick and
 * the swap loop simply steps there and searches again.
 * </p>
 *
 * <p>
 * Between {@link #beginUndoLog()} and {@link #endUndoLog()} the first flip of
 * each word records the word's previous value, so {@link #undo()} can put back
 * exactly the words a failed session touched.
 * </p>
 */
public class TickBitmap {

    private final Int2ObjectHashMap<BigInteger> words = new Int2ObjectHashMap<>();
    private Int2ObjectHashMap<BigInteger> undoLog;

    /**
     * The result of a one-word search.
     */
    public static class NextTick {
        public final int tick;
        public final boolean initialized;

        public NextTick(int tick, boolean initialized) {
            this.tick = tick;
            this.initialized = initialized;
        }

        @Override
        public String toString() {
            return "NextTick{tick=" + tick + ", initialized=" + initialized + '}';
        }
    }

    /**
     * Floor division of a tick by the spacing (rounds towards negative infinity).
     */
    public static int compress(int tick, int tickSpacing) {
        int compressed = tick / tickSpacing;
        if (tick < 0 && tick % tickSpacing != 0) {
            compressed--;
        }
        return compressed;
    }

    public BigInteger getWord(int wordPos) {
        BigInteger word = words.get(wordPos);
        return word == null ? BigInteger.ZERO : word;
    }

    public boolean isInitialized(int tick, int tickSpacing) {
        if (tick % tickSpacing != 0) {
            return false;
        }
        int compressed = tick / tickSpacing;
        return getWord(compressed >> 8).testBit(compressed & 0xFF);
    }

    /**
     * Toggles the initialized bit of {@code tick}.
     *
     * @throws EngineException {@link ErrorCode#TICK_MISALIGNED} if the tick is not
     *                         a multiple of the spacing
     */
    public void flipTick(int tick, int tickSpacing) {
        if (tick % tickSpacing != 0) {
            throw new EngineException(ErrorCode.TICK_MISALIGNED, tick, tickSpacing);
        }
        int compressed = tick / tickSpacing;
        int wordPos = compressed >> 8;
        int bitPos = compressed & 0xFF;

        BigInteger word = getWord(wordPos);
        if (undoLog != null && !undoLog.containsKey(wordPos)) {
            undoLog.put(wordPos, word);
        }
        BigInteger flipped = word.flipBit(bitPos);
        if (flipped.signum() == 0) {
            words.remove(wordPos);
        } else {
            words.put(wordPos, flipped);
        }
    }

    /**
     * Finds the next initialized tick in the same word as {@code tick}.
     *
     * @param lte search at or below {@code tick} (price going down) when true,
     *            strictly above it otherwise
     */
    public NextTick nextInitializedTickWithinOneWord(int tick, int tickSpacing, boolean lte) {
        int compressed = compress(tick, tickSpacing);

        if (lte) {
            int wordPos = compressed >> 8;
            int bitPos = compressed & 0xFF;
            // All bits at or to the right of bitPos
            BigInteger mask = BigInteger.ONE.shiftLeft(bitPos + 1).subtract(BigInteger.ONE);
            BigInteger masked = getWord(wordPos).and(mask);

            if (masked.signum() != 0) {
                int msb = masked.bitLength() - 1;
                return new NextTick((compressed - (bitPos - msb)) * tickSpacing, true);
            }
            return new NextTick((compressed - bitPos) * tickSpacing, false);
        }

        // Start from the next tick; the current one is already "behind" us
        compressed++;
        int wordPos = compressed >> 8;
        int bitPos = compressed & 0xFF;
        // All bits at or to the left of bitPos
        BigInteger mask = SafeCast.MAX_UINT256.xor(BigInteger.ONE.shiftLeft(bitPos).subtract(BigInteger.ONE));
        BigInteger masked = getWord(wordPos).and(mask);

        if (masked.signum() != 0) {
            int lsb = masked.getLowestSetBit();
            return new NextTick((compressed + (lsb - bitPos)) * tickSpacing, true);
        }
        return new NextTick((compressed + (255 - bitPos)) * tickSpacing, false);
    }

    public void beginUndoLog() {
        undoLog = new Int2ObjectHashMap<>();
    }

    public void endUndoLog() {
        undoLog = null;
    }

    /**
     * Restores every word flipped since {@link #beginUndoLog()} and ends the log.
     */
    public void undo() {
        if (undoLog == null) {
            return;
        }
        for (Map.Entry<Integer, BigInteger> entry : undoLog.entrySet()) {
            if (entry.getValue().signum() == 0) {
                words.remove(entry.getKey().intValue());
            } else {
                words.put(entry.getKey().intValue(), entry.getValue());
            }
        }
        undoLog = null;
    }
}
