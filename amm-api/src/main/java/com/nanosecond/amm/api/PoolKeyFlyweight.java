package com.nanosecond.amm.api;

import org.agrona.MutableDirectBuffer;

import java.math.BigInteger;
import java.nio.ByteOrder;

/**
 * <b>The PoolKey Flyweight: the canonical byte form of a pool's identity.</b>
 * <p>
 * A {@link PoolKey} is hashed into its {@link PoolId} from exactly these bytes,
 * so the layout is fixed: five 32-byte big-endian words, each field
 * right-aligned in its word, signed fields sign-extended.
 * </p>
 *
 * <h3>Memory Layout:</h3>
 *
 * <pre>
 *   0          32         64         96         128        160
 *   +----------+----------+----------+----------+----------+
 *   |currency0 |currency1 |   fee    |tickSpace |  hooks   |
 *   +----------+----------+----------+----------+----------+
 *   (20 bytes   (20 bytes  (uint24)   (int24)    (20 bytes
 *    in word)    in word)                         in word)
 * </pre>
 */
public class PoolKeyFlyweight {

    public static final int WORD = 32;

    // Offsets
    public static final int CURRENCY0_OFFSET = 0;
    public static final int CURRENCY1_OFFSET = 32;
    public static final int FEE_OFFSET = 64;
    public static final int TICK_SPACING_OFFSET = 96;
    public static final int HOOKS_OFFSET = 128;

    // Total length in bytes
    public static final int LENGTH = 160;

    private static final int ADDRESS_BYTES = 20;

    private MutableDirectBuffer buffer;
    private int offset;

    public PoolKeyFlyweight wrap(MutableDirectBuffer buffer, int offset) {
        this.buffer = buffer;
        this.offset = offset;
        return this;
    }

    public PoolKeyFlyweight encode(PoolKey key) {
        currency0(key.currency0().address());
        currency1(key.currency1().address());
        fee(key.fee());
        tickSpacing(key.tickSpacing());
        hooks(key.hooks());
        return this;
    }

    public PoolKey decode() {
        return new PoolKey(Currency.of(currency0()), Currency.of(currency1()), fee(), tickSpacing(), hooks());
    }

    public Address currency0() {
        return getAddress(CURRENCY0_OFFSET);
    }

    public void currency0(Address address) {
        putAddress(CURRENCY0_OFFSET, address);
    }

    public Address currency1() {
        return getAddress(CURRENCY1_OFFSET);
    }

    public void currency1(Address address) {
        putAddress(CURRENCY1_OFFSET, address);
    }

    public int fee() {
        return buffer.getInt(offset + FEE_OFFSET + WORD - 4, ByteOrder.BIG_ENDIAN);
    }

    public void fee(int fee) {
        putInt32Word(FEE_OFFSET, fee);
    }

    public int tickSpacing() {
        return buffer.getInt(offset + TICK_SPACING_OFFSET + WORD - 4, ByteOrder.BIG_ENDIAN);
    }

    public void tickSpacing(int tickSpacing) {
        putInt32Word(TICK_SPACING_OFFSET, tickSpacing);
    }

    public Address hooks() {
        return getAddress(HOOKS_OFFSET);
    }

    public void hooks(Address address) {
        putAddress(HOOKS_OFFSET, address);
    }

    private void putInt32Word(int fieldOffset, int value) {
        // Sign-extend into the upper 28 bytes
        buffer.setMemory(offset + fieldOffset, WORD - 4, value < 0 ? (byte) 0xFF : (byte) 0);
        buffer.putInt(offset + fieldOffset + WORD - 4, value, ByteOrder.BIG_ENDIAN);
    }

    private void putAddress(int fieldOffset, Address address) {
        byte[] raw = address.value().toByteArray();
        // toByteArray may carry a leading sign byte; keep the low 20 bytes only
        int copy = Math.min(raw.length, ADDRESS_BYTES);
        buffer.setMemory(offset + fieldOffset, WORD, (byte) 0);
        buffer.putBytes(offset + fieldOffset + WORD - copy, raw, raw.length - copy, copy);
    }

    private Address getAddress(int fieldOffset) {
        byte[] raw = new byte[ADDRESS_BYTES];
        buffer.getBytes(offset + fieldOffset + WORD - ADDRESS_BYTES, raw);
        return Address.of(new BigInteger(1, raw));
    }

    @Override
    public String toString() {
        if (buffer == null) {
            return "PoolKeyFlyweight{unwrapped}";
        }
        return "PoolKeyFlyweight{" +
                "currency0=" + currency0() +
                ", currency1=" + currency1() +
                ", fee=" + fee() +
                ", tickSpacing=" + tickSpacing() +
                ", hooks=" + hooks() +
                '}';
    }
}
