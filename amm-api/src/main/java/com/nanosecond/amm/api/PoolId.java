package com.nanosecond.amm.api;

import org.agrona.concurrent.UnsafeBuffer;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * A 32-byte SHA3-256 digest of the {@link PoolKeyFlyweight} encoding of a key.
 * The sole lookup key for pool state.
 */
public final class PoolId {

    public static final int LENGTH = 32;

    private static final String DIGEST = "SHA3-256";

    private final byte[] bytes;
    private final int hash;

    private PoolId(byte[] bytes) {
        this.bytes = bytes;
        this.hash = Arrays.hashCode(bytes);
    }

    public static PoolId of(PoolKey key) {
        UnsafeBuffer buffer = new UnsafeBuffer(new byte[PoolKeyFlyweight.LENGTH]);
        new PoolKeyFlyweight().wrap(buffer, 0).encode(key);
        return new PoolId(digest(buffer.byteArray()));
    }

    public static PoolId wrap(byte[] bytes) {
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("PoolId must be " + LENGTH + " bytes, got " + bytes.length);
        }
        return new PoolId(bytes.clone());
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    private static byte[] digest(byte[] input) {
        try {
            return MessageDigest.getInstance(DIGEST).digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST + " not available in this JVM", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PoolId)) {
            return false;
        }
        return Arrays.equals(bytes, ((PoolId) o).bytes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(2 + LENGTH * 2).append("0x");
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }
}
