package com.nanosecond.amm.core;

import com.nanosecond.amm.api.Address;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Identifies a position inside a pool. The salt lets one owner hold several
 * independent positions over the same range.
 */
public final class PositionKey {

    private final Address owner;
    private final int tickLower;
    private final int tickUpper;
    private final BigInteger salt;

    public PositionKey(Address owner, int tickLower, int tickUpper, BigInteger salt) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.tickLower = tickLower;
        this.tickUpper = tickUpper;
        this.salt = salt == null ? BigInteger.ZERO : salt;
    }

    public Address owner() {
        return owner;
    }

    public int tickLower() {
        return tickLower;
    }

    public int tickUpper() {
        return tickUpper;
    }

    public BigInteger salt() {
        return salt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PositionKey)) {
            return false;
        }
        PositionKey other = (PositionKey) o;
        return tickLower == other.tickLower
                && tickUpper == other.tickUpper
                && owner.equals(other.owner)
                && salt.equals(other.salt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(owner, tickLower, tickUpper, salt);
    }

    @Override
    public String toString() {
        return "PositionKey{" +
                "owner=" + owner +
                ", tickLower=" + tickLower +
                ", tickUpper=" + tickUpper +
                ", salt=" + salt +
                '}';
    }
}
