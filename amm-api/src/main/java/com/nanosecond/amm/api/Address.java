package com.nanosecond.amm.api;

import java.math.BigInteger;

/**
 * A 160-bit identity: an actor (caller, hook, recipient) or the backing of a
 * {@link Currency}.
 * <p>
 * Addresses are totally ordered by their unsigned numeric value. For hooks, the
 * low 14 bits double as the permission flags the hook was deployed with.
 * </p>
 */
public final class Address implements Comparable<Address> {

    public static final Address ZERO = new Address(BigInteger.ZERO);

    private static final int HEX_LENGTH = 40;

    private final BigInteger value;

    private Address(BigInteger value) {
        this.value = value;
    }

    public static Address of(BigInteger value) {
        if (value.signum() < 0 || value.compareTo(SafeCast.MAX_UINT160) > 0) {
            throw new IllegalArgumentException("Address out of 160-bit range: " + value);
        }
        return value.signum() == 0 ? ZERO : new Address(value);
    }

    public static Address of(long value) {
        return of(BigInteger.valueOf(value));
    }

    /**
     * @param hex up to 40 hex digits, with or without a {@code 0x} prefix.
     */
    public static Address fromHex(String hex) {
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.isEmpty() || digits.length() > HEX_LENGTH) {
            throw new IllegalArgumentException("Not a 160-bit hex address: " + hex);
        }
        return of(new BigInteger(digits, 16));
    }

    public BigInteger value() {
        return value;
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    /**
     * @return the bits of this address selected by {@code mask} (mask must fit in an int).
     */
    public int lowBits(int mask) {
        return value.intValue() & mask;
    }

    @Override
    public int compareTo(Address other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Address)) {
            return false;
        }
        return value.equals(((Address) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        String hex = value.toString(16);
        StringBuilder sb = new StringBuilder(HEX_LENGTH + 2).append("0x");
        for (int i = hex.length(); i < HEX_LENGTH; i++) {
            sb.append('0');
        }
        return sb.append(hex).toString();
    }
}
