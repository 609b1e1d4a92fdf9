package com.nanosecond.amm.api;

import java.math.BigInteger;

/**
 * An asset identity. The zero address denotes the native asset.
 */
public final class Currency implements Comparable<Currency> {

    public static final Currency NATIVE = new Currency(Address.ZERO);

    private final Address address;

    private Currency(Address address) {
        this.address = address;
    }

    public static Currency of(Address address) {
        return address.isZero() ? NATIVE : new Currency(address);
    }

    public static Currency of(long address) {
        return of(Address.of(address));
    }

    /**
     * Inverse of {@link #toId()}: the claim-token id of a currency is its address.
     */
    public static Currency fromId(BigInteger id) {
        return of(Address.of(id));
    }

    public Address address() {
        return address;
    }

    public boolean isNative() {
        return address.isZero();
    }

    public BigInteger toId() {
        return address.value();
    }

    @Override
    public int compareTo(Currency other) {
        return address.compareTo(other.address);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Currency)) {
            return false;
        }
        return address.equals(((Currency) o).address);
    }

    @Override
    public int hashCode() {
        return address.hashCode();
    }

    @Override
    public String toString() {
        return isNative() ? "Currency{native}" : "Currency{" + address + '}';
    }
}
