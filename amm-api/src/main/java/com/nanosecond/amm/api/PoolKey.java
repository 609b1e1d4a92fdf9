package com.nanosecond.amm.api;

import java.util.Objects;

/**
 * The immutable identity of a pool: its two currencies (ordered), fee selector,
 * tick spacing and attached hook.
 * <p>
 * Construction does not validate; {@code initialize} rejects keys whose
 * currencies are out of order, whose tick spacing is out of range or whose hook
 * is not registered.
 * </p>
 */
public final class PoolKey {

    private final Currency currency0;
    private final Currency currency1;
    private final int fee;
    private final int tickSpacing;
    private final Address hooks;

    public PoolKey(Currency currency0, Currency currency1, int fee, int tickSpacing, Address hooks) {
        this.currency0 = Objects.requireNonNull(currency0, "currency0");
        this.currency1 = Objects.requireNonNull(currency1, "currency1");
        this.fee = fee;
        this.tickSpacing = tickSpacing;
        this.hooks = hooks == null ? Address.ZERO : hooks;
    }

    public Currency currency0() {
        return currency0;
    }

    public Currency currency1() {
        return currency1;
    }

    public int fee() {
        return fee;
    }

    public int tickSpacing() {
        return tickSpacing;
    }

    public Address hooks() {
        return hooks;
    }

    public boolean hasHooks() {
        return !hooks.isZero();
    }

    public PoolId toId() {
        return PoolId.of(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PoolKey)) {
            return false;
        }
        PoolKey other = (PoolKey) o;
        return fee == other.fee
                && tickSpacing == other.tickSpacing
                && currency0.equals(other.currency0)
                && currency1.equals(other.currency1)
                && hooks.equals(other.hooks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(currency0, currency1, fee, tickSpacing, hooks);
    }

    @Override
    public String toString() {
        return "PoolKey{" +
                "currency0=" + currency0 +
                ", currency1=" + currency1 +
                ", fee=" + fee +
                ", tickSpacing=" + tickSpacing +
                ", hooks=" + hooks +
                '}';
    }
}
