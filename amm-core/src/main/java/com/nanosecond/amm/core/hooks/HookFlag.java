package com.nanosecond.amm.core.hooks;

/**
 * The fourteen hook callbacks a pool can dispatch, and the address bit that
 * enables each of them.
 */
public enum HookFlag {
    BEFORE_INITIALIZE(13),
    AFTER_INITIALIZE(12),
    BEFORE_ADD_LIQUIDITY(11),
    AFTER_ADD_LIQUIDITY(10),
    BEFORE_REMOVE_LIQUIDITY(9),
    AFTER_REMOVE_LIQUIDITY(8),
    BEFORE_SWAP(7),
    AFTER_SWAP(6),
    BEFORE_DONATE(5),
    AFTER_DONATE(4),
    BEFORE_SWAP_RETURNS_DELTA(3),
    AFTER_SWAP_RETURNS_DELTA(2),
    AFTER_ADD_LIQUIDITY_RETURNS_DELTA(1),
    AFTER_REMOVE_LIQUIDITY_RETURNS_DELTA(0);

    /** All permission bits of an address. */
    public static final int ALL_HOOK_MASK = (1 << 14) - 1;

    private final int bit;

    HookFlag(int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }

    public int mask() {
        return 1 << bit;
    }

    /**
     * @return the callback a returns-delta flag extends, or null for a plain
     *         callback flag
     */
    public HookFlag requiredFlag() {
        switch (this) {
            case BEFORE_SWAP_RETURNS_DELTA:
                return BEFORE_SWAP;
            case AFTER_SWAP_RETURNS_DELTA:
                return AFTER_SWAP;
            case AFTER_ADD_LIQUIDITY_RETURNS_DELTA:
                return AFTER_ADD_LIQUIDITY;
            case AFTER_REMOVE_LIQUIDITY_RETURNS_DELTA:
                return AFTER_REMOVE_LIQUIDITY;
            default:
                return null;
        }
    }
}
