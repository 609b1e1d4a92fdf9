package com.nanosecond.amm.api;

/**
 * Every way an engine operation can fail, grouped by {@link Category}.
 */
public enum ErrorCode {
    // Session discipline
    ALREADY_UNLOCKED(Category.SESSION),
    MANAGER_LOCKED(Category.SESSION),
    CURRENCY_NOT_SETTLED(Category.SESSION),
    SESSION_ABORTED(Category.SESSION),

    // Pool lifecycle
    POOL_ALREADY_INITIALIZED(Category.POOL_LIFECYCLE),
    POOL_NOT_INITIALIZED(Category.POOL_LIFECYCLE),
    CURRENCIES_OUT_OF_ORDER_OR_EQUAL(Category.POOL_LIFECYCLE),
    TICK_SPACING_TOO_LARGE(Category.POOL_LIFECYCLE),
    TICK_SPACING_TOO_SMALL(Category.POOL_LIFECYCLE),
    NO_LIQUIDITY_TO_RECEIVE_FEES(Category.POOL_LIFECYCLE),

    // Swap
    SWAP_AMOUNT_CANNOT_BE_ZERO(Category.SWAP),
    PRICE_LIMIT_ALREADY_EXCEEDED(Category.SWAP),
    PRICE_LIMIT_OUT_OF_BOUNDS(Category.SWAP),
    INVALID_FEE_FOR_EXACT_OUT(Category.SWAP),

    // Ticks and positions
    INVALID_TICK(Category.TICK),
    INVALID_SQRT_PRICE(Category.TICK),
    TICKS_MISORDERED(Category.TICK),
    TICK_LOWER_OUT_OF_BOUNDS(Category.TICK),
    TICK_UPPER_OUT_OF_BOUNDS(Category.TICK),
    TICK_MISALIGNED(Category.TICK),
    TICK_LIQUIDITY_OVERFLOW(Category.TICK),
    CANNOT_UPDATE_EMPTY_POSITION(Category.TICK),

    // Extensions
    INVALID_HOOK_RESPONSE(Category.HOOK),
    HOOK_ADDRESS_NOT_VALID(Category.HOOK),
    HOOK_NOT_IMPLEMENTED(Category.HOOK),
    HOOK_DELTA_EXCEEDS_SWAP_AMOUNT(Category.HOOK),
    UNAUTHORIZED_DYNAMIC_LP_FEE_UPDATE(Category.HOOK),

    // Ledger
    MUST_CLEAR_EXACT_POSITIVE_DELTA(Category.LEDGER),
    INSUFFICIENT_BALANCE(Category.LEDGER),
    INSUFFICIENT_PERMISSION(Category.LEDGER),

    // Arithmetic
    SAFE_CAST_OVERFLOW(Category.ARITHMETIC),
    LIQUIDITY_UNDERFLOW(Category.ARITHMETIC),
    MUL_DIV_OVERFLOW(Category.ARITHMETIC),
    PRICE_OVERFLOW(Category.ARITHMETIC),
    NOT_ENOUGH_LIQUIDITY(Category.ARITHMETIC),
    INVALID_PRICE_OR_LIQUIDITY(Category.ARITHMETIC),

    // Fees
    LP_FEE_TOO_LARGE(Category.FEE),
    PROTOCOL_FEE_TOO_LARGE(Category.FEE),
    PROTOCOL_FEE_CURRENCY_SYNCED(Category.FEE),

    // Permissions
    INVALID_CALLER(Category.PERMISSION);

    public enum Category {
        SESSION,
        POOL_LIFECYCLE,
        SWAP,
        TICK,
        HOOK,
        LEDGER,
        ARITHMETIC,
        FEE,
        PERMISSION
    }

    private final Category category;

    ErrorCode(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }
}
