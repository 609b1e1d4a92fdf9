package com.nanosecond.amm.core.hooks;

/**
 * The acknowledgement a hook returns from each callback. A hook that answers a
 * callback with another callback's acknowledgement aborts the operation with
 * {@link com.nanosecond.amm.api.ErrorCode#INVALID_HOOK_RESPONSE}.
 */
public enum HookAck {
    BEFORE_INITIALIZE,
    AFTER_INITIALIZE,
    BEFORE_ADD_LIQUIDITY,
    AFTER_ADD_LIQUIDITY,
    BEFORE_REMOVE_LIQUIDITY,
    AFTER_REMOVE_LIQUIDITY,
    BEFORE_SWAP,
    AFTER_SWAP,
    BEFORE_DONATE,
    AFTER_DONATE
}
