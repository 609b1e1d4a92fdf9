package com.nanosecond.amm.core;

import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;

/**
 * <b>LP fee selectors.</b>
 * <p>
 * A {@code PoolKey.fee} is either a static fee in pips (hundredths of a basis
 * point, at most {@link #MAX_LP_FEE}) or exactly {@link #DYNAMIC_FEE_FLAG},
 * meaning the pool's hook sets the fee. A before-swap hook on a dynamic pool
 * may also return a one-off fee tagged with {@link #OVERRIDE_FEE_FLAG}.
 * </p>
 */
public final class LpFees {

    public static final int DYNAMIC_FEE_FLAG = 0x800000;
    public static final int OVERRIDE_FEE_FLAG = 0x400000;
    public static final int REMOVE_OVERRIDE_MASK = 0xBFFFFF;

    public static final int MAX_LP_FEE = 1_000_000;

    private LpFees() {
        // Prevent instantiation
    }

    public static boolean isDynamicFee(int fee) {
        return fee == DYNAMIC_FEE_FLAG;
    }

    public static boolean isValid(int fee) {
        return fee >= 0 && fee <= MAX_LP_FEE;
    }

    public static void validate(int fee) {
        if (!isValid(fee)) {
            throw new EngineException(ErrorCode.LP_FEE_TOO_LARGE, fee);
        }
    }

    /**
     * Dynamic-fee pools start at zero until their hook sets a fee.
     */
    public static int getInitialLpFee(int fee) {
        if (isDynamicFee(fee)) {
            return 0;
        }
        validate(fee);
        return fee;
    }

    public static boolean isOverride(int fee) {
        return (fee & OVERRIDE_FEE_FLAG) != 0;
    }

    public static int removeOverrideFlag(int fee) {
        return fee & REMOVE_OVERRIDE_MASK;
    }

    public static int removeOverrideFlagAndValidate(int fee) {
        int lpFee = removeOverrideFlag(fee);
        validate(lpFee);
        return lpFee;
    }
}
