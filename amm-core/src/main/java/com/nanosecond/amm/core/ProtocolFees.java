package com.nanosecond.amm.core;

/**
 * A protocol fee packs two 12-bit directional fees in pips: bits 0..11 apply to
 * zeroForOne swaps, bits 12..23 to oneForZero swaps. Each is capped at
 * {@link #MAX_PROTOCOL_FEE} (0.1%).
 */
public final class ProtocolFees {

    public static final int MAX_PROTOCOL_FEE = 1000;
    public static final int PIPS_DENOMINATOR = 1_000_000;

    private static final int DIRECTION_MASK = 0xFFF;

    private ProtocolFees() {
        // Prevent instantiation
    }

    public static int zeroForOneFee(int protocolFee) {
        return protocolFee & DIRECTION_MASK;
    }

    public static int oneForZeroFee(int protocolFee) {
        return (protocolFee >>> 12) & DIRECTION_MASK;
    }

    public static int pack(int zeroForOneFee, int oneForZeroFee) {
        return (oneForZeroFee << 12) | zeroForOneFee;
    }

    public static boolean isValid(int protocolFee) {
        if (protocolFee < 0 || protocolFee > 0xFFFFFF) {
            return false;
        }
        return zeroForOneFee(protocolFee) <= MAX_PROTOCOL_FEE && oneForZeroFee(protocolFee) <= MAX_PROTOCOL_FEE;
    }

    /**
     * Total fee charged on the input when the protocol takes {@code protocolFee}
     * of the input first and LPs take {@code lpFee} of the remainder.
     */
    public static int calculateSwapFee(int protocolFee, int lpFee) {
        long fee = (long) protocolFee + lpFee - ((long) protocolFee * lpFee) / PIPS_DENOMINATOR;
        return (int) fee;
    }
}
