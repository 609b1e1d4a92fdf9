package com.nanosecond.amm.core;

/**
 * The code a caller runs inside a session. Whatever it does through
 * {@code session} must leave every delta at zero by the time it returns.
 */
public interface UnlockCallback {

    byte[] unlockCallback(Session session, byte[] data);
}
