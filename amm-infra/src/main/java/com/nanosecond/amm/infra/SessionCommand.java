package com.nanosecond.amm.infra;

import com.lmax.disruptor.EventFactory;
import com.nanosecond.amm.api.Address;
import com.nanosecond.amm.core.UnlockCallback;

import java.util.concurrent.CompletableFuture;

/**
 * Event wrapper for a session request in the Ring Buffer.
 */
public class SessionCommand {
    public Address caller;
    public UnlockCallback callback;
    public byte[] payload;
    public CompletableFuture<byte[]> result;

    public void reset() {
        caller = null;
        callback = null;
        payload = null;
        result = null;
    }

    public final static EventFactory<SessionCommand> FACTORY = SessionCommand::new;
}
