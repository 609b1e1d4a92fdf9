package com.nanosecond.amm.core.ledger;

/**
 * A resource whose mutations during a session are made permanent or discarded
 * together with the engine's own state.
 * <p>
 * {@code begin} is called once when a session opens; exactly one of
 * {@code commit} or {@code rollback} follows.
 * </p>
 */
public interface Transactional {

    void begin();

    void commit();

    void rollback();
}
