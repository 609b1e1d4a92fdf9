package com.nanosecond.amm.api;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * <b>The single failure type of the engine.</b>
 * <p>
 * Every failure carries an {@link ErrorCode} and the offending values (the fee
 * that was too large, the tick that was misaligned, ...). Nothing catches these
 * inside the engine: the exception unwinds to {@code unlock}, which rolls the
 * whole session back and rethrows it to the caller. A callback that catches
 * one does not save its session: the first failure marks the session aborted.
 * </p>
 */
public class EngineException extends RuntimeException {

    private final ErrorCode code;
    private final List<Object> values;

    public EngineException(ErrorCode code, Object... values) {
        super(format(code, values));
        this.code = code;
        this.values = Collections.unmodifiableList(Arrays.asList(values));
    }

    public ErrorCode code() {
        return code;
    }

    public ErrorCode.Category category() {
        return code.category();
    }

    public List<Object> values() {
        return values;
    }

    private static String format(ErrorCode code, Object[] values) {
        if (values.length == 0) {
            return code.name();
        }
        return code.name() + Arrays.toString(values);
    }
}
