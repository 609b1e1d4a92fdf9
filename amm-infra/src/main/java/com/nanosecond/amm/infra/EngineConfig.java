package com.nanosecond.amm.infra;

import com.nanosecond.amm.api.Address;

/**
 * Engine settings, read from system properties.
 *
 * <pre>
 * amm.ringBufferSize   sequencer ring size, power of two    (default 1024)
 * amm.waitStrategy     blocking | yielding | busy-spin       (default blocking)
 * amm.engineAddress    custody address of the engine          (default 0x...a11ce)
 * amm.ownerAddress     may appoint the protocol fee controller (default 0x...0e)
 * </pre>
 */
public final class EngineConfig {

    public static final String RING_BUFFER_SIZE = "amm.ringBufferSize";
    public static final String WAIT_STRATEGY = "amm.waitStrategy";
    public static final String ENGINE_ADDRESS = "amm.engineAddress";
    public static final String OWNER_ADDRESS = "amm.ownerAddress";

    public enum WaitStrategyType {
        BLOCKING,
        YIELDING,
        BUSY_SPIN
    }

    private final int ringBufferSize;
    private final WaitStrategyType waitStrategy;
    private final Address engineAddress;
    private final Address ownerAddress;

    public EngineConfig(int ringBufferSize, WaitStrategyType waitStrategy, Address engineAddress,
            Address ownerAddress) {
        if (Integer.bitCount(ringBufferSize) != 1) {
            throw new IllegalArgumentException("Ring buffer size must be a power of two: " + ringBufferSize);
        }
        this.ringBufferSize = ringBufferSize;
        this.waitStrategy = waitStrategy;
        this.engineAddress = engineAddress;
        this.ownerAddress = ownerAddress;
    }

    public static EngineConfig fromSystemProperties() {
        int ringBufferSize = Integer.getInteger(RING_BUFFER_SIZE, 1024);
        String wait = System.getProperty(WAIT_STRATEGY, "blocking");
        Address engine = Address.fromHex(System.getProperty(ENGINE_ADDRESS, "0xa11ce"));
        Address owner = Address.fromHex(System.getProperty(OWNER_ADDRESS, "0x0e"));
        return new EngineConfig(ringBufferSize, parseWaitStrategy(wait), engine, owner);
    }

    static WaitStrategyType parseWaitStrategy(String value) {
        switch (value.trim().toLowerCase()) {
            case "blocking":
                return WaitStrategyType.BLOCKING;
            case "yielding":
                return WaitStrategyType.YIELDING;
            case "busy-spin":
                return WaitStrategyType.BUSY_SPIN;
            default:
                throw new IllegalArgumentException("Unknown " + WAIT_STRATEGY + ": " + value);
        }
    }

    public int ringBufferSize() {
        return ringBufferSize;
    }

    public WaitStrategyType waitStrategy() {
        return waitStrategy;
    }

    public Address engineAddress() {
        return engineAddress;
    }

    public Address ownerAddress() {
        return ownerAddress;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "ringBufferSize=" + ringBufferSize +
                ", waitStrategy=" + waitStrategy +
                ", engineAddress=" + engineAddress +
                ", ownerAddress=" + ownerAddress +
                '}';
    }
}
