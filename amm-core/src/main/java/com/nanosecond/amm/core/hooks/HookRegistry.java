package com.nanosecond.amm.core.hooks;

import com.nanosecond.amm.api.Address;
import com.nanosecond.amm.api.EngineException;
import com.nanosecond.amm.api.ErrorCode;
import com.nanosecond.amm.api.PoolKey;
import com.nanosecond.amm.core.LpFees;
import org.agrona.collections.Object2ObjectHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the hook address in a {@link PoolKey} to a {@link Hook} and the
 * permissions it was registered with.
 * <p>
 * Registration is where a hook's address is checked against what it claims to
 * do. The checked {@link HookPermissions} are stored with the hook and are what
 * dispatch consults afterwards; a pool can only be initialized with a
 * registered hook.
 * </p>
 */
public class HookRegistry {

    private static final Logger log = LoggerFactory.getLogger(HookRegistry.class);

    /**
     * A registered hook and its validated permissions.
     */
    public static final class Registration {
        private final Hook hook;
        private final HookPermissions permissions;

        Registration(Hook hook, HookPermissions permissions) {
            this.hook = hook;
            this.permissions = permissions;
        }

        public Hook hook() {
            return hook;
        }

        public HookPermissions permissions() {
            return permissions;
        }
    }

    private final Object2ObjectHashMap<Address, Registration> registrations = new Object2ObjectHashMap<>();

    /**
     * @throws EngineException {@link ErrorCode#HOOK_ADDRESS_NOT_VALID} if the
     *                         address is zero, if its flag bits differ from the
     *                         declared permissions, or if a returns-delta flag is
     *                         set without the callback it extends
     */
    public void register(Hook hook) {
        Address address = hook.address();
        if (address == null || address.isZero()) {
            throw new EngineException(ErrorCode.HOOK_ADDRESS_NOT_VALID, address);
        }

        HookPermissions declared = hook.getHookPermissions();
        HookPermissions encoded = HookPermissions.fromAddress(address);
        if (!encoded.equals(declared)) {
            throw new EngineException(ErrorCode.HOOK_ADDRESS_NOT_VALID, address, declared, encoded);
        }

        for (HookFlag flag : encoded.flags()) {
            HookFlag required = flag.requiredFlag();
            if (required != null && !encoded.has(required)) {
                throw new EngineException(ErrorCode.HOOK_ADDRESS_NOT_VALID, address, flag);
            }
        }

        registrations.put(address, new Registration(hook, encoded));
        log.info("Registered hook {} with {}", address, encoded);
    }

    /**
     * @return the registration at {@code address}, or null
     */
    public Registration lookup(Address address) {
        return registrations.get(address);
    }

    /**
     * Checks that a pool may be created with {@code key}'s hooks and fee.
     * <ul>
     * <li>No hook: the fee must be static, nobody could update a dynamic one.</li>
     * <li>A hook: it must be registered, and it must either have at least one
     * flag or exist only to set a dynamic fee.</li>
     * </ul>
     */
    public void validate(PoolKey key) {
        Address address = key.hooks();
        boolean dynamic = LpFees.isDynamicFee(key.fee());
        if (address.isZero()) {
            if (dynamic) {
                throw new EngineException(ErrorCode.HOOK_ADDRESS_NOT_VALID, address);
            }
            return;
        }
        Registration registration = registrations.get(address);
        if (registration == null) {
            throw new EngineException(ErrorCode.HOOK_ADDRESS_NOT_VALID, address);
        }
        if (registration.permissions().isEmpty() && !dynamic) {
            throw new EngineException(ErrorCode.HOOK_ADDRESS_NOT_VALID, address);
        }
    }
}
