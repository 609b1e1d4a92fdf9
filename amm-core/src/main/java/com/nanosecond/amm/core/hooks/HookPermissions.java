package com.nanosecond.amm.core.hooks;

import com.nanosecond.amm.api.Address;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * An immutable set of {@link HookFlag}s.
 * <p>
 * A hook's permissions are fixed by its address: {@link #fromAddress} reads the
 * low 14 bits. A hook also declares them itself
 * ({@link Hook#getHookPermissions()}) and registration fails unless the two
 * agree.
 * </p>
 */
public final class HookPermissions {

    public static final HookPermissions NONE = new HookPermissions(EnumSet.noneOf(HookFlag.class));

    private final EnumSet<HookFlag> flags;

    private HookPermissions(EnumSet<HookFlag> flags) {
        this.flags = flags;
    }

    public static HookPermissions of(HookFlag... flags) {
        EnumSet<HookFlag> set = EnumSet.noneOf(HookFlag.class);
        set.addAll(Arrays.asList(flags));
        return new HookPermissions(set);
    }

    public static HookPermissions fromBits(int bits) {
        EnumSet<HookFlag> set = EnumSet.noneOf(HookFlag.class);
        for (HookFlag flag : HookFlag.values()) {
            if ((bits & flag.mask()) != 0) {
                set.add(flag);
            }
        }
        return new HookPermissions(set);
    }

    public static HookPermissions fromAddress(Address address) {
        return fromBits(address.lowBits(HookFlag.ALL_HOOK_MASK));
    }

    public boolean has(HookFlag flag) {
        return flags.contains(flag);
    }

    public boolean isEmpty() {
        return flags.isEmpty();
    }

    public Set<HookFlag> flags() {
        return Collections.unmodifiableSet(flags);
    }

    public int toBits() {
        int bits = 0;
        for (HookFlag flag : flags) {
            bits |= flag.mask();
        }
        return bits;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HookPermissions)) {
            return false;
        }
        return flags.equals(((HookPermissions) o).flags);
    }

    @Override
    public int hashCode() {
        return flags.hashCode();
    }

    @Override
    public String toString() {
        return "HookPermissions" + flags;
    }
}
