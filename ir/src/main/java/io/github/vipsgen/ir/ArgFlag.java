package io.github.vipsgen.ir;

import java.util.EnumSet;
import java.util.Set;

public enum ArgFlag {
    INPUT(1 << 0),
    OUTPUT(1 << 1),
    REQUIRED(1 << 2),
    MODIFY(1 << 3);

    private final int bit;

    ArgFlag(int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }

    public boolean isSetIn(int flags) {
        return (flags & bit) != 0;
    }

    public static int maskOf(ArgFlag... flags) {
        int mask = 0;
        for (ArgFlag flag : flags) {
            mask |= flag.bit;
        }
        return mask;
    }

    public static Set<ArgFlag> decode(int flags) {
        Set<ArgFlag> result = EnumSet.noneOf(ArgFlag.class);
        for (ArgFlag flag : values()) {
            if (flag.isSetIn(flags)) {
                result.add(flag);
            }
        }
        return result;
    }
}
