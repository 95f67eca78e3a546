package io.github.vipsgen.introspect.runtime;

/** Bits of the foreign runtime's per-argument flag word, with the values libvips assigns them. */
public final class ForeignArgumentFlags {

    public static final int NONE = 0;
    public static final int REQUIRED = 1;
    public static final int CONSTRUCT = 2;
    public static final int SET_ONCE = 4;
    public static final int SET_ALWAYS = 8;
    public static final int INPUT = 16;
    public static final int OUTPUT = 32;
    public static final int DEPRECATED = 64;
    public static final int MODIFY = 128;

    private ForeignArgumentFlags() {}

    public static boolean isSet(int flags, int bit) {
        return (flags & bit) != 0;
    }

    public static int valueOf(String flagName) {
        switch (flagName) {
            case "REQUIRED":
                return REQUIRED;
            case "CONSTRUCT":
                return CONSTRUCT;
            case "SET_ONCE":
                return SET_ONCE;
            case "SET_ALWAYS":
                return SET_ALWAYS;
            case "INPUT":
                return INPUT;
            case "OUTPUT":
                return OUTPUT;
            case "DEPRECATED":
                return DEPRECATED;
            case "MODIFY":
                return MODIFY;
            default:
                throw new IllegalArgumentException("Unknown argument flag: " + flagName);
        }
    }
}
