package io.github.vipsgen.introspect.runtime;

import static java.util.Objects.requireNonNull;

/** A parameter of an instantiated operation together with its argument-class flags and priority. */
public final class ArgumentSpec {

    private final ParamSpec paramSpec;
    private final int flags;
    private final int priority;

    public ArgumentSpec(ParamSpec paramSpec, int flags, int priority) {
        this.paramSpec = requireNonNull(paramSpec, "paramSpec");
        this.flags = flags;
        this.priority = priority;
    }

    public ParamSpec getParamSpec() {
        return paramSpec;
    }

    public String getName() {
        return paramSpec.name();
    }

    /** Bitmask of {@link ForeignArgumentFlags}. */
    public int getFlags() {
        return flags;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isDeprecated() {
        return ForeignArgumentFlags.isSet(flags, ForeignArgumentFlags.DEPRECATED);
    }

    public boolean isConstruct() {
        return ForeignArgumentFlags.isSet(flags, ForeignArgumentFlags.CONSTRUCT);
    }
}
