package io.github.vipsgen.ir;

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * One construction-time argument of an operation.
 *
 * <p>{@code defaultValue}, {@code min} and {@code max} are only meaningful when {@link ArgKind#isNumericShaped()};
 * for every other kind they are zero. {@code enumTypeName} is set only for {@link ArgKind#ENUM} and
 * {@link ArgKind#FLAGS}.
 */
public final class ArgumentDescriptor {

    private final String name;
    private final ArgKind kind;
    private final int flags;
    private final int priority;
    private final double defaultValue;
    private final double min;
    private final double max;
    private final @Nullable String enumTypeName;

    public ArgumentDescriptor(
            String name,
            ArgKind kind,
            int flags,
            int priority,
            double defaultValue,
            double min,
            double max,
            @Nullable String enumTypeName) {
        this.name = requireNonNull(name, "name");
        this.kind = requireNonNull(kind, "kind");
        if (!kind.isNumericShaped() && (defaultValue != 0 || min != 0 || max != 0)) {
            throw new IllegalArgumentException("Argument '" + name + "' of kind " + kind + " cannot carry numeric values");
        }
        if (kind.isEnumerated() == (enumTypeName == null)) {
            throw new IllegalArgumentException("Argument '" + name + "' of kind " + kind
                    + (enumTypeName == null ? " requires" : " cannot have") + " an enum type name");
        }
        this.flags = flags;
        this.priority = priority;
        this.defaultValue = defaultValue;
        this.min = min;
        this.max = max;
        this.enumTypeName = enumTypeName;
    }

    public String getName() {
        return name;
    }

    public ArgKind getKind() {
        return kind;
    }

    public int getFlags() {
        return flags;
    }

    public Set<ArgFlag> getFlagSet() {
        return ArgFlag.decode(flags);
    }

    public int getPriority() {
        return priority;
    }

    public double getDefaultValue() {
        return defaultValue;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public @Nullable String getEnumTypeName() {
        return enumTypeName;
    }

    public boolean isInput() {
        return ArgFlag.INPUT.isSetIn(flags);
    }

    public boolean isOutput() {
        return ArgFlag.OUTPUT.isSetIn(flags);
    }

    public boolean isRequired() {
        return ArgFlag.REQUIRED.isSetIn(flags);
    }

    public boolean isModify() {
        return ArgFlag.MODIFY.isSetIn(flags);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ArgumentDescriptor)) {
            return false;
        }
        ArgumentDescriptor that = (ArgumentDescriptor) o;
        return flags == that.flags
                && priority == that.priority
                && Double.compare(defaultValue, that.defaultValue) == 0
                && Double.compare(min, that.min) == 0
                && Double.compare(max, that.max) == 0
                && name.equals(that.name)
                && kind == that.kind
                && Objects.equals(enumTypeName, that.enumTypeName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind, flags, priority, defaultValue, min, max, enumTypeName);
    }

    @Override
    public String toString() {
        return name + ":" + (enumTypeName != null ? enumTypeName : kind.displayName()) + ArgFlag.decode(flags);
    }
}
