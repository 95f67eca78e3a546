package io.github.vipsgen.ir;

import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Values of an enumerated type referenced by operation arguments. A descriptor without values means the type name
 * did not resolve to an enumerated type, or that its only entry was the end-of-list sentinel.
 */
public final class EnumDescriptor {

    private final String typeName;
    private final List<EnumValue> values;

    public EnumDescriptor(String typeName, List<EnumValue> values) {
        this.typeName = requireNonNull(typeName, "typeName");
        this.values = unmodifiableList(new ArrayList<>(values));
    }

    public static EnumDescriptor unresolved(String typeName) {
        return new EnumDescriptor(typeName, emptyList());
    }

    public String getTypeName() {
        return typeName;
    }

    public List<EnumValue> getValues() {
        return values;
    }

    /** Whether any value survived resolution; says nothing about whether the name denotes an enum type. */
    public boolean hasValues() {
        return !values.isEmpty();
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EnumDescriptor)) {
            return false;
        }
        EnumDescriptor that = (EnumDescriptor) o;
        return typeName.equals(that.typeName) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeName, values);
    }

    @Override
    public String toString() {
        return "EnumDescriptor{" + typeName + " " + values + "}";
    }
}
