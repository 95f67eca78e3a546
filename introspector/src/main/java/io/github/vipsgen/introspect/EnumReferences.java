package io.github.vipsgen.introspect;

import io.github.vipsgen.ir.ArgumentDescriptor;
import io.github.vipsgen.ir.OperationDescriptor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;

public final class EnumReferences {

    private EnumReferences() {}

    /** Sorted, de-duplicated enum and flags type names referenced by any argument of the given operations. */
    public static List<String> collect(Collection<OperationDescriptor> operations) {
        TreeSet<String> names = new TreeSet<>();
        for (OperationDescriptor operation : operations) {
            for (ArgumentDescriptor argument : operation.getArguments()) {
                @Nullable String enumTypeName = argument.getEnumTypeName();
                if (enumTypeName != null && !enumTypeName.isEmpty()) {
                    names.add(enumTypeName);
                }
            }
        }
        return new ArrayList<>(names);
    }
}
