package io.github.vipsgen.introspect.inspect;

import io.github.vipsgen.introspect.runtime.ArgumentSpec;
import io.github.vipsgen.introspect.runtime.BooleanParamSpec;
import io.github.vipsgen.introspect.runtime.DoubleParamSpec;
import io.github.vipsgen.introspect.runtime.EnumParamSpec;
import io.github.vipsgen.introspect.runtime.ForeignArgumentFlags;
import io.github.vipsgen.introspect.runtime.ForeignType;
import io.github.vipsgen.introspect.runtime.Fundamental;
import io.github.vipsgen.introspect.runtime.IntParamSpec;
import io.github.vipsgen.introspect.runtime.ParamSpec;
import io.github.vipsgen.introspect.runtime.UIntParamSpec;
import io.github.vipsgen.ir.ArgFlag;
import io.github.vipsgen.ir.ArgKind;
import io.github.vipsgen.ir.ArgumentDescriptor;
import javax.inject.Inject;
import org.jspecify.annotations.Nullable;

/**
 * Maps a foreign parameter onto the normalized argument schema.
 *
 * <p>Kind checks run from the most specific capability to the generic fundamental types: an image array is also a
 * boxed value, an enum also has an integer fundamental, and only the first match counts.
 */
public final class ArgumentClassifier {

    @Inject
    ArgumentClassifier() {}

    public ArgumentDescriptor classify(ArgumentSpec argument) {
        ParamSpec spec = argument.getParamSpec();
        ForeignType valueType = spec.valueType();
        ArgKind kind = kindOf(valueType);
        @Nullable String enumTypeName = kind.isEnumerated() ? valueType.name() : null;

        double defaultValue = 0;
        double min = 0;
        double max = 0;
        if (kind.isNumericShaped()) {
            if (spec instanceof DoubleParamSpec) {
                DoubleParamSpec doubleSpec = (DoubleParamSpec) spec;
                defaultValue = doubleSpec.defaultValue();
                min = doubleSpec.minimum();
                max = doubleSpec.maximum();
            } else if (spec instanceof IntParamSpec) {
                IntParamSpec intSpec = (IntParamSpec) spec;
                defaultValue = intSpec.defaultValue();
                min = intSpec.minimum();
                max = intSpec.maximum();
            } else if (spec instanceof UIntParamSpec) {
                UIntParamSpec uintSpec = (UIntParamSpec) spec;
                defaultValue = uintSpec.defaultValue();
                min = uintSpec.minimum();
                max = uintSpec.maximum();
            } else if (spec instanceof BooleanParamSpec) {
                defaultValue = ((BooleanParamSpec) spec).defaultValue() ? 1.0 : 0.0;
            } else if (spec instanceof EnumParamSpec) {
                defaultValue = ((EnumParamSpec) spec).defaultValue();
            }
        }

        return new ArgumentDescriptor(
                spec.name(),
                kind,
                convertFlags(argument.getFlags()),
                argument.getPriority(),
                defaultValue,
                min,
                max,
                enumTypeName);
    }

    public static ArgKind kindOf(ForeignType type) {
        if (type.isImageHandle()) {
            return ArgKind.IMAGE;
        }
        if (type.isInterpolate()) {
            return ArgKind.INTERPOLATE;
        }
        if (type.isSource()) {
            return ArgKind.SOURCE;
        }
        if (type.isTarget()) {
            return ArgKind.TARGET;
        }
        if (type.isBlob()) {
            return ArgKind.BLOB;
        }
        if (type.isArrayOfDouble()) {
            return ArgKind.ARRAY_DOUBLE;
        }
        if (type.isArrayOfInt()) {
            return ArgKind.ARRAY_INT;
        }
        if (type.isArrayOfImage()) {
            return ArgKind.ARRAY_IMAGE;
        }
        if (type.isEnum()) {
            return ArgKind.ENUM;
        }
        if (type.isFlags()) {
            return ArgKind.FLAGS;
        }

        Fundamental fundamental = type.fundamental();
        if (fundamental.isFloatingPoint()) {
            return ArgKind.DOUBLE;
        }
        if (fundamental.isInteger()) {
            return ArgKind.INT;
        }
        if (fundamental == Fundamental.BOOLEAN) {
            return ArgKind.BOOL;
        }
        if (fundamental == Fundamental.STRING) {
            return ArgKind.STRING;
        }
        return ArgKind.UNKNOWN;
    }

    public static int convertFlags(int foreignFlags) {
        int flags = 0;
        if (ForeignArgumentFlags.isSet(foreignFlags, ForeignArgumentFlags.INPUT)) {
            flags |= ArgFlag.INPUT.bit();
        }
        if (ForeignArgumentFlags.isSet(foreignFlags, ForeignArgumentFlags.OUTPUT)) {
            flags |= ArgFlag.OUTPUT.bit();
        }
        if (ForeignArgumentFlags.isSet(foreignFlags, ForeignArgumentFlags.REQUIRED)) {
            flags |= ArgFlag.REQUIRED.bit();
        }
        if (ForeignArgumentFlags.isSet(foreignFlags, ForeignArgumentFlags.MODIFY)) {
            flags |= ArgFlag.MODIFY.bit();
        }
        return flags;
    }
}
