package io.github.vipsgen.snapshot;

import io.github.vipsgen.introspect.runtime.BooleanParamSpec;
import io.github.vipsgen.introspect.runtime.DoubleParamSpec;
import io.github.vipsgen.introspect.runtime.EnumParamSpec;
import io.github.vipsgen.introspect.runtime.ForeignType;
import io.github.vipsgen.introspect.runtime.IntParamSpec;
import io.github.vipsgen.introspect.runtime.ParamSpec;
import io.github.vipsgen.introspect.runtime.UIntParamSpec;
import io.github.vipsgen.snapshot.SnapshotDocument.SpecEntry;
import org.jspecify.annotations.Nullable;

/** Parameter specifications rebuilt from snapshot entries, one class per concrete specification kind. */
final class SnapshotParamSpecs {

    private SnapshotParamSpecs() {}

    static ParamSpec create(String name, ForeignType valueType, @Nullable SpecEntry spec) {
        if (spec == null) {
            return new Plain(name, valueType);
        }
        switch (spec.getKind()) {
            case "double":
                return new DoubleSpec(name, valueType, spec);
            case "int":
                return new IntSpec(name, valueType, spec);
            case "uint":
                return new UIntSpec(name, valueType, spec);
            case "boolean":
                return new BooleanSpec(name, valueType, spec.getDefaultValue() != 0);
            case "enum":
                return new EnumSpec(name, valueType, (int) spec.getDefaultValue());
            default:
                return new Plain(name, valueType);
        }
    }

    static class Plain implements ParamSpec {

        private final String name;
        private final ForeignType valueType;

        Plain(String name, ForeignType valueType) {
            this.name = name;
            this.valueType = valueType;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public ForeignType valueType() {
            return valueType;
        }
    }

    static final class DoubleSpec extends Plain implements DoubleParamSpec {

        private final SpecEntry spec;

        DoubleSpec(String name, ForeignType valueType, SpecEntry spec) {
            super(name, valueType);
            this.spec = spec;
        }

        @Override
        public double defaultValue() {
            return spec.getDefaultValue();
        }

        @Override
        public double minimum() {
            return spec.getMin();
        }

        @Override
        public double maximum() {
            return spec.getMax();
        }
    }

    static final class IntSpec extends Plain implements IntParamSpec {

        private final SpecEntry spec;

        IntSpec(String name, ForeignType valueType, SpecEntry spec) {
            super(name, valueType);
            this.spec = spec;
        }

        @Override
        public int defaultValue() {
            return (int) spec.getDefaultValue();
        }

        @Override
        public int minimum() {
            return (int) spec.getMin();
        }

        @Override
        public int maximum() {
            return (int) spec.getMax();
        }
    }

    static final class UIntSpec extends Plain implements UIntParamSpec {

        private final SpecEntry spec;

        UIntSpec(String name, ForeignType valueType, SpecEntry spec) {
            super(name, valueType);
            this.spec = spec;
        }

        @Override
        public long defaultValue() {
            return (long) spec.getDefaultValue();
        }

        @Override
        public long minimum() {
            return (long) spec.getMin();
        }

        @Override
        public long maximum() {
            return (long) spec.getMax();
        }
    }

    static final class BooleanSpec extends Plain implements BooleanParamSpec {

        private final boolean defaultValue;

        BooleanSpec(String name, ForeignType valueType, boolean defaultValue) {
            super(name, valueType);
            this.defaultValue = defaultValue;
        }

        @Override
        public boolean defaultValue() {
            return defaultValue;
        }
    }

    static final class EnumSpec extends Plain implements EnumParamSpec {

        private final int defaultValue;

        EnumSpec(String name, ForeignType valueType, int defaultValue) {
            super(name, valueType);
            this.defaultValue = defaultValue;
        }

        @Override
        public int defaultValue() {
            return defaultValue;
        }
    }
}
