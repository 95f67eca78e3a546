package io.github.vipsgen.snapshot;

import io.github.vipsgen.introspect.runtime.ForeignType;
import io.github.vipsgen.introspect.runtime.Fundamental;
import io.github.vipsgen.snapshot.SnapshotDocument.TypeEntry;

/** A snapshot type; capability checks are is-a queries against the well-known libvips type names. */
final class SnapshotType implements ForeignType {

    static final String IMAGE = "VipsImage";
    static final String INTERPOLATE = "VipsInterpolate";
    static final String SOURCE = "VipsSource";
    static final String TARGET = "VipsTarget";
    static final String BLOB = "VipsBlob";
    static final String ARRAY_DOUBLE = "VipsArrayDouble";
    static final String ARRAY_INT = "VipsArrayInt";
    static final String ARRAY_IMAGE = "VipsArrayImage";

    private final TypeEntry entry;
    private final SnapshotRegistry registry;

    SnapshotType(TypeEntry entry, SnapshotRegistry registry) {
        this.entry = entry;
        this.registry = registry;
    }

    TypeEntry entry() {
        return entry;
    }

    @Override
    public String name() {
        return entry.getName();
    }

    @Override
    public boolean isImageHandle() {
        return registry.isA(this, IMAGE);
    }

    @Override
    public boolean isInterpolate() {
        return registry.isA(this, INTERPOLATE);
    }

    @Override
    public boolean isSource() {
        return registry.isA(this, SOURCE);
    }

    @Override
    public boolean isTarget() {
        return registry.isA(this, TARGET);
    }

    @Override
    public boolean isBlob() {
        return registry.isA(this, BLOB);
    }

    @Override
    public boolean isArrayOfDouble() {
        return registry.isA(this, ARRAY_DOUBLE);
    }

    @Override
    public boolean isArrayOfInt() {
        return registry.isA(this, ARRAY_INT);
    }

    @Override
    public boolean isArrayOfImage() {
        return registry.isA(this, ARRAY_IMAGE);
    }

    @Override
    public boolean isEnum() {
        return fundamental() == Fundamental.ENUM;
    }

    @Override
    public boolean isFlags() {
        return fundamental() == Fundamental.FLAGS;
    }

    @Override
    public Fundamental fundamental() {
        return registry.fundamentalOf(this);
    }

    @Override
    public String toString() {
        return name();
    }
}
