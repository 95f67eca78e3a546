package io.github.vipsgen.introspect.runtime;

/**
 * A type registered in the foreign runtime, seen through the capability checks argument classification needs.
 * Implementations answer "is-a" questions against the runtime's own hierarchy.
 */
public interface ForeignType {

    /** Registered type name, e.g. {@code VipsImage} or {@code VipsKernel}. */
    String name();

    boolean isImageHandle();

    boolean isInterpolate();

    boolean isSource();

    boolean isTarget();

    boolean isBlob();

    boolean isArrayOfDouble();

    boolean isArrayOfInt();

    boolean isArrayOfImage();

    boolean isEnum();

    boolean isFlags();

    Fundamental fundamental();
}
