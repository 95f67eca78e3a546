package io.github.vipsgen.introspect.runtime;

/** Fundamental (root) value types of the foreign type system. */
public enum Fundamental {
    BOOLEAN,
    INT,
    UINT,
    LONG,
    ULONG,
    INT64,
    UINT64,
    FLOAT,
    DOUBLE,
    STRING,
    ENUM,
    FLAGS,
    OBJECT,
    BOXED,
    POINTER,
    OTHER;

    public boolean isFloatingPoint() {
        return this == FLOAT || this == DOUBLE;
    }

    public boolean isInteger() {
        return this == INT || this == UINT || this == LONG || this == ULONG || this == INT64 || this == UINT64;
    }
}
