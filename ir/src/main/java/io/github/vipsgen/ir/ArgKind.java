package io.github.vipsgen.ir;

/**
 * Normalized argument kinds. Declaration order matches the numeric codes binding generators key on.
 */
public enum ArgKind {
    UNKNOWN("unknown"),
    IMAGE("image"),
    DOUBLE("double"),
    INT("int"),
    BOOL("bool"),
    STRING("string"),
    ENUM("enum"),
    FLAGS("flags"),
    ARRAY_DOUBLE("[]double"),
    ARRAY_INT("[]int"),
    ARRAY_IMAGE("[]image"),
    BLOB("blob"),
    INTERPOLATE("interpolate"),
    SOURCE("source"),
    TARGET("target");

    private final String displayName;

    ArgKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /** Kinds that carry default/min/max values. */
    public boolean isNumericShaped() {
        return this == DOUBLE || this == INT || this == BOOL || this == ENUM;
    }

    public boolean isEnumerated() {
        return this == ENUM || this == FLAGS;
    }
}
