package io.github.vipsgen.introspect.runtime;

public interface EnumParamSpec extends ParamSpec {

    /** Integer value of the default enum member. */
    int defaultValue();
}
