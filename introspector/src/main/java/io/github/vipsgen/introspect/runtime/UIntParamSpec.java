package io.github.vipsgen.introspect.runtime;

/** Unsigned 32-bit specification; values are widened to {@code long} so they stay non-negative. */
public interface UIntParamSpec extends ParamSpec {

    long defaultValue();

    long minimum();

    long maximum();
}
