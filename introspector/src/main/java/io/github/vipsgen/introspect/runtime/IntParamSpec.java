package io.github.vipsgen.introspect.runtime;

public interface IntParamSpec extends ParamSpec {

    int defaultValue();

    int minimum();

    int maximum();
}
