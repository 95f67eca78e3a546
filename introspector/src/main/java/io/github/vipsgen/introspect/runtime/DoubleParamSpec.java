package io.github.vipsgen.introspect.runtime;

public interface DoubleParamSpec extends ParamSpec {

    double defaultValue();

    double minimum();

    double maximum();
}
