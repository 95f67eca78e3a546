package io.github.vipsgen.introspect.runtime;

public interface BooleanParamSpec extends ParamSpec {

    boolean defaultValue();
}
