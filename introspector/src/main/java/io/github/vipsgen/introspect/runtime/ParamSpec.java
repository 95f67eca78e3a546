package io.github.vipsgen.introspect.runtime;

/**
 * Declared specification of one object parameter. Concrete specification kinds that expose a default value or
 * bounds implement one of the sub-interfaces of this type.
 */
public interface ParamSpec {

    String name();

    ForeignType valueType();
}
