package io.github.vipsgen.introspect.runtime;

import io.github.vipsgen.introspect.IntrospectionException;
import java.util.List;

/**
 * Handle on the foreign image-processing runtime.
 *
 * <p>{@link #init()} must succeed before any other call. It is idempotent: a runtime is started at most once per
 * process and later calls return immediately. The runtime mutates process-wide state, so discovery runs against
 * one runtime must not overlap.
 */
public interface ForeignRuntime {

    void init() throws IntrospectionException;

    void shutdown();

    TypeRegistry registry();

    OperationInstance instantiate(ForeignType type) throws InstantiationFailedException;

    /** Declared entries of an enumerated type, in their native order, sentinel included. */
    List<ForeignEnumValue> enumValues(ForeignType enumType);
}
