package io.github.vipsgen.introspect.runtime;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A transient, reference-counted instance of an operation type. {@link #close()} drops the reference and must be
 * safe to call more than once.
 */
public interface OperationInstance extends AutoCloseable {

    ForeignType type();

    @Nullable
    String description();

    /** Every parameter of the instance in declaration order, including deprecated and internal ones. */
    List<ArgumentSpec> arguments();

    @Override
    void close();
}
