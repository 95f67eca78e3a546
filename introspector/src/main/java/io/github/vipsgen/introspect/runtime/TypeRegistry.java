package io.github.vipsgen.introspect.runtime;

import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * Read-only view over the foreign runtime's type registry.
 *
 * <p>{@link #forEachSubtype} visits types in the runtime's registration order. That order is stable within one
 * process but carries no meaning across library versions; callers needing a deterministic order sort afterwards.
 */
public interface TypeRegistry {

    /** Visits every type transitively deriving from {@code base}, abstract or not, excluding {@code base} itself. */
    void forEachSubtype(ForeignType base, Consumer<ForeignType> visit);

    boolean isAbstract(ForeignType type);

    /** Immediate ancestor, or {@code null} at the hierarchy root. */
    @Nullable
    ForeignType parentOf(ForeignType type);

    /** Canonical nickname used by the foreign ecosystem, or {@code null} for unnamed/internal types. */
    @Nullable
    String shortName(ForeignType type);

    @Nullable
    ForeignType typeFromName(String typeName);
}
