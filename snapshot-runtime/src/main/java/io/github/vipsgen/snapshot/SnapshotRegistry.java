package io.github.vipsgen.snapshot;

import static java.util.stream.Collectors.joining;

import io.github.vipsgen.introspect.IntrospectionException;
import io.github.vipsgen.introspect.runtime.ForeignType;
import io.github.vipsgen.introspect.runtime.Fundamental;
import io.github.vipsgen.introspect.runtime.TypeRegistry;
import io.github.vipsgen.snapshot.SnapshotDocument.TypeEntry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import org.jgrapht.Graphs;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jspecify.annotations.Nullable;

/**
 * Type hierarchy of a snapshot, held as a parent-to-child graph. Children keep registration order, so a pre-order
 * walk reproduces the order the live runtime visits types in.
 */
final class SnapshotRegistry implements TypeRegistry {

    private final DefaultDirectedGraph<SnapshotType, DefaultEdge> hierarchy =
            new DefaultDirectedGraph<>(DefaultEdge.class);
    private final Map<String, SnapshotType> byName = new LinkedHashMap<>();

    private SnapshotRegistry() {}

    static SnapshotRegistry build(SnapshotDocument document) throws IntrospectionException {
        SnapshotRegistry registry = new SnapshotRegistry();
        for (TypeEntry entry : document.getTypes()) {
            if (registry.byName.containsKey(entry.getName())) {
                throw new IntrospectionException("Type " + entry.getName() + " is registered twice");
            }
            if (entry.getFundamental() != null) {
                try {
                    Fundamental.valueOf(entry.getFundamental().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    throw new IntrospectionException(
                            "Type " + entry.getName() + " declares unknown fundamental " + entry.getFundamental(), e);
                }
            }
            SnapshotType type = new SnapshotType(entry, registry);
            registry.byName.put(entry.getName(), type);
            registry.hierarchy.addVertex(type);
        }
        for (SnapshotType type : registry.byName.values()) {
            @Nullable String parentName = type.entry().getParent();
            if (parentName == null) {
                continue;
            }
            @Nullable SnapshotType parent = registry.byName.get(parentName);
            if (parent == null) {
                throw new IntrospectionException(
                        "Type " + type.name() + " derives from unregistered type " + parentName);
            }
            registry.hierarchy.addEdge(parent, type);
        }
        CycleDetector<SnapshotType, DefaultEdge> cycleDetector = new CycleDetector<>(registry.hierarchy);
        if (cycleDetector.detectCycles()) {
            Set<SnapshotType> cycle = cycleDetector.findCycles();
            throw new IntrospectionException("Type hierarchy is cyclic: "
                    + cycle.stream().map(SnapshotType::name).collect(joining(", ")));
        }
        return registry;
    }

    @Override
    public void forEachSubtype(ForeignType base, Consumer<ForeignType> visit) {
        for (SnapshotType child : Graphs.successorListOf(hierarchy, own(base))) {
            visit.accept(child);
            forEachSubtype(child, visit);
        }
    }

    @Override
    public boolean isAbstract(ForeignType type) {
        return own(type).entry().isAbstract();
    }

    @Override
    public @Nullable ForeignType parentOf(ForeignType type) {
        return parent(own(type));
    }

    @Override
    public @Nullable String shortName(ForeignType type) {
        return own(type).entry().getNickname();
    }

    @Override
    public @Nullable ForeignType typeFromName(String typeName) {
        return byName.get(typeName);
    }

    SnapshotType require(String typeName) throws IntrospectionException {
        @Nullable SnapshotType type = byName.get(typeName);
        if (type == null) {
            throw new IntrospectionException("Unknown type " + typeName);
        }
        return type;
    }

    Iterable<SnapshotType> types() {
        return byName.values();
    }

    boolean isA(SnapshotType type, String ancestorName) {
        @Nullable SnapshotType walk = type;
        while (walk != null) {
            if (walk.name().equals(ancestorName)) {
                return true;
            }
            walk = parent(walk);
        }
        return false;
    }

    /** The fundamental declared by the type or its nearest ancestor that declares one. */
    Fundamental fundamentalOf(SnapshotType type) {
        @Nullable SnapshotType walk = type;
        while (walk != null) {
            @Nullable String fundamental = walk.entry().getFundamental();
            if (fundamental != null) {
                return Fundamental.valueOf(fundamental.toUpperCase(Locale.ROOT));
            }
            walk = parent(walk);
        }
        return Fundamental.OTHER;
    }

    SnapshotType own(ForeignType type) {
        if (type instanceof SnapshotType && byName.get(type.name()) == type) {
            return (SnapshotType) type;
        }
        throw new IllegalArgumentException("Type " + type.name() + " does not belong to this snapshot");
    }

    private @Nullable SnapshotType parent(SnapshotType type) {
        List<SnapshotType> parents = Graphs.predecessorListOf(hierarchy, type);
        return parents.isEmpty() ? null : parents.get(0);
    }
}
