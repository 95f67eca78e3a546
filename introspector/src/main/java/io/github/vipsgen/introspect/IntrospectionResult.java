package io.github.vipsgen.introspect;

import static java.util.Collections.unmodifiableList;

import io.github.vipsgen.ir.OperationDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Operations found by one discovery run, sorted by name and unique by name. */
public final class IntrospectionResult {

    private final List<OperationDescriptor> operations;
    private final int discoveredCount;
    private final List<String> droppedDuplicates;

    public IntrospectionResult(
            List<OperationDescriptor> operations, int discoveredCount, List<String> droppedDuplicates) {
        this.operations = unmodifiableList(new ArrayList<>(operations));
        this.discoveredCount = discoveredCount;
        this.droppedDuplicates = unmodifiableList(new ArrayList<>(droppedDuplicates));
    }

    public List<OperationDescriptor> getOperations() {
        return operations;
    }

    public Optional<OperationDescriptor> operation(String name) {
        return operations.stream().filter(op -> op.getName().equals(name)).findFirst();
    }

    /** Descriptors produced before duplicate names were dropped. */
    public int getDiscoveredCount() {
        return discoveredCount;
    }

    public List<String> getDroppedDuplicates() {
        return droppedDuplicates;
    }
}
