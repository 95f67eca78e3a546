package io.github.vipsgen.introspect.stage;

import static java.util.Collections.unmodifiableList;

import io.github.vipsgen.ir.OperationDescriptor;
import java.util.ArrayList;
import java.util.List;

public final class DiscoveryResult {

    private final List<OperationDescriptor> operations;
    private final int visitedTypes;
    private final int skippedTypes;

    public DiscoveryResult(List<OperationDescriptor> operations, int visitedTypes, int skippedTypes) {
        this.operations = unmodifiableList(new ArrayList<>(operations));
        this.visitedTypes = visitedTypes;
        this.skippedTypes = skippedTypes;
    }

    /** Operations in registry visiting order. */
    public List<OperationDescriptor> getOperations() {
        return operations;
    }

    public int getVisitedTypes() {
        return visitedTypes;
    }

    /** Concrete, named types that produced no descriptor. */
    public int getSkippedTypes() {
        return skippedTypes;
    }
}
