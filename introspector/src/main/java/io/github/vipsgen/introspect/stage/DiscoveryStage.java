package io.github.vipsgen.introspect.stage;

import io.github.vipsgen.introspect.IntrospectionException;
import io.github.vipsgen.introspect.config.IntrospectionConfig;
import io.github.vipsgen.introspect.di.DiscoveryScoped;
import io.github.vipsgen.introspect.inspect.OperationInspector;
import io.github.vipsgen.introspect.runtime.ForeignType;
import io.github.vipsgen.introspect.runtime.TypeRegistry;
import io.github.vipsgen.ir.OperationDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks every subtype of the operation base type and collects a descriptor for each concrete, named one. Types
 * that cannot be described are skipped so that one broken type never hides the rest of the registry.
 */
@DiscoveryScoped
public class DiscoveryStage {

    private static final Logger LOGGER = LoggerFactory.getLogger(DiscoveryStage.class);

    private final TypeRegistry registry;
    private final OperationInspector inspector;
    private final String operationBaseType;

    @Inject
    DiscoveryStage(TypeRegistry registry, OperationInspector inspector, IntrospectionConfig config) {
        this.registry = registry;
        this.inspector = inspector;
        this.operationBaseType = config.getOperationBaseType();
    }

    public DiscoveryResult execute() throws IntrospectionException {
        @Nullable ForeignType base = registry.typeFromName(operationBaseType);
        if (base == null) {
            throw new IntrospectionException("Operation base type " + operationBaseType + " is not registered");
        }

        List<OperationDescriptor> operations = new ArrayList<>();
        int[] visited = {0};
        int[] skipped = {0};
        registry.forEachSubtype(base, type -> {
            visited[0]++;
            if (registry.isAbstract(type)) {
                return;
            }
            @Nullable String shortName = registry.shortName(type);
            if (shortName == null || shortName.isEmpty()) {
                return;
            }
            Optional<OperationDescriptor> descriptor = describe(type, shortName);
            if (descriptor.isPresent()) {
                operations.add(descriptor.get());
            } else {
                skipped[0]++;
            }
        });

        LOGGER.info(
                "Discovered {} operations under {} ({} types visited, {} skipped)",
                operations.size(),
                operationBaseType,
                visited[0],
                skipped[0]);
        return new DiscoveryResult(operations, visited[0], skipped[0]);
    }

    private Optional<OperationDescriptor> describe(ForeignType type, String shortName) {
        try {
            return inspector.inspect(type, shortName);
        } catch (IllegalStateException | IllegalArgumentException e) {
            LOGGER.warn("Skipping {} ({}): {}", shortName, type.name(), e.getMessage());
            return Optional.empty();
        }
    }
}
