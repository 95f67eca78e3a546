package io.github.vipsgen.introspect.inspect;

import io.github.vipsgen.introspect.di.DiscoveryScoped;
import io.github.vipsgen.introspect.runtime.ArgumentSpec;
import io.github.vipsgen.introspect.runtime.ForeignRuntime;
import io.github.vipsgen.introspect.runtime.ForeignType;
import io.github.vipsgen.introspect.runtime.InstantiationFailedException;
import io.github.vipsgen.introspect.runtime.OperationInstance;
import io.github.vipsgen.ir.ArgumentDescriptor;
import io.github.vipsgen.ir.OperationDescriptor;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.inject.Inject;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Describes one concrete operation type by instantiating it, reading its metadata and releasing it again.
 */
@DiscoveryScoped
public class OperationInspector {

    private static final Logger LOGGER = LoggerFactory.getLogger(OperationInspector.class);

    private final ForeignRuntime runtime;
    private final CategoryResolver categoryResolver;
    private final ArgumentClassifier classifier;

    @Inject
    OperationInspector(ForeignRuntime runtime, CategoryResolver categoryResolver, ArgumentClassifier classifier) {
        this.runtime = runtime;
        this.categoryResolver = categoryResolver;
        this.classifier = classifier;
    }

    /**
     * @return the descriptor, or empty when the type cannot be instantiated
     * @throws IllegalStateException if the instance declares two construction arguments with the same name
     */
    public Optional<OperationDescriptor> inspect(ForeignType type, String shortName) {
        try (OperationInstance instance = runtime.instantiate(type)) {
            @Nullable String description = instance.description();
            String category = categoryResolver.resolve(type, shortName);
            List<ArgumentDescriptor> arguments = collectArguments(shortName, instance);
            return Optional.of(new OperationDescriptor(
                    shortName, description == null ? "" : description, category, arguments));
        } catch (InstantiationFailedException e) {
            LOGGER.debug("Skipping {} ({}): {}", shortName, type.name(), e.getMessage());
            return Optional.empty();
        }
    }

    private List<ArgumentDescriptor> collectArguments(String operationName, OperationInstance instance) {
        List<ArgumentDescriptor> arguments = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (ArgumentSpec argument : instance.arguments()) {
            if (argument.isDeprecated() || !argument.isConstruct()) {
                continue;
            }
            if (!names.add(argument.getName())) {
                throw new IllegalStateException(
                        "Operation '" + operationName + "' declares construct argument '" + argument.getName()
                                + "' more than once");
            }
            arguments.add(classifier.classify(argument));
        }
        return arguments;
    }
}
