package io.github.vipsgen.introspect.stage;

import static java.util.Comparator.comparing;

import io.github.vipsgen.introspect.IntrospectionResult;
import io.github.vipsgen.introspect.di.DiscoveryScoped;
import io.github.vipsgen.ir.OperationDescriptor;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import javax.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orders operations by name and keeps one descriptor per name. Several foreign types can share a nickname; the
 * first in registry order wins.
 */
@DiscoveryScoped
public class NormalizeStage {

    private static final Logger LOGGER = LoggerFactory.getLogger(NormalizeStage.class);

    @Inject
    NormalizeStage() {}

    public IntrospectionResult execute(DiscoveryResult discovery) {
        List<OperationDescriptor> sorted = new ArrayList<>(discovery.getOperations());
        // stable, so registry order decides between equal names
        sorted.sort(comparing(OperationDescriptor::getName));

        List<OperationDescriptor> unique = new ArrayList<>();
        List<String> duplicates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (OperationDescriptor operation : sorted) {
            if (seen.add(operation.getName())) {
                unique.add(operation);
            } else {
                duplicates.add(operation.getName());
                LOGGER.warn("Dropping duplicate operation {} [{}]", operation.getName(), operation.getCategory());
            }
        }
        return new IntrospectionResult(unique, discovery.getOperations().size(), duplicates);
    }
}
