package io.github.vipsgen.introspect.catalog;

import static java.util.stream.Collectors.toList;

import io.github.vipsgen.introspect.IntrospectionResult;
import io.github.vipsgen.introspect.config.BindingConfig;
import io.github.vipsgen.ir.OperationDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * The discovered operations as a binding generator sees them: with configured category corrections applied and
 * hand-written operations marked as excluded.
 */
public final class BindingCatalog {

    private final List<OperationDescriptor> operations;
    private final BindingConfig config;

    public BindingCatalog(IntrospectionResult result, BindingConfig config) {
        this.operations = result.getOperations();
        this.config = config;
    }

    public List<OperationDescriptor> getOperations() {
        return operations;
    }

    /** Override for the operation first, then the alias table, else the introspected category. */
    public String categoryOf(OperationDescriptor operation) {
        @Nullable String override = config.getCategoryOverrides().get(operation.getName());
        if (override != null) {
            return override;
        }
        return config.getCategoryAliases().getOrDefault(operation.getCategory(), operation.getCategory());
    }

    public boolean isExcluded(OperationDescriptor operation) {
        return config.getExcludedOperations().contains(operation.getName());
    }

    public List<OperationDescriptor> generatable() {
        return operations.stream().filter(op -> !isExcluded(op)).collect(toList());
    }

    /**
     * Generatable operations grouped by effective category, categories in name order.
     *
     * @param categoryFilter only this category when non-null
     */
    public Map<String, List<OperationDescriptor>> byCategory(@Nullable String categoryFilter) {
        Map<String, List<OperationDescriptor>> categories = new TreeMap<>();
        for (OperationDescriptor operation : generatable()) {
            String category = categoryOf(operation);
            if (categoryFilter != null && !categoryFilter.equals(category)) {
                continue;
            }
            categories.computeIfAbsent(category, k -> new ArrayList<>()).add(operation.withCategory(category));
        }
        return categories;
    }

    public Optional<String> bindingName(String enumTypeName) {
        return Optional.ofNullable(config.getEnumBindingNames().get(enumTypeName));
    }

    /** Library version that introduced the operation, for operations newer than the baseline. */
    public Optional<String> minimumVersion(String operationName) {
        return Optional.ofNullable(config.getVersionIntroduced().get(operationName));
    }

    public CoverageReport coverage() {
        Map<String, int[]> counts = new TreeMap<>();
        for (OperationDescriptor operation : operations) {
            int[] row = counts.computeIfAbsent(categoryOf(operation), k -> new int[2]);
            row[isExcluded(operation) ? 1 : 0]++;
        }
        List<CoverageReport.Row> rows = new ArrayList<>();
        counts.forEach((category, row) -> rows.add(new CoverageReport.Row(category, row[0], row[1])));
        return new CoverageReport(rows);
    }
}
