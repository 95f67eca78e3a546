package io.github.vipsgen.introspect.catalog;

import static java.util.stream.Collectors.joining;

import io.github.vipsgen.ir.ArgumentDescriptor;
import io.github.vipsgen.ir.EnumDescriptor;
import io.github.vipsgen.ir.EnumValue;
import io.github.vipsgen.ir.OperationDescriptor;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Plain-text views of a catalog for reviewing what a generator would see. */
public final class CatalogRenderer {

    private static final String RULE = "-".repeat(50);

    private CatalogRenderer() {}

    public static String renderOperations(BindingCatalog catalog, @Nullable String categoryFilter) {
        Map<String, List<OperationDescriptor>> categories = catalog.byCategory(categoryFilter);
        int generatable = catalog.generatable().size();
        int total = catalog.getOperations().size();

        StringBuilder sb = new StringBuilder();
        sb.append(String.format(
                "Discovered %d operations (%d excluded, %d generatable)%n%n", total, total - generatable, generatable));
        categories.forEach((category, operations) -> {
            sb.append(String.format("=== %s (%d ops) ===%n", category, operations.size()));
            for (OperationDescriptor operation : operations) {
                sb.append(String.format("  %s: %s%n", operation.getName(), operation.getDescription()));
                appendArguments(sb, "required:", operation.requiredInputs());
                appendArguments(sb, "optional:", operation.optionalInputs());
                appendArguments(sb, "outputs: ", operation.outputs());
                sb.append(System.lineSeparator());
            }
        });
        return sb.toString();
    }

    public static String renderEnums(BindingCatalog catalog, List<EnumDescriptor> enums) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Discovered %d enum types%n%n", enums.size()));
        for (EnumDescriptor descriptor : enums) {
            String bindingName = catalog.bindingName(descriptor.getTypeName()).orElse("(unmapped)");
            sb.append(String.format("%s -> %s%n", descriptor.getTypeName(), bindingName));
            for (EnumValue value : descriptor.getValues()) {
                sb.append(String.format(
                        "  %s = %d (nick: %s)%n", value.getSymbolicName(), value.getValue(), value.getNick()));
            }
            sb.append(System.lineSeparator());
        }
        return sb.toString();
    }

    public static String renderCoverage(CoverageReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Coverage Report%n"));
        sb.append(String.format("%-20s %8s %8s %8s%n", "Category", "Generate", "Excluded", "Total"));
        sb.append(RULE).append(System.lineSeparator());
        for (CoverageReport.Row row : report.getRows()) {
            sb.append(String.format(
                    "%-20s %8d %8d %8d%n", row.getCategory(), row.getGenerated(), row.getExcluded(), row.getTotal()));
        }
        sb.append(RULE).append(System.lineSeparator());
        sb.append(String.format(
                "%-20s %8d %8d %8d%n", "TOTAL", report.totalGenerated(), report.totalExcluded(), report.total()));
        return sb.toString();
    }

    static String formatArguments(List<ArgumentDescriptor> arguments) {
        return arguments.stream()
                .map(a -> a.getName() + ":"
                        + (a.getEnumTypeName() != null ? a.getEnumTypeName() : a.getKind().displayName()))
                .collect(joining(", "));
    }

    private static void appendArguments(StringBuilder sb, String label, List<ArgumentDescriptor> arguments) {
        if (!arguments.isEmpty()) {
            sb.append(String.format("    %s %s%n", label, formatArguments(arguments)));
        }
    }
}
