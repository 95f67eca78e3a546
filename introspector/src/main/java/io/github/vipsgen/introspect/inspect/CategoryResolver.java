package io.github.vipsgen.introspect.inspect;

import static java.util.Collections.unmodifiableMap;

import io.github.vipsgen.introspect.config.IntrospectionConfig;
import io.github.vipsgen.introspect.runtime.ForeignType;
import io.github.vipsgen.introspect.runtime.TypeRegistry;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import javax.inject.Inject;
import org.jspecify.annotations.Nullable;

/**
 * Derives an operation's category from the abstract category classes in its ancestry.
 *
 * <p>The walk starts at the immediate parent and ends at the first ancestor found in {@link #ANCESTOR_CATEGORIES},
 * whichever family it belongs to. A more specific category further up is never looked for. Without a match the
 * operation's own short name is its category.
 */
public final class CategoryResolver {

    static final Map<String, String> ANCESTOR_CATEGORIES;

    static {
        Map<String, String> table = new LinkedHashMap<>();
        register(table, "arithmetic", "VipsArithmetic", "VipsBinary", "VipsUnary", "VipsStatistic");
        register(
                table,
                "colour",
                "VipsColour",
                "VipsColourCode",
                "VipsColourDifference",
                "VipsColourSpace",
                "VipsColourTransform");
        register(table, "conversion", "VipsConversion");
        register(table, "convolution", "VipsConvolution");
        register(table, "create", "VipsCreate");
        register(table, "draw", "VipsDraw");
        register(table, "foreign", "VipsForeign", "VipsForeignLoad", "VipsForeignSave");
        register(table, "freqfilt", "VipsFreqfilt");
        register(table, "histogram", "VipsHistogram");
        register(table, "morphology", "VipsMorphology");
        register(table, "resample", "VipsResample");
        ANCESTOR_CATEGORIES = unmodifiableMap(table);
    }

    private final TypeRegistry registry;
    private final Set<String> roots;

    @Inject
    CategoryResolver(TypeRegistry registry, IntrospectionConfig config) {
        this.registry = registry;
        this.roots = new HashSet<>(config.getHierarchyRoots());
    }

    public String resolve(ForeignType operationType, String shortName) {
        @Nullable ForeignType walk = registry.parentOf(operationType);
        while (walk != null && !roots.contains(walk.name())) {
            @Nullable String category = ANCESTOR_CATEGORIES.get(walk.name());
            if (category != null) {
                return category;
            }
            walk = registry.parentOf(walk);
        }
        return shortName;
    }

    private static void register(Map<String, String> table, String category, String... typeNames) {
        for (String typeName : typeNames) {
            table.put(typeName, category);
        }
    }
}
