package io.github.vipsgen.introspect.config;

import static java.util.Collections.emptyMap;
import static java.util.Collections.emptySet;
import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Generator-facing policy applied on top of the introspected operations: which operations are hand-written
 * elsewhere, category corrections for operations without an abstract category ancestor, and the binding names of
 * enumerated types.
 */
public final class BindingConfig {

    private final Set<String> excludedOperations;
    private final Map<String, String> categoryOverrides;
    private final Map<String, String> categoryAliases;
    private final Map<String, String> enumBindingNames;
    private final Map<String, String> versionIntroduced;

    @JsonCreator
    public BindingConfig(
            @JsonProperty("excludedOperations") @Nullable Set<String> excludedOperations,
            @JsonProperty("categoryOverrides") @Nullable Map<String, String> categoryOverrides,
            @JsonProperty("categoryAliases") @Nullable Map<String, String> categoryAliases,
            @JsonProperty("enumBindingNames") @Nullable Map<String, String> enumBindingNames,
            @JsonProperty("versionIntroduced") @Nullable Map<String, String> versionIntroduced) {
        this.excludedOperations = copyOf(excludedOperations);
        this.categoryOverrides = copyOf(categoryOverrides);
        this.categoryAliases = copyOf(categoryAliases);
        this.enumBindingNames = copyOf(enumBindingNames);
        this.versionIntroduced = copyOf(versionIntroduced);
    }

    public static BindingConfig empty() {
        return new BindingConfig(emptySet(), emptyMap(), emptyMap(), emptyMap(), emptyMap());
    }

    @JsonProperty("excludedOperations")
    public Set<String> getExcludedOperations() {
        return excludedOperations;
    }

    @JsonProperty("categoryOverrides")
    public Map<String, String> getCategoryOverrides() {
        return categoryOverrides;
    }

    @JsonProperty("categoryAliases")
    public Map<String, String> getCategoryAliases() {
        return categoryAliases;
    }

    @JsonProperty("enumBindingNames")
    public Map<String, String> getEnumBindingNames() {
        return enumBindingNames;
    }

    /** Operation name to the {@code major.minor} library version that introduced it. */
    @JsonProperty("versionIntroduced")
    public Map<String, String> getVersionIntroduced() {
        return versionIntroduced;
    }

    private static Set<String> copyOf(@Nullable Set<String> values) {
        return values == null ? emptySet() : unmodifiableSet(new LinkedHashSet<>(values));
    }

    private static Map<String, String> copyOf(@Nullable Map<String, String> values) {
        return values == null ? emptyMap() : unmodifiableMap(new LinkedHashMap<>(values));
    }
}
