package io.github.vipsgen.introspect.config;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings of a discovery run. Defaults come from the classpath resource {@value #DEFAULTS_RESOURCE}; a user file
 * passed to {@link #load(Path)} is merged over them field by field (objects merge, everything else replaces).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class IntrospectionConfig {

    public static final String DEFAULTS_RESOURCE = "/vipsgen-defaults.json";

    private static final Logger LOGGER = LoggerFactory.getLogger(IntrospectionConfig.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String runtime;
    private final Map<String, String> runtimeOptions;
    private final String operationBaseType;
    private final List<String> hierarchyRoots;
    private final String sentinelNick;
    private final BindingConfig binding;

    @JsonCreator
    public IntrospectionConfig(
            @JsonProperty("runtime") String runtime,
            @JsonProperty("runtimeOptions") @Nullable Map<String, String> runtimeOptions,
            @JsonProperty("operationBaseType") String operationBaseType,
            @JsonProperty("hierarchyRoots") List<String> hierarchyRoots,
            @JsonProperty("sentinelNick") String sentinelNick,
            @JsonProperty("binding") @Nullable BindingConfig binding) {
        this.runtime = requireNonNull(runtime, "runtime");
        this.runtimeOptions =
                unmodifiableMap(runtimeOptions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(runtimeOptions));
        this.operationBaseType = requireNonNull(operationBaseType, "operationBaseType");
        this.hierarchyRoots = unmodifiableList(new ArrayList<>(requireNonNull(hierarchyRoots, "hierarchyRoots")));
        this.sentinelNick = requireNonNull(sentinelNick, "sentinelNick");
        this.binding = binding == null ? BindingConfig.empty() : binding;
    }

    /**
     * Loads the built-in defaults.
     *
     * @throws ConfigLoadException if the defaults resource is missing or malformed
     */
    public static IntrospectionConfig defaults() throws ConfigLoadException {
        return fromTree(readDefaults());
    }

    /**
     * Loads the defaults and merges the given user file over them.
     *
     * @param configFile JSON file with any subset of the configuration fields
     * @throws ConfigLoadException if either document cannot be read or bound
     */
    public static IntrospectionConfig load(Path configFile) throws ConfigLoadException {
        ObjectNode merged = readDefaults();
        try {
            JsonNode user = MAPPER.readTree(Files.readString(configFile));
            if (!user.isObject()) {
                throw new ConfigLoadException("Configuration in '" + configFile + "' is not a JSON object");
            }
            merge(merged, (ObjectNode) user);
            LOGGER.debug("Merged configuration from {}", configFile);
        } catch (IOException e) {
            throw new ConfigLoadException(String.format("Failed to load configuration from '%s'", configFile), e);
        }
        return fromTree(merged);
    }

    public String getRuntime() {
        return runtime;
    }

    public Map<String, String> getRuntimeOptions() {
        return runtimeOptions;
    }

    public @Nullable String runtimeOption(String key) {
        return runtimeOptions.get(key);
    }

    public String getOperationBaseType() {
        return operationBaseType;
    }

    /** Type names at which the ancestor walk for categories stops. */
    public List<String> getHierarchyRoots() {
        return hierarchyRoots;
    }

    /** Nick of the end-of-list enum entry that never reaches the IR. */
    public String getSentinelNick() {
        return sentinelNick;
    }

    public BindingConfig getBinding() {
        return binding;
    }

    public IntrospectionConfig withRuntime(String runtime, Map<String, String> runtimeOptions) {
        return new IntrospectionConfig(
                runtime, runtimeOptions, operationBaseType, hierarchyRoots, sentinelNick, binding);
    }

    public IntrospectionConfig withBinding(BindingConfig binding) {
        return new IntrospectionConfig(
                runtime, runtimeOptions, operationBaseType, hierarchyRoots, sentinelNick, binding);
    }

    private static ObjectNode readDefaults() throws ConfigLoadException {
        try (InputStream in = IntrospectionConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new ConfigLoadException("Missing configuration resource " + DEFAULTS_RESOURCE);
            }
            JsonNode tree = MAPPER.readTree(in);
            if (!tree.isObject()) {
                throw new ConfigLoadException("Configuration resource " + DEFAULTS_RESOURCE + " is not a JSON object");
            }
            return (ObjectNode) tree;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read configuration resource " + DEFAULTS_RESOURCE, e);
        }
    }

    private static IntrospectionConfig fromTree(ObjectNode tree) throws ConfigLoadException {
        try {
            return MAPPER.treeToValue(tree, IntrospectionConfig.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static void merge(ObjectNode target, ObjectNode overlay) {
        Iterator<Map.Entry<String, JsonNode>> fields = overlay.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                merge((ObjectNode) existing, (ObjectNode) field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }
}
