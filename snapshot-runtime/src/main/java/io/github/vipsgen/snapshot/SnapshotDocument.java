package io.github.vipsgen.snapshot;

import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * JSON dump of a foreign type registry. Types are listed in registration order; a type's parent must be listed
 * before it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SnapshotDocument {

    private final List<TypeEntry> types;

    @JsonCreator
    public SnapshotDocument(@JsonProperty("types") @Nullable List<TypeEntry> types) {
        this.types = copyOf(types);
    }

    public List<TypeEntry> getTypes() {
        return types;
    }

    static <T> List<T> copyOf(@Nullable List<T> values) {
        return values == null ? emptyList() : unmodifiableList(new ArrayList<>(values));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class TypeEntry {

        private final String name;
        private final @Nullable String parent;
        private final boolean isAbstract;
        private final @Nullable String nickname;
        private final @Nullable String fundamental;
        private final boolean instantiable;
        private final @Nullable String description;
        private final List<ArgumentEntry> arguments;
        private final List<ValueEntry> values;

        @JsonCreator
        public TypeEntry(
                @JsonProperty(value = "name", required = true) String name,
                @JsonProperty("parent") @Nullable String parent,
                @JsonProperty("abstract") boolean isAbstract,
                @JsonProperty("nickname") @Nullable String nickname,
                @JsonProperty("fundamental") @Nullable String fundamental,
                @JsonProperty("instantiable") @Nullable Boolean instantiable,
                @JsonProperty("description") @Nullable String description,
                @JsonProperty("arguments") @Nullable List<ArgumentEntry> arguments,
                @JsonProperty("values") @Nullable List<ValueEntry> values) {
            this.name = name;
            this.parent = parent;
            this.isAbstract = isAbstract;
            this.nickname = nickname;
            this.fundamental = fundamental;
            this.instantiable = instantiable == null || instantiable;
            this.description = description;
            this.arguments = copyOf(arguments);
            this.values = copyOf(values);
        }

        public String getName() {
            return name;
        }

        public @Nullable String getParent() {
            return parent;
        }

        public boolean isAbstract() {
            return isAbstract;
        }

        public @Nullable String getNickname() {
            return nickname;
        }

        public @Nullable String getFundamental() {
            return fundamental;
        }

        public boolean isInstantiable() {
            return instantiable;
        }

        public @Nullable String getDescription() {
            return description;
        }

        public List<ArgumentEntry> getArguments() {
            return arguments;
        }

        public List<ValueEntry> getValues() {
            return values;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ArgumentEntry {

        private final String name;
        private final String type;
        private final List<String> flags;
        private final int priority;
        private final @Nullable SpecEntry spec;

        @JsonCreator
        public ArgumentEntry(
                @JsonProperty(value = "name", required = true) String name,
                @JsonProperty(value = "type", required = true) String type,
                @JsonProperty("flags") @Nullable List<String> flags,
                @JsonProperty("priority") int priority,
                @JsonProperty("spec") @Nullable SpecEntry spec) {
            this.name = name;
            this.type = type;
            this.flags = copyOf(flags);
            this.priority = priority;
            this.spec = spec;
        }

        public String getName() {
            return name;
        }

        public String getType() {
            return type;
        }

        public List<String> getFlags() {
            return flags;
        }

        public int getPriority() {
            return priority;
        }

        public @Nullable SpecEntry getSpec() {
            return spec;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class SpecEntry {

        private final String kind;
        private final double defaultValue;
        private final double min;
        private final double max;

        @JsonCreator
        public SpecEntry(
                @JsonProperty(value = "kind", required = true) String kind,
                @JsonProperty("default") double defaultValue,
                @JsonProperty("min") double min,
                @JsonProperty("max") double max) {
            this.kind = kind;
            this.defaultValue = defaultValue;
            this.min = min;
            this.max = max;
        }

        /** One of {@code double}, {@code int}, {@code uint}, {@code boolean}, {@code enum} or {@code other}. */
        public String getKind() {
            return kind;
        }

        public double getDefaultValue() {
            return defaultValue;
        }

        public double getMin() {
            return min;
        }

        public double getMax() {
            return max;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ValueEntry {

        private final @Nullable String name;
        private final @Nullable String nick;
        private final int value;

        @JsonCreator
        public ValueEntry(
                @JsonProperty("name") @Nullable String name,
                @JsonProperty("nick") @Nullable String nick,
                @JsonProperty("value") int value) {
            this.name = name;
            this.nick = nick;
            this.value = value;
        }

        public @Nullable String getName() {
            return name;
        }

        public @Nullable String getNick() {
            return nick;
        }

        public int getValue() {
            return value;
        }
    }
}
