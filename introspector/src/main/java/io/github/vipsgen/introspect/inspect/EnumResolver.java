package io.github.vipsgen.introspect.inspect;

import static java.util.stream.Collectors.toList;

import io.github.vipsgen.introspect.config.IntrospectionConfig;
import io.github.vipsgen.introspect.di.DiscoveryScoped;
import io.github.vipsgen.introspect.runtime.ForeignEnumValue;
import io.github.vipsgen.introspect.runtime.ForeignRuntime;
import io.github.vipsgen.introspect.runtime.ForeignType;
import io.github.vipsgen.introspect.runtime.TypeRegistry;
import io.github.vipsgen.ir.EnumDescriptor;
import io.github.vipsgen.ir.EnumValue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import javax.inject.Inject;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves type names referenced by arguments into their enum values. Names that are unknown, or that denote
 * anything other than an enumerated type (flags types included), yield a descriptor without values.
 */
@DiscoveryScoped
public class EnumResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(EnumResolver.class);

    private final ForeignRuntime runtime;
    private final TypeRegistry registry;
    private final String sentinelNick;

    @Inject
    EnumResolver(ForeignRuntime runtime, TypeRegistry registry, IntrospectionConfig config) {
        this.runtime = runtime;
        this.registry = registry;
        this.sentinelNick = config.getSentinelNick();
    }

    public EnumDescriptor resolve(String typeName) {
        @Nullable ForeignType type = registry.typeFromName(typeName);
        if (type == null || !type.isEnum()) {
            LOGGER.debug("{} is not a registered enum type", typeName);
            return EnumDescriptor.unresolved(typeName);
        }

        List<EnumValue> values = new ArrayList<>();
        for (ForeignEnumValue value : runtime.enumValues(type)) {
            if (sentinelNick.equals(value.getNick())) {
                continue;
            }
            values.add(new EnumValue(
                    value.getName() == null ? "" : value.getName(),
                    value.getNick() == null ? "" : value.getNick(),
                    value.getValue()));
        }
        return new EnumDescriptor(typeName, values);
    }

    public List<EnumDescriptor> resolveAll(Collection<String> typeNames) {
        return typeNames.stream().map(this::resolve).collect(toList());
    }
}
