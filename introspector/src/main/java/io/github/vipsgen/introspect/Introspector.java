package io.github.vipsgen.introspect;

import io.github.vipsgen.introspect.config.IntrospectionConfig;
import io.github.vipsgen.introspect.di.DaggerIntrospectionComponent;
import io.github.vipsgen.introspect.di.IntrospectionComponent;
import io.github.vipsgen.introspect.di.IntrospectionModule;
import io.github.vipsgen.introspect.runtime.ForeignRuntime;
import io.github.vipsgen.introspect.runtime.ForeignRuntimeProvider;
import io.github.vipsgen.ir.EnumDescriptor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the introspection engine.
 *
 * <pre>{@code
 * try (Introspector introspector = Introspector.open(config)) {
 *     IntrospectionResult result = introspector.introspect();
 *     List<EnumDescriptor> enums = introspector.introspectEnums(EnumReferences.collect(result.getOperations()));
 * }
 * }</pre>
 *
 * <p>Not thread-safe: the foreign runtime is process-wide state, so callers serialize discovery runs.
 */
public final class Introspector implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Introspector.class);

    private final ForeignRuntime runtime;
    private final IntrospectionComponent component;

    private Introspector(ForeignRuntime runtime, IntrospectionComponent component) {
        this.runtime = runtime;
        this.component = component;
    }

    /**
     * Starts the given runtime and wires the engine around it.
     *
     * @throws IntrospectionException if the runtime fails to initialize; nothing is discovered in that case
     */
    public static Introspector open(ForeignRuntime runtime, IntrospectionConfig config)
            throws IntrospectionException {
        try {
            runtime.init();
        } catch (IntrospectionException e) {
            LOGGER.error("Foreign runtime failed to initialize: {}", e.getMessage());
            throw e;
        }
        IntrospectionComponent component =
                DaggerIntrospectionComponent.factory().create(new IntrospectionModule(runtime, config));
        return new Introspector(runtime, component);
    }

    /** Opens the runtime whose provider id matches {@link IntrospectionConfig#getRuntime()}. */
    public static Introspector open(IntrospectionConfig config) throws IntrospectionException {
        return open(findProvider(config.getRuntime()).create(config), config);
    }

    public IntrospectionResult introspect() throws IntrospectionException {
        return component.pipeline().process();
    }

    public EnumDescriptor introspectEnum(String typeName) {
        return component.enumResolver().resolve(typeName);
    }

    public List<EnumDescriptor> introspectEnums(Collection<String> typeNames) {
        return component.enumResolver().resolveAll(typeNames);
    }

    @Override
    public void close() {
        runtime.shutdown();
    }

    static ForeignRuntimeProvider findProvider(String id) throws IntrospectionException {
        List<String> available = new ArrayList<>();
        for (ForeignRuntimeProvider provider :
                ServiceLoader.load(ForeignRuntimeProvider.class, Introspector.class.getClassLoader())) {
            if (provider.id().equals(id)) {
                return provider;
            }
            available.add(provider.id());
        }
        throw new IntrospectionException("No foreign runtime provider '" + id + "' (available: " + available + ")");
    }
}
