package io.github.vipsgen.introspect.di;

import dagger.Module;
import dagger.Provides;
import io.github.vipsgen.introspect.config.IntrospectionConfig;
import io.github.vipsgen.introspect.runtime.ForeignRuntime;
import io.github.vipsgen.introspect.runtime.TypeRegistry;

@Module
public final class IntrospectionModule {

    private final ForeignRuntime runtime;
    private final IntrospectionConfig config;

    public IntrospectionModule(ForeignRuntime runtime, IntrospectionConfig config) {
        this.runtime = runtime;
        this.config = config;
    }

    @Provides
    @DiscoveryScoped
    ForeignRuntime foreignRuntime() {
        return runtime;
    }

    @Provides
    @DiscoveryScoped
    TypeRegistry typeRegistry() {
        return runtime.registry();
    }

    @Provides
    @DiscoveryScoped
    IntrospectionConfig introspectionConfig() {
        return config;
    }
}
