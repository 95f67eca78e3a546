package io.github.vipsgen.introspect.di;

import dagger.Component;
import io.github.vipsgen.introspect.Pipeline;
import io.github.vipsgen.introspect.inspect.EnumResolver;

@DiscoveryScoped
@Component(modules = IntrospectionModule.class)
public interface IntrospectionComponent {

    Pipeline pipeline();

    EnumResolver enumResolver();

    @Component.Factory
    interface Factory {
        IntrospectionComponent create(IntrospectionModule introspectionModule);
    }
}
