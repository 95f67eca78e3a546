package io.github.vipsgen.introspect.runtime;

import io.github.vipsgen.introspect.config.IntrospectionConfig;

/** Service-loaded factory selecting a {@link ForeignRuntime} by the id named in configuration. */
public interface ForeignRuntimeProvider {

    String id();

    ForeignRuntime create(IntrospectionConfig config);
}
