package io.github.vipsgen.introspect.di;

import static java.lang.annotation.RetentionPolicy.RUNTIME;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import javax.inject.Scope;

/** One instance per opened {@link io.github.vipsgen.introspect.Introspector}. */
@Scope
@Documented
@Retention(RUNTIME)
public @interface DiscoveryScoped {}
