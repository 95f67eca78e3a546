package io.github.vipsgen.introspect;

import io.github.vipsgen.introspect.di.DiscoveryScoped;
import io.github.vipsgen.introspect.stage.DiscoveryResult;
import io.github.vipsgen.introspect.stage.DiscoveryStage;
import io.github.vipsgen.introspect.stage.NormalizeStage;
import javax.inject.Inject;

@DiscoveryScoped
public class Pipeline {

    private final DiscoveryStage discoveryStage;
    private final NormalizeStage normalizeStage;

    @Inject
    Pipeline(DiscoveryStage discoveryStage, NormalizeStage normalizeStage) {
        this.discoveryStage = discoveryStage;
        this.normalizeStage = normalizeStage;
    }

    public IntrospectionResult process() throws IntrospectionException {
        DiscoveryResult discovery = discoveryStage.execute();
        return normalizeStage.execute(discovery);
    }
}
