package io.github.vipsgen.snapshot;

import com.google.auto.service.AutoService;
import io.github.vipsgen.introspect.config.IntrospectionConfig;
import io.github.vipsgen.introspect.runtime.ForeignRuntime;
import io.github.vipsgen.introspect.runtime.ForeignRuntimeProvider;
import java.nio.file.Paths;
import org.jspecify.annotations.Nullable;

/**
 * Registers the snapshot runtime under the id {@value #ID}. Reads {@value #PATH_OPTION} (a file) or, failing that,
 * {@value #RESOURCE_OPTION} (a classpath resource) from the runtime options.
 */
@AutoService(ForeignRuntimeProvider.class)
public final class SnapshotRuntimeProvider implements ForeignRuntimeProvider {

    public static final String ID = "snapshot";
    public static final String PATH_OPTION = "snapshot.path";
    public static final String RESOURCE_OPTION = "snapshot.resource";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ForeignRuntime create(IntrospectionConfig config) {
        @Nullable String path = config.runtimeOption(PATH_OPTION);
        if (path != null) {
            return SnapshotRuntime.fromPath(Paths.get(path));
        }
        @Nullable String resource = config.runtimeOption(RESOURCE_OPTION);
        if (resource != null) {
            return SnapshotRuntime.fromResource(resource);
        }
        throw new IllegalArgumentException(
                "Snapshot runtime needs the '" + PATH_OPTION + "' or '" + RESOURCE_OPTION + "' option");
    }
}
