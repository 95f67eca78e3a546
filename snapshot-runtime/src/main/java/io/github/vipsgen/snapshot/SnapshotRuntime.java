package io.github.vipsgen.snapshot;

import static java.util.stream.Collectors.toList;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.vipsgen.introspect.IntrospectionException;
import io.github.vipsgen.introspect.runtime.ArgumentSpec;
import io.github.vipsgen.introspect.runtime.ForeignArgumentFlags;
import io.github.vipsgen.introspect.runtime.ForeignEnumValue;
import io.github.vipsgen.introspect.runtime.ForeignRuntime;
import io.github.vipsgen.introspect.runtime.ForeignType;
import io.github.vipsgen.introspect.runtime.InstantiationFailedException;
import io.github.vipsgen.introspect.runtime.OperationInstance;
import io.github.vipsgen.introspect.runtime.TypeRegistry;
import io.github.vipsgen.snapshot.SnapshotDocument.ArgumentEntry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ForeignRuntime} that replays a registry captured from a live libvips into JSON. The document is read by
 * {@link #init()}; instances are lightweight views but are still counted so that leaked instances show up.
 */
public final class SnapshotRuntime implements ForeignRuntime {

    private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotRuntime.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final DocumentSource source;
    private @Nullable SnapshotRegistry registry;
    private final Map<SnapshotType, List<ArgumentSpec>> arguments = new LinkedHashMap<>();
    private boolean shutDown;
    private int liveInstances;

    private SnapshotRuntime(DocumentSource source) {
        this.source = source;
    }

    public static SnapshotRuntime fromPath(Path path) {
        return new SnapshotRuntime(new DocumentSource() {
            @Override
            public SnapshotDocument read() throws IOException {
                return MAPPER.readValue(Files.readString(path), SnapshotDocument.class);
            }

            @Override
            public String toString() {
                return path.toString();
            }
        });
    }

    public static SnapshotRuntime fromResource(String resource) {
        return new SnapshotRuntime(new DocumentSource() {
            @Override
            public SnapshotDocument read() throws IOException {
                try (InputStream in = SnapshotRuntime.class.getResourceAsStream(resource)) {
                    if (in == null) {
                        throw new IOException("Missing snapshot resource " + resource);
                    }
                    return MAPPER.readValue(in, SnapshotDocument.class);
                }
            }

            @Override
            public String toString() {
                return "classpath:" + resource;
            }
        });
    }

    public static SnapshotRuntime of(SnapshotDocument document) {
        return new SnapshotRuntime(new DocumentSource() {
            @Override
            public SnapshotDocument read() {
                return document;
            }

            @Override
            public String toString() {
                return "in-memory document";
            }
        });
    }

    @Override
    public void init() throws IntrospectionException {
        if (shutDown) {
            throw new IntrospectionException("Snapshot runtime " + source + " has already been shut down");
        }
        if (registry != null) {
            return;
        }
        SnapshotDocument document;
        try {
            document = source.read();
        } catch (IOException e) {
            throw new IntrospectionException("Failed to read snapshot " + source + ": " + e.getMessage(), e);
        }
        SnapshotRegistry built = SnapshotRegistry.build(document);
        Map<SnapshotType, List<ArgumentSpec>> builtArguments = new LinkedHashMap<>();
        for (SnapshotType type : built.types()) {
            builtArguments.put(type, buildArguments(built, type));
        }
        arguments.putAll(builtArguments);
        registry = built;
        LOGGER.info("Loaded {} types from snapshot {}", document.getTypes().size(), source);
    }

    @Override
    public void shutdown() {
        if (liveInstances > 0) {
            LOGGER.warn("Shutting down snapshot runtime with {} unreleased instances", liveInstances);
        }
        registry = null;
        arguments.clear();
        shutDown = true;
    }

    @Override
    public TypeRegistry registry() {
        return started();
    }

    @Override
    public OperationInstance instantiate(ForeignType type) throws InstantiationFailedException {
        SnapshotType own = started().own(type);
        if (own.entry().isAbstract() || !own.entry().isInstantiable()) {
            throw new InstantiationFailedException("Type " + own.name() + " cannot be instantiated");
        }
        liveInstances++;
        return new Instance(own, arguments.get(own));
    }

    @Override
    public List<ForeignEnumValue> enumValues(ForeignType enumType) {
        SnapshotType own = started().own(enumType);
        return own.entry().getValues().stream()
                .map(v -> new ForeignEnumValue(v.getName(), v.getNick(), v.getValue()))
                .collect(toList());
    }

    /** Instances handed out and not yet closed. */
    public int liveInstances() {
        return liveInstances;
    }

    private SnapshotRegistry started() {
        if (registry == null) {
            throw new IllegalStateException("Snapshot runtime " + source + " is not initialized");
        }
        return registry;
    }

    private static List<ArgumentSpec> buildArguments(SnapshotRegistry registry, SnapshotType type)
            throws IntrospectionException {
        List<ArgumentSpec> specs = new ArrayList<>();
        for (ArgumentEntry entry : type.entry().getArguments()) {
            SnapshotType valueType = registry.require(entry.getType());
            int flags = ForeignArgumentFlags.NONE;
            for (String flag : entry.getFlags()) {
                try {
                    flags |= ForeignArgumentFlags.valueOf(flag);
                } catch (IllegalArgumentException e) {
                    throw new IntrospectionException(
                            "Argument " + type.name() + "." + entry.getName() + ": " + e.getMessage(), e);
                }
            }
            specs.add(new ArgumentSpec(
                    SnapshotParamSpecs.create(entry.getName(), valueType, entry.getSpec()), flags, entry.getPriority()));
        }
        return specs;
    }

    private interface DocumentSource {
        SnapshotDocument read() throws IOException;
    }

    private final class Instance implements OperationInstance {

        private final SnapshotType type;
        private final List<ArgumentSpec> arguments;
        private boolean released;

        Instance(SnapshotType type, List<ArgumentSpec> arguments) {
            this.type = type;
            this.arguments = arguments;
        }

        @Override
        public ForeignType type() {
            return type;
        }

        @Override
        public @Nullable String description() {
            return type.entry().getDescription();
        }

        @Override
        public List<ArgumentSpec> arguments() {
            return arguments;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                liveInstances--;
            }
        }
    }
}
