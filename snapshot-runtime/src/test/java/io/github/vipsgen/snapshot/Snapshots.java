package io.github.vipsgen.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;

final class Snapshots {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Snapshots() {}

    /** Parses a document written with single quotes for readability. */
    static SnapshotDocument parse(String json) {
        try {
            return MAPPER.readValue(json.replace('\'', '"'), SnapshotDocument.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
