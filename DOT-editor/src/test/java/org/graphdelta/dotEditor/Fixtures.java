package org.graphdelta.dotEditor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/** Access to the files under src/test/resources. */
public final class Fixtures {
    private Fixtures() {}

    public static final String EXAMPLE =
            "digraph Example { A [label=\"Node A\"]; B [label=\"Node B\"]; A -> B [label=\"edge\"]; }";

    public static String read(String name) {
        try (InputStream stream = Fixtures.class.getResourceAsStream("/" + name)) {
            Objects.requireNonNull(stream, () -> "Missing test resource " + name);
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static String kitchenSink() {
        return read("kitchen_sink.dot");
    }
}
