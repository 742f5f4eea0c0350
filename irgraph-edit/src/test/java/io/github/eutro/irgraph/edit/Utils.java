package io.github.eutro.irgraph.edit;

import io.github.eutro.irgraph.core.backend.DefaultBackend;
import io.github.eutro.irgraph.core.backend.IRBackend;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

public class Utils {
    @NotNull
    public static String getResourceText(String name) throws IOException {
        try (InputStream stream = Utils.class.getResourceAsStream(name)) {
            if (stream == null) throw new IOException("missing test resource " + name);
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * An editor and a session with a test resource loaded.
     */
    public static class Loaded {
        public final IRBackend backend;
        public final GraphEditor editor;
        public final EditSession session = new EditSession();
        public final String text;

        Loaded(IRBackend backend, String text) {
            this.backend = backend;
            this.editor = new GraphEditor(backend);
            this.text = text;
            editor.load(session, text);
        }

        public String print() {
            return editor.print(session);
        }

        public boolean verifies() {
            return backend.verify(session.requireModule()).valid;
        }
    }

    @NotNull
    public static Loaded load(String resource) throws IOException {
        return load(new DefaultBackend(), resource);
    }

    @NotNull
    public static Loaded load(IRBackend backend, String resource) throws IOException {
        return new Loaded(backend, getResourceText(resource));
    }

    @NotNull
    public static Loaded loadText(String text) {
        return new Loaded(new DefaultBackend(), text);
    }
}
