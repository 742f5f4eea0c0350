package io.github.eutro.irgraph.core;

import io.github.eutro.irgraph.core.ir.Operation;
import io.github.eutro.irgraph.core.ops.OpRegistry;
import io.github.eutro.irgraph.core.text.IRParser;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class Utils {
    @NotNull
    public static String getResourceText(String name) throws IOException {
        try (InputStream stream = Utils.class.getResourceAsStream(name)) {
            if (stream == null) throw new IOException("missing test resource " + name);
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @NotNull
    public static Operation parse(String text) {
        return IRParser.parseModule(text, OpRegistry.builtin());
    }

    /**
     * Collect every operation under {@code root} with the given name, in document order.
     */
    @NotNull
    public static List<Operation> findAll(Operation root, String name) {
        List<Operation> found = new ArrayList<>();
        root.walk(op -> {
            if (op.getName().equals(name)) found.add(op);
        });
        return found;
    }

    @NotNull
    public static Operation findOne(Operation root, String name) {
        List<Operation> found = findAll(root, name);
        if (found.size() != 1) {
            throw new AssertionError("expected one '" + name + "', found " + found.size());
        }
        return found.get(0);
    }
}
