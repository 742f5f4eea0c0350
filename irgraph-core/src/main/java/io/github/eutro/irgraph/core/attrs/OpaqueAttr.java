package io.github.eutro.irgraph.core.attrs;

import org.jetbrains.annotations.Nullable;

/**
 * An attribute of a dialect the IR knows nothing about, {@code #dialect.name<body>}.
 * The body is kept verbatim.
 */
public final class OpaqueAttr extends Attribute {
    public final String name;
    @Nullable
    public final String body;

    public OpaqueAttr(String name, @Nullable String body) {
        this.name = name;
        this.body = body;
    }

    @Override
    public String kind() {
        return "opaque";
    }

    @Override
    protected void print(StringBuilder sb) {
        sb.append('#').append(name);
        if (body != null) sb.append('<').append(body).append('>');
    }
}
