package io.github.eutro.irgraph.core.types;

import org.jetbrains.annotations.Nullable;

/**
 * A type belonging to a dialect the IR knows nothing about, {@code !dialect.name<body>}.
 * The body is kept verbatim.
 */
public final class OpaqueType extends Type {
    public final String name;
    @Nullable
    public final String body;

    public OpaqueType(String name, @Nullable String body) {
        this.name = name;
        this.body = body;
    }

    public String getDialect() {
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    @Override
    protected void print(StringBuilder sb) {
        sb.append('!').append(name);
        if (body != null) sb.append('<').append(body).append('>');
    }
}
