package io.github.eutro.irgraph.core.attrs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A reference to a symbol, {@code @name}, optionally nested, {@code @outer::@inner}.
 */
public final class SymbolRefAttr extends Attribute {
    public final String root;
    public final List<String> nested;

    public SymbolRefAttr(String root, List<String> nested) {
        this.root = root;
        this.nested = Collections.unmodifiableList(new ArrayList<>(nested));
    }

    public SymbolRefAttr(String root) {
        this(root, Collections.emptyList());
    }

    @Override
    public String kind() {
        return "symbol_ref";
    }

    @Override
    protected void print(StringBuilder sb) {
        printSymbol(sb, root);
        for (String name : nested) {
            sb.append("::");
            printSymbol(sb, name);
        }
    }

    private static void printSymbol(StringBuilder sb, String name) {
        sb.append('@');
        if (isBareName(name)) {
            sb.append(name);
        } else {
            StringAttr.quote(sb, name);
        }
    }

    /**
     * Whether {@code name} can be written without quotes, as a bare identifier.
     *
     * @param name The name.
     * @return Whether it is a valid bare identifier.
     */
    public static boolean isBareName(String name) {
        if (name.isEmpty()) return false;
        char first = name.charAt(0);
        if (!(Character.isLetter(first) || first == '_')) return false;
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '.')) return false;
        }
        return true;
    }
}
