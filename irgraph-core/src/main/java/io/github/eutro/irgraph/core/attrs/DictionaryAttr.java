package io.github.eutro.irgraph.core.attrs;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A dictionary of named attributes, sorted by name.
 */
public final class DictionaryAttr extends Attribute {
    public final SortedMap<String, Attribute> entries;

    public DictionaryAttr(Map<String, Attribute> entries) {
        this.entries = Collections.unmodifiableSortedMap(new TreeMap<>(entries));
    }

    @Override
    public String kind() {
        return "dictionary";
    }

    @Override
    protected void print(StringBuilder sb) {
        printEntries(sb, entries);
    }

    /**
     * Append {@code {a = 1 : i64, b}}, where unit entries are printed by name alone.
     *
     * @param sb      The builder.
     * @param entries The entries.
     */
    public static void printEntries(StringBuilder sb, Map<String, Attribute> entries) {
        sb.append('{');
        boolean first = true;
        for (Map.Entry<String, Attribute> entry : entries.entrySet()) {
            if (!first) sb.append(", ");
            first = false;
            printKey(sb, entry.getKey());
            if (!(entry.getValue() instanceof UnitAttr)) {
                sb.append(" = ").append(entry.getValue());
            }
        }
        sb.append('}');
    }

    private static void printKey(StringBuilder sb, String key) {
        if (SymbolRefAttr.isBareName(key)) {
            sb.append(key);
        } else {
            StringAttr.quote(sb, key);
        }
    }
}
