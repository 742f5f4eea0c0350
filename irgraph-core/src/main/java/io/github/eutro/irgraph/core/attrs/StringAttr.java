package io.github.eutro.irgraph.core.attrs;

/**
 * A string constant, printed quoted and escaped.
 */
public final class StringAttr extends Attribute {
    public final String value;

    public StringAttr(String value) {
        this.value = value;
    }

    @Override
    public String kind() {
        return "string";
    }

    @Override
    protected void print(StringBuilder sb) {
        quote(sb, value);
    }

    /**
     * Append {@code s} as a quoted string literal, escaping quotes, backslashes
     * and non-printable characters as {@code \XX} hex escapes.
     *
     * @param sb The builder.
     * @param s  The string.
     */
    public static void quote(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':
                case '\\':
                    sb.append('\\').append(c);
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (c < 0x20 || c == 0x7f) {
                        sb.append('\\').append(String.format("%02X", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        sb.append('"');
    }
}
