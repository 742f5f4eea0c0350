package io.github.eutro.irgraph.core.types;

import org.jetbrains.annotations.Nullable;

/**
 * The keyword types, and lookup of types that are spelled as a single bare identifier.
 */
public final class BuiltinTypes {
    public static final Type INDEX = new KeywordType("index") {
        @Override
        public boolean isIntegerLike() {
            return true;
        }
    };
    public static final Type NONE = new KeywordType("none");

    private BuiltinTypes() {
    }

    /**
     * Look up a type spelled as a single bare identifier, like {@code i32}, {@code f64} or {@code index}.
     *
     * @param word The identifier.
     * @return The type, or null if the identifier does not name a type.
     */
    public static @Nullable Type forKeyword(String word) {
        switch (word) {
            case "index":
                return INDEX;
            case "none":
                return NONE;
        }
        FloatType ft = FloatType.forKeyword(word);
        if (ft != null) return ft;
        for (IntegerType.Signedness s : new IntegerType.Signedness[]{
                IntegerType.Signedness.UNSIGNED,
                IntegerType.Signedness.SIGNED,
                IntegerType.Signedness.SIGNLESS,
        }) {
            if (word.startsWith(s.prefix) && word.length() > s.prefix.length()) {
                String digits = word.substring(s.prefix.length());
                if (!digits.chars().allMatch(Character::isDigit)) continue;
                if (digits.length() > 7) return null;
                int width = Integer.parseInt(digits);
                if (width == 0) return null;
                return new IntegerType(width, s);
            }
        }
        return null;
    }

    private static class KeywordType extends Type {
        private final String keyword;

        KeywordType(String keyword) {
            this.keyword = keyword;
        }

        @Override
        protected void print(StringBuilder sb) {
            sb.append(keyword);
        }
    }
}
