package io.github.eutro.irgraph.core.text;

final class Token {
    enum Kind {
        BARE_ID("identifier"),
        PERCENT_ID("SSA value name"),
        CARET_ID("block label"),
        AT_ID("symbol reference"),
        HASH_ID("attribute alias"),
        BANG_ID("dialect type"),
        STRING("string"),
        INTEGER("integer"),
        FLOAT("float"),
        LPAREN("'('"),
        RPAREN("')'"),
        LBRACE("'{'"),
        RBRACE("'}'"),
        LBRACKET("'['"),
        RBRACKET("']'"),
        LANGLE("'<'"),
        RANGLE("'>'"),
        COMMA("','"),
        COLON("':'"),
        DOUBLE_COLON("'::'"),
        EQUAL("'='"),
        ARROW("'->'"),
        QUESTION("'?'"),
        STAR("'*'"),
        EOF("end of input"),
        ;

        final String description;

        Kind(String description) {
            this.description = description;
        }
    }

    final Kind kind;
    /**
     * The token's value: the identifier without its sigil, or the unescaped string contents.
     */
    final String text;
    final int start;
    final int end;
    final int line;
    final int column;

    Token(Kind kind, String text, int start, int end, int line, int column) {
        this.kind = kind;
        this.text = text;
        this.start = start;
        this.end = end;
        this.line = line;
        this.column = column;
    }

    boolean is(Kind kind) {
        return this.kind == kind;
    }

    boolean isKeyword(String word) {
        return kind == Kind.BARE_ID && text.equals(word);
    }

    @Override
    public String toString() {
        return kind == Kind.EOF ? kind.description : kind.description + " '" + text + "'";
    }
}
