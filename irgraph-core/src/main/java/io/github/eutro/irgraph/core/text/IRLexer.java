package io.github.eutro.irgraph.core.text;

import org.jetbrains.annotations.Nullable;

/**
 * Splits IR text into {@link Token tokens}, on demand.
 * <p>
 * Some constructs, like the dimension list of a shaped type or the body of a dialect
 * attribute, don't tokenize cleanly; the parser reads those character by character
 * with the {@code raw} methods.
 */
final class IRLexer {
    private final String src;
    private int pos = 0;
    private int line = 1;
    private int lineStart = 0;
    @Nullable
    private Token peeked;
    private int peekedLine;
    private int peekedLineStart;

    IRLexer(String src) {
        this.src = src;
    }

    Token peek() {
        if (peeked == null) {
            peekedLine = line;
            peekedLineStart = lineStart;
            peeked = lex();
        }
        return peeked;
    }

    Token next() {
        Token token = peek();
        peeked = null;
        return token;
    }

    boolean consumeIf(Token.Kind kind) {
        if (peek().is(kind)) {
            next();
            return true;
        }
        return false;
    }

    Token expect(Token.Kind kind, String context) {
        Token token = peek();
        if (!token.is(kind)) {
            throw error(token, "expected " + kind.description + " " + context + ", but found " + token);
        }
        return next();
    }

    IRParseException error(Token at, String message) {
        return new IRParseException(message, at.line, at.column);
    }

    IRParseException errorHere(String message) {
        unpeek();
        return new IRParseException(message, line, pos - lineStart + 1);
    }

    // raw access

    private void unpeek() {
        if (peeked != null) {
            pos = peeked.start;
            line = peekedLine;
            lineStart = peekedLineStart;
            peeked = null;
        }
    }

    /**
     * Whether the character right after the last consumed token is {@code c}, with no whitespace between.
     */
    boolean rawFollowedBy(char c) {
        unpeek();
        return pos < src.length() && src.charAt(pos) == c;
    }

    int rawPeekChar() {
        unpeek();
        skipWhitespace();
        return pos < src.length() ? src.charAt(pos) : -1;
    }

    void rawAdvance() {
        advance();
    }

    /**
     * Read a non-negative decimal integer, character by character.
     */
    String rawDigits() {
        unpeek();
        int start = pos;
        while (pos < src.length() && Character.isDigit(src.charAt(pos))) pos++;
        return src.substring(start, pos);
    }

    /**
     * Read the contents of a {@code <...>} group starting at the next character,
     * which must be {@code <}, returning the text between the brackets.
     */
    String rawAngleBody() {
        unpeek();
        skipWhitespace();
        if (pos >= src.length() || src.charAt(pos) != '<') {
            throw errorHere("expected '<'");
        }
        advance();
        int start = pos;
        int depth = 1;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '"') {
                lexString();
                continue;
            }
            if (c == '-' && pos + 1 < src.length() && src.charAt(pos + 1) == '>') {
                advance();
                advance();
                continue;
            }
            if (c == '<') depth++;
            else if (c == '>' && --depth == 0) {
                String body = src.substring(start, pos);
                advance();
                return body.trim();
            }
            advance();
        }
        throw errorHere("unterminated '<'");
    }

    // lexing

    private void advance() {
        if (src.charAt(pos) == '\n') {
            line++;
            lineStart = pos + 1;
        }
        pos++;
    }

    private void skipWhitespace() {
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '/' && pos + 1 < src.length() && src.charAt(pos + 1) == '/') {
                while (pos < src.length() && src.charAt(pos) != '\n') pos++;
            } else {
                break;
            }
        }
    }

    private Token lex() {
        skipWhitespace();
        int start = pos;
        int tokLine = line;
        int tokCol = pos - lineStart + 1;
        if (pos >= src.length()) {
            return new Token(Token.Kind.EOF, "", pos, pos, tokLine, tokCol);
        }
        char c = src.charAt(pos);
        String text;
        switch (c) {
            // @formatter:off
            case '(': pos++; return make(Token.Kind.LPAREN, start, tokLine, tokCol);
            case ')': pos++; return make(Token.Kind.RPAREN, start, tokLine, tokCol);
            case '{': pos++; return make(Token.Kind.LBRACE, start, tokLine, tokCol);
            case '}': pos++; return make(Token.Kind.RBRACE, start, tokLine, tokCol);
            case '[': pos++; return make(Token.Kind.LBRACKET, start, tokLine, tokCol);
            case ']': pos++; return make(Token.Kind.RBRACKET, start, tokLine, tokCol);
            case '<': pos++; return make(Token.Kind.LANGLE, start, tokLine, tokCol);
            case '>': pos++; return make(Token.Kind.RANGLE, start, tokLine, tokCol);
            case ',': pos++; return make(Token.Kind.COMMA, start, tokLine, tokCol);
            case '=': pos++; return make(Token.Kind.EQUAL, start, tokLine, tokCol);
            case '?': pos++; return make(Token.Kind.QUESTION, start, tokLine, tokCol);
            case '*': pos++; return make(Token.Kind.STAR, start, tokLine, tokCol);
            // @formatter:on
            case ':':
                pos++;
                if (pos < src.length() && src.charAt(pos) == ':') {
                    pos++;
                    return make(Token.Kind.DOUBLE_COLON, start, tokLine, tokCol);
                }
                return make(Token.Kind.COLON, start, tokLine, tokCol);
            case '-':
                if (pos + 1 < src.length() && src.charAt(pos + 1) == '>') {
                    pos += 2;
                    return make(Token.Kind.ARROW, start, tokLine, tokCol);
                }
                if (pos + 1 < src.length() && Character.isDigit(src.charAt(pos + 1))) {
                    return lexNumber(start, tokLine, tokCol);
                }
                break;
            case '"':
                text = lexString();
                return new Token(Token.Kind.STRING, text, start, pos, tokLine, tokCol);
            case '%':
                return lexSigil(Token.Kind.PERCENT_ID, start, tokLine, tokCol, true);
            case '^':
                return lexSigil(Token.Kind.CARET_ID, start, tokLine, tokCol, true);
            case '#':
                return lexSigil(Token.Kind.HASH_ID, start, tokLine, tokCol, true);
            case '!':
                return lexSigil(Token.Kind.BANG_ID, start, tokLine, tokCol, true);
            case '@':
                pos++;
                if (pos < src.length() && src.charAt(pos) == '"') {
                    text = lexString();
                    return new Token(Token.Kind.AT_ID, text, start, pos, tokLine, tokCol);
                }
                pos--;
                return lexSigil(Token.Kind.AT_ID, start, tokLine, tokCol, false);
            default:
                if (Character.isDigit(c)) {
                    return lexNumber(start, tokLine, tokCol);
                }
                if (Character.isLetter(c) || c == '_') {
                    while (pos < src.length() && isIdChar(src.charAt(pos))) pos++;
                    return new Token(Token.Kind.BARE_ID, src.substring(start, pos), start, pos, tokLine, tokCol);
                }
        }
        throw new IRParseException("unexpected character '" + c + "'", tokLine, tokCol);
    }

    private Token make(Token.Kind kind, int start, int tokLine, int tokCol) {
        return new Token(kind, src.substring(start, pos), start, pos, tokLine, tokCol);
    }

    private static boolean isIdChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '.';
    }

    private Token lexSigil(Token.Kind kind, int start, int tokLine, int tokCol, boolean allowDigitStart) {
        pos++;
        int idStart = pos;
        boolean allowDash = kind == Token.Kind.PERCENT_ID || kind == Token.Kind.CARET_ID;
        while (pos < src.length() && (isIdChar(src.charAt(pos)) || allowDash && isDashInName(pos))) {
            pos++;
        }
        if (pos == idStart || !allowDigitStart && Character.isDigit(src.charAt(idStart))) {
            throw new IRParseException("invalid " + kind.description, tokLine, tokCol);
        }
        return new Token(kind, src.substring(idStart, pos), start, pos, tokLine, tokCol);
    }

    private boolean isDashInName(int at) {
        return src.charAt(at) == '-' && (at + 1 >= src.length() || src.charAt(at + 1) != '>');
    }

    private Token lexNumber(int start, int tokLine, int tokCol) {
        if (src.charAt(pos) == '-') pos++;
        if (src.startsWith("0x", pos)) {
            pos += 2;
            int digitsStart = pos;
            while (pos < src.length() && Character.digit(src.charAt(pos), 16) >= 0) pos++;
            if (pos == digitsStart) throw new IRParseException("expected hexadecimal digits", tokLine, tokCol);
            return make(Token.Kind.INTEGER, start, tokLine, tokCol);
        }
        while (pos < src.length() && Character.isDigit(src.charAt(pos))) pos++;
        if (pos < src.length() && src.charAt(pos) == '.') {
            pos++;
            while (pos < src.length() && Character.isDigit(src.charAt(pos))) pos++;
            if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
                int save = pos;
                pos++;
                if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) pos++;
                int expStart = pos;
                while (pos < src.length() && Character.isDigit(src.charAt(pos))) pos++;
                if (pos == expStart) pos = save;
            }
            return make(Token.Kind.FLOAT, start, tokLine, tokCol);
        }
        return make(Token.Kind.INTEGER, start, tokLine, tokCol);
    }

    private String lexString() {
        int tokLine = line;
        int tokCol = pos - lineStart + 1;
        pos++; // opening quote
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= src.length() || src.charAt(pos) == '\n') {
                throw new IRParseException("unterminated string literal", tokLine, tokCol);
            }
            char c = src.charAt(pos++);
            if (c == '"') break;
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (pos >= src.length()) throw new IRParseException("unterminated string literal", tokLine, tokCol);
            char e = src.charAt(pos++);
            switch (e) {
                case '"':
                case '\\':
                    sb.append(e);
                    break;
                case 'n':
                    sb.append('\n');
                    break;
                case 't':
                    sb.append('\t');
                    break;
                default:
                    if (pos < src.length() && Character.digit(e, 16) >= 0 && Character.digit(src.charAt(pos), 16) >= 0) {
                        sb.append((char) Integer.parseInt(src.substring(pos - 1, pos + 1), 16));
                        pos++;
                    } else {
                        throw new IRParseException("unknown escape in string literal", tokLine, tokCol);
                    }
            }
        }
        return sb.toString();
    }
}
