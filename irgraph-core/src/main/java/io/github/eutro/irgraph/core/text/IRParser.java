package io.github.eutro.irgraph.core.text;

import io.github.eutro.irgraph.core.attrs.*;
import io.github.eutro.irgraph.core.ir.*;
import io.github.eutro.irgraph.core.ops.OpKey;
import io.github.eutro.irgraph.core.ops.OpRegistry;
import io.github.eutro.irgraph.core.types.*;

import java.math.BigInteger;
import java.util.*;

/**
 * A parser for the generic textual form of the IR.
 * <p>
 * An operation is written
 * <pre>{@code %r:2 = "dialect.op"(%a, %b#1) <{prop = 1 : i64}> ({ ...regions... }) {attr} : (f32, f32) -> (f32, f32)}</pre>
 * where every part except the quoted name, the operand list and the type is optional.
 * Custom operation syntax is not supported.
 * <p>
 * Value names are scoped by region, and operations that are isolated from above
 * start a new namespace, in which earlier names are not visible. Values may be
 * used before they are defined, as long as they are defined somewhere in the same namespace.
 */
public final class IRParser {
    private static final OpRegistry NO_OPS = new OpRegistry();

    private final IRLexer lexer;
    private final OpRegistry registry;
    private final Deque<Namespace> namespaces = new ArrayDeque<>();

    private IRParser(String text, OpRegistry registry) {
        this.lexer = new IRLexer(text);
        this.registry = registry;
    }

    /**
     * Parse a module.
     * <p>
     * If the text is a single {@code builtin.module} operation, that is returned,
     * otherwise the top level operations are wrapped in a new module.
     *
     * @param text     The text.
     * @param registry The registered operations.
     * @return The module.
     * @throws IRParseException If the text is malformed.
     */
    public static Operation parseModule(String text, OpRegistry registry) {
        return new IRParser(text, registry).topLevel();
    }

    /**
     * Parse a type, like {@code f32} or {@code tensor<2x?xf32>}.
     *
     * @param text The text.
     * @return The type.
     * @throws IRParseException If the text is not exactly one type.
     */
    public static Type parseType(String text) {
        IRParser parser = new IRParser(text, NO_OPS);
        Type type = parser.type();
        parser.expectEnd();
        return type;
    }

    /**
     * Parse an attribute, like {@code 42 : i32}, {@code "str"} or {@code [1, 2]}.
     *
     * @param text The text.
     * @return The attribute.
     * @throws IRParseException If the text is not exactly one attribute.
     */
    public static Attribute parseAttribute(String text) {
        IRParser parser = new IRParser(text, NO_OPS);
        Attribute attr = parser.attribute();
        parser.expectEnd();
        return attr;
    }

    private void expectEnd() {
        Token token = lexer.peek();
        if (!token.is(Token.Kind.EOF)) {
            throw lexer.error(token, "unexpected " + token + " after end of input");
        }
    }

    // operations

    private Operation topLevel() {
        pushNamespace();
        Block top = new Block();
        while (!lexer.peek().is(Token.Kind.EOF)) {
            top.getOperations().add(operation());
        }
        popNamespace();
        List<Operation> ops = new ArrayList<>(top.getOperations());
        if (ops.size() == 1 && "builtin.module".equals(ops.get(0).getName())) {
            Operation module = ops.get(0);
            module.remove();
            return module;
        }
        Operation module = Operation.create(new OperationState("builtin.module").setNumRegions(1),
                registry.lookup("builtin.module"));
        Block body = module.getRegion(0).addBlock();
        for (Operation op : ops) {
            op.remove();
            body.getOperations().add(op);
        }
        return module;
    }

    private Operation operation() {
        List<ResultGroup> groups = new ArrayList<>();
        if (lexer.peek().is(Token.Kind.PERCENT_ID)) {
            do {
                Token name = lexer.expect(Token.Kind.PERCENT_ID, "in result list");
                int count = 1;
                if (lexer.consumeIf(Token.Kind.COLON)) {
                    Token countTok = lexer.expect(Token.Kind.INTEGER, "for the number of results");
                    count = positiveInt(countTok);
                }
                groups.add(new ResultGroup(name, count));
            } while (lexer.consumeIf(Token.Kind.COMMA));
            lexer.expect(Token.Kind.EQUAL, "after result list");
        }

        Token nameTok = lexer.peek();
        if (!nameTok.is(Token.Kind.STRING)) {
            throw lexer.error(nameTok, "expected a quoted operation name, but found " + nameTok
                    + " (only the generic operation form is supported)");
        }
        lexer.next();
        OperationState state;
        try {
            state = new OperationState(nameTok.text);
        } catch (IRException e) {
            throw lexer.error(nameTok, e.getMessage());
        }
        OpKey key = registry.lookup(nameTok.text);

        lexer.expect(Token.Kind.LPAREN, "to start operand list");
        List<ValueRef> operandRefs = new ArrayList<>();
        if (!lexer.peek().is(Token.Kind.RPAREN)) {
            do {
                operandRefs.add(valueRef());
            } while (lexer.consumeIf(Token.Kind.COMMA));
        }
        lexer.expect(Token.Kind.RPAREN, "to end operand list");
        if (lexer.peek().is(Token.Kind.LBRACKET)) {
            throw lexer.error(lexer.peek(), "successor lists are not supported");
        }

        if (lexer.consumeIf(Token.Kind.LANGLE)) {
            state.properties.putAll(attrDict());
            lexer.expect(Token.Kind.RANGLE, "to end properties");
        }

        List<List<Block>> regions = new ArrayList<>();
        if (lexer.consumeIf(Token.Kind.LPAREN)) {
            boolean isolated = key != null && key.isIsolatedFromAbove();
            if (isolated) pushNamespace();
            do {
                regions.add(region());
            } while (lexer.consumeIf(Token.Kind.COMMA));
            lexer.expect(Token.Kind.RPAREN, "to end region list");
            if (isolated) popNamespace();
        }

        if (lexer.peek().is(Token.Kind.LBRACE)) {
            state.attributes.putAll(attrDict());
        }

        lexer.expect(Token.Kind.COLON, "before operation type");
        Token typeTok = lexer.peek();
        Type type = type();
        if (!(type instanceof FunctionType)) {
            throw lexer.error(typeTok, "expected a function type for the operation, but found '" + type + "'");
        }
        FunctionType fnType = (FunctionType) type;
        if (fnType.inputs.size() != operandRefs.size()) {
            throw lexer.error(typeTok, "expected " + operandRefs.size() + " operand types but had " + fnType.inputs.size());
        }
        int numResults = 0;
        for (ResultGroup group : groups) numResults += group.count;
        if (!groups.isEmpty() && numResults != fnType.results.size()) {
            throw lexer.error(typeTok, "operation defines " + fnType.results.size()
                    + " results but was provided " + numResults + " to bind");
        }
        skipLocation();

        for (int i = 0; i < operandRefs.size(); i++) {
            state.operands.add(resolve(operandRefs.get(i), fnType.inputs.get(i)));
        }
        state.resultTypes.addAll(fnType.results);
        state.numRegions = regions.size();
        Operation op = Operation.create(state, key);
        for (int i = 0; i < regions.size(); i++) {
            op.getRegion(i).getBlocks().addAll(regions.get(i));
        }

        int resultIndex = 0;
        for (ResultGroup group : groups) {
            for (int i = 0; i < group.count; i++) {
                define(group.name, i, op.getResult(resultIndex++));
            }
        }
        return op;
    }

    private List<Block> region() {
        lexer.expect(Token.Kind.LBRACE, "to start region");
        namespaces.getFirst().scopes.push(new HashMap<>());
        List<Block> blocks = new ArrayList<>();
        Set<String> labels = new HashSet<>();
        if (!lexer.peek().is(Token.Kind.CARET_ID) && !lexer.peek().is(Token.Kind.RBRACE)) {
            Block entry = new Block();
            blocks.add(entry);
            blockBody(entry);
        }
        while (lexer.peek().is(Token.Kind.CARET_ID)) {
            Token label = lexer.next();
            if (!labels.add(label.text)) {
                throw lexer.error(label, "redefinition of block '^" + label.text + "'");
            }
            Block block = new Block();
            blocks.add(block);
            if (lexer.consumeIf(Token.Kind.LPAREN)) {
                if (!lexer.peek().is(Token.Kind.RPAREN)) {
                    do {
                        Token argName = lexer.expect(Token.Kind.PERCENT_ID, "for block argument");
                        lexer.expect(Token.Kind.COLON, "after block argument name");
                        Type argType = type();
                        skipLocation();
                        define(argName, 0, block.addArgument(argType));
                    } while (lexer.consumeIf(Token.Kind.COMMA));
                }
                lexer.expect(Token.Kind.RPAREN, "to end block argument list");
            }
            lexer.expect(Token.Kind.COLON, "after block label");
            blockBody(block);
        }
        lexer.expect(Token.Kind.RBRACE, "to end region");
        namespaces.getFirst().scopes.pop();
        return blocks;
    }

    private void blockBody(Block block) {
        while (true) {
            Token.Kind kind = lexer.peek().kind;
            if (kind == Token.Kind.CARET_ID || kind == Token.Kind.RBRACE || kind == Token.Kind.EOF) break;
            block.getOperations().add(operation());
        }
    }

    private void skipLocation() {
        if (!lexer.peek().isKeyword("loc")) return;
        lexer.next();
        lexer.expect(Token.Kind.LPAREN, "to start location");
        int depth = 1;
        while (depth > 0) {
            Token token = lexer.next();
            switch (token.kind) {
                case LPAREN:
                    depth++;
                    break;
                case RPAREN:
                    depth--;
                    break;
                case EOF:
                    throw lexer.error(token, "unterminated location");
                default:
            }
        }
    }

    // names

    private static final class Namespace {
        final Deque<Map<String, Value>> scopes = new ArrayDeque<>();
        final Map<String, ForwardRef> forwardRefs = new LinkedHashMap<>();
        final Map<String, Token> forwardRefTokens = new HashMap<>();
    }

    private static final class ResultGroup {
        final Token name;
        final int count;

        ResultGroup(Token name, int count) {
            this.name = name;
            this.count = count;
        }
    }

    private static final class ValueRef {
        final Token token;
        final int index;

        ValueRef(Token token, int index) {
            this.token = token;
            this.index = index;
        }

        String key() {
            return key(token.text, index);
        }

        static String key(String name, int index) {
            return name + "#" + index;
        }

        static String display(String name, int index) {
            return "%" + name + (index == 0 ? "" : "#" + index);
        }
    }

    private void pushNamespace() {
        Namespace ns = new Namespace();
        ns.scopes.push(new HashMap<>());
        namespaces.push(ns);
    }

    private void popNamespace() {
        Namespace ns = namespaces.pop();
        for (Map.Entry<String, Token> entry : ns.forwardRefTokens.entrySet()) {
            if (ns.forwardRefs.containsKey(entry.getKey())) {
                throw lexer.error(entry.getValue(), "use of undeclared SSA value name '%" + entry.getValue().text + "'");
            }
        }
    }

    private ValueRef valueRef() {
        Token token = lexer.expect(Token.Kind.PERCENT_ID, "for operand");
        int index = 0;
        Token next = lexer.peek();
        if (next.is(Token.Kind.HASH_ID) && next.start == token.end) {
            lexer.next();
            try {
                index = Integer.parseInt(next.text);
            } catch (NumberFormatException e) {
                throw lexer.error(next, "invalid SSA value result number");
            }
        }
        return new ValueRef(token, index);
    }

    private Value resolve(ValueRef ref, Type type) {
        Namespace ns = namespaces.getFirst();
        String key = ref.key();
        for (Map<String, Value> scope : ns.scopes) {
            Value value = scope.get(key);
            if (value != null) {
                checkUseType(ref, value.getType(), type);
                return value;
            }
        }
        ForwardRef fwd = ns.forwardRefs.get(key);
        if (fwd != null) {
            checkUseType(ref, fwd.getType(), type);
            return fwd;
        }
        fwd = new ForwardRef(type, ValueRef.display(ref.token.text, ref.index).substring(1));
        ns.forwardRefs.put(key, fwd);
        ns.forwardRefTokens.putIfAbsent(key, ref.token);
        return fwd;
    }

    private void checkUseType(ValueRef ref, Type prior, Type used) {
        if (!prior.equals(used)) {
            throw lexer.error(ref.token, "use of value '" + ValueRef.display(ref.token.text, ref.index)
                    + "' expects different type than prior uses: '" + used + "' vs '" + prior + "'");
        }
    }

    private void define(Token name, int index, Value value) {
        Namespace ns = namespaces.getFirst();
        String key = ValueRef.key(name.text, index);
        for (Map<String, Value> scope : ns.scopes) {
            if (scope.containsKey(key)) {
                throw lexer.error(name, "redefinition of SSA value '" + ValueRef.display(name.text, index) + "'");
            }
        }
        ForwardRef fwd = ns.forwardRefs.remove(key);
        if (fwd != null) {
            if (!fwd.getType().equals(value.getType())) {
                throw lexer.error(name, "definition of SSA value '" + ValueRef.display(name.text, index)
                        + "' has type '" + value.getType() + "', but prior uses expected '" + fwd.getType() + "'");
            }
            fwd.replaceAllUsesWith(value);
        }
        ns.scopes.getFirst().put(key, value);
    }

    // attributes

    private SortedMap<String, Attribute> attrDict() {
        lexer.expect(Token.Kind.LBRACE, "to start attribute dictionary");
        SortedMap<String, Attribute> attrs = new TreeMap<>();
        if (lexer.consumeIf(Token.Kind.RBRACE)) return attrs;
        do {
            Token keyTok = lexer.next();
            if (!keyTok.is(Token.Kind.BARE_ID) && !keyTok.is(Token.Kind.STRING)) {
                throw lexer.error(keyTok, "expected attribute name, but found " + keyTok);
            }
            Attribute value = lexer.consumeIf(Token.Kind.EQUAL) ? attribute() : UnitAttr.INSTANCE;
            if (attrs.put(keyTok.text, value) != null) {
                throw lexer.error(keyTok, "duplicate key '" + keyTok.text + "' in dictionary attribute");
            }
        } while (lexer.consumeIf(Token.Kind.COMMA));
        lexer.expect(Token.Kind.RBRACE, "to end attribute dictionary");
        return attrs;
    }

    private Attribute attribute() {
        Token token = lexer.peek();
        switch (token.kind) {
            case STRING:
                lexer.next();
                return new StringAttr(token.text);
            case INTEGER:
                lexer.next();
                return integerLiteral(token);
            case FLOAT:
                lexer.next();
                return floatLiteral(token);
            case LBRACKET: {
                lexer.next();
                List<Attribute> elements = new ArrayList<>();
                if (!lexer.peek().is(Token.Kind.RBRACKET)) {
                    do {
                        elements.add(attribute());
                    } while (lexer.consumeIf(Token.Kind.COMMA));
                }
                lexer.expect(Token.Kind.RBRACKET, "to end array attribute");
                return new ArrayAttr(elements);
            }
            case LBRACE:
                return new DictionaryAttr(attrDict());
            case AT_ID: {
                lexer.next();
                List<String> nested = new ArrayList<>();
                while (lexer.consumeIf(Token.Kind.DOUBLE_COLON)) {
                    nested.add(lexer.expect(Token.Kind.AT_ID, "in nested symbol reference").text);
                }
                return new SymbolRefAttr(token.text, nested);
            }
            case HASH_ID: {
                lexer.next();
                String body = lexer.rawFollowedBy('<') ? lexer.rawAngleBody() : null;
                return new OpaqueAttr(token.text, body);
            }
            case BARE_ID:
                switch (token.text) {
                    case "true":
                        lexer.next();
                        return BoolAttr.TRUE;
                    case "false":
                        lexer.next();
                        return BoolAttr.FALSE;
                    case "unit":
                        lexer.next();
                        return UnitAttr.INSTANCE;
                    case "dense": {
                        lexer.next();
                        String literal = lexer.rawAngleBody();
                        lexer.expect(Token.Kind.COLON, "after dense literal");
                        return new DenseElementsAttr(literal, type());
                    }
                }
                if (BuiltinTypes.forKeyword(token.text) == null && ShapedType.Kind.forKeyword(token.text) == null) {
                    throw lexer.error(token, "expected attribute value, but found " + token);
                }
                return new TypeAttr(type());
            case LPAREN:
            case BANG_ID:
                return new TypeAttr(type());
            default:
                throw lexer.error(token, "expected attribute value, but found " + token);
        }
    }

    private Attribute integerLiteral(Token token) {
        Type type = IntegerType.I64;
        if (lexer.consumeIf(Token.Kind.COLON)) type = type();
        boolean negative = token.text.startsWith("-");
        String digits = negative ? token.text.substring(1) : token.text;
        boolean hex = digits.startsWith("0x");
        BigInteger value = hex ? new BigInteger(digits.substring(2), 16) : new BigInteger(digits);
        if (negative) value = value.negate();
        if (type instanceof FloatType) {
            if (hex) {
                if (negative || value.bitLength() > 64) {
                    throw lexer.error(token, "hexadecimal float literal out of range");
                }
                return new FloatAttr(Double.longBitsToDouble(value.longValue()), type);
            }
            return new FloatAttr(value.doubleValue(), type);
        }
        if (!(type instanceof IntegerType) && type != BuiltinTypes.INDEX) {
            throw lexer.error(token, "integer literal not valid for specified type '" + type + "'");
        }
        if (type instanceof IntegerType && !fitsIn(value, ((IntegerType) type).width)) {
            throw lexer.error(token, "integer constant out of range for attribute of type '" + type + "'");
        }
        return new IntegerAttr(value, type);
    }

    // either as a signed or an unsigned value
    private static boolean fitsIn(BigInteger value, int width) {
        return value.signum() >= 0 ? value.bitLength() <= width : value.bitLength() <= width - 1;
    }

    private Attribute floatLiteral(Token token) {
        Type type = FloatType.F64;
        if (lexer.consumeIf(Token.Kind.COLON)) type = type();
        if (!(type instanceof FloatType)) {
            throw lexer.error(token, "floating point value not valid for specified type '" + type + "'");
        }
        return new FloatAttr(Double.parseDouble(token.text), type);
    }

    // types

    private Type type() {
        Token token = lexer.next();
        switch (token.kind) {
            case BARE_ID: {
                Type keyword = BuiltinTypes.forKeyword(token.text);
                if (keyword != null) return keyword;
                ShapedType.Kind kind = ShapedType.Kind.forKeyword(token.text);
                if (kind != null) return shapedType(kind);
                throw lexer.error(token, "unknown type '" + token.text + "'");
            }
            case LPAREN: {
                List<Type> inputs = typeListUntilRParen();
                lexer.expect(Token.Kind.ARROW, "in function type");
                List<Type> results;
                if (lexer.consumeIf(Token.Kind.LPAREN)) {
                    results = typeListUntilRParen();
                } else {
                    results = Collections.singletonList(type());
                }
                return new FunctionType(inputs, results);
            }
            case BANG_ID: {
                int dot = token.text.indexOf('.');
                if (dot <= 0 || dot == token.text.length() - 1) {
                    throw lexer.error(token, "dialect type '!" + token.text + "' is not of the form '!dialect.name'");
                }
                String body = lexer.rawFollowedBy('<') ? lexer.rawAngleBody() : null;
                return new OpaqueType(token.text, body);
            }
            default:
                throw lexer.error(token, "expected type, but found " + token);
        }
    }

    private List<Type> typeListUntilRParen() {
        List<Type> types = new ArrayList<>();
        if (!lexer.consumeIf(Token.Kind.RPAREN)) {
            do {
                types.add(type());
            } while (lexer.consumeIf(Token.Kind.COMMA));
            lexer.expect(Token.Kind.RPAREN, "to end type list");
        }
        return types;
    }

    private Type shapedType(ShapedType.Kind kind) {
        lexer.expect(Token.Kind.LANGLE, "after '" + kind.keyword + "'");
        List<Long> dims = new ArrayList<>();
        boolean unranked = false;
        while (true) {
            int c = lexer.rawPeekChar();
            if (kind == ShapedType.Kind.VECTOR && (c == '*' || c == '?')) {
                throw lexer.errorHere("vector types must have static dimensions");
            }
            if (c == '*' && !unranked && dims.isEmpty()) {
                lexer.rawAdvance();
                rawDimensionSeparator();
                unranked = true;
                break;
            } else if (c == '?') {
                lexer.rawAdvance();
                rawDimensionSeparator();
                dims.add(ShapedType.DYNAMIC);
            } else if (c >= '0' && c <= '9') {
                String digits = lexer.rawDigits();
                rawDimensionSeparator();
                try {
                    dims.add(Long.parseLong(digits));
                } catch (NumberFormatException e) {
                    throw lexer.errorHere("dimension '" + digits + "' is too large");
                }
            } else {
                break;
            }
        }
        Type element = type();
        lexer.expect(Token.Kind.RANGLE, "to end " + kind.keyword + " type");
        long[] shape = null;
        if (!unranked) {
            shape = new long[dims.size()];
            for (int i = 0; i < shape.length; i++) shape[i] = dims.get(i);
        }
        return new ShapedType(kind, shape, element);
    }

    private void rawDimensionSeparator() {
        if (lexer.rawPeekChar() != 'x') {
            throw lexer.errorHere("expected 'x' in dimension list");
        }
        lexer.rawAdvance();
    }

    private int positiveInt(Token token) {
        String text = token.text;
        if (text.startsWith("-") || text.startsWith("0x") || text.length() > 9 || Integer.parseInt(text) == 0) {
            throw lexer.error(token, "expected a positive number of results");
        }
        return Integer.parseInt(text);
    }
}
