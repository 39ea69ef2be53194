package io.github.cyfko.zapformat.core.impl;

import io.github.cyfko.zapformat.core.api.ZapParser;
import io.github.cyfko.zapformat.core.ast.*;
import io.github.cyfko.zapformat.core.ast.TypeNode.*;
import io.github.cyfko.zapformat.core.config.ParserPolicy;
import io.github.cyfko.zapformat.core.exception.ZapParseException;
import io.github.cyfko.zapformat.core.model.Token;
import io.github.cyfko.zapformat.core.model.TokenKind;

import java.util.*;

/**
 * Recursive-descent implementation of {@link ZapParser}.
 * <p>
 * One production per AST node variant, driven by a single integer cursor over an immutable
 * token list. The cursor lives in a per-call session, so a single instance can be shared
 * between threads.
 * </p>
 *
 * <h2>Type expression precedence</h2>
 * <ul>
 *   <li>{@code |} binds loosest: {@code a | b?} is {@code Union(a, Optional(b))}</li>
 *   <li>{@code ?} applies after every array suffix: {@code u8[]?} is {@code Optional(Array(u8))}</li>
 *   <li>array suffixes nest left to right: {@code string[][]} is {@code Array(Array(string))}</li>
 *   <li>parentheses around a single unnamed type are transparent: {@code (u8)} is {@code u8}</li>
 * </ul>
 *
 * <h2>Usage example</h2>
 * <pre>{@code
 * ZapParser parser = new BasicZapParser();
 * ZapConfiguration config = parser.parse(ZapLexer.tokenize(source));
 *
 * // Untrusted input
 * ZapParser strictParser = new BasicZapParser(ParserPolicy.strict());
 * }</pre>
 *
 * <p>Type nesting beyond {@link ParserPolicy#maxNestingDepth()} is rejected with a
 * {@link ZapParseException}, so hostile input cannot exhaust the thread stack.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicZapParser implements ZapParser {

    private static final Set<TokenKind> STANDARD_TYPES = EnumSet.of(
            TokenKind.ALIGNED_CFRAME, TokenKind.BOOLEAN, TokenKind.BRICK_COLOR, TokenKind.CFRAME,
            TokenKind.COLOR3, TokenKind.DATETIME, TokenKind.DATETIME_MILLIS, TokenKind.F32,
            TokenKind.F64, TokenKind.I8, TokenKind.I16, TokenKind.I32, TokenKind.STRING,
            TokenKind.U8, TokenKind.U16, TokenKind.U32, TokenKind.UNKNOWN,
            TokenKind.VECTOR, TokenKind.VECTOR2, TokenKind.VECTOR3);

    /** Primitives that may carry a dotted qualifier, e.g. {@code string.utf8}. */
    private static final Set<String> QUALIFIABLE_TYPES = Set.of(
            "f32", "f64", "i8", "i16", "i32", "string", "u8", "u16", "u32");

    private static final Set<TokenKind> PROPERTY_NAMES = EnumSet.of(
            TokenKind.ARGS, TokenKind.CALL, TokenKind.DATA, TokenKind.FROM,
            TokenKind.IDENTIFIER, TokenKind.RETS, TokenKind.TYPE);

    /** Property-name keywords also accepted where a plain identifier value is expected. */
    private static final Set<TokenKind> IDENTIFIER_VALUES = EnumSet.of(
            TokenKind.IDENTIFIER, TokenKind.CALL, TokenKind.DATA, TokenKind.FROM, TokenKind.TYPE);

    private static final String INSTANCE_PREFIX = "Instance.";

    private final ParserPolicy policy;

    public BasicZapParser() {
        this(ParserPolicy.defaults());
    }

    /**
     * @param policy complexity limits
     * @throws IllegalArgumentException if policy is null
     */
    public BasicZapParser(ParserPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }
        this.policy = policy;
    }

    public ParserPolicy getPolicy() {
        return policy;
    }

    @Override
    public ZapConfiguration parse(List<Token> tokens) throws ZapParseException {
        if (tokens == null || tokens.isEmpty()) {
            throw new IllegalArgumentException("Token sequence cannot be null or empty");
        }
        if (!tokens.get(tokens.size() - 1).is(TokenKind.EOF)) {
            throw new IllegalArgumentException("Token sequence must be terminated by an EOF token");
        }

        List<Token> significant = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (!token.is(TokenKind.WHITESPACE)) significant.add(token);
        }

        return new Session(significant, policy.maxNestingDepth()).parseConfiguration();
    }

    /**
     * Cursor state of a single {@link #parse(List)} call.
     */
    private static final class Session {
        private final List<Token> tokens;
        private final int maxNestingDepth;
        private int current = 0;
        private int nesting = 0;

        Session(List<Token> tokens, int maxNestingDepth) {
            this.tokens = tokens;
            this.maxNestingDepth = maxNestingDepth;
        }

        ZapConfiguration parseConfiguration() {
            List<OptionNode> options = new ArrayList<>();
            List<ConfigItem> items = new ArrayList<>();

            while (!isAtEnd()) {
                skipNewlines();
                if (isAtEnd()) break;

                switch (peek().kind()) {
                    case OPT -> options.add(parseOption());
                    case COMMENT -> items.add(parseComment());
                    case EVENT -> items.add(parseEvent());
                    case FUNCT -> items.add(parseFunction());
                    case NAMESPACE -> items.add(parseNamespace());
                    case TYPE -> items.add(parseTypeDefinition());
                    default -> throw new ZapParseException("Unexpected token", peek());
                }

                skipNewlines();
            }

            return new ZapConfiguration(options, items);
        }

        // ---------------------------------------------------------------- declarations

        private OptionNode parseOption() {
            consume(TokenKind.OPT, "Expected \"opt\"");
            String key = consume(TokenKind.IDENTIFIER, "Expected option key").value();
            consume(TokenKind.EQUALS, "Expected \"=\"");

            Object value;
            if (check(TokenKind.STRING_LITERAL)) value = advance().value();
            else if (check(TokenKind.NUMBER_LITERAL)) value = Double.parseDouble(advance().value());
            else if (check(TokenKind.BOOLEAN_LITERAL)) value = "true".equals(advance().value());
            else if (check(TokenKind.IDENTIFIER)) value = advance().value();
            else throw new ZapParseException("Expected value for option \"" + key + "\"", peek());

            return new OptionNode(key, value);
        }

        private CommentNode parseComment() {
            return new CommentNode(consume(TokenKind.COMMENT, "Expected comment").value());
        }

        private EventNode parseEvent() {
            consume(TokenKind.EVENT, "Expected \"event\"");
            String name = consume(TokenKind.IDENTIFIER, "Expected event name").value();
            openBlock();

            String from = null;
            String type = null;
            String call = null;
            TypeNode data = null;

            while (!check(TokenKind.RIGHT_BRACE) && !isAtEnd()) {
                skipNewlines();
                if (check(TokenKind.RIGHT_BRACE)) break;

                Token property = consumePropertyName();
                consume(TokenKind.COLON, "Expected \":\"");

                switch (property.value()) {
                    case "from" -> from = consumeIdentifierValue();
                    case "type" -> type = consumeIdentifierValue();
                    case "call" -> call = consumeIdentifierValue();
                    case "data" -> data = parseType();
                    default -> throw new ZapParseException(
                            "Unknown event property '" + property.value() + "'", property);
                }

                if (check(TokenKind.COMMA)) advance();
                skipNewlines();
            }

            consume(TokenKind.RIGHT_BRACE, "Expected \"}\"");
            return new EventNode(name, new EventProperties(from, type, call, data));
        }

        private FunctionNode parseFunction() {
            consume(TokenKind.FUNCT, "Expected \"funct\"");
            String name = consume(TokenKind.IDENTIFIER, "Expected function name").value();
            openBlock();

            String call = null;
            TypeNode args = null;
            TypeNode rets = null;

            while (!check(TokenKind.RIGHT_BRACE) && !isAtEnd()) {
                skipNewlines();
                if (check(TokenKind.RIGHT_BRACE)) break;

                Token property = consumePropertyName();
                consume(TokenKind.COLON, "Expected \":\"");

                switch (property.value()) {
                    case "call" -> call = consumeIdentifierValue();
                    case "args" -> args = parseType();
                    case "rets" -> rets = parseType();
                    default -> throw new ZapParseException(
                            "Unknown function property '" + property.value() + "'", property);
                }

                if (check(TokenKind.COMMA)) advance();
                skipNewlines();
            }

            consume(TokenKind.RIGHT_BRACE, "Expected \"}\"");
            return new FunctionNode(name, new FunctionProperties(call, args, rets));
        }

        private NamespaceNode parseNamespace() {
            consume(TokenKind.NAMESPACE, "Expected \"namespace\"");
            String name = consume(TokenKind.IDENTIFIER, "Expected namespace name").value();
            openBlock();

            List<NamespaceMember> members = new ArrayList<>();

            while (!check(TokenKind.RIGHT_BRACE) && !isAtEnd()) {
                skipNewlines();
                if (check(TokenKind.RIGHT_BRACE)) break;

                if (check(TokenKind.COMMENT)) members.add(parseComment());
                else if (check(TokenKind.EVENT)) members.add(parseEvent());
                else if (check(TokenKind.FUNCT)) members.add(parseFunction());
                else throw new ZapParseException("Unexpected token in namespace", peek());

                skipNewlines();
            }

            consume(TokenKind.RIGHT_BRACE, "Expected \"}\"");
            return new NamespaceNode(name, members);
        }

        private TypeDefinitionNode parseTypeDefinition() {
            consume(TokenKind.TYPE, "Expected \"type\"");
            String name = consume(TokenKind.IDENTIFIER, "Expected type name").value();
            consume(TokenKind.EQUALS, "Expected \"=\"");
            return new TypeDefinitionNode(name, parseType());
        }

        /** {@code = \n* {} */
        private void openBlock() {
            consume(TokenKind.EQUALS, "Expected \"=\"");
            skipNewlines();
            consume(TokenKind.LEFT_BRACE, "Expected \"{\"");
        }

        // ---------------------------------------------------------------- types

        private TypeNode parseType() {
            if (nesting >= maxNestingDepth) {
                throw new ZapParseException(
                        "Type nesting exceeds maximum depth of " + maxNestingDepth, peek());
            }
            nesting++;
            try {
                return parseUnionType();
            } finally {
                nesting--;
            }
        }

        private TypeNode parseUnionType() {
            TypeNode first = parseOptionalType();
            if (!check(TokenKind.PIPE)) return first;

            List<TypeNode> types = new ArrayList<>();
            types.add(first);
            while (check(TokenKind.PIPE)) {
                advance();
                types.add(parseOptionalType());
            }
            return new UnionType(types);
        }

        private TypeNode parseOptionalType() {
            TypeNode type = parseBaseType();

            while (check(TokenKind.LEFT_BRACKET)) {
                type = new ArrayType(type, parseArraySuffix());
            }

            if (check(TokenKind.QUESTION)) {
                advance();
                return new OptionalType(type);
            }
            return type;
        }

        /** {@code [ range? ]}, returns the constraint or {@code null} for {@code []}. */
        private RangeConstraint parseArraySuffix() {
            consume(TokenKind.LEFT_BRACKET, "Expected \"[\"");
            RangeConstraint constraint = null;
            if (!check(TokenKind.RIGHT_BRACKET)) constraint = parseRangeContent();
            consume(TokenKind.RIGHT_BRACKET, "Expected \"]\"");
            return constraint;
        }

        private TypeNode parseBaseType() {
            if (check(TokenKind.LEFT_PAREN)) return parseParenthesized();
            if (check(TokenKind.MAP)) return parseMapType();
            if (check(TokenKind.SET)) return parseSetType();
            if (check(TokenKind.INSTANCE)) return parseInstanceType();
            if (check(TokenKind.ENUM)) return parseEnumType();
            if (check(TokenKind.STRUCT)) return parseStructType();
            if (check(TokenKind.VECTOR) || check(TokenKind.VECTOR2) || check(TokenKind.VECTOR3)) {
                return parseVectorType();
            }

            if (check(TokenKind.IDENTIFIER) && peek().value().startsWith(INSTANCE_PREFIX)) {
                return new InstanceType(advance().value().substring(INSTANCE_PREFIX.length()));
            }

            if (isPrimitiveType()) return parsePrimitiveType();

            throw new ZapParseException("Unexpected token in type", peek());
        }

        /** A parenthesized type or a tuple. */
        private TypeNode parseParenthesized() {
            consume(TokenKind.LEFT_PAREN, "Expected \"(\"");
            List<TupleElement> elements = new ArrayList<>();

            if (!check(TokenKind.RIGHT_PAREN)) {
                do {
                    skipNewlines();
                    if (check(TokenKind.RIGHT_PAREN)) break;

                    String name = null;
                    Token next = peekNext();
                    if (next != null && next.is(TokenKind.COLON) && isParameterName()) {
                        name = advance().value();
                        advance(); // ':'
                    }

                    elements.add(new TupleElement(name, parseType()));
                    skipNewlines();

                    if (!check(TokenKind.COMMA)) break;
                    advance();
                    skipNewlines();
                } while (!check(TokenKind.RIGHT_PAREN));
            }

            consume(TokenKind.RIGHT_PAREN, "Expected \")\"");

            if (elements.size() == 1 && elements.get(0).name() == null) {
                return elements.get(0).type();
            }
            return new TupleType(elements);
        }

        private MapType parseMapType() {
            consume(TokenKind.MAP, "Expected \"map\"");
            consume(TokenKind.LEFT_BRACE, "Expected \"{\"");
            consume(TokenKind.LEFT_BRACKET, "Expected \"[\"");
            TypeNode keyType = parseType();
            consume(TokenKind.RIGHT_BRACKET, "Expected \"]\"");
            consume(TokenKind.COLON, "Expected \":\"");
            TypeNode valueType = parseType();
            consume(TokenKind.RIGHT_BRACE, "Expected \"}\"");
            return new MapType(keyType, valueType);
        }

        private SetType parseSetType() {
            consume(TokenKind.SET, "Expected \"set\"");
            consume(TokenKind.LEFT_BRACE, "Expected \"{\"");
            TypeNode elementType = parseType();
            consume(TokenKind.RIGHT_BRACE, "Expected \"}\"");
            return new SetType(elementType);
        }

        private InstanceType parseInstanceType() {
            consume(TokenKind.INSTANCE, "Expected \"Instance\"");
            String className = null;
            if (check(TokenKind.LEFT_PAREN)) {
                advance();
                className = consumeIdentifierValue();
                consume(TokenKind.RIGHT_PAREN, "Expected \")\"");
            }
            return new InstanceType(className);
        }

        private EnumType parseEnumType() {
            consume(TokenKind.ENUM, "Expected \"enum\"");

            String tagField = null;
            if (check(TokenKind.STRING_LITERAL)) {
                String quoted = advance().value();
                tagField = quoted.substring(1, quoted.length() - 1);
            }
            boolean tagged = tagField != null && !tagField.isEmpty();

            consume(TokenKind.LEFT_BRACE, "Expected \"{\"");
            List<EnumVariant> variants = new ArrayList<>();

            while (!check(TokenKind.RIGHT_BRACE) && !isAtEnd()) {
                skipNewlines();
                if (check(TokenKind.RIGHT_BRACE)) break;

                String variantName = consume(TokenKind.IDENTIFIER, "Expected variant name").value();
                StructType fields = null;
                if (tagged && check(TokenKind.LEFT_BRACE)) fields = parseStructFields();
                variants.add(new EnumVariant(variantName, fields));

                if (check(TokenKind.COMMA)) {
                    advance();
                    skipNewlines();
                    if (check(TokenKind.RIGHT_BRACE)) break;
                }
                skipNewlines();
            }

            consume(TokenKind.RIGHT_BRACE, "Expected \"}\"");
            return new EnumType(tagField, variants);
        }

        private StructType parseStructType() {
            consume(TokenKind.STRUCT, "Expected \"struct\"");
            return parseStructFields();
        }

        /** {@code { name: type, ... }}, shared by structs and tagged-enum variant payloads. */
        private StructType parseStructFields() {
            consume(TokenKind.LEFT_BRACE, "Expected \"{\"");
            List<StructField> fields = new ArrayList<>();

            while (!check(TokenKind.RIGHT_BRACE) && !isAtEnd()) {
                skipNewlines();
                if (check(TokenKind.RIGHT_BRACE)) break;

                String fieldName = consume(TokenKind.IDENTIFIER, "Expected field name").value();
                consume(TokenKind.COLON, "Expected \":\"");
                fields.add(new StructField(fieldName, parseType()));

                if (check(TokenKind.COMMA)) {
                    advance();
                    skipNewlines();
                    if (check(TokenKind.RIGHT_BRACE)) break;
                }
                skipNewlines();
            }

            consume(TokenKind.RIGHT_BRACE, "Expected \"}\"");
            return new StructType(fields);
        }

        private VectorType parseVectorType() {
            advance(); // vector, Vector2 or Vector3
            if (!check(TokenKind.LEFT_PAREN)) return new VectorType(null);

            advance();
            List<TypeNode> components = new ArrayList<>();
            if (!check(TokenKind.RIGHT_PAREN)) {
                do {
                    components.add(parseType());
                    if (!check(TokenKind.COMMA)) break;
                    advance();
                } while (!check(TokenKind.RIGHT_PAREN));
            }
            consume(TokenKind.RIGHT_PAREN, "Expected \")\"");
            return new VectorType(components);
        }

        private TypeNode parsePrimitiveType() {
            String name = advance().value();

            if (check(TokenKind.LEFT_PAREN)) {
                consume(TokenKind.LEFT_PAREN, "Expected \"(\"");
                RangeConstraint constraint = parseRangeContent();
                consume(TokenKind.RIGHT_PAREN, "Expected \")\"");
                return new PrimitiveType(name, constraint);
            }

            if (check(TokenKind.LEFT_BRACKET)) {
                return new ArrayType(new PrimitiveType(name), parseArraySuffix());
            }

            return new PrimitiveType(name);
        }

        private RangeConstraint parseRangeContent() {
            Double min = null;
            Double max = null;

            if (check(TokenKind.DOT_DOT)) {
                advance();
                if (check(TokenKind.NUMBER_LITERAL)) max = parseNumber(advance());
            } else if (check(TokenKind.NUMBER_LITERAL)) {
                min = parseNumber(advance());
                if (check(TokenKind.DOT_DOT)) {
                    advance();
                    if (check(TokenKind.NUMBER_LITERAL)) max = parseNumber(advance());
                } else {
                    max = min;
                }
            }

            return new RangeConstraint(min, max);
        }

        private boolean isPrimitiveType() {
            Token token = peek();
            if (STANDARD_TYPES.contains(token.kind())) return true;
            if (token.is(TokenKind.IDENTIFIER)) {
                int dot = token.value().indexOf('.');
                return dot > 0 && QUALIFIABLE_TYPES.contains(token.value().substring(0, dot));
            }
            return false;
        }

        // ---------------------------------------------------------------- cursor

        private Token consumePropertyName() {
            if (PROPERTY_NAMES.contains(peek().kind())) return advance();
            throw new ZapParseException("Expected property name", peek());
        }

        private String consumeIdentifierValue() {
            if (IDENTIFIER_VALUES.contains(peek().kind())) return advance().value();
            throw new ZapParseException("Expected identifier value", peek());
        }

        private boolean isParameterName() {
            return PROPERTY_NAMES.contains(peek().kind());
        }

        private static double parseNumber(Token token) {
            return Double.parseDouble(token.value());
        }

        private Token consume(TokenKind kind, String message) {
            if (check(kind)) return advance();
            throw new ZapParseException(message, peek());
        }

        private boolean check(TokenKind kind) {
            if (isAtEnd()) return false;
            return peek().is(kind);
        }

        private Token advance() {
            if (!isAtEnd()) current++;
            return tokens.get(current - 1);
        }

        private boolean isAtEnd() {
            return peek().is(TokenKind.EOF);
        }

        private Token peek() {
            return tokens.get(current);
        }

        private Token peekNext() {
            if (current + 1 >= tokens.size()) return null;
            return tokens.get(current + 1);
        }

        private void skipNewlines() {
            while (check(TokenKind.NEWLINE)) advance();
        }
    }
}
