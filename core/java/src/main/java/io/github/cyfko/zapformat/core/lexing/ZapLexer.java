package io.github.cyfko.zapformat.core.lexing;

import io.github.cyfko.zapformat.core.exception.ZapLexException;
import io.github.cyfko.zapformat.core.model.Token;
import io.github.cyfko.zapformat.core.model.TokenKind;

import java.util.*;

/**
 * Single-pass lexer for the Zap configuration language.
 * <p>
 * Scans the source left to right and produces line/column tagged tokens. Spaces, tabs and
 * carriage returns are skipped; newlines are significant and produce {@link TokenKind#NEWLINE}
 * tokens. Exactly one {@link TokenKind#EOF} token is appended, positioned at end of input.
 * </p>
 *
 * <p><strong>Scanning order at each position:</strong></p>
 * <ol>
 *   <li>{@code --} line comment (token value keeps the {@code --}, excludes the newline)</li>
 *   <li>{@code ..} range separator</li>
 *   <li>single-character punctuation</li>
 *   <li>{@code "} string literal, with {@code \" \\ \n \r \t} escapes</li>
 *   <li>digit: number literal, at most one {@code .} and never the first dot of {@code ..}</li>
 *   <li>letter or {@code _}: identifier or keyword, with an optional dotted suffix</li>
 * </ol>
 * Anything else fails with a {@link ZapLexException}.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Token> tokens = ZapLexer.tokenize("type Id = u8(1..5)");
 * // TYPE, IDENTIFIER(Id), EQUALS, U8, LEFT_PAREN, NUMBER_LITERAL(1), DOT_DOT,
 * // NUMBER_LITERAL(5), RIGHT_PAREN, EOF
 * }</pre>
 *
 * <p>Columns count UTF-16 code units, as {@link String#charAt(int)} does.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ZapLexer {

    private static final Map<String, TokenKind> KEYWORDS = keywords();

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int position = 0;
    private int line = 1;
    private int column = 1;

    private ZapLexer(String source) {
        this.source = source;
    }

    /**
     * Tokenizes a Zap source text.
     *
     * @param source the source text
     * @return the tokens in source order, terminated by a single {@link TokenKind#EOF} token
     * @throws ZapLexException on an unterminated string literal or an unexpected character
     * @throws IllegalArgumentException if {@code source} is {@code null}
     */
    public static List<Token> tokenize(String source) {
        if (source == null) {
            throw new IllegalArgumentException("Zap source cannot be null");
        }
        return new ZapLexer(source).scan();
    }

    /**
     * Looks up the token kind of a bare word.
     * <p>
     * Dotted words are never keywords and always resolve to {@link TokenKind#IDENTIFIER}.
     * </p>
     *
     * @param word the word to classify
     * @return the keyword kind, or {@link TokenKind#IDENTIFIER}
     */
    public static TokenKind classify(String word) {
        if (word.indexOf('.') >= 0) return TokenKind.IDENTIFIER;
        return KEYWORDS.getOrDefault(word, TokenKind.IDENTIFIER);
    }

    private List<Token> scan() {
        while (position < source.length()) {
            Token token = nextToken();
            if (token != null) tokens.add(token);
        }
        tokens.add(new Token(TokenKind.EOF, "", line, column));
        return List.copyOf(tokens);
    }

    private Token nextToken() {
        skipWhitespace();
        if (position >= source.length()) return null;

        int startLine = line;
        int startColumn = column;

        if (match("--")) return readComment(startLine, startColumn);
        if (match("..")) return new Token(TokenKind.DOT_DOT, "..", startLine, startColumn);

        char c = source.charAt(position);
        TokenKind punctuation = punctuation(c);
        if (punctuation != null) {
            advance();
            return new Token(punctuation, String.valueOf(c), startLine, startColumn);
        }

        if (c == '"') return readString(startLine, startColumn);
        if (isDigit(c)) return readNumber(startLine, startColumn);
        if (isIdentifierStart(c)) return readIdentifier(startLine, startColumn);

        throw new ZapLexException(
                String.format("Unexpected character '%c' at line %d, column %d", c, line, column),
                line, column);
    }

    private static TokenKind punctuation(char c) {
        return switch (c) {
            case '\n' -> TokenKind.NEWLINE;
            case '(' -> TokenKind.LEFT_PAREN;
            case ')' -> TokenKind.RIGHT_PAREN;
            case ',' -> TokenKind.COMMA;
            case ':' -> TokenKind.COLON;
            case '<' -> TokenKind.LESS_THAN;
            case '=' -> TokenKind.EQUALS;
            case '>' -> TokenKind.GREATER_THAN;
            case '?' -> TokenKind.QUESTION;
            case '[' -> TokenKind.LEFT_BRACKET;
            case ']' -> TokenKind.RIGHT_BRACKET;
            case '{' -> TokenKind.LEFT_BRACE;
            case '|' -> TokenKind.PIPE;
            case '}' -> TokenKind.RIGHT_BRACE;
            default -> null;
        };
    }

    private Token readComment(int startLine, int startColumn) {
        StringBuilder value = new StringBuilder("--");
        while (position < source.length() && peek() != '\n') {
            value.append(peek());
            advance();
        }
        return new Token(TokenKind.COMMENT, value.toString(), startLine, startColumn);
    }

    private Token readString(int startLine, int startColumn) {
        StringBuilder value = new StringBuilder("\"");
        advance(); // opening quote

        while (position < source.length() && peek() != '"') {
            if (peek() == '\\') {
                advance();
                if (position < source.length()) {
                    char escaped = peek();
                    value.append(switch (escaped) {
                        case 'n' -> '\n';
                        case 'r' -> '\r';
                        case 't' -> '\t';
                        default -> escaped;
                    });
                    advance();
                }
            } else {
                value.append(peek());
                advance();
            }
        }

        if (position >= source.length()) {
            throw new ZapLexException(
                    String.format("Unterminated string literal at line %d, column %d", startLine, startColumn),
                    startLine, startColumn);
        }

        advance(); // closing quote
        return new Token(TokenKind.STRING_LITERAL, value.append('"').toString(), startLine, startColumn);
    }

    private Token readNumber(int startLine, int startColumn) {
        StringBuilder value = new StringBuilder();
        boolean hasDecimalPoint = false;

        while (position < source.length()) {
            char c = peek();
            if (isDigit(c)) {
                value.append(c);
                advance();
            } else if (c == '.' && !hasDecimalPoint) {
                // "1..5" is a range, not the number "1."
                if (position + 1 < source.length() && source.charAt(position + 1) == '.') break;
                hasDecimalPoint = true;
                value.append(c);
                advance();
            } else {
                break;
            }
        }

        return new Token(TokenKind.NUMBER_LITERAL, value.toString(), startLine, startColumn);
    }

    private Token readIdentifier(int startLine, int startColumn) {
        StringBuilder value = new StringBuilder();
        readWord(value);

        if (position < source.length() && peek() == '.') {
            value.append('.');
            advance();
            readWord(value);
        }

        String text = value.toString();
        return new Token(classify(text), text, startLine, startColumn);
    }

    private void readWord(StringBuilder into) {
        while (position < source.length() && isIdentifierPart(peek())) {
            into.append(peek());
            advance();
        }
    }

    private void skipWhitespace() {
        while (position < source.length()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r') advance();
            else break;
        }
    }

    private boolean match(String expected) {
        if (!source.startsWith(expected, position)) return false;
        for (int i = 0; i < expected.length(); i++) advance();
        return true;
    }

    private void advance() {
        if (position >= source.length()) return;
        if (source.charAt(position) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        position++;
    }

    private char peek() {
        return source.charAt(position);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static Map<String, TokenKind> keywords() {
        Map<String, TokenKind> table = new HashMap<>();
        for (TokenKind kind : EnumSet.range(TokenKind.OPT, TokenKind.UNKNOWN)) {
            table.put(kind.getSpelling(), kind);
        }
        table.put("true", TokenKind.BOOLEAN_LITERAL);
        table.put("false", TokenKind.BOOLEAN_LITERAL);

        // Reserved-looking words given meaning by the parser as property values
        for (String word : List.of(
                "Async", "Sync", "Client", "Server", "Reliable", "Unreliable",
                "ManyAsync", "ManySync", "Polling", "SingleAsync", "SingleSync",
                "PascalCase", "camelCase", "snake_case",
                "ConstEnum", "StringConstEnum", "StringLiteral",
                "promise", "future", "yield", "utf8")) {
            table.put(word, TokenKind.IDENTIFIER);
        }
        return Collections.unmodifiableMap(table);
    }
}
