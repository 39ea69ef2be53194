package io.github.cyfko.zapformat.core.model;

/**
 * Closed set of token kinds produced by the Zap lexer.
 * <p>
 * Every kind carries the literal spelling it stands for when that spelling is fixed
 * (keywords, primitive type names, punctuation). Literal, identifier, comment and
 * sentinel kinds have no fixed spelling and report {@code null}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenKind {

    // Declarations and type constructors
    OPT("opt"),
    TYPE("type"),
    EVENT("event"),
    FUNCT("funct"),
    NAMESPACE("namespace"),
    ENUM("enum"),
    STRUCT("struct"),
    MAP("map"),
    SET("set"),
    INSTANCE("Instance"),

    // Property names
    CALL("call"),
    DATA("data"),
    FROM("from"),
    ARGS("args"),
    RETS("rets"),

    // Primitive type names
    BOOLEAN("boolean"),
    STRING("string"),
    F32("f32"),
    F64("f64"),
    I8("i8"),
    I16("i16"),
    I32("i32"),
    U8("u8"),
    U16("u16"),
    U32("u32"),
    CFRAME("CFrame"),
    ALIGNED_CFRAME("AlignedCFrame"),
    COLOR3("Color3"),
    BRICK_COLOR("BrickColor"),
    DATETIME("DateTime"),
    DATETIME_MILLIS("DateTimeMillis"),
    VECTOR2("Vector2"),
    VECTOR3("Vector3"),
    VECTOR("vector"),
    UNKNOWN("unknown"),

    // Punctuation
    LEFT_BRACE("{"),
    RIGHT_BRACE("}"),
    LEFT_PAREN("("),
    RIGHT_PAREN(")"),
    LEFT_BRACKET("["),
    RIGHT_BRACKET("]"),
    COLON(":"),
    COMMA(","),
    EQUALS("="),
    QUESTION("?"),
    PIPE("|"),
    DOT_DOT(".."),
    LESS_THAN("<"),
    GREATER_THAN(">"),

    // Literals
    STRING_LITERAL(null),
    NUMBER_LITERAL(null),
    BOOLEAN_LITERAL(null),

    IDENTIFIER(null),
    COMMENT(null),
    NEWLINE("\n"),
    WHITESPACE(null),
    EOF(null);

    private final String spelling;

    TokenKind(String spelling) {
        this.spelling = spelling;
    }

    /**
     * Returns the fixed source spelling of this kind.
     *
     * @return the spelling, or {@code null} when tokens of this kind have variable text
     */
    public String getSpelling() {
        return spelling;
    }
}
