package io.github.cyfko.zapformat.core.impl;

import io.github.cyfko.zapformat.core.ast.*;
import io.github.cyfko.zapformat.core.ast.TypeNode.*;
import io.github.cyfko.zapformat.core.exception.ZapParseException;
import io.github.cyfko.zapformat.core.lexing.ZapLexer;
import io.github.cyfko.zapformat.core.model.Token;
import io.github.cyfko.zapformat.core.model.TokenKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link BasicZapParser}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("BasicZapParser Tests")
class BasicZapParserTest {

    private BasicZapParser parser;

    @BeforeEach
    void setUp() {
        parser = new BasicZapParser();
    }

    private ZapConfiguration parse(String source) {
        return parser.parse(ZapLexer.tokenize(source));
    }

    private TypeNode parseType(String expression) {
        ConfigItem item = parse("type T = " + expression).items().get(0);
        return ((TypeDefinitionNode) item).definition();
    }

    @Nested
    @DisplayName("Options")
    class OptionTests {

        @Test
        @DisplayName("String option keeps its quotes")
        void testStringOption() {
            OptionNode option = parse("opt casing = \"PascalCase\"").options().get(0);

            assertEquals("casing", option.key());
            assertEquals("\"PascalCase\"", option.value());
        }

        @Test
        @DisplayName("Number option is a double")
        void testNumberOption() {
            assertEquals(1.5, parse("opt x = 1.5").options().get(0).value());
        }

        @Test
        @DisplayName("Boolean option is a boolean")
        void testBooleanOption() {
            assertEquals(Boolean.TRUE, parse("opt x = true").options().get(0).value());
            assertEquals(Boolean.FALSE, parse("opt x = false").options().get(0).value());
        }

        @Test
        @DisplayName("Bare word option is a string")
        void testIdentifierOption() {
            assertEquals("PascalCase", parse("opt casing = PascalCase").options().get(0).value());
        }

        @Test
        @DisplayName("Options are collected apart from items, each list in source order")
        void testOptionsSeparatedFromItems() {
            ZapConfiguration config = parse("type A = u8\nopt x = 1\ntype B = u8\nopt y = 2");

            assertEquals(List.of("x", "y"), config.options().stream().map(OptionNode::key).toList());
            assertEquals(2, config.items().size());
            assertEquals("A", ((TypeDefinitionNode) config.items().get(0)).name());
            assertEquals("B", ((TypeDefinitionNode) config.items().get(1)).name());
        }

        @Test
        @DisplayName("Missing value names the option")
        void testMissingValue() {
            ZapParseException e = assertThrows(ZapParseException.class, () -> parse("opt x = {"));

            assertEquals("Expected value for option \"x\". Got 'LEFT_BRACE' at line 1", e.getMessage());
        }
    }

    @Nested
    @DisplayName("Events and Functions")
    class DeclarationTests {

        @Test
        @DisplayName("Event with every property")
        void testFullEvent() {
            EventNode event = (EventNode) parse(
                    "event Ping = { from: Client, type: Reliable, call: SingleAsync, data: (n: f32) }"
            ).items().get(0);

            assertEquals("Ping", event.name());
            assertEquals(ItemKind.EVENT, event.kind());
            assertEquals("Client", event.properties().from());
            assertEquals("Reliable", event.properties().type());
            assertEquals("SingleAsync", event.properties().call());
            assertEquals(new TupleType(List.of(new TupleElement("n", new PrimitiveType("f32")))),
                    event.properties().data());
        }

        @Test
        @DisplayName("Block may open on the next line and use newlines instead of commas")
        void testMultilineEvent() {
            EventNode event = (EventNode) parse("event E =\n{\n\tfrom: Server\n\ttype: Unreliable\n}").items().get(0);

            assertEquals("Server", event.properties().from());
            assertEquals("Unreliable", event.properties().type());
            assertNull(event.properties().call());
            assertNull(event.properties().data());
        }

        @Test
        @DisplayName("Empty event block")
        void testEmptyEvent() {
            EventNode event = (EventNode) parse("event E = {}").items().get(0);
            assertEquals(EventProperties.empty(), event.properties());
        }

        @Test
        @DisplayName("Unknown event property is rejected")
        void testUnknownEventProperty() {
            ZapParseException e = assertThrows(ZapParseException.class, () -> parse("event E = { foo: u8 }"));

            assertTrue(e.getMessage().startsWith("Unknown event property 'foo'"));
            assertEquals(TokenKind.IDENTIFIER, e.getTokenKind());
        }

        @Test
        @DisplayName("Missing event name reports the offending token")
        void testMissingEventName() {
            ZapParseException e = assertThrows(ZapParseException.class, () -> parse("event = {}"));

            assertEquals("Expected event name. Got 'EQUALS' at line 1", e.getMessage());
            assertEquals(TokenKind.EQUALS, e.getTokenKind());
            assertEquals(1, e.getLine());
        }

        @Test
        @DisplayName("Function with every property")
        void testFullFunction() {
            FunctionNode function = (FunctionNode) parse(
                    "funct Get = { call: Async, args: string, rets: u8?, }"
            ).items().get(0);

            assertEquals("Get", function.name());
            assertEquals("Async", function.properties().call());
            assertEquals(new PrimitiveType("string"), function.properties().args());
            assertEquals(new OptionalType(new PrimitiveType("u8")), function.properties().rets());
        }

        @Test
        @DisplayName("Event property is not a function property")
        void testUnknownFunctionProperty() {
            ZapParseException e = assertThrows(ZapParseException.class,
                    () -> parse("funct F = { from: Client }"));

            assertTrue(e.getMessage().startsWith("Unknown function property 'from'"));
            assertEquals(TokenKind.FROM, e.getTokenKind());
        }
    }

    @Nested
    @DisplayName("Namespaces and Comments")
    class NamespaceTests {

        @Test
        @DisplayName("Namespace keeps members in order")
        void testNamespaceMembers() {
            NamespaceNode namespace = (NamespaceNode) parse(
                    "namespace Net = {\n\t-- c\n\tevent E = { from: Client }\n\tfunct F = { call: Sync }\n}"
            ).items().get(0);

            assertEquals("Net", namespace.name());
            assertEquals(List.of(ItemKind.COMMENT, ItemKind.EVENT, ItemKind.FUNCTION),
                    namespace.members().stream().map(NamespaceMember::kind).toList());
            assertEquals(new CommentNode("-- c"), namespace.members().get(0));
        }

        @Test
        @DisplayName("Type definitions are not allowed inside a namespace")
        void testTypeInNamespace() {
            ZapParseException e = assertThrows(ZapParseException.class,
                    () -> parse("namespace N = {\n\ttype A = u8\n}"));

            assertEquals("Unexpected token in namespace. Got 'TYPE' at line 2", e.getMessage());
        }

        @Test
        @DisplayName("Top-level comments are items")
        void testTopLevelComment() {
            ZapConfiguration config = parse("-- header\n\n\ntype A = u8");

            assertEquals(new CommentNode("-- header"), config.items().get(0));
            assertEquals(ItemKind.TYPE_DEFINITION, config.items().get(1).kind());
        }

        @Test
        @DisplayName("Stray token at top level")
        void testUnexpectedTopLevelToken() {
            ZapParseException e = assertThrows(ZapParseException.class, () -> parse("\nu8"));
            assertEquals("Unexpected token. Got 'U8' at line 2", e.getMessage());
        }

        @Test
        @DisplayName("Blank source gives an empty configuration")
        void testBlankSource() {
            ZapConfiguration config = parse("\n\n");

            assertTrue(config.options().isEmpty());
            assertTrue(config.items().isEmpty());
        }
    }

    @Nested
    @DisplayName("Type Expressions")
    class TypeTests {

        @Test
        @DisplayName("Parentheses around a single unnamed type are transparent")
        void testTupleCollapse() {
            assertEquals(new PrimitiveType("string"), parseType("(string)"));
        }

        @Test
        @DisplayName("Single named element stays a tuple")
        void testSingleNamedTuple() {
            assertEquals(new TupleType(List.of(new TupleElement("a", new PrimitiveType("u8")))), parseType("(a: u8)"));
        }

        @Test
        @DisplayName("Unnamed tuple with trailing comma")
        void testUnnamedTuple() {
            assertEquals(new TupleType(List.of(
                    new TupleElement(null, new PrimitiveType("u8")),
                    new TupleElement(null, new PrimitiveType("string"))
            )), parseType("(u8, string,)"));
        }

        @Test
        @DisplayName("Keyword property names are valid tuple element names")
        void testKeywordTupleNames() {
            TupleType tuple = (TupleType) parseType("(data: u8, type: string)");

            assertEquals("data", tuple.elements().get(0).name());
            assertEquals("type", tuple.elements().get(1).name());
        }

        @Test
        @DisplayName("Array suffixes nest left to right")
        void testNestedArrays() {
            assertEquals(new ArrayType(new ArrayType(new PrimitiveType("string"))), parseType("string[][]"));
        }

        @Test
        @DisplayName("Optional applies after array suffixes")
        void testOptionalArray() {
            assertEquals(new OptionalType(new ArrayType(new PrimitiveType("u8"))), parseType("u8[]?"));
        }

        @Test
        @DisplayName("Union binds loosest")
        void testUnion() {
            assertEquals(new UnionType(List.of(
                    new PrimitiveType("u8"),
                    new OptionalType(new PrimitiveType("string")),
                    new PrimitiveType("boolean")
            )), parseType("u8 | string? | boolean"));
        }

        @Test
        @DisplayName("Grouped union as array element")
        void testGroupedUnionArray() {
            assertEquals(new ArrayType(new UnionType(List.of(new PrimitiveType("u8"), new PrimitiveType("string")))),
                    parseType("(u8 | string)[]"));
        }

        @Test
        @DisplayName("Primitive range forms")
        void testPrimitiveRanges() {
            assertEquals(new PrimitiveType("u8", RangeConstraint.exactly(5)), parseType("u8(5)"));
            assertEquals(new PrimitiveType("u8", RangeConstraint.between(1, 10)), parseType("u8(1..10)"));
            assertEquals(new PrimitiveType("u8", RangeConstraint.atLeast(1)), parseType("u8(1..)"));
            assertEquals(new PrimitiveType("u8", RangeConstraint.atMost(10)), parseType("u8(..10)"));
            assertEquals(new PrimitiveType("u8", RangeConstraint.open()), parseType("u8(..)"));
            assertEquals(new PrimitiveType("f32", RangeConstraint.between(0, 0.5)), parseType("f32(0..0.5)"));
        }

        @Test
        @DisplayName("Array length constraints")
        void testArrayConstraints() {
            assertEquals(new ArrayType(new PrimitiveType("string"), RangeConstraint.between(1, 10)),
                    parseType("string[1..10]"));
            assertEquals(new ArrayType(new ArrayType(new PrimitiveType("u8"), RangeConstraint.exactly(4)),
                    RangeConstraint.exactly(2)), parseType("u8[4][2]"));
        }

        @Test
        @DisplayName("Map and set")
        void testMapAndSet() {
            assertEquals(new MapType(new PrimitiveType("string"), new PrimitiveType("u8")),
                    parseType("map {[string]: u8}"));
            assertEquals(new SetType(new PrimitiveType("string")), parseType("set { string }"));
        }

        @Test
        @DisplayName("Instance forms")
        void testInstances() {
            assertEquals(new InstanceType(null), parseType("Instance"));
            assertEquals(new InstanceType("Part"), parseType("Instance(Part)"));
            assertEquals(new InstanceType("Part"), parseType("Instance.Part"));
        }

        @Test
        @DisplayName("Untagged enum")
        void testUntaggedEnum() {
            EnumType enumType = (EnumType) parseType("enum { A, B,\n C }");

            assertFalse(enumType.isTagged());
            assertEquals(List.of(new EnumVariant("A"), new EnumVariant("B"), new EnumVariant("C")),
                    enumType.variants());
        }

        @Test
        @DisplayName("Tagged enum with payloads")
        void testTaggedEnum() {
            EnumType enumType = (EnumType) parseType("enum \"kind\" {\n\tA { x: string },\n\tB,\n}");

            assertEquals("kind", enumType.tagField());
            assertEquals(new EnumVariant("A",
                    new StructType(List.of(new StructField("x", new PrimitiveType("string"))))),
                    enumType.variants().get(0));
            assertEquals(new EnumVariant("B"), enumType.variants().get(1));
        }

        @Test
        @DisplayName("Untagged enum rejects payloads")
        void testUntaggedEnumPayload() {
            ZapParseException e = assertThrows(ZapParseException.class, () -> parseType("enum { A { x: u8 } }"));
            assertEquals(TokenKind.LEFT_BRACE, e.getTokenKind());
        }

        @Test
        @DisplayName("Struct keeps field order")
        void testStruct() {
            assertEquals(new StructType(List.of(
                    new StructField("b", new PrimitiveType("string")),
                    new StructField("a", new OptionalType(new PrimitiveType("u8")))
            )), parseType("struct {\n\tb: string,\n\ta: u8?,\n}"));
        }

        @Test
        @DisplayName("Vectors")
        void testVectors() {
            assertEquals(new VectorType(List.of(
                    new PrimitiveType("f32"), new PrimitiveType("f32"), new PrimitiveType("f32")
            )), parseType("vector(f32, f32, f32)"));
            assertEquals(new VectorType(null), parseType("Vector2"));
            assertEquals(new VectorType(null), parseType("Vector3"));
        }

        @ParameterizedTest
        @DisplayName("Built-in names are primitives")
        @ValueSource(strings = {"boolean", "f64", "i16", "u32", "CFrame", "AlignedCFrame", "Color3",
                "BrickColor", "DateTime", "DateTimeMillis", "unknown", "string.utf8", "u8.binary"})
        void testPrimitiveNames(String name) {
            assertEquals(new PrimitiveType(name), parseType(name));
        }

        @Test
        @DisplayName("Unknown dotted name is not a type")
        void testUnknownDottedName() {
            ZapParseException e = assertThrows(ZapParseException.class, () -> parseType("foo.bar"));
            assertEquals("Unexpected token in type. Got 'IDENTIFIER' at line 1", e.getMessage());
        }
    }

    @Nested
    @DisplayName("Token Sequence Contract")
    class ContractTests {

        @Test
        @DisplayName("Empty sequence is rejected")
        void testEmptySequence() {
            assertThrows(IllegalArgumentException.class, () -> parser.parse(List.of()));
        }

        @Test
        @DisplayName("Sequence without EOF is rejected")
        void testMissingEof() {
            assertThrows(IllegalArgumentException.class,
                    () -> parser.parse(List.of(new Token(TokenKind.OPT, "opt", 1, 1))));
        }

        @Test
        @DisplayName("Whitespace tokens are ignored")
        void testWhitespaceTokensIgnored() {
            ZapConfiguration config = parser.parse(List.of(
                    new Token(TokenKind.OPT, "opt", 1, 1),
                    new Token(TokenKind.WHITESPACE, " ", 1, 4),
                    new Token(TokenKind.IDENTIFIER, "x", 1, 5),
                    new Token(TokenKind.EQUALS, "=", 1, 7),
                    new Token(TokenKind.NUMBER_LITERAL, "1", 1, 9),
                    new Token(TokenKind.EOF, "", 1, 10)
            ));

            assertEquals(new OptionNode("x", 1.0), config.options().get(0));
        }

        @Test
        @DisplayName("One instance parses several sources")
        void testReusable() {
            assertEquals(1, parse("type A = u8").items().size());
            assertEquals(2, parse("type A = u8\ntype B = u8").items().size());
        }
    }
}
