package io.github.cyfko.zapformat.core.formatting;

import io.github.cyfko.zapformat.core.ast.*;
import io.github.cyfko.zapformat.core.ast.TypeNode.*;
import io.github.cyfko.zapformat.core.config.FormatPolicy;
import io.github.cyfko.zapformat.core.exception.ZapFormatException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Canonical pretty-printer for Zap configurations.
 * <p>
 * The output is rebuilt entirely from the AST: source layout, comment placement inside blocks
 * and property order are not preserved. Formatting is deterministic and idempotent, i.e.
 * formatting the parse of a formatted text yields the same text.
 * </p>
 *
 * <h2>Layout rules</h2>
 * <ul>
 *   <li>options first, one per line, then a blank line, then the items</li>
 *   <li>a blank line between two items unless the first one is a comment</li>
 *   <li>events and functions always use the block form, properties in canonical order
 *       ({@code from type call data} and {@code call args rets}), each followed by a comma</li>
 *   <li>structs, tuples and enums stay on one line while that line fits
 *       {@link FormatPolicy#maxInlineWidth()}, otherwise one entry per line</li>
 * </ul>
 *
 * <h2>Usage example</h2>
 * <pre>{@code
 * ZapFormatter formatter = new ZapFormatter();
 * String text = formatter.format(config);
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe; the indentation depth is tracked per call.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ZapFormatter {

    private static final Pattern NON_WORD_CHARACTER = Pattern.compile("[^a-zA-Z0-9_]");
    private static final Pattern COMMENT_MARKER = Pattern.compile("^--");

    private final FormatPolicy policy;

    public ZapFormatter() {
        this(FormatPolicy.defaults());
    }

    /**
     * @param policy layout settings
     * @throws IllegalArgumentException if policy is null
     */
    public ZapFormatter(FormatPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Format policy is required");
        }
        this.policy = policy;
    }

    public FormatPolicy getPolicy() {
        return policy;
    }

    /**
     * Renders a configuration in canonical form.
     *
     * @param configuration the configuration to render
     * @return the formatted text, lines separated by {@code \n}, without a trailing newline
     * @throws ZapFormatException if the AST is malformed
     */
    public String format(ZapConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        return new Renderer().configuration(configuration);
    }

    /**
     * Renders a single type expression as it would appear at top level.
     *
     * @param type the type to render
     * @return the formatted type
     * @throws ZapFormatException if the AST is malformed
     */
    public String formatType(TypeNode type) {
        return new Renderer().type(type);
    }

    /**
     * Renders an option value.
     * <p>
     * Booleans and numbers are printed as is. A string already wrapped in double quotes keeps its
     * quotes, with its content re-escaped.
     * Any other string is quoted when it contains a non-word character and no {@code (}, so that
     * call-like values such as {@code require(...)} stay bare.
     * </p>
     *
     * @param value a {@link Boolean}, {@link Double} or {@link String}
     * @return the rendered value
     */
    static String formatOptionValue(Object value) {
        if (value instanceof String text) {
            if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
                return quote(text.substring(1, text.length() - 1));
            }
            if (NON_WORD_CHARACTER.matcher(text).find() && !text.contains("(")) return quote(text);
            return text;
        }
        if (value instanceof Double number) return formatNumber(number);
        if (value instanceof Boolean) return value.toString();
        throw new ZapFormatException("Malformed AST: unsupported option value " + value);
    }

    /**
     * Wraps text in double quotes, escaping what the lexer decodes inside a string literal.
     */
    static String quote(String text) {
        StringBuilder quoted = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> quoted.append("\\\"");
                case '\\' -> quoted.append("\\\\");
                case '\n' -> quoted.append("\\n");
                case '\r' -> quoted.append("\\r");
                case '\t' -> quoted.append("\\t");
                default -> quoted.append(c);
            }
        }
        return quoted.append('"').toString();
    }

    /**
     * {@code n}, {@code a..b}, {@code a..}, {@code ..b} or {@code ..}.
     */
    static String formatRange(RangeConstraint range) {
        Double min = range.min();
        Double max = range.max();
        if (min != null && max != null) {
            if (min.doubleValue() == max.doubleValue()) return formatNumber(min);
            return formatNumber(min) + ".." + formatNumber(max);
        }
        if (min != null) return formatNumber(min) + "..";
        if (max != null) return ".." + formatNumber(max);
        return "..";
    }

    /**
     * Shortest plain decimal form: {@code 10} rather than {@code 10.0}, never an exponent.
     */
    static String formatNumber(double value) {
        if (!Double.isFinite(value)) return Double.toString(value);
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static <T> T narrow(Object node, Class<T> type, Enum<?> kind) {
        if (!type.isInstance(node)) {
            throw new ZapFormatException(String.format(
                    "Malformed AST: node of kind %s is a %s, expected %s",
                    kind, node.getClass().getSimpleName(), type.getSimpleName()));
        }
        return type.cast(node);
    }

    /**
     * State of one formatting call: the current indentation depth.
     */
    private final class Renderer {
        private int depth = 0;

        String configuration(ZapConfiguration configuration) {
            List<String> lines = new ArrayList<>();

            for (OptionNode option : configuration.options()) {
                lines.add("opt " + option.key() + " = " + formatOptionValue(option.value()));
            }
            if (!configuration.options().isEmpty() && !configuration.items().isEmpty()) {
                lines.add("");
            }

            List<ConfigItem> items = configuration.items();
            for (int i = 0; i < items.size(); i++) {
                ConfigItem item = items.get(i);
                lines.add(item(item));
                if (i < items.size() - 1 && item.kind() != ItemKind.COMMENT) lines.add("");
            }

            return String.join("\n", lines);
        }

        private String item(ConfigItem item) {
            return switch (item.kind()) {
                case COMMENT -> narrow(item, CommentNode.class, item.kind()).text();
                case EVENT -> event(narrow(item, EventNode.class, item.kind()));
                case FUNCTION -> function(narrow(item, FunctionNode.class, item.kind()));
                case NAMESPACE -> namespace(narrow(item, NamespaceNode.class, item.kind()));
                case TYPE_DEFINITION -> typeDefinition(narrow(item, TypeDefinitionNode.class, item.kind()));
            };
        }

        private String event(EventNode event) {
            String indent = indent();
            EventProperties properties = event.properties();
            List<String> lines = new ArrayList<>();
            lines.add(indent + "event " + event.name() + " = {");

            depth++;
            String propertyIndent = indent();
            if (properties.from() != null) lines.add(propertyIndent + "from: " + properties.from() + ",");
            if (properties.type() != null) lines.add(propertyIndent + "type: " + properties.type() + ",");
            if (properties.call() != null) lines.add(propertyIndent + "call: " + properties.call() + ",");
            if (properties.data() != null) lines.add(propertyIndent + "data: " + type(properties.data()) + ",");
            depth--;

            lines.add(indent + "}");
            return String.join("\n", lines);
        }

        private String function(FunctionNode function) {
            String indent = indent();
            FunctionProperties properties = function.properties();
            List<String> lines = new ArrayList<>();
            lines.add(indent + "funct " + function.name() + " = {");

            depth++;
            String propertyIndent = indent();
            if (properties.call() != null) lines.add(propertyIndent + "call: " + properties.call() + ",");
            if (properties.args() != null) lines.add(propertyIndent + "args: " + type(properties.args()) + ",");
            if (properties.rets() != null) lines.add(propertyIndent + "rets: " + type(properties.rets()) + ",");
            depth--;

            lines.add(indent + "}");
            return String.join("\n", lines);
        }

        private String namespace(NamespaceNode namespace) {
            String indent = indent();
            List<NamespaceMember> members = namespace.members();
            List<String> lines = new ArrayList<>();
            lines.add(indent + "namespace " + namespace.name() + " = {");

            depth++;
            for (int i = 0; i < members.size(); i++) {
                NamespaceMember member = members.get(i);
                String formatted = item(member);
                if (member.kind() == ItemKind.COMMENT) {
                    formatted = indent() + COMMENT_MARKER.matcher(formatted).replaceFirst("--");
                }
                lines.add(formatted);
                if (i < members.size() - 1 && member.kind() != ItemKind.COMMENT) lines.add("");
            }
            depth--;

            lines.add(indent + "}");
            return String.join("\n", lines);
        }

        private String typeDefinition(TypeDefinitionNode definition) {
            return indent() + "type " + definition.name() + " = " + type(definition.definition());
        }

        String type(TypeNode type) {
            if (type == null) {
                throw new ZapFormatException("Malformed AST: missing type node");
            }
            TypeKind kind = type.kind();
            return switch (kind) {
                case PRIMITIVE -> primitive(narrow(type, PrimitiveType.class, kind));
                case ARRAY -> array(narrow(type, ArrayType.class, kind));
                case MAP -> map(narrow(type, MapType.class, kind));
                case SET -> "set {" + type(narrow(type, SetType.class, kind).elementType()) + "}";
                case OPTIONAL -> optional(narrow(type, OptionalType.class, kind));
                case UNION -> union(narrow(type, UnionType.class, kind));
                case INSTANCE -> instance(narrow(type, InstanceType.class, kind));
                case TUPLE -> tuple(narrow(type, TupleType.class, kind));
                case STRUCT -> struct(narrow(type, StructType.class, kind), "struct ");
                case ENUM -> enumeration(narrow(type, EnumType.class, kind));
                case VECTOR -> vector(narrow(type, VectorType.class, kind));
            };
        }

        private String primitive(PrimitiveType primitive) {
            if (primitive.constraint() == null) return primitive.name();
            return primitive.name() + "(" + formatRange(primitive.constraint()) + ")";
        }

        private String array(ArrayType array) {
            TypeNode element = array.elementType();
            boolean grouped = element.kind() == TypeKind.UNION || element.kind() == TypeKind.OPTIONAL;
            String constraint = array.constraint() == null ? "" : formatRange(array.constraint());
            return group(type(element), grouped) + "[" + constraint + "]";
        }

        private String map(MapType map) {
            return "map {[" + type(map.keyType()) + "]: " + type(map.valueType()) + "}";
        }

        private String optional(OptionalType optional) {
            TypeNode inner = optional.innerType();
            boolean grouped = inner.kind() == TypeKind.UNION || inner.kind() == TypeKind.OPTIONAL;
            return group(type(inner), grouped) + "?";
        }

        private String union(UnionType union) {
            List<String> members = new ArrayList<>(union.types().size());
            for (TypeNode member : union.types()) members.add(type(member));
            return String.join(" | ", members);
        }

        private String instance(InstanceType instance) {
            String className = instance.className();
            if (className == null || className.isEmpty()) return "Instance";
            return "Instance." + className;
        }

        private String tuple(TupleType tuple) {
            depth++;
            List<String> elements = new ArrayList<>(tuple.elements().size());
            for (TupleElement element : tuple.elements()) {
                String rendered = type(element.type());
                elements.add(element.name() == null ? rendered : element.name() + ": " + rendered);
            }
            String elementIndent = indent();
            depth--;

            String inline = "(" + String.join(", ", elements) + ")";
            if (fitsInline(inline)) return inline;

            List<String> lines = new ArrayList<>();
            lines.add("(");
            for (int i = 0; i < elements.size(); i++) {
                lines.add(elementIndent + elements.get(i) + (i < elements.size() - 1 ? "," : ""));
            }
            lines.add(indent() + ")");
            return String.join("\n", lines);
        }

        /**
         * @param keyword {@code "struct "} for a struct type, empty for a tagged-enum payload
         */
        private String struct(StructType struct, String keyword) {
            depth++;
            List<String> fields = new ArrayList<>(struct.fields().size());
            for (StructField field : struct.fields()) {
                fields.add(field.name() + ": " + type(field.type()));
            }
            String fieldIndent = indent();
            depth--;

            String inline = keyword + "{" + String.join(", ", fields) + "}";
            if (fitsInline(inline)) return inline;

            List<String> lines = new ArrayList<>();
            lines.add(keyword + "{");
            for (int i = 0; i < fields.size(); i++) {
                lines.add(fieldIndent + fields.get(i) + (i < fields.size() - 1 ? "," : ""));
            }
            lines.add(indent() + "}");
            return String.join("\n", lines);
        }

        private String enumeration(EnumType enumType) {
            List<EnumVariant> variants = enumType.variants();
            String head = enumType.isTagged() ? "enum " + quote(enumType.tagField()) : "enum";

            if (!enumType.isTagged() && variants.stream().allMatch(variant -> variant.fields() == null)) {
                List<String> names = new ArrayList<>(variants.size());
                for (EnumVariant variant : variants) names.add(variant.name());
                String inline = head + " {" + String.join(", ", names) + "}";
                if (fitsInline(inline)) return inline;
            }

            List<String> lines = new ArrayList<>();
            lines.add(head + " {");

            depth++;
            String variantIndent = indent();
            for (int i = 0; i < variants.size(); i++) {
                EnumVariant variant = variants.get(i);
                boolean last = i == variants.size() - 1;

                String line = variantIndent + variant.name();
                if (variant.fields() != null) line += " " + struct(variant.fields(), "");
                lines.add(line + (last ? "" : ","));

                if (enumType.isTagged() && variant.fields() != null && !last) lines.add("");
            }
            depth--;

            lines.add(indent() + "}");
            return String.join("\n", lines);
        }

        private String vector(VectorType vector) {
            if (vector.components() == null) return "Vector3";
            List<String> components = new ArrayList<>(vector.components().size());
            for (TypeNode component : vector.components()) components.add(type(component));
            return "vector(" + String.join(", ", components) + ")";
        }

        private String group(String rendered, boolean grouped) {
            return grouped ? "(" + rendered + ")" : rendered;
        }

        private boolean fitsInline(String candidate) {
            return candidate.length() <= policy.maxInlineWidth();
        }

        private String indent() {
            return policy.indentUnit().repeat(depth);
        }
    }
}
