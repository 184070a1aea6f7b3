package org.pragmatica.jstransform.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.pragmatica.jstransform.error.TransformError;
import org.pragmatica.jstransform.error.TransformException;
import org.pragmatica.jstransform.syntax.JsParser;
import org.pragmatica.jstransform.tree.SourceLocation;
import org.pragmatica.jstransform.tree.SourceSpan;
import org.pragmatica.jstransform.tree.SyntaxNode;
import org.pragmatica.jstransform.tree.SyntaxNode.ArrowBody;
import org.pragmatica.jstransform.tree.SyntaxNode.ArrowFunctionExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.Argument;
import org.pragmatica.jstransform.tree.SyntaxNode.ArrayExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.AssignmentExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.BinaryExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.BlockStatement;
import org.pragmatica.jstransform.tree.SyntaxNode.BooleanLiteral;
import org.pragmatica.jstransform.tree.SyntaxNode.CallExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.ComputedPropName;
import org.pragmatica.jstransform.tree.SyntaxNode.ConditionalExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.DeclarationKind;
import org.pragmatica.jstransform.tree.SyntaxNode.EmptyStatement;
import org.pragmatica.jstransform.tree.SyntaxNode.Expression;
import org.pragmatica.jstransform.tree.SyntaxNode.ExpressionStatement;
import org.pragmatica.jstransform.tree.SyntaxNode.FunctionDeclaration;
import org.pragmatica.jstransform.tree.SyntaxNode.Identifier;
import org.pragmatica.jstransform.tree.SyntaxNode.IfStatement;
import org.pragmatica.jstransform.tree.SyntaxNode.KeyValueProperty;
import org.pragmatica.jstransform.tree.SyntaxNode.MemberExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.MemberProperty;
import org.pragmatica.jstransform.tree.SyntaxNode.NullLiteral;
import org.pragmatica.jstransform.tree.SyntaxNode.NumericLiteral;
import org.pragmatica.jstransform.tree.SyntaxNode.ObjectExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.ParenthesisExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.Program;
import org.pragmatica.jstransform.tree.SyntaxNode.PropertyKey;
import org.pragmatica.jstransform.tree.SyntaxNode.ReturnStatement;
import org.pragmatica.jstransform.tree.SyntaxNode.Statement;
import org.pragmatica.jstransform.tree.SyntaxNode.StringLiteral;
import org.pragmatica.jstransform.tree.SyntaxNode.UnaryExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.VariableDeclaration;
import org.pragmatica.jstransform.tree.SyntaxNode.VariableDeclarator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts a {@link Program} to and from its JSON representation.
 *
 * <p>Every node is a JSON object with a {@code type} discriminator (the node kind, {@code "Script"}
 * for the program root), a {@code span} and one member per node field. Call arguments and array
 * elements carry no discriminator: {@code {"span": ..., "spread": false, "expression": ...}}.
 * Absent optional children are written as {@code null}.
 */
public final class AstJsonCodec {
    public static final String PROGRAM_TYPE = "Script";

    /**
     * JSON nesting accepted in both directions. One parser nesting level takes at most three JSON
     * levels (node object, child array, argument object), so every parsed tree fits.
     */
    public static final int MAX_JSON_DEPTH = 4 * JsParser.MAX_NESTING_DEPTH;

    private static final ObjectMapper MAPPER = new ObjectMapper(
        JsonFactory.builder()
                   .streamReadConstraints(StreamReadConstraints.builder()
                                                               .maxNestingDepth(MAX_JSON_DEPTH)
                                                               .build())
                   .streamWriteConstraints(StreamWriteConstraints.builder()
                                                                 .maxNestingDepth(MAX_JSON_DEPTH)
                                                                 .build())
                   .build());

    private AstJsonCodec() {}

    // === Encoding ===

    public static String encode(Program program) {
        return write(writeProgram(program), false);
    }

    public static String encodePretty(Program program) {
        return write(writeProgram(program), true);
    }

    public static ObjectNode writeProgram(Program program) {
        var json = node(PROGRAM_TYPE, program.span());
        json.set("body", writeAll(program.body()));
        return json;
    }

    private static String write(ObjectNode json, boolean pretty) {
        try {
            return pretty
                   ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(json)
                   : MAPPER.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize syntax tree", e);
        }
    }

    private static ArrayNode writeAll(List<? extends SyntaxNode> nodes) {
        var array = MAPPER.createArrayNode();
        for (var node : nodes) {
            array.add(writeNode(node));
        }
        return array;
    }

    private static JsonNode writeOptional(Optional<? extends SyntaxNode> node) {
        return node.<JsonNode>map(AstJsonCodec::writeNode)
                   .orElseGet(MAPPER::nullNode);
    }

    private static ObjectNode writeNode(SyntaxNode node) {
        if (node instanceof Argument argument) {
            var json = MAPPER.createObjectNode();
            json.set("span", writeSpan(argument.span()));
            json.put("spread", argument.spread());
            json.set("expression", writeNode(argument.expression()));
            return json;
        }
        var json = node(node.getClass().getSimpleName(), node.span());
        if (node instanceof ExpressionStatement statement) {
            json.set("expression", writeNode(statement.expression()));
        } else if (node instanceof VariableDeclaration declaration) {
            json.put("kind", declaration.kind().keyword());
            json.set("declarations", writeAll(declaration.declarations()));
        } else if (node instanceof VariableDeclarator declarator) {
            json.set("name", writeNode(declarator.name()));
            json.set("init", writeOptional(declarator.init()));
        } else if (node instanceof FunctionDeclaration function) {
            json.set("identifier", writeNode(function.identifier()));
            json.set("params", writeAll(function.params()));
            json.set("body", writeNode(function.body()));
        } else if (node instanceof BlockStatement block) {
            json.set("stmts", writeAll(block.stmts()));
        } else if (node instanceof IfStatement statement) {
            json.set("test", writeNode(statement.test()));
            json.set("consequent", writeNode(statement.consequent()));
            json.set("alternate", writeOptional(statement.alternate()));
        } else if (node instanceof ReturnStatement statement) {
            json.set("argument", writeOptional(statement.argument()));
        } else if (node instanceof Identifier identifier) {
            json.put("value", identifier.value());
        } else if (node instanceof StringLiteral literal) {
            json.put("value", literal.value());
            json.put("raw", literal.raw());
        } else if (node instanceof NumericLiteral literal) {
            json.put("value", literal.value());
            json.put("raw", literal.raw());
        } else if (node instanceof BooleanLiteral literal) {
            json.put("value", literal.value());
        } else if (node instanceof ArrayExpression array) {
            json.set("elements", writeAll(array.elements()));
        } else if (node instanceof ObjectExpression object) {
            json.set("properties", writeAll(object.properties()));
        } else if (node instanceof KeyValueProperty property) {
            json.set("key", writeNode(property.key()));
            json.set("value", writeNode(property.value()));
        } else if (node instanceof MemberExpression member) {
            json.set("object", writeNode(member.object()));
            json.set("property", writeNode(member.property()));
        } else if (node instanceof ComputedPropName computed) {
            json.set("expression", writeNode(computed.expression()));
        } else if (node instanceof CallExpression call) {
            json.set("callee", writeNode(call.callee()));
            json.set("arguments", writeAll(call.arguments()));
        } else if (node instanceof UnaryExpression unary) {
            json.put("operator", unary.operator());
            json.set("argument", writeNode(unary.argument()));
        } else if (node instanceof BinaryExpression binary) {
            json.put("operator", binary.operator());
            json.set("left", writeNode(binary.left()));
            json.set("right", writeNode(binary.right()));
        } else if (node instanceof AssignmentExpression assignment) {
            json.put("operator", assignment.operator());
            json.set("left", writeNode(assignment.left()));
            json.set("right", writeNode(assignment.right()));
        } else if (node instanceof ConditionalExpression conditional) {
            json.set("test", writeNode(conditional.test()));
            json.set("consequent", writeNode(conditional.consequent()));
            json.set("alternate", writeNode(conditional.alternate()));
        } else if (node instanceof ParenthesisExpression parenthesis) {
            json.set("expression", writeNode(parenthesis.expression()));
        } else if (node instanceof ArrowFunctionExpression arrow) {
            json.set("params", writeAll(arrow.params()));
            json.set("body", writeNode(arrow.body()));
        }
        // EmptyStatement and NullLiteral carry only type and span
        return json;
    }

    private static ObjectNode node(String type, SourceSpan span) {
        var json = MAPPER.createObjectNode();
        json.put("type", type);
        json.set("span", writeSpan(span));
        return json;
    }

    private static ObjectNode writeSpan(SourceSpan span) {
        var json = MAPPER.createObjectNode();
        json.set("start", writeLocation(span.start()));
        json.set("end", writeLocation(span.end()));
        return json;
    }

    private static ObjectNode writeLocation(SourceLocation location) {
        var json = MAPPER.createObjectNode();
        json.put("line", location.line());
        json.put("column", location.column());
        json.put("offset", location.offset());
        return json;
    }

    // === Decoding ===

    /**
     * Parse a JSON document into a program.
     *
     * @throws TransformException with {@link TransformError.MalformedAst} if the document is not valid JSON
     *                            or does not describe a syntax tree
     */
    public static Program decode(String json) throws TransformException {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TransformException(new TransformError.MalformedAst("$", "not valid JSON: " + e.getOriginalMessage()), e);
        }
        return readProgram(root);
    }

    public static Program readProgram(JsonNode json) throws TransformException {
        var path = "$";
        requireObject(json, path);
        var type = text(json, "type", path);
        if (!type.equals(PROGRAM_TYPE)) {
            throw malformed(path, "expected " + PROGRAM_TYPE + ", found " + type);
        }
        return new Program(readSpan(json, path), readAll(json, "body", path, Statement.class));
    }

    private static SyntaxNode readNode(JsonNode json, String path) throws TransformException {
        requireObject(json, path);
        var type = text(json, "type", path);
        var span = readSpan(json, path);
        return switch (type) {
            case "ExpressionStatement" ->
                new ExpressionStatement(span, read(json, "expression", path, Expression.class));
            case "VariableDeclaration" -> {
                var keyword = text(json, "kind", path);
                var kind = DeclarationKind.fromKeyword(keyword)
                                          .orElseThrow(() -> malformed(path + ".kind", "unknown declaration kind " + keyword));
                yield new VariableDeclaration(span, kind, readAll(json, "declarations", path, VariableDeclarator.class));
            }
            case "VariableDeclarator" ->
                new VariableDeclarator(span,
                                       read(json, "name", path, Identifier.class),
                                       readOptional(json, "init", path, Expression.class));
            case "FunctionDeclaration" ->
                new FunctionDeclaration(span,
                                        read(json, "identifier", path, Identifier.class),
                                        readAll(json, "params", path, Identifier.class),
                                        read(json, "body", path, BlockStatement.class));
            case "BlockStatement" ->
                new BlockStatement(span, readAll(json, "stmts", path, Statement.class));
            case "IfStatement" ->
                new IfStatement(span,
                                read(json, "test", path, Expression.class),
                                read(json, "consequent", path, Statement.class),
                                readOptional(json, "alternate", path, Statement.class));
            case "ReturnStatement" ->
                new ReturnStatement(span, readOptional(json, "argument", path, Expression.class));
            case "EmptyStatement" ->
                new EmptyStatement(span);
            case "Identifier" ->
                new Identifier(span, text(json, "value", path));
            case "StringLiteral" ->
                stringLiteral(span, text(json, "value", path), text(json, "raw", path), path);
            case "NumericLiteral" ->
                new NumericLiteral(span, number(json, "value", path), text(json, "raw", path));
            case "BooleanLiteral" ->
                new BooleanLiteral(span, bool(json, "value", path));
            case "NullLiteral" ->
                new NullLiteral(span);
            case "ArrayExpression" ->
                new ArrayExpression(span, readArguments(json, "elements", path));
            case "ObjectExpression" ->
                new ObjectExpression(span, readAll(json, "properties", path, KeyValueProperty.class));
            case "KeyValueProperty" ->
                new KeyValueProperty(span,
                                     read(json, "key", path, PropertyKey.class),
                                     read(json, "value", path, Expression.class));
            case "MemberExpression" ->
                new MemberExpression(span,
                                     read(json, "object", path, Expression.class),
                                     read(json, "property", path, MemberProperty.class));
            case "ComputedPropName" ->
                new ComputedPropName(span, read(json, "expression", path, Expression.class));
            case "CallExpression" ->
                new CallExpression(span,
                                   read(json, "callee", path, Expression.class),
                                   readArguments(json, "arguments", path));
            case "UnaryExpression" ->
                new UnaryExpression(span, text(json, "operator", path), read(json, "argument", path, Expression.class));
            case "BinaryExpression" ->
                new BinaryExpression(span,
                                     text(json, "operator", path),
                                     read(json, "left", path, Expression.class),
                                     read(json, "right", path, Expression.class));
            case "AssignmentExpression" ->
                new AssignmentExpression(span,
                                         text(json, "operator", path),
                                         read(json, "left", path, Expression.class),
                                         read(json, "right", path, Expression.class));
            case "ConditionalExpression" ->
                new ConditionalExpression(span,
                                          read(json, "test", path, Expression.class),
                                          read(json, "consequent", path, Expression.class),
                                          read(json, "alternate", path, Expression.class));
            case "ParenthesisExpression" ->
                new ParenthesisExpression(span, read(json, "expression", path, Expression.class));
            case "ArrowFunctionExpression" ->
                new ArrowFunctionExpression(span,
                                            readAll(json, "params", path, Identifier.class),
                                            read(json, "body", path, ArrowBody.class));
            default -> throw malformed(path + ".type", "unknown node type " + type);
        };
    }

    private static StringLiteral stringLiteral(SourceSpan span, String value, String raw, String path) throws TransformException {
        try {
            return new StringLiteral(span, value, raw);
        } catch (IllegalArgumentException e) {
            throw new TransformException(new TransformError.MalformedAst(path, e.getMessage()), e);
        }
    }

    private static <T extends SyntaxNode> T read(JsonNode json, String field, String path, Class<T> kind)
    throws TransformException {
        var fieldPath = path + "." + field;
        return narrow(readNode(required(json, field, path), fieldPath), fieldPath, kind);
    }

    private static <T extends SyntaxNode> Optional<T> readOptional(JsonNode json, String field, String path, Class<T> kind)
    throws TransformException {
        var value = json.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        var fieldPath = path + "." + field;
        return Optional.of(narrow(readNode(value, fieldPath), fieldPath, kind));
    }

    private static <T extends SyntaxNode> List<T> readAll(JsonNode json, String field, String path, Class<T> kind)
    throws TransformException {
        var array = requiredArray(json, field, path);
        var result = new ArrayList<T>(array.size());
        for (int i = 0; i < array.size(); i++) {
            var elementPath = path + "." + field + "[" + i + "]";
            result.add(narrow(readNode(array.get(i), elementPath), elementPath, kind));
        }
        return result;
    }

    private static List<Argument> readArguments(JsonNode json, String field, String path) throws TransformException {
        var array = requiredArray(json, field, path);
        var result = new ArrayList<Argument>(array.size());
        for (int i = 0; i < array.size(); i++) {
            var elementPath = path + "." + field + "[" + i + "]";
            var element = array.get(i);
            requireObject(element, elementPath);
            result.add(new Argument(readSpan(element, elementPath),
                                    bool(element, "spread", elementPath),
                                    read(element, "expression", elementPath, Expression.class)));
        }
        return result;
    }

    private static <T extends SyntaxNode> T narrow(SyntaxNode node, String path, Class<T> kind) throws TransformException {
        if (!kind.isInstance(node)) {
            throw malformed(path, "expected " + kind.getSimpleName() + ", found " + node.getClass().getSimpleName());
        }
        return kind.cast(node);
    }

    private static SourceSpan readSpan(JsonNode json, String path) throws TransformException {
        var spanPath = path + ".span";
        var span = required(json, "span", path);
        requireObject(span, spanPath);
        return SourceSpan.of(readLocation(required(span, "start", spanPath), spanPath + ".start"),
                             readLocation(required(span, "end", spanPath), spanPath + ".end"));
    }

    private static SourceLocation readLocation(JsonNode json, String path) throws TransformException {
        requireObject(json, path);
        return SourceLocation.at(integer(json, "line", path), integer(json, "column", path), integer(json, "offset", path));
    }

    // === Field access ===

    private static JsonNode required(JsonNode json, String field, String path) throws TransformException {
        var value = json.get(field);
        if (value == null || value.isNull()) {
            throw malformed(path, "missing field '" + field + "'");
        }
        return value;
    }

    private static ArrayNode requiredArray(JsonNode json, String field, String path) throws TransformException {
        var value = required(json, field, path);
        if (!value.isArray()) {
            throw malformed(path + "." + field, "expected an array");
        }
        return (ArrayNode) value;
    }

    private static void requireObject(JsonNode json, String path) throws TransformException {
        if (!json.isObject()) {
            throw malformed(path, "expected an object, found " + json.getNodeType());
        }
    }

    private static String text(JsonNode json, String field, String path) throws TransformException {
        var value = required(json, field, path);
        if (!value.isTextual()) {
            throw malformed(path + "." + field, "expected a string");
        }
        return value.textValue();
    }

    private static double number(JsonNode json, String field, String path) throws TransformException {
        var value = required(json, field, path);
        if (!value.isNumber()) {
            throw malformed(path + "." + field, "expected a number");
        }
        return value.doubleValue();
    }

    private static int integer(JsonNode json, String field, String path) throws TransformException {
        var value = required(json, field, path);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw malformed(path + "." + field, "expected an integer");
        }
        return value.intValue();
    }

    private static boolean bool(JsonNode json, String field, String path) throws TransformException {
        var value = required(json, field, path);
        if (!value.isBoolean()) {
            throw malformed(path + "." + field, "expected a boolean");
        }
        return value.booleanValue();
    }

    private static TransformException malformed(String path, String reason) {
        return new TransformException(new TransformError.MalformedAst(path, reason));
    }
}
