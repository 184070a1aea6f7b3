package org.pragmatica.jstransform.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.pragmatica.jstransform.error.TransformError;
import org.pragmatica.jstransform.error.TransformException;
import org.pragmatica.jstransform.syntax.JsParser;
import org.pragmatica.jstransform.tree.SourceSpan;
import org.pragmatica.jstransform.tree.SyntaxNode.Argument;
import org.pragmatica.jstransform.tree.SyntaxNode.CallExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.Expression;
import org.pragmatica.jstransform.tree.SyntaxNode.ExpressionStatement;
import org.pragmatica.jstransform.tree.SyntaxNode.Identifier;
import org.pragmatica.jstransform.tree.SyntaxNode.NumericLiteral;
import org.pragmatica.jstransform.tree.SyntaxNode.Program;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AstJsonCodecTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String PROGRAM = """
        const greet = (name) => console.log("hi " + name, { loud: true });
        function main(args) {
            if (!args.length) {
                return null;
            } else greet(args[0], ...args);
            let count = -1.5e3;
        }
        main([1, 'two', 0x3]);
        """;

    @Test
    void encode_consoleCall_producesTypedNodes() throws Exception {
        var json = MAPPER.readTree(AstJsonCodec.encode(JsParser.parse("console.log(\"hello\")")));

        assertEquals(AstJsonCodec.PROGRAM_TYPE, json.get("type").asText());
        var call = json.get("body").get(0).get("expression");
        assertEquals("CallExpression", call.get("type").asText());
        assertEquals("MemberExpression", call.get("callee").get("type").asText());
        assertEquals("console", call.get("callee").get("object").get("value").asText());
        var argument = call.get("arguments").get(0);
        assertFalse(argument.has("type"));
        assertFalse(argument.get("spread").asBoolean());
        assertEquals("hello", argument.get("expression").get("value").asText());
        assertEquals("\"hello\"", argument.get("expression").get("raw").asText());
        assertEquals(13, argument.get("span").get("start").get("column").asInt());
    }

    @Test
    void decode_encodedProgram_restoresEqualTree() throws TransformException {
        var program = JsParser.parse(PROGRAM);

        assertEquals(program, AstJsonCodec.decode(AstJsonCodec.encode(program)));
        assertEquals(program, AstJsonCodec.decode(AstJsonCodec.encodePretty(program)));
    }

    @Test
    void encode_absentOptionalChild_isNull() throws Exception {
        var json = MAPPER.readTree(AstJsonCodec.encode(JsParser.parse("let x;")));

        assertTrue(json.get("body").get(0).get("declarations").get(0).get("init").isNull());
    }

    @Test
    void decode_invalidJson_isMalformedAtRoot() {
        var error = malformed("{not json");

        assertEquals("$", error.path());
        assertThat(error.reason()).startsWith("not valid JSON");
    }

    @Test
    void decode_wrongRootType_isMalformed() {
        var error = malformed("{\"type\": \"Module\", \"body\": []}");

        assertEquals("$", error.path());
    }

    @Test
    void decode_unknownNodeType_reportsPath() throws TransformException {
        var json = tree("foo()");
        statement(json).put("type", "WhileStatement");

        var error = malformed(json.toString());

        assertEquals("$.body[0].type", error.path());
    }

    @Test
    void decode_statementWhereExpressionExpected_reportsPath() throws TransformException {
        var json = tree("foo(); ;");
        statement(json).set("expression", json.get("body").get(1));

        var error = malformed(json.toString());

        assertEquals("$.body[0].expression", error.path());
        assertThat(error.reason()).contains("Expression").contains("EmptyStatement");
    }

    @Test
    void decode_inconsistentStringLiteral_isRejected() throws TransformException {
        var json = tree("console.log(\"hello\")");
        var literal = (ObjectNode) statement(json).get("expression").get("arguments").get(0).get("expression");
        literal.put("value", "from_plugin");

        var error = malformed(json.toString());

        assertEquals("$.body[0].expression.arguments[0].expression", error.path());
    }

    @Test
    void decode_missingSpan_isRejected() throws TransformException {
        var json = tree("foo()");
        statement(json).remove("span");

        var error = malformed(json.toString());

        assertEquals("$.body[0]", error.path());
        assertThat(error.reason()).contains("span");
    }

    @Test
    void encode_deepCallChain_roundTrips() throws TransformException {
        Expression expression = new NumericLiteral(SourceSpan.DUMMY, 1, "1");
        for (int i = 0; i < 400; i++) {
            expression = new CallExpression(SourceSpan.DUMMY,
                                            new Identifier(SourceSpan.DUMMY, "f"),
                                            List.of(Argument.of(expression)));
        }
        var program = new Program(SourceSpan.DUMMY, List.of(new ExpressionStatement(SourceSpan.DUMMY, expression)));

        assertEquals(program, AstJsonCodec.decode(AstJsonCodec.encode(program)));
    }

    @Test
    void encode_deepestParsedNesting_roundTrips() throws TransformException {
        int levels = JsParser.MAX_NESTING_DEPTH - 10;
        var program = JsParser.parse("[".repeat(levels) + "]".repeat(levels));

        assertEquals(program, AstJsonCodec.decode(AstJsonCodec.encode(program)));
    }

    @Test
    void decode_nestingBeyondLimit_isMalformed() {
        int levels = AstJsonCodec.MAX_JSON_DEPTH + 1;

        var error = malformed("[".repeat(levels) + "]".repeat(levels));

        assertEquals("$", error.path());
    }

    private static ObjectNode tree(String source) throws TransformException {
        return AstJsonCodec.writeProgram(JsParser.parse(source));
    }

    private static ObjectNode statement(ObjectNode program) {
        return (ObjectNode) program.get("body").get(0);
    }

    private static TransformError.MalformedAst malformed(String json) {
        var exception = assertThrows(TransformException.class, () -> AstJsonCodec.decode(json));
        return assertInstanceOf(TransformError.MalformedAst.class, exception.error());
    }
}
