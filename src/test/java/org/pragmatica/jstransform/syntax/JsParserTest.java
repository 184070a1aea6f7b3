package org.pragmatica.jstransform.syntax;

import org.junit.jupiter.api.Test;
import org.pragmatica.jstransform.error.TransformError;
import org.pragmatica.jstransform.error.TransformException;
import org.pragmatica.jstransform.tree.SyntaxNode.ArrowFunctionExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.BinaryExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.BlockStatement;
import org.pragmatica.jstransform.tree.SyntaxNode.CallExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.ComputedPropName;
import org.pragmatica.jstransform.tree.SyntaxNode.DeclarationKind;
import org.pragmatica.jstransform.tree.SyntaxNode.ExpressionStatement;
import org.pragmatica.jstransform.tree.SyntaxNode.Expression;
import org.pragmatica.jstransform.tree.SyntaxNode.FunctionDeclaration;
import org.pragmatica.jstransform.tree.SyntaxNode.Identifier;
import org.pragmatica.jstransform.tree.SyntaxNode.IfStatement;
import org.pragmatica.jstransform.tree.SyntaxNode.MemberExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.ObjectExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.ParenthesisExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.StringLiteral;
import org.pragmatica.jstransform.tree.SyntaxNode.VariableDeclaration;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class JsParserTest {

    @Test
    void parse_consoleCall_producesMemberCallee() throws TransformException {
        var call = assertInstanceOf(CallExpression.class, onlyExpression("console.log(\"hello\")"));

        var callee = assertInstanceOf(MemberExpression.class, call.callee());
        assertEquals("console", assertInstanceOf(Identifier.class, callee.object()).value());
        assertEquals("log", assertInstanceOf(Identifier.class, callee.property()).value());
        assertEquals(1, call.arguments().size());
        var argument = assertInstanceOf(StringLiteral.class, call.arguments().get(0).expression());
        assertEquals("hello", argument.value());
        assertEquals("\"hello\"", argument.raw());
    }

    @Test
    void parse_computedMember_producesComputedPropName() throws TransformException {
        var call = assertInstanceOf(CallExpression.class, onlyExpression("console['warn'](1)"));

        var callee = assertInstanceOf(MemberExpression.class, call.callee());
        var property = assertInstanceOf(ComputedPropName.class, callee.property());
        assertEquals("warn", assertInstanceOf(StringLiteral.class, property.expression()).value());
    }

    @Test
    void parse_parenthesizedObject_keepsParenthesis() throws TransformException {
        var call = assertInstanceOf(CallExpression.class, onlyExpression("(console).log(1)"));

        var callee = assertInstanceOf(MemberExpression.class, call.callee());
        assertInstanceOf(ParenthesisExpression.class, callee.object());
    }

    @Test
    void parse_spreadArgument_isMarked() throws TransformException {
        var call = assertInstanceOf(CallExpression.class, onlyExpression("f(a, ...rest)"));

        assertFalse(call.arguments().get(0).spread());
        assertTrue(call.arguments().get(1).spread());
    }

    @Test
    void parse_binaryOperators_respectPrecedence() throws TransformException {
        var sum = assertInstanceOf(BinaryExpression.class, onlyExpression("1 + 2 * 3"));

        assertEquals("+", sum.operator());
        assertEquals("*", assertInstanceOf(BinaryExpression.class, sum.right()).operator());
    }

    @Test
    void parse_exponent_isRightAssociative() throws TransformException {
        var power = assertInstanceOf(BinaryExpression.class, onlyExpression("2 ** 3 ** 2"));

        assertInstanceOf(BinaryExpression.class, power.right());
    }

    @Test
    void parse_declarationsAndFunctions_produceStatements() throws TransformException {
        var program = JsParser.parse("""
            const x = 1, y = 2;
            let z;
            function greet(name) {
                return "hi " + name;
            }
            if (x) greet("a"); else { greet("b") }
            """);

        assertThat(program.body()).hasSize(4);
        var constant = assertInstanceOf(VariableDeclaration.class, program.body().get(0));
        assertEquals(DeclarationKind.CONST, constant.kind());
        assertEquals(2, constant.declarations().size());
        var let = assertInstanceOf(VariableDeclaration.class, program.body().get(1));
        assertTrue(let.declarations().get(0).init().isEmpty());
        var function = assertInstanceOf(FunctionDeclaration.class, program.body().get(2));
        assertEquals("greet", function.identifier().value());
        assertEquals(1, function.params().size());
        var ifStatement = assertInstanceOf(IfStatement.class, program.body().get(3));
        assertInstanceOf(BlockStatement.class, ifStatement.alternate().orElseThrow());
    }

    @Test
    void parse_arrowFunctions_areRecognized() throws TransformException {
        var single = assertInstanceOf(ArrowFunctionExpression.class, onlyExpression("x => x * 2"));
        assertEquals(1, single.params().size());

        var multi = assertInstanceOf(ArrowFunctionExpression.class, onlyExpression("(a, b) => { return a }"));
        assertEquals(2, multi.params().size());
        assertInstanceOf(BlockStatement.class, multi.body());
    }

    @Test
    void parse_objectLiteral_acceptsReservedWordKeys() throws TransformException {
        var object = assertInstanceOf(ObjectExpression.class,
                                      assertInstanceOf(ParenthesisExpression.class, onlyExpression("({ if: 1, 'b': 2, [k]: 3 })"))
                                          .expression());

        assertEquals(3, object.properties().size());
    }

    @Test
    void parse_missingSemicolonAtLineBreak_isAccepted() throws TransformException {
        var program = JsParser.parse("a()\nb()");

        assertEquals(2, program.body().size());
    }

    @Test
    void parse_missingSemicolonOnSameLine_isRejected() {
        var exception = assertThrows(TransformException.class, () -> JsParser.parse("a() b()"));

        var error = assertInstanceOf(TransformError.UnexpectedToken.class, exception.error());
        assertEquals("b", error.found());
        assertEquals("';'", error.expected());
    }

    @Test
    void parse_unclosedCall_reportsEndOfInput() {
        var exception = assertThrows(TransformException.class, () -> JsParser.parse("console.log(\"hello\""));

        assertInstanceOf(TransformError.UnexpectedEof.class, exception.error());
    }

    @Test
    void parse_unexpectedToken_reportsLocation() {
        var exception = assertThrows(TransformException.class, () -> JsParser.parse("console.log(\"hi\" 2)"));

        var error = assertInstanceOf(TransformError.UnexpectedToken.class, exception.error());
        assertEquals(1, error.location().line());
        assertEquals(18, error.location().column());
        assertEquals("2", error.found());
        assertEquals("')'", error.expected());
    }

    @Test
    void parse_lexicalError_isReported() {
        var exception = assertThrows(TransformException.class, () -> JsParser.parse("let s = 'open"));

        var error = assertInstanceOf(TransformError.LexicalError.class, exception.error());
        assertThat(error.message()).contains("Unterminated string literal");
    }

    @Test
    void parse_constWithoutInitializer_isRejected() {
        assertThrows(TransformException.class, () -> JsParser.parse("const x;"));
    }

    @Test
    void parse_assignmentToLiteral_isRejected() {
        assertThrows(TransformException.class, () -> JsParser.parse("1 = 2"));
    }

    @Test
    void parse_oversizedInput_isLexicalError() {
        var input = "a".repeat(JsParser.MAX_INPUT_SIZE + 1);

        var exception = assertThrows(TransformException.class, () -> JsParser.parse(input));

        assertInstanceOf(TransformError.LexicalError.class, exception.error());
    }

    @Test
    void parse_excessiveNesting_isRejected() {
        int levels = JsParser.MAX_NESTING_DEPTH * 2;
        var sources = List.of(
            "[".repeat(levels) + "]".repeat(levels),
            "(".repeat(levels) + "x" + ")".repeat(levels),
            "-".repeat(levels) + "x",
            "a" + ".b".repeat(levels),
            "f" + "()".repeat(levels),
            "a" + " + a".repeat(levels),
            "{".repeat(levels) + "}".repeat(levels),
            "x => ".repeat(levels) + "x");

        for (var source : sources) {
            var exception = assertThrows(TransformException.class, () -> JsParser.parse(source));
            var error = assertInstanceOf(TransformError.NestingTooDeep.class, exception.error());
            assertEquals(JsParser.MAX_NESTING_DEPTH, error.limit());
        }
    }

    @Test
    void parse_nestingBelowLimit_isAccepted() throws TransformException {
        int levels = JsParser.MAX_NESTING_DEPTH / 2;

        assertEquals(1, JsParser.parse("[".repeat(levels) + "]".repeat(levels)).body().size());
        assertEquals(1, JsParser.parse("a" + ".b".repeat(levels)).body().size());
        assertEquals(1, JsParser.parse("a" + " + a".repeat(levels)).body().size());
    }

    @Test
    void parse_sequentialStatements_doNotAccumulateNesting() throws TransformException {
        var source = "f(g(h(1)));\n".repeat(JsParser.MAX_NESTING_DEPTH * 2);

        assertEquals(JsParser.MAX_NESTING_DEPTH * 2, JsParser.parse(source).body().size());
    }

    private static Expression onlyExpression(String source) throws TransformException {
        var program = JsParser.parse(source);
        assertEquals(1, program.body().size());
        return assertInstanceOf(ExpressionStatement.class, program.body().get(0)).expression();
    }
}
