package org.pragmatica.jstransform.visit;

import org.junit.jupiter.api.Test;
import org.pragmatica.jstransform.error.TransformException;
import org.pragmatica.jstransform.syntax.JsParser;
import org.pragmatica.jstransform.tree.JsStrings;
import org.pragmatica.jstransform.tree.SyntaxNode.CallExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.ExpressionStatement;
import org.pragmatica.jstransform.tree.SyntaxNode.StringLiteral;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleArgumentRewriteTest {
    private final ConsoleArgumentRewrite rewrite = new ConsoleArgumentRewrite();

    @Test
    void apply_stringArgument_isReplaced() throws TransformException {
        var result = rewrite.apply(call("console.log(\"hello\")"));

        var literal = assertInstanceOf(StringLiteral.class, result.arguments().get(0).expression());
        assertEquals(ConsoleArgumentRewrite.REPLACEMENT, literal.value());
        assertEquals("\"from_plugin\"", literal.raw());
    }

    @Test
    void apply_replacement_keepsValueAndRawConsistent() throws TransformException {
        var result = rewrite.apply(call("console.log('it\\'s')"));

        var literal = (StringLiteral) result.arguments().get(0).expression();
        assertEquals(literal.value(), JsStrings.unquote(literal.raw()));
    }

    @Test
    void apply_numericFirstArgument_isReplacedAndRestKept() throws TransformException {
        var original = call("console.error(1, 2)");

        var result = rewrite.apply(original);

        assertEquals("from_plugin", ((StringLiteral) result.arguments().get(0).expression()).value());
        assertSame(original.arguments().get(1), result.arguments().get(1));
        assertSame(original.callee(), result.callee());
        assertEquals(original.arguments().get(0).span(), result.arguments().get(0).span());
    }

    @Test
    void apply_otherLiterals_areReplaced() throws TransformException {
        for (var source : new String[]{"console.log(true)", "console.log(null)", "console.log(0x10)"}) {
            var result = rewrite.apply(call(source));
            assertEquals("from_plugin", ((StringLiteral) result.arguments().get(0).expression()).value(), source);
        }
    }

    @Test
    void apply_anyConsoleMethod_matches() throws TransformException {
        for (var source : new String[]{"console.warn('x')", "console.table('x')", "console['info']('x')"}) {
            var result = rewrite.apply(call(source));
            assertEquals("from_plugin", ((StringLiteral) result.arguments().get(0).expression()).value(), source);
        }
    }

    @Test
    void apply_nonConsoleCall_isUntouched() throws TransformException {
        for (var source : new String[]{"logger.log('x')", "log('x')", "window.console.log('x')", "(console).log('x')",
                                       "Console.log('x')"}) {
            var original = call(source);
            assertSame(original, rewrite.apply(original), source);
        }
    }

    @Test
    void apply_noArguments_isUntouched() throws TransformException {
        var original = call("console.log()");

        assertSame(original, rewrite.apply(original));
    }

    @Test
    void apply_nonLiteralFirstArgument_isUntouched() throws TransformException {
        for (var source : new String[]{"console.log(message)", "console.log('a' + b)", "console.log(f())",
                                       "console.log(...args)"}) {
            var original = call(source);
            assertSame(original, rewrite.apply(original), source);
        }
    }

    @Test
    void apply_alreadyRewritten_returnsSameInstance() throws TransformException {
        var once = rewrite.apply(call("console.log('hello', 2)"));

        assertSame(once, rewrite.apply(once));
    }

    @Test
    void matches_checksCalleeShapeOnly() throws TransformException {
        assertTrue(ConsoleArgumentRewrite.matches(call("console.anything()")));
        assertFalse(ConsoleArgumentRewrite.matches(call("console()")));
    }

    private static CallExpression call(String source) throws TransformException {
        var statement = (ExpressionStatement) JsParser.parse(source).body().get(0);
        return (CallExpression) statement.expression();
    }
}
