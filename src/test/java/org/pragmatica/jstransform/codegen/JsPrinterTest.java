package org.pragmatica.jstransform.codegen;

import org.junit.jupiter.api.Test;
import org.pragmatica.jstransform.error.TransformException;
import org.pragmatica.jstransform.syntax.JsParser;
import org.pragmatica.jstransform.tree.SourceSpan;
import org.pragmatica.jstransform.tree.SyntaxNode.ArrowFunctionExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.ExpressionStatement;
import org.pragmatica.jstransform.tree.SyntaxNode.Identifier;
import org.pragmatica.jstransform.tree.SyntaxNode.KeyValueProperty;
import org.pragmatica.jstransform.tree.SyntaxNode.NumericLiteral;
import org.pragmatica.jstransform.tree.SyntaxNode.ObjectExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.Program;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JsPrinterTest {

    @Test
    void print_consoleCall_endsWithSemicolonAndNewline() throws TransformException {
        assertEquals("console.log(\"hello\");\n", reprint("console.log(\"hello\")"));
    }

    @Test
    void print_literals_keepOriginalSpelling() throws TransformException {
        assertEquals("f('single', 0x1F, 1.50, true, null);\n", reprint("f('single', 0x1F, 1.50, true, null)"));
    }

    @Test
    void print_statements_oneLineEach() throws TransformException {
        var source = """
            let a = 1, b;
            ;
            if (a) b(); else c();
            function f() {}
            """;

        assertEquals(source, reprint(source));
    }

    @Test
    void print_blocks_areIndented() throws TransformException {
        var source = """
            function f(a, b) {
                if (a) {
                    return b;
                }
                return;
            }
            """;

        assertEquals(source, reprint(source));
    }

    @Test
    void print_operators_keepGrouping() throws TransformException {
        assertEquals("x = (a + b) * c;\n", reprint("x = (a + b) * c"));
        assertEquals("y = a ? b : c ?? d;\n", reprint("y = a ? b : c ?? d"));
        assertEquals("typeof x === \"string\";\n", reprint("typeof x === \"string\""));
        assertEquals("- -x;\n", reprint("- -x"));
        assertEquals("!done;\n", reprint("!done"));
    }

    @Test
    void print_collectionsAndMembers_useCompactLayout() throws TransformException {
        assertEquals("f([1, ...xs], {}, { a: 1, 'b': [k] });\n", reprint("f([1,...xs],{},{a:1,'b':[k]})"));
        assertEquals("obj.list[0].push(item);\n", reprint("obj.list[0].push(item)"));
        assertEquals("const g = (a, b) => a + b;\n", reprint("const g = (a, b) => a + b"));
    }

    @Test
    void print_memberOfIntegerLiteral_keepsSeparator() throws TransformException {
        assertEquals("1 .toString();\n", reprint("1 .toString()"));
        assertEquals("1.5.toFixed(1);\n", reprint("1.5.toFixed(1)"));
        assertEquals("0x10.toString();\n", reprint("0x10.toString()"));
        assertEquals("list[1];\n", reprint("list[1]"));
    }

    @Test
    void print_objectInStatementPosition_isWrapped() {
        var object = new ObjectExpression(SourceSpan.DUMMY, List.of(
            new KeyValueProperty(SourceSpan.DUMMY,
                                 new Identifier(SourceSpan.DUMMY, "a"),
                                 new NumericLiteral(SourceSpan.DUMMY, 1, "1"))));
        var arrow = new ArrowFunctionExpression(SourceSpan.DUMMY, List.of(), object);
        var program = new Program(SourceSpan.DUMMY, List.of(
            new ExpressionStatement(SourceSpan.DUMMY, object),
            new ExpressionStatement(SourceSpan.DUMMY, arrow)));

        assertEquals("({ a: 1 });\n() => ({ a: 1 });\n", JsPrinter.print(program));
    }

    @Test
    void print_emptyProgram_isEmpty() throws TransformException {
        assertEquals("", reprint("   // nothing here\n"));
    }

    private static String reprint(String source) throws TransformException {
        return JsPrinter.print(JsParser.parse(source));
    }
}
