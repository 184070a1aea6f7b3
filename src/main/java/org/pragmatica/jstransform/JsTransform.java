package org.pragmatica.jstransform;

import org.pragmatica.jstransform.codegen.JsPrinter;
import org.pragmatica.jstransform.error.TransformException;
import org.pragmatica.jstransform.json.AstJsonCodec;
import org.pragmatica.jstransform.syntax.JsParser;
import org.pragmatica.jstransform.tree.SyntaxNode.Program;
import org.pragmatica.jstransform.visit.TransformVisitor;
import org.pragmatica.jstransform.visit.Visitor;

/**
 * Entry point for applying the console argument rewrite.
 *
 * <p>Example usage:
 * <pre>{@code
 * var output = JsTransform.transformSource("console.log(\"hello\")");
 * // console.log("from_plugin");
 * }</pre>
 */
public final class JsTransform {
    private JsTransform() {}

    /**
     * Apply {@link TransformVisitor} to a program.
     */
    public static Program transform(Program program) {
        return transform(program, new TransformVisitor());
    }

    /**
     * Apply the given visitor to a program.
     */
    public static Program transform(Program program, Visitor visitor) {
        return visitor.visitProgram(program);
    }

    /**
     * Parse, transform and print JavaScript source.
     */
    public static String transformSource(String source) throws TransformException {
        return JsPrinter.print(transform(JsParser.parse(source)));
    }

    /**
     * Decode, transform and encode a JSON syntax tree.
     */
    public static String transformJson(String astJson) throws TransformException {
        return AstJsonCodec.encode(transform(AstJsonCodec.decode(astJson)));
    }

    public static Program parse(String source) throws TransformException {
        return JsParser.parse(source);
    }

    public static String print(Program program) {
        return JsPrinter.print(program);
    }
}
