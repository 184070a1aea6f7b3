package org.pragmatica.jstransform;

import org.pragmatica.jstransform.codegen.JsPrinter;
import org.pragmatica.jstransform.config.TransformConfig;
import org.pragmatica.jstransform.error.Diagnostic;
import org.pragmatica.jstransform.error.TransformError;
import org.pragmatica.jstransform.error.TransformException;
import org.pragmatica.jstransform.json.AstJsonCodec;
import org.pragmatica.jstransform.syntax.JsParser;
import org.pragmatica.jstransform.tree.SyntaxNode.Program;
import org.pragmatica.jstransform.visit.Visitor;
import org.pragmatica.jstransform.visit.VisitorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Host-facing transform pipeline.
 *
 * <p>The host hands over a program (as a tree, JSON or source text) together with the plugin
 * configuration. The configuration names the visitor to apply. Any failure (missing or unreadable
 * configuration, unknown visitor, undecodable input) is reported as a {@link Diagnostic} and the
 * input is returned unchanged; the pipeline itself never throws.
 */
public final class TransformPlugin {
    private static final Logger LOG = LoggerFactory.getLogger(TransformPlugin.class);

    static final String SKIPPED_HELP = "the transform was skipped and the input returned unchanged";

    private final VisitorRegistry registry;

    private TransformPlugin(VisitorRegistry registry) {
        this.registry = registry;
    }

    public static TransformPlugin create() {
        return new TransformPlugin(VisitorRegistry.defaults());
    }

    public static TransformPlugin create(VisitorRegistry registry) {
        return new TransformPlugin(registry);
    }

    /**
     * Transform a program.
     */
    public TransformResult<Program> process(Program program, Optional<String> configJson) {
        try {
            var visitor = resolveVisitor(configJson);
            return TransformResult.success(visitor.visitProgram(program));
        } catch (TransformException e) {
            return skipped(program, e.error());
        }
    }

    /**
     * Transform a program serialized with {@link AstJsonCodec}; the output is serialized the same way.
     */
    public TransformResult<String> processJson(String astJson, Optional<String> configJson) {
        try {
            var visitor = resolveVisitor(configJson);
            var program = AstJsonCodec.decode(astJson);
            return TransformResult.success(AstJsonCodec.encode(visitor.visitProgram(program)));
        } catch (TransformException e) {
            return skipped(astJson, e.error());
        }
    }

    /**
     * Transform JavaScript source text; the output is printed with {@link JsPrinter}.
     */
    public TransformResult<String> processSource(String source, Optional<String> configJson) {
        try {
            var visitor = resolveVisitor(configJson);
            var program = JsParser.parse(source);
            return TransformResult.success(JsPrinter.print(visitor.visitProgram(program)));
        } catch (TransformException e) {
            return skipped(source, e.error());
        }
    }

    private Visitor resolveVisitor(Optional<String> configJson) throws TransformException {
        if (configJson.isEmpty()) {
            throw new TransformException(new TransformError.MissingConfig());
        }
        var config = TransformConfig.fromJson(configJson.get());
        var name = config.visitorClassName();
        var visitor = registry.create(name);
        if (visitor.isEmpty()) {
            throw new TransformException(new TransformError.UnknownVisitor(name));
        }
        LOG.debug("Applying visitor '{}'", name);
        return visitor.get();
    }

    private static <T> TransformResult<T> skipped(T input, TransformError error) {
        var diagnostic = Diagnostic.from(error)
                                   .withHelp(SKIPPED_HELP);
        LOG.warn("Skipping transform: {}", diagnostic.formatSimple());
        return TransformResult.skipped(input, diagnostic);
    }
}
