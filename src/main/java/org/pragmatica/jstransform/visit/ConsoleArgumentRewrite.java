package org.pragmatica.jstransform.visit;

import org.pragmatica.jstransform.tree.SyntaxNode.Argument;
import org.pragmatica.jstransform.tree.SyntaxNode.CallExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.Identifier;
import org.pragmatica.jstransform.tree.SyntaxNode.Literal;
import org.pragmatica.jstransform.tree.SyntaxNode.MemberExpression;
import org.pragmatica.jstransform.tree.SyntaxNode.StringLiteral;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * Rewrites the first argument of {@code console.<method>(...)} calls to the string literal
 * {@code "from_plugin"}.
 *
 * <p>The match is purely syntactic: the callee must be a member expression whose object is the
 * identifier {@code console}. Which method is called does not matter ({@code log}, {@code error},
 * {@code console["warn"]} all match), but {@code (console).log} or {@code window.console.log} do not.
 *
 * <p>Only a literal first argument is replaced; calls without arguments and calls whose first
 * argument is any other expression are returned unchanged.
 */
public final class ConsoleArgumentRewrite {
    private static final Logger LOG = LoggerFactory.getLogger(ConsoleArgumentRewrite.class);

    public static final String CONSOLE = "console";
    public static final String REPLACEMENT = "from_plugin";

    /**
     * Apply the rewrite to a single call. Returns the same instance when nothing changes.
     */
    public CallExpression apply(CallExpression call) {
        if (!matches(call)) {
            return call;
        }
        if (call.arguments().isEmpty()) {
            LOG.debug("Skipping console call without arguments at {}", call.span());
            return call;
        }
        var first = call.arguments().get(0);
        if (!(first.expression() instanceof Literal literal)) {
            LOG.debug("Skipping console call at {}: first argument is not a literal", call.span());
            return call;
        }
        var replacement = StringLiteral.of(literal.span(), REPLACEMENT);
        if (replacement.equals(literal)) {
            return call;
        }
        LOG.debug("Rewriting first argument of console call at {}", call.span());
        var arguments = new ArrayList<>(call.arguments());
        arguments.set(0, new Argument(first.span(), first.spread(), replacement));
        return new CallExpression(call.span(), call.callee(), arguments);
    }

    /**
     * Whether the callee is a property access off an identifier named {@code console}.
     */
    public static boolean matches(CallExpression call) {
        return call.callee() instanceof MemberExpression member
               && member.object() instanceof Identifier object
               && object.value().equals(CONSOLE);
    }
}
