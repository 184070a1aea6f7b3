package org.pragmatica.jstransform.visit;

import org.pragmatica.jstransform.tree.SyntaxNode.CallExpression;

/**
 * Visitor applying {@link ConsoleArgumentRewrite} to every call expression in the tree.
 */
public class TransformVisitor extends Visitor {
    /**
     * Name under which this visitor is registered by default.
     */
    public static final String NAME = "TransformVisitor";

    private final ConsoleArgumentRewrite rewrite = new ConsoleArgumentRewrite();

    @Override
    public CallExpression visitCallExpression(CallExpression call) {
        return rewrite.apply(super.visitCallExpression(call));
    }
}
