package org.pragmatica.jstransform.tree;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JavaScript syntax tree node.
 *
 * <p>Nodes are immutable and own their children exclusively. A transformation produces a new
 * node only along the path that actually changed; untouched subtrees keep their identity.
 * Field names follow the JSON shape of the SWC ECMAScript AST (e.g. identifiers keep their name
 * in {@code value}).
 */
public sealed interface SyntaxNode {
    /**
     * The source span covered by this node.
     */
    SourceSpan span();

    /**
     * Root of a parsed compilation unit.
     */
    record Program(SourceSpan span, List<Statement> body) implements SyntaxNode {
        public Program {
            body = List.copyOf(body);
        }
    }

    // === Statements ===

    sealed interface Statement extends SyntaxNode {}

    record ExpressionStatement(SourceSpan span, Expression expression) implements Statement {}

    record VariableDeclaration(
    SourceSpan span,
    DeclarationKind kind,
    List<VariableDeclarator> declarations) implements Statement {
        public VariableDeclaration {
            declarations = List.copyOf(declarations);
        }
    }

    /**
     * Single {@code name = init} entry of a variable declaration.
     */
    record VariableDeclarator(
    SourceSpan span,
    Identifier name,
    Optional<Expression> init) implements SyntaxNode {}

    record FunctionDeclaration(
    SourceSpan span,
    Identifier identifier,
    List<Identifier> params,
    BlockStatement body) implements Statement {
        public FunctionDeclaration {
            params = List.copyOf(params);
        }
    }

    record BlockStatement(SourceSpan span, List<Statement> stmts) implements Statement, ArrowBody {
        public BlockStatement {
            stmts = List.copyOf(stmts);
        }
    }

    record IfStatement(
    SourceSpan span,
    Expression test,
    Statement consequent,
    Optional<Statement> alternate) implements Statement {}

    record ReturnStatement(SourceSpan span, Optional<Expression> argument) implements Statement {}

    record EmptyStatement(SourceSpan span) implements Statement {}

    enum DeclarationKind {
        VAR("var"),
        LET("let"),
        CONST("const");

        private final String keyword;

        DeclarationKind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        public static Optional<DeclarationKind> fromKeyword(String keyword) {
            for (var kind : values()) {
                if (kind.keyword.equals(keyword)) {
                    return Optional.of(kind);
                }
            }
            return Optional.empty();
        }
    }

    // === Expressions ===

    /**
     * Body of an arrow function: either a block or a single expression.
     */
    sealed interface ArrowBody extends SyntaxNode {}

    sealed interface Expression extends ArrowBody {}

    /**
     * Literal expression. Every literal keeps the exact source text it was written as.
     */
    sealed interface Literal extends Expression {}

    /**
     * Property access key: {@code a.b} (identifier) or {@code a[b]} (computed).
     */
    sealed interface MemberProperty extends SyntaxNode {}

    /**
     * Key of an object literal property.
     */
    sealed interface PropertyKey extends SyntaxNode {}

    record Identifier(SourceSpan span, String value) implements Expression, MemberProperty, PropertyKey {
        public Identifier {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * String literal. {@code raw} is the quoted source text and always decodes to {@code value}.
     */
    record StringLiteral(SourceSpan span, String value, String raw) implements Literal, PropertyKey {
        public StringLiteral {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(raw, "raw");
            if (!JsStrings.unquote(raw).equals(value)) {
                throw new IllegalArgumentException("Raw text " + raw + " does not decode to the literal value");
            }
        }

        /**
         * Create a literal whose source text is derived from the value.
         */
        public static StringLiteral of(SourceSpan span, String value) {
            return new StringLiteral(span, value, JsStrings.quote(value));
        }
    }

    record NumericLiteral(SourceSpan span, double value, String raw) implements Literal, PropertyKey {}

    record BooleanLiteral(SourceSpan span, boolean value) implements Literal {}

    record NullLiteral(SourceSpan span) implements Literal {}

    record ArrayExpression(SourceSpan span, List<Argument> elements) implements Expression {
        public ArrayExpression {
            elements = List.copyOf(elements);
        }
    }

    record ObjectExpression(SourceSpan span, List<KeyValueProperty> properties) implements Expression {
        public ObjectExpression {
            properties = List.copyOf(properties);
        }
    }

    record KeyValueProperty(SourceSpan span, PropertyKey key, Expression value) implements SyntaxNode {}

    record MemberExpression(SourceSpan span, Expression object, MemberProperty property) implements Expression {}

    /**
     * Computed key: {@code [expression]}.
     */
    record ComputedPropName(SourceSpan span, Expression expression) implements MemberProperty, PropertyKey {}

    record CallExpression(SourceSpan span, Expression callee, List<Argument> arguments) implements Expression {
        public CallExpression {
            arguments = List.copyOf(arguments);
        }
    }

    /**
     * A call argument or array element, optionally spread ({@code ...expression}).
     */
    record Argument(SourceSpan span, boolean spread, Expression expression) implements SyntaxNode {
        public static Argument of(Expression expression) {
            return new Argument(expression.span(), false, expression);
        }
    }

    record UnaryExpression(SourceSpan span, String operator, Expression argument) implements Expression {}

    record BinaryExpression(
    SourceSpan span,
    String operator,
    Expression left,
    Expression right) implements Expression {}

    record AssignmentExpression(
    SourceSpan span,
    String operator,
    Expression left,
    Expression right) implements Expression {}

    record ConditionalExpression(
    SourceSpan span,
    Expression test,
    Expression consequent,
    Expression alternate) implements Expression {}

    record ParenthesisExpression(SourceSpan span, Expression expression) implements Expression {}

    record ArrowFunctionExpression(
    SourceSpan span,
    List<Identifier> params,
    ArrowBody body) implements Expression {
        public ArrowFunctionExpression {
            params = List.copyOf(params);
        }
    }
}
