package org.pragmatica.jstransform.codegen;

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

import java.util.List;

/**
 * Prints a syntax tree back to JavaScript source.
 *
 * <p>Output layout: one statement per line, terminated by {@code ;}, blocks indented by four
 * spaces. Literals are printed from their {@code raw} text, so a literal that was not rewritten
 * comes out exactly as it was written. Parentheses appear only where the tree has a
 * {@link ParenthesisExpression}.
 */
public final class JsPrinter {
    private static final String INDENT = "    ";
    private static final int DEFAULT_CAPACITY = 256;

    private final StringBuilder out = new StringBuilder(DEFAULT_CAPACITY);
    private int depth;

    private JsPrinter() {}

    public static String print(Program program) {
        var printer = new JsPrinter();
        for (var statement : program.body()) {
            printer.statement(statement);
        }
        return printer.out.toString();
    }

    private void statement(Statement statement) {
        indent();
        statementBody(statement);
        out.append('\n');
    }

    private void statementBody(Statement statement) {
        if (statement instanceof ExpressionStatement expressionStatement) {
            // An expression statement must not start with '{' or it would read as a block
            if (expressionStatement.expression() instanceof ObjectExpression) {
                out.append('(');
                expression(expressionStatement.expression());
                out.append(')');
            } else {
                expression(expressionStatement.expression());
            }
            out.append(';');
        } else if (statement instanceof VariableDeclaration declaration) {
            variableDeclaration(declaration);
            out.append(';');
        } else if (statement instanceof FunctionDeclaration function) {
            out.append("function ");
            identifier(function.identifier());
            params(function.params());
            out.append(' ');
            block(function.body());
        } else if (statement instanceof BlockStatement block) {
            block(block);
        } else if (statement instanceof IfStatement ifStatement) {
            ifStatement(ifStatement);
        } else if (statement instanceof ReturnStatement returnStatement) {
            out.append("return");
            returnStatement.argument()
                           .ifPresent(argument -> {
                               out.append(' ');
                               expression(argument);
                           });
            out.append(';');
        } else if (statement instanceof EmptyStatement) {
            out.append(';');
        } else {
            throw new IllegalStateException("Unknown statement kind: " + statement.getClass().getSimpleName());
        }
    }

    private void variableDeclaration(VariableDeclaration declaration) {
        out.append(declaration.kind().keyword()).append(' ');
        var declarations = declaration.declarations();
        for (int i = 0; i < declarations.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            variableDeclarator(declarations.get(i));
        }
    }

    private void variableDeclarator(VariableDeclarator declarator) {
        identifier(declarator.name());
        declarator.init()
                  .ifPresent(init -> {
                      out.append(" = ");
                      expression(init);
                  });
    }

    private void ifStatement(IfStatement statement) {
        out.append("if (");
        expression(statement.test());
        out.append(") ");
        statementBody(statement.consequent());
        statement.alternate()
                 .ifPresent(alternate -> {
                     out.append(" else ");
                     statementBody(alternate);
                 });
    }

    private void block(BlockStatement block) {
        if (block.stmts().isEmpty()) {
            out.append("{}");
            return;
        }
        out.append("{\n");
        depth++;
        for (var statement : block.stmts()) {
            statement(statement);
        }
        depth--;
        indent();
        out.append('}');
    }

    private void params(List<Identifier> params) {
        out.append('(');
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            identifier(params.get(i));
        }
        out.append(')');
    }

    private void expression(Expression expression) {
        if (expression instanceof Identifier identifier) {
            identifier(identifier);
        } else if (expression instanceof StringLiteral string) {
            out.append(string.raw());
        } else if (expression instanceof NumericLiteral number) {
            out.append(number.raw());
        } else if (expression instanceof BooleanLiteral bool) {
            out.append(bool.value());
        } else if (expression instanceof NullLiteral) {
            out.append("null");
        } else if (expression instanceof CallExpression call) {
            expression(call.callee());
            arguments(call.arguments(), '(', ')');
        } else if (expression instanceof MemberExpression member) {
            expression(member.object());
            if (member.property() instanceof Identifier && isBareInteger(member.object())) {
                out.append(' ');
            }
            memberProperty(member.property());
        } else if (expression instanceof ArrayExpression array) {
            arguments(array.elements(), '[', ']');
        } else if (expression instanceof ObjectExpression object) {
            objectExpression(object);
        } else if (expression instanceof UnaryExpression unary) {
            out.append(unary.operator());
            if (Character.isLetter(unary.operator().charAt(0)) || startsWithSameSign(unary)) {
                out.append(' ');
            }
            expression(unary.argument());
        } else if (expression instanceof BinaryExpression binary) {
            expression(binary.left());
            out.append(' ').append(binary.operator()).append(' ');
            expression(binary.right());
        } else if (expression instanceof AssignmentExpression assignment) {
            expression(assignment.left());
            out.append(' ').append(assignment.operator()).append(' ');
            expression(assignment.right());
        } else if (expression instanceof ConditionalExpression conditional) {
            expression(conditional.test());
            out.append(" ? ");
            expression(conditional.consequent());
            out.append(" : ");
            expression(conditional.alternate());
        } else if (expression instanceof ParenthesisExpression parenthesis) {
            out.append('(');
            expression(parenthesis.expression());
            out.append(')');
        } else if (expression instanceof ArrowFunctionExpression arrow) {
            params(arrow.params());
            out.append(" => ");
            arrowBody(arrow.body());
        } else {
            throw new IllegalStateException("Unknown expression kind: " + expression.getClass().getSimpleName());
        }
    }

    // "1.toString" would lex as the number "1." followed by an identifier
    private static boolean isBareInteger(Expression expression) {
        return expression instanceof NumericLiteral number
               && number.raw().chars().allMatch(Character::isDigit);
    }

    // "- -x" must not collapse into "--x"
    private static boolean startsWithSameSign(UnaryExpression unary) {
        return unary.argument() instanceof UnaryExpression inner
               && (inner.operator().equals("-") || inner.operator().equals("+"));
    }

    private void arrowBody(ArrowBody body) {
        if (body instanceof BlockStatement block) {
            block(block);
        } else if (body instanceof ObjectExpression object) {
            out.append('(');
            objectExpression(object);
            out.append(')');
        } else if (body instanceof Expression expression) {
            expression(expression);
        }
    }

    private void memberProperty(MemberProperty property) {
        if (property instanceof Identifier identifier) {
            out.append('.');
            identifier(identifier);
        } else if (property instanceof ComputedPropName computed) {
            out.append('[');
            expression(computed.expression());
            out.append(']');
        }
    }

    private void arguments(List<Argument> arguments, char open, char close) {
        out.append(open);
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            var argument = arguments.get(i);
            if (argument.spread()) {
                out.append("...");
            }
            expression(argument.expression());
        }
        out.append(close);
    }

    private void objectExpression(ObjectExpression object) {
        if (object.properties().isEmpty()) {
            out.append("{}");
            return;
        }
        out.append("{ ");
        var properties = object.properties();
        for (int i = 0; i < properties.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            keyValueProperty(properties.get(i));
        }
        out.append(" }");
    }

    private void keyValueProperty(KeyValueProperty property) {
        propertyKey(property.key());
        out.append(": ");
        expression(property.value());
    }

    private void propertyKey(PropertyKey key) {
        if (key instanceof Identifier identifier) {
            identifier(identifier);
        } else if (key instanceof StringLiteral string) {
            out.append(string.raw());
        } else if (key instanceof NumericLiteral number) {
            out.append(number.raw());
        } else if (key instanceof ComputedPropName computed) {
            out.append('[');
            expression(computed.expression());
            out.append(']');
        }
    }

    private void identifier(Identifier identifier) {
        out.append(identifier.value());
    }

    private void indent() {
        out.append(INDENT.repeat(depth));
    }
}
