package org.pragmatica.jstransform.visit;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Depth-first syntax tree traversal.
 *
 * <p>Every node kind has a {@code visitX} method. The default implementation visits each owned
 * child, replaces it with the result and returns the node. A node is rebuilt only when at least
 * one child came back as a different instance; otherwise the very same instance is returned, so an
 * untouched tree comes back identical ({@code ==}) to the input.
 *
 * <p>Subclasses override the methods for the kinds they want to rewrite. Calling {@code super}
 * first gives post-order behavior: children are already transformed when the override sees the node.
 *
 * <p>Instances keep no state between calls; one instance may be reused for any number of trees.
 */
public class Visitor {

    public Program visitProgram(Program program) {
        var body = visitList(program.body(), this::visitStatement);
        return body == program.body()
               ? program
               : new Program(program.span(), body);
    }

    // === Dispatch ===

    public Statement visitStatement(Statement statement) {
        if (statement instanceof ExpressionStatement expressionStatement) {
            return visitExpressionStatement(expressionStatement);
        }
        if (statement instanceof VariableDeclaration declaration) {
            return visitVariableDeclaration(declaration);
        }
        if (statement instanceof FunctionDeclaration function) {
            return visitFunctionDeclaration(function);
        }
        if (statement instanceof BlockStatement block) {
            return visitBlockStatement(block);
        }
        if (statement instanceof IfStatement ifStatement) {
            return visitIfStatement(ifStatement);
        }
        if (statement instanceof ReturnStatement returnStatement) {
            return visitReturnStatement(returnStatement);
        }
        if (statement instanceof EmptyStatement empty) {
            return visitEmptyStatement(empty);
        }
        throw new IllegalStateException("Unknown statement kind: " + statement.getClass().getSimpleName());
    }

    public Expression visitExpression(Expression expression) {
        if (expression instanceof CallExpression call) {
            return visitCallExpression(call);
        }
        if (expression instanceof MemberExpression member) {
            return visitMemberExpression(member);
        }
        if (expression instanceof Identifier identifier) {
            return visitIdentifier(identifier);
        }
        if (expression instanceof StringLiteral string) {
            return visitStringLiteral(string);
        }
        if (expression instanceof NumericLiteral number) {
            return visitNumericLiteral(number);
        }
        if (expression instanceof BooleanLiteral bool) {
            return visitBooleanLiteral(bool);
        }
        if (expression instanceof NullLiteral nullLiteral) {
            return visitNullLiteral(nullLiteral);
        }
        if (expression instanceof ArrayExpression array) {
            return visitArrayExpression(array);
        }
        if (expression instanceof ObjectExpression object) {
            return visitObjectExpression(object);
        }
        if (expression instanceof UnaryExpression unary) {
            return visitUnaryExpression(unary);
        }
        if (expression instanceof BinaryExpression binary) {
            return visitBinaryExpression(binary);
        }
        if (expression instanceof AssignmentExpression assignment) {
            return visitAssignmentExpression(assignment);
        }
        if (expression instanceof ConditionalExpression conditional) {
            return visitConditionalExpression(conditional);
        }
        if (expression instanceof ParenthesisExpression parenthesis) {
            return visitParenthesisExpression(parenthesis);
        }
        if (expression instanceof ArrowFunctionExpression arrow) {
            return visitArrowFunctionExpression(arrow);
        }
        throw new IllegalStateException("Unknown expression kind: " + expression.getClass().getSimpleName());
    }

    public MemberProperty visitMemberProperty(MemberProperty property) {
        if (property instanceof Identifier identifier) {
            return visitIdentifier(identifier);
        }
        if (property instanceof ComputedPropName computed) {
            return visitComputedPropName(computed);
        }
        throw new IllegalStateException("Unknown member property kind: " + property.getClass().getSimpleName());
    }

    public PropertyKey visitPropertyKey(PropertyKey key) {
        if (key instanceof Identifier identifier) {
            return visitIdentifier(identifier);
        }
        if (key instanceof StringLiteral string) {
            return visitStringLiteral(string);
        }
        if (key instanceof NumericLiteral number) {
            return visitNumericLiteral(number);
        }
        if (key instanceof ComputedPropName computed) {
            return visitComputedPropName(computed);
        }
        throw new IllegalStateException("Unknown property key kind: " + key.getClass().getSimpleName());
    }

    public ArrowBody visitArrowBody(ArrowBody body) {
        if (body instanceof BlockStatement block) {
            return visitBlockStatement(block);
        }
        if (body instanceof Expression expression) {
            return visitExpression(expression);
        }
        throw new IllegalStateException("Unknown arrow body kind: " + body.getClass().getSimpleName());
    }

    // === Statements ===

    public Statement visitExpressionStatement(ExpressionStatement statement) {
        var expression = visitExpression(statement.expression());
        return expression == statement.expression()
               ? statement
               : new ExpressionStatement(statement.span(), expression);
    }

    public Statement visitVariableDeclaration(VariableDeclaration declaration) {
        var declarations = visitList(declaration.declarations(), this::visitVariableDeclarator);
        return declarations == declaration.declarations()
               ? declaration
               : new VariableDeclaration(declaration.span(), declaration.kind(), declarations);
    }

    public VariableDeclarator visitVariableDeclarator(VariableDeclarator declarator) {
        var name = visitIdentifier(declarator.name());
        var init = visitOptional(declarator.init(), this::visitExpression);
        if (name == declarator.name() && init == declarator.init()) {
            return declarator;
        }
        return new VariableDeclarator(declarator.span(), name, init);
    }

    public Statement visitFunctionDeclaration(FunctionDeclaration function) {
        var identifier = visitIdentifier(function.identifier());
        var params = visitList(function.params(), this::visitIdentifier);
        var body = visitBlockStatement(function.body());
        if (identifier == function.identifier() && params == function.params() && body == function.body()) {
            return function;
        }
        return new FunctionDeclaration(function.span(), identifier, params, body);
    }

    public BlockStatement visitBlockStatement(BlockStatement block) {
        var stmts = visitList(block.stmts(), this::visitStatement);
        return stmts == block.stmts()
               ? block
               : new BlockStatement(block.span(), stmts);
    }

    public Statement visitIfStatement(IfStatement statement) {
        var test = visitExpression(statement.test());
        var consequent = visitStatement(statement.consequent());
        var alternate = visitOptional(statement.alternate(), this::visitStatement);
        if (test == statement.test() && consequent == statement.consequent() && alternate == statement.alternate()) {
            return statement;
        }
        return new IfStatement(statement.span(), test, consequent, alternate);
    }

    public Statement visitReturnStatement(ReturnStatement statement) {
        var argument = visitOptional(statement.argument(), this::visitExpression);
        return argument == statement.argument()
               ? statement
               : new ReturnStatement(statement.span(), argument);
    }

    public Statement visitEmptyStatement(EmptyStatement statement) {
        return statement;
    }

    // === Expressions ===

    /**
     * Visit callee and arguments. Overrides that rewrite calls should call this first, so that
     * calls nested inside the callee or the arguments are handled as well.
     */
    public CallExpression visitCallExpression(CallExpression call) {
        var callee = visitExpression(call.callee());
        var arguments = visitList(call.arguments(), this::visitArgument);
        if (callee == call.callee() && arguments == call.arguments()) {
            return call;
        }
        return new CallExpression(call.span(), callee, arguments);
    }

    public Argument visitArgument(Argument argument) {
        var expression = visitExpression(argument.expression());
        return expression == argument.expression()
               ? argument
               : new Argument(argument.span(), argument.spread(), expression);
    }

    public Expression visitMemberExpression(MemberExpression member) {
        var object = visitExpression(member.object());
        var property = visitMemberProperty(member.property());
        if (object == member.object() && property == member.property()) {
            return member;
        }
        return new MemberExpression(member.span(), object, property);
    }

    public ComputedPropName visitComputedPropName(ComputedPropName computed) {
        var expression = visitExpression(computed.expression());
        return expression == computed.expression()
               ? computed
               : new ComputedPropName(computed.span(), expression);
    }

    public Identifier visitIdentifier(Identifier identifier) {
        return identifier;
    }

    public StringLiteral visitStringLiteral(StringLiteral literal) {
        return literal;
    }

    public NumericLiteral visitNumericLiteral(NumericLiteral literal) {
        return literal;
    }

    public Expression visitBooleanLiteral(BooleanLiteral literal) {
        return literal;
    }

    public Expression visitNullLiteral(NullLiteral literal) {
        return literal;
    }

    public Expression visitArrayExpression(ArrayExpression array) {
        var elements = visitList(array.elements(), this::visitArgument);
        return elements == array.elements()
               ? array
               : new ArrayExpression(array.span(), elements);
    }

    public Expression visitObjectExpression(ObjectExpression object) {
        var properties = visitList(object.properties(), this::visitKeyValueProperty);
        return properties == object.properties()
               ? object
               : new ObjectExpression(object.span(), properties);
    }

    public KeyValueProperty visitKeyValueProperty(KeyValueProperty property) {
        var key = visitPropertyKey(property.key());
        var value = visitExpression(property.value());
        if (key == property.key() && value == property.value()) {
            return property;
        }
        return new KeyValueProperty(property.span(), key, value);
    }

    public Expression visitUnaryExpression(UnaryExpression unary) {
        var argument = visitExpression(unary.argument());
        return argument == unary.argument()
               ? unary
               : new UnaryExpression(unary.span(), unary.operator(), argument);
    }

    public Expression visitBinaryExpression(BinaryExpression binary) {
        var left = visitExpression(binary.left());
        var right = visitExpression(binary.right());
        if (left == binary.left() && right == binary.right()) {
            return binary;
        }
        return new BinaryExpression(binary.span(), binary.operator(), left, right);
    }

    public Expression visitAssignmentExpression(AssignmentExpression assignment) {
        var left = visitExpression(assignment.left());
        var right = visitExpression(assignment.right());
        if (left == assignment.left() && right == assignment.right()) {
            return assignment;
        }
        return new AssignmentExpression(assignment.span(), assignment.operator(), left, right);
    }

    public Expression visitConditionalExpression(ConditionalExpression conditional) {
        var test = visitExpression(conditional.test());
        var consequent = visitExpression(conditional.consequent());
        var alternate = visitExpression(conditional.alternate());
        if (test == conditional.test() && consequent == conditional.consequent()
            && alternate == conditional.alternate()) {
            return conditional;
        }
        return new ConditionalExpression(conditional.span(), test, consequent, alternate);
    }

    public Expression visitParenthesisExpression(ParenthesisExpression parenthesis) {
        var expression = visitExpression(parenthesis.expression());
        return expression == parenthesis.expression()
               ? parenthesis
               : new ParenthesisExpression(parenthesis.span(), expression);
    }

    public Expression visitArrowFunctionExpression(ArrowFunctionExpression arrow) {
        var params = visitList(arrow.params(), this::visitIdentifier);
        var body = visitArrowBody(arrow.body());
        if (params == arrow.params() && body == arrow.body()) {
            return arrow;
        }
        return new ArrowFunctionExpression(arrow.span(), params, body);
    }

    // === Helpers ===

    /**
     * Visit every element. Returns the original list if no element was replaced.
     */
    protected static <T> List<T> visitList(List<T> items, UnaryOperator<T> visit) {
        List<T> result = null;
        for (int i = 0; i < items.size(); i++) {
            var item = items.get(i);
            var visited = visit.apply(item);
            if (visited != item && result == null) {
                result = new ArrayList<>(items.subList(0, i));
            }
            if (result != null) {
                result.add(visited);
            }
        }
        return result == null
               ? items
               : result;
    }

    /**
     * Visit the value if present. Returns the original {@link Optional} if the value was not replaced.
     */
    protected static <T> Optional<T> visitOptional(Optional<T> item, UnaryOperator<T> visit) {
        if (item.isEmpty()) {
            return item;
        }
        var visited = visit.apply(item.get());
        return visited == item.get()
               ? item
               : Optional.of(visited);
    }
}
