package org.pragmatica.jstransform.syntax;

import org.pragmatica.jstransform.error.TransformError;
import org.pragmatica.jstransform.error.TransformException;
import org.pragmatica.jstransform.tree.SourceLocation;
import org.pragmatica.jstransform.tree.SourceSpan;
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
import org.pragmatica.jstransform.tree.SyntaxNode.DeclarationKind;
import org.pragmatica.jstransform.tree.SyntaxNode.EmptyStatement;
import org.pragmatica.jstransform.tree.SyntaxNode.Expression;
import org.pragmatica.jstransform.tree.SyntaxNode.ExpressionStatement;
import org.pragmatica.jstransform.tree.SyntaxNode.FunctionDeclaration;
import org.pragmatica.jstransform.tree.SyntaxNode.Identifier;
import org.pragmatica.jstransform.tree.SyntaxNode.IfStatement;
import org.pragmatica.jstransform.tree.SyntaxNode.KeyValueProperty;
import org.pragmatica.jstransform.tree.SyntaxNode.MemberExpression;
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
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive descent parser for the supported JavaScript subset.
 * Converts source text into a {@link Program}.
 */
public final class JsParser {
    public static final int MAX_INPUT_SIZE = 1_000_000;

    /**
     * Maximum number of open nesting levels: nested statements, nested expressions, unary operators
     * and member, call or binary operator chain links all count.
     */
    public static final int MAX_NESTING_DEPTH = 500;

    private static final Set<String> RESERVED = Set.of(
        "var", "let", "const", "function", "if", "else", "return", "true", "false", "null",
        "typeof", "void", "delete", "new", "this", "in", "instanceof", "while", "for", "do",
        "break", "continue", "switch", "case", "default", "throw", "try", "catch", "finally",
        "class", "extends", "super", "import", "export", "yield", "await");

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of("=", "+=", "-=", "*=", "/=", "%=", "**=");

    private static final Set<String> UNARY_OPERATORS = Set.of("!", "-", "+", "~", "typeof", "void", "delete");

    // Binary operator precedence; higher binds tighter.
    private static final Map<String, Integer> PRECEDENCE = Map.ofEntries(
        Map.entry("??", 1),
        Map.entry("||", 2),
        Map.entry("&&", 3),
        Map.entry("==", 4),
        Map.entry("!=", 4),
        Map.entry("===", 4),
        Map.entry("!==", 4),
        Map.entry("<", 5),
        Map.entry(">", 5),
        Map.entry("<=", 5),
        Map.entry(">=", 5),
        Map.entry("instanceof", 5),
        Map.entry("in", 5),
        Map.entry("+", 6),
        Map.entry("-", 6),
        Map.entry("*", 7),
        Map.entry("/", 7),
        Map.entry("%", 7),
        Map.entry("**", 8));

    private static final String EXPONENT = "**";

    private final List<JsToken> tokens;
    private int pos;
    private int depth;

    private JsParser(List<JsToken> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse source text into a program.
     *
     * @throws TransformException with {@link TransformError.LexicalError}, {@link TransformError.UnexpectedToken}
     *                            or {@link TransformError.UnexpectedEof} if the text is not valid
     */
    public static Program parse(String source) throws TransformException {
        if (source.length() > MAX_INPUT_SIZE) {
            throw new TransformException(new TransformError.LexicalError(
                SourceLocation.START,
                "Source input exceeds maximum size of " + MAX_INPUT_SIZE + " characters"));
        }
        var tokens = JsLexer.tokenize(source);

        // Check for lexer errors
        for (var token : tokens) {
            if (token instanceof JsToken.Error error) {
                throw new TransformException(new TransformError.LexicalError(error.span().start(), error.message()));
            }
        }

        return new JsParser(tokens).parseProgram();
    }

    private Program parseProgram() throws TransformException {
        var start = peek().span().start();
        var body = new ArrayList<Statement>();
        while (!(peek() instanceof JsToken.Eof)) {
            body.add(parseStatement());
        }
        return new Program(SourceSpan.of(start, peek().span().end()), body);
    }

    // === Statements ===

    private Statement parseStatement() throws TransformException {
        descend();
        var statement = parseStatementBody();
        depth--;
        return statement;
    }

    private Statement parseStatementBody() throws TransformException {
        var token = peek();
        if (isPunctuator(token, "{")) {
            return parseBlock();
        }
        if (isPunctuator(token, ";")) {
            advance();
            return new EmptyStatement(token.span());
        }
        if (token instanceof JsToken.Identifier id) {
            var declarationKind = DeclarationKind.fromKeyword(id.name());
            if (declarationKind.isPresent()) {
                return parseVariableDeclaration(declarationKind.get());
            }
            switch (id.name()) {
                case "function" -> {
                    return parseFunctionDeclaration();
                }
                case "if" -> {
                    return parseIfStatement();
                }
                case "return" -> {
                    return parseReturnStatement();
                }
                default -> {}
            }
        }
        var start = token.span().start();
        var expression = parseExpression();
        consumeSemicolon();
        return new ExpressionStatement(spanFrom(start), expression);
    }

    private BlockStatement parseBlock() throws TransformException {
        var start = peek().span().start();
        expectPunctuator("{");
        var stmts = new ArrayList<Statement>();
        while (!isPunctuator(peek(), "}")) {
            if (peek() instanceof JsToken.Eof) {
                throw unexpected("'}'");
            }
            stmts.add(parseStatement());
        }
        advance();
        return new BlockStatement(spanFrom(start), stmts);
    }

    private VariableDeclaration parseVariableDeclaration(DeclarationKind kind) throws TransformException {
        var start = advance().span().start();
        var declarations = new ArrayList<VariableDeclarator>();
        do {
            var nameStart = peek().span().start();
            var name = parseBindingIdentifier();
            Optional<Expression> init = Optional.empty();
            if (isPunctuator(peek(), "=")) {
                advance();
                init = Optional.of(parseAssignment());
            } else if (kind == DeclarationKind.CONST) {
                throw unexpected("'=' (const declarations need an initializer)");
            }
            declarations.add(new VariableDeclarator(spanFrom(nameStart), name, init));
        } while (matchPunctuator(","));
        consumeSemicolon();
        return new VariableDeclaration(spanFrom(start), kind, declarations);
    }

    private FunctionDeclaration parseFunctionDeclaration() throws TransformException {
        var start = advance().span().start();
        var name = parseBindingIdentifier();
        var params = parseParameterList();
        var body = parseBlock();
        return new FunctionDeclaration(spanFrom(start), name, params, body);
    }

    private IfStatement parseIfStatement() throws TransformException {
        var start = advance().span().start();
        expectPunctuator("(");
        var test = parseExpression();
        expectPunctuator(")");
        var consequent = parseStatement();
        Optional<Statement> alternate = Optional.empty();
        if (peek() instanceof JsToken.Identifier id && id.name().equals("else")) {
            advance();
            alternate = Optional.of(parseStatement());
        }
        return new IfStatement(spanFrom(start), test, consequent, alternate);
    }

    private ReturnStatement parseReturnStatement() throws TransformException {
        var start = advance().span().start();
        Optional<Expression> argument = Optional.empty();
        if (!atStatementEnd()) {
            argument = Optional.of(parseExpression());
        }
        consumeSemicolon();
        return new ReturnStatement(spanFrom(start), argument);
    }

    private List<Identifier> parseParameterList() throws TransformException {
        expectPunctuator("(");
        var params = new ArrayList<Identifier>();
        if (!isPunctuator(peek(), ")")) {
            do {
                if (isPunctuator(peek(), ")")) {
                    break;
                }
                params.add(parseBindingIdentifier());
            } while (matchPunctuator(","));
        }
        expectPunctuator(")");
        return params;
    }

    // === Expressions ===

    private Expression parseExpression() throws TransformException {
        return parseAssignment();
    }

    private Expression parseAssignment() throws TransformException {
        descend();
        var expression = parseAssignmentBody();
        depth--;
        return expression;
    }

    private Expression parseAssignmentBody() throws TransformException {
        if (isArrowFunctionAhead()) {
            return parseArrowFunction();
        }
        var start = peek().span().start();
        var left = parseConditional();
        if (peek() instanceof JsToken.Punctuator punctuator && ASSIGNMENT_OPERATORS.contains(punctuator.text())) {
            if (!(left instanceof Identifier) && !(left instanceof MemberExpression)) {
                throw new TransformException(new TransformError.UnexpectedToken(
                    punctuator.span().start(),
                    punctuator.text(),
                    "assignment to an identifier or member expression"));
            }
            advance();
            var right = parseAssignment();
            return new AssignmentExpression(spanFrom(start), punctuator.text(), left, right);
        }
        return left;
    }

    private boolean isArrowFunctionAhead() {
        var token = peek();
        if (token instanceof JsToken.Identifier id && !RESERVED.contains(id.name())) {
            return isPunctuator(tokens.get(pos + 1), "=>");
        }
        if (!isPunctuator(token, "(")) {
            return false;
        }
        // Find the matching ')' and look at what follows it
        int open = 0;
        for (int i = pos; i < tokens.size(); i++) {
            var current = tokens.get(i);
            if (current instanceof JsToken.Eof) {
                return false;
            }
            if (isPunctuator(current, "(") || isPunctuator(current, "[") || isPunctuator(current, "{")) {
                open++;
            } else if (isPunctuator(current, ")") || isPunctuator(current, "]") || isPunctuator(current, "}")) {
                open--;
                if (open == 0) {
                    return isPunctuator(tokens.get(i + 1), "=>");
                }
            }
        }
        return false;
    }

    private ArrowFunctionExpression parseArrowFunction() throws TransformException {
        var start = peek().span().start();
        List<Identifier> params;
        if (peek() instanceof JsToken.Identifier) {
            params = List.of(parseBindingIdentifier());
        } else {
            params = parseParameterList();
        }
        expectPunctuator("=>");
        ArrowBody body;
        if (isPunctuator(peek(), "{")) {
            body = parseBlock();
        } else {
            body = parseAssignment();
        }
        return new ArrowFunctionExpression(spanFrom(start), params, body);
    }

    private Expression parseConditional() throws TransformException {
        var start = peek().span().start();
        var test = parseBinary(1);
        if (!isPunctuator(peek(), "?")) {
            return test;
        }
        advance();
        var consequent = parseAssignment();
        expectPunctuator(":");
        var alternate = parseAssignment();
        return new ConditionalExpression(spanFrom(start), test, consequent, alternate);
    }

    private Expression parseBinary(int minPrecedence) throws TransformException {
        var start = peek().span().start();
        var left = parseUnary();
        int links = 0;
        while (true) {
            var operator = binaryOperator(peek());
            if (operator.isEmpty()) {
                depth -= links;
                return left;
            }
            int precedence = PRECEDENCE.get(operator.get());
            if (precedence < minPrecedence) {
                depth -= links;
                return left;
            }
            descend();
            links++;
            advance();
            // ** is right-associative
            int nextMin = operator.get().equals(EXPONENT)
                          ? precedence
                          : precedence + 1;
            var right = parseBinary(nextMin);
            left = new BinaryExpression(spanFrom(start), operator.get(), left, right);
        }
    }

    private Optional<String> binaryOperator(JsToken token) {
        if (token instanceof JsToken.Punctuator punctuator && PRECEDENCE.containsKey(punctuator.text())) {
            return Optional.of(punctuator.text());
        }
        if (token instanceof JsToken.Identifier id && (id.name().equals("in") || id.name().equals("instanceof"))) {
            return Optional.of(id.name());
        }
        return Optional.empty();
    }

    private Expression parseUnary() throws TransformException {
        var token = peek();
        var operator = unaryOperator(token);
        if (operator.isPresent()) {
            advance();
            descend();
            var argument = parseUnary();
            depth--;
            return new UnaryExpression(spanFrom(token.span().start()), operator.get(), argument);
        }
        return parseCallOrMember();
    }

    private Optional<String> unaryOperator(JsToken token) {
        if (token instanceof JsToken.Punctuator punctuator && UNARY_OPERATORS.contains(punctuator.text())) {
            return Optional.of(punctuator.text());
        }
        if (token instanceof JsToken.Identifier id && UNARY_OPERATORS.contains(id.name())) {
            return Optional.of(id.name());
        }
        return Optional.empty();
    }

    private Expression parseCallOrMember() throws TransformException {
        var start = peek().span().start();
        var expression = parsePrimary();
        int links = 0;
        while (true) {
            if (isPunctuator(peek(), ".") || isPunctuator(peek(), "[") || isPunctuator(peek(), "(")) {
                descend();
                links++;
            }
            if (matchPunctuator(".")) {
                var property = parsePropertyName();
                expression = new MemberExpression(spanFrom(start), expression, property);
            } else if (isPunctuator(peek(), "[")) {
                var keyStart = advance().span().start();
                var key = parseExpression();
                expectPunctuator("]");
                expression = new MemberExpression(spanFrom(start), expression,
                                                  new ComputedPropName(spanFrom(keyStart), key));
            } else if (isPunctuator(peek(), "(")) {
                var arguments = parseArguments("(", ")");
                expression = new CallExpression(spanFrom(start), expression, arguments);
            } else {
                depth -= links;
                return expression;
            }
        }
    }

    private List<Argument> parseArguments(String open, String close) throws TransformException {
        expectPunctuator(open);
        var arguments = new ArrayList<Argument>();
        while (!isPunctuator(peek(), close)) {
            var start = peek().span().start();
            boolean spread = matchPunctuator("...");
            var expression = parseAssignment();
            arguments.add(new Argument(spanFrom(start), spread, expression));
            if (!matchPunctuator(",")) {
                break;
            }
        }
        expectPunctuator(close);
        return arguments;
    }

    private Expression parsePrimary() throws TransformException {
        var token = peek();
        if (token instanceof JsToken.StringLiteral string) {
            advance();
            return new StringLiteral(string.span(), string.value(), string.raw());
        }
        if (token instanceof JsToken.NumericLiteral number) {
            advance();
            return new NumericLiteral(number.span(), number.value(), number.raw());
        }
        if (token instanceof JsToken.Identifier id) {
            switch (id.name()) {
                case "true" -> {
                    advance();
                    return new BooleanLiteral(id.span(), true);
                }
                case "false" -> {
                    advance();
                    return new BooleanLiteral(id.span(), false);
                }
                case "null" -> {
                    advance();
                    return new NullLiteral(id.span());
                }
                default -> {
                    return parseBindingIdentifier();
                }
            }
        }
        if (isPunctuator(token, "(")) {
            var start = advance().span().start();
            var expression = parseExpression();
            expectPunctuator(")");
            return new ParenthesisExpression(spanFrom(start), expression);
        }
        if (isPunctuator(token, "[")) {
            var start = token.span().start();
            var elements = parseArguments("[", "]");
            return new ArrayExpression(spanFrom(start), elements);
        }
        if (isPunctuator(token, "{")) {
            return parseObject();
        }
        throw unexpected("expression");
    }

    private ObjectExpression parseObject() throws TransformException {
        var start = advance().span().start();
        var properties = new ArrayList<KeyValueProperty>();
        while (!isPunctuator(peek(), "}")) {
            var propertyStart = peek().span().start();
            var key = parsePropertyKey();
            expectPunctuator(":");
            var value = parseAssignment();
            properties.add(new KeyValueProperty(spanFrom(propertyStart), key, value));
            if (!matchPunctuator(",")) {
                break;
            }
        }
        expectPunctuator("}");
        return new ObjectExpression(spanFrom(start), properties);
    }

    private PropertyKey parsePropertyKey() throws TransformException {
        var token = peek();
        if (token instanceof JsToken.StringLiteral string) {
            advance();
            return new StringLiteral(string.span(), string.value(), string.raw());
        }
        if (token instanceof JsToken.NumericLiteral number) {
            advance();
            return new NumericLiteral(number.span(), number.value(), number.raw());
        }
        if (isPunctuator(token, "[")) {
            var start = advance().span().start();
            var key = parseAssignment();
            expectPunctuator("]");
            return new ComputedPropName(spanFrom(start), key);
        }
        return parsePropertyName();
    }

    /**
     * Property names after '.' and object keys may be reserved words.
     */
    private Identifier parsePropertyName() throws TransformException {
        if (peek() instanceof JsToken.Identifier id) {
            advance();
            return new Identifier(id.span(), id.name());
        }
        throw unexpected("property name");
    }

    private Identifier parseBindingIdentifier() throws TransformException {
        if (peek() instanceof JsToken.Identifier id && !RESERVED.contains(id.name())) {
            advance();
            return new Identifier(id.span(), id.name());
        }
        throw unexpected("identifier");
    }

    // === Helpers ===

    /**
     * Accept ';' or an implied semicolon: before '}', at end of input or at a line break.
     */
    private void consumeSemicolon() throws TransformException {
        if (matchPunctuator(";")) {
            return;
        }
        if (!atStatementEnd()) {
            throw unexpected("';'");
        }
    }

    private boolean atStatementEnd() {
        var token = peek();
        if (token instanceof JsToken.Eof || isPunctuator(token, ";") || isPunctuator(token, "}")) {
            return true;
        }
        return pos > 0 && token.span().start().line() > tokens.get(pos - 1).span().end().line();
    }

    /**
     * Open one nesting level. Deeply nested input would otherwise exhaust the stack here or in
     * any later tree walk.
     */
    private void descend() throws TransformException {
        if (++depth > MAX_NESTING_DEPTH) {
            throw new TransformException(new TransformError.NestingTooDeep(peek().span().start(), MAX_NESTING_DEPTH));
        }
    }

    private void expectPunctuator(String text) throws TransformException {
        if (!matchPunctuator(text)) {
            throw unexpected("'" + text + "'");
        }
    }

    private boolean matchPunctuator(String text) {
        if (isPunctuator(peek(), text)) {
            advance();
            return true;
        }
        return false;
    }

    private static boolean isPunctuator(JsToken token, String text) {
        return token instanceof JsToken.Punctuator punctuator && punctuator.is(text);
    }

    private TransformException unexpected(String expected) {
        var token = peek();
        if (token instanceof JsToken.Eof) {
            return new TransformException(new TransformError.UnexpectedEof(token.span().start(), expected));
        }
        return new TransformException(new TransformError.UnexpectedToken(
            token.span().start(),
            token.describe(),
            expected));
    }

    private SourceSpan spanFrom(SourceLocation start) {
        return SourceSpan.of(start, tokens.get(pos - 1).span().end());
    }

    private JsToken peek() {
        return tokens.get(pos);
    }

    private JsToken advance() {
        var token = tokens.get(pos);
        if (!(token instanceof JsToken.Eof)) {
            pos++;
        }
        return token;
    }
}
