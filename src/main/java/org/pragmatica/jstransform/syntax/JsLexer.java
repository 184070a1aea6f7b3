package org.pragmatica.jstransform.syntax;

import org.pragmatica.jstransform.tree.JsStrings;
import org.pragmatica.jstransform.tree.SourceLocation;
import org.pragmatica.jstransform.tree.SourceSpan;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for the supported JavaScript subset.
 */
public final class JsLexer {
    // Longest first, so that "===" wins over "==" and "=".
    private static final List<String> PUNCTUATORS = List.of(
        "...", "===", "!==", "**=",
        "=>", "==", "!=", "<=", ">=", "&&", "||", "??", "**", "+=", "-=", "*=", "/=", "%=",
        "(", ")", "{", "}", "[", "]", ";", ",", ".", "?", ":", "=", "+", "-", "*", "/", "%",
        "<", ">", "!", "~");

    private final String input;
    private int pos;
    private int line;
    private int column;

    private JsLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<JsToken> tokenize(String input) {
        return new JsLexer(input).tokenizeAll();
    }

    private List<JsToken> tokenizeAll() {
        var tokens = new ArrayList<JsToken>();
        while (!isAtEnd()) {
            var error = skipWhitespaceAndComments();
            if (error != null) {
                tokens.add(error);
                continue;
            }
            if (!isAtEnd()) {
                tokens.add(nextToken());
            }
        }
        tokens.add(new JsToken.Eof(currentSpan()));
        return tokens;
    }

    private JsToken nextToken() {
        var start = currentLocation();
        char c = peek();
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        if (c == '\'' || c == '"') {
            return scanStringLiteral(start);
        }
        if (isDigit(c) || (c == '.' && isDigit(peekAt(1)))) {
            return scanNumber(start);
        }
        if (c == '`') {
            advance();
            return new JsToken.Error(span(start), "Template literals are not supported");
        }
        return scanPunctuator(start);
    }

    private JsToken scanIdentifier(SourceLocation start) {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        return new JsToken.Identifier(span(start), input.substring(start.offset(), pos));
    }

    private JsToken scanStringLiteral(SourceLocation start) {
        char quote = advance();
        while (!isAtEnd() && peek() != quote) {
            char c = peek();
            if (c == '\n' || c == '\r') {
                return new JsToken.Error(span(start), "Unterminated string literal");
            }
            if (c == '\\' && pos + 1 < input.length()) {
                // escape: keep both characters, decoding happens on the raw text
                advance();
            }
            advance();
        }
        if (isAtEnd()) {
            return new JsToken.Error(span(start), "Unterminated string literal");
        }
        advance();
        var raw = input.substring(start.offset(), pos);
        try {
            return new JsToken.StringLiteral(span(start), JsStrings.unquote(raw), raw);
        } catch (IllegalArgumentException e) {
            return new JsToken.Error(span(start), "Invalid string literal: " + e.getMessage());
        }
    }

    private JsToken scanNumber(SourceLocation start) {
        if (peek() == '0' && (peekAt(1) == 'x' || peekAt(1) == 'X')) {
            advance();
            advance();
            while (!isAtEnd() && isHexDigit(peek())) {
                advance();
            }
            var raw = input.substring(start.offset(), pos);
            if (raw.length() == 2) {
                return new JsToken.Error(span(start), "Missing hexadecimal digits");
            }
            return new JsToken.NumericLiteral(span(start), new BigInteger(raw.substring(2), 16).doubleValue(), raw);
        }
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }
        if (!isAtEnd() && peek() == '.') {
            advance();
            while (!isAtEnd() && isDigit(peek())) {
                advance();
            }
        }
        if (!isAtEnd() && (peek() == 'e' || peek() == 'E')) {
            advance();
            if (!isAtEnd() && (peek() == '+' || peek() == '-')) {
                advance();
            }
            if (isAtEnd() || !isDigit(peek())) {
                return new JsToken.Error(span(start), "Missing exponent digits");
            }
            while (!isAtEnd() && isDigit(peek())) {
                advance();
            }
        }
        if (!isAtEnd() && isIdentifierStart(peek())) {
            return new JsToken.Error(span(start), "Identifier directly after number");
        }
        var raw = input.substring(start.offset(), pos);
        return new JsToken.NumericLiteral(span(start), Double.parseDouble(raw), raw);
    }

    private JsToken scanPunctuator(SourceLocation start) {
        for (var punctuator : PUNCTUATORS) {
            if (input.startsWith(punctuator, pos)) {
                for (int i = 0; i < punctuator.length(); i++) {
                    advance();
                }
                return new JsToken.Punctuator(span(start), punctuator);
            }
        }
        char c = advance();
        return new JsToken.Error(span(start), "Unexpected character: " + c);
    }

    /**
     * Skip whitespace and comments. Returns an error token for an unterminated block comment.
     */
    private JsToken skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c) || c == '\u00A0' || c == '\uFEFF') {
                advance();
            } else if (c == '/' && peekAt(1) == '/') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else if (c == '/' && peekAt(1) == '*') {
                var start = currentLocation();
                advance();
                advance();
                while (!isAtEnd() && !(peek() == '*' && peekAt(1) == '/')) {
                    advance();
                }
                if (isAtEnd()) {
                    return new JsToken.Error(span(start), "Unterminated block comment");
                }
                advance();
                advance();
            } else {
                break;
            }
        }
        return null;
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekAt(int distance) {
        int index = pos + distance;
        return index < input.length()
               ? input.charAt(index)
               : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan currentSpan() {
        return SourceSpan.at(currentLocation());
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$'
               || (c > 0x7F && Character.isUnicodeIdentifierStart(c));
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || (c > 0x7F && Character.isUnicodeIdentifierPart(c));
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
