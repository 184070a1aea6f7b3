package org.pragmatica.jstransform.syntax;

import org.pragmatica.jstransform.tree.SourceSpan;

/**
 * Token types for the JavaScript lexer.
 */
public sealed interface JsToken {
    SourceSpan span();

    /**
     * Text shown in error messages.
     */
    String describe();

    // Keywords are lexed as identifiers; the parser decides what they mean.
    record Identifier(SourceSpan span, String name) implements JsToken {
        @Override
        public String describe() {
            return name;
        }
    }

    record StringLiteral(SourceSpan span, String value, String raw) implements JsToken {
        @Override
        public String describe() {
            return raw;
        }
    }

    record NumericLiteral(SourceSpan span, double value, String raw) implements JsToken {
        @Override
        public String describe() {
            return raw;
        }
    }

    // ( ) { } [ ] ; , . ... => and operators
    record Punctuator(SourceSpan span, String text) implements JsToken {
        @Override
        public String describe() {
            return text;
        }

        public boolean is(String expected) {
            return text.equals(expected);
        }
    }

    record Eof(SourceSpan span) implements JsToken {
        @Override
        public String describe() {
            return "end of input";
        }
    }

    record Error(SourceSpan span, String message) implements JsToken {
        @Override
        public String describe() {
            return message;
        }
    }
}
