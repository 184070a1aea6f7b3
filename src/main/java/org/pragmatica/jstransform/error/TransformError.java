package org.pragmatica.jstransform.error;

import org.pragmatica.jstransform.tree.SourceLocation;

/**
 * Failure raised while reading, decoding or configuring a transformation.
 */
public sealed interface TransformError {
    String message();

    /**
     * Unexpected token in source text.
     */
    record UnexpectedToken(
    SourceLocation location,
    String found,
    String expected) implements TransformError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }
    }

    /**
     * Source text ended early.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements TransformError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }

    /**
     * Malformed token (unterminated string, stray character, bad escape).
     */
    record LexicalError(
    SourceLocation location,
    String reason) implements TransformError {
        @Override
        public String message() {
            return reason + " at " + location;
        }
    }

    /**
     * Source nests expressions or statements deeper than the parser accepts.
     */
    record NestingTooDeep(
    SourceLocation location,
    int limit) implements TransformError {
        @Override
        public String message() {
            return "Nesting too deep at " + location + ", at most " + limit + " levels are supported";
        }
    }

    /**
     * JSON document does not describe a valid syntax tree.
     *
     * @param path   JSON pointer-like path of the offending node
     * @param reason what is wrong with it
     */
    record MalformedAst(
    String path,
    String reason) implements TransformError {
        @Override
        public String message() {
            return "Malformed AST at " + path + ": " + reason;
        }
    }

    /**
     * Host supplied no plugin configuration at all.
     */
    record MissingConfig() implements TransformError {
        @Override
        public String message() {
            return "Plugin config object is not supplied, skipping transform";
        }
    }

    /**
     * Plugin configuration is unreadable.
     */
    record InvalidConfig(String reason) implements TransformError {
        @Override
        public String message() {
            return "Invalid plugin config: " + reason;
        }
    }

    /**
     * No visitor registered under the requested name.
     */
    record UnknownVisitor(String name) implements TransformError {
        @Override
        public String message() {
            return "No visitor registered as '" + name + "'";
        }
    }
}
