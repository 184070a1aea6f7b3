package org.pragmatica.jstransform.error;

import org.pragmatica.jstransform.tree.SourceLocation;
import org.pragmatica.jstransform.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Diagnostic message reported by the transform pipeline.
 *
 * <p>Example output of {@link #format(String, String)}:
 * <pre>
 * error[E0001]: Unexpected '2' at 1:18, expected ')'
 *   --> input.js:1:18
 *   |
 * 1 | console.log("hi" 2)
 *   |                  ^
 *   |
 *   = help: the transform was skipped and the input returned unchanged
 * </pre>
 *
 * @param severity Error severity level
 * @param code     Error code (e.g., "E0001")
 * @param message  Primary error message
 * @param span     Source span where the error occurred, when it refers to source text
 * @param notes    Additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    String code,
    String message,
    Optional<SourceSpan> span,
    List<String> notes
) {
    public static final String SYNTAX_ERROR = "E0001";
    public static final String MALFORMED_AST = "E0002";
    public static final String INVALID_CONFIG = "E0003";
    public static final String UNKNOWN_VISITOR = "E0004";

    public Diagnostic {
        notes = List.copyOf(notes);
    }

    /**
     * Error severity levels.
     */
    public enum Severity {
        ERROR("error");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * Create an error diagnostic not tied to source text.
     */
    public static Diagnostic error(String code, String message) {
        return new Diagnostic(Severity.ERROR, code, message, Optional.empty(), List.of());
    }

    /**
     * Create an error diagnostic pointing at a source span.
     */
    public static Diagnostic error(String code, String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, code, message, Optional.of(span), List.of());
    }

    /**
     * Translate a pipeline failure into a diagnostic.
     */
    public static Diagnostic from(TransformError error) {
        if (error instanceof TransformError.UnexpectedToken token) {
            return error(SYNTAX_ERROR, error.message(), pointAt(token.location()));
        }
        if (error instanceof TransformError.UnexpectedEof eof) {
            return error(SYNTAX_ERROR, error.message(), pointAt(eof.location()));
        }
        if (error instanceof TransformError.LexicalError lexical) {
            return error(SYNTAX_ERROR, error.message(), pointAt(lexical.location()));
        }
        if (error instanceof TransformError.NestingTooDeep nesting) {
            return error(SYNTAX_ERROR, error.message(), pointAt(nesting.location()));
        }
        if (error instanceof TransformError.MalformedAst) {
            return error(MALFORMED_AST, error.message());
        }
        if (error instanceof TransformError.InvalidConfig || error instanceof TransformError.MissingConfig) {
            return error(INVALID_CONFIG, error.message());
        }
        return error(UNKNOWN_VISITOR, error.message());
    }

    private static SourceSpan pointAt(SourceLocation location) {
        var next = SourceLocation.at(location.line(), location.column() + 1, location.offset() + 1);
        return SourceSpan.of(location, next);
    }

    /**
     * Add a note.
     */
    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, code, message, span, newNotes);
    }

    /**
     * Add a help suggestion.
     */
    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic in Rust style, quoting the offending source line when the
     * diagnostic has a span.
     *
     * @param source   The source text
     * @param filename Filename for display
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        sb.append(severity.display())
          .append("[")
          .append(code)
          .append("]: ")
          .append(message)
          .append("\n");

        if (span.isEmpty()) {
            for (var note : notes) {
                sb.append("  = ").append(note).append("\n");
            }
            return sb.toString();
        }

        var location = span.get().start();
        var lines = source.split("\n", -1);
        int gutterWidth = String.valueOf(location.line()).length();

        sb.append("  --> ")
          .append(filename)
          .append(":")
          .append(location.line())
          .append(":")
          .append(location.column())
          .append("\n");
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        if (location.line() >= 1 && location.line() <= lines.length) {
            var lineContent = lines[location.line() - 1];
            sb.append(location.line()).append(" | ").append(lineContent).append("\n");
            sb.append(" ".repeat(gutterWidth))
              .append(" | ")
              .append(" ".repeat(Math.max(0, location.column() - 1)))
              .append("^".repeat(Math.max(1, underlineLength(lineContent))))
              .append("\n");
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    private int underlineLength(String lineContent) {
        var current = span.get();
        if (current.end().line() != current.start().line()) {
            return lineContent.length() - current.start().column() + 1;
        }
        return current.end().column() - current.start().column();
    }

    /**
     * Simple single-line format for logs.
     */
    public String formatSimple() {
        var location = span.map(s -> s.start().line() + ":" + s.start().column() + ": ")
                           .orElse("");
        return String.format("%s%s[%s]: %s", location, severity.display(), code, message);
    }
}
