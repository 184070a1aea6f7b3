package org.pragmatica.jstransform;

import org.pragmatica.jstransform.error.Diagnostic;

import java.util.List;

/**
 * Outcome of a plugin run: the output (the untouched input when the transform was skipped) and the
 * diagnostics reported on the way.
 *
 * @param output      Transformed output, or the original input if an error prevented the transform
 * @param diagnostics Reported diagnostics (empty on full success)
 * @param <T>         Output type: JSON text, source text or a syntax tree
 */
public record TransformResult<T>(T output, List<Diagnostic> diagnostics) {
    public TransformResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public static <T> TransformResult<T> success(T output) {
        return new TransformResult<>(output, List.of());
    }

    public static <T> TransformResult<T> skipped(T input, Diagnostic diagnostic) {
        return new TransformResult<>(input, List.of(diagnostic));
    }

    /**
     * Check if the transform ran without errors.
     */
    public boolean isSuccess() {
        return errorCount() == 0;
    }

    public int errorCount() {
        return (int) diagnostics.stream()
                                .filter(d -> d.severity() == Diagnostic.Severity.ERROR)
                                .count();
    }

    /**
     * Format all diagnostics in Rust style.
     *
     * @param source   Source text the diagnostics refer to
     * @param filename Filename for display
     * @return Formatted diagnostics string
     */
    public String formatDiagnostics(String source, String filename) {
        var sb = new StringBuilder();
        for (var diagnostic : diagnostics) {
            sb.append(diagnostic.format(source, filename));
            sb.append("\n");
        }
        return sb.toString();
    }
}
