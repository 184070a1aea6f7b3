package org.pragmatica.jstransform.tree;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    /**
     * Span used for nodes that do not originate from source text.
     */
    public static final SourceSpan DUMMY = new SourceSpan(SourceLocation.START, SourceLocation.START);

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
