package org.pragmatica.jstransform.error;

/**
 * Checked exception carrying a {@link TransformError}.
 */
public final class TransformException extends Exception {
    private final TransformError error;

    public TransformException(TransformError error) {
        super(error.message());
        this.error = error;
    }

    public TransformException(TransformError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public TransformError error() {
        return error;
    }
}
