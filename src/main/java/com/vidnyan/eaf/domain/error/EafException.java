package com.vidnyan.eaf.domain.error;

/**
 * Raised when an operation on an EAF document detects a referential,
 * structural, integrity or value-domain problem.
 * Operations fail on the first problem and never repair the document.
 */
public class EafException extends RuntimeException {

    private final EafError error;

    public EafException(EafError error, String message) {
        super(message);
        this.error = error;
    }

    public EafException(EafError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    /**
     * Create an exception with the error's formatted message.
     */
    public static EafException of(EafError error, Object... args) {
        return new EafException(error, error.format(args));
    }

    public EafError getError() {
        return error;
    }

    public EafError.Category getCategory() {
        return error.category();
    }
}
