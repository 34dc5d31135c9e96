package ai.docsite.plaintext.convert;

import java.util.Objects;

/**
 * Runtime exception aborting a bundle conversion.
 */
public class ConversionException extends RuntimeException {

    private final FailureKind kind;

    public ConversionException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ConversionException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FailureKind kind() {
        return kind;
    }
}
