package ai.docsite.plaintext.convert;

/**
 * Category of a fatal conversion failure, mapped to a process exit code.
 */
public enum FailureKind {
    /** Missing or unreadable bundle, metadata, article or site record. */
    INPUT(2),
    /** The temporary work space could not be created or populated. */
    WORKSPACE(3),
    /** Rendered text could not be written. */
    OUTPUT(4);

    private final int exitCode;

    FailureKind(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
