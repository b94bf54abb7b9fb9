package org.merit.grapher;

/**
 * Checked exception thrown by the loader and the data transforms.
 * <p>
 * Every instance carries an {@link ErrorKind} so the window can decide whether the
 * message belongs in the status bar or in an error dialog. None of these failures
 * are fatal: the user corrects the input and triggers the action again.
 */
public class GrapherException extends Exception {
    private final ErrorKind kind;

    public GrapherException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GrapherException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * @return the category of this failure.
     */
    public ErrorKind getKind() {
        return kind;
    }
}
