package org.rostilos.reviewpipe.analysisengine.exception;

/**
 * Thrown when the diff source cannot be read or resolved at all.
 * This is the only fatal parsing error; malformed file blocks are skipped instead.
 */
public class DiffUnreadableException extends RuntimeException {

    private final String source;

    public DiffUnreadableException(String source, String message, Throwable cause) {
        super(String.format("Failed to read diff from %s: %s", source, message), cause);
        this.source = source;
    }

    public DiffUnreadableException(String source, String message) {
        this(source, message, null);
    }

    public String getSource() {
        return source;
    }
}
