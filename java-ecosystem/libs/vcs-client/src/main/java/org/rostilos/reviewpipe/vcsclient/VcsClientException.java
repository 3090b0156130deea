package org.rostilos.reviewpipe.vcsclient;

/**
 * Exception thrown when a repository cannot be opened or a revision cannot be diffed.
 */
public class VcsClientException extends RuntimeException {

    public VcsClientException(String message) {
        super(message);
    }

    public VcsClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
