package org.rostilos.reviewpipe.reviewcli.command;

/**
 * Invalid command line. Mapped to exit status 2.
 */
public class CliUsageException extends RuntimeException {

    public CliUsageException(String message) {
        super(message);
    }
}
