package org.rostilos.reviewpipe.reviewcli.command;

public final class ExitStatus {

    public static final int OK = 0;
    public static final int FAILURE = 1;
    public static final int USAGE = 2;

    private ExitStatus() {
        throw new UnsupportedOperationException("Utility class");
    }
}
