package com.example.accessmanager.cli;

/** Process exit codes of the command line tool. */
public final class ExitCodes {
    public static final int OK = 0;
    public static final int CONFIGURATION_ERROR = 1;
    public static final int REMOTE_ERROR = 2;

    private ExitCodes() {}
}
