/*
 * @LICENSE@
 */
package org.multisearch.cli;

/**
 * POSIX exit codes, the subset the command line uses.
 */
public final class ExitCodes {

    private ExitCodes() {
    } // no instance, just constants

    public static final int OK = 0;
    public static final int USAGE = 64;          /* command line usage error */
    public static final int NO_INPUT = 66;       /* cannot open input */
    public static final int CANT_CREATE = 73;    /* can't create (user) output file */
    public static final int IO_ERROR = 74;       /* input/output error */
}
