/*
 * @LICENSE@
 */
package org.multisearch.cli;

/**
 * An exception representing a user fixable problem in {@link Command} usage.
 */
public class UserError extends Exception {

    private static final long serialVersionUID = 1L;

    /** The exit status the cli should use when catching this user error. */
    public final int exitCode;

    /** Constructs a UserError with an exit status and message to show the user. */
    public UserError(int exitCode, String msg) {
        super(msg);
        this.exitCode = exitCode;
    }

    public UserError(int exitCode, String msg, Throwable cause) {
        super(msg, cause);
        this.exitCode = exitCode;
    }
}
