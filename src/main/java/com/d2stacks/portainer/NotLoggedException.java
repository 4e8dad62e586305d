package com.d2stacks.portainer;

/**
 * Thrown when session data is read from a client that has not logged in.
 * This is a caller bug, not a recoverable failure, so it never travels inside a Result.
 */
public class NotLoggedException extends IllegalStateException {

    public NotLoggedException() {
        super("Not logged in");
    }
}
