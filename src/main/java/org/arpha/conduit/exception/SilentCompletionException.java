package org.arpha.conduit.exception;

/**
 * Raised when a controller action completes without writing a response, without
 * returning a value and without calling its continuation.
 */
public class SilentCompletionException extends RuntimeException {

    public SilentCompletionException(String action) {
        super("Action " + action + " completed without writing a response");
    }

}
