package org.arpha.conduit.core;

/**
 * What the controller invoker does when an action settles successfully with no value,
 * has not written a response and has not called its continuation.
 */
public enum SilentCompletionPolicy {

    /**
     * Commit an empty {@code 204 No Content} response.
     */
    NO_CONTENT,

    /**
     * Forward a {@link org.arpha.conduit.exception.SilentCompletionException} to the error stage.
     */
    FORWARD_ERROR,

    /**
     * Leave the request open. The action is assumed to write the response later by other means.
     * This is the default.
     */
    IGNORE

}
