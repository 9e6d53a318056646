package org.arpha.conduit.http.pipeline;

/**
 * Continuation handed to every handler: passes control to the following stage,
 * or skips to the error stage when called with a failure.
 */
public interface Next {

    void proceed();

    void fail(Throwable error);

}
