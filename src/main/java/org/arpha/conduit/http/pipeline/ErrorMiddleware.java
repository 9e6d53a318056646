package org.arpha.conduit.http.pipeline;

/**
 * Terminal handler invoked with the error forwarded by an upstream handler.
 */
@FunctionalInterface
public interface ErrorMiddleware {

    void handle(Throwable error, HttpRequest request, HttpResponse response, Next next) throws Exception;

}
