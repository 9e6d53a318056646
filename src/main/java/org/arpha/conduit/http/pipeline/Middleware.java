package org.arpha.conduit.http.pipeline;

import java.util.concurrent.CompletionStage;

/**
 * A unit of the request-processing chain.
 * <p>
 * A handler that finishes its work before returning returns {@code null}. A handler that
 * suspends returns the pending stage; it still owns calling {@code next} or writing the
 * response once that work is done.
 */
@FunctionalInterface
public interface Middleware {

    CompletionStage<?> handle(HttpRequest request, HttpResponse response, Next next) throws Exception;

}
