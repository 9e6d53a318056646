package org.arpha.conduit.core;

import org.arpha.conduit.container.Container;
import org.arpha.conduit.http.pipeline.HttpRequest;
import org.arpha.conduit.http.pipeline.HttpResponse;
import org.arpha.conduit.http.pipeline.Middleware;
import org.arpha.conduit.http.pipeline.Next;
import org.arpha.conduit.metadata.MiddlewareRef;

/**
 * Turns a {@link MiddlewareRef} into an async-safe host {@link Middleware}.
 * <p>
 * Class references are resolved through the container on every invocation; a resolution
 * failure is forwarded to the error stage like any other fault of the middleware.
 */
public class MiddlewareAdapter {

    private final Container container;

    public MiddlewareAdapter(Container container) {
        this.container = container;
    }

    public Middleware adapt(MiddlewareRef ref) {
        Middleware target;
        if (ref instanceof MiddlewareRef.FunctionMiddleware function) {
            target = function.middleware();
        } else if (ref instanceof MiddlewareRef.ClassMiddleware type) {
            Class<? extends Middleware> middlewareType = type.type();
            target = (request, response, next) -> container.resolve(middlewareType).handle(request, response, next);
        } else {
            throw new IllegalArgumentException("Unsupported middleware reference " + ref);
        }
        return new GuardedHandler(ref.describe()) {
            @Override
            protected Object invoke(HttpRequest request, HttpResponse response, Next next) throws Exception {
                return target.handle(request, response, next);
            }
        };
    }

}
