package org.arpha.conduit.metadata;

import org.arpha.conduit.http.pipeline.Middleware;

import java.util.Objects;

/**
 * Reference to a middleware: either the handler itself, or a type resolved through the
 * container each time the middleware runs.
 */
public sealed interface MiddlewareRef permits MiddlewareRef.FunctionMiddleware, MiddlewareRef.ClassMiddleware {

    String describe();

    static MiddlewareRef function(Middleware middleware) {
        return new FunctionMiddleware(middleware);
    }

    static MiddlewareRef type(Class<? extends Middleware> type) {
        return new ClassMiddleware(type);
    }

    record FunctionMiddleware(Middleware middleware) implements MiddlewareRef {

        public FunctionMiddleware {
            Objects.requireNonNull(middleware, "middleware");
        }

        @Override
        public String describe() {
            return "function middleware " + middleware;
        }
    }

    record ClassMiddleware(Class<? extends Middleware> type) implements MiddlewareRef {

        public ClassMiddleware {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String describe() {
            return "middleware " + type.getSimpleName();
        }
    }

}
