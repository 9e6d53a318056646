package org.arpha.conduit.http.routing;

import org.arpha.conduit.http.common.HttpMethod;
import org.arpha.conduit.http.pipeline.ErrorMiddleware;
import org.arpha.conduit.http.pipeline.Middleware;

import java.util.List;
import java.util.regex.Pattern;

/**
 * One layer of an application. Endpoint layers carry an HTTP method; middleware and error
 * layers mounted with {@code use} carry none and match by path prefix.
 */
public record RouteDefinition(String originalPath, HttpMethod httpMethod, Pattern pattern,
                              List<String> pathParamNames, List<Middleware> handlers,
                              ErrorMiddleware errorHandler) {

    public boolean isErrorHandler() {
        return errorHandler != null;
    }

    public boolean isEndpoint() {
        return httpMethod != null;
    }

    boolean acceptsMethod(HttpMethod requestMethod) {
        return httpMethod == null || httpMethod.matches(requestMethod);
    }

}
