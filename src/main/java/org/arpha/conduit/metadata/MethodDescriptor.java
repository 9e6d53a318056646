package org.arpha.conduit.metadata;

import org.arpha.conduit.http.common.HttpMethod;

import java.util.List;
import java.util.Objects;

/**
 * One route of a controller. Middleware runs in list order, before the action.
 */
public record MethodDescriptor(HttpMethod httpVerb, String subPath, List<MiddlewareRef> middleware, String actionName) {

    public MethodDescriptor {
        Objects.requireNonNull(httpVerb, "httpVerb");
        Objects.requireNonNull(actionName, "actionName");
        subPath = subPath == null ? "/" : subPath;
        middleware = List.copyOf(middleware);
    }

    public static MethodDescriptor of(HttpMethod httpVerb, String subPath, String actionName, MiddlewareRef... middleware) {
        return new MethodDescriptor(httpVerb, subPath, List.of(middleware), actionName);
    }

}
