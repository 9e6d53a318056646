package org.arpha.conduit.core;

import org.arpha.conduit.http.common.HttpMethod;
import org.arpha.conduit.http.pipeline.Middleware;

import java.util.List;

/**
 * Compiled handler chain of one route: controller middleware, route middleware, then the action.
 */
public record RouteRegistration(HttpMethod verb, String path, Class<?> controllerType, String actionName,
                                List<Middleware> handlers) {

    public RouteRegistration {
        handlers = List.copyOf(handlers);
    }

}
