package org.arpha.conduit.metadata;

import java.util.List;
import java.util.Objects;

/**
 * A controller type with the base path and middleware shared by all of its routes.
 */
public record ControllerDescriptor(Class<?> controllerType, String basePath, List<MiddlewareRef> middleware,
                                   List<MethodDescriptor> methods) {

    public ControllerDescriptor {
        Objects.requireNonNull(controllerType, "controllerType");
        basePath = basePath == null ? "/" : basePath;
        middleware = List.copyOf(middleware);
        methods = List.copyOf(methods);
    }

    public static ControllerDescriptor of(Class<?> controllerType, String basePath, MiddlewareRef... middleware) {
        return new ControllerDescriptor(controllerType, basePath, List.of(middleware), List.of());
    }

    public ControllerDescriptor withMethods(List<MethodDescriptor> methods) {
        return new ControllerDescriptor(controllerType, basePath, middleware, methods);
    }

}
