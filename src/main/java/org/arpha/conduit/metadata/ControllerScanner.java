package org.arpha.conduit.metadata;

import org.arpha.conduit.exception.RegistrationException;
import org.arpha.conduit.http.annotation.Controller;
import org.arpha.conduit.http.annotation.HttpRoute;
import org.arpha.conduit.http.pipeline.Middleware;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Turns {@link Controller} and {@link HttpRoute} annotations into registration calls.
 * Routes of one controller are registered in method-name order, since the JVM does not
 * report declaration order.
 */
public final class ControllerScanner {

    private ControllerScanner() {
    }

    public static void register(MetadataRegistry registry, Class<?>... controllerTypes) {
        for (Class<?> type : controllerTypes) {
            registry.registerController(describe(type));
        }
    }

    static ControllerDescriptor describe(Class<?> type) {
        Controller controller = type.getAnnotation(Controller.class);
        if (controller == null) {
            throw new RegistrationException(type.getName() + " is not annotated with @Controller");
        }

        List<MethodDescriptor> methods = new ArrayList<>();
        Method[] declared = type.getDeclaredMethods();
        Arrays.sort(declared, Comparator.comparing(Method::getName));
        for (Method method : declared) {
            if (method.isAnnotationPresent(HttpRoute.class)) {
                HttpRoute route = method.getAnnotation(HttpRoute.class);
                methods.add(new MethodDescriptor(route.method(), route.path(), refs(route.middleware()), method.getName()));
            }
        }
        return new ControllerDescriptor(type, controller.value(), refs(controller.middleware()), methods);
    }

    private static List<MiddlewareRef> refs(Class<? extends Middleware>[] types) {
        List<MiddlewareRef> refs = new ArrayList<>(types.length);
        for (Class<? extends Middleware> type : types) {
            refs.add(MiddlewareRef.type(type));
        }
        return refs;
    }

}
