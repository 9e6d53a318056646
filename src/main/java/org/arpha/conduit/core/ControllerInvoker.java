package org.arpha.conduit.core;

import lombok.extern.slf4j.Slf4j;
import org.arpha.conduit.container.Container;
import org.arpha.conduit.exception.RegistrationException;
import org.arpha.conduit.exception.SilentCompletionException;
import org.arpha.conduit.http.annotation.PathParam;
import org.arpha.conduit.http.annotation.QueryParam;
import org.arpha.conduit.http.pipeline.HttpRequest;
import org.arpha.conduit.http.pipeline.HttpResponse;
import org.arpha.conduit.http.pipeline.Middleware;
import org.arpha.conduit.http.pipeline.Next;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.List;

/**
 * Wraps the action method of a controller into the last handler of a route.
 * <p>
 * The controller is resolved through the container on every request. Action parameters are
 * bound by type ({@link HttpRequest}, {@link HttpResponse}, {@link Next}) or by
 * {@link PathParam} / {@link QueryParam}. A non-null result, or the value of a returned
 * stage, is sent as the response body unless the action already responded or continued;
 * a silent completion is handled by the {@link SilentCompletionPolicy}.
 */
@Slf4j
public class ControllerInvoker {

    private final Container container;
    private final SilentCompletionPolicy silentCompletionPolicy;

    public ControllerInvoker(Container container, SilentCompletionPolicy silentCompletionPolicy) {
        this.container = container;
        this.silentCompletionPolicy = silentCompletionPolicy;
    }

    /**
     * @throws RegistrationException if the controller has no unique, bindable method of that name
     */
    public Middleware wrap(Class<?> controllerType, String actionName) {
        Method action = findAction(controllerType, actionName);
        return new ActionHandler(controllerType, action, binders(action));
    }

    static Method findAction(Class<?> controllerType, String actionName) {
        Method found = null;
        for (Method method : controllerType.getDeclaredMethods()) {
            if (!method.getName().equals(actionName) || method.isBridge() || method.isSynthetic()) {
                continue;
            }
            if (found != null) {
                throw new RegistrationException("Action " + controllerType.getName() + "." + actionName + " is overloaded");
            }
            found = method;
        }
        if (found == null) {
            throw new RegistrationException("Controller " + controllerType.getName() + " has no action " + actionName);
        }
        found.setAccessible(true);
        return found;
    }

    private static List<ArgumentBinder> binders(Method action) {
        List<ArgumentBinder> binders = new ArrayList<>();
        for (Parameter param : action.getParameters()) {
            Class<?> type = param.getType();
            if (type.equals(HttpRequest.class)) {
                binders.add((request, response, next) -> request);
            } else if (type.equals(HttpResponse.class)) {
                binders.add((request, response, next) -> response);
            } else if (type.equals(Next.class)) {
                binders.add((request, response, next) -> next);
            } else if (param.isAnnotationPresent(PathParam.class) && type.equals(String.class)) {
                String name = param.getAnnotation(PathParam.class).value();
                binders.add((request, response, next) -> request.getPathParam(name));
            } else if (param.isAnnotationPresent(QueryParam.class) && type.equals(String.class)) {
                String name = param.getAnnotation(QueryParam.class).value();
                binders.add((request, response, next) -> request.getQueryParam(name));
            } else {
                throw new RegistrationException("Cannot bind parameter " + param.getName() + " of "
                        + action.getDeclaringClass().getName() + "." + action.getName());
            }
        }
        return binders;
    }

    @FunctionalInterface
    private interface ArgumentBinder {
        Object bind(HttpRequest request, HttpResponse response, Next next);
    }

    private final class ActionHandler extends GuardedHandler {

        private final Class<?> controllerType;
        private final Method action;
        private final List<ArgumentBinder> binders;

        private ActionHandler(Class<?> controllerType, Method action, List<ArgumentBinder> binders) {
            super(controllerType.getSimpleName() + "." + action.getName());
            this.controllerType = controllerType;
            this.action = action;
            this.binders = binders;
        }

        @Override
        protected Object invoke(HttpRequest request, HttpResponse response, Next next) throws Throwable {
            Object controller = container.resolve(controllerType);
            Object[] args = new Object[binders.size()];
            for (int i = 0; i < args.length; i++) {
                args[i] = binders.get(i).bind(request, response, next);
            }
            try {
                return action.invoke(controller, args);
            } catch (InvocationTargetException e) {
                throw e.getCause();
            }
        }

        @Override
        protected void completed(Object value, HttpRequest request, HttpResponse response, GuardedContinuation next) {
            if (!next.isPending() || response.isCommitted()) {
                return;
            }
            if (value != null) {
                response.send(value);
                return;
            }
            switch (silentCompletionPolicy) {
                case NO_CONTENT -> response.status(204).end();
                case FORWARD_ERROR -> next.fail(new SilentCompletionException(label()));
                case IGNORE -> log.warn("{} completed for {} without writing a response", label(), request);
            }
        }
    }

}
