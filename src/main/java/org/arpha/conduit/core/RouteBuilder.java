package org.arpha.conduit.core;

import lombok.extern.slf4j.Slf4j;
import org.arpha.conduit.container.Container;
import org.arpha.conduit.http.pipeline.Middleware;
import org.arpha.conduit.http.routing.Router;
import org.arpha.conduit.metadata.ControllerDescriptor;
import org.arpha.conduit.metadata.MetadataRegistry;
import org.arpha.conduit.metadata.MethodDescriptor;
import org.arpha.conduit.metadata.MiddlewareRef;
import org.arpha.conduit.metadata.RouteInfo;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class RouteBuilder {

    private final MiddlewareAdapter middlewareAdapter;
    private final ControllerInvoker controllerInvoker;

    public RouteBuilder(Container container, SilentCompletionPolicy silentCompletionPolicy) {
        this(new MiddlewareAdapter(container), new ControllerInvoker(container, silentCompletionPolicy));
    }

    RouteBuilder(MiddlewareAdapter middlewareAdapter, ControllerInvoker controllerInvoker) {
        this.middlewareAdapter = middlewareAdapter;
        this.controllerInvoker = controllerInvoker;
    }

    /**
     * Compiles every registered route, in registration order. The registry is only read.
     */
    public List<RouteRegistration> compile(MetadataRegistry registry, String rootPath) {
        List<RouteRegistration> registrations = new ArrayList<>();
        for (ControllerDescriptor controller : registry.controllers()) {
            List<Middleware> controllerMiddleware = adapt(controller.middleware());
            for (MethodDescriptor method : controller.methods()) {
                List<Middleware> handlers = new ArrayList<>(controllerMiddleware);
                handlers.addAll(adapt(method.middleware()));
                handlers.add(controllerInvoker.wrap(controller.controllerType(), method.actionName()));

                String path = Router.join(rootPath, controller.basePath(), method.subPath());
                registrations.add(new RouteRegistration(method.httpVerb(), path, controller.controllerType(),
                        method.actionName(), handlers));
                log.debug("Compiled {} {} -> {}.{} ({} handlers)", method.httpVerb(), path,
                        controller.controllerType().getSimpleName(), method.actionName(), handlers.size());
            }
        }
        return registrations;
    }

    public static List<RouteInfo> describe(MetadataRegistry registry, String rootPath) {
        List<RouteInfo> info = new ArrayList<>();
        for (ControllerDescriptor controller : registry.controllers()) {
            List<RouteInfo.Endpoint> endpoints = new ArrayList<>();
            for (MethodDescriptor method : controller.methods()) {
                endpoints.add(new RouteInfo.Endpoint(method.httpVerb(),
                        Router.join(rootPath, controller.basePath(), method.subPath())));
            }
            info.add(new RouteInfo(controller.controllerType().getSimpleName(), List.copyOf(endpoints)));
        }
        return info;
    }

    private List<Middleware> adapt(List<MiddlewareRef> refs) {
        List<Middleware> adapted = new ArrayList<>(refs.size());
        for (MiddlewareRef ref : refs) {
            adapted.add(middlewareAdapter.adapt(ref));
        }
        return adapted;
    }

}
