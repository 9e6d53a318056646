package org.arpha.conduit.metadata;

import lombok.extern.slf4j.Slf4j;
import org.arpha.conduit.exception.RegistrationException;
import org.arpha.conduit.http.routing.Router;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Controller and route descriptors collected by registration calls, in registration order.
 * <p>
 * Routes may be registered before their controller. A registry is meant to be
 * {@link #reset()} between independent build cycles so that routes of a discarded
 * application never leak into the next one.
 */
@Slf4j
public class MetadataRegistry {

    private final Map<Class<?>, ControllerDescriptor> controllers = new LinkedHashMap<>();
    private final Map<Class<?>, List<MethodDescriptor>> methods = new LinkedHashMap<>();

    public synchronized void registerController(ControllerDescriptor descriptor) {
        Class<?> type = descriptor.controllerType();
        if (controllers.containsKey(type)) {
            throw new RegistrationException("Controller " + type.getName() + " is already registered");
        }
        controllers.put(type, descriptor.withMethods(List.of()));
        log.debug("Registered controller {} at {}", type.getSimpleName(), descriptor.basePath());
        for (MethodDescriptor method : descriptor.methods()) {
            registerMethod(type, method);
        }
    }

    public synchronized void registerMethod(Class<?> controllerType, MethodDescriptor descriptor) {
        List<MethodDescriptor> registered = methods.computeIfAbsent(controllerType, k -> new ArrayList<>());
        String subPath = Router.normalize(descriptor.subPath());
        for (MethodDescriptor existing : registered) {
            if (existing.httpVerb() == descriptor.httpVerb() && Router.normalize(existing.subPath()).equals(subPath)) {
                throw new RegistrationException("Route " + descriptor.httpVerb() + " " + subPath + " of "
                        + controllerType.getName() + " is already mapped to " + existing.actionName());
            }
        }
        registered.add(descriptor);
        log.debug("Registered {} {} -> {}.{}", descriptor.httpVerb(), subPath,
                controllerType.getSimpleName(), descriptor.actionName());
    }

    /**
     * Snapshot of every controller with its routes attached.
     *
     * @throws RegistrationException if routes were registered for a controller that never was
     */
    public synchronized List<ControllerDescriptor> controllers() {
        for (Class<?> type : methods.keySet()) {
            if (!controllers.containsKey(type)) {
                throw new RegistrationException("Routes registered for " + type.getName()
                        + " but the controller itself was never registered");
            }
        }
        List<ControllerDescriptor> snapshot = new ArrayList<>(controllers.size());
        for (ControllerDescriptor controller : controllers.values()) {
            snapshot.add(controller.withMethods(methods.getOrDefault(controller.controllerType(), List.of())));
        }
        return List.copyOf(snapshot);
    }

    public synchronized boolean isEmpty() {
        return controllers.isEmpty() && methods.isEmpty();
    }

    public synchronized void reset() {
        log.debug("Clearing {} controllers", controllers.size());
        controllers.clear();
        methods.clear();
    }

}
