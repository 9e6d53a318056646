package org.arpha.conduit.core;

import lombok.extern.slf4j.Slf4j;
import org.arpha.conduit.container.Container;
import org.arpha.conduit.http.routing.Application;
import org.arpha.conduit.metadata.MetadataRegistry;
import org.arpha.conduit.metadata.RouteInfo;
import org.arpha.conduit.server.ConduitHttp;
import org.arpha.conduit.server.dto.ServerProperties;

import java.util.List;
import java.util.function.Consumer;

/**
 * Assembles an {@link Application} from a {@link MetadataRegistry}.
 * <p>
 * Layers are mounted in this order: the {@linkplain #setConfig application config}, every
 * compiled route, then the {@linkplain #setErrorConfig error config}. Every error forwarded by
 * a route therefore reaches the error middleware installed by the error config; without one,
 * the application's default error response applies.
 */
@Slf4j
public class ConduitServer {

    private final MetadataRegistry registry;
    private final ServerProperties properties;
    private final RouteBuilder routeBuilder;
    private Consumer<Application> config;
    private Consumer<Application> errorConfig;

    public ConduitServer(Container container, MetadataRegistry registry) {
        this(container, registry, ServerProperties.builder().build());
    }

    public ConduitServer(Container container, MetadataRegistry registry, ServerProperties properties) {
        this.registry = registry;
        this.properties = properties;
        this.routeBuilder = new RouteBuilder(container, properties.getSilentCompletion());
    }

    public ConduitServer setConfig(Consumer<Application> config) {
        this.config = config;
        return this;
    }

    public ConduitServer setErrorConfig(Consumer<Application> errorConfig) {
        this.errorConfig = errorConfig;
        return this;
    }

    /**
     * Builds a new, independent application from the current registry content.
     */
    public Application build() {
        Application application = new Application();
        if (config != null) {
            config.accept(application);
        }

        List<RouteRegistration> routes = routeBuilder.compile(registry, properties.getRootPath());
        for (RouteRegistration route : routes) {
            application.route(route.verb(), route.path(), route.handlers());
        }

        if (errorConfig != null) {
            errorConfig.accept(application);
        }
        log.info("Built application with {} routes", routes.size());
        return application;
    }

    public List<RouteInfo> getRouteInfo() {
        return RouteBuilder.describe(registry, properties.getRootPath());
    }

    /**
     * Builds the application and wraps it in an unbound HTTP server.
     */
    public ConduitHttp serve() {
        return new ConduitHttp(build(), properties);
    }

}
