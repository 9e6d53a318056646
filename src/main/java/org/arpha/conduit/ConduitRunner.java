package org.arpha.conduit;

import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.arpha.conduit.configuration.ConfigurationManager;
import org.arpha.conduit.container.DefaultContainer;
import org.arpha.conduit.core.ConduitServer;
import org.arpha.conduit.example.RequestIdMiddleware;
import org.arpha.conduit.example.StatusController;
import org.arpha.conduit.http.routing.Application;
import org.arpha.conduit.metadata.ControllerScanner;
import org.arpha.conduit.metadata.MetadataRegistry;
import org.arpha.conduit.server.dto.ServerProperties;

import java.util.Map;

@Slf4j
public class ConduitRunner {

    @SneakyThrows
    public static void main(String[] args) {
        if (args.length > 0) {
            ConfigurationManager.overrideProperties(args[0]);
        }
        ServerProperties properties = ServerProperties.initialize();

        DefaultContainer container = new DefaultContainer()
                .bindSingleton(RequestIdMiddleware.class, RequestIdMiddleware::new);
        MetadataRegistry registry = new MetadataRegistry();
        ControllerScanner.register(registry, StatusController.class);

        ConduitServer server = new ConduitServer(container, registry, properties)
                .setErrorConfig(ConduitRunner::errorConfig);
        server.getRouteInfo().forEach(info -> log.info("{}: {}", info.controller(), info.endpoints()));

        server.serve().start();
    }

    public static void errorConfig(Application app) {
        app.use((error, request, response, next) -> {
            log.error("Request {} failed", request, error);
            if (!response.isCommitted()) {
                response.status(500).json(Map.of("error", String.valueOf(error.getMessage())));
            }
        });
    }

}
