package org.arpha.conduit.http.routing;

import lombok.extern.slf4j.Slf4j;
import org.arpha.conduit.http.common.HttpMethod;
import org.arpha.conduit.http.pipeline.ErrorMiddleware;
import org.arpha.conduit.http.pipeline.HttpRequest;
import org.arpha.conduit.http.pipeline.HttpResponse;
import org.arpha.conduit.http.pipeline.Middleware;
import org.arpha.conduit.http.pipeline.Next;

import java.util.List;
import java.util.Optional;

/**
 * Ordered stack of middleware, endpoint and error layers.
 * <p>
 * A request walks the stack from the top. Calling {@code next.proceed()} moves to the next
 * handler of the current layer, then to the next matching layer; calling
 * {@code next.fail(error)} skips straight to the next matching error layer. Exceptions thrown
 * synchronously by a handler are treated as {@code next.fail}. Stages returned by handlers
 * are not observed here; see {@code org.arpha.conduit.core.MiddlewareAdapter}.
 * <p>
 * When the stack is exhausted an error yields {@code 500 Internal Server Error} and an
 * unanswered request yields {@code 404}.
 */
@Slf4j
public class Application {

    private final Router router = new Router();

    public Application use(Middleware... handlers) {
        return use("/", handlers);
    }

    public Application use(String pathPrefix, Middleware... handlers) {
        router.addMiddleware(pathPrefix, List.of(handlers));
        return this;
    }

    public Application use(ErrorMiddleware errorHandler) {
        return use("/", errorHandler);
    }

    public Application use(String pathPrefix, ErrorMiddleware errorHandler) {
        router.addErrorHandler(pathPrefix, errorHandler);
        return this;
    }

    public Application route(HttpMethod method, String path, List<Middleware> handlers) {
        RouteDefinition route = router.addRoute(method, path, handlers);
        log.debug("Mounted {} {} with {} handlers", method, route.originalPath(), handlers.size());
        return this;
    }

    public List<RouteDefinition> getRoutes() {
        return router.getRoutes();
    }

    public void handle(HttpRequest request, HttpResponse response) {
        log.debug("Dispatching {}", request);
        new Dispatch(request, response).proceed();
    }

    private final class Dispatch implements Next {

        private final HttpRequest request;
        private final HttpResponse response;
        private int layerIndex;
        private RouteDefinition current;
        private int handlerIndex;

        private Dispatch(HttpRequest request, HttpResponse response) {
            this.request = request;
            this.response = response;
        }

        @Override
        public void proceed() {
            advance(null);
        }

        @Override
        public void fail(Throwable error) {
            current = null;
            advance(error != null ? error : new IllegalArgumentException("next.fail called without an error"));
        }

        private void advance(Throwable error) {
            if (error == null && current != null && handlerIndex < current.handlers().size()) {
                invoke(current.handlers().get(handlerIndex++));
                return;
            }
            current = null;

            List<RouteDefinition> routes = router.getRoutes();
            while (layerIndex < routes.size()) {
                RouteDefinition route = routes.get(layerIndex++);
                if (route.isErrorHandler() != (error != null)) {
                    continue;
                }
                Optional<RouteMatch> match = Router.match(route, request.getPath(), request.getMethod());
                if (match.isEmpty()) {
                    continue;
                }
                request.setPathParams(match.get().pathParams());
                if (error != null) {
                    invokeErrorHandler(route.errorHandler(), error);
                } else {
                    current = route;
                    handlerIndex = 0;
                    invoke(current.handlers().get(handlerIndex++));
                }
                return;
            }
            finish(error);
        }

        private void invoke(Middleware handler) {
            try {
                handler.handle(request, response, this);
            } catch (Exception e) {
                log.debug("Handler threw for {}", request, e);
                fail(e);
            }
        }

        private void invokeErrorHandler(ErrorMiddleware handler, Throwable error) {
            try {
                handler.handle(error, request, response, this);
            } catch (Exception e) {
                log.debug("Error handler threw for {}", request, e);
                fail(e);
            }
        }

        private void finish(Throwable error) {
            if (error != null) {
                if (response.isCommitted()) {
                    log.error("Unhandled error for {} after the response was committed", request, error);
                    return;
                }
                log.error("Unhandled error for {}", request, error);
                response.status(500).send("Internal Server Error");
            } else if (!response.isCommitted()) {
                log.debug("No route matched {}", request);
                response.status(404).send("Cannot " + request.getMethodName() + " " + request.getPath());
            }
        }

    }

}
