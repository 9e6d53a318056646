package org.arpha.conduit.http.routing;

import org.arpha.conduit.http.common.HttpMethod;
import org.arpha.conduit.http.pipeline.HttpResponse;
import org.arpha.conduit.http.pipeline.Middleware;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.arpha.conduit.testutil.Exchange.perform;
import static org.assertj.core.api.Assertions.assertThat;

class ApplicationTest {

    private final Application app = new Application();
    private final List<String> trace = new CopyOnWriteArrayList<>();

    private Middleware step(String name) {
        return (request, response, next) -> {
            trace.add(name);
            next.proceed();
            return null;
        };
    }

    @Test
    void unmatchedRequest_yields404() throws Exception {
        app.route(HttpMethod.GET, "/known", List.of((request, response, next) -> {
            response.send("known");
            return null;
        }));

        HttpResponse response = perform(app, HttpMethod.GET, "/unknown");

        assertThat(response.getStatus()).isEqualTo(404);
        assertThat(response.getBodyAsString()).isEqualTo("Cannot GET /unknown");
    }

    @Test
    void syncThrow_withoutErrorMiddleware_yields500() throws Exception {
        app.route(HttpMethod.GET, "/", List.of((request, response, next) -> {
            throw new IllegalStateException("boom");
        }));

        HttpResponse response = perform(app, HttpMethod.GET, "/");

        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(response.getBodyAsString()).isEqualTo("Internal Server Error");
    }

    @Test
    void routeHandlersAndLaterLayers_runInOrder() throws Exception {
        app.use(step("use"));
        app.route(HttpMethod.GET, "/items/{id}", List.of(step("first"), step("second")));
        app.route(HttpMethod.GET, "/items/{id}", List.of((request, response, next) -> {
            trace.add("endpoint " + request.getPathParam("id"));
            response.send("ok");
            return null;
        }));

        HttpResponse response = perform(app, HttpMethod.GET, "/items/9");

        assertThat(response.getBodyAsString()).isEqualTo("ok");
        assertThat(trace).containsExactly("use", "first", "second", "endpoint 9");
    }

    @Test
    void failure_skipsRemainingHandlers_andReachesErrorMiddleware() throws Exception {
        app.route(HttpMethod.POST, "/", List.of(
                (request, response, next) -> {
                    next.fail(new IllegalArgumentException("bad input"));
                    return null;
                },
                step("skipped")));
        app.use(step("also skipped"));
        app.use((error, request, response, next) -> response.status(400).send(error.getMessage()));

        HttpResponse response = perform(app, HttpMethod.POST, "/");

        assertThat(response.getStatus()).isEqualTo(400);
        assertThat(response.getBodyAsString()).isEqualTo("bad input");
        assertThat(trace).isEmpty();
    }

    @Test
    void errorMiddleware_isSkippedWhenNothingFailed() throws Exception {
        app.use((error, request, response, next) -> trace.add("error"));
        app.route(HttpMethod.GET, "/", List.of((request, response, next) -> {
            response.send("fine");
            return null;
        }));

        HttpResponse response = perform(app, HttpMethod.GET, "/");

        assertThat(response.getBodyAsString()).isEqualTo("fine");
        assertThat(trace).isEmpty();
    }

    @Test
    void errorMiddleware_canPassTheErrorOn() throws Exception {
        app.route(HttpMethod.GET, "/", List.of((request, response, next) -> {
            throw new IllegalStateException("first");
        }));
        app.use((error, request, response, next) -> {
            trace.add("logged " + error.getMessage());
            next.fail(error);
        });
        app.use((error, request, response, next) -> response.status(502).send("handled"));

        HttpResponse response = perform(app, HttpMethod.GET, "/");

        assertThat(response.getStatus()).isEqualTo(502);
        assertThat(trace).containsExactly("logged first");
    }

}
