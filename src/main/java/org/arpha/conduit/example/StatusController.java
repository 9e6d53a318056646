package org.arpha.conduit.example;

import lombok.extern.slf4j.Slf4j;
import org.arpha.conduit.http.annotation.Controller;
import org.arpha.conduit.http.annotation.HttpRoute;
import org.arpha.conduit.http.annotation.PathParam;
import org.arpha.conduit.http.annotation.QueryParam;
import org.arpha.conduit.http.common.HttpMethod;
import org.arpha.conduit.http.pipeline.HttpRequest;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

@Slf4j
@Controller(value = "/status", middleware = RequestIdMiddleware.class)
public class StatusController {

    @HttpRoute(path = "/", method = HttpMethod.GET)
    public StatusResponse status(HttpRequest request) {
        return new StatusResponse("UP", request.getAttribute("requestId"));
    }

    @HttpRoute(path = "/echo/{word}", method = HttpMethod.GET)
    public CompletionStage<EchoResponse> echo(@PathParam("word") String word, @QueryParam("times") String times) {
        return CompletableFuture.supplyAsync(() -> {
            int count = times == null ? 1 : Integer.parseInt(times);
            log.debug("Echoing '{}' {} times", word, count);
            return new EchoResponse(word.repeat(count));
        });
    }

    public record StatusResponse(String status, String requestId) { }

    public record EchoResponse(String echo) { }

}
