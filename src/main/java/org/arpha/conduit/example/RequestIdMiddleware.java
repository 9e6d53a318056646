package org.arpha.conduit.example;

import org.arpha.conduit.http.pipeline.HttpRequest;
import org.arpha.conduit.http.pipeline.HttpResponse;
import org.arpha.conduit.http.pipeline.Middleware;
import org.arpha.conduit.http.pipeline.Next;

import java.util.UUID;
import java.util.concurrent.CompletionStage;

/**
 * Tags each request with an id, reusing the caller's {@code X-Request-Id} when present.
 */
public class RequestIdMiddleware implements Middleware {

    public static final String HEADER = "X-Request-Id";

    @Override
    public CompletionStage<?> handle(HttpRequest request, HttpResponse response, Next next) {
        String id = request.getHeader(HEADER);
        if (id == null || id.isBlank()) {
            id = UUID.randomUUID().toString();
        }
        request.setAttribute("requestId", id);
        response.header(HEADER, id);
        next.proceed();
        return null;
    }

}
