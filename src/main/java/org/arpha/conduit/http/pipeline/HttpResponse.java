package org.arpha.conduit.http.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.SneakyThrows;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Response under construction. It is committed exactly once, by {@link #send(Object)},
 * {@link #json(Object)}, {@link #sendStatus(int)} or {@link #end()}; committing hands the
 * response to its {@link ResponseWriter} and completes {@link #completion()}.
 */
public class HttpResponse {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final ResponseWriter writer;
    private final AtomicBoolean committed = new AtomicBoolean();
    private final CompletableFuture<HttpResponse> completion = new CompletableFuture<>();
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private volatile int status = 200;
    private volatile byte[] body = new byte[0];

    public HttpResponse(ResponseWriter writer) {
        this.writer = writer;
    }

    public HttpResponse() {
        this(ResponseWriter.NONE);
    }

    public HttpResponse status(int status) {
        this.status = status;
        return this;
    }

    public HttpResponse header(String name, String value) {
        headers.put(name, value);
        return this;
    }

    /**
     * Strings are sent as HTML text, byte arrays as an octet stream, anything else as JSON.
     */
    public void send(Object value) {
        if (value == null) {
            end();
        } else if (value instanceof String) {
            commit(((String) value).getBytes(StandardCharsets.UTF_8), "text/html; charset=UTF-8");
        } else if (value instanceof byte[]) {
            commit((byte[]) value, "application/octet-stream");
        } else {
            json(value);
        }
    }

    @SneakyThrows
    public void json(Object value) {
        commit(objectMapper.writeValueAsBytes(value), "application/json; charset=UTF-8");
    }

    public void sendStatus(int status) {
        status(status).send(HttpResponseStatus.valueOf(status).reasonPhrase());
    }

    public void end() {
        commit(new byte[0], null);
    }

    public boolean isCommitted() {
        return committed.get();
    }

    public CompletableFuture<HttpResponse> completion() {
        return completion;
    }

    public int getStatus() {
        return status;
    }

    public String getHeader(String name) {
        return headers.get(name);
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public byte[] getBody() {
        return body;
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    private void commit(byte[] content, String contentType) {
        if (!committed.compareAndSet(false, true)) {
            throw new IllegalStateException("Response already committed");
        }
        if (contentType != null) {
            headers.putIfAbsent("Content-Type", contentType);
        }
        headers.put("Content-Length", String.valueOf(content.length));
        this.body = content;
        try {
            writer.write(this);
        } catch (RuntimeException e) {
            completion.completeExceptionally(e);
            throw e;
        }
        completion.complete(this);
    }

}
