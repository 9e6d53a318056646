package org.arpha.conduit.http.pipeline;

import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.Getter;
import lombok.Setter;
import org.arpha.conduit.http.common.HttpMethod;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Request as seen by the pipeline. The raw content is never parsed; handlers attach
 * whatever they derive from it as the request {@code payload} or as attributes.
 */
@Getter
public class HttpRequest {

    private final String methodName;
    private final HttpMethod method;
    private final String uri;
    private final String path;
    private final Map<String, List<String>> queryParams;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final String content;
    private final Map<String, Object> attributes = new HashMap<>();
    private Map<String, String> pathParams = Collections.emptyMap();

    @Setter
    private Object payload;

    public HttpRequest(String methodName, String uri, Map<String, String> headers, String content) {
        QueryStringDecoder decoder = new QueryStringDecoder(uri);
        this.methodName = methodName;
        this.method = HttpMethod.fromName(methodName);
        this.uri = uri;
        this.path = decoder.path();
        this.queryParams = decoder.parameters();
        this.headers.putAll(headers);
        this.content = content == null ? "" : content;
    }

    public static HttpRequest of(HttpMethod method, String uri) {
        return new HttpRequest(method.name(), uri, Map.of(), "");
    }

    public String getHeader(String name) {
        return headers.get(name);
    }

    public String getQueryParam(String name) {
        List<String> values = queryParams.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public String getPathParam(String name) {
        return pathParams.get(name);
    }

    public void setPathParams(Map<String, String> pathParams) {
        this.pathParams = Collections.unmodifiableMap(pathParams);
    }

    @SuppressWarnings("unchecked")
    public <T> T getAttribute(String name) {
        return (T) attributes.get(name);
    }

    public void setAttribute(String name, Object value) {
        attributes.put(name, value);
    }

    @Override
    public String toString() {
        return methodName + " " + uri;
    }

}
