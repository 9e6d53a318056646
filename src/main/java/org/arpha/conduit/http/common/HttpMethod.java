package org.arpha.conduit.http.common;

public enum HttpMethod {

    GET,
    POST,
    PUT,
    PATCH,
    DELETE,
    HEAD,
    OPTIONS,
    ALL;

    public boolean matches(HttpMethod requestMethod) {
        return this == ALL || this == requestMethod;
    }

    /**
     * Maps a request-line method name onto this enum. Unknown extension methods yield {@code null}.
     */
    public static HttpMethod fromName(String name) {
        if (name == null) {
            return null;
        }
        try {
            HttpMethod method = valueOf(name.toUpperCase());
            return method == ALL ? null : method;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

}
