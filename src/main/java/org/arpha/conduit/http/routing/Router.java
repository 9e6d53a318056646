package org.arpha.conduit.http.routing;

import io.netty.handler.codec.http.QueryStringDecoder;
import org.arpha.conduit.http.common.HttpMethod;
import org.arpha.conduit.http.pipeline.ErrorMiddleware;
import org.arpha.conduit.http.pipeline.Middleware;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Router {

    private static final Pattern PARAM_PATTERN = Pattern.compile("\\{([^/]+?)\\}|:([A-Za-z_][A-Za-z0-9_]*)");

    private final List<RouteDefinition> routes = new ArrayList<>();

    public RouteDefinition addRoute(HttpMethod method, String path, List<Middleware> handlers) {
        if (method == null) {
            throw new IllegalArgumentException("Route method must not be null");
        }
        if (handlers.isEmpty()) {
            throw new IllegalArgumentException("Route " + method + " " + path + " has no handlers");
        }
        return add(method, path, false, handlers, null);
    }

    public RouteDefinition addMiddleware(String pathPrefix, List<Middleware> handlers) {
        if (handlers.isEmpty()) {
            throw new IllegalArgumentException("No middleware given for " + pathPrefix);
        }
        return add(null, pathPrefix, true, handlers, null);
    }

    public RouteDefinition addErrorHandler(String pathPrefix, ErrorMiddleware errorHandler) {
        return add(null, pathPrefix, true, List.of(), errorHandler);
    }

    private RouteDefinition add(HttpMethod method, String path, boolean prefix,
                                List<Middleware> handlers, ErrorMiddleware errorHandler) {
        String normalized = normalize(path);
        PathPattern pp = compilePathPattern(normalized, prefix);
        RouteDefinition route = new RouteDefinition(
                normalized,
                method,
                pp.getPattern(),
                pp.getParamNames(),
                List.copyOf(handlers),
                errorHandler
        );
        routes.add(route);
        return route;
    }

    /**
     * Matches a single layer against a request path and method.
     * Returns an Optional with RouteMatch if the layer applies, otherwise empty.
     */
    public static Optional<RouteMatch> match(RouteDefinition route, String path, HttpMethod httpMethod) {
        if (!route.acceptsMethod(httpMethod)) {
            return Optional.empty();
        }
        Matcher matcher = route.pattern().matcher(normalize(path));
        if (!matcher.matches()) {
            return Optional.empty();
        }
        Map<String, String> pathParams = new HashMap<>();
        List<String> paramNames = route.pathParamNames();
        for (int i = 0; i < paramNames.size(); i++) {
            String value = matcher.group(i + 1);
            pathParams.put(paramNames.get(i), QueryStringDecoder.decodeComponent(value));
        }
        return Optional.of(new RouteMatch(route, pathParams));
    }

    public List<RouteDefinition> getRoutes() {
        return Collections.unmodifiableList(routes);
    }

    /**
     * Joins path segments with single slashes, without a trailing slash except for the root.
     */
    public static String join(String... segments) {
        StringBuilder joined = new StringBuilder();
        for (String segment : segments) {
            if (segment != null && !segment.isEmpty()) {
                joined.append('/').append(segment);
            }
        }
        return normalize(joined.toString());
    }

    public static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        String collapsed = ("/" + path).replaceAll("/{2,}", "/");
        if (collapsed.length() > 1 && collapsed.endsWith("/")) {
            collapsed = collapsed.substring(0, collapsed.length() - 1);
        }
        return collapsed;
    }

    public static class PathPattern {
        private final Pattern pattern;
        private final List<String> paramNames;

        public PathPattern(Pattern pattern, List<String> paramNames) {
            this.pattern = pattern;
            this.paramNames = paramNames;
        }

        public Pattern getPattern() {
            return pattern;
        }

        public List<String> getParamNames() {
            return paramNames;
        }
    }

    static PathPattern compilePathPattern(String template, boolean prefix) {
        List<String> paramNames = new ArrayList<>();
        StringBuilder regexBuilder = new StringBuilder();
        int start = 0;
        Matcher m = PARAM_PATTERN.matcher(template);
        while (m.find()) {
            regexBuilder.append(Pattern.quote(template.substring(start, m.start())));
            regexBuilder.append("([^/]+)");
            paramNames.add(m.group(1) != null ? m.group(1) : m.group(2));
            start = m.end();
        }
        String rest = template.substring(start);
        if (!rest.isEmpty()) {
            regexBuilder.append(Pattern.quote(rest));
        }
        String regex;
        if (prefix) {
            // "/" as a prefix mounts on every path
            regex = "/".equals(template) ? "^/.*$" : "^" + regexBuilder + "(?:/.*)?$";
        } else {
            regex = "^" + regexBuilder + "$";
        }
        return new PathPattern(Pattern.compile(regex), List.copyOf(paramNames));
    }

}
