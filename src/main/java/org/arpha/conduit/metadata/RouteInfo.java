package org.arpha.conduit.metadata;

import org.arpha.conduit.http.common.HttpMethod;

import java.util.List;

public record RouteInfo(String controller, List<Endpoint> endpoints) {

    public record Endpoint(HttpMethod method, String route) {
    }

}
