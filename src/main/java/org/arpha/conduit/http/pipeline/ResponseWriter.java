package org.arpha.conduit.http.pipeline;

@FunctionalInterface
public interface ResponseWriter {

    ResponseWriter NONE = response -> { };

    void write(HttpResponse response);

}
