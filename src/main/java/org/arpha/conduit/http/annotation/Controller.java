package org.arpha.conduit.http.annotation;

import org.arpha.conduit.http.pipeline.Middleware;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Controller {

    /**
     * Base path shared by every route of the controller.
     */
    String value();

    /**
     * Middleware run, in order, before the middleware of each route.
     */
    Class<? extends Middleware>[] middleware() default {};

}
