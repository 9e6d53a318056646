package org.arpha.conduit.http.annotation;

import org.arpha.conduit.http.common.HttpMethod;
import org.arpha.conduit.http.pipeline.Middleware;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface HttpRoute {

    String path() default "/";

    HttpMethod method() default HttpMethod.GET;

    Class<? extends Middleware>[] middleware() default {};

}
