package org.arpha.conduit.container;

/**
 * Source of controller and class-middleware instances. Whether an instance is shared or
 * created per call is the container's policy.
 */
public interface Container {

    <T> T resolve(Class<T> type);

}
