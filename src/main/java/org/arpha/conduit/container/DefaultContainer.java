package org.arpha.conduit.container;

import lombok.extern.slf4j.Slf4j;
import org.arpha.conduit.exception.ResolutionException;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * In-process container with three binding scopes: constant, singleton (created on first
 * resolve) and transient (created on every resolve). Types without a binding are
 * instantiated per resolve through their no-arg constructor when they are concrete.
 */
@Slf4j
public class DefaultContainer implements Container {

    private final Map<Class<?>, Supplier<?>> bindings = new ConcurrentHashMap<>();

    public <T> DefaultContainer bindConstant(Class<T> type, T instance) {
        if (!type.isInstance(instance)) {
            throw new IllegalArgumentException(instance + " is not a " + type.getName());
        }
        return register(type, () -> instance);
    }

    public <T> DefaultContainer bindTransient(Class<T> type, Supplier<? extends T> factory) {
        return register(type, factory);
    }

    public <T> DefaultContainer bindSingleton(Class<T> type, Supplier<? extends T> factory) {
        return register(type, new Memoized<>(factory));
    }

    public boolean isBound(Class<?> type) {
        return bindings.containsKey(type);
    }

    private DefaultContainer register(Class<?> type, Supplier<?> supplier) {
        if (bindings.putIfAbsent(type, supplier) != null) {
            throw new ResolutionException("Type " + type.getName() + " is already bound");
        }
        log.debug("Bound {}", type.getName());
        return this;
    }

    @Override
    public <T> T resolve(Class<T> type) {
        Supplier<?> supplier = bindings.get(type);
        if (supplier == null) {
            return instantiate(type);
        }
        Object instance;
        try {
            instance = supplier.get();
        } catch (RuntimeException e) {
            throw new ResolutionException("Factory for " + type.getName() + " failed", e);
        }
        if (instance == null) {
            throw new ResolutionException("Binding for " + type.getName() + " produced null");
        }
        return type.cast(instance);
    }

    private <T> T instantiate(Class<T> type) {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new ResolutionException("No binding for " + type.getName());
        }
        try {
            Constructor<T> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new ResolutionException("No binding for " + type.getName() + " and no no-arg constructor", e);
        } catch (InvocationTargetException e) {
            throw new ResolutionException("Constructor of " + type.getName() + " failed", e.getCause());
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new ResolutionException("Cannot instantiate " + type.getName(), e);
        }
    }

    private static final class Memoized<T> implements Supplier<T> {

        private final Supplier<? extends T> factory;
        private volatile T instance;

        private Memoized(Supplier<? extends T> factory) {
            this.factory = factory;
        }

        @Override
        public T get() {
            T result = instance;
            if (result == null) {
                synchronized (this) {
                    result = instance;
                    if (result == null) {
                        result = factory.get();
                        instance = result;
                    }
                }
            }
            return result;
        }
    }

}
