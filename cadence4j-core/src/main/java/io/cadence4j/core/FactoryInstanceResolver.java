package io.cadence4j.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link InstanceResolver} backed by factories registered per type.
 *
 * <p>Instances that implement {@link AutoCloseable} are closed when their scope closes,
 * most recently created first.
 */
public class FactoryInstanceResolver implements InstanceResolver {

    private final Map<Class<?>, Function<Object[], ?>> factoriesByType = new ConcurrentHashMap<>();

    public <T> FactoryInstanceResolver register(Class<T> type, Supplier<? extends T> factory) {
        Objects.requireNonNull(factory, "factory must not be null");
        return registerWithParams(type, parameters -> factory.get());
    }

    /**
     * Register a factory receiving the constructor parameters bound with
     * {@code scheduleWithParams(...)} (an empty array otherwise).
     */
    public <T> FactoryInstanceResolver registerWithParams(Class<T> type, Function<Object[], ? extends T> factory) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        Function<Object[], ?> previous = factoriesByType.putIfAbsent(type, factory);
        if (previous != null) {
            throw new IllegalStateException("Duplicate factory for type: " + type.getName());
        }
        return this;
    }

    public boolean isRegistered(Class<?> type) {
        return factoriesByType.containsKey(type);
    }

    @Override
    public ResolutionScope createScope() {
        return new Scope();
    }

    private final class Scope implements ResolutionScope {

        private final Deque<AutoCloseable> closeables = new ArrayDeque<>();

        @Override
        public <T> T resolve(Class<T> type, Object[] parameters) {
            Objects.requireNonNull(type, "type must not be null");
            Function<Object[], ?> factory = factoriesByType.get(type);
            if (factory == null) {
                throw new InstanceResolutionException("No factory registered for type: " + type.getName());
            }

            Object instance;
            try {
                instance = factory.apply(parameters == null ? new Object[0] : parameters);
            } catch (RuntimeException ex) {
                throw new InstanceResolutionException("Factory failed for type: " + type.getName(), ex);
            }
            if (instance == null) {
                throw new InstanceResolutionException("Factory returned null for type: " + type.getName());
            }
            if (instance instanceof AutoCloseable closeable) {
                closeables.push(closeable);
            }
            return type.cast(instance);
        }

        @Override
        public void close() {
            InstanceResolutionException failure = null;
            while (!closeables.isEmpty()) {
                AutoCloseable closeable = closeables.pop();
                try {
                    closeable.close();
                } catch (Exception ex) {
                    if (failure == null) {
                        failure = new InstanceResolutionException("Failed to release resolved instance", ex);
                    } else {
                        failure.addSuppressed(ex);
                    }
                }
            }
            if (failure != null) {
                throw failure;
            }
        }
    }
}
