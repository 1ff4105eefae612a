package net.solidcore.container.di.engine;

import net.solidcore.container.di.ServiceResolver;
import net.solidcore.container.di.exception.CircularDependencyException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Tracks the types under construction during one top-level resolution.
 * Factories receive this context as their resolver, so every nested lookup, reflective or
 * not, passes through {@link #enter(Class)}. Not thread-safe: one context per calling thread.
 */
public class ResolutionContext implements ServiceResolver {

    private final ContextualResolver container;
    private final Set<Class<?>> resolving = new LinkedHashSet<>();

    public ResolutionContext(@NotNull ContextualResolver container) {
        this.container = container;
    }

    /**
     * Mark a type as being constructed.
     *
     * @throws CircularDependencyException if the type is already being constructed
     */
    public void enter(@NotNull Class<?> serviceType) {
        if (resolving.contains(serviceType)) {
            List<Class<?>> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (Class<?> type : resolving) {
                if (type.equals(serviceType)) {
                    inCycle = true;
                }
                if (inCycle) {
                    cycle.add(type);
                }
            }
            cycle.add(serviceType);
            throw new CircularDependencyException(cycle);
        }
        resolving.add(serviceType);
    }

    public void exit(@NotNull Class<?> serviceType) {
        resolving.remove(serviceType);
    }

    public int depth() {
        return resolving.size();
    }

    @Override
    public <T> @NotNull T getService(@NotNull Class<T> serviceType) {
        return container.resolve(serviceType, this);
    }

    @Override
    public <T> @Nullable T getServiceOrNull(@NotNull Class<T> serviceType) {
        return container.isRegistered(serviceType) ? container.resolve(serviceType, this) : null;
    }

    @Override
    public boolean isRegistered(@NotNull Class<?> serviceType) {
        return container.isRegistered(serviceType);
    }

    /**
     * A resolver that can continue a resolution already in progress.
     */
    public interface ContextualResolver {

        @NotNull <T> T resolve(@NotNull Class<T> serviceType, @NotNull ResolutionContext context);

        boolean isRegistered(@NotNull Class<?> serviceType);
    }
}
