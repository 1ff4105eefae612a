package net.solidcore.container.di;

import net.solidcore.container.debug.DebugLogger;
import net.solidcore.container.di.engine.DependencyGraphResolver;
import net.solidcore.container.di.engine.ResolutionContext;
import net.solidcore.container.di.exception.ServiceInstantiationException;
import net.solidcore.container.di.exception.ServiceResolutionException;
import net.solidcore.container.di.exception.UnregisteredServiceException;
import net.solidcore.container.di.lifecycle.LifecycleManager;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of service bindings that builds object graphs on demand.
 *
 * <p>Bindings are registered at the composition root, then {@link #getService(Class)} resolves
 * the requested type by invoking the greatest-arity public constructor of its implementation,
 * resolving every constructor parameter from the same container. Singletons are created on first
 * resolution and reused; transients are created on every resolution.
 *
 * <p>Registration and resolution may be called from several threads. Two threads resolving the same
 * unresolved singleton at once may each construct an instance; only the first one stored survives
 * and both callers receive it. A resolution racing a re-registration may observe either binding.
 */
public class ServiceContainer implements ServiceResolver, ResolutionContext.ContextualResolver {

    private final Map<Class<?>, ServiceRegistration> registrations = new ConcurrentHashMap<>();
    private final LifecycleManager lifecycleManager = new LifecycleManager();
    private final DependencyGraphResolver graphResolver = new DependencyGraphResolver(this);

    /**
     * Bind a service type to an implementation created anew on every resolution.
     * Replaces any earlier binding of the service type.
     */
    public <S> void registerTransient(@NotNull Class<S> serviceType, @NotNull Class<? extends S> implementationType) {
        registerType(serviceType, implementationType, Lifetime.TRANSIENT);
    }

    /**
     * Bind a service type to an implementation created once, on first resolution.
     * Replaces any earlier binding of the service type.
     */
    public <S> void registerSingleton(@NotNull Class<S> serviceType, @NotNull Class<? extends S> implementationType) {
        registerType(serviceType, implementationType, Lifetime.SINGLETON);
    }

    /**
     * Bind a service type to an already constructed instance, returned as-is on every resolution.
     */
    public <S> void registerSingletonInstance(@NotNull Class<S> serviceType, @NotNull S instance) {
        Objects.requireNonNull(serviceType, "serviceType");
        Objects.requireNonNull(instance, "instance");
        register(ServiceRegistration.forInstance(serviceType, instance));
    }

    public <S> void registerTransient(@NotNull Class<S> serviceType, @NotNull ServiceFactory<? extends S> factory) {
        registerFactory(serviceType, factory, Lifetime.TRANSIENT);
    }

    public <S> void registerSingleton(@NotNull Class<S> serviceType, @NotNull ServiceFactory<? extends S> factory) {
        registerFactory(serviceType, factory, Lifetime.SINGLETON);
    }

    /**
     * Register a concrete type under itself.
     */
    public <S> void registerSelf(@NotNull Class<S> implementationType, @NotNull Lifetime lifetime) {
        registerType(implementationType, implementationType, lifetime);
    }

    /**
     * Untyped form of the type registrations, for callers holding {@code Class<?>} references.
     *
     * @throws IllegalArgumentException if the implementation does not implement or extend the service type
     */
    public void registerType(@NotNull Class<?> serviceType, @NotNull Class<?> implementationType, @NotNull Lifetime lifetime) {
        Objects.requireNonNull(serviceType, "serviceType");
        Objects.requireNonNull(implementationType, "implementationType");
        Objects.requireNonNull(lifetime, "lifetime");
        if (!serviceType.isAssignableFrom(implementationType)) {
            throw new IllegalArgumentException(implementationType.getName() + " is not assignable to " + serviceType.getName());
        }
        DebugLogger.enableIfAnnotated(implementationType);
        register(ServiceRegistration.forType(serviceType, implementationType, lifetime));
    }

    /**
     * Bind several service types to one singleton implementation. All of them resolve to the same instance.
     *
     * @throws IllegalArgumentException if no service type is given, or the implementation does not implement one of them
     */
    public void registerSharedSingleton(@NotNull Class<?> implementationType, @NotNull Class<?>... serviceTypes) {
        Objects.requireNonNull(implementationType, "implementationType");
        if (serviceTypes.length == 0) {
            throw new IllegalArgumentException("No service types given for " + implementationType.getName());
        }
        for (Class<?> serviceType : serviceTypes) {
            if (!serviceType.isAssignableFrom(implementationType)) {
                throw new IllegalArgumentException(implementationType.getName() + " is not assignable to " + serviceType.getName());
            }
        }
        DebugLogger.enableIfAnnotated(implementationType);
        ServiceRegistration shared = ServiceRegistration.forType(serviceTypes[0], implementationType, Lifetime.SINGLETON);
        register(shared);
        for (int i = 1; i < serviceTypes.length; i++) {
            register(shared.sharedWith(serviceTypes[i]));
        }
    }

    private void registerFactory(Class<?> serviceType, ServiceFactory<?> factory, Lifetime lifetime) {
        Objects.requireNonNull(serviceType, "serviceType");
        Objects.requireNonNull(factory, "factory");
        register(ServiceRegistration.forFactory(serviceType, factory, lifetime));
    }

    private void register(ServiceRegistration registration) {
        ServiceRegistration previous = registrations.put(registration.getServiceType(), registration);
        if (previous != null) {
            DebugLogger.log(ServiceContainer.class, "Replaced %s with %s", previous, registration);
        } else {
            DebugLogger.log(ServiceContainer.class, "Registered %s", registration);
        }
    }

    @Override
    public <T> @NotNull T getService(@NotNull Class<T> serviceType) {
        return resolve(serviceType, new ResolutionContext(this));
    }

    @Override
    public <T> @Nullable T getServiceOrNull(@NotNull Class<T> serviceType) {
        if (!registrations.containsKey(serviceType)) {
            return null;
        }
        return getService(serviceType);
    }

    @Override
    public boolean isRegistered(@NotNull Class<?> serviceType) {
        return registrations.containsKey(serviceType);
    }

    @Override
    public <T> @NotNull T resolve(@NotNull Class<T> serviceType, @NotNull ResolutionContext context) {
        ServiceRegistration registration = registrations.get(serviceType);
        if (registration == null) {
            throw new UnregisteredServiceException(serviceType);
        }

        Object existing = registration.getInstance();
        if (existing != null) {
            return serviceType.cast(existing);
        }

        context.enter(serviceType);
        try {
            T created = serviceType.cast(create(registration, context));
            if (registration.getLifetime() == Lifetime.SINGLETON) {
                Object survivor = registration.publish(created);
                if (survivor != created) {
                    DebugLogger.log(ServiceContainer.class, "Discarded concurrently created singleton %s", registration);
                } else {
                    DebugLogger.log(ServiceContainer.class, "Materialized singleton %s", registration);
                }
                return serviceType.cast(survivor);
            }
            return created;
        } finally {
            context.exit(serviceType);
        }
    }

    private Object create(ServiceRegistration registration, ResolutionContext context) {
        ServiceFactory<?> factory = Objects.requireNonNull(registration.getFactory(), "factory");
        Object instance;
        try {
            instance = factory.create(context);
        } catch (ServiceResolutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ServiceInstantiationException("Factory for " + registration.getServiceType().getName() + " threw an exception", e);
        }
        if (instance == null) {
            throw new ServiceInstantiationException("Factory for " + registration.getServiceType().getName() + " returned null", null);
        }
        lifecycleManager.invokePostConstruct(instance);
        return instance;
    }

    /**
     * @return the binding of the type, or null if it has none
     */
    @Nullable
    public ServiceRegistration getRegistration(@NotNull Class<?> serviceType) {
        return registrations.get(serviceType);
    }

    /**
     * @return a snapshot of all bindings
     */
    @NotNull
    public Map<Class<?>, ServiceRegistration> getRegistrations() {
        return Map.copyOf(registrations);
    }

    /**
     * Check every binding for missing dependencies, missing constructors and cycles.
     *
     * @throws net.solidcore.container.di.exception.ContainerValidationException listing every problem found
     */
    public void validate() {
        graphResolver.createLoadingOrder();
    }

    /**
     * @return the registered service types, dependencies before their consumers
     * @throws net.solidcore.container.di.exception.ContainerValidationException if the bindings are not valid
     */
    @NotNull
    public List<Class<?>> createLoadingOrder() {
        return graphResolver.createLoadingOrder();
    }

    /**
     * Validate the bindings, then create every singleton in loading order.
     */
    public void initializeSingletons() {
        for (Class<?> serviceType : graphResolver.createLoadingOrder()) {
            ServiceRegistration registration = registrations.get(serviceType);
            if (registration != null && registration.getLifetime() == Lifetime.SINGLETON) {
                getService(serviceType);
            }
        }
    }
}
