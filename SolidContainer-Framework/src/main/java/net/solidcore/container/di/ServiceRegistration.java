package net.solidcore.container.di;

import lombok.AccessLevel;
import lombok.Getter;
import net.solidcore.container.di.engine.ConstructorFactory;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One binding of a service type to the way its instances are produced.
 * Registrations are immutable apart from the singleton slot, which goes from empty to
 * populated at most once.
 */
@Getter
public class ServiceRegistration {

    private final Class<?> serviceType;
    private final Class<?> implementationType;
    private final Lifetime lifetime;

    /**
     * Null for registrations bound to a pre-built instance.
     */
    @Nullable
    private final ServiceFactory<?> factory;

    @Getter(AccessLevel.NONE)
    private final AtomicReference<Object> instance;

    private ServiceRegistration(Class<?> serviceType, Class<?> implementationType, Lifetime lifetime,
                                @Nullable ServiceFactory<?> factory, @Nullable Object instance) {
        this(serviceType, implementationType, lifetime, factory, new AtomicReference<>(instance));
    }

    private ServiceRegistration(Class<?> serviceType, Class<?> implementationType, Lifetime lifetime,
                                @Nullable ServiceFactory<?> factory, AtomicReference<Object> instance) {
        this.serviceType = serviceType;
        this.implementationType = implementationType;
        this.lifetime = lifetime;
        this.factory = factory;
        this.instance = instance;
    }

    public static ServiceRegistration forType(@NotNull Class<?> serviceType, @NotNull Class<?> implementationType,
                                              @NotNull Lifetime lifetime) {
        return new ServiceRegistration(serviceType, implementationType, lifetime,
                new ConstructorFactory<>(implementationType), null);
    }

    public static ServiceRegistration forFactory(@NotNull Class<?> serviceType, @NotNull ServiceFactory<?> factory,
                                                 @NotNull Lifetime lifetime) {
        return new ServiceRegistration(serviceType, serviceType, lifetime, factory, null);
    }

    public static ServiceRegistration forInstance(@NotNull Class<?> serviceType, @NotNull Object instance) {
        Objects.requireNonNull(instance, "instance");
        return new ServiceRegistration(serviceType, instance.getClass(), Lifetime.SINGLETON, null, instance);
    }

    /**
     * Bind another service type to this registration's implementation and singleton slot, so that
     * resolving either type yields the same instance.
     */
    public ServiceRegistration sharedWith(@NotNull Class<?> otherServiceType) {
        return new ServiceRegistration(otherServiceType, implementationType, lifetime, factory, instance);
    }

    /**
     * @return the materialized singleton, or null while unresolved (always null for transients)
     */
    @Nullable
    public Object getInstance() {
        return instance.get();
    }

    public boolean isResolved() {
        return instance.get() != null;
    }

    /**
     * Whether instances are built by reflectively invoking a constructor of the implementation type.
     */
    public boolean isConstructorBased() {
        return factory instanceof ConstructorFactory;
    }

    /**
     * Store a freshly created singleton unless another thread got there first.
     *
     * @return the instance every caller must use from now on
     */
    Object publish(@NotNull Object created) {
        if (instance.compareAndSet(null, created)) {
            return created;
        }
        return instance.get();
    }

    @Override
    public String toString() {
        return serviceType.getSimpleName() + " -> " + implementationType.getSimpleName() + " (" + lifetime + ")";
    }
}
