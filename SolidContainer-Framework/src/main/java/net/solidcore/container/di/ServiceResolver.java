package net.solidcore.container.di;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public interface ServiceResolver {

    /**
     * Get a service from the resolver
     * @param serviceType The type the service was registered under
     * @return The fully wired service instance, never null
     * @param <T> The type of the service
     * @throws net.solidcore.container.di.exception.UnregisteredServiceException if the service
     *         or one of its transitive dependencies is not registered
     */
    @NotNull <T> T getService(@NotNull Class<T> serviceType);

    /**
     * Get a service from the resolver
     * @param serviceType The type the service was registered under
     * @return The service instance or null if the type itself is not registered
     * @param <T> The type of the service
     */
    @Nullable <T> T getServiceOrNull(@NotNull Class<T> serviceType);

    /**
     * Check whether a binding exists for the type
     * @param serviceType The type to check
     * @return true if the type is registered
     */
    boolean isRegistered(@NotNull Class<?> serviceType);
}
