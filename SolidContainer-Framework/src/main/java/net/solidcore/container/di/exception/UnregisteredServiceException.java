package net.solidcore.container.di.exception;

import lombok.Getter;

/**
 * Thrown when a requested type, or one of its transitive dependencies, has no binding.
 */
@Getter
public class UnregisteredServiceException extends ServiceResolutionException {

    private final Class<?> serviceType;

    public UnregisteredServiceException(Class<?> serviceType) {
        super("Service " + serviceType.getName() + " is not registered");
        this.serviceType = serviceType;
    }
}
