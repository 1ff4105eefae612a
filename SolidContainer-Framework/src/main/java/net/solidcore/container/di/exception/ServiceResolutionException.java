package net.solidcore.container.di.exception;

/**
 * Base class for every failure raised while resolving a service.
 */
public class ServiceResolutionException extends RuntimeException {

    public ServiceResolutionException(String message) {
        super(message);
    }

    public ServiceResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
