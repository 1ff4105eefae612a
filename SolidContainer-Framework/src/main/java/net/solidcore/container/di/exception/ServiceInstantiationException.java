package net.solidcore.container.di.exception;

/**
 * Wraps an exception thrown by a constructor, a factory or a {@code @PostConstruct} method.
 */
public class ServiceInstantiationException extends ServiceResolutionException {

    public ServiceInstantiationException(String message, Throwable cause) {
        super(message, cause);
    }
}
