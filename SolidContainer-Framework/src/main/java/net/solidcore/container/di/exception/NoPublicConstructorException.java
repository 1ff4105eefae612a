package net.solidcore.container.di.exception;

import lombok.Getter;

/**
 * Thrown when an implementation type exposes no public constructor to build it with.
 */
@Getter
public class NoPublicConstructorException extends ServiceResolutionException {

    private final Class<?> implementationType;

    public NoPublicConstructorException(Class<?> implementationType) {
        super("No public constructor found for " + implementationType.getName());
        this.implementationType = implementationType;
    }
}
