package net.solidcore.container.di.exception;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a type is requested again while it is still being constructed.
 */
@Getter
public class CircularDependencyException extends ServiceResolutionException {

    /**
     * The types on the cycle, starting and ending with the re-entered type.
     */
    private final List<Class<?>> cycle;

    public CircularDependencyException(List<Class<?>> cycle) {
        super("Circular dependency detected: " + describe(cycle));
        this.cycle = List.copyOf(cycle);
    }

    public static String describe(List<Class<?>> cycle) {
        return cycle.stream().map(Class::getSimpleName).collect(Collectors.joining(" -> "));
    }
}
