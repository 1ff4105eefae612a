package net.solidcore.container.di.engine;

import net.solidcore.container.annotation.Inject;
import net.solidcore.container.di.exception.NoPublicConstructorException;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.Collectors;

/**
 * Picks the constructor the container invokes for an implementation type.
 *
 * <p>The public constructor with the most parameters wins. Ties are broken by preferring a
 * constructor annotated with {@link Inject}, then by comparing the fully qualified parameter
 * type names in declaration order, so the choice never depends on reflection enumeration order.
 */
public final class ConstructorSelector {

    private static final Comparator<Constructor<?>> PREFERENCE = Comparator
            .comparingInt((Constructor<?> constructor) -> constructor.getParameterCount()).reversed()
            .thenComparing(constructor -> !constructor.isAnnotationPresent(Inject.class))
            .thenComparing(ConstructorSelector::signature);

    private ConstructorSelector() {
    }

    /**
     * @throws NoPublicConstructorException if the type is abstract, an interface, or has no public constructor
     */
    @NotNull
    public static Constructor<?> select(@NotNull Class<?> implementationType) {
        if (implementationType.isInterface() || Modifier.isAbstract(implementationType.getModifiers())) {
            throw new NoPublicConstructorException(implementationType);
        }
        return Arrays.stream(implementationType.getConstructors())
                .min(PREFERENCE)
                .orElseThrow(() -> new NoPublicConstructorException(implementationType));
    }

    static String signature(Constructor<?> constructor) {
        return Arrays.stream(constructor.getParameterTypes())
                .map(Class::getName)
                .collect(Collectors.joining(","));
    }
}
