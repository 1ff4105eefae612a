package net.solidcore.container.di;

import org.jetbrains.annotations.NotNull;

/**
 * Produces instances for a registration.
 * The resolver passed in is bound to the current resolution, so dependencies fetched
 * through it take part in cycle detection.
 *
 * @param <T> the produced type
 */
@FunctionalInterface
public interface ServiceFactory<T> {

    @NotNull
    T create(@NotNull ServiceResolver resolver);
}
