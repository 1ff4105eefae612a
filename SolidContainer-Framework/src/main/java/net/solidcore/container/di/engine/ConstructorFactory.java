package net.solidcore.container.di.engine;

import lombok.Getter;
import net.solidcore.container.debug.DebugLogger;
import net.solidcore.container.di.ServiceFactory;
import net.solidcore.container.di.ServiceResolver;
import net.solidcore.container.di.exception.ServiceInstantiationException;
import net.solidcore.container.di.exception.ServiceResolutionException;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/**
 * Builds instances by invoking the selected constructor of the implementation type with
 * every parameter resolved from the container.
 *
 * @param <T> the implementation type
 */
public class ConstructorFactory<T> implements ServiceFactory<T> {

    @Getter
    private final Class<T> implementationType;
    private volatile Constructor<?> constructor;

    public ConstructorFactory(@NotNull Class<T> implementationType) {
        this.implementationType = implementationType;
    }

    @Override
    public @NotNull T create(@NotNull ServiceResolver resolver) {
        Constructor<?> selected = getConstructor();
        Class<?>[] parameterTypes = selected.getParameterTypes();
        Object[] parameters = new Object[parameterTypes.length];
        for (int i = 0; i < parameterTypes.length; i++) {
            parameters[i] = resolver.getService(parameterTypes[i]);
        }

        try {
            return implementationType.cast(selected.newInstance(parameters));
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof ServiceResolutionException resolutionException) {
                throw resolutionException;
            }
            throw new ServiceInstantiationException("Constructor of " + implementationType.getName() + " threw an exception", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new ServiceInstantiationException("Unable to create new instance of class: " + implementationType.getName(), e);
        }
    }

    /**
     * The constructor this factory invokes, selected on first use.
     *
     * @throws net.solidcore.container.di.exception.NoPublicConstructorException if there is none
     */
    @NotNull
    public Constructor<?> getConstructor() {
        Constructor<?> selected = constructor;
        if (selected == null) {
            selected = ConstructorSelector.select(implementationType);
            // Public constructors of non-public classes are not accessible from this package
            selected.setAccessible(true);
            constructor = selected;
            DebugLogger.log(ConstructorFactory.class, "Selected constructor %s(%s)",
                    implementationType.getSimpleName(), ConstructorSelector.signature(selected));
        }
        return selected;
    }
}
