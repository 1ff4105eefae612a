package net.solidcore.container.di.lifecycle;

import net.solidcore.container.annotation.lifecycle.PostConstruct;
import net.solidcore.container.di.exception.ServiceInstantiationException;
import net.solidcore.container.di.exception.ServiceResolutionException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Invokes {@link PostConstruct} methods on instances the container has just created.
 */
public class LifecycleManager {

    private final Map<Class<?>, List<Method>> postConstructMethods = new ConcurrentHashMap<>();

    /**
     * Invokes all methods annotated with @PostConstruct declared on the instance's class,
     * in method name order.
     *
     * @param instance The instance to process
     */
    public void invokePostConstruct(Object instance) {
        Class<?> clazz = instance.getClass();
        for (Method method : postConstructMethods.computeIfAbsent(clazz, LifecycleManager::findPostConstructMethods)) {
            try {
                method.invoke(instance);
            } catch (InvocationTargetException e) {
                throw new ServiceInstantiationException("Error invoking @PostConstruct method " + method.getName()
                        + " on " + clazz.getName(), e.getCause());
            } catch (IllegalAccessException e) {
                throw new ServiceInstantiationException("Unable to access @PostConstruct method " + method.getName()
                        + " on " + clazz.getName(), e);
            }
        }
    }

    private static List<Method> findPostConstructMethods(Class<?> clazz) {
        List<Method> methods = new ArrayList<>();
        for (Method method : clazz.getDeclaredMethods()) {
            if (!method.isAnnotationPresent(PostConstruct.class)) {
                continue;
            }
            if (method.getParameterCount() != 0 || !method.getReturnType().equals(void.class)) {
                throw new ServiceResolutionException("@PostConstruct method " + method.getName() + " in class "
                        + clazz.getName() + " must have no parameters and return void");
            }
            method.setAccessible(true);
            methods.add(method);
        }
        methods.sort(Comparator.comparing(Method::getName));
        return methods;
    }
}
