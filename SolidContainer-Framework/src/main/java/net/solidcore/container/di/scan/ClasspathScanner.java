package net.solidcore.container.di.scan;

import lombok.Getter;
import net.solidcore.container.annotation.component.Service;
import net.solidcore.container.debug.DebugLogger;
import net.solidcore.container.di.Lifetime;
import net.solidcore.container.di.ServiceContainer;
import org.reflections.Configuration;
import org.reflections.Reflections;
import org.reflections.util.ConfigurationBuilder;

import java.lang.annotation.Annotation;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scans packages for classes annotated with {@link Service} and registers them in a container.
 */
@Getter
public class ClasspathScanner {

    /**
     * -- GETTER --
     *  Access the underlying Reflections instance if advanced scanning is needed.
     */
    private final Reflections reflections;

    public ClasspathScanner(String... packages) {
        this.reflections = new Reflections(createConfiguration(packages));
    }

    /**
     * Helper to create a Reflections configuration limited to the given packages.
     */
    public static Configuration createConfiguration(String... packages) {
        List<String> packagePaths = Arrays.stream(packages)
                .map(packageName -> packageName.replace('.', '/') + "/")
                .collect(Collectors.toList());

        return new ConfigurationBuilder()
                .forPackages(packages)
                .filterInputsBy(s -> {
                    if (s == null) return false;
                    if (s.startsWith("META-INF")) return false;
                    if (!s.endsWith(".class")) return false;

                    // Only include classes under one of the scanned package paths
                    for (String packagePath : packagePaths) {
                        if (s.startsWith(packagePath)) {
                            return true;
                        }
                    }
                    return false;
                });
    }

    /**
     * Find all types directly annotated with a specific annotation.
     * Subclasses of annotated types are not included unless they carry the annotation themselves.
     */
    public Set<Class<?>> getTypesAnnotatedWith(Class<? extends Annotation> annotation) {
        return reflections.getTypesAnnotatedWith(annotation).stream()
                .filter(type -> type.isAnnotationPresent(annotation))
                .collect(Collectors.toSet());
    }

    /**
     * Register every {@link Service} class found under the scanned packages.
     *
     * @return the number of classes registered
     * @throws IllegalArgumentException if an annotated class is abstract or does not implement a declared service type
     */
    public int registerServices(ServiceContainer container) {
        List<Class<?>> services = getTypesAnnotatedWith(Service.class).stream()
                .sorted(Comparator.comparing(Class::getName))
                .collect(Collectors.toList());

        for (Class<?> serviceClass : services) {
            if (serviceClass.isInterface() || Modifier.isAbstract(serviceClass.getModifiers())) {
                throw new IllegalArgumentException("Class: " + serviceClass.getName() + " annotated with @Service must be concrete");
            }
            Service service = serviceClass.getAnnotation(Service.class);
            Class<?>[] serviceTypes = service.value().length == 0 ? new Class<?>[]{serviceClass} : service.value();
            if (service.lifetime() == Lifetime.SINGLETON) {
                container.registerSharedSingleton(serviceClass, serviceTypes);
            } else {
                for (Class<?> serviceType : serviceTypes) {
                    container.registerType(serviceType, serviceClass, service.lifetime());
                }
            }
            DebugLogger.log(ClasspathScanner.class, "Registered %s as %s (%s)", serviceClass.getSimpleName(),
                    Arrays.stream(serviceTypes).map(Class::getSimpleName).collect(Collectors.joining(", ")), service.lifetime());
        }
        return services.size();
    }
}
