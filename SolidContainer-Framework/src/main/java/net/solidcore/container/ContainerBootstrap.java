package net.solidcore.container;

import net.solidcore.container.config.ContainerSettings;
import net.solidcore.container.config.Environment;
import net.solidcore.container.debug.DebugLogger;
import net.solidcore.container.di.ServiceContainer;
import net.solidcore.container.di.ServiceResolver;
import net.solidcore.container.di.engine.ConstructorFactory;
import net.solidcore.container.di.engine.DependencyGraphResolver;
import net.solidcore.container.di.scan.ClasspathScanner;
import org.jetbrains.annotations.NotNull;

/**
 * Composition root helper. Creates a container configured from {@link ContainerSettings}.
 *
 * <p>Usage example:
 * <pre>
 * {@code
 * ServiceContainer container = ContainerBootstrap.start();
 * container.registerSingleton(Clock.class, SystemClock.class);
 * ReportService reports = container.getService(ReportService.class);
 * }
 * </pre>
 */
public class ContainerBootstrap {

    /**
     * Start a container configured from environment variables, system properties and application.properties.
     */
    public static ServiceContainer start() {
        return start(ContainerSettings.from(Environment.load()));
    }

    /**
     * Start a container with the given settings.
     * The container is registered under {@link ServiceResolver} and {@link ServiceContainer} so
     * services may depend on it. Configured packages are scanned for {@code @Service} classes, and
     * with eager singletons enabled the bindings are validated and every singleton is created.
     *
     * @param settings The container settings
     * @return The started container
     */
    public static ServiceContainer start(@NotNull ContainerSettings settings) {
        if (settings.isDebug()) {
            DebugLogger.enableDebugFor(ContainerBootstrap.class, ServiceContainer.class, ConstructorFactory.class,
                    DependencyGraphResolver.class, ClasspathScanner.class);
        }

        ServiceContainer container = new ServiceContainer();
        container.registerSingletonInstance(ServiceResolver.class, container);
        container.registerSingletonInstance(ServiceContainer.class, container);

        if (!settings.getScanPackages().isEmpty()) {
            ClasspathScanner scanner = new ClasspathScanner(settings.getScanPackages().toArray(new String[0]));
            int registered = scanner.registerServices(container);
            DebugLogger.log(ContainerBootstrap.class, "Scanned %s, registered %d service class(es)",
                    settings.getScanPackages(), registered);
        }

        if (settings.isEagerSingletons()) {
            container.initializeSingletons();
        }
        return container;
    }
}
