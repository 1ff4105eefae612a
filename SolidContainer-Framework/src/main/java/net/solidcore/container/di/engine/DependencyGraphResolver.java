package net.solidcore.container.di.engine;

import net.solidcore.container.debug.DebugLogger;
import net.solidcore.container.di.ServiceContainer;
import net.solidcore.container.di.ServiceRegistration;
import net.solidcore.container.di.exception.CircularDependencyException;
import net.solidcore.container.di.exception.ContainerValidationException;
import net.solidcore.container.di.exception.NoPublicConstructorException;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the dependency graph of a container's bindings and sorts it topologically.
 * Edges come from the constructor a binding would be built with; factory and instance bindings,
 * and singletons already created, have no edges.
 */
public class DependencyGraphResolver {

    private final ServiceContainer container;

    public DependencyGraphResolver(ServiceContainer container) {
        this.container = container;
    }

    /**
     * Creates a loading order for the registered service types based on their dependencies.
     *
     * @throws ContainerValidationException listing every missing binding, missing constructor and cycle
     */
    public LinkedList<Class<?>> createLoadingOrder() {
        List<String> problems = new ArrayList<>();
        Map<Class<?>, Set<Class<?>>> dependencyGraph = buildGraph(problems);
        LinkedList<Class<?>> sortedServices = performTopologicalSort(dependencyGraph, problems);

        if (!problems.isEmpty()) {
            DebugLogger.log(DependencyGraphResolver.class, "Validation found %d problem(s)", problems.size());
            throw new ContainerValidationException(problems);
        }
        DebugLogger.log(DependencyGraphResolver.class, "Loading order: %s", sortedServices);
        return sortedServices;
    }

    private Map<Class<?>, Set<Class<?>>> buildGraph(List<String> problems) {
        List<ServiceRegistration> registrations = new ArrayList<>(container.getRegistrations().values());
        // Sorted so the loading order and problem list are stable between runs
        registrations.sort(Comparator.comparing(registration -> registration.getServiceType().getName()));

        Map<Class<?>, Set<Class<?>>> dependencyGraph = new LinkedHashMap<>();
        for (ServiceRegistration registration : registrations) {
            Class<?> serviceType = registration.getServiceType();
            Set<Class<?>> dependencies = new LinkedHashSet<>();

            if (registration.isConstructorBased() && !registration.isResolved()) {
                try {
                    Constructor<?> constructor = ConstructorSelector.select(registration.getImplementationType());
                    for (Class<?> parameter : constructor.getParameterTypes()) {
                        if (container.isRegistered(parameter)) {
                            dependencies.add(parameter);
                        } else {
                            problems.add(serviceType.getName() + " -> " + parameter.getName() + " is not registered");
                        }
                    }
                } catch (NoPublicConstructorException e) {
                    problems.add(e.getMessage() + " (bound to " + serviceType.getName() + ")");
                }
            }

            dependencyGraph.put(serviceType, dependencies);
        }
        return dependencyGraph;
    }

    private LinkedList<Class<?>> performTopologicalSort(Map<Class<?>, Set<Class<?>>> dependencyGraph, List<String> problems) {
        LinkedList<Class<?>> sortedServices = new LinkedList<>();
        Set<Class<?>> visited = new HashSet<>();
        Set<Class<?>> visiting = new LinkedHashSet<>();

        for (Class<?> service : dependencyGraph.keySet()) {
            if (!visited.contains(service)) {
                visit(service, dependencyGraph, visited, visiting, sortedServices, problems);
            }
        }

        return sortedServices;
    }

    private void visit(Class<?> service,
                       Map<Class<?>, Set<Class<?>>> graph,
                       Set<Class<?>> visited,
                       Set<Class<?>> visiting,
                       LinkedList<Class<?>> sortedServices,
                       List<String> problems) {
        if (visiting.contains(service)) {
            List<Class<?>> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (Class<?> c : visiting) {
                if (c.equals(service)) {
                    inCycle = true;
                }
                if (inCycle) {
                    cycle.add(c);
                }
            }
            cycle.add(service);
            problems.add("Circular dependency: " + CircularDependencyException.describe(cycle));
            return;
        }

        if (!visited.contains(service)) {
            visiting.add(service);
            for (Class<?> dependency : graph.getOrDefault(service, Collections.emptySet())) {
                visit(dependency, graph, visited, visiting, sortedServices, problems);
            }
            visiting.remove(service);
            visited.add(service);
            sortedServices.addLast(service);
        }
    }
}
