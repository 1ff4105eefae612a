package net.solidcore.container.config;

import lombok.Getter;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Container options read from an {@link Environment}.
 */
@Getter
public class ContainerSettings {

    public static final String DEBUG = "container.debug";
    public static final String SCAN_PACKAGES = "container.scan.packages";
    public static final String EAGER_SINGLETONS = "container.eager-singletons";

    private final boolean debug;
    private final List<String> scanPackages;
    private final boolean eagerSingletons;

    public ContainerSettings(boolean debug, @NotNull List<String> scanPackages, boolean eagerSingletons) {
        this.debug = debug;
        this.scanPackages = List.copyOf(scanPackages);
        this.eagerSingletons = eagerSingletons;
    }

    public static ContainerSettings defaults() {
        return new ContainerSettings(false, List.of(), false);
    }

    public static ContainerSettings from(@NotNull Environment environment) {
        String packages = environment.getProperty(SCAN_PACKAGES, "");
        List<String> scanPackages = Arrays.stream(packages.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        return new ContainerSettings(
                environment.getPropertyAsBoolean(DEBUG, false),
                scanPackages,
                environment.getPropertyAsBoolean(EAGER_SINGLETONS, false));
    }
}
