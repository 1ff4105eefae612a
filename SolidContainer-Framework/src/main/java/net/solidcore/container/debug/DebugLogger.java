package net.solidcore.container.debug;

import net.solidcore.container.annotation.util.EnableDebug;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Debug logger for container internals.
 * Output is off unless a class is enabled through {@link #enableDebugFor(Class[])}, through
 * {@link EnableDebug}, or globally with the {@code container.debug.all} system property.
 */
public class DebugLogger {

    private static final Set<String> enabledClasses = ConcurrentHashMap.newKeySet();

    /**
     * Enable debug logging for one or more classes.
     */
    public static void enableDebugFor(Class<?>... classes) {
        for (Class<?> clazz : classes) {
            enabledClasses.add(clazz.getName());
        }
    }

    /**
     * Enable debug logging for the class when it carries {@link EnableDebug}.
     *
     * @return true if the annotation was present
     */
    public static boolean enableIfAnnotated(Class<?> clazz) {
        if (clazz.isAnnotationPresent(EnableDebug.class)) {
            enabledClasses.add(clazz.getName());
            return true;
        }
        return false;
    }

    /**
     * Check if debug logging is enabled for a class.
     */
    public static boolean isEnabled(Class<?> clazz) {
        return Boolean.getBoolean("container.debug.all") || enabledClasses.contains(clazz.getName());
    }

    /**
     * Log a formatted debug message for a specific class.
     *
     * @param clazz the class to log for
     * @param format the format string
     * @param args the arguments
     */
    public static void log(Class<?> clazz, String format, Object... args) {
        if (isEnabled(clazz)) {
            String message = args.length == 0 ? format : String.format(format, args);
            System.out.println("[DEBUG:" + clazz.getSimpleName() + "] " + message);
        }
    }

    /**
     * Clear all enabled debug classes (for testing).
     */
    public static void clearAll() {
        enabledClasses.clear();
    }
}
