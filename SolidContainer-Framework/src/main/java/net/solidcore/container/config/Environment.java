package net.solidcore.container.config;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import java.util.function.UnaryOperator;

/**
 * Reads container properties with support for:
 * - Environment variables (highest priority)
 * - System properties
 * - application.properties file (lowest priority)
 *
 * Supports {@code ${key:default}} property expressions.
 */
public class Environment {

    public static final String PROPERTIES_FILE = "application.properties";

    private final Properties applicationProperties;
    private final UnaryOperator<String> environmentVariables;

    public Environment(@NotNull Properties applicationProperties, @NotNull UnaryOperator<String> environmentVariables) {
        this.applicationProperties = applicationProperties;
        this.environmentVariables = environmentVariables;
    }

    /**
     * Create an Environment backed by the process environment and the application.properties file.
     *
     * <p>Looks for application.properties in the following order:
     * <ol>
     *   <li>Current working directory (where the application is run from)</li>
     *   <li>Classpath resource</li>
     * </ol>
     * A missing file is not an error, properties can come from the environment or system properties.
     *
     * @throws UncheckedIOException if a properties file exists but cannot be read
     */
    public static Environment load() {
        return new Environment(loadApplicationProperties(), System::getenv);
    }

    private static Properties loadApplicationProperties() {
        Properties properties = new Properties();
        File propertiesFile = new File(System.getProperty("user.dir"), PROPERTIES_FILE);
        try {
            if (propertiesFile.isFile()) {
                try (FileInputStream fileInputStream = new FileInputStream(propertiesFile)) {
                    properties.load(fileInputStream);
                }
                return properties;
            }
            try (InputStream inputStream = Environment.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
                if (inputStream != null) {
                    properties.load(inputStream);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + PROPERTIES_FILE, e);
        }
        return properties;
    }

    /**
     * Get a property value with resolution priority:
     * 1. Environment variables (converted from dot notation to UPPER_SNAKE_CASE)
     * 2. System properties
     * 3. application.properties file
     *
     * @param key The property key (supports dot notation, e.g., "container.debug")
     * @return The property value, or null if not found
     */
    @Nullable
    public String getProperty(String key) {
        if (key == null || key.isEmpty()) {
            return null;
        }

        String value = environmentVariables.apply(convertToEnvKey(key));
        if (value != null) {
            return value;
        }

        value = System.getProperty(key);
        if (value != null) {
            return value;
        }

        return applicationProperties.getProperty(key);
    }

    /**
     * Get a property value with a default value if not found.
     */
    public String getProperty(String key, String defaultValue) {
        String value = getProperty(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Get a property value as a boolean.
     *
     * @param key The property key
     * @param defaultValue The default value if property is not found
     * @return The boolean value
     */
    public boolean getPropertyAsBoolean(String key, boolean defaultValue) {
        String value = getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Resolve a property expression that may contain a default value.
     * Syntax: ${property.key:defaultValue}
     *
     * @param expression The property expression (e.g., "${container.scan.packages:com.example}")
     * @return The resolved value
     * @throws IllegalArgumentException if the key is missing and the expression has no default
     */
    public String resolveProperty(String expression) {
        if (expression == null || !expression.startsWith("${") || !expression.endsWith("}")) {
            return expression;
        }

        String content = expression.substring(2, expression.length() - 1);
        // First colon separates the default, so defaults may contain colons
        int colonIndex = content.indexOf(':');
        if (colonIndex >= 0) {
            return getProperty(content.substring(0, colonIndex).trim(), content.substring(colonIndex + 1).trim());
        }
        String key = content.trim();
        String value = getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Property '" + key + "' not found and no default value provided");
        }
        return value;
    }

    /**
     * Example: "container.scan.packages" -> "CONTAINER_SCAN_PACKAGES"
     */
    private String convertToEnvKey(String key) {
        return key.toUpperCase().replace('.', '_').replace('-', '_');
    }
}
