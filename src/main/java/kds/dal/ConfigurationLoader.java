package kds.dal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.Properties;

/**
 * Resolves configuration keys with priority:
 * 1. System Properties
 * 2. Environment Variables (dots to underscores, uppercase)
 * 3. External application.properties (from -Dconfig.dir / CONFIG_DIR, or ./config next to the working directory)
 * 4. Classpath config/application.properties (embedded in JAR)
 *
 * <p>An absolute path passed to the constructor replaces steps 3 and 4, which is handy in tests.</p>
 *
 * @since 03/10/2026
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_FILE = "config/application.properties";
    private static final String PROPERTIES_NAME = "application.properties";

    private final String configFile;
    private final Properties properties;

    public ConfigurationLoader() {
        this(DEFAULT_CONFIG_FILE);
    }

    public ConfigurationLoader(String configFile) {
        this.configFile = configFile;
        this.properties = loadProperties(configFile);
    }

    private Properties loadProperties(String configFile) {
        Path explicitPath = Paths.get(configFile);
        if (explicitPath.isAbsolute()) {
            Properties props = readFile(explicitPath);
            if (!props.isEmpty()) {
                logger.info("Loaded configuration from absolute path: {}", explicitPath);
                return props;
            }
        }

        Properties props = new Properties();
        Properties external = readFile(externalConfigPath());
        props.putAll(external);

        Properties defaults = readClasspath(configFile);
        for (String key : defaults.stringPropertyNames()) {
            props.putIfAbsent(key, defaults.getProperty(key));
        }

        if (props.isEmpty()) {
            logger.warn("No configuration file found, using built-in defaults only");
        } else if (external.isEmpty()) {
            logger.info("Loaded configuration from classpath '{}'", configFile);
        } else {
            logger.info("Loaded external configuration, classpath '{}' used for defaults", configFile);
        }
        return props;
    }

    private Path externalConfigPath() {
        String configDir = System.getProperty("config.dir");
        if (configDir == null) {
            configDir = System.getenv("CONFIG_DIR");
        }
        if (configDir != null) {
            return Paths.get(configDir, PROPERTIES_NAME).normalize();
        }
        return Paths.get(System.getProperty("user.dir"), "config", PROPERTIES_NAME).normalize();
    }

    private Properties readFile(Path path) {
        Properties props = new Properties();
        if (!Files.isRegularFile(path)) {
            logger.trace("Configuration file not found at: {}", path.toAbsolutePath());
            return props;
        }
        try (InputStream input = Files.newInputStream(path)) {
            props.load(input);
            logger.debug("Read configuration file {}", path.toAbsolutePath());
        } catch (IOException e) {
            logger.warn("Failed to load configuration from '{}': {}", path, e.getMessage());
        }
        return props;
    }

    private Properties readClasspath(String location) {
        Properties props = new Properties();
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(location)) {
            if (input != null) {
                props.load(input);
            }
        } catch (IOException e) {
            logger.debug("Error loading configuration from classpath '{}': {}", location, e.getMessage());
        }
        return props;
    }

    private Optional<String> resolve(String key) {
        String value = System.getProperty(key);
        if (value != null) {
            logger.debug("Property '{}' from System Properties: {}", key, value);
            return Optional.of(value);
        }

        String envKey = key.replace('.', '_').toUpperCase();
        value = System.getenv(envKey);
        if (value != null) {
            logger.debug("Property '{}' from Environment Variable '{}'", key, envKey);
            return Optional.of(value);
        }

        return Optional.ofNullable(properties.getProperty(key));
    }

    /**
     * Get string property with priority: System Property > Env Var > Properties File > Default
     */
    public String getString(String key, String defaultValue) {
        return resolve(key).orElse(defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        Optional<String> value = resolve(key);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.get().trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for property '{}': '{}', using default: {}", key, value.get(), defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        Optional<String> value = resolve(key);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.get().trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for property '{}': '{}', using default: {}", key, value.get(), defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return resolve(key).map(v -> Boolean.parseBoolean(v.trim())).orElse(defaultValue);
    }

    /**
     * Get required string property (throws exception if missing or blank)
     */
    public String getRequiredString(String key) throws ConfigurationException {
        String value = getString(key, null);
        if (value == null || value.trim().isEmpty()) {
            throw new ConfigurationException("Required property '" + key + "' is not configured");
        }
        return value;
    }

    public void reload() {
        Properties fresh = loadProperties(configFile);
        properties.clear();
        properties.putAll(fresh);
        logger.info("Configuration reloaded");
    }
}
