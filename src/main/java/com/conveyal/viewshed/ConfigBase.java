package com.conveyal.viewshed;

import com.google.common.io.Resources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.net.URL;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Shared functionality for classes that load properties containing configuration information and expose these options
 * via the Config interfaces of the classes that use them.
 *
 * Default values for every key ship on the classpath, so a complete list of the options is always visible in one
 * place. All configuration parameters are therefore required to resolve after layering: a key that is missing or
 * cannot be parsed is an error, and all such errors are reported at once.
 */
public class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String VIEWSHED_PROPERTY_PREFIX = "viewshed-";

    // All access to these should be through the *Prop methods.
    private final Properties properties;

    protected final Set<String> keysWithErrors = new TreeSet<>();

    /**
     * Prepare to load config from the given properties, overriding from environment variables and system properties.
     * In the latter two sources, the keys may be in upper or lower case and use dashes, underscores, or dots as
     * separators. System properties can be set on the JVM command line with -D options. The usual config file keys
     * must be prefixed with "viewshed", e.g. VIEWSHED_WORKER_THREADS=5 or java -Dviewshed.worker.threads=5.
     * Precedence of configuration sources is: system properties > environment variables > config file.
     */
    protected ConfigBase (Properties properties) {
        this.properties = properties;
        // Overwrite properties from config file with environment variables and system properties.
        // This could also be done with the Properties constructor that specifies defaults, but by manually
        // overwriting items we are able to log these potentially confusing changes to configuration.
        setPropertiesFromMap(System.getenv(), "environment variable");
        setPropertiesFromMap(System.getProperties(), "system properties");
    }

    /** Static convenience method to uniformly load files into properties and catch errors. */
    protected static Properties propsFromFile (String filename) {
        try (Reader propsReader = new FileReader(filename)) {
            Properties properties = new Properties();
            properties.load(propsReader);
            return properties;
        } catch (IOException e) {
            throw new IllegalStateException("Could not load configuration properties from " + filename, e);
        }
    }

    /** Load properties from a resource on the classpath, such as the defaults shipped in the jar. */
    protected static Properties propsFromResource (String resourceName) {
        try {
            URL url = Resources.getResource(resourceName);
            try (InputStream propsStream = url.openStream()) {
                Properties properties = new Properties();
                properties.load(propsStream);
                return properties;
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Could not load configuration resource " + resourceName, e);
        }
    }

    // Always use the following *Prop methods to read properties. This will catch and log missing keys or parse
    // exceptions, allowing config loading to continue and reporting as many problems as possible at once.

    // Catches and records missing values,
    // so methods that wrap this and parse into non-String types can just ignore null values.
    protected String strProp (String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            LOG.error("Missing configuration option {}", key);
            keysWithErrors.add(key);
        }
        return value;
    }

    protected int intProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Integer.parseInt(val.trim());
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as an integer: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    /**
     * Read a property and convert it with the supplied parser, which signals bad values with an
     * IllegalArgumentException. Returns the fallback value when the key is missing or unparseable.
     */
    protected <T> T parsedProp (String key, Function<String, T> parser, T fallback) {
        String val = strProp(key);
        if (val != null) {
            try {
                return parser.apply(val);
            } catch (IllegalArgumentException e) {
                LOG.error("Value of configuration option '{}' could not be parsed: {}", key, e.getMessage());
                keysWithErrors.add(key);
            }
        }
        return fallback;
    }

    /** Record a value that parsed but is out of range. */
    protected void invalidProp (String key, String problem) {
        LOG.error("Value of configuration option '{}' is invalid: {}", key, problem);
        keysWithErrors.add(key);
    }

    /** Call this after reading all properties to enforce the presence and validity of all configuration options. */
    protected void throwIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            String keys = String.join(", ", keysWithErrors);
            LOG.error("You must provide valid values for these configuration properties: {}", keys);
            throw new IllegalStateException("Missing or invalid configuration properties: " + keys);
        }
    }

    /**
     * Overwrite configuration options supplied in the config file with environment variables and system properties
     * (e.g. supplied on the JVM command line). Case and separators are normalized to conform to both properties and
     * environment variable conventions.
     */
    private void setPropertiesFromMap (Map<?, ?> map, String sourceDescription) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            // Normalize to String type, all lower case, all dash separators.
            String key = String.valueOf(entry.getKey()).toLowerCase().replaceAll("[\\._-]", "-");
            String value = String.valueOf(entry.getValue());
            if (key.startsWith(VIEWSHED_PROPERTY_PREFIX)) {
                // Strip off the prefix to get the key that would be used in our config file.
                key = key.substring(VIEWSHED_PROPERTY_PREFIX.length());
                String existingValue = properties.getProperty(key);
                if (existingValue != null) {
                    LOG.info("Overwriting existing config key {} to '{}' from {}.", key, value, sourceDescription);
                } else {
                    LOG.info("Setting configuration key {} to '{}' from {}.", key, value, sourceDescription);
                }
                properties.setProperty(key, value);
            }
        }
    }

}
