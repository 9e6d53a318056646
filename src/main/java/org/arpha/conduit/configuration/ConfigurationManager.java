package org.arpha.conduit.configuration;

import lombok.extern.slf4j.Slf4j;
import org.arpha.conduit.exception.ConfigurationException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

@Slf4j
public class ConfigurationManager {

    static final String DEFAULT_RESOURCE = "conduit.properties";

    private static ConfigurationManager INSTANCE;
    private final Properties properties;

    ConfigurationManager(String resource) {
        properties = new Properties();

        try (InputStream input = ConfigurationManager.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                log.warn("Configuration resource {} not found on classpath, using defaults", resource);
                return;
            }
            properties.load(input);
        } catch (IOException e) {
            log.error("Error loading configuration resource: {}", resource, e);
            throw new ConfigurationException("Error loading configuration resource " + resource, e);
        }
    }

    public static synchronized ConfigurationManager getINSTANCE() {
        if (INSTANCE == null) {
            INSTANCE = new ConfigurationManager(DEFAULT_RESOURCE);
        }

        return INSTANCE;
    }

    /**
     * Merges the properties of an external file over the classpath defaults.
     */
    public static void overrideProperties(String path) {
        getINSTANCE().merge(path);
    }

    void merge(String path) {
        Properties overrides = new Properties();
        try (FileInputStream input = new FileInputStream(path)) {
            overrides.load(input);
        } catch (FileNotFoundException e) {
            log.error("Configuration file not found: {}", path, e);
            throw new ConfigurationException("Configuration file not found: " + path, e);
        } catch (IOException e) {
            log.error("Error loading configuration file: {}", path, e);
            throw new ConfigurationException("Error loading configuration file: " + path, e);
        }
        properties.putAll(overrides);
        log.info("Loaded {} configuration overrides from {}", overrides.size(), path);
    }

    public String getProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            log.warn("Property {} not found in configuration. Using default value: {}", key, defaultValue);
            return defaultValue;
        }
        return value.trim();
    }

    public int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid integer format for property: {}", key, e);
                throw new ConfigurationException("Invalid integer format for property: " + key, e);
            }
        } else {
            log.info("Using default value for property: {}", key);
        }
        return defaultValue;
    }

    public <E extends Enum<E>> E getEnumProperty(String key, Class<E> type, E defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            log.info("Using default value for property: {}", key);
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value '{}' for property: {}", value, key, e);
            throw new ConfigurationException("Invalid value '" + value + "' for property: " + key, e);
        }
    }

}
