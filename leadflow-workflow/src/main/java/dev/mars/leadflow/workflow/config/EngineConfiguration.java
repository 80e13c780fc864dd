/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.leadflow.workflow.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Engine settings loaded from layered property sources. Later layers override
 * earlier ones: built-in defaults, {@code leadflow.properties} on the classpath,
 * {@code leadflow.properties} or {@code config/leadflow.properties} in the working
 * directory, {@code ~/.leadflow/leadflow.properties}, then system properties
 * starting with {@code leadflow.}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-01
 * @version 1.0
 */
public class EngineConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfiguration.class);

    public static final String MAX_CONCURRENT_STEPS = "leadflow.engine.max.concurrent.steps";
    public static final String SHUTDOWN_TIMEOUT_MS = "leadflow.engine.shutdown.timeout.ms";
    public static final String METRICS_ENABLED = "leadflow.monitoring.metrics.enabled";

    private static final int DEFAULT_MAX_CONCURRENT_STEPS = 4;
    private static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 5000;
    private static final String PROPERTIES_FILE = "leadflow.properties";

    private final Properties properties;

    public EngineConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromClasspath();
        loadConfigurationFromFiles();
        loadConfigurationFromSystemProperties();
    }

    /**
     * Defaults overlaid with the given properties only; no files or system properties are read.
     */
    public EngineConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * @return worker pool size; always at least 1
     */
    public int getMaxConcurrentSteps() {
        int value = getIntProperty(MAX_CONCURRENT_STEPS, DEFAULT_MAX_CONCURRENT_STEPS);
        if (value < 1) {
            logger.warn("Property {} must be at least 1 but was {}. Using default: {}",
                    MAX_CONCURRENT_STEPS, value, DEFAULT_MAX_CONCURRENT_STEPS);
            return DEFAULT_MAX_CONCURRENT_STEPS;
        }
        return value;
    }

    public long getShutdownTimeoutMs() {
        return getLongProperty(SHUTDOWN_TIMEOUT_MS, DEFAULT_SHUTDOWN_TIMEOUT_MS);
    }

    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(MAX_CONCURRENT_STEPS, String.valueOf(DEFAULT_MAX_CONCURRENT_STEPS));
        properties.setProperty(SHUTDOWN_TIMEOUT_MS, String.valueOf(DEFAULT_SHUTDOWN_TIMEOUT_MS));
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromClasspath() {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromFiles() {
        String[] configFiles = {
                PROPERTIES_FILE,
                "config/" + PROPERTIES_FILE,
                System.getProperty("user.home") + "/.leadflow/" + PROPERTIES_FILE
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.isRegularFile(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().stringPropertyNames().stream()
                .filter(key -> key.startsWith("leadflow."))
                .forEach(key -> {
                    properties.setProperty(key, System.getProperty(key));
                    logger.debug("Override from system property: {}={}", key, System.getProperty(key));
                });
    }

    @Override
    public String toString() {
        return "EngineConfiguration{" +
                "maxConcurrentSteps=" + getMaxConcurrentSteps() +
                ", shutdownTimeoutMs=" + getShutdownTimeoutMs() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
