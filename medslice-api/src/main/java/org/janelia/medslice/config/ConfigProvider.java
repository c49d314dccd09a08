package org.janelia.medslice.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Layered configuration: the classpath defaults are overridden by a properties file
 * which in turn can be overridden by explicit values.
 */
public class ConfigProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigProvider.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/medslice.properties";

    public static ConfigProvider getInstance() {
        return new ConfigProvider();
    }

    private final Properties properties = new Properties();

    private ConfigProvider() {
    }

    public ConfigProvider fromDefaultResources() {
        try (InputStream configStream = ConfigProvider.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (configStream == null) {
                LOG.debug("No default configuration found at {}", DEFAULT_CONFIG_RESOURCE);
            } else {
                properties.load(configStream);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Error reading default configuration " + DEFAULT_CONFIG_RESOURCE, e);
        }
        return this;
    }

    public ConfigProvider fromFile(String fileName) {
        if (StringUtils.isBlank(fileName)) {
            return this;
        }
        Path configFile = Paths.get(fileName);
        if (Files.notExists(configFile)) {
            throw new IllegalArgumentException("Configuration file " + fileName + " does not exist");
        }
        try (InputStream configStream = Files.newInputStream(configFile)) {
            LOG.info("Read configuration from {}", fileName);
            properties.load(configStream);
        } catch (IOException e) {
            throw new IllegalStateException("Error reading configuration from " + fileName, e);
        }
        return this;
    }

    public ConfigProvider fromMap(Map<String, String> values) {
        if (values != null) {
            values.forEach((k, v) -> {
                if (v != null) {
                    properties.setProperty(k, v);
                }
            });
        }
        return this;
    }

    public Config get() {
        Properties configProperties = new Properties();
        configProperties.putAll(properties);
        return new Config(configProperties);
    }
}
