package org.janelia.medslice.config;

import java.util.Properties;

import org.apache.commons.lang3.StringUtils;

public class Config {

    private final Properties properties;

    Config(Properties properties) {
        this.properties = properties;
    }

    public String getStringPropertyValue(String name) {
        return StringUtils.trimToNull(properties.getProperty(name));
    }

    public String getStringPropertyValue(String name, String defaultValue) {
        String value = getStringPropertyValue(name);
        return value == null ? defaultValue : value;
    }

    public Integer getIntegerPropertyValue(String name, Integer defaultValue) {
        String value = getStringPropertyValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer value for " + name + ": " + value, e);
        }
    }

    public Long getLongPropertyValue(String name, Long defaultValue) {
        String value = getStringPropertyValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.valueOf(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid long value for " + name + ": " + value, e);
        }
    }

    public Double getDoublePropertyValue(String name, Double defaultValue) {
        String value = getStringPropertyValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value for " + name + ": " + value, e);
        }
    }

    public Boolean getBooleanPropertyValue(String name, Boolean defaultValue) {
        String value = getStringPropertyValue(name);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.valueOf(value);
    }

    @Override
    public String toString() {
        return properties.toString();
    }
}
