package org.janelia.identicon.config;

import java.util.Properties;

import org.apache.commons.lang3.StringUtils;

public class Config {
    private final Properties properties;

    Config(Properties properties) {
        this.properties = properties;
    }

    public boolean hasProperty(String name) {
        return StringUtils.isNotBlank(properties.getProperty(name));
    }

    public String getStringPropertyValue(String name) {
        return properties.getProperty(name);
    }

    public String getStringPropertyValue(String name, String defaultValue) {
        String value = properties.getProperty(name);
        return StringUtils.isBlank(value) ? defaultValue : value.trim();
    }

    public Integer getIntegerPropertyValue(String name, Integer defaultValue) {
        String value = properties.getProperty(name);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer value for " + name + ": " + value, e);
        }
    }

    public boolean getBooleanPropertyValue(String name, boolean defaultValue) {
        String value = properties.getProperty(name);
        return StringUtils.isBlank(value) ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    @Override
    public String toString() {
        return properties.toString();
    }
}
