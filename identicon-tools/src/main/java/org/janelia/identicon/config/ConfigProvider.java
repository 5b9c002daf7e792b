package org.janelia.identicon.config;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

import javax.annotation.Nullable;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Config} from layered property sources; a later source overrides the values of an earlier one.
 */
public class ConfigProvider {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigProvider.class);

    static final String DEFAULT_CONFIG_RESOURCE = "/identicon.properties";
    static final String SYSTEM_PROPERTY_PREFIX = "identicon.";

    private final Properties properties = new Properties();

    public static ConfigProvider getInstance() {
        return new ConfigProvider();
    }

    private ConfigProvider() {
    }

    public ConfigProvider fromDefaultResources() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    public ConfigProvider fromResource(String resourceName) {
        try (InputStream configStream = ConfigProvider.class.getResourceAsStream(resourceName)) {
            if (configStream == null) {
                LOG.warn("Config resource {} not found", resourceName);
            } else {
                LOG.debug("Read config from resource {}", resourceName);
                properties.load(configStream);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading config resource " + resourceName, e);
        }
        return this;
    }

    public ConfigProvider fromFile(@Nullable String fileName) {
        if (StringUtils.isBlank(fileName)) {
            return this;
        }
        try (InputStream configStream = FileUtils.openInputStream(new File(fileName))) {
            LOG.info("Read config from {}", fileName);
            properties.load(configStream);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading config file " + fileName, e);
        }
        return this;
    }

    /**
     * System properties prefixed with "identicon." override the property without the prefix,
     * e.g. -Didenticon.Output.Dir=/tmp sets Output.Dir.
     */
    public ConfigProvider fromSystemProperties() {
        System.getProperties().stringPropertyNames().stream()
                .filter(name -> name.startsWith(SYSTEM_PROPERTY_PREFIX))
                .forEach(name -> properties.setProperty(
                        name.substring(SYSTEM_PROPERTY_PREFIX.length()),
                        System.getProperty(name)));
        return this;
    }

    public Config get() {
        Properties configProperties = new Properties();
        configProperties.putAll(properties);
        return new Config(configProperties);
    }
}
