package org.janelia.mediasync.cdi;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.StringUtils;
import org.janelia.mediasync.config.ApplicationConfig;
import org.janelia.mediasync.config.ApplicationConfigImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles the application configuration from layered sources. A later source overrides an earlier one.
 * The standard layering ({@link #mediaSyncConfig()}) is: JVM system properties, the process environment
 * as {@code env.NAME} entries, {@value #DEFAULT_CONFIG_RESOURCE}, the file named by
 * {@value #CONFIG_FILE_ENV_VAR} and the dynamic {@code -Dkey=value} command line arguments.
 * Environment variables named {@code MEDIASYNC_Section_Key} are applied last and override {@code Section.Key}.
 */
public class ApplicationConfigProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationConfigProvider.class);

    public static final String DEFAULT_CONFIG_RESOURCE = "/mediasync.properties";
    public static final String CONFIG_FILE_ENV_VAR = "MEDIASYNC_CONFIG";

    private static final String ENV_ENTRY_PREFIX = "env.";
    private static final String ENV_OVERRIDE_PREFIX = ENV_ENTRY_PREFIX + "mediasync_";

    private static final Map<String, String> APP_DYNAMIC_ARGS = new HashMap<>();

    public static synchronized Map<String, String> getAppDynamicArgs() {
        return new HashMap<>(APP_DYNAMIC_ARGS);
    }

    public static synchronized void setAppDynamicArgs(Map<String, String> appDynamicArgs) {
        APP_DYNAMIC_ARGS.clear();
        if (appDynamicArgs != null) {
            APP_DYNAMIC_ARGS.putAll(appDynamicArgs);
        }
    }

    public static ApplicationConfig mediaSyncConfig() {
        return new ApplicationConfigProvider()
                .fromSystemProperties()
                .fromEnvironment(System.getenv())
                .fromResource(DEFAULT_CONFIG_RESOURCE)
                .fromFile(System.getenv(CONFIG_FILE_ENV_VAR))
                .fromMap("command line", getAppDynamicArgs())
                .build();
    }

    private final ApplicationConfig applicationConfig = new ApplicationConfigImpl();
    private final List<String> loadedSources = new ArrayList<>();

    public ApplicationConfigProvider fromSystemProperties() {
        return fromMap("system properties", Maps.fromProperties(System.getProperties()));
    }

    public ApplicationConfigProvider fromEnvironment(Map<String, String> environment) {
        Map<String, String> envEntries = new HashMap<>();
        MapUtils.emptyIfNull(environment).forEach((name, value) -> envEntries.put(ENV_ENTRY_PREFIX + name, value));
        return fromMap("environment", envEntries);
    }

    public ApplicationConfigProvider fromResource(String resourceName) {
        if (StringUtils.isBlank(resourceName)) {
            return this;
        }
        try (InputStream configStream = ApplicationConfigProvider.class.getResourceAsStream(resourceName)) {
            if (configStream == null) {
                LOG.warn("Config resource {} not found", resourceName);
                return this;
            }
            return load("resource " + resourceName, configStream);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Loads a properties file. A blank name is ignored and a missing file is only reported.
     */
    public ApplicationConfigProvider fromFile(String fileName) {
        if (StringUtils.isBlank(fileName)) {
            return this;
        }
        Path configFile = Paths.get(fileName);
        if (!Files.isRegularFile(configFile)) {
            LOG.warn("Configuration file {} not found", configFile);
            return this;
        }
        try (InputStream configStream = Files.newInputStream(configFile)) {
            return load("file " + configFile, configStream);
        } catch (IOException e) {
            LOG.error("Error reading configuration file {}", configFile, e);
            throw new UncheckedIOException(e);
        }
    }

    public ApplicationConfigProvider fromMap(String sourceName, Map<String, String> entries) {
        if (MapUtils.isNotEmpty(entries)) {
            applicationConfig.putAll(entries);
            loadedSources.add(sourceName);
        }
        return this;
    }

    private ApplicationConfigProvider load(String sourceName, InputStream configStream) throws IOException {
        applicationConfig.load(configStream);
        loadedSources.add(sourceName);
        LOG.info("Read application config from {}", sourceName);
        return this;
    }

    public List<String> getLoadedSources() {
        return ImmutableList.copyOf(loadedSources);
    }

    public ApplicationConfig build() {
        applyEnvironmentOverrides();
        LOG.debug("Application config assembled from {}", loadedSources);
        return applicationConfig;
    }

    private void applyEnvironmentOverrides() {
        Map<String, String> overrides = new HashMap<>();
        applicationConfig.asMap().forEach((key, value) -> {
            if (StringUtils.startsWithIgnoreCase(key, ENV_OVERRIDE_PREFIX) && key.length() > ENV_OVERRIDE_PREFIX.length()) {
                overrides.put(key.substring(ENV_OVERRIDE_PREFIX.length()).replace('_', '.'), value);
            }
        });
        if (!overrides.isEmpty()) {
            LOG.debug("Environment overrides {}", overrides.keySet());
        }
        applicationConfig.putAll(overrides);
    }
}
