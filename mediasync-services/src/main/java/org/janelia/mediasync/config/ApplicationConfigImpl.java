package org.janelia.mediasync.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.apache.commons.lang3.StringUtils;

public class ApplicationConfigImpl implements ApplicationConfig {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");
    private static final int MAX_RESOLVE_DEPTH = 8;

    private final Map<String, String> configProperties = new ConcurrentHashMap<>();

    @Override
    public String getStringPropertyValue(String name) {
        if (name == null) {
            return null;
        }
        return resolve(configProperties.get(name), 0);
    }

    @Override
    public String getStringPropertyValue(String name, String defaultValue) {
        String value = getStringPropertyValue(name);
        return value == null ? defaultValue : value;
    }

    @Override
    public Boolean getBooleanPropertyValue(String name) {
        String stringValue = getStringPropertyValue(name);
        return StringUtils.isBlank(stringValue) ? Boolean.FALSE : Boolean.valueOf(stringValue);
    }

    @Override
    public Boolean getBooleanPropertyValue(String name, boolean defaultValue) {
        String stringValue = getStringPropertyValue(name);
        return StringUtils.isBlank(stringValue) ? defaultValue : Boolean.valueOf(stringValue);
    }

    @Override
    public Integer getIntegerPropertyValue(String name) {
        String stringValue = getStringPropertyValue(name);
        return StringUtils.isBlank(stringValue) ? null : Integer.valueOf(stringValue.trim());
    }

    @Override
    public Integer getIntegerPropertyValue(String name, Integer defaultValue) {
        String stringValue = getStringPropertyValue(name);
        return StringUtils.isBlank(stringValue) ? defaultValue : Integer.valueOf(stringValue.trim());
    }

    @Override
    public Long getLongPropertyValue(String name) {
        String stringValue = getStringPropertyValue(name);
        return StringUtils.isBlank(stringValue) ? null : Long.valueOf(stringValue.trim());
    }

    @Override
    public Long getLongPropertyValue(String name, Long defaultValue) {
        String stringValue = getStringPropertyValue(name);
        return StringUtils.isBlank(stringValue) ? defaultValue : Long.valueOf(stringValue.trim());
    }

    @Override
    public List<String> getStringListPropertyValue(String name) {
        return getStringListPropertyValue(name, ImmutableList.of());
    }

    @Override
    public List<String> getStringListPropertyValue(String name, List<String> defaultValue) {
        String stringValue = getStringPropertyValue(name);
        if (StringUtils.isBlank(stringValue)) {
            return defaultValue;
        } else {
            return Splitter.on(',').trimResults().omitEmptyStrings().splitToList(stringValue);
        }
    }

    @Override
    public void load(InputStream stream) throws IOException {
        Properties toLoad = new Properties();
        toLoad.load(stream);
        putAll(Maps.fromProperties(toLoad));
    }

    @Override
    public void put(String key, String value) {
        if (key != null && value != null) {
            configProperties.put(key, value);
        }
    }

    @Override
    public void putAll(Map<String, String> properties) {
        properties.forEach(this::put);
    }

    @Override
    public Map<String, String> asMap() {
        ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        configProperties.keySet().forEach(k -> {
            String v = getStringPropertyValue(k);
            if (v != null) builder.put(k, v);
        });
        return builder.build();
    }

    /**
     * Replaces ${key} references with the value of key; unknown references are left as they are.
     */
    private String resolve(String value, int depth) {
        if (value == null || depth >= MAX_RESOLVE_DEPTH || !value.contains("${")) {
            return value;
        }
        Matcher m = PLACEHOLDER.matcher(value);
        StringBuffer resolved = new StringBuffer();
        while (m.find()) {
            String ref = configProperties.get(m.group(1));
            String replacement = ref == null ? m.group(0) : resolve(ref, depth + 1);
            m.appendReplacement(resolved, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(resolved);
        return resolved.toString();
    }
}
