package scaraplate.strategies;

import scaraplate.config.ConfigurationException;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class RawConfig {

    private final String owner;
    private final Map<String, Object> values;

    public RawConfig(String owner, Map<String, Object> values) {
        this.owner = owner;
        this.values = values == null ? Collections.emptyMap() : values;
    }

    public static RawConfig empty(String owner) {
        return new RawConfig(owner, Collections.emptyMap());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public String owner() {
        return owner;
    }

    public RawConfig allowOnly(String... keys) {
        Set<String> unknown = new TreeSet<>(values.keySet());
        unknown.removeAll(new HashSet<>(Arrays.asList(keys)));
        if (!unknown.isEmpty()) {
            throw error("unknown config keys " + unknown);
        }
        return this;
    }

    public String string(String key, String defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof String)) {
            throw error("`" + key + "` must be a string, got " + value);
        }
        return (String) value;
    }

    public Integer optionalInt(String key, int min) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Integer)) {
            throw error("`" + key + "` must be an integer, got " + value);
        }
        int i = (Integer) value;
        if (i < min) {
            throw error("`" + key + "` must be at least " + min + ", got " + i);
        }
        return i;
    }

    public Pattern pattern(String key, String defaultValue) {
        return compile(key, string(key, defaultValue));
    }

    public List<RawConfig> list(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List)) {
            throw error("`" + key + "` must be a list, got " + value);
        }
        List<?> raw = (List<?>) value;
        RawConfig[] result = new RawConfig[raw.size()];
        for (int i = 0; i < raw.size(); i++) {
            Object item = raw.get(i);
            if (!(item instanceof Map)) {
                throw error("`" + key + "[" + i + "]` must be a mapping, got " + item);
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> map = (Map<String, Object>) item;
            result[i] = new RawConfig(owner + "." + key + "[" + i + "]", map);
        }
        return Arrays.asList(result);
    }

    public Pattern compile(String key, String regex) {
        if (regex == null) {
            return null;
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException(owner + ": `" + key + "` is not a valid pattern: " + regex, e);
        }
    }

    public Pattern requiredPattern(String key) {
        String regex = string(key, null);
        if (regex == null) {
            throw error("`" + key + "` is required");
        }
        return compile(key, regex);
    }

    public ConfigurationException error(String message) {
        return new ConfigurationException(owner + ": " + message);
    }
}
