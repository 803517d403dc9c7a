package scaraplate.parsers;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Named group of {@code key = value} entries. Keys are case-sensitive and unique,
 * kept in the order they were added.
 * <p>
 * A wrapped value (continuation lines) is stored as its sub-items joined by {@code \n};
 * when the first line of the value was empty the stored value starts with {@code \n}.
 */
public class Section {

    @Getter
    private final String name;
    private final Map<String, String> entries = new LinkedHashMap<>();

    public Section(String name) {
        this.name = name;
    }

    public Section copy() {
        Section copy = new Section(name);
        copy.entries.putAll(entries);
        return copy;
    }

    public boolean has(String key) {
        return entries.containsKey(key);
    }

    public String get(String key) {
        return entries.get(key);
    }

    public void put(String key, String value) {
        entries.put(key, value == null ? "" : value);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Map<String, String> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public static List<String> items(String value) {
        if (value == null || value.isEmpty()) {
            return new ArrayList<>();
        }
        return Arrays.stream(value.split("\n"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    public static String listValue(List<String> items) {
        if (items.isEmpty()) {
            return "";
        }
        return "\n" + String.join("\n", items);
    }

    public static boolean isList(String value) {
        return value != null && value.indexOf('\n') >= 0;
    }
}
