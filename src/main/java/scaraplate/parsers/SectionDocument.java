package scaraplate.parsers;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public class SectionDocument {

    private final Map<String, Section> sections = new LinkedHashMap<>();

    public boolean has(String name) {
        return sections.containsKey(name);
    }

    public Section get(String name) {
        return sections.get(name);
    }

    public Section getOrCreate(String name) {
        return sections.computeIfAbsent(name, Section::new);
    }

    public void put(Section section) {
        sections.put(section.getName(), section);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(sections.keySet());
    }

    public Collection<Section> sections() {
        return Collections.unmodifiableCollection(sections.values());
    }

    public boolean isEmpty() {
        return sections.isEmpty();
    }
}
