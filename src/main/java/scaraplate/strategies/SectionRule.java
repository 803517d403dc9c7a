package scaraplate.strategies;

import lombok.Getter;

import java.util.regex.Pattern;

@Getter
public class SectionRule {

    private final Pattern sections;
    private final Pattern ignoreKeys;

    public SectionRule(Pattern sections, Pattern ignoreKeys) {
        this.sections = sections;
        this.ignoreKeys = ignoreKeys;
    }

    public static SectionRule of(String sections) {
        return new SectionRule(Pattern.compile(sections), null);
    }

    static SectionRule from(RawConfig raw) {
        raw.allowOnly("sections", "ignore_keys");
        return new SectionRule(raw.requiredPattern("sections"), raw.pattern("ignore_keys", null));
    }

    public boolean matches(String section) {
        return sections.matcher(section).find();
    }

    public boolean ignores(String key) {
        return ignoreKeys != null && ignoreKeys.matcher(key).find();
    }
}
