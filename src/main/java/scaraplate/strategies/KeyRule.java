package scaraplate.strategies;

import lombok.Getter;

import java.util.regex.Pattern;

@Getter
public class KeyRule {

    private final Pattern sections;
    private final Pattern keys;

    public KeyRule(Pattern sections, Pattern keys) {
        this.sections = sections;
        this.keys = keys;
    }

    public static KeyRule of(String sections, String keys) {
        return new KeyRule(Pattern.compile(sections), Pattern.compile(keys));
    }

    static KeyRule from(RawConfig raw) {
        raw.allowOnly("sections", "keys");
        return new KeyRule(raw.requiredPattern("sections"), raw.requiredPattern("keys"));
    }

    public boolean matches(String section, String key) {
        return sections.matcher(section).find() && keys.matcher(key).find();
    }
}
