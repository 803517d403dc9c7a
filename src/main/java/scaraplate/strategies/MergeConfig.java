package scaraplate.strategies;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;
import java.util.stream.Collectors;

@Getter
@Builder
public class MergeConfig {

    @Singular
    private final List<KeyRule> mergeRequirements;
    @Singular
    private final List<KeyRule> preserveKeys;
    @Singular
    private final List<SectionRule> preserveSections;

    public static MergeConfig from(RawConfig raw) {
        raw.allowOnly("merge_requirements", "preserve_keys", "preserve_sections");
        return MergeConfig.builder()
                .mergeRequirements(raw.list("merge_requirements").stream().map(KeyRule::from).collect(Collectors.toList()))
                .preserveKeys(raw.list("preserve_keys").stream().map(KeyRule::from).collect(Collectors.toList()))
                .preserveSections(raw.list("preserve_sections").stream().map(SectionRule::from).collect(Collectors.toList()))
                .build();
    }

    public SectionRule preservedSection(String section) {
        return preserveSections.stream().filter(rule -> rule.matches(section)).findFirst().orElse(null);
    }

    public boolean isPreservedKey(String section, String key) {
        return preserveKeys.stream().anyMatch(rule -> rule.matches(section, key));
    }

    public boolean isRequirementList(String section, String key) {
        return mergeRequirements.stream().anyMatch(rule -> rule.matches(section, key));
    }
}
