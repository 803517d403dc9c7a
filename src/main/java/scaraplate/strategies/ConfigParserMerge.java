package scaraplate.strategies;

import lombok.Getter;
import scaraplate.parsers.Requirements;
import scaraplate.parsers.Section;
import scaraplate.parsers.SectionDocument;
import scaraplate.parsers.SectionParser;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Merges INI-like files section by section.
 * <ul>
 *     <li>a section matching {@code preserve_sections} is taken verbatim from the target when the target
 *     has it, except for keys matching the rule's {@code ignore_keys};</li>
 *     <li>a key matching {@code preserve_keys} is taken from the target when the target has it;</li>
 *     <li>a key matching {@code merge_requirements} becomes the union of both requirement lists,
 *     the target's requirement winning when both name the same project;</li>
 *     <li>any other key is taken from the template, falling back to the target;</li>
 *     <li>sections only present in the target are kept as they are.</li>
 * </ul>
 * Comments are dropped and the output is written in canonical form, see {@link SectionParser#dump}.
 */
@Getter
public class ConfigParserMerge extends TextStrategy {

    private final MergeConfig config;

    public ConfigParserMerge(MergeConfig config) {
        this.config = config;
    }

    public static ConfigParserMerge create(RawConfig raw) {
        return new ConfigParserMerge(MergeConfig.from(raw));
    }

    @Override
    protected String merge(String template, String target, StrategyInput input) {
        SectionDocument fromTemplate = SectionParser.parse(template, input.getPath() + ".template");
        SectionDocument fromTarget = target == null ? null : SectionParser.parse(target, input.getPath() + ".target");
        return SectionParser.dump(merge(fromTemplate, fromTarget));
    }

    public SectionDocument merge(SectionDocument template, SectionDocument target) {
        Set<String> names = new TreeSet<>(template.names());
        if (target != null) {
            names.addAll(target.names());
        }

        SectionDocument out = new SectionDocument();
        for (String name : names) {
            Section fromTemplate = template.get(name);
            Section fromTarget = target == null ? null : target.get(name);
            out.put(mergeSection(name, fromTemplate, fromTarget));
        }
        return out;
    }

    private Section mergeSection(String name, Section fromTemplate, Section fromTarget) {
        SectionRule preserve = config.preservedSection(name);
        if (preserve != null && fromTarget != null) {
            return preserveSection(preserve, fromTemplate, fromTarget);
        }
        if (fromTemplate == null) {
            return fromTarget.copy();
        }

        Section out = new Section(name);
        for (String key : keys(fromTemplate, fromTarget)) {
            out.put(key, mergeValue(name, key, fromTemplate, fromTarget));
        }
        return out;
    }

    private static Section preserveSection(SectionRule rule, Section fromTemplate, Section fromTarget) {
        Section out = fromTarget.copy();
        if (fromTemplate == null) {
            return out;
        }
        for (String key : fromTemplate.keys()) {
            if (rule.ignores(key)) {
                out.put(key, fromTemplate.get(key));
            }
        }
        return out;
    }

    private String mergeValue(String name, String key, Section fromTemplate, Section fromTarget) {
        if (keepsTarget(name, key, fromTarget)) {
            return fromTarget.get(key);
        }
        if (config.isRequirementList(name, key)) {
            return mergeRequirements(key, fromTemplate, fromTarget);
        }
        if (fromTemplate.has(key)) {
            return fromTemplate.get(key);
        }
        return fromTarget.get(key);
    }

    private boolean keepsTarget(String name, String key, Section fromTarget) {
        return fromTarget != null && fromTarget.has(key) && config.isPreservedKey(name, key);
    }

    private static String mergeRequirements(String key, Section fromTemplate, Section fromTarget) {
        List<String> template = Section.items(fromTemplate == null ? null : fromTemplate.get(key));
        List<String> target = Section.items(fromTarget == null ? null : fromTarget.get(key));
        return Section.listValue(Requirements.merge(template, target));
    }

    private static Set<String> keys(Section fromTemplate, Section fromTarget) {
        Set<String> keys = new LinkedHashSet<>();
        if (fromTemplate != null) {
            keys.addAll(fromTemplate.keys());
        }
        if (fromTarget != null) {
            keys.addAll(fromTarget.keys());
        }
        return keys;
    }
}
