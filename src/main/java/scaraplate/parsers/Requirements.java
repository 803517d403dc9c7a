package scaraplate.parsers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Requirements {

    private static final Pattern NAME_PATTERN = Pattern.compile("^\\s*([A-Za-z0-9](?:[A-Za-z0-9._-]*[A-Za-z0-9])?)");

    /**
     * Case-insensitive first, then case-sensitive, so the order is total.
     */
    public static final Comparator<String> ORDER =
            String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());

    private Requirements() {
    }

    public static String name(String requirement) {
        Matcher matcher = NAME_PATTERN.matcher(requirement);
        if (matcher.find()) {
            return matcher.group(1);
        }
        return requirement.trim();
    }

    static String normalizedName(String requirement) {
        return name(requirement).toLowerCase(Locale.ROOT);
    }

    public static List<String> merge(List<String> template, List<String> target) {
        Set<String> targetNames = new HashSet<>();
        Set<String> merged = new LinkedHashSet<>();
        for (String requirement : target) {
            targetNames.add(normalizedName(requirement));
            merged.add(requirement);
        }
        for (String requirement : template) {
            if (!targetNames.contains(normalizedName(requirement))) {
                merged.add(requirement);
            }
        }
        List<String> result = new ArrayList<>(merged);
        result.sort(ORDER);
        return result;
    }
}
