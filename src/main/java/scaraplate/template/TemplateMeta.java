package scaraplate.template;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class TemplateMeta {
    private final String projectUrl;
    private final String commitHash;
    private final String commitUrl;
    private final boolean dirty;
    private final String headRef;
}
