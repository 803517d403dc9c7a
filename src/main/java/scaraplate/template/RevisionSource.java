package scaraplate.template;

import java.nio.file.Path;

public interface RevisionSource {

    TemplateMeta describe(Path templateRoot);
}
