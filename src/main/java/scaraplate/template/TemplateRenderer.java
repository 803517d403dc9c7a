package scaraplate.template;

import java.nio.file.Path;
import java.util.Map;

public interface TemplateRenderer {

    RenderedTemplate render(Path templateRoot, Map<String, String> context, Path outputDir);
}
