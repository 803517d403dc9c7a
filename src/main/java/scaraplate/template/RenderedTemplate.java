package scaraplate.template;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.file.Path;

@Getter
@AllArgsConstructor
public class RenderedTemplate {
    private final Path root;
}
