package scaraplate.context;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

public interface ContextReader {

    Optional<Map<String, String>> read(Path projectRoot);

    String fileName();
}
