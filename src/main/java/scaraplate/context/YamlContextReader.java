package scaraplate.context;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public class YamlContextReader implements ContextReader {

    public static final String FILE_NAME = ".scaraplate.context.yaml";
    public static final String KEY = "cookiecutter_context";

    private static final Logger logger = LogManager.getLogger(YamlContextReader.class);

    @Override
    public String fileName() {
        return FILE_NAME;
    }

    @Override
    public Optional<Map<String, String>> read(Path projectRoot) {
        Path path = projectRoot.resolve(FILE_NAME);
        if (!Files.isRegularFile(path)) {
            logger.debug("{} does not exist", path);
            return Optional.empty();
        }

        Object root;
        try {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(Files.readString(path));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (YAMLException e) {
            throw new ContextException("Unable to parse the context file " + path, e);
        }

        Object context = root instanceof Map ? ((Map<?, ?>) root).get(KEY) : null;
        if (!(context instanceof Map) || ((Map<?, ?>) context).isEmpty()) {
            throw new ContextException("No `" + KEY + "` mapping found in " + path);
        }

        Map<String, String> result = new TreeMap<>();
        ((Map<?, ?>) context).forEach((k, v) -> result.put(String.valueOf(k), v == null ? "" : String.valueOf(v)));
        return Optional.of(result);
    }

    @Override
    public String toString() {
        return FILE_NAME;
    }
}
