package scaraplate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import scaraplate.config.ScaraplateYaml;
import scaraplate.context.ContextReader;
import scaraplate.strategies.StrategyCatalog;
import scaraplate.strategies.StrategyRegistry;
import scaraplate.template.RenderedTemplate;
import scaraplate.template.RevisionSource;
import scaraplate.template.TemplateMeta;
import scaraplate.template.TemplateRenderer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

public class RollupRunner {

    private static final Logger logger = LogManager.getLogger(RollupRunner.class);

    static final String PROJECT_DEST = "project_dest";

    private final TemplateRenderer renderer;
    private final RevisionSource revisionSource;
    private final StrategyCatalog catalog;

    public RollupRunner(TemplateRenderer renderer, RevisionSource revisionSource) {
        this(renderer, revisionSource, StrategyCatalog.builtIn());
    }

    public RollupRunner(TemplateRenderer renderer, RevisionSource revisionSource, StrategyCatalog catalog) {
        this.renderer = renderer;
        this.revisionSource = revisionSource;
        this.catalog = catalog;
    }

    public RollupReport run(Path templateRoot, Path targetRoot, Map<String, String> extraContext) {
        ScaraplateYaml scaraplateYaml = ScaraplateYaml.load(templateRoot);
        TemplateMeta templateMeta = revisionSource.describe(templateRoot);
        ContextReader contextReader = scaraplateYaml.getContextType().reader();

        createDirectories(targetRoot);
        Optional<Map<String, String>> previous = contextReader.read(targetRoot);
        if (previous.isPresent()) {
            logger.info("Continuing with the context from `{}`: {}", contextReader, previous.get());
        } else {
            logger.info("`{}` doesn't exist in {}, continuing with an empty context", contextReader, targetRoot);
        }

        Map<String, String> context = new LinkedHashMap<>(previous.orElseGet(LinkedHashMap::new));
        context.putAll(extraContext);
        context.putIfAbsent(PROJECT_DEST, projectDest(targetRoot));

        Path workDir = createTempDirectory();
        try {
            Path outputDir = workDir.resolve("out");
            createDirectories(outputDir);
            RenderedTemplate rendered = renderer.render(templateRoot, context, outputDir);

            Map<String, String> renderedContext = contextReader.read(rendered.getRoot())
                    .orElseThrow(() -> new InvalidTemplateException(
                            "The context file `" + contextReader + "` doesn't exist in the rendered template. "
                                    + "Ensure the template generates it."));

            StrategyRegistry registry = scaraplateYaml.registry(renderedContext, catalog);
            return new Rollup(registry, templateMeta, previous.isEmpty()).apply(rendered.getRoot(), targetRoot);
        } finally {
            deleteRecursively(workDir);
        }
    }

    static String projectDest(Path targetRoot) {
        return targetRoot.toAbsolutePath().normalize().getFileName().toString();
    }

    private static void createDirectories(Path path) {
        try {
            Files.createDirectories(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Path createTempDirectory() {
        try {
            return Files.createTempDirectory("scaraplate");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void deleteRecursively(Path root) {
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    logger.warn("Failed to delete {}", p, e);
                }
            });
        } catch (IOException e) {
            logger.warn("Failed to clean up {}", root, e);
        }
    }
}
