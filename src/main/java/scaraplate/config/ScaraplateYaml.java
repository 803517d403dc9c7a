package scaraplate.config;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import scaraplate.context.ContextType;
import scaraplate.strategies.StrategyCatalog;
import scaraplate.strategies.StrategyKind;
import scaraplate.strategies.StrategyRegistry;
import scaraplate.template.GitRemote;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The {@code scaraplate.yaml} file in the root of a template:
 * <pre>
 * default_strategy: Overwrite
 * cookiecutter_context_type: ScaraplateConf
 * strategies_mapping:
 *   ^Jenkinsfile$: TemplateHash
 *   ^setup\.cfg$: SetupCfgMerge
 *   ^{{ cookiecutter.project_dest }}/__init__\.py$: IfMissing
 *   ^MANIFEST\.in$:
 *     strategy: SortedUniqueLines
 *     config:
 *       comment_pattern: '^ *#'
 * </pre>
 * Mapping keys are regular expressions over paths relative to the project root and may
 * reference values of the rendering context.
 */
@Getter
public class ScaraplateYaml {

    public static final String FILE_NAME = "scaraplate.yaml";

    private static final Logger logger = LogManager.getLogger(ScaraplateYaml.class);
    private static final Pattern CONTEXT_VARIABLE = Pattern.compile("\\{\\{\\s*cookiecutter\\.(\\w+)\\s*}}");

    private final StrategyNode defaultStrategy;
    private final List<StrategyNode> strategiesMapping;
    private final ContextType contextType;
    private final GitRemote gitRemoteType;

    private ScaraplateYaml(StrategyNode defaultStrategy, List<StrategyNode> strategiesMapping, ContextType contextType,
                           GitRemote gitRemoteType) {
        this.defaultStrategy = defaultStrategy;
        this.strategiesMapping = Collections.unmodifiableList(strategiesMapping);
        this.contextType = contextType;
        this.gitRemoteType = gitRemoteType;
    }

    public static ScaraplateYaml load(Path templateRoot) {
        Path path = templateRoot.resolve(FILE_NAME);
        try {
            return parse(Files.readString(path), path.toString());
        } catch (NoSuchFileException e) {
            throw new ConfigurationException("`" + FILE_NAME + "` is missing in the template " + templateRoot, e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ScaraplateYaml parse(String text, String source) {
        Object root;
        try {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(text);
        } catch (YAMLException e) {
            throw new ConfigurationException(source + ": invalid YAML", e);
        }
        if (root == null) {
            root = Collections.emptyMap();
        }
        if (!(root instanceof Map)) {
            throw new ConfigurationException(source + ": a mapping is expected at the top level");
        }
        Map<?, ?> config = (Map<?, ?>) root;

        StrategyNode defaultStrategy = config.containsKey("default_strategy")
                ? node("default_strategy", config.get("default_strategy"))
                : new StrategyNode("default_strategy", StrategyKind.OVERWRITE.strategyName(), Collections.emptyMap());

        Object mapping = config.get("strategies_mapping");
        List<StrategyNode> nodes = new ArrayList<>();
        if (mapping != null) {
            if (!(mapping instanceof Map)) {
                throw new ConfigurationException(source + ": `strategies_mapping` must be a mapping");
            }
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) mapping).entrySet()) {
                nodes.add(node(String.valueOf(entry.getKey()), entry.getValue()));
            }
        }

        Object contextTypeName = config.get("cookiecutter_context_type");
        ContextType contextType = contextTypeName == null
                ? ContextType.SCARAPLATE_CONF
                : ContextType.byName(String.valueOf(contextTypeName));

        Object gitRemoteName = config.get("git_remote_type");
        GitRemote gitRemoteType = gitRemoteName == null ? null : GitRemote.byName(String.valueOf(gitRemoteName));

        logger.debug("Loaded {} with {} strategy mappings", source, nodes.size());
        return new ScaraplateYaml(defaultStrategy, nodes, contextType, gitRemoteType);
    }

    public GitRemote gitRemote(String remote) {
        return gitRemoteType != null ? gitRemoteType : GitRemote.detect(remote);
    }

    public StrategyRegistry registry(Map<String, String> context, StrategyCatalog catalog) {
        StrategyRegistry.Builder builder = StrategyRegistry.builder(catalog)
                .defaultStrategy(defaultStrategy.getStrategy(), defaultStrategy.getConfig());
        for (StrategyNode node : strategiesMapping) {
            builder.bind(interpolate(node.getPattern(), context), node.getStrategy(), node.getConfig());
        }
        return builder.build();
    }

    static String interpolate(String pattern, Map<String, String> context) {
        Matcher matcher = CONTEXT_VARIABLE.matcher(pattern);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = context.get(name);
            if (value == null) {
                throw new ConfigurationException(
                        "strategies_mapping[" + pattern + "]: unknown context variable `" + name + "`");
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(Pattern.quote(value)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static StrategyNode node(String owner, Object raw) {
        if (raw instanceof String) {
            return new StrategyNode(owner, (String) raw, Collections.emptyMap());
        }
        if (!(raw instanceof Map)) {
            throw new ConfigurationException(owner + ": unexpected strategy value " + raw);
        }
        Map<?, ?> map = (Map<?, ?>) raw;
        Object strategy = map.get("strategy");
        if (!(strategy instanceof String)) {
            throw new ConfigurationException(owner + ": `strategy` must be a string, got " + strategy);
        }
        Object config = map.get("config");
        if (config == null) {
            config = Collections.emptyMap();
        }
        if (!(config instanceof Map)) {
            throw new ConfigurationException(owner + ": `config` must be a mapping, got " + config);
        }
        for (Object key : map.keySet()) {
            if (!"strategy".equals(key) && !"config".equals(key)) {
                throw new ConfigurationException(owner + ": unknown key `" + key + "`");
            }
        }
        Map<String, Object> typed = new LinkedHashMap<>();
        ((Map<?, ?>) config).forEach((k, v) -> typed.put(String.valueOf(k), v));
        return new StrategyNode(owner, (String) strategy, typed);
    }

    @Getter
    @AllArgsConstructor
    public static class StrategyNode {
        private final String pattern;
        private final String strategy;
        private final Map<String, Object> config;
    }
}
