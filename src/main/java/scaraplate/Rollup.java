package scaraplate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import scaraplate.newline.NewlineStyle;
import scaraplate.newline.Newlines;
import scaraplate.strategies.MergeResult;
import scaraplate.strategies.StrategyBinding;
import scaraplate.strategies.StrategyInput;
import scaraplate.strategies.StrategyRegistry;
import scaraplate.template.TemplateMeta;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class Rollup {

    private static final Logger logger = LogManager.getLogger(Rollup.class);

    private final StrategyRegistry registry;
    private final TemplateMeta templateMeta;
    private final boolean newProject;

    public Rollup(StrategyRegistry registry, TemplateMeta templateMeta, boolean newProject) {
        this.registry = registry;
        this.templateMeta = templateMeta;
        this.newProject = newProject;
    }

    public RollupReport apply(Path renderedRoot, Path targetRoot) {
        Path generated = renderedRoot.toAbsolutePath().normalize();
        Path target = targetRoot.toAbsolutePath().normalize();
        RollupReport report = new RollupReport();

        for (Path file : listFiles(generated)) {
            Path relative = generated.relativize(file);
            applyFile(file, relativePath(relative), resolveTarget(target, relative), report);
        }

        logger.info("Rollup of {} finished: {}", target, report);
        return report;
    }

    private void applyFile(Path templateFile, String path, Path targetFile, RollupReport report) {
        StrategyBinding binding = registry.resolve(path);
        byte[] template = read(templateFile);
        byte[] current = Files.exists(targetFile) ? read(targetFile) : null;

        MergeResult result = binding.getStrategy().apply(StrategyInput.builder()
                .path(path)
                .template(template)
                .target(current)
                .templateMeta(templateMeta)
                .newProject(newProject)
                .build());

        if (result.isSkip()) {
            logger.debug("{}: skipped by {}", path, binding.getStrategyName());
            report.onSkipped(path);
            return;
        }

        byte[] contents = result.getContents();
        if (result.isText()) {
            NewlineStyle style = Newlines.styleFor(template, current);
            contents = Newlines.normalize(result.asText(), style).getBytes(StandardCharsets.UTF_8);
        }

        if (current != null && Arrays.equals(current, contents)) {
            logger.debug("{}: unchanged ({})", path, binding.getStrategyName());
            report.onUnchanged(path);
            return;
        }

        write(targetFile, contents);
        copyPermissions(templateFile, targetFile);
        logger.debug("{}: written by {}", path, binding.getStrategyName());
        report.onWritten(path);
    }

    private static List<Path> listFiles(Path root) {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String relativePath(Path relative) {
        StringJoiner joiner = new StringJoiner("/");
        for (Path part : relative) {
            joiner.add(part.toString());
        }
        return joiner.toString();
    }

    private static Path resolveTarget(Path targetRoot, Path relative) {
        Path resolved = targetRoot.resolve(relative.toString()).normalize();
        if (!resolved.startsWith(targetRoot)) {
            throw new ScaraplateException("Refusing to write outside of the target project: " + resolved);
        }
        if (Files.isDirectory(resolved)) {
            throw new ScaraplateException("A directory is in place of a template file: " + resolved);
        }
        return resolved;
    }

    private static byte[] read(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void write(Path path, byte[] contents) {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(path, contents);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void copyPermissions(Path from, Path to) {
        if (Files.getFileAttributeView(from, PosixFileAttributeView.class) == null) {
            return;
        }
        try {
            Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(from);
            Files.setPosixFilePermissions(to, permissions);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
