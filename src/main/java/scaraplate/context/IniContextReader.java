package scaraplate.context;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import scaraplate.parsers.ParseException;
import scaraplate.parsers.Section;
import scaraplate.parsers.SectionDocument;
import scaraplate.parsers.SectionParser;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public class IniContextReader implements ContextReader {

    private static final Logger logger = LogManager.getLogger(IniContextReader.class);

    private final String fileName;
    private final String sectionName;

    public IniContextReader(String fileName, String sectionName) {
        this.fileName = fileName;
        this.sectionName = sectionName;
    }

    @Override
    public String fileName() {
        return fileName;
    }

    @Override
    public Optional<Map<String, String>> read(Path projectRoot) {
        Path path = projectRoot.resolve(fileName);
        if (!Files.isRegularFile(path)) {
            logger.debug("{} does not exist", path);
            return Optional.empty();
        }

        String text;
        try {
            text = Files.readString(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }

        SectionDocument document;
        try {
            document = SectionParser.parse(text, path.toString());
        } catch (ParseException e) {
            throw new ContextException("Unable to parse the context file " + path, e);
        }

        Section section = document.get(sectionName);
        if (section == null || section.keys().isEmpty()) {
            throw new ContextException("No [" + sectionName + "] context found in " + path);
        }
        return Optional.of(new TreeMap<>(section.entries()));
    }

    @Override
    public String toString() {
        return fileName;
    }
}
