package scaraplate.strategies;

import lombok.Builder;
import lombok.Getter;
import scaraplate.parsers.ParseException;
import scaraplate.template.TemplateMeta;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

@Getter
@Builder
public class StrategyInput {

    private final String path;
    private final byte[] template;
    // null when the file does not exist in the target project
    private final byte[] target;
    private final TemplateMeta templateMeta;
    @Builder.Default
    private final boolean newProject = true;

    public boolean hasTarget() {
        return target != null;
    }

    public String templateText() {
        return decode(template, path + " (template)");
    }

    public String targetText() {
        return target == null ? null : decode(target, path + " (target)");
    }

    private static String decode(byte[] bytes, String source) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new ParseException(source, 0, "not a UTF-8 text file");
        }
    }
}
