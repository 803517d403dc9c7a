package scaraplate.strategies;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.nio.charset.StandardCharsets;

@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class MergeResult {

    private static final MergeResult SKIP = new MergeResult(null, false);

    private final byte[] contents;
    private final boolean text;

    public static MergeResult skip() {
        return SKIP;
    }

    public static MergeResult bytes(byte[] contents) {
        return new MergeResult(contents, false);
    }

    public static MergeResult text(String contents) {
        return new MergeResult(contents.getBytes(StandardCharsets.UTF_8), true);
    }

    public boolean isSkip() {
        return contents == null;
    }

    public String asText() {
        return contents == null ? null : new String(contents, StandardCharsets.UTF_8);
    }
}
