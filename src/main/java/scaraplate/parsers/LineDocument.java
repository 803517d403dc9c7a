package scaraplate.parsers;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class LineDocument {
    private final List<String> header;
    /**
     * A blank line follows the header.
     */
    private final boolean separated;
    private final List<LineItem> items;
    private final List<String> orphans;

    public boolean hasHeader() {
        return !header.isEmpty();
    }
}
