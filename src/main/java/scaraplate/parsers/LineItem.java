package scaraplate.parsers;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class LineItem {
    private final String line;
    private final List<String> comments;
}
