package scaraplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class RollupReport {

    private final List<String> written = new ArrayList<>();
    private final List<String> unchanged = new ArrayList<>();
    private final List<String> skipped = new ArrayList<>();

    void onWritten(String path) {
        written.add(path);
    }

    void onUnchanged(String path) {
        unchanged.add(path);
    }

    void onSkipped(String path) {
        skipped.add(path);
    }

    public List<String> getWritten() {
        return Collections.unmodifiableList(written);
    }

    public List<String> getUnchanged() {
        return Collections.unmodifiableList(unchanged);
    }

    public List<String> getSkipped() {
        return Collections.unmodifiableList(skipped);
    }

    @Override
    public String toString() {
        return String.format("%d written, %d unchanged, %d skipped", written.size(), unchanged.size(), skipped.size());
    }
}
