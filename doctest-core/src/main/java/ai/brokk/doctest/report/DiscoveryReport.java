package ai.brokk.doctest.report;

import ai.brokk.doctest.api.AddressResolutionException;
import ai.brokk.doctest.api.DiscoveredTest;
import ai.brokk.doctest.api.TestAddress;
import ai.brokk.doctest.cases.DoctestGroup;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Writes discovered doctests as JSON lines, one object per case, so a host can store ids and addresses and rerun
 * cases by id later.
 */
public final class DiscoveryReport {
    private static final Logger logger = LogManager.getLogger(DiscoveryReport.class);

    private final ObjectMapper mapper;

    public DiscoveryReport() {
        this.mapper = new ObjectMapper().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    /**
     * One line of the report. {@code address} is null exactly when it could not be resolved, and then
     * {@code addressError} says why.
     */
    public record Entry(
            String id,
            String label,
            String description,
            @Nullable TestAddress address,
            @Nullable String addressError,
            int group) {}

    public List<Entry> entries(List<DoctestGroup> groups) {
        var entries = new ArrayList<Entry>();
        for (int i = 0; i < groups.size(); i++) {
            for (var testCase : groups.get(i)) {
                entries.add(entry(testCase, i));
            }
        }
        return entries;
    }

    /** Writes the entries of {@code groups}; the writer is flushed but left open. */
    public void write(List<DoctestGroup> groups, Writer writer) throws IOException {
        for (var entry : entries(groups)) {
            writer.write(mapper.writeValueAsString(entry));
            writer.write('\n');
        }
        writer.flush();
    }

    public Entry readEntry(String line) throws IOException {
        return mapper.readValue(line, Entry.class);
    }

    private static Entry entry(DiscoveredTest testCase, int group) {
        try {
            return new Entry(
                    testCase.id(), testCase.toString(), testCase.shortDescription(), testCase.address(), null, group);
        } catch (AddressResolutionException e) {
            logger.warn("No address for doctest {}: {}", testCase.id(), e.getMessage());
            return new Entry(testCase.id(), testCase.toString(), testCase.shortDescription(), null, e.getMessage(), group);
        }
    }
}
