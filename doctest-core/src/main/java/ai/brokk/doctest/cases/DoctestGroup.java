package ai.brokk.doctest.cases;

import ai.brokk.doctest.api.AddressResolutionException;
import ai.brokk.doctest.api.DiscoveredTest;
import ai.brokk.doctest.api.TestAddress;
import ai.brokk.doctest.run.CaseResult;
import ai.brokk.doctest.run.ExampleRunner;
import ai.brokk.doctest.run.TraceControl;
import ai.brokk.doctest.source.ModuleEntity;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * The doctest cases of one module or text file, scheduled as a unit.
 *
 * <p>Some cases are attached to things that cannot be addressed on their own (properties, for one), so a group is
 * never split across parallel workers: {@link #canSplit()} is always false, and the group's address is that of its
 * context rather than of any case. Iteration follows insertion order.
 */
public final class DoctestGroup implements Iterable<RunnableDoctest> {
    private final List<RunnableDoctest> cases;
    private final @Nullable ModuleEntity context;
    private final @Nullable Path sourceFile;

    private DoctestGroup(List<? extends RunnableDoctest> cases, @Nullable ModuleEntity context, @Nullable Path sourceFile) {
        if (cases.isEmpty()) {
            throw new IllegalArgumentException("A doctest group needs at least one case");
        }
        this.cases = List.copyOf(cases);
        this.context = context;
        this.sourceFile = sourceFile;
    }

    /** Group of the cases found in {@code module}, which is also their execution context. */
    public static DoctestGroup forModule(List<? extends RunnableDoctest> cases, ModuleEntity module) {
        return new DoctestGroup(cases, module, null);
    }

    /**
     * Group of a text file's cases.
     *
     * @param fixture the module supplying bindings for the file's examples, or {@code null} for none
     */
    public static DoctestGroup forFile(List<? extends RunnableDoctest> cases, Path file, @Nullable ModuleEntity fixture) {
        return new DoctestGroup(cases, fixture, file);
    }

    public boolean canSplit() {
        return false;
    }

    public @Nullable ModuleEntity context() {
        return context;
    }

    public List<RunnableDoctest> cases() {
        return cases;
    }

    public int size() {
        return cases.size();
    }

    @Override
    public Iterator<RunnableDoctest> iterator() {
        return cases.iterator();
    }

    /** Address of the context module; a text file without fixture is addressed by the file alone. */
    public TestAddress address() throws AddressResolutionException {
        if (context != null) {
            return EntityAddresses.of(context);
        }
        if (sourceFile == null) {
            throw new AddressResolutionException("<group>", "Group has neither context nor source file");
        }
        return TestAddress.forFile(sourceFile.toString());
    }

    /** Runs every case, in order, on the calling thread, against this group's context. */
    public List<CaseResult> run(ExampleRunner runner, TraceControl traceControl) {
        var results = new ArrayList<CaseResult>(cases.size());
        for (var testCase : cases) {
            results.add(testCase.run(runner, context, traceControl));
        }
        return results;
    }

    public List<String> ids() {
        return cases.stream().map(DiscoveredTest::id).toList();
    }

    @Override
    public String toString() {
        return cases.toString();
    }
}
