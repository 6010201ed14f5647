package ai.brokk.doctest.cases;

import ai.brokk.doctest.api.DiscoveredTest;
import ai.brokk.doctest.run.CaseResult;
import ai.brokk.doctest.run.ExampleRunner;
import ai.brokk.doctest.run.OutputRedirectingDebugger;
import ai.brokk.doctest.run.TraceControl;
import ai.brokk.doctest.source.ModuleEntity;
import org.jetbrains.annotations.Nullable;

/** A discovered test that can run its block through an {@link ExampleRunner}. */
public interface RunnableDoctest extends DiscoveredTest {

    /**
     * Runs the block against {@code context} with a fresh debugger hook, which is always told to continue once the
     * block is done.
     */
    default CaseResult run(ExampleRunner runner, @Nullable ModuleEntity context, TraceControl traceControl) {
        var debugger = new OutputRedirectingDebugger(traceControl, runner.debugSession());
        try {
            return new CaseResult(id(), runner.run(block(), context, debugger));
        } finally {
            debugger.setContinue();
        }
    }
}
