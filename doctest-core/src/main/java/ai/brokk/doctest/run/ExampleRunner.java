package ai.brokk.doctest.run;

import ai.brokk.doctest.api.ExampleBlock;
import ai.brokk.doctest.source.ModuleEntity;
import org.jetbrains.annotations.Nullable;

/**
 * Executes the examples of one block and compares their output. Implementations capture output themselves; callers
 * must not intercept it.
 */
@FunctionalInterface
public interface ExampleRunner {

    /**
     * @param context the module whose bindings the examples run against, or {@code null} for none
     * @param debugger the hook to use when an example breaks into the debugger
     */
    RunOutcome run(ExampleBlock block, @Nullable ModuleEntity context, InteractiveDebugger debugger);

    /** The debugger examples break into; runners without one keep the default. */
    default DebugSession debugSession() {
        return DebugSession.NONE;
    }
}
