package ai.brokk.doctest.run;

/**
 * Access to the process-wide trace hook that coverage instrumentation depends on. Leaving a debugger normally clears
 * that hook, which silently ends coverage collection for the rest of the run.
 */
@FunctionalInterface
public interface TraceControl {

    TraceControl NONE = () -> {};

    void clearTrace();
}
