package ai.brokk.doctest.run;

/** Debugger hook handed to an {@link ExampleRunner} for the duration of one example block. */
public interface InteractiveDebugger {

    /** Called when an example asks to break into the debugger. */
    void setTrace();

    /** Called when the block finishes, whether or not the debugger was entered. */
    void setContinue();

    boolean wasEntered();
}
