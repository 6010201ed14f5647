package ai.brokk.doctest.run;

/** The interactive debugger an example can drop into; supplied by whatever executes the examples. */
public interface DebugSession {

    DebugSession NONE = new DebugSession() {
        @Override
        public void enter() {}

        @Override
        public void resume() {}
    };

    /** Starts single-stepping at the caller's frame. */
    void enter();

    /** Leaves single-step mode and lets the example continue. */
    void resume();
}
