package ai.brokk.doctest.run;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Debugger hook that only touches the trace hook when an example actually entered the debugger. Blocks that never
 * call {@link #setTrace()} leave coverage instrumentation alone when they {@link #setContinue()}.
 */
public final class OutputRedirectingDebugger implements InteractiveDebugger {
    private static final Logger logger = LogManager.getLogger(OutputRedirectingDebugger.class);

    private final TraceControl traceControl;
    private final DebugSession session;
    private boolean entered;

    public OutputRedirectingDebugger(TraceControl traceControl, DebugSession session) {
        this.traceControl = traceControl;
        this.session = session;
    }

    @Override
    public void setTrace() {
        entered = true;
        session.enter();
    }

    @Override
    public void setContinue() {
        if (!entered) {
            return;
        }
        logger.debug("Leaving interactive debugger; clearing trace hook");
        session.resume();
        traceControl.clearTrace();
    }

    @Override
    public boolean wasEntered() {
        return entered;
    }
}
