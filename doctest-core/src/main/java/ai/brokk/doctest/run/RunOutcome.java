package ai.brokk.doctest.run;

import java.util.List;

/** Result of running one example block. */
public record RunOutcome(int attempted, int failed, List<String> failures) {

    public RunOutcome {
        failures = List.copyOf(failures);
        if (failed > attempted) {
            throw new IllegalArgumentException("failed (%d) exceeds attempted (%d)".formatted(failed, attempted));
        }
    }

    public static RunOutcome passed(int attempted) {
        return new RunOutcome(attempted, 0, List.of());
    }

    public boolean isSuccess() {
        return failed == 0;
    }
}
