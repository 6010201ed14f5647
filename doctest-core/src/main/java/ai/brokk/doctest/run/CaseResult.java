package ai.brokk.doctest.run;

/** A run outcome tagged with the id of the case that produced it. */
public record CaseResult(String testId, RunOutcome outcome) {}
