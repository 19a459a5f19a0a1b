package de.mirkosertic.searchvalidator.engine;

/**
 * Verdict of a single test case.
 */
public enum CaseOutcome {

    PASS,
    /** Expected document absent from the returned candidates. */
    FAIL_NOT_FOUND,
    /** Found, but below the allowed rank. Checked before the score. */
    FAIL_RANK_EXCEEDED,
    /** Found within the allowed rank, but with an insufficient score. */
    FAIL_SCORE_BELOW_THRESHOLD,
    /** The case could not be evaluated (provider or backend failure, timeout). */
    ERROR;

    public boolean isPass() {
        return this == PASS;
    }
}
