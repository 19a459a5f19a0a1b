package de.mirkosertic.searchvalidator.testcase;

import de.mirkosertic.searchvalidator.config.ConfigurationException;

public class DuplicateTestCaseException extends ConfigurationException {

    private final String testCaseId;

    public DuplicateTestCaseException(final String testCaseId, final String source) {
        super("Duplicate test case id '" + testCaseId + "' in " + source);
        this.testCaseId = testCaseId;
    }

    public String getTestCaseId() {
        return testCaseId;
    }
}
