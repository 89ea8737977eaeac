package com.vidnyan.eaf.domain.engine;

import com.vidnyan.eaf.domain.error.EafError;

import java.util.List;

/**
 * Result of validating a document.
 */
public record ValidationReport(List<Issue> issues) {

    public ValidationReport {
        issues = List.copyOf(issues);
    }

    public boolean isValid() {
        return issues.isEmpty();
    }

    public List<Issue> issuesOf(EafError error) {
        return issues.stream()
                .filter(i -> i.error() == error)
                .toList();
    }

    public boolean has(EafError error) {
        return issues.stream().anyMatch(i -> i.error() == error);
    }

    /**
     * A single problem found in a document.
     *
     * @param subjectId ID of the tier, annotation or time slot at fault
     */
    public record Issue(EafError error, String subjectId, String message) {

        public static Issue of(EafError error, String subjectId, Object... args) {
            return new Issue(error, subjectId, error.format(args));
        }

        public EafError.Category category() {
            return error.category();
        }
    }
}
