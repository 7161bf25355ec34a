package com.phillippitts.freefleet.service.validation;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of the ultra-free safety checks.
 *
 * @param failedChecks names of the checks that did not pass ({@code tier}, {@code confidence}, {@code multi_source})
 */
public record ValidationResult(boolean safe, List<String> failedChecks, Instant timestamp) {

    public ValidationResult {
        failedChecks = List.copyOf(failedChecks);
    }
}
