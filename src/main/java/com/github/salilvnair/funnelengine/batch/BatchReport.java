package com.github.salilvnair.funnelengine.batch;

import java.util.List;

/**
 * Summary of one batch run. {@code affected} counts items whose state the run changed;
 * a failure on one item never stops the others.
 */
public record BatchReport(String batch, int scanned, int affected, List<BatchItemError> errors, boolean interrupted) {

    public BatchReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
