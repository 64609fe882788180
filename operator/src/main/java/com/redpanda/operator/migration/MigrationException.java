package com.redpanda.operator.migration;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Failures of one migration pass, each attributed to the step that raised it
 */
public class MigrationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public static class StepFailure {

        private final String step;
        private final Exception cause;

        public StepFailure(String step, Exception cause) {
            this.step = step;
            this.cause = cause;
        }

        public String getStep() {
            return step;
        }

        public Exception getCause() {
            return cause;
        }

        @Override
        public String toString() {
            return step + ": " + cause.getMessage();
        }
    }

    private final transient List<StepFailure> failures;

    public MigrationException(String target, List<StepFailure> failures) {
        super(String.format("migration of %s failed: %s", target,
                failures.stream().map(StepFailure::toString).collect(Collectors.joining("; "))));
        this.failures = Collections.unmodifiableList(failures);
        failures.forEach(f -> addSuppressed(f.getCause()));
    }

    public List<StepFailure> getFailures() {
        return failures;
    }
}
