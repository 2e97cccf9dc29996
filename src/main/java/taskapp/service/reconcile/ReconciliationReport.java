package taskapp.service.reconcile;

import java.util.List;

/**
 * Outcome of applying a reconciliation plan.
 *
 * @param applied steps that completed
 * @param failed  steps that still failed after every attempt
 */
public record ReconciliationReport(List<ReconciliationStep> applied, List<Failure> failed) {

    public ReconciliationReport {
        applied = List.copyOf(applied);
        failed = List.copyOf(failed);
    }

    public static ReconciliationReport empty() {
        return new ReconciliationReport(List.of(), List.of());
    }

    /**
     * @return {@code true} if every step completed
     */
    public boolean clean() {
        return failed.isEmpty();
    }

    /**
     * @param step     the step that failed
     * @param attempts how many times it was tried
     * @param error    message of the last failure
     */
    public record Failure(ReconciliationStep step, int attempts, String error) {
    }
}
