package hrl.java.reconcile;

import java.util.List;

/**
 * Outcome of one change batch.
 *
 * @param processedCount events in the batch
 * @param snapshotsUpdated usage window records written
 * @param refillsWritten bucket catch-up refills that landed
 * @param errors one message per failed item; the rest of the batch still ran
 */
public record ProcessResult(int processedCount, int snapshotsUpdated, int refillsWritten, List<String> errors) {
    public ProcessResult {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
