package hrl.java.reconcile;

import hrl.core.model.WindowType;

import java.util.List;

/**
 * Reconciliation worker settings.
 *
 * @param windows usage windows every delta is aggregated into
 * @param retentionDays lifetime of a usage snapshot record
 */
public record WorkerConfig(List<WindowType> windows, int retentionDays) {
    public WorkerConfig {
        if (windows == null || windows.isEmpty()) {
            throw new IllegalArgumentException("windows cannot be empty");
        }
        if (retentionDays <= 0) {
            throw new IllegalArgumentException("retentionDays must be > 0");
        }
        windows = List.copyOf(windows);
    }

    public static WorkerConfig defaults() {
        return new WorkerConfig(List.of(WindowType.HOURLY, WindowType.DAILY), 90);
    }

    public WorkerConfig withWindows(WindowType... types) {
        return new WorkerConfig(List.of(types), retentionDays);
    }

    public WorkerConfig withRetentionDays(int days) {
        return new WorkerConfig(windows, days);
    }
}
