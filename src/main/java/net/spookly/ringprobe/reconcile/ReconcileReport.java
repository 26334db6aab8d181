package net.spookly.ringprobe.reconcile;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Outcome of one reconciliation cycle.
 */
@Value
@Accessors(fluent = true)
public class ReconcileReport {
    Instant startedAt;
    long durationMs;
    boolean directorySynced;
    String error;
    int nodes;
    int added;
    int removed;
    int opened;
    int openFailed;
    int checked;
    int demoted;
    boolean persisted;

    static ReconcileReport directoryFailed(Instant startedAt,
                                           long durationMs,
                                           String error,
                                           int nodes,
                                           int opened,
                                           int openFailed,
                                           int checked,
                                           int demoted) {
        return new ReconcileReport(startedAt, durationMs, false, error, nodes, 0, 0, opened, openFailed, checked,
                demoted, false);
    }
}
