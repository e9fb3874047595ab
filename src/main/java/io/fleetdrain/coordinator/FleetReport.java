package io.fleetdrain.coordinator;

import java.util.List;

public record FleetReport(String operation, List<WorkerReport> workers, long elapsedMs) {
    public static final int EXIT_OK = 0;
    public static final int EXIT_HARD_FAILURE = 1;
    public static final int EXIT_PARTIAL_FAILURE = 3;

    public FleetReport {
        workers = List.copyOf(workers);
    }

    public long count(WorkerReport.Severity severity) {
        return workers.stream().filter(w -> w.severity() == severity).count();
    }

    public WorkerReport.Severity worstSeverity() {
        WorkerReport.Severity worst = WorkerReport.Severity.OK;
        for (WorkerReport report : workers) {
            if (report.severity().compareTo(worst) > 0) {
                worst = report.severity();
            }
        }
        return worst;
    }

    public CoordinationError coordinationError() {
        return worstSeverity() == WorkerReport.Severity.OK ? null : CoordinationError.PARTIAL_FLEET_FAILURE;
    }

    public int exitCode() {
        return switch (worstSeverity()) {
            case OK -> EXIT_OK;
            case FAILED -> EXIT_PARTIAL_FAILURE;
            case HARD -> EXIT_HARD_FAILURE;
        };
    }

    public String summaryLine() {
        return String.format("%s: %d worker(s), %d ok, %d failed, %d error(s) in %ds%s",
                operation,
                workers.size(),
                count(WorkerReport.Severity.OK),
                count(WorkerReport.Severity.FAILED),
                count(WorkerReport.Severity.HARD),
                elapsedMs / 1_000L,
                coordinationError() == null ? "" : " [" + coordinationError() + "]");
    }
}
