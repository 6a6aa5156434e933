package taskboard.coordinator.service;

import taskboard.coordinator.model.Board;
import taskboard.coordinator.validation.Violation;

import java.util.List;

/**
 * Outcome of one reconciliation pass.
 *
 * @param repairs             duplicate copies that were removed
 * @param integrityViolations dangling dependencies or cycles found across boards, reported only
 */
public record ReconcileReport(List<Repair> repairs, List<Violation> integrityViolations) {

    public ReconcileReport {
        repairs = List.copyOf(repairs);
        integrityViolations = List.copyOf(integrityViolations);
    }

    /**
     * One duplicate resolved.
     *
     * @param taskId    the duplicated task
     * @param keptOn    board whose copy survived
     * @param removedOn boards whose copies were dropped
     */
    public record Repair(String taskId, Board keptOn, List<Board> removedOn) {
    }

    public boolean isClean() {
        return repairs.isEmpty() && integrityViolations.isEmpty();
    }
}
