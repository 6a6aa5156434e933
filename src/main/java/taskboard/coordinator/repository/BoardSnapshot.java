package taskboard.coordinator.repository;

import taskboard.coordinator.model.Board;
import taskboard.coordinator.model.Task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered task list of one board as read from storage.
 * Mutations inside a locked section are tracked so that only changed
 * boards get written back.
 */
public final class BoardSnapshot {

    private final Board board;
    private final List<Task> tasks;
    private int additions;
    private int removals;
    private int replacements;

    public BoardSnapshot(Board board, List<Task> tasks) {
        this.board = board;
        this.tasks = new ArrayList<>(tasks);
    }

    public static BoardSnapshot empty(Board board) {
        return new BoardSnapshot(board, List.of());
    }

    public Board board() {
        return board;
    }

    public List<Task> tasks() {
        return Collections.unmodifiableList(tasks);
    }

    public int size() {
        return tasks.size();
    }

    public Optional<Task> find(String taskId) {
        return tasks.stream().filter(t -> t.id().equals(taskId)).findFirst();
    }

    public boolean contains(String taskId) {
        return find(taskId).isPresent();
    }

    /** Append a task at the end of the board */
    public void add(Task task) {
        if (contains(task.id())) {
            throw new IllegalStateException("Task " + task.id() + " already on board " + board);
        }
        tasks.add(task);
        additions++;
    }

    /** Replace the task with the same id, keeping its position */
    public void replace(Task task) {
        for (int i = 0; i < tasks.size(); i++) {
            if (tasks.get(i).id().equals(task.id())) {
                tasks.set(i, task);
                replacements++;
                return;
            }
        }
        throw new IllegalStateException("Task " + task.id() + " not on board " + board);
    }

    public Optional<Task> remove(String taskId) {
        for (int i = 0; i < tasks.size(); i++) {
            if (tasks.get(i).id().equals(taskId)) {
                removals++;
                return Optional.of(tasks.remove(i));
            }
        }
        return Optional.empty();
    }

    public boolean isDirty() {
        return additions + removals + replacements > 0;
    }

    /** Check if tasks were added to this board since it was read */
    public boolean hasAdditions() {
        return additions > 0;
    }

    @Override
    public String toString() {
        return "BoardSnapshot{board=" + board + ", tasks=" + tasks.size() + ", dirty=" + isDirty() + "}";
    }
}
