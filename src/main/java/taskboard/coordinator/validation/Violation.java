package taskboard.coordinator.validation;

/**
 * A single schema or integrity problem found in a task record.
 *
 * @param kind    category, decides which exception the violation surfaces as
 * @param field   record field concerned, null for record-level problems
 * @param message precise reason
 */
public record Violation(Kind kind, String field, String message) {

    public enum Kind {
        /** Missing field, wrong type, illegal enum value, immutable field */
        SCHEMA,
        /** task_id already present on a board */
        DUPLICATE,
        /** dependency id unknown on every board */
        UNRESOLVED_DEPENDENCY,
        /** dependency graph would contain a cycle */
        CYCLE,
        /** stored record breaks a lifecycle invariant */
        INVARIANT
    }

    public static Violation schema(String field, String message) {
        return new Violation(Kind.SCHEMA, field, message);
    }

    @Override
    public String toString() {
        return field != null ? field + ": " + message : message;
    }
}
