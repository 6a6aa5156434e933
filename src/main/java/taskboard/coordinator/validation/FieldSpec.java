package taskboard.coordinator.validation;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Declaration of one record field: name, type, required flag and, for
 * enums, the legal values.
 */
public record FieldSpec(
        String name,
        FieldType type,
        boolean required,
        boolean nonBlank,
        Set<String> allowedValues) {

    public FieldSpec {
        allowedValues = allowedValues == null ? Set.of() : Set.copyOf(allowedValues);
    }

    public static FieldSpec required(String name, FieldType type) {
        return new FieldSpec(name, type, true, type == FieldType.STRING, Set.of());
    }

    public static FieldSpec optional(String name, FieldType type) {
        return new FieldSpec(name, type, false, false, Set.of());
    }

    public static <E extends Enum<E>> FieldSpec enumOf(String name, boolean required, Class<E> type) {
        Set<String> values = Arrays.stream(type.getEnumConstants())
                .map(Enum::name)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return new FieldSpec(name, FieldType.ENUM, required, false, values);
    }

    /**
     * Check this field in a record.
     *
     * @return problem description, or null when the field conforms
     */
    public String check(Object value) {
        if (value == null) {
            return required ? "is required" : null;
        }
        return type.check(value, this);
    }
}
