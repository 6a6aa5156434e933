package taskboard.coordinator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import taskboard.coordinator.error.BoardCorruptedException;
import taskboard.coordinator.model.Board;
import taskboard.coordinator.model.Task;
import taskboard.coordinator.model.TaskRecords;
import taskboard.coordinator.validation.SchemaValidator;
import taskboard.coordinator.validation.Violation;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON encoding of a board file: a pretty-printed array of task records.
 * Decoding is strict; anything that is not a valid board is corruption.
 */
public class BoardCodec {

    private static final TypeReference<Map<String, Object>> RECORD = new TypeReference<>() {
    };

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final SchemaValidator validator;

    public BoardCodec(SchemaValidator validator) {
        this.validator = validator;
    }

    public byte[] encode(List<Task> tasks) throws JsonProcessingException {
        List<Map<String, Object>> records = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            records.add(TaskRecords.toRecord(task));
        }
        return mapper.writeValueAsBytes(records);
    }

    /**
     * Decode a board artifact.
     *
     * @param source name of the artifact, used in error messages
     * @throws BoardCorruptedException if the content is not a valid board
     */
    public List<Task> decode(Board board, byte[] content, String source) {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new BoardCorruptedException(board, "Board " + board + " (" + source + ") is not valid JSON: "
                    + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new BoardCorruptedException(board, "Board " + board + " (" + source + ") is unreadable: "
                    + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new BoardCorruptedException(board, "Board " + board + " (" + source + ") is empty");
        }
        if (!root.isArray()) {
            throw new BoardCorruptedException(board, "Board " + board + " (" + source
                    + ") must be a JSON array, got " + root.getNodeType());
        }

        List<Task> tasks = new ArrayList<>(root.size());
        Set<String> seen = new HashSet<>();
        int index = 0;
        for (JsonNode node : root) {
            if (!node.isObject()) {
                throw corrupted(board, source, index, "expected object, got " + node.getNodeType());
            }
            Map<String, Object> record = mapper.convertValue(node, RECORD);
            List<Violation> violations = validator.checkStored(record);
            if (!violations.isEmpty()) {
                throw corrupted(board, source, index, violations.toString());
            }
            Task task;
            try {
                task = TaskRecords.fromRecord(record);
            } catch (IllegalArgumentException e) {
                throw corrupted(board, source, index, e.getMessage());
            }
            violations = validator.checkInvariants(task);
            if (!violations.isEmpty()) {
                throw corrupted(board, source, index, "task " + task.id() + " " + violations);
            }
            if (task.board() != board) {
                throw corrupted(board, source, index, "task " + task.id() + " in status " + task.status()
                        + " belongs on board " + task.board());
            }
            if (!seen.add(task.id())) {
                throw corrupted(board, source, index, "duplicate task id " + task.id());
            }
            tasks.add(task);
            index++;
        }
        return tasks;
    }

    private static BoardCorruptedException corrupted(Board board, String source, int index, String reason) {
        return new BoardCorruptedException(board, "Board " + board + " (" + source + ") record " + index + ": " + reason);
    }
}
