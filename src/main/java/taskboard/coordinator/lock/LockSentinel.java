package taskboard.coordinator.lock;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Content of a lock sentinel file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LockSentinel(
        @JsonProperty("holder_id") String holderId,
        @JsonProperty("acquired_at") String acquiredAt,
        @JsonProperty("token") String token) {

    @JsonIgnore
    public Optional<Instant> acquiredAtInstant() {
        if (acquiredAt == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(acquiredAt));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
