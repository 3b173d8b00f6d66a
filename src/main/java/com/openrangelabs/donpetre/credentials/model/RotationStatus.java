package com.openrangelabs.donpetre.credentials.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Rotation state of a key. {@code history} is append-only.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RotationStatus {

    @Builder.Default
    private RotationState state = RotationState.NONE;
    private Instant lastRotation;
    private Instant nextScheduledRotation;

    @Builder.Default
    private List<RotationHistoryEntry> history = new ArrayList<>();

    public static RotationStatus none() {
        return RotationStatus.builder().build();
    }

    public RotationStatus append(RotationHistoryEntry entry) {
        List<RotationHistoryEntry> copy = new ArrayList<>(history == null ? List.of() : history);
        copy.add(entry);
        return toBuilder().history(copy).build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RotationHistoryEntry {
        private Instant timestamp;
        private boolean success;
        private String reason;
        private String oldKeyId;
        private String newKeyId;
    }
}
