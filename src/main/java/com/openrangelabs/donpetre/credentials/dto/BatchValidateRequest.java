package com.openrangelabs.donpetre.credentials.dto;

import com.openrangelabs.donpetre.credentials.validation.BatchValidationInput;
import com.openrangelabs.donpetre.credentials.validation.BatchValidationOptions;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Batch validation request. Results come back in entry order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Validates many keys in bounded-concurrency batches")
public class BatchValidateRequest {

    @Valid
    @NotNull(message = "Entries are required")
    @Size(max = 1000, message = "At most 1000 entries per request")
    private List<Entry> entries;

    @Min(1)
    @Max(100)
    private Integer batchSize;

    @Min(1)
    @Max(20)
    private Integer concurrency;

    private boolean includeLiveValidation;

    private boolean failFast;

    @Min(100)
    @Max(60000)
    private Long timeoutMs;

    public List<BatchValidationInput> toInputs() {
        return entries.stream()
                .map(entry -> new BatchValidationInput(entry.getId(), entry.getKey(), entry.getProvider()))
                .collect(Collectors.toList());
    }

    public BatchValidationOptions toOptions(BatchValidationOptions defaults) {
        BatchValidationOptions.BatchValidationOptionsBuilder builder = defaults.toBuilder()
                .includeLiveValidation(includeLiveValidation)
                .failFast(failFast);
        if (batchSize != null) {
            builder.batchSize(batchSize);
        }
        if (concurrency != null) {
            builder.concurrency(concurrency);
        }
        if (timeoutMs != null) {
            builder.timeout(Duration.ofMillis(timeoutMs));
        }
        return builder.build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {

        @NotBlank(message = "Entry id is required")
        private String id;

        @NotBlank(message = "Entry key is required")
        private String key;

        private String provider;

        @Override
        public String toString() {
            return "Entry(id=" + id + ", provider=" + provider + ")";
        }
    }
}
