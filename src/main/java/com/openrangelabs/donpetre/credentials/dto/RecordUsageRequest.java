package com.openrangelabs.donpetre.credentials.dto;

import com.openrangelabs.donpetre.credentials.model.UsageRecord;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One usage sample reported by a caller of the key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Usage sample to fold into a key's statistics")
public class RecordUsageRequest {

    @Min(value = 1, message = "Requests must be at least 1")
    @Builder.Default
    private long requests = 1;

    @Min(value = 0, message = "Tokens cannot be negative")
    private long tokens;

    @Min(value = 0, message = "Input tokens cannot be negative")
    private long inputTokens;

    @Min(value = 0, message = "Output tokens cannot be negative")
    private long outputTokens;

    @DecimalMin(value = "0", message = "Cost cannot be negative")
    private BigDecimal cost;

    @PositiveOrZero(message = "Response time cannot be negative")
    @Schema(description = "Response time in milliseconds", example = "420")
    private double responseTime;

    @Builder.Default
    private boolean success = true;

    public UsageRecord toRecord() {
        return UsageRecord.builder()
                .requests(requests)
                .tokens(tokens)
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .cost(cost != null ? cost : BigDecimal.ZERO)
                .responseTime(responseTime)
                .success(success)
                .build();
    }
}
