package com.company.energyanalytics.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReadingDto {
    @NotNull(message = "Reading timestamp is required")
    private Instant timestamp;

    private Double powerKw;
    private Double energyKwh;

    // Optional electrical and environmental values
    private Double voltage;
    private Double current;
    private Double powerFactor;
    private Double temperature;
}
