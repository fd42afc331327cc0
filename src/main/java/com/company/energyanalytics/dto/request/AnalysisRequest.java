package com.company.energyanalytics.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Request to generate a site report. Omitted windows are derived: the report window
 * defaults to the last complete week and the baseline to the weeks preceding it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {
    @NotBlank(message = "Organization ID is required")
    private String organizationId;

    private String organizationName;

    private Instant reportStart;
    private Instant reportEnd;

    // Optional fields
    private Instant baselineStart;
    private Instant baselineEnd;
    private Instant referenceTime;

    @NotEmpty(message = "At least one channel is required")
    @Valid
    private List<ChannelReadingsRequest> channels;
}
