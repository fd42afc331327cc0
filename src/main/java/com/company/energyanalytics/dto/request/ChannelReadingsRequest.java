package com.company.energyanalytics.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Readings of one channel for the report window and, optionally, the baseline window
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelReadingsRequest {
    @NotBlank(message = "Channel ID is required")
    private String channelId;

    private String channelName;

    // Site totals use the higher absolute spike floor
    private boolean siteTotal;

    @NotNull(message = "Resolution is required")
    @Positive(message = "Resolution must be positive")
    private Long resolutionSeconds;

    @Valid
    @Builder.Default
    private List<ReadingDto> readings = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<ReadingDto> baselineReadings = new ArrayList<>();
}
