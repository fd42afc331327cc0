package com.company.energyanalytics.controller;

import com.company.energyanalytics.domain.*;
import com.company.energyanalytics.dto.request.AnalysisRequest;
import com.company.energyanalytics.dto.request.ChannelReadingsRequest;
import com.company.energyanalytics.dto.request.ReadingDto;
import com.company.energyanalytics.dto.response.AnalysisReportResponse;
import com.company.energyanalytics.service.ReportAssemblyService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/analysis")
@Tag(name = "Analysis", description = "Weekly energy analytics reports")
@RequiredArgsConstructor
@Slf4j
public class AnalysisController {

    private final ReportAssemblyService reportAssemblyService;
    private final MeterRegistry meterRegistry;

    @PostMapping("/reports")
    @Operation(summary = "Generate a site report",
            description = "Runs sensor health, after-hours waste, anomaly and spike analysis over the supplied readings")
    public ResponseEntity<AnalysisReportResponse> generateReport(@Valid @RequestBody AnalysisRequest request) {

        log.info("Report request for organization {} with {} channel(s)",
                request.getOrganizationId(), request.getChannels().size());

        meterRegistry.counter("api.analysis.reports.requests",
                "organization", request.getOrganizationId()
        ).increment();

        AnalysisReportResponse report = reportAssemblyService.generateReport(toSiteAnalysisRequest(request));

        return ResponseEntity.ok(report);
    }

    private SiteAnalysisRequest toSiteAnalysisRequest(AnalysisRequest request) {
        return SiteAnalysisRequest.builder()
                .organizationId(request.getOrganizationId())
                .organizationName(request.getOrganizationName())
                .reportWindow(toWindow(request.getReportStart(), request.getReportEnd()))
                .baselineWindow(toWindow(request.getBaselineStart(), request.getBaselineEnd()))
                .referenceTime(request.getReferenceTime())
                .channels(request.getChannels().stream()
                        .map(c -> toChannelData(c, request.getOrganizationId()))
                        .collect(Collectors.toList()))
                .build();
    }

    private ChannelData toChannelData(ChannelReadingsRequest request, String organizationId) {
        return ChannelData.builder()
                .channel(Channel.builder()
                        .channelId(request.getChannelId())
                        .channelName(request.getChannelName())
                        .organizationId(organizationId)
                        .siteTotal(request.isSiteTotal())
                        .build())
                .resolutionSeconds(request.getResolutionSeconds())
                .readings(toReadings(request.getReadings()))
                .baselineReadings(toReadings(request.getBaselineReadings()))
                .build();
    }

    private List<Reading> toReadings(List<ReadingDto> readings) {
        if (readings == null) {
            return List.of();
        }
        return readings.stream()
                .map(r -> Reading.builder()
                        .timestamp(r.getTimestamp())
                        .powerKw(r.getPowerKw())
                        .energyKwh(r.getEnergyKwh())
                        .voltage(r.getVoltage())
                        .current(r.getCurrent())
                        .powerFactor(r.getPowerFactor())
                        .temperature(r.getTemperature())
                        .build())
                .collect(Collectors.toList());
    }

    // Both bounds omitted means "derive"; a single bound is passed on and rejected by validation
    private static AnalysisWindow toWindow(Instant start, Instant end) {
        if (start == null && end == null) {
            return null;
        }
        return AnalysisWindow.of(start, end);
    }
}
