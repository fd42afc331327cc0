package com.company.energyanalytics.controller;

import com.company.energyanalytics.config.AnalyticsProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Health check endpoints")
@RequiredArgsConstructor
public class HealthController {

    private final AnalyticsProperties properties;

    @GetMapping
    @Operation(summary = "Health check", description = "Liveness plus the analysis timezone and business calendar in effect")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now());
        response.put("service", "energy-analytics-service");
        response.put("timezone", properties.getTimezone());
        response.put("businessDays", properties.businessHoursCalendar().getDays().size());

        return ResponseEntity.ok(response);
    }
}
