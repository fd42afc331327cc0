package com.company.energyanalytics.domain;

import com.company.energyanalytics.domain.enums.IssueType;
import com.company.energyanalytics.domain.enums.Severity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class HealthIssue implements Serializable {
    private static final long serialVersionUID = 1L;

    IssueType type;
    Severity severity;
    String channelId;
    String channelName;
    String description;

    // Point-in-time findings (stale) use detectedAt, span findings use the window
    Instant detectedAt;
    Instant windowStart;
    Instant windowEnd;

    @Singular
    Map<String, Double> metrics;
}
