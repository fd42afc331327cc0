package com.company.energyanalytics.domain;

import com.company.energyanalytics.domain.enums.Priority;
import com.company.energyanalytics.domain.enums.QuickWinType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.io.Serializable;
import java.util.List;

@Value
@Builder
public class QuickWin implements Serializable {
    private static final long serialVersionUID = 1L;

    QuickWinType type;

    // Null for site-level recommendations
    String channelId;

    String title;
    String description;
    Priority priority;
    QuickWinImpact impact;

    @Singular
    List<String> recommendations;

    String owner;
    String effort;
    String confidence;
}
