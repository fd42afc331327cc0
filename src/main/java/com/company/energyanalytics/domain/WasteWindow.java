package com.company.energyanalytics.domain;

import com.company.energyanalytics.domain.enums.BaselineSource;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.io.Serializable;
import java.util.List;

/**
 * After-hours consumption above the idle baseline for one channel over the report window.
 */
@Value
@Builder
public class WasteWindow implements Serializable {
    private static final long serialVersionUID = 1L;

    String channelId;
    String channelName;

    double baselineKw;
    BaselineSource baselineSource;

    double excessKwh;
    double excessCost;
    double annualizedCost;

    double thisWeekAvgPowerKw;
    double maxPowerKw;
    double minPowerKw;
    double totalAfterHoursKwh;
    int afterHoursIntervals;
    double percentOfTotal;

    @Singular
    List<ExcessInterval> excessIntervals;
}
