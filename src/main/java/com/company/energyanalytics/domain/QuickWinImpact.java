package com.company.energyanalytics.domain;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;

@Value
@Builder
public class QuickWinImpact implements Serializable {
    private static final long serialVersionUID = 1L;

    double weeklyKwh;
    double weeklyCost;
    double annualCost;

    // Qualitative impact for findings without an energy figure
    String note;

    public static QuickWinImpact ofWeekly(double weeklyKwh, double costPerKwh, String note) {
        double weeklyCost = weeklyKwh * costPerKwh;
        return QuickWinImpact.builder()
                .weeklyKwh(weeklyKwh)
                .weeklyCost(weeklyCost)
                .annualCost(weeklyCost * 52)
                .note(note)
                .build();
    }

    public static QuickWinImpact qualitative(String note) {
        return QuickWinImpact.builder().note(note).build();
    }
}
