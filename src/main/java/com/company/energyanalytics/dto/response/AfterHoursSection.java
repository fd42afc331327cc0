package com.company.energyanalytics.dto.response;

import com.company.energyanalytics.domain.WasteWindow;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AfterHoursSection {
    private double totalExcessKwh;
    private double totalExcessCost;
    private double estimatedAnnualCost;

    // Highest excess first
    private List<WasteWindow> topMeters;
}
