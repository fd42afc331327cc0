package com.company.energyanalytics.domain;

import com.company.energyanalytics.domain.enums.IssueType;
import lombok.Builder;
import lombok.Value;

import java.io.Serializable;

@Value
@Builder
public class IssueSummary implements Serializable {
    private static final long serialVersionUID = 1L;

    IssueType type;
    int count;
    int affectedChannels;
    String description;
}
