package com.company.energyanalytics.domain;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;

/**
 * A monitored point (submeter, piece of equipment or the site total).
 */
@Value
@Builder
public class Channel implements Serializable {
    private static final long serialVersionUID = 1L;

    String channelId;
    String channelName;
    String organizationId;

    // Site totals get the higher absolute spike floor
    boolean siteTotal;

    public String getDisplayName() {
        return channelName != null ? channelName : channelId;
    }
}
