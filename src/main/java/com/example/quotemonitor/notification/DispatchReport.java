package com.example.quotemonitor.notification;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Per-channel outcome of one notification burst
 */
@Value
@Builder
public class DispatchReport {

    @Singular("delivered")
    List<String> deliveredChannels;

    /**
     * Channel name to error message
     */
    @Singular("failed")
    Map<String, String> failedChannels;

    public static DispatchReport empty() {
        return DispatchReport.builder().build();
    }

    public boolean isFullyDelivered() {
        return failedChannels.isEmpty();
    }
}
