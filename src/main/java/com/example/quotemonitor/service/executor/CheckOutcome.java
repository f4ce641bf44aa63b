package com.example.quotemonitor.service.executor;

import com.example.quotemonitor.domain.PriceMovement;
import com.example.quotemonitor.domain.Trigger;
import com.example.quotemonitor.notification.DispatchReport;
import lombok.Builder;
import lombok.Value;

import java.util.OptionalDouble;

/**
 * Result of one successful quote check.
 */
@Value
@Builder
public class CheckOutcome {

    Trigger trigger;

    PriceMovement movement;

    /**
     * Value observed before this check; empty on the first check after startup
     */
    @Builder.Default
    OptionalDouble previousValue = OptionalDouble.empty();

    double currentValue;

    String message;

    @Builder.Default
    DispatchReport dispatchReport = DispatchReport.empty();

    /**
     * First observation after startup: the store was only seeded
     */
    public boolean isSeeded() {
        return previousValue.isEmpty();
    }

    public boolean isNotified() {
        return movement.isChange();
    }

    /**
     * Classification used for logs and metric tags
     */
    public String getOutcomeName() {
        return isSeeded() ? "seeded" : movement.name().toLowerCase();
    }
}
