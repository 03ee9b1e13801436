package com.orderschedule.simulation;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * One row of a purchase-order schedule. Only {@code completed} changes after the schedule is
 * produced, and only at the caller's request; the simulation never reads it.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class ScheduleEvent {

    private final String productTitle;
    private final String variantTitle;
    private final String sku;
    private final EventKind eventKind;
    /** Null for in-transit arrivals. */
    private final LocalDate orderDate;
    private final LocalDate arrivalDate;
    private final double quantity;

    @Setter
    @EqualsAndHashCode.Exclude
    private boolean completed;

    public EventKey key() {
        return new EventKey(sku, arrivalDate, eventKind);
    }
}
