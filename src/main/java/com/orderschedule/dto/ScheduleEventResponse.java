package com.orderschedule.dto;

import com.orderschedule.simulation.EventKind;
import com.orderschedule.simulation.ScheduleEvent;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class ScheduleEventResponse {
    String productTitle;
    String variantTitle;
    String sku;
    EventKind eventKind;
    String event;
    LocalDate orderDate;
    LocalDate arrivalDate;
    double quantity;
    boolean completed;

    public static ScheduleEventResponse from(ScheduleEvent event) {
        return ScheduleEventResponse.builder()
            .productTitle(event.getProductTitle())
            .variantTitle(event.getVariantTitle())
            .sku(event.getSku())
            .eventKind(event.getEventKind())
            .event(event.getEventKind().label())
            .orderDate(event.getOrderDate())
            .arrivalDate(event.getArrivalDate())
            .quantity(event.getQuantity())
            .completed(event.isCompleted())
            .build();
    }
}
