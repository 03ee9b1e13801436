package com.orderschedule.simulation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

final class ScheduleAssembler {

    private ScheduleAssembler() {
    }

    static List<ScheduleEvent> assemble(ReplenishmentInputs inputs, List<PlannedEvent> emitted) {
        // List.sort is stable: same-day events keep emission order
        List<ScheduleEvent> events = new ArrayList<>(emitted.stream()
            .map(event -> ScheduleEvent.builder()
                .productTitle(inputs.getProductTitle())
                .variantTitle(inputs.getVariantTitle())
                .sku(inputs.getSku())
                .eventKind(event.eventKind())
                .orderDate(event.orderDate())
                .arrivalDate(event.arrivalDate())
                .quantity(event.quantity())
                .completed(false)
                .build())
            .toList());
        events.sort(Comparator.comparing(ScheduleEvent::getArrivalDate));
        return List.copyOf(events);
    }
}
