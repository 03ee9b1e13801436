package com.orderschedule.simulation;

import java.time.LocalDate;

/** An event as emitted by the stepper, before identity fields are attached. */
record PlannedEvent(EventKind eventKind, LocalDate orderDate, LocalDate arrivalDate, double quantity) {

    static PlannedEvent inTransitArrival(LocalDate arrivalDate, double quantity) {
        return new PlannedEvent(EventKind.IN_TRANSIT_ARRIVAL, null, arrivalDate, quantity);
    }

    static PlannedEvent orderPlaced(LocalDate orderDate, LocalDate arrivalDate, double quantity) {
        return new PlannedEvent(EventKind.ORDER_PLACED, orderDate, arrivalDate, quantity);
    }
}
