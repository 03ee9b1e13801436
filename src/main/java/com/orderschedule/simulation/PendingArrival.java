package com.orderschedule.simulation;

import java.time.LocalDate;

public record PendingArrival(LocalDate arrivalDate, double quantity, Source source) {

    public enum Source {
        /** Goods already shipped before the run started. */
        IN_TRANSIT,
        /** Goods ordered during the run. */
        ORDER
    }
}
