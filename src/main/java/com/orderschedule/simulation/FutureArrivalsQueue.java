package com.orderschedule.simulation;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Quantities not yet available to satisfy demand, keyed by arrival date.
 * Owned by a single simulation run; not thread-safe.
 */
final class FutureArrivalsQueue {

    private final NavigableMap<LocalDate, List<PendingArrival>> byDate = new TreeMap<>();

    void seed(double quantity, LocalDate arrivalDate) {
        if (quantity > 0.0 && arrivalDate != null) {
            add(new PendingArrival(arrivalDate, quantity, PendingArrival.Source.IN_TRANSIT));
        }
    }

    void schedule(double quantity, LocalDate arrivalDate) {
        add(new PendingArrival(arrivalDate, quantity, PendingArrival.Source.ORDER));
    }

    /**
     * Removes and returns every entry arriving on {@code date}, in insertion order.
     * A second call for the same date returns an empty list.
     */
    List<PendingArrival> matureOn(LocalDate date) {
        List<PendingArrival> matured = byDate.remove(date);
        return matured != null ? matured : List.of();
    }

    boolean hasPendingAfter(LocalDate date) {
        return byDate.higherKey(date) != null;
    }

    private void add(PendingArrival arrival) {
        byDate.computeIfAbsent(arrival.arrivalDate(), d -> new ArrayList<>()).add(arrival);
    }
}
