package com.orderschedule.simulation;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Steps one calendar day at a time from the start date over a fixed horizon. Each day matures
 * pending arrivals, debits demand, then checks the reorder point. At most one order is
 * outstanding at any time.
 */
final class InventorySimulator {

    static final int HORIZON_DAYS = 365;

    private final ReplenishmentParameters parameters;
    private final double dailyDemand;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final FutureArrivalsQueue arrivals = new FutureArrivalsQueue();
    private final List<PlannedEvent> emitted = new ArrayList<>();

    private double availableInventory;
    private int ordersPlaced;

    InventorySimulator(ReplenishmentInputs inputs, ReplenishmentParameters parameters) {
        this.parameters = parameters;
        this.dailyDemand = inputs.getDailyDemand();
        this.startDate = inputs.getStartDate();
        this.endDate = startDate.plusDays(HORIZON_DAYS);
        this.availableInventory = inputs.getStartingInventory();
        arrivals.seed(inputs.getInTransitQuantity(), inputs.getInTransitArrivalDate());
    }

    List<PlannedEvent> run() {
        for (LocalDate day = startDate; day.isBefore(endDate); day = day.plusDays(1)) {
            receive(day);
            availableInventory -= dailyDemand;
            if (shouldReorder(day)) {
                placeOrder(day);
            }
        }
        return emitted;
    }

    private void receive(LocalDate day) {
        for (PendingArrival arrival : arrivals.matureOn(day)) {
            availableInventory += arrival.quantity();
            // order arrivals are already on the schedule through their ORDER_PLACED event
            if (arrival.source() == PendingArrival.Source.IN_TRANSIT) {
                emitted.add(PlannedEvent.inTransitArrival(day, arrival.quantity()));
            }
        }
    }

    private boolean shouldReorder(LocalDate day) {
        if (availableInventory > parameters.reorderPoint() || arrivals.hasPendingAfter(day)) {
            return false;
        }
        // with zero demand nothing is ever consumed, so a second empty order changes nothing
        return dailyDemand > 0.0 || ordersPlaced == 0;
    }

    private void placeOrder(LocalDate day) {
        LocalDate arrivalDate = day.plusDays(parameters.totalLeadTime());
        if (!arrivalDate.isBefore(endDate)) {
            return;
        }
        emitted.add(PlannedEvent.orderPlaced(day, arrivalDate, parameters.orderQuantity()));
        arrivals.schedule(parameters.orderQuantity(), arrivalDate);
        ordersPlaced++;
        if (arrivalDate.equals(day)) {
            // zero lead time: today's maturity step has already run
            receive(day);
        }
    }
}
