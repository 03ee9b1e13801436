package com.orderschedule.simulation;

import com.orderschedule.exception.InvalidParameterException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Entry point of the schedule engine. Stateless: every call owns its own arrivals queue and
 * event list, so independent items may be simulated concurrently.
 */
@Slf4j
@Component
public class ReplenishmentScheduler {

    /**
     * Produces the purchase-order schedule for the next 365 days, sorted by arrival date.
     * An empty list means no order is needed within the horizon.
     *
     * @throws InvalidParameterException if any count or rate is negative, the start date is
     *         missing, or an in-transit quantity has no usable arrival date
     */
    public List<ScheduleEvent> simulateReplenishment(ReplenishmentInputs inputs) {
        validate(inputs);
        ReplenishmentParameters parameters = computeParameters(inputs);
        List<PlannedEvent> emitted = new InventorySimulator(inputs, parameters).run();
        List<ScheduleEvent> schedule = ScheduleAssembler.assemble(inputs, emitted);
        log.debug("Schedule simulated | sku={} | start={} | reorderPoint={} | events={}",
                  inputs.getSku(), inputs.getStartDate(), parameters.reorderPoint(), schedule.size());
        return schedule;
    }

    public ReplenishmentParameters computeParameters(ReplenishmentInputs inputs) {
        return ParameterCalculator.computeParameters(
            inputs.getDailyDemand(), inputs.getLeadTimeDays(),
            inputs.getShippingTimeDays(), inputs.getSafetyStockDays());
    }

    private void validate(ReplenishmentInputs inputs) {
        if (inputs == null) {
            throw new InvalidParameterException("replenishment inputs are required");
        }
        if (inputs.getStartDate() == null) {
            throw new InvalidParameterException("startDate is required");
        }
        if (!Double.isFinite(inputs.getStartingInventory())) {
            throw new InvalidParameterException("startingInventory must be a finite value");
        }
        double inTransit = inputs.getInTransitQuantity();
        if (!Double.isFinite(inTransit) || inTransit < 0.0) {
            throw new InvalidParameterException("inTransitQuantity must be a finite value >= 0, was " + inTransit);
        }
        if (inTransit > 0.0) {
            if (inputs.getInTransitArrivalDate() == null) {
                throw new InvalidParameterException("inTransitArrivalDate is required when inTransitQuantity > 0");
            }
            if (inputs.getInTransitArrivalDate().isBefore(inputs.getStartDate())) {
                throw new InvalidParameterException("inTransitArrivalDate " + inputs.getInTransitArrivalDate()
                    + " is before startDate " + inputs.getStartDate());
            }
        }
    }
}
