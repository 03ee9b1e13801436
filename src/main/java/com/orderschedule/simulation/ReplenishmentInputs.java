package com.orderschedule.simulation;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Everything one simulation run needs. Identity fields are not used by the algorithm and are
 * copied onto every emitted event.
 */
@Value
@Builder(toBuilder = true)
public class ReplenishmentInputs {

    String productTitle;
    String variantTitle;
    String sku;

    double dailyDemand;
    int leadTimeDays;
    int shippingTimeDays;
    int safetyStockDays;
    double startingInventory;
    LocalDate startDate;

    @Builder.Default
    double inTransitQuantity = 0.0;

    LocalDate inTransitArrivalDate;
}
