package com.orderschedule.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class SimulationRequest {

    String productTitle;
    String variantTitle;
    String sku;

    @DecimalMin(value = "0.0", message = "dailyDemand must be >= 0")
    double dailyDemand;

    @Min(value = 0, message = "leadTimeDays must be >= 0")
    @Builder.Default
    int leadTimeDays = 45;

    @Min(value = 0, message = "shippingTimeDays must be >= 0")
    @Builder.Default
    int shippingTimeDays = 45;

    @Min(value = 0, message = "safetyStockDays must be >= 0")
    @Builder.Default
    int safetyStockDays = 10;

    double startingInventory;

    /** Defaults to today. */
    LocalDate startDate;

    @DecimalMin(value = "0.0", message = "inTransitQuantity must be >= 0")
    @Builder.Default
    double inTransitQuantity = 0.0;

    LocalDate inTransitArrivalDate;
}
