package com.orderschedule.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/** Fields left null keep the value the product was added with. */
@Value
@Builder
@Jacksonized
public class UpdateProductRequest {

    @Min(value = 0, message = "leadTimeDays must be >= 0")
    Integer leadTimeDays;

    @Min(value = 0, message = "shippingTimeDays must be >= 0")
    Integer shippingTimeDays;

    @Min(value = 0, message = "safetyStockDays must be >= 0")
    Integer safetyStockDays;

    @DecimalMin(value = "0.0", message = "inTransitQuantity must be >= 0")
    Double inTransitQuantity;

    LocalDate inTransitArrivalDate;

    LocalDate startDate;
}
