package com.orderschedule.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class AddProductRequest {

    @NotBlank(message = "sku is required")
    String sku;

    @Min(value = 0, message = "leadTimeDays must be >= 0")
    @Builder.Default
    int leadTimeDays = 45;

    @Min(value = 0, message = "shippingTimeDays must be >= 0")
    @Builder.Default
    int shippingTimeDays = 45;

    @Min(value = 0, message = "safetyStockDays must be >= 0")
    @Builder.Default
    int safetyStockDays = 10;

    @DecimalMin(value = "0.0", message = "inTransitQuantity must be >= 0")
    @Builder.Default
    double inTransitQuantity = 0.0;

    LocalDate inTransitArrivalDate;

    LocalDate startDate;
}
