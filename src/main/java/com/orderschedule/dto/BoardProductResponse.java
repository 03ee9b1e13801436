package com.orderschedule.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

@Value
@Builder
public class BoardProductResponse {
    String productTitle;
    String variantTitle;
    String sku;
    double currentInventory;
    double dailyDemand;
    int manufacturingLeadTime;
    int shippingTime;
    int safetyStockDays;
    double orderQuantity;
    int totalLeadTime;
    double safetyStock;
    double reorderPoint;
    double inTransitQuantity;
    LocalDate inTransitArrivalDate;
    LocalDate startDate;
    int orderCount;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant addedAt;
}
