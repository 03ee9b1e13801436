package com.orderschedule.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flat, textual form of a schedule event as written to an export file. Dates are ISO
 * {@code yyyy-MM-dd}; {@code orderDate} is empty for in-transit arrivals.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"Product", "Variant", "SKU", "Order Date", "Arrival Date", "Order Quantity", "Event", "Completed"})
public class ScheduleRecord {

    @JsonProperty("Product")
    private String product;

    @JsonProperty("Variant")
    private String variant;

    @JsonProperty("SKU")
    private String sku;

    @JsonProperty("Order Date")
    private String orderDate;

    @JsonProperty("Arrival Date")
    private String arrivalDate;

    @JsonProperty("Order Quantity")
    private double orderQuantity;

    @JsonProperty("Event")
    private String event;

    @JsonProperty("Completed")
    private boolean completed;
}
