package com.orderschedule.model;

import lombok.Builder;
import lombok.Value;

/** One row of an ingested demand file. */
@Value
@Builder(toBuilder = true)
public class DemandItem {
    String productTitle;
    String variantTitle;
    String sku;
    double endingQuantity;
    double quantitySoldPerDay;

    public String label() {
        return productTitle + " - " + variantTitle + " (SKU: " + sku + ")";
    }
}
