package com.orderschedule.dto;

import com.orderschedule.model.DemandItem;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DemandItemResponse {
    String label;
    String productTitle;
    String variantTitle;
    String sku;
    double endingQuantity;
    double quantitySoldPerDay;

    public static DemandItemResponse from(DemandItem item) {
        return DemandItemResponse.builder()
            .label(item.label())
            .productTitle(item.getProductTitle())
            .variantTitle(item.getVariantTitle())
            .sku(item.getSku())
            .endingQuantity(item.getEndingQuantity())
            .quantitySoldPerDay(item.getQuantitySoldPerDay())
            .build();
    }
}
