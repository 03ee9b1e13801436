package com.orderschedule.dto;

import com.orderschedule.simulation.ReplenishmentParameters;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ParametersResponse {
    int totalLeadTime;
    double safetyStock;
    double reorderPoint;
    double orderQuantity;

    public static ParametersResponse from(ReplenishmentParameters parameters) {
        return ParametersResponse.builder()
            .totalLeadTime(parameters.totalLeadTime())
            .safetyStock(parameters.safetyStock())
            .reorderPoint(parameters.reorderPoint())
            .orderQuantity(parameters.orderQuantity())
            .build();
    }
}
