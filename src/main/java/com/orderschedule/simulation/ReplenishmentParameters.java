package com.orderschedule.simulation;

/**
 * Constants derived once per run. {@code reorderPoint} and {@code orderQuantity} share one
 * formula, so an order placed at the threshold roughly doubles the reorder point on arrival.
 */
public record ReplenishmentParameters(
    int totalLeadTime,
    double safetyStock,
    double reorderPoint,
    double orderQuantity
) {}
