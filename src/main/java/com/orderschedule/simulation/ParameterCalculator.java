package com.orderschedule.simulation;

import com.orderschedule.exception.InvalidParameterException;

public final class ParameterCalculator {

    private ParameterCalculator() {
    }

    public static ReplenishmentParameters computeParameters(
            double dailyDemand, int leadTimeDays, int shippingTimeDays, int safetyStockDays) {
        if (!Double.isFinite(dailyDemand) || dailyDemand < 0.0) {
            throw new InvalidParameterException("dailyDemand must be a finite value >= 0, was " + dailyDemand);
        }
        requireNonNegative("leadTimeDays", leadTimeDays);
        requireNonNegative("shippingTimeDays", shippingTimeDays);
        requireNonNegative("safetyStockDays", safetyStockDays);

        int totalLeadTime = totalLeadTime(leadTimeDays, shippingTimeDays);
        double safetyStock = dailyDemand * safetyStockDays;
        double reorderPoint = dailyDemand * totalLeadTime + safetyStock;
        double orderQuantity = dailyDemand * totalLeadTime + safetyStock;
        return new ReplenishmentParameters(totalLeadTime, safetyStock, reorderPoint, orderQuantity);
    }

    private static int totalLeadTime(int leadTimeDays, int shippingTimeDays) {
        try {
            return Math.addExact(leadTimeDays, shippingTimeDays);
        } catch (ArithmeticException e) {
            throw new InvalidParameterException("leadTimeDays + shippingTimeDays exceeds "
                + Integer.MAX_VALUE + " days (" + leadTimeDays + " + " + shippingTimeDays + ")");
        }
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new InvalidParameterException(name + " must be >= 0, was " + value);
        }
    }
}
