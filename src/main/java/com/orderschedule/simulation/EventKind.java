package com.orderschedule.simulation;

import java.util.Arrays;

public enum EventKind {
    IN_TRANSIT_ARRIVAL("In-Transit Arrival"),
    ORDER_PLACED("Order Placed");

    private final String label;

    EventKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static EventKind fromLabel(String label) {
        return Arrays.stream(values())
            .filter(kind -> kind.label.equalsIgnoreCase(label) || kind.name().equalsIgnoreCase(label))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown event kind: " + label));
    }
}
