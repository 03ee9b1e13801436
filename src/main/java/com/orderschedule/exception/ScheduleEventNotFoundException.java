package com.orderschedule.exception;

import com.orderschedule.simulation.EventKey;

public class ScheduleEventNotFoundException extends OrderScheduleException {
    public ScheduleEventNotFoundException(EventKey key) {
        super("SCHEDULE_EVENT_NOT_FOUND",
              "No " + key.eventKind() + " event arriving " + key.arrivalDate()
                  + " in the schedule of SKU '" + key.sku() + "'.");
    }
}
