package com.orderschedule.model;

import com.orderschedule.simulation.ReplenishmentInputs;
import com.orderschedule.simulation.ReplenishmentParameters;
import com.orderschedule.simulation.ScheduleEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/** A product on the board together with the schedule most recently generated for it. */
@Value
@Builder(toBuilder = true)
public class BoardEntry {
    ReplenishmentInputs inputs;
    ReplenishmentParameters parameters;
    List<ScheduleEvent> schedule;
    Instant addedAt;
    Instant generatedAt;

    public String getSku() {
        return inputs.getSku();
    }
}
