package com.orderschedule.dto;

import com.orderschedule.simulation.EventKind;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class CompletionUpdateRequest {

    @NotNull(message = "eventKind is required")
    EventKind eventKind;

    @NotNull(message = "arrivalDate is required")
    LocalDate arrivalDate;

    boolean completed;
}
