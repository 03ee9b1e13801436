package com.orderschedule.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class ScheduleResponse {
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    String sku;
    String productTitle;
    String variantTitle;
    LocalDate startDate;
    LocalDate horizonEnd;
    ParametersResponse parameters;
    int orderCount;
    int eventCount;
    /** Set when no order is needed within the horizon. */
    String message;
    List<ScheduleEventResponse> events;
}
