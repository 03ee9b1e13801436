package com.orderschedule.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class DemandUploadResponse {
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant uploadedAt;
    String fileName;
    int rowCount;
    int itemCount;
    List<String> warnings;
    List<DemandItemResponse> items;
}
