package com.orderschedule.controller;

import com.orderschedule.dto.ParametersResponse;
import com.orderschedule.dto.ScheduleResponse;
import com.orderschedule.dto.SimulationRequest;
import com.orderschedule.service.ScheduleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/api/v1/schedules")
@RequiredArgsConstructor
public class ScheduleController {

    private final ScheduleService scheduleService;

    @PostMapping("/simulate")
    public ResponseEntity<ScheduleResponse> simulate(@Valid @RequestBody SimulationRequest request) {
        return ResponseEntity.ok(scheduleService.simulate(request));
    }

    @PostMapping("/parameters")
    public ResponseEntity<ParametersResponse> parameters(@Valid @RequestBody SimulationRequest request) {
        return ResponseEntity.ok(scheduleService.parameters(request));
    }
}
